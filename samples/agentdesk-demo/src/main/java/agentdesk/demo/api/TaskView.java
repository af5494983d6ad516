package agentdesk.demo.api;

import agentdesk.AgentTask;
import agentdesk.model.TaskMetadata;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;

import java.time.Instant;

/**
 * JSON shape of a task. Payload and result are embedded as JSON when they parse,
 * otherwise as strings.
 */
public record TaskView(
    String taskId,
    String supervisor,
    String agent,
    String action,
    JsonNode payload,
    TaskMetadata metadata,
    String status,
    JsonNode result,
    String error,
    Instant createdAt,
    Instant updatedAt
) {

  public static TaskView of(AgentTask task, ObjectMapper mapper) {
    return new TaskView(task.taskId(), task.supervisor(), task.agent(), task.action(),
        json(task.payload(), mapper), task.metadata(), task.status().code(),
        json(task.result(), mapper), task.error(), task.createdAt(), task.updatedAt());
  }

  private static JsonNode json(String value, ObjectMapper mapper) {
    if (value == null) {
      return null;
    }
    try {
      return mapper.readTree(value);
    } catch (JsonProcessingException e) {
      return TextNode.valueOf(value);
    }
  }
}
