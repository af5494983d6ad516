package agentdesk.demo.email;

import agentdesk.AgentHandler;
import agentdesk.AgentResult;
import agentdesk.AgentTask;
import agentdesk.OutboxMessage;
import agentdesk.model.OutboxItem;
import agentdesk.outbox.OutboxAdmin;
import agentdesk.outbox.OutboxWriter;
import agentdesk.spring.boot.AgentCapability;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drafts email and queues it for delivery.
 *
 * <p>Actions:
 * <ul>
 *   <li>{@code draft}: returns {@code {"draft": {to, subject, body}}}</li>
 *   <li>{@code enqueue} / {@code send}: writes an outbox item on channel {@code email};
 *       {@code to} and {@code subject} are required</li>
 *   <li>{@code list_outbox}: returns the outbox items</li>
 * </ul>
 *
 * <p>When both {@code template} and {@code templateData} are present the body is
 * rendered from the template.
 */
@Component
@AgentCapability(name = "EmailAgent", description = "Drafts and queues email messages")
public class EmailAgent implements AgentHandler {
  public static final String CHANNEL = "email";

  private static final Logger log = LoggerFactory.getLogger(EmailAgent.class);

  private final ObjectMapper objectMapper;
  private final OutboxWriter outboxWriter;
  private final OutboxAdmin outboxAdmin;

  public EmailAgent(ObjectMapper objectMapper, OutboxWriter outboxWriter, OutboxAdmin outboxAdmin) {
    this.objectMapper = objectMapper;
    this.outboxWriter = outboxWriter;
    this.outboxAdmin = outboxAdmin;
  }

  @Override
  public AgentResult handle(AgentTask task) throws JsonProcessingException {
    JsonNode payload = parse(task.payload());
    switch (task.action()) {
      case "draft":
        return draft(payload);
      case "enqueue":
      case "send":
        return enqueue(task, payload);
      case "list_outbox":
        return listOutbox();
      default:
        throw new IllegalArgumentException("Unknown action for EmailAgent: " + task.action());
    }
  }

  private AgentResult draft(JsonNode payload) throws JsonProcessingException {
    ObjectNode draft = objectMapper.createObjectNode();
    if (payload.has("to")) {
      draft.set("to", payload.get("to"));
    }
    if (payload.hasNonNull("subject")) {
      draft.put("subject", payload.get("subject").asText());
    }
    draft.put("body", body(payload));
    ObjectNode result = objectMapper.createObjectNode();
    result.set("draft", draft);
    return AgentResult.of(objectMapper.writeValueAsString(result));
  }

  private AgentResult enqueue(AgentTask task, JsonNode payload) throws JsonProcessingException {
    List<String> to = recipients(payload.get("to"));
    if (to.isEmpty()) {
      throw new IllegalArgumentException("to is required");
    }
    if (!payload.hasNonNull("subject")) {
      throw new IllegalArgumentException("subject is required");
    }
    OutboxMessage.Builder message = OutboxMessage.builder(CHANNEL)
        .recipients(to)
        .subject(payload.get("subject").asText())
        .body(body(payload))
        .header("X-Agent-Task", task.taskId());
    if (payload.hasNonNull("html")) {
      message.header("html", payload.get("html").asText());
    }
    String id = outboxWriter.enqueue(message.build());
    log.info("Queued email {} for task {}", id, task.taskId());

    ObjectNode queued = objectMapper.createObjectNode();
    queued.put("id", id);
    queued.set("to", objectMapper.valueToTree(to));
    queued.put("subject", payload.get("subject").asText());
    ObjectNode result = objectMapper.createObjectNode();
    result.set("queued", queued);
    return AgentResult.of(objectMapper.writeValueAsString(result), "queued " + id);
  }

  private AgentResult listOutbox() throws JsonProcessingException {
    ArrayNode items = objectMapper.createArrayNode();
    for (OutboxItem item : outboxAdmin.list()) {
      ObjectNode node = items.addObject();
      node.put("id", item.id());
      node.set("to", objectMapper.valueToTree(item.recipients()));
      node.put("subject", item.subject());
      node.put("attempts", item.attempts());
      node.put("sent", item.sent());
      node.put("failed", item.failed());
      node.put("error", item.error());
    }
    ObjectNode result = objectMapper.createObjectNode();
    result.set("outbox", items);
    return AgentResult.of(objectMapper.writeValueAsString(result));
  }

  private JsonNode parse(String payload) throws JsonProcessingException {
    if (payload == null || payload.isBlank()) {
      return objectMapper.createObjectNode();
    }
    JsonNode node = objectMapper.readTree(payload);
    if (!node.isObject()) {
      throw new IllegalArgumentException("payload must be a JSON object");
    }
    return node;
  }

  private static String body(JsonNode payload) {
    JsonNode template = payload.get("template");
    JsonNode data = payload.get("templateData");
    if (template != null && template.isTextual() && data != null && data.isObject()) {
      Map<String, String> values = new LinkedHashMap<>();
      data.fields().forEachRemaining(e -> values.put(e.getKey(), e.getValue().asText()));
      return TemplateRenderer.render(template.asText(), values);
    }
    return payload.hasNonNull("body") ? payload.get("body").asText() : "";
  }

  private static List<String> recipients(JsonNode to) {
    List<String> recipients = new ArrayList<>();
    if (to == null || to.isNull()) {
      return recipients;
    }
    if (to.isArray()) {
      to.forEach(n -> recipients.add(n.asText()));
    } else {
      recipients.add(to.asText());
    }
    return recipients;
  }
}
