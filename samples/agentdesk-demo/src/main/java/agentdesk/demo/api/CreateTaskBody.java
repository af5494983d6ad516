package agentdesk.demo.api;

import agentdesk.model.SafetyLevel;
import agentdesk.model.TaskMetadata;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/** Request body of {@code POST /api/agent/tasks}. */
public record CreateTaskBody(
    String supervisor,
    String agent,
    String action,
    JsonNode payload,
    Metadata metadata
) {

  public record Metadata(String safetyLevel, boolean requireUserApproval) {

    TaskMetadata toTaskMetadata() {
      SafetyLevel level = safetyLevel == null || safetyLevel.isBlank()
          ? null : SafetyLevel.valueOf(safetyLevel.trim().toUpperCase(Locale.ROOT));
      return new TaskMetadata(level, requireUserApproval, false, null);
    }
  }
}
