package agentdesk.model;

import java.util.Locale;

public enum AuditEventType {
  CREATED,
  STARTED,
  COMPLETED,
  FAILED,
  CANCELLED;

  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static AuditEventType fromCode(String code) {
    return valueOf(code.toUpperCase(Locale.ROOT));
  }
}
