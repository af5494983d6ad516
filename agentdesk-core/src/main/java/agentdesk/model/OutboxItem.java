package agentdesk.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Read-only record representing a persisted outbox item.
 *
 * <p>An item is eligible for delivery only when it is neither {@code sent} nor
 * {@code failed} and {@code nextAttemptAt} is not in the future.
 *
 * @see agentdesk.spi.OutboxStore
 */
public record OutboxItem(
    String id,
    String channel,
    List<String> recipients,
    String subject,
    String body,
    Map<String, String> headers,
    int attempts,
    Instant nextAttemptAt,
    boolean sent,
    boolean failed,
    String error,
    Instant createdAt,
    Instant lastAttemptAt,
    Instant sentAt
) {

  public OutboxItem {
    recipients = recipients == null ? List.of() : List.copyOf(recipients);
    headers = headers == null ? Map.of() : Map.copyOf(headers);
  }

  public boolean isEligible(Instant now) {
    return !sent && !failed && !nextAttemptAt.isAfter(now);
  }
}
