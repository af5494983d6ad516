package agentdesk.outbox;

import agentdesk.OutboxMessage;
import agentdesk.model.OutboxItem;
import agentdesk.spi.OutboxStore;

import java.time.Instant;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Entry point for handlers that need an asynchronous side effect delivered.
 *
 * <p>Enqueued items are picked up by the next {@link DeliveryWorker} pass.
 */
public final class OutboxWriter {
  private static final Logger logger = Logger.getLogger(OutboxWriter.class.getName());

  private final OutboxStore outboxStore;

  public OutboxWriter(OutboxStore outboxStore) {
    this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
  }

  /**
   * Persists the message as a new outbox item due immediately.
   *
   * @return the item id
   */
  public String enqueue(OutboxMessage message) {
    Objects.requireNonNull(message, "message");
    OutboxItem item = outboxStore.insert(message, Instant.now());
    logger.fine("Enqueued outbox item " + item.id() + " for channel " + item.channel());
    return item.id();
  }
}
