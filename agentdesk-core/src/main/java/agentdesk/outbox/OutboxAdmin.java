package agentdesk.outbox;

import agentdesk.model.OutboxItem;
import agentdesk.spi.OutboxStore;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Operator facade for inspecting and repairing the outbox.
 *
 * @see OutboxStore#reset
 * @see OutboxStore#delete
 */
public final class OutboxAdmin {
  private static final Logger logger = Logger.getLogger(OutboxAdmin.class.getName());

  private final OutboxStore outboxStore;
  private final DeliveryWorker deliveryWorker;

  public OutboxAdmin(OutboxStore outboxStore, DeliveryWorker deliveryWorker) {
    this.outboxStore = Objects.requireNonNull(outboxStore, "outboxStore");
    this.deliveryWorker = Objects.requireNonNull(deliveryWorker, "deliveryWorker");
  }

  /**
   * @return every item, oldest first
   */
  public List<OutboxItem> list() {
    return outboxStore.listAll();
  }

  public Optional<OutboxItem> find(String id) {
    return outboxStore.find(id);
  }

  /**
   * Makes an item deliverable again with a fresh attempt budget, whatever its state.
   *
   * @param id the item id
   * @return {@code true} if the item exists
   */
  public boolean resend(String id) {
    boolean reset = outboxStore.reset(id, Instant.now()) > 0;
    if (reset) {
      logger.info("Outbox item " + id + " queued for resend");
    }
    return reset;
  }

  /**
   * Removes an item permanently.
   *
   * @return {@code true} if the item existed
   */
  public boolean delete(String id) {
    boolean deleted = outboxStore.delete(id) > 0;
    if (deleted) {
      logger.info("Outbox item " + id + " deleted");
    }
    return deleted;
  }

  /** Runs a delivery pass now, for example right after {@link #resend}. */
  public DeliveryReport deliverNow() {
    return deliveryWorker.deliverOnce();
  }

  public DeliveryStats stats() {
    return deliveryWorker.stats();
  }

  public int pendingCount() {
    return outboxStore.countPending();
  }
}
