package agentdesk.outbox;

import agentdesk.model.OutboxItem;

/**
 * Transport that performs the actual side effect of an outbox item, for example an
 * SMTP or HTTP email provider.
 *
 * <p>Delivery is at-least-once: a channel may see the same item again after a crash
 * between delivery and bookkeeping. Use {@link OutboxItem#id()} to deduplicate.
 */
@FunctionalInterface
public interface DeliveryChannel {

  /**
   * Delivers the item.
   *
   * @param item the item, with {@code attempts} counting earlier attempts only
   * @throws Exception if delivery failed; the item is retried with backoff or,
   *     after the last attempt, marked failed
   */
  void deliver(OutboxItem item) throws Exception;
}
