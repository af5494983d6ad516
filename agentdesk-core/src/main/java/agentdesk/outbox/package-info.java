/**
 * Durable outbox for asynchronous side effects.
 *
 * <p>{@link agentdesk.outbox.OutboxWriter} persists items, {@link agentdesk.outbox.DeliveryWorker}
 * delivers them at least once through registered {@link agentdesk.outbox.DeliveryChannel channels}
 * with exponential backoff, and {@link agentdesk.outbox.OutboxAdmin} lists, resends and deletes them.
 *
 * @see agentdesk.outbox.RetryPolicy
 */
package agentdesk.outbox;
