package agentdesk.outbox;

/**
 * Snapshot of the running delivery counters of a {@link DeliveryWorker}.
 *
 * @param attempted every delivery attempt, successful or not
 * @param delivered items marked sent
 * @param retried   failed attempts that were rescheduled
 * @param failed    items marked permanently failed
 */
public record DeliveryStats(long attempted, long delivered, long retried, long failed) {}
