package agentdesk.spi;

/**
 * Observability hook for exporting delivery and task counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of delivery attempts, successful or not.
     */
    void incrementDeliveryAttempted();

    /**
     * Increments the count of outbox items delivered successfully.
     */
    void incrementDeliveryDelivered();

    /**
     * Increments the count of failed attempts that were rescheduled.
     */
    void incrementDeliveryRetried();

    /**
     * Increments the count of items marked permanently failed.
     */
    void incrementDeliveryFailed();

    /**
     * Records the number of items still waiting for delivery.
     *
     * @param pending number of items neither sent nor failed
     */
    void recordPendingItems(int pending);

    default void incrementTaskCompleted() {
    }

    default void incrementTaskFailed() {
    }

    /**
     * Increments the count of runs blocked because the task was not approved.
     */
    default void incrementTaskApprovalBlocked() {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementDeliveryAttempted() {
        }

        @Override
        public void incrementDeliveryDelivered() {
        }

        @Override
        public void incrementDeliveryRetried() {
        }

        @Override
        public void incrementDeliveryFailed() {
        }

        @Override
        public void recordPendingItems(int pending) {
        }
    }
}
