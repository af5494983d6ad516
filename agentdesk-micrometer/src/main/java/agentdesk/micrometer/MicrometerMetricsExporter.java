package agentdesk.micrometer;

import agentdesk.spi.MetricsExporter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code agentdesk.delivery.attempted}: delivery attempts, successful or not</li>
 *   <li>{@code agentdesk.delivery.delivered}: outbox items delivered</li>
 *   <li>{@code agentdesk.delivery.retried}: failed attempts rescheduled with backoff</li>
 *   <li>{@code agentdesk.delivery.failed}: items marked permanently failed</li>
 *   <li>{@code agentdesk.task.completed}: task runs that completed</li>
 *   <li>{@code agentdesk.task.failed}: task runs whose handler failed</li>
 *   <li>{@code agentdesk.task.approval.blocked}: runs refused for missing approval</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code agentdesk.delivery.pending}: items neither sent nor failed, as of the last pass</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter deliveryAttempted;
  private final Counter deliveryDelivered;
  private final Counter deliveryRetried;
  private final Counter deliveryFailed;
  private final Counter taskCompleted;
  private final Counter taskFailed;
  private final Counter taskApprovalBlocked;
  private final Gauge pendingGauge;

  private final AtomicInteger pending = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "agentdesk"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "agentdesk");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "assistant.desk"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.deliveryAttempted = counter(namePrefix + ".delivery.attempted", "Outbox delivery attempts");
    this.deliveryDelivered = counter(namePrefix + ".delivery.delivered", "Outbox items delivered");
    this.deliveryRetried = counter(namePrefix + ".delivery.retried", "Failed attempts rescheduled");
    this.deliveryFailed = counter(namePrefix + ".delivery.failed", "Outbox items marked failed");
    this.taskCompleted = counter(namePrefix + ".task.completed", "Task runs completed");
    this.taskFailed = counter(namePrefix + ".task.failed", "Task runs failed");
    this.taskApprovalBlocked = counter(namePrefix + ".task.approval.blocked",
        "Task runs refused for missing approval");
    this.pendingGauge = Gauge.builder(namePrefix + ".delivery.pending", pending, AtomicInteger::get)
        .description("Outbox items waiting for delivery")
        .register(registry);
  }

  private Counter counter(String name, String description) {
    return Counter.builder(name).description(description).register(registry);
  }

  @Override
  public void incrementDeliveryAttempted() {
    if (closed) return;
    deliveryAttempted.increment();
  }

  @Override
  public void incrementDeliveryDelivered() {
    if (closed) return;
    deliveryDelivered.increment();
  }

  @Override
  public void incrementDeliveryRetried() {
    if (closed) return;
    deliveryRetried.increment();
  }

  @Override
  public void incrementDeliveryFailed() {
    if (closed) return;
    deliveryFailed.increment();
  }

  @Override
  public void recordPendingItems(int pending) {
    if (closed) return;
    this.pending.set(pending);
  }

  @Override
  public void incrementTaskCompleted() {
    if (closed) return;
    taskCompleted.increment();
  }

  @Override
  public void incrementTaskFailed() {
    if (closed) return;
    taskFailed.increment();
  }

  @Override
  public void incrementTaskApprovalBlocked() {
    if (closed) return;
    taskApprovalBlocked.increment();
  }

  /**
   * Removes all meters registered by this exporter from the registry, so a closed
   * {@link agentdesk.AgentDesk} leaves no stale gauge behind.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(deliveryAttempted, deliveryDelivered, deliveryRetried, deliveryFailed,
        taskCompleted, taskFailed, taskApprovalBlocked, pendingGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
