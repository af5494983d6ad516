package agentdesk.outbox;

import agentdesk.model.OutboxItem;
import agentdesk.spi.MetricsExporter;
import agentdesk.spi.OutboxStore;
import agentdesk.util.DaemonThreadFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Delivers eligible outbox items through their {@link DeliveryChannel} with retry and backoff.
 *
 * <p>{@link #deliverOnce()} runs a single pass over the items whose {@code nextAttemptAt}
 * has arrived. Each attempt is counted on the item; a failure reschedules the item using
 * the {@link RetryPolicy} until {@code maxAttempts} attempts have been made, after which
 * the item is marked failed and never picked up again. Items whose channel is not
 * registered are marked failed immediately.
 *
 * <p>Passes are serialized: a pass started while another is running waits for it. Items
 * are additionally guarded by an {@link InFlightTracker}. {@link #start()} runs passes on
 * a fixed delay from a daemon thread; passes may also be invoked directly.
 *
 * <p>Create instances via {@link #builder()}. This class is thread-safe.
 *
 * @see DeliveryWorker.Builder
 * @see OutboxAdmin
 */
public final class DeliveryWorker implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(DeliveryWorker.class.getName());

  private final OutboxStore outboxStore;
  private final Map<String, DeliveryChannel> channels;
  private final RetryPolicy retryPolicy;
  private final InFlightTracker inFlightTracker;
  private final MetricsExporter metrics;
  private final int maxAttempts;
  private final int batchSize;
  private final long intervalMs;
  private final long drainTimeoutMs;

  private final ReentrantLock passLock = new ReentrantLock();
  private final AtomicLong attempted = new AtomicLong();
  private final AtomicLong delivered = new AtomicLong();
  private final AtomicLong retried = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> passTask;
  private volatile boolean closed;

  private DeliveryWorker(Builder builder) {
    this.outboxStore = Objects.requireNonNull(builder.outboxStore, "outboxStore");
    this.channels = Map.copyOf(builder.channels);
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy : new ExponentialBackoffRetryPolicy();
    this.inFlightTracker = builder.inFlightTracker != null
        ? builder.inFlightTracker : new DefaultInFlightTracker();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (builder.maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.intervalMs <= 0L) {
      throw new IllegalArgumentException("intervalMs must be > 0");
    }
    this.maxAttempts = builder.maxAttempts;
    this.batchSize = builder.batchSize;
    this.intervalMs = builder.intervalMs;
    this.drainTimeoutMs = builder.drainTimeoutMs;
    if (channels.isEmpty()) {
      logger.warning("No delivery channels registered; every outbox item will be marked failed");
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the scheduled delivery loop with an immediate first pass. Subsequent calls
   * are no-ops if already started.
   *
   * @throws IllegalStateException if the worker has been closed
   */
  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("DeliveryWorker has been closed");
    }
    if (passTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("agentdesk-delivery-"));
    passTask = scheduler.scheduleWithFixedDelay(this::scheduledPass, 0L, intervalMs, TimeUnit.MILLISECONDS);
    logger.info("Outbox delivery started, interval " + intervalMs + " ms");
  }

  public boolean isRunning() {
    return passTask != null && !closed;
  }

  private void scheduledPass() {
    if (closed) {
      return;
    }
    try {
      DeliveryReport report = deliverOnce();
      if (report.processed() > 0) {
        logger.fine("Delivery pass: " + report);
      }
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Delivery pass failed", t);
    }
  }

  /**
   * Runs one delivery pass over the items that are due now.
   *
   * @return counts of what happened in this pass
   * @throws RuntimeException if the eligible items could not be loaded
   */
  public DeliveryReport deliverOnce() {
    passLock.lock();
    try {
      List<OutboxItem> items = outboxStore.pollEligible(Instant.now(), batchSize);
      int sent = 0;
      int rescheduled = 0;
      int dead = 0;
      int skipped = 0;
      for (OutboxItem item : items) {
        switch (process(item)) {
          case SENT:
            sent++;
            break;
          case RETRIED:
            rescheduled++;
            break;
          case FAILED:
            dead++;
            break;
          default:
            skipped++;
            break;
        }
      }
      metrics.recordPendingItems(outboxStore.countPending());
      return items.isEmpty() ? DeliveryReport.EMPTY : new DeliveryReport(sent, rescheduled, dead, skipped);
    } finally {
      passLock.unlock();
    }
  }

  /**
   * Returns the counters accumulated since this worker was built.
   */
  public DeliveryStats stats() {
    return new DeliveryStats(attempted.get(), delivered.get(), retried.get(), failed.get());
  }

  private Outcome process(OutboxItem item) {
    String id = item.id();
    if (!inFlightTracker.tryAcquire(id)) {
      return Outcome.SKIPPED;
    }
    try {
      return deliver(item);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to record delivery outcome for outbox item " + id, e);
      return Outcome.SKIPPED;
    } finally {
      inFlightTracker.release(id);
    }
  }

  private Outcome deliver(OutboxItem item) {
    attempted.incrementAndGet();
    metrics.incrementDeliveryAttempted();

    DeliveryChannel channel = channels.get(item.channel());
    if (channel == null) {
      String error = "no delivery channel: " + item.channel();
      logger.severe("Outbox item " + item.id() + " marked failed: " + error);
      return markFailed(item, error);
    }
    try {
      channel.deliver(item);
    } catch (Exception e) {
      return handleFailure(item, e);
    }
    if (outboxStore.markSent(item.id(), Instant.now()) == 0) {
      logger.warning("Outbox item " + item.id() + " changed during delivery; sent flag not recorded");
      return Outcome.SKIPPED;
    }
    delivered.incrementAndGet();
    metrics.incrementDeliveryDelivered();
    return Outcome.SENT;
  }

  private Outcome handleFailure(OutboxItem item, Exception failure) {
    String error = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getName();
    int attempts = item.attempts() + 1;
    if (attempts >= maxAttempts) {
      logger.log(Level.SEVERE, "Outbox item " + item.id() + " failed after " + attempts + " attempts", failure);
      return markFailed(item, error);
    }
    Instant now = Instant.now();
    Instant nextAt = now.plusMillis(retryPolicy.computeDelayMs(attempts));
    if (outboxStore.markRetry(item.id(), now, nextAt, error) == 0) {
      return Outcome.SKIPPED;
    }
    logger.log(Level.WARNING, "Delivery of outbox item " + item.id() + " failed (attempt "
        + attempts + "), next attempt at " + nextAt, failure);
    retried.incrementAndGet();
    metrics.incrementDeliveryRetried();
    return Outcome.RETRIED;
  }

  private Outcome markFailed(OutboxItem item, String error) {
    if (outboxStore.markFailed(item.id(), Instant.now(), error) == 0) {
      return Outcome.SKIPPED;
    }
    failed.incrementAndGet();
    metrics.incrementDeliveryFailed();
    return Outcome.FAILED;
  }

  /**
   * Stops the delivery loop, waiting up to the drain timeout for a running pass.
   */
  @Override
  public synchronized void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (scheduler == null) {
      return;
    }
    if (passTask != null) {
      passTask.cancel(false);
    }
    scheduler.shutdown();
    try {
      if (!scheduler.awaitTermination(drainTimeoutMs, TimeUnit.MILLISECONDS)) {
        logger.warning("Delivery pass did not finish within " + drainTimeoutMs + " ms; forcing shutdown");
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      scheduler.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  private enum Outcome {
    SENT,
    RETRIED,
    FAILED,
    SKIPPED
  }

  /** Builder for {@link DeliveryWorker}. */
  public static final class Builder {
    private OutboxStore outboxStore;
    private final Map<String, DeliveryChannel> channels = new LinkedHashMap<>();
    private RetryPolicy retryPolicy;
    private InFlightTracker inFlightTracker;
    private MetricsExporter metrics;
    private int maxAttempts = 3;
    private int batchSize = 50;
    private long intervalMs = 60_000L;
    private long drainTimeoutMs = 5000L;

    private Builder() {}

    /**
     * Sets the store that holds the outbox items.
     *
     * <p><b>Required.</b>
     */
    public Builder outboxStore(OutboxStore outboxStore) {
      this.outboxStore = outboxStore;
      return this;
    }

    /**
     * Registers the transport for items whose {@code channel} equals {@code name}.
     * A later registration for the same name replaces the earlier one.
     */
    public Builder channel(String name, DeliveryChannel channel) {
      this.channels.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(channel, "channel"));
      return this;
    }

    public Builder channels(Map<String, ? extends DeliveryChannel> channels) {
      channels.forEach(this::channel);
      return this;
    }

    /**
     * Optional. Defaults to {@link ExponentialBackoffRetryPolicy} with one minute base
     * delay capped at one day.
     */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder inFlightTracker(InFlightTracker inFlightTracker) {
      this.inFlightTracker = inFlightTracker;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Sets the number of attempts after which a failing item is marked failed.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 1.
     */
    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    /** Maximum items per pass. Defaults to {@code 50}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Delay between scheduled passes. Defaults to {@code 60000} ms. */
    public Builder intervalMs(long intervalMs) {
      this.intervalMs = intervalMs;
      return this;
    }

    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * @throws NullPointerException if {@code outboxStore} is null
     * @throws IllegalArgumentException if {@code maxAttempts < 1}, {@code batchSize <= 0}
     *     or {@code intervalMs <= 0}
     */
    public DeliveryWorker build() {
      return new DeliveryWorker(this);
    }
  }
}
