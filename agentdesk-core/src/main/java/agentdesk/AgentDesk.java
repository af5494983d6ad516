package agentdesk;

import agentdesk.model.AuditEvent;
import agentdesk.outbox.DeliveryChannel;
import agentdesk.outbox.DeliveryWorker;
import agentdesk.outbox.OutboxAdmin;
import agentdesk.outbox.OutboxWriter;
import agentdesk.outbox.RetryPolicy;
import agentdesk.registry.AgentDescriptor;
import agentdesk.registry.AgentRegistry;
import agentdesk.spi.AuditLog;
import agentdesk.spi.MetricsExporter;
import agentdesk.spi.OutboxStore;
import agentdesk.spi.TaskStore;
import agentdesk.util.DaemonThreadFactory;
import agentdesk.worker.TaskWorker;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Front door for supervisors: creates, runs, approves, rejects and cancels tasks, reads
 * the audit trail, and exposes the outbox when one is configured.
 *
 * <p>Wires a {@link TaskWorker} and, optionally, an {@link OutboxWriter},
 * {@link DeliveryWorker} and {@link OutboxAdmin} into a single {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (AgentDesk desk = AgentDesk.builder()
 *     .taskStore(taskStore)
 *     .auditLog(auditLog)
 *     .agentRegistry(registry)
 *     .outboxStore(outboxStore)
 *     .deliveryChannel("email", smtpChannel)
 *     .build()) {
 *   AgentTask task = desk.create(TaskRequest.of("EmailAgent", "draft", "{\"to\":\"jane@example.com\"}"));
 *   AgentTask done = desk.run(task.taskId());
 * }
 * }</pre>
 *
 * @see TaskWorker
 * @see DeliveryWorker
 */
public final class AgentDesk implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(AgentDesk.class.getName());

  private final TaskStore taskStore;
  private final AuditLog auditLog;
  private final AgentRegistry agentRegistry;
  private final TaskWorker worker;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final OutboxWriter outboxWriter;
  private final DeliveryWorker deliveryWorker;
  private final OutboxAdmin outboxAdmin;
  private final MetricsExporter metrics;

  private AgentDesk(Builder builder) {
    this.taskStore = Objects.requireNonNull(builder.taskStore, "taskStore");
    this.auditLog = Objects.requireNonNull(builder.auditLog, "auditLog");
    this.agentRegistry = Objects.requireNonNull(builder.agentRegistry, "agentRegistry");
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.worker = new TaskWorker(taskStore, auditLog, agentRegistry, metrics);

    if (builder.asyncThreads <= 0) {
      throw new IllegalArgumentException("asyncThreads must be > 0");
    }
    if (builder.executor != null) {
      this.executor = builder.executor;
      this.ownsExecutor = false;
    } else {
      this.executor = Executors.newFixedThreadPool(builder.asyncThreads,
          new DaemonThreadFactory("agentdesk-task-"));
      this.ownsExecutor = true;
    }

    if (builder.outboxStore != null) {
      this.outboxWriter = new OutboxWriter(builder.outboxStore);
      DeliveryWorker.Builder delivery = DeliveryWorker.builder()
          .outboxStore(builder.outboxStore)
          .channels(builder.channels)
          .retryPolicy(builder.retryPolicy)
          .maxAttempts(builder.maxAttempts)
          .batchSize(builder.batchSize)
          .intervalMs(builder.deliveryIntervalMs)
          .drainTimeoutMs(builder.drainTimeoutMs)
          .metrics(metrics);
      this.deliveryWorker = delivery.build();
      this.outboxAdmin = new OutboxAdmin(builder.outboxStore, deliveryWorker);
      if (builder.startDelivery) {
        deliveryWorker.start();
      }
    } else {
      this.outboxWriter = null;
      this.deliveryWorker = null;
      this.outboxAdmin = null;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates a pending task and writes its {@code created} audit event.
   *
   * @throws IllegalArgumentException if {@code agent} or {@code action} is blank
   */
  public AgentTask create(TaskRequest request) {
    Objects.requireNonNull(request, "request");
    if (request.agent() == null || request.agent().isBlank()) {
      throw new IllegalArgumentException("agent is required");
    }
    if (request.action() == null || request.action().isBlank()) {
      throw new IllegalArgumentException("action is required");
    }
    AgentTask task = AgentTask.builder(request.agent(), request.action())
        .supervisor(request.supervisor())
        .payload(request.payload())
        .metadata(request.metadata())
        .build();
    String detail = request.supervisor() == null
        ? "Task created" : "Task created by " + request.supervisor();
    return worker.create(task, detail);
  }

  /**
   * @throws TaskNotFoundException if no such task exists
   */
  public AgentTask get(String taskId) {
    return taskStore.getTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  public List<AgentTask> list() {
    return taskStore.listTasks();
  }

  /**
   * Runs the task on the calling thread.
   *
   * @see TaskWorker#runTask
   */
  public AgentTask run(String taskId) {
    return worker.runTask(taskId);
  }

  /**
   * Runs the task in the background.
   *
   * <p>Missing, running, completed and cancelled tasks are rejected before anything is
   * scheduled. The returned future completes exceptionally with
   * {@link ApprovalRequiredException} (wrapped in a {@link CompletionException}) when
   * the task is not approved.
   *
   * @throws TaskNotFoundException if no such task exists
   * @throws InvalidTransitionException if the task cannot be run in its current status
   */
  public CompletableFuture<AgentTask> runAsync(String taskId) {
    worker.checkRunnable(taskId);
    return CompletableFuture.supplyAsync(() -> worker.runTask(taskId), executor)
        .whenComplete((task, error) -> {
          if (error == null) {
            return;
          }
          Throwable cause = error instanceof CompletionException && error.getCause() != null
              ? error.getCause() : error;
          if (cause instanceof AgentDeskException) {
            logger.info("Background run of task " + taskId + " rejected: " + cause.getMessage());
          } else {
            logger.log(Level.SEVERE, "Background run of task " + taskId + " failed", cause);
          }
        });
  }

  public AgentTask approve(String taskId) {
    return worker.approve(taskId);
  }

  public AgentTask reject(String taskId, String reason) {
    return worker.reject(taskId, reason);
  }

  public AgentTask cancel(String taskId) {
    return worker.cancel(taskId);
  }

  /**
   * Returns the audit trail of a task, oldest first. Unknown ids yield an empty list.
   */
  public List<AuditEvent> auditTrail(String taskId) {
    return auditLog.trail(taskId);
  }

  public List<AuditEvent> recentAudit(int limit) {
    return auditLog.recent(limit);
  }

  public List<AgentDescriptor> agents() {
    return agentRegistry.listAgents();
  }

  public TaskWorker worker() {
    return worker;
  }

  /**
   * @throws IllegalStateException if no outbox store was configured
   */
  public OutboxWriter outboxWriter() {
    return requireOutbox(outboxWriter);
  }

  /**
   * @throws IllegalStateException if no outbox store was configured
   */
  public DeliveryWorker deliveryWorker() {
    return requireOutbox(deliveryWorker);
  }

  /**
   * @throws IllegalStateException if no outbox store was configured
   */
  public OutboxAdmin outboxAdmin() {
    return requireOutbox(outboxAdmin);
  }

  public boolean hasOutbox() {
    return outboxWriter != null;
  }

  private static <T> T requireOutbox(T component) {
    if (component == null) {
      throw new IllegalStateException("No outbox store configured");
    }
    return component;
  }

  /**
   * Stops the delivery loop, then the background task executor if it was created here.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    if (deliveryWorker != null) {
      try {
        deliveryWorker.close();
      } catch (RuntimeException e) {
        first = e;
      }
    }
    if (ownsExecutor) {
      executor.shutdown();
      try {
        if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
          logger.warning("Background task runs still active after 5s; forcing shutdown");
          executor.shutdownNow();
        }
      } catch (InterruptedException e) {
        executor.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception e) {
        RuntimeException re = (e instanceof RuntimeException r) ? r : new RuntimeException(e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link AgentDesk}. */
  public static final class Builder {
    private TaskStore taskStore;
    private AuditLog auditLog;
    private AgentRegistry agentRegistry;
    private MetricsExporter metrics;
    private ExecutorService executor;
    private int asyncThreads = 4;
    private OutboxStore outboxStore;
    private final Map<String, DeliveryChannel> channels = new LinkedHashMap<>();
    private RetryPolicy retryPolicy;
    private int maxAttempts = 3;
    private int batchSize = 50;
    private long deliveryIntervalMs = 60_000L;
    private long drainTimeoutMs = 5_000L;
    private boolean startDelivery = true;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder taskStore(TaskStore taskStore) {
      this.taskStore = taskStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder auditLog(AuditLog auditLog) {
      this.auditLog = auditLog;
      return this;
    }

    /** <b>Required.</b> */
    public Builder agentRegistry(AgentRegistry agentRegistry) {
      this.agentRegistry = agentRegistry;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Executor for {@link AgentDesk#runAsync}. Optional; when absent a daemon pool of
     * {@link #asyncThreads} threads is created and shut down on close.
     */
    public Builder executor(ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    public Builder asyncThreads(int asyncThreads) {
      this.asyncThreads = asyncThreads;
      return this;
    }

    /**
     * Enables the outbox. Without an outbox store the outbox accessors throw.
     */
    public Builder outboxStore(OutboxStore outboxStore) {
      this.outboxStore = outboxStore;
      return this;
    }

    public Builder deliveryChannel(String name, DeliveryChannel channel) {
      this.channels.put(Objects.requireNonNull(name, "name"), Objects.requireNonNull(channel, "channel"));
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder deliveryIntervalMs(long deliveryIntervalMs) {
      this.deliveryIntervalMs = deliveryIntervalMs;
      return this;
    }

    /** How long {@link AgentDesk#close()} waits for an in-flight delivery pass. */
    public Builder drainTimeoutMs(long drainTimeoutMs) {
      this.drainTimeoutMs = drainTimeoutMs;
      return this;
    }

    /**
     * Whether {@link #build()} starts the scheduled delivery loop. Defaults to
     * {@code true}; set to {@code false} to drive passes manually.
     */
    public Builder startDelivery(boolean startDelivery) {
      this.startDelivery = startDelivery;
      return this;
    }

    /**
     * @throws NullPointerException if {@code taskStore}, {@code auditLog} or
     *     {@code agentRegistry} is null
     */
    public AgentDesk build() {
      return new AgentDesk(this);
    }
  }
}
