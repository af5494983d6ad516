package agentdesk.worker;

import agentdesk.AgentHandler;
import agentdesk.AgentResult;
import agentdesk.AgentTask;
import agentdesk.ApprovalRequiredException;
import agentdesk.InvalidTransitionException;
import agentdesk.TaskNotFoundException;
import agentdesk.TaskUpdate;
import agentdesk.model.AuditEventType;
import agentdesk.model.TaskStatus;
import agentdesk.registry.AgentRegistry;
import agentdesk.spi.AuditLog;
import agentdesk.spi.MetricsExporter;
import agentdesk.spi.TaskStore;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Drives tasks through their lifecycle: running, approval, rejection and cancellation.
 *
 * <p>Every state change is read-modify-written through the {@link TaskStore} while
 * holding a per-task lock, and is followed by an audit event. The worker keeps no task
 * state between calls. Handlers are invoked outside the lock, so a long-running handler
 * does not block approval or cancellation of other tasks.
 *
 * <h2>Run sequence</h2>
 * <ol>
 *   <li>Tasks that are in progress, completed or cancelled are rejected unchanged.</li>
 *   <li>Unapproved tasks that require approval are marked failed and
 *       {@link ApprovalRequiredException} is thrown; the handler is not looked up.</li>
 *   <li>The task moves to {@code in_progress} and a {@code started} event is written.</li>
 *   <li>An unknown agent or a handler exception marks the task failed; otherwise the
 *       handler result is stored and the task is completed.</li>
 * </ol>
 *
 * <p>Audit write failures are logged and never undo a task transition. This class is
 * thread-safe.
 */
public final class TaskWorker {
  private static final Logger logger = Logger.getLogger(TaskWorker.class.getName());

  public static final String APPROVED_DETAIL = "User approved task";
  public static final String DEFAULT_REJECTION_REASON = "User rejected task";
  public static final String CANCELLED_DETAIL = "Task cancelled";
  public static final String DISCARDED_DETAIL = "discarded: task cancelled while running";

  private final TaskStore taskStore;
  private final AuditLog auditLog;
  private final AgentRegistry agentRegistry;
  private final MetricsExporter metrics;
  private final TaskLocks locks = new TaskLocks();

  public TaskWorker(TaskStore taskStore, AuditLog auditLog, AgentRegistry agentRegistry) {
    this(taskStore, auditLog, agentRegistry, MetricsExporter.NOOP);
  }

  public TaskWorker(TaskStore taskStore, AuditLog auditLog, AgentRegistry agentRegistry,
      MetricsExporter metrics) {
    this.taskStore = Objects.requireNonNull(taskStore, "taskStore");
    this.auditLog = Objects.requireNonNull(auditLog, "auditLog");
    this.agentRegistry = Objects.requireNonNull(agentRegistry, "agentRegistry");
    this.metrics = metrics != null ? metrics : MetricsExporter.NOOP;
  }

  /**
   * Stores a new task and writes its {@code created} event.
   *
   * @param task   a pending task
   * @param detail audit detail, may be {@code null}
   * @return the stored task
   */
  public AgentTask create(AgentTask task, String detail) {
    Objects.requireNonNull(task, "task");
    if (task.status() != TaskStatus.PENDING) {
      throw new IllegalArgumentException("New tasks must be pending, got " + task.status().code());
    }
    taskStore.addTask(task);
    audit(task, AuditEventType.CREATED, detail);
    return task;
  }

  /**
   * Runs a task to completion or failure on the calling thread.
   *
   * @param taskId the task to run
   * @return the final stored task; check its status for the outcome
   * @throws TaskNotFoundException if the task does not exist
   * @throws InvalidTransitionException if the task is in progress, completed or cancelled
   * @throws ApprovalRequiredException if the task requires approval and has none
   */
  public AgentTask runTask(String taskId) {
    AgentTask running = start(taskId);
    return execute(running);
  }

  /**
   * Verifies, without changing anything, that {@link #runTask} would get past its
   * status checks. The approval gate is not evaluated here.
   *
   * @return the current task
   */
  public AgentTask checkRunnable(String taskId) {
    AgentTask task = load(taskId);
    ensureRunnable(task);
    return task;
  }

  /**
   * Marks the task approved. Approving an approved task is a no-op.
   *
   * @throws InvalidTransitionException if the task is completed or cancelled
   */
  public AgentTask approve(String taskId) {
    ReentrantLock lock = locks.lockFor(taskId);
    lock.lock();
    try {
      AgentTask task = load(taskId);
      if (task.status().isTerminal()) {
        throw new InvalidTransitionException(taskId, task.status(),
            "Cannot approve a " + task.status().code() + " task");
      }
      if (task.metadata().approved()) {
        return task;
      }
      AgentTask approved = update(taskId, TaskUpdate.metadata(task.metadata().withApproved(true)));
      audit(approved, AuditEventType.CREATED, APPROVED_DETAIL);
      return approved;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Cancels the task and records why. Rejecting a cancelled task is a no-op.
   *
   * @param reason rejection reason; {@value #DEFAULT_REJECTION_REASON} when blank
   * @throws InvalidTransitionException if the task is completed
   */
  public AgentTask reject(String taskId, String reason) {
    ReentrantLock lock = locks.lockFor(taskId);
    lock.lock();
    try {
      AgentTask task = load(taskId);
      if (task.status() == TaskStatus.CANCELLED) {
        return task;
      }
      if (task.status() == TaskStatus.COMPLETED) {
        throw new InvalidTransitionException(taskId, task.status(), "Cannot reject a completed task");
      }
      String why = reason == null || reason.isBlank() ? DEFAULT_REJECTION_REASON : reason;
      AgentTask rejected = update(taskId, TaskUpdate.builder()
          .status(TaskStatus.CANCELLED)
          .metadata(task.metadata().withApproved(false).withRejectionReason(why))
          .clearResult()
          .clearError()
          .build());
      audit(rejected, AuditEventType.CANCELLED, why);
      return rejected;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Soft-cancels the task. A handler that is already running is not interrupted; its
   * outcome is discarded when it returns. Cancelling a cancelled task is a no-op.
   *
   * @throws InvalidTransitionException if the task is completed
   */
  public AgentTask cancel(String taskId) {
    ReentrantLock lock = locks.lockFor(taskId);
    lock.lock();
    try {
      AgentTask task = load(taskId);
      if (task.status() == TaskStatus.CANCELLED) {
        return task;
      }
      if (task.status() == TaskStatus.COMPLETED) {
        throw new InvalidTransitionException(taskId, task.status(), "Cannot cancel a completed task");
      }
      AgentTask cancelled = update(taskId, TaskUpdate.status(TaskStatus.CANCELLED));
      audit(cancelled, AuditEventType.CANCELLED, CANCELLED_DETAIL);
      return cancelled;
    } finally {
      lock.unlock();
    }
  }

  private AgentTask start(String taskId) {
    ReentrantLock lock = locks.lockFor(taskId);
    lock.lock();
    try {
      AgentTask task = load(taskId);
      ensureRunnable(task);
      if (task.metadata().awaitingApproval()) {
        AgentTask blocked = update(taskId, TaskUpdate.failed(ApprovalRequiredException.MESSAGE));
        audit(blocked, AuditEventType.FAILED, ApprovalRequiredException.MESSAGE);
        metrics.incrementTaskApprovalBlocked();
        throw new ApprovalRequiredException(taskId);
      }
      AgentTask running = update(taskId, TaskUpdate.status(TaskStatus.IN_PROGRESS));
      audit(running, AuditEventType.STARTED, null);
      return running;
    } finally {
      lock.unlock();
    }
  }

  private AgentTask execute(AgentTask task) {
    AgentHandler handler = agentRegistry.handlerFor(task.agent());
    if (handler == null) {
      String message = "unknown agent: " + task.agent();
      logger.warning(message + " (task " + task.taskId() + ")");
      return finish(task, TaskUpdate.failed(message), AuditEventType.FAILED, message);
    }
    AgentResult result;
    try {
      result = handler.handle(task);
    } catch (Exception e) {
      String message = errorMessage(e);
      logger.log(Level.WARNING, "Agent " + task.agent() + " failed task " + task.taskId(), e);
      return finish(task, TaskUpdate.failed(message), AuditEventType.FAILED, message);
    } catch (Error e) {
      // record the failure so the task is not left in progress, then let the error through
      String message = errorMessage(e);
      logger.log(Level.SEVERE, "Agent " + task.agent() + " raised an error on task " + task.taskId(), e);
      try {
        finish(task, TaskUpdate.failed(message), AuditEventType.FAILED, message);
      } catch (RuntimeException recordFailure) {
        e.addSuppressed(recordFailure);
      }
      throw e;
    }
    String output = result == null ? null : result.output();
    String detail = result == null ? null : result.detail();
    return finish(task, TaskUpdate.completed(output), AuditEventType.COMPLETED, detail);
  }

  private AgentTask finish(AgentTask task, TaskUpdate outcome, AuditEventType eventType, String detail) {
    String taskId = task.taskId();
    ReentrantLock lock = locks.lockFor(taskId);
    lock.lock();
    try {
      AgentTask current = load(taskId);
      if (current.status() == TaskStatus.CANCELLED) {
        logger.info("Task " + taskId + " was cancelled while running; discarding "
            + eventType.code() + " outcome");
        audit(current, eventType, DISCARDED_DETAIL);
        return current;
      }
      AgentTask done = update(taskId, outcome);
      audit(done, eventType, detail);
      if (eventType == AuditEventType.COMPLETED) {
        metrics.incrementTaskCompleted();
      } else {
        metrics.incrementTaskFailed();
      }
      return done;
    } finally {
      lock.unlock();
    }
  }

  private static void ensureRunnable(AgentTask task) {
    switch (task.status()) {
      case IN_PROGRESS:
        throw new InvalidTransitionException(task.taskId(), task.status(), "Task is already in progress");
      case COMPLETED:
        throw new InvalidTransitionException(task.taskId(), task.status(), "Task is already completed");
      case CANCELLED:
        throw new InvalidTransitionException(task.taskId(), task.status(), "Task is cancelled");
      default:
        break;
    }
  }

  private AgentTask load(String taskId) {
    Objects.requireNonNull(taskId, "taskId");
    return taskStore.getTask(taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  private AgentTask update(String taskId, TaskUpdate update) {
    return taskStore.updateTask(taskId, update).orElseThrow(() -> new TaskNotFoundException(taskId));
  }

  private void audit(AgentTask task, AuditEventType eventType, String detail) {
    try {
      auditLog.append(task.taskId(), task.agent(), task.action(), eventType, detail);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Failed to append " + eventType.code()
          + " audit event for taskId=" + task.taskId(), e);
    }
  }

  private static String errorMessage(Throwable e) {
    String message = e.getMessage();
    return message != null ? message : e.getClass().getName();
  }
}
