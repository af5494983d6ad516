package agentdesk.worker;

import agentdesk.AgentResult;
import agentdesk.AgentTask;
import agentdesk.ApprovalRequiredException;
import agentdesk.InvalidTransitionException;
import agentdesk.TaskNotFoundException;
import agentdesk.model.AuditEvent;
import agentdesk.model.AuditEventType;
import agentdesk.model.SafetyLevel;
import agentdesk.model.TaskMetadata;
import agentdesk.model.TaskStatus;
import agentdesk.registry.DefaultAgentRegistry;
import agentdesk.stub.InMemoryAuditLog;
import agentdesk.stub.InMemoryTaskStore;
import agentdesk.stub.RecordingMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TaskWorkerTest {

  private InMemoryTaskStore taskStore;
  private InMemoryAuditLog auditLog;
  private DefaultAgentRegistry registry;
  private RecordingMetrics metrics;
  private TaskWorker worker;
  private final AtomicInteger invocations = new AtomicInteger();

  @BeforeEach
  void setUp() {
    taskStore = new InMemoryTaskStore();
    auditLog = new InMemoryAuditLog();
    metrics = new RecordingMetrics();
    registry = new DefaultAgentRegistry()
        .register("EmailAgent", "Drafts email", task -> {
          invocations.incrementAndGet();
          return AgentResult.of("{\"draft\":\"Hello\"}", "draft ready");
        })
        .register("CalendarAgent", "Creates events", task -> {
          invocations.incrementAndGet();
          throw new IllegalStateException("Calendar API down");
        });
    worker = new TaskWorker(taskStore, auditLog, registry, metrics);
  }

  private AgentTask create(String agent, TaskMetadata metadata) {
    return worker.create(AgentTask.builder(agent, "draft").metadata(metadata).build(), "created in test");
  }

  // ── Successful runs ─────────────────────────────────────────────

  @Test
  void runCompletesTaskAndStoresResult() {
    AgentTask task = create("EmailAgent", null);

    AgentTask done = worker.runTask(task.taskId());

    assertEquals(TaskStatus.COMPLETED, done.status());
    assertEquals("{\"draft\":\"Hello\"}", done.result());
    assertNull(done.error());
    assertEquals(done, taskStore.getTask(task.taskId()).orElseThrow());
    assertEquals(1, metrics.tasksCompleted.get());
  }

  @Test
  void runWritesOneStartedAndOneCompletedEvent() {
    AgentTask task = create("EmailAgent", null);

    worker.runTask(task.taskId());

    assertEquals(List.of(AuditEventType.CREATED, AuditEventType.STARTED, AuditEventType.COMPLETED),
        auditLog.types(task.taskId()));
    AuditEvent completed = auditLog.trail(task.taskId()).get(2);
    assertEquals("draft ready", completed.detail());
    assertEquals("EmailAgent", completed.agent());
    assertEquals("draft", completed.action());
  }

  @Test
  void handlerSeesInProgressTask() {
    AtomicInteger seenInProgress = new AtomicInteger();
    registry.register("Probe", task -> {
      if (task.status() == TaskStatus.IN_PROGRESS) {
        seenInProgress.incrementAndGet();
      }
      return AgentResult.of("ok");
    });
    AgentTask task = create("Probe", null);

    worker.runTask(task.taskId());

    assertEquals(1, seenInProgress.get());
  }

  @Test
  void failedTaskCanBeRunAgain() {
    AtomicInteger calls = new AtomicInteger();
    registry.register("Flaky", task -> {
      if (calls.incrementAndGet() == 1) {
        throw new IllegalStateException("first call fails");
      }
      return AgentResult.of("second call works");
    });
    AgentTask task = create("Flaky", null);

    assertEquals(TaskStatus.FAILED, worker.runTask(task.taskId()).status());
    AgentTask retried = worker.runTask(task.taskId());

    assertEquals(TaskStatus.COMPLETED, retried.status());
    assertNull(retried.error());
  }

  // ── Failures ────────────────────────────────────────────────────

  @Test
  void handlerExceptionMessageIsStoredVerbatim() {
    AgentTask task = create("CalendarAgent", null);

    AgentTask failed = worker.runTask(task.taskId());

    assertEquals(TaskStatus.FAILED, failed.status());
    assertEquals("Calendar API down", failed.error());
    assertNull(failed.result());
    assertEquals(List.of(AuditEventType.CREATED, AuditEventType.STARTED, AuditEventType.FAILED),
        auditLog.types(task.taskId()));
    assertEquals("Calendar API down", auditLog.trail(task.taskId()).get(2).detail());
    assertEquals(1, metrics.tasksFailed.get());
  }

  @Test
  void handlerExceptionWithoutMessageStoresClassName() {
    registry.register("Broken", task -> {
      throw new UnsupportedOperationException();
    });
    AgentTask task = create("Broken", null);

    AgentTask failed = worker.runTask(task.taskId());

    assertEquals(UnsupportedOperationException.class.getName(), failed.error());
  }

  @Test
  void handlerErrorIsRethrownAfterTaskIsMarkedFailed() {
    registry.register("Crashing", task -> {
      throw new AssertionError("boom");
    });
    AgentTask task = create("Crashing", null);

    AssertionError error = assertThrows(AssertionError.class, () -> worker.runTask(task.taskId()));

    assertEquals("boom", error.getMessage());
    AgentTask stored = taskStore.getTask(task.taskId()).orElseThrow();
    assertEquals(TaskStatus.FAILED, stored.status());
    assertEquals("boom", stored.error());
    assertEquals(List.of(AuditEventType.CREATED, AuditEventType.STARTED, AuditEventType.FAILED),
        auditLog.types(task.taskId()));
    assertEquals(1, metrics.tasksFailed.get());
  }

  @Test
  void taskFailedByErrorCanBeRunAgain() {
    AtomicInteger calls = new AtomicInteger();
    registry.register("Flaky", task -> {
      if (calls.getAndIncrement() == 0) {
        throw new AssertionError("first call");
      }
      return AgentResult.of("ok");
    });
    AgentTask task = create("Flaky", null);
    assertThrows(AssertionError.class, () -> worker.runTask(task.taskId()));

    AgentTask done = worker.runTask(task.taskId());

    assertEquals(TaskStatus.COMPLETED, done.status());
    assertEquals("ok", done.result());
  }

  @Test
  void unknownAgentFailsWithoutInvokingAnyHandler() {
    AgentTask task = create("NoSuchAgent", null);

    AgentTask failed = worker.runTask(task.taskId());

    assertEquals(TaskStatus.FAILED, failed.status());
    assertEquals("unknown agent: NoSuchAgent", failed.error());
    assertEquals(0, invocations.get());
    assertEquals(List.of(AuditEventType.CREATED, AuditEventType.STARTED, AuditEventType.FAILED),
        auditLog.types(task.taskId()));
  }

  @Test
  void missingTaskIsReported() {
    assertThrows(TaskNotFoundException.class, () -> worker.runTask("missing"));
    assertThrows(TaskNotFoundException.class, () -> worker.approve("missing"));
    assertThrows(TaskNotFoundException.class, () -> worker.cancel("missing"));
  }

  // ── Approval gate ───────────────────────────────────────────────

  @Test
  void unapprovedTaskIsBlockedBeforeHandlerRuns() {
    AgentTask task = create("EmailAgent", TaskMetadata.approvalRequired(SafetyLevel.HIGH));

    ApprovalRequiredException e = assertThrows(ApprovalRequiredException.class,
        () -> worker.runTask(task.taskId()));

    assertEquals(task.taskId(), e.taskId());
    assertEquals(0, invocations.get());
    AgentTask stored = taskStore.getTask(task.taskId()).orElseThrow();
    assertEquals(TaskStatus.FAILED, stored.status());
    assertEquals("requires user approval", stored.error());
    assertEquals(List.of(AuditEventType.CREATED, AuditEventType.FAILED), auditLog.types(task.taskId()));
    assertEquals("requires user approval", auditLog.trail(task.taskId()).get(1).detail());
    assertEquals(1, metrics.approvalBlocked.get());
  }

  @Test
  void approvedTaskRunsAfterBeingBlocked() {
    AgentTask task = create("EmailAgent", TaskMetadata.approvalRequired(SafetyLevel.HIGH));
    assertThrows(ApprovalRequiredException.class, () -> worker.runTask(task.taskId()));

    AgentTask approved = worker.approve(task.taskId());
    AgentTask done = worker.runTask(task.taskId());

    assertTrue(approved.metadata().approved());
    assertEquals(TaskStatus.COMPLETED, done.status());
    assertEquals(1, invocations.get());
    assertEquals(List.of(AuditEventType.CREATED, AuditEventType.FAILED, AuditEventType.CREATED,
        AuditEventType.STARTED, AuditEventType.COMPLETED), auditLog.types(task.taskId()));
    assertEquals(TaskWorker.APPROVED_DETAIL, auditLog.trail(task.taskId()).get(2).detail());
  }

  @Test
  void approveIsIdempotent() {
    AgentTask task = create("EmailAgent", TaskMetadata.approvalRequired(SafetyLevel.LOW));

    worker.approve(task.taskId());
    AgentTask again = worker.approve(task.taskId());

    assertTrue(again.metadata().approved());
    assertEquals(List.of(AuditEventType.CREATED, AuditEventType.CREATED), auditLog.types(task.taskId()));
  }

  @Test
  void approveOfCompletedTaskIsRejected() {
    AgentTask task = create("EmailAgent", null);
    worker.runTask(task.taskId());

    assertThrows(InvalidTransitionException.class, () -> worker.approve(task.taskId()));
  }

  @Test
  void rejectCancelsAndRecordsReason() {
    AgentTask task = create("EmailAgent", TaskMetadata.approvalRequired(SafetyLevel.HIGH));

    AgentTask rejected = worker.reject(task.taskId(), "Wrong recipient");

    assertEquals(TaskStatus.CANCELLED, rejected.status());
    assertEquals("Wrong recipient", rejected.metadata().rejectionReason());
    assertFalse(rejected.metadata().approved());
    AuditEvent last = auditLog.trail(task.taskId()).get(1);
    assertEquals(AuditEventType.CANCELLED, last.eventType());
    assertEquals("Wrong recipient", last.detail());
  }

  @Test
  void rejectWithoutReasonUsesDefault() {
    AgentTask task = create("EmailAgent", null);

    AgentTask rejected = worker.reject(task.taskId(), " ");

    assertEquals(TaskWorker.DEFAULT_REJECTION_REASON, rejected.metadata().rejectionReason());
  }

  @Test
  void rejectIsIdempotent() {
    AgentTask task = create("EmailAgent", null);
    worker.reject(task.taskId(), "no");

    AgentTask again = worker.reject(task.taskId(), "still no");

    assertEquals("no", again.metadata().rejectionReason());
    assertEquals(2, auditLog.trail(task.taskId()).size());
  }

  // ── Cancellation and terminal states ────────────────────────────

  @Test
  void cancelOfCompletedTaskIsRejectedAndLeavesTaskUnchanged() {
    AgentTask task = create("EmailAgent", null);
    AgentTask done = worker.runTask(task.taskId());

    InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
        () -> worker.cancel(task.taskId()));

    assertEquals("Cannot cancel a completed task", e.getMessage());
    assertEquals(done, taskStore.getTask(task.taskId()).orElseThrow());
  }

  @Test
  void cancelIsIdempotent() {
    AgentTask task = create("EmailAgent", null);

    worker.cancel(task.taskId());
    AgentTask again = worker.cancel(task.taskId());

    assertEquals(TaskStatus.CANCELLED, again.status());
    assertEquals(List.of(AuditEventType.CREATED, AuditEventType.CANCELLED), auditLog.types(task.taskId()));
  }

  @Test
  void cancelledTaskCannotRun() {
    AgentTask task = create("EmailAgent", null);
    worker.cancel(task.taskId());

    assertThrows(InvalidTransitionException.class, () -> worker.runTask(task.taskId()));
    assertEquals(0, invocations.get());
  }

  @Test
  void completedTaskCannotRunAgain() {
    AgentTask task = create("EmailAgent", null);
    worker.runTask(task.taskId());

    InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
        () -> worker.runTask(task.taskId()));

    assertEquals(TaskStatus.COMPLETED, e.currentStatus());
    assertEquals(1, invocations.get());
  }

  @Test
  void cancelDuringRunDiscardsOutcome() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    registry.register("Slow", task -> {
      entered.countDown();
      release.await(5, TimeUnit.SECONDS);
      return AgentResult.of("late");
    });
    AgentTask task = create("Slow", null);
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<AgentTask> run = executor.submit(() -> worker.runTask(task.taskId()));
      assertTrue(entered.await(5, TimeUnit.SECONDS));

      worker.cancel(task.taskId());
      release.countDown();
      AgentTask outcome = run.get(5, TimeUnit.SECONDS);

      assertEquals(TaskStatus.CANCELLED, outcome.status());
      assertNull(outcome.result());
      List<AuditEvent> trail = auditLog.trail(task.taskId());
      AuditEvent last = trail.get(trail.size() - 1);
      assertEquals(AuditEventType.COMPLETED, last.eventType());
      assertEquals(TaskWorker.DISCARDED_DETAIL, last.detail());
    } finally {
      executor.shutdownNow();
    }
  }

  // ── Concurrency ─────────────────────────────────────────────────

  @Test
  void inProgressTaskCannotBeStartedAgain() throws Exception {
    CountDownLatch entered = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicInteger calls = new AtomicInteger();
    registry.register("Slow", task -> {
      calls.incrementAndGet();
      entered.countDown();
      release.await(5, TimeUnit.SECONDS);
      return AgentResult.of("done");
    });
    AgentTask task = create("Slow", null);
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      Future<AgentTask> first = executor.submit(() -> worker.runTask(task.taskId()));
      assertTrue(entered.await(5, TimeUnit.SECONDS));

      InvalidTransitionException e = assertThrows(InvalidTransitionException.class,
          () -> worker.runTask(task.taskId()));
      assertEquals("Task is already in progress", e.getMessage());

      release.countDown();
      assertEquals(TaskStatus.COMPLETED, first.get(5, TimeUnit.SECONDS).status());
      assertEquals(1, calls.get());
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void concurrentRunsInvokeHandlerOnce() throws Exception {
    AgentTask task = create("EmailAgent", null);
    int threads = 8;
    CountDownLatch start = new CountDownLatch(1);
    AtomicInteger rejected = new AtomicInteger();
    ExecutorService executor = Executors.newFixedThreadPool(threads);
    try {
      for (int i = 0; i < threads; i++) {
        executor.submit(() -> {
          start.await();
          try {
            worker.runTask(task.taskId());
          } catch (InvalidTransitionException e) {
            rejected.incrementAndGet();
          }
          return null;
        });
      }
      start.countDown();
      executor.shutdown();
      assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));
    } finally {
      executor.shutdownNow();
    }

    assertEquals(1, invocations.get());
    assertEquals(threads - 1, rejected.get());
    assertEquals(1, auditLog.types(task.taskId()).stream().filter(t -> t == AuditEventType.STARTED).count());
  }

  // ── Audit failures ──────────────────────────────────────────────

  @Test
  void auditFailureDoesNotRollBackTransitions() {
    AgentTask task = create("EmailAgent", null);
    auditLog.failing = true;

    AgentTask done = worker.runTask(task.taskId());

    assertEquals(TaskStatus.COMPLETED, done.status());
    auditLog.failing = false;
    assertEquals(List.of(AuditEventType.CREATED), auditLog.types(task.taskId()));
  }

  @Test
  void checkRunnableDoesNotChangeTask() {
    AgentTask task = create("EmailAgent", TaskMetadata.approvalRequired(SafetyLevel.HIGH));

    AgentTask checked = worker.checkRunnable(task.taskId());

    assertEquals(TaskStatus.PENDING, checked.status());
    assertEquals(0, taskStore.updateCount.get());
  }
}
