package agentdesk;

import agentdesk.model.AuditEvent;
import agentdesk.model.AuditEventType;
import agentdesk.model.OutboxItem;
import agentdesk.model.SafetyLevel;
import agentdesk.model.TaskMetadata;
import agentdesk.model.TaskStatus;
import agentdesk.registry.AgentDescriptor;
import agentdesk.registry.DefaultAgentRegistry;
import agentdesk.stub.InMemoryAuditLog;
import agentdesk.stub.InMemoryOutboxStore;
import agentdesk.stub.InMemoryTaskStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentDeskTest {

  private InMemoryTaskStore taskStore;
  private InMemoryAuditLog auditLog;
  private InMemoryOutboxStore outboxStore;
  private DefaultAgentRegistry registry;
  private final List<OutboxItem> sentEmails = new CopyOnWriteArrayList<>();
  private AgentDesk desk;

  @BeforeEach
  void setUp() {
    taskStore = new InMemoryTaskStore();
    auditLog = new InMemoryAuditLog();
    outboxStore = new InMemoryOutboxStore();
    registry = new DefaultAgentRegistry();
    desk = AgentDesk.builder()
        .taskStore(taskStore)
        .auditLog(auditLog)
        .agentRegistry(registry)
        .outboxStore(outboxStore)
        .deliveryChannel("email", sentEmails::add)
        .startDelivery(false)
        .build();
    registry
        .register("EmailAgent", "Drafts and sends email", task -> {
          if ("send".equals(task.action())) {
            String id = desk.outboxWriter().enqueue(OutboxMessage.builder("email")
                .recipient("jane@example.com")
                .subject("Re: " + task.payload())
                .body("Hello")
                .build());
            return AgentResult.of("{\"outboxId\":\"" + id + "\"}", "queued " + id);
          }
          return AgentResult.of("{\"draft\":\"Hello Jane\"}");
        })
        .register("TestAgent", "Echoes its payload", task -> AgentResult.of(task.payload()));
  }

  @AfterEach
  void tearDown() {
    desk.close();
  }

  @Test
  void draftTaskCompletesWithOneStartedAndOneCompletedEvent() {
    AgentTask task = desk.create(new TaskRequest("MillaAgent", "EmailAgent", "draft",
        "{\"to\":\"jane@example.com\"}", null));

    AgentTask done = desk.run(task.taskId());

    assertEquals(TaskStatus.COMPLETED, done.status());
    assertTrue(done.result().contains("draft"));
    List<AuditEvent> trail = desk.auditTrail(task.taskId());
    assertEquals(1, trail.stream().filter(e -> e.eventType() == AuditEventType.STARTED).count());
    assertEquals(1, trail.stream().filter(e -> e.eventType() == AuditEventType.COMPLETED).count());
    assertEquals("Task created by MillaAgent", trail.get(0).detail());
  }

  @Test
  void approvalRequiredTaskRunsOnlyAfterApproval() {
    AgentTask task = desk.create(new TaskRequest(null, "TestAgent", "echo", "payload",
        TaskMetadata.approvalRequired(SafetyLevel.HIGH)));

    assertThrows(ApprovalRequiredException.class, () -> desk.run(task.taskId()));
    assertEquals(TaskStatus.FAILED, desk.get(task.taskId()).status());
    assertEquals("requires user approval", desk.get(task.taskId()).error());

    desk.approve(task.taskId());
    AgentTask done = desk.run(task.taskId());

    assertEquals(TaskStatus.COMPLETED, done.status());
    assertEquals("payload", done.result());
  }

  @Test
  void cancellingCompletedTaskIsRejected() {
    AgentTask task = desk.create(TaskRequest.of("TestAgent", "echo", "x"));
    desk.run(task.taskId());

    assertThrows(InvalidTransitionException.class, () -> desk.cancel(task.taskId()));
    assertEquals(TaskStatus.COMPLETED, desk.get(task.taskId()).status());
  }

  @Test
  void createRequiresAgentAndAction() {
    assertThrows(IllegalArgumentException.class, () -> desk.create(TaskRequest.of(" ", "draft", null)));
    assertThrows(IllegalArgumentException.class, () -> desk.create(TaskRequest.of("EmailAgent", null, null)));
    assertTrue(desk.list().isEmpty());
  }

  @Test
  void listReturnsTasksInCreationOrder() {
    AgentTask first = desk.create(TaskRequest.of("TestAgent", "a", null));
    AgentTask second = desk.create(TaskRequest.of("TestAgent", "b", null));

    assertEquals(List.of(first.taskId(), second.taskId()),
        desk.list().stream().map(AgentTask::taskId).toList());
  }

  @Test
  void getOfUnknownTaskThrows() {
    assertThrows(TaskNotFoundException.class, () -> desk.get("nope"));
    assertTrue(desk.auditTrail("nope").isEmpty());
  }

  @Test
  void runAsyncCompletesInBackground() throws Exception {
    AgentTask task = desk.create(TaskRequest.of("TestAgent", "echo", "async"));

    AgentTask done = desk.runAsync(task.taskId()).get(5, TimeUnit.SECONDS);

    assertEquals(TaskStatus.COMPLETED, done.status());
  }

  @Test
  void runAsyncRejectsCompletedTaskImmediately() {
    AgentTask task = desk.create(TaskRequest.of("TestAgent", "echo", "x"));
    desk.run(task.taskId());

    assertThrows(InvalidTransitionException.class, () -> desk.runAsync(task.taskId()));
  }

  @Test
  void runAsyncSurfacesApprovalRequirement() {
    AgentTask task = desk.create(new TaskRequest(null, "TestAgent", "echo", null,
        TaskMetadata.approvalRequired(SafetyLevel.HIGH)));

    CompletableFuture<AgentTask> future = desk.runAsync(task.taskId());

    ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
    assertInstanceOf(ApprovalRequiredException.class, e.getCause());
  }

  @Test
  void handlerCanEnqueueEmailForDelivery() {
    AgentTask task = desk.create(TaskRequest.of("EmailAgent", "send", "Lunch"));

    desk.run(task.taskId());
    desk.deliveryWorker().deliverOnce();

    assertEquals(1, sentEmails.size());
    assertEquals("Re: Lunch", sentEmails.get(0).subject());
    OutboxItem item = desk.outboxAdmin().list().get(0);
    assertTrue(item.sent());
    assertEquals(1, desk.outboxAdmin().stats().delivered());
  }

  @Test
  void agentsListsRegistrations() {
    assertEquals(List.of(
        new AgentDescriptor("EmailAgent", "Drafts and sends email"),
        new AgentDescriptor("TestAgent", "Echoes its payload")), desk.agents());
  }

  @Test
  void recentAuditSpansTasks() {
    AgentTask a = desk.create(TaskRequest.of("TestAgent", "a", null));
    AgentTask b = desk.create(TaskRequest.of("TestAgent", "b", null));

    List<AuditEvent> recent = desk.recentAudit(2);

    assertEquals(List.of(a.taskId(), b.taskId()), recent.stream().map(AuditEvent::taskId).toList());
  }

  @Test
  void outboxAccessorsRequireOutboxStore() {
    try (AgentDesk bare = AgentDesk.builder()
        .taskStore(taskStore)
        .auditLog(auditLog)
        .agentRegistry(registry)
        .build()) {
      assertFalse(bare.hasOutbox());
      assertThrows(IllegalStateException.class, bare::outboxWriter);
      assertThrows(IllegalStateException.class, bare::outboxAdmin);
    }
  }

  @Test
  void builderRequiresStores() {
    assertThrows(NullPointerException.class, () -> AgentDesk.builder()
        .auditLog(auditLog)
        .agentRegistry(registry)
        .build());
  }
}
