package agentdesk.jdbc;

import agentdesk.AgentDesk;
import agentdesk.AgentResult;
import agentdesk.AgentTask;
import agentdesk.ApprovalRequiredException;
import agentdesk.InvalidTransitionException;
import agentdesk.OutboxMessage;
import agentdesk.TaskRequest;
import agentdesk.jdbc.store.JdbcAuditLog;
import agentdesk.jdbc.store.JdbcOutboxStore;
import agentdesk.jdbc.store.JdbcTaskStore;
import agentdesk.model.AuditEvent;
import agentdesk.model.AuditEventType;
import agentdesk.model.OutboxItem;
import agentdesk.model.SafetyLevel;
import agentdesk.model.TaskMetadata;
import agentdesk.model.TaskStatus;
import agentdesk.outbox.DeliveryReport;
import agentdesk.registry.DefaultAgentRegistry;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HikariCPIntegrationTest {
  private HikariDataSource hikariDs;
  private DefaultAgentRegistry registry;
  private final List<OutboxItem> delivered = new CopyOnWriteArrayList<>();
  private final AtomicInteger channelFailures = new AtomicInteger();
  private AgentDesk desk;

  @BeforeEach
  void setup() {
    HikariConfig config = new HikariConfig();
    config.setJdbcUrl("jdbc:h2:mem:hikari_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
    config.setMaximumPoolSize(5);
    config.setMinimumIdle(1);
    config.setPoolName("agentdesk-test-pool");
    hikariDs = new HikariDataSource(config);
    SchemaInitializer.create(hikariDs, TableNames.DEFAULTS);

    DataSourceConnectionProvider provider = new DataSourceConnectionProvider(hikariDs);
    registry = new DefaultAgentRegistry();
    desk = AgentDesk.builder()
        .taskStore(new JdbcTaskStore(provider))
        .auditLog(new JdbcAuditLog(provider))
        .agentRegistry(registry)
        .outboxStore(new JdbcOutboxStore(provider))
        .deliveryChannel("email", item -> {
          if (channelFailures.getAndDecrement() > 0) {
            throw new IllegalStateException("smtp unavailable");
          }
          delivered.add(item);
        })
        .maxAttempts(1)
        .startDelivery(false)
        .build();

    registry.register("EmailAgent", "Drafts and sends email", task -> {
      String id = desk.outboxWriter().enqueue(OutboxMessage.builder("email")
          .recipient("jane@example.com")
          .subject(task.payload())
          .body("Hello Jane")
          .build());
      return AgentResult.of("{\"outboxId\":\"" + id + "\"}");
    });
    registry.register("TestAgent", task -> AgentResult.of(task.payload()));
  }

  @AfterEach
  void tearDown() {
    desk.close();
    if (hikariDs != null && !hikariDs.isClosed()) {
      hikariDs.close();
    }
  }

  @Test
  void taskLifecyclePersistsStateAndAuditThroughPool() {
    AgentTask task = desk.create(new TaskRequest("MillaAgent", "TestAgent", "echo", "hi", null));

    AgentTask done = desk.run(task.taskId());

    assertEquals(TaskStatus.COMPLETED, done.status());
    assertEquals("hi", desk.get(task.taskId()).result());
    assertEquals(List.of(AuditEventType.CREATED, AuditEventType.STARTED, AuditEventType.COMPLETED),
        desk.auditTrail(task.taskId()).stream().map(AuditEvent::eventType).toList());
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }

  @Test
  void approvalGateSurvivesRoundTripThroughDatabase() {
    AgentTask task = desk.create(new TaskRequest(null, "TestAgent", "echo", "risky",
        TaskMetadata.approvalRequired(SafetyLevel.HIGH)));

    assertThrows(ApprovalRequiredException.class, () -> desk.run(task.taskId()));
    desk.approve(task.taskId());

    assertEquals(TaskStatus.COMPLETED, desk.run(task.taskId()).status());
    assertTrue(desk.get(task.taskId()).metadata().approved());
  }

  @Test
  void rejectWithLongReasonCancelsTask() {
    AgentTask task = desk.create(new TaskRequest("s".repeat(200), "TestAgent", "echo", "risky",
        TaskMetadata.approvalRequired(SafetyLevel.HIGH)));
    String reason = "r".repeat(2000);

    AgentTask rejected = desk.reject(task.taskId(), reason);

    assertEquals(TaskStatus.CANCELLED, rejected.status());
    AgentTask loaded = desk.get(task.taskId());
    assertEquals(TaskStatus.CANCELLED, loaded.status());
    assertEquals(reason, loaded.metadata().rejectionReason());
    assertEquals("s".repeat(200), loaded.supervisor());
  }

  @Test
  void concurrentRunsOfOneTaskExecuteHandlerOnce() throws Exception {
    AtomicInteger invocations = new AtomicInteger();
    registry.register("CountingAgent", task -> {
      invocations.incrementAndGet();
      Thread.sleep(50);
      return AgentResult.of("ok");
    });
    AgentTask task = desk.create(TaskRequest.of("CountingAgent", "count", null));

    ExecutorService pool = Executors.newFixedThreadPool(4);
    CountDownLatch start = new CountDownLatch(1);
    List<Future<AgentTask>> futures = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      Callable<AgentTask> run = () -> {
        start.await();
        return desk.run(task.taskId());
      };
      futures.add(pool.submit(run));
    }
    start.countDown();

    int completed = 0;
    int rejected = 0;
    for (Future<AgentTask> f : futures) {
      try {
        f.get(10, TimeUnit.SECONDS);
        completed++;
      } catch (java.util.concurrent.ExecutionException e) {
        assertInstanceOf(InvalidTransitionException.class, e.getCause());
        rejected++;
      }
    }
    pool.shutdown();

    assertEquals(1, completed);
    assertEquals(3, rejected);
    assertEquals(1, invocations.get());
    assertEquals(TaskStatus.COMPLETED, desk.get(task.taskId()).status());
  }

  @Test
  void enqueuedEmailIsDeliveredAndResendRecoversFailure() {
    channelFailures.set(1);
    AgentTask task = desk.create(TaskRequest.of("EmailAgent", "send", "Lunch"));
    desk.run(task.taskId());

    DeliveryReport first = desk.outboxAdmin().deliverNow();
    assertEquals(1, first.failed());
    OutboxItem failed = desk.outboxAdmin().list().get(0);
    assertTrue(failed.failed());
    assertEquals("smtp unavailable", failed.error());

    assertTrue(desk.outboxAdmin().resend(failed.id()));
    DeliveryReport second = desk.outboxAdmin().deliverNow();

    assertEquals(1, second.sent());
    assertEquals(1, delivered.size());
    assertEquals("Lunch", delivered.get(0).subject());
    assertTrue(desk.outboxAdmin().find(failed.id()).orElseThrow().sent());
    assertEquals(0, desk.outboxAdmin().pendingCount());
    assertEquals(0, hikariDs.getHikariPoolMXBean().getActiveConnections());
  }
}
