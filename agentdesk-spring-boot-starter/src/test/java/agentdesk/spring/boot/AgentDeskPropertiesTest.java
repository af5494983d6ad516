package agentdesk.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AgentDeskPropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropsConfig.class);

    @Test
    void defaultValues() {
        runner.run(ctx -> {
            var props = ctx.getBean(AgentDeskProperties.class);
            assertTrue(props.isInitializeSchema());
            assertEquals("agent_task", props.getTables().getTasks());
            assertEquals("agent_audit_event", props.getTables().getAudit());
            assertEquals("agent_outbox", props.getTables().getOutbox());
            assertEquals(4, props.getWorker().getAsyncThreads());
            assertTrue(props.getDelivery().isEnabled());
            assertEquals(60000, props.getDelivery().getIntervalMs());
            assertEquals(50, props.getDelivery().getBatchSize());
            assertEquals(3, props.getDelivery().getMaxAttempts());
            assertEquals(5000, props.getDelivery().getDrainTimeoutMs());
            assertEquals(60000, props.getDelivery().getRetry().getBaseDelayMs());
            assertEquals(86400000, props.getDelivery().getRetry().getMaxDelayMs());
            assertTrue(props.getMetrics().isEnabled());
            assertEquals("agentdesk", props.getMetrics().getNamePrefix());
        });
    }

    @Test
    void customValues() {
        runner.withPropertyValues(
                "agentdesk.initialize-schema=false",
                "agentdesk.tables.tasks=my_tasks",
                "agentdesk.tables.audit=my_audit",
                "agentdesk.tables.outbox=my_outbox",
                "agentdesk.worker.async-threads=8",
                "agentdesk.delivery.enabled=false",
                "agentdesk.delivery.interval-ms=1000",
                "agentdesk.delivery.batch-size=10",
                "agentdesk.delivery.max-attempts=5",
                "agentdesk.delivery.drain-timeout-ms=2000",
                "agentdesk.delivery.retry.base-delay-ms=500",
                "agentdesk.delivery.retry.max-delay-ms=120000",
                "agentdesk.metrics.enabled=false",
                "agentdesk.metrics.name-prefix=assistant.desk"
        ).run(ctx -> {
            var props = ctx.getBean(AgentDeskProperties.class);
            assertFalse(props.isInitializeSchema());
            assertEquals("my_tasks", props.getTables().getTasks());
            assertEquals("my_audit", props.getTables().getAudit());
            assertEquals("my_outbox", props.getTables().getOutbox());
            assertEquals(8, props.getWorker().getAsyncThreads());
            assertFalse(props.getDelivery().isEnabled());
            assertEquals(1000, props.getDelivery().getIntervalMs());
            assertEquals(10, props.getDelivery().getBatchSize());
            assertEquals(5, props.getDelivery().getMaxAttempts());
            assertEquals(2000, props.getDelivery().getDrainTimeoutMs());
            assertEquals(500, props.getDelivery().getRetry().getBaseDelayMs());
            assertEquals(120000, props.getDelivery().getRetry().getMaxDelayMs());
            assertFalse(props.getMetrics().isEnabled());
            assertEquals("assistant.desk", props.getMetrics().getNamePrefix());
            assertEquals("my_outbox", props.getTables().toTableNames().outbox());
        });
    }

    @Configuration
    @EnableConfigurationProperties(AgentDeskProperties.class)
    static class PropsConfig {
    }
}
