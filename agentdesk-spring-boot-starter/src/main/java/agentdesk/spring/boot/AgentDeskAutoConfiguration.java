package agentdesk.spring.boot;

import agentdesk.AgentDesk;
import agentdesk.jdbc.ConnectionProvider;
import agentdesk.jdbc.DataSourceConnectionProvider;
import agentdesk.jdbc.SchemaInitializer;
import agentdesk.jdbc.TableNames;
import agentdesk.jdbc.store.JdbcAuditLog;
import agentdesk.jdbc.store.JdbcOutboxStore;
import agentdesk.jdbc.store.JdbcTaskStore;
import agentdesk.outbox.DeliveryChannel;
import agentdesk.outbox.ExponentialBackoffRetryPolicy;
import agentdesk.outbox.OutboxAdmin;
import agentdesk.outbox.OutboxWriter;
import agentdesk.registry.DefaultAgentRegistry;
import agentdesk.spi.AuditLog;
import agentdesk.spi.MetricsExporter;
import agentdesk.spi.OutboxStore;
import agentdesk.spi.TaskStore;
import agentdesk.util.JsonCodec;

import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Auto-configuration for the agent desk.
 *
 * <p>Wires JDBC task, audit and outbox stores from the application's {@link DataSource},
 * registers {@link AgentCapability} handlers and {@link OutboxChannel} transports, and
 * exposes an {@link AgentDesk} composite together with its outbox writer and admin.
 *
 * @see AgentDeskProperties
 * @see AgentDeskMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(AgentDesk.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(AgentDeskProperties.class)
public class AgentDeskAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider agentDeskConnectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TaskStore.class)
  public JdbcTaskStore taskStore(ConnectionProvider connectionProvider, AgentDeskProperties props) {
    return new JdbcTaskStore(connectionProvider, props.getTables().getTasks());
  }

  @Bean
  @ConditionalOnMissingBean(AuditLog.class)
  public JdbcAuditLog auditLog(ConnectionProvider connectionProvider, AgentDeskProperties props) {
    return new JdbcAuditLog(connectionProvider, props.getTables().getAudit());
  }

  @Bean
  @ConditionalOnMissingBean(OutboxStore.class)
  public JdbcOutboxStore outboxStore(ConnectionProvider connectionProvider, AgentDeskProperties props,
      ObjectProvider<JsonCodec> jsonCodecProvider) {
    return new JdbcOutboxStore(connectionProvider, props.getTables().getOutbox(),
        jsonCodecProvider.getIfAvailable(JsonCodec::getDefault));
  }

  @Bean
  @ConditionalOnMissingBean
  public DefaultAgentRegistry agentRegistry() {
    return new DefaultAgentRegistry();
  }

  @Bean
  @ConditionalOnMissingBean
  public AgentCapabilityRegistrar agentCapabilityRegistrar(ListableBeanFactory beanFactory,
      DefaultAgentRegistry agentRegistry) {
    return new AgentCapabilityRegistrar(beanFactory, agentRegistry);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public AgentDesk agentDesk(AgentDeskProperties props,
      DataSource dataSource,
      TaskStore taskStore,
      AuditLog auditLog,
      OutboxStore outboxStore,
      DefaultAgentRegistry agentRegistry,
      ListableBeanFactory beanFactory,
      ObjectProvider<MetricsExporter> metricsProvider) {

    if (props.isInitializeSchema()) {
      TableNames tables = props.getTables().toTableNames();
      SchemaInitializer.create(dataSource, tables);
    }

    AgentDeskProperties.Delivery delivery = props.getDelivery();
    AgentDesk.Builder builder = AgentDesk.builder()
        .taskStore(taskStore)
        .auditLog(auditLog)
        .agentRegistry(agentRegistry)
        .asyncThreads(props.getWorker().getAsyncThreads())
        .outboxStore(outboxStore)
        .retryPolicy(new ExponentialBackoffRetryPolicy(
            delivery.getRetry().getBaseDelayMs(), delivery.getRetry().getMaxDelayMs()))
        .maxAttempts(delivery.getMaxAttempts())
        .batchSize(delivery.getBatchSize())
        .deliveryIntervalMs(delivery.getIntervalMs())
        .drainTimeoutMs(delivery.getDrainTimeoutMs())
        .startDelivery(delivery.isEnabled());
    deliveryChannels(beanFactory).forEach(builder::deliveryChannel);
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    return builder.build();
  }

  @Bean
  @ConditionalOnMissingBean
  public OutboxWriter outboxWriter(AgentDesk agentDesk) {
    return agentDesk.outboxWriter();
  }

  @Bean
  @ConditionalOnMissingBean
  public OutboxAdmin outboxAdmin(AgentDesk agentDesk) {
    return agentDesk.outboxAdmin();
  }

  private static Map<String, DeliveryChannel> deliveryChannels(ListableBeanFactory beanFactory) {
    Map<String, DeliveryChannel> channels = new LinkedHashMap<>();
    Map<String, Object> beans = beanFactory.getBeansWithAnnotation(OutboxChannel.class);
    for (Map.Entry<String, Object> entry : beans.entrySet()) {
      String beanName = entry.getKey();
      if (!(entry.getValue() instanceof DeliveryChannel channel)) {
        throw new BeanCreationException(beanName,
            "Bean annotated with @OutboxChannel must implement DeliveryChannel, but "
                + entry.getValue().getClass().getName() + " does not");
      }
      OutboxChannel annotation = beanFactory.findAnnotationOnBean(beanName, OutboxChannel.class);
      String name = annotation == null ? "" : annotation.value();
      if (name.isBlank()) {
        throw new BeanCreationException(beanName, "@OutboxChannel value must not be blank");
      }
      DeliveryChannel previous = channels.put(name, channel);
      if (previous != null) {
        throw new BeanCreationException(beanName, "Duplicate @OutboxChannel for channel '" + name + "'");
      }
    }
    return channels;
  }
}
