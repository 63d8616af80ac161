package supportbus.spring.boot;

import supportbus.SupportBus;
import supportbus.broker.EventBroker;
import supportbus.broker.EventInterceptor;
import supportbus.coordinator.Coordinator;
import supportbus.coordinator.CoordinatorConfig;
import supportbus.escalation.EscalationQueue;
import supportbus.jdbc.DataSourceConnectionProvider;
import supportbus.jdbc.JdbcConversationWriter;
import supportbus.session.SessionRegistry;
import supportbus.spi.ConversationWriter;
import supportbus.spi.MetricsExporter;

import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Auto-configuration for the support bus.
 *
 * <p>Builds a {@link SupportBus} from {@link SupportBusProperties} and exposes its
 * broker, registry, coordinator and escalation queue as beans. When a {@link DataSource}
 * and {@code supportbus-jdbc} are present, finished conversations are written with a
 * {@link JdbcConversationWriter}; otherwise they are only logged.
 *
 * @see SupportBusProperties
 * @see SupportBusMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(SupportBus.class)
@EnableConfigurationProperties(SupportBusProperties.class)
public class SupportBusAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public CoordinatorConfig coordinatorConfig(SupportBusProperties props) {
    SupportBusProperties.Coordinator c = props.getCoordinator();
    CoordinatorConfig config = new CoordinatorConfig()
        .setIntentConfidenceThreshold(c.getIntentConfidenceThreshold())
        .setSentimentEscalationLabels(c.getSentimentEscalationLabels());
    if (!c.getRoutes().isEmpty()) {
      config.setRoutes(c.getRoutes());
    }
    return config;
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public SupportBus supportBus(SupportBusProperties props,
      CoordinatorConfig coordinatorConfig,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<ConversationWriter> writerProvider,
      ObjectProvider<EventInterceptor> interceptorProvider) {
    SupportBus.Builder builder = SupportBus.builder()
        .coordinatorConfig(coordinatorConfig)
        .maxPublishDepth(props.getMaxPublishDepth())
        .avgHandlingSeconds(props.getEscalation().getAvgHandlingSeconds());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    ConversationWriter writer = writerProvider.getIfAvailable();
    if (writer != null) {
      builder.conversationWriter(writer);
    }
    interceptorProvider.orderedStream().forEach(builder::interceptor);
    return builder.build();
  }

  // Component beans are owned by the SupportBus; it closes them.

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean
  public EventBroker eventBroker(SupportBus supportBus) {
    return supportBus.broker();
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean
  public SessionRegistry sessionRegistry(SupportBus supportBus) {
    return supportBus.registry();
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean
  public Coordinator coordinator(SupportBus supportBus) {
    return supportBus.coordinator();
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean
  public EscalationQueue escalationQueue(SupportBus supportBus) {
    return supportBus.escalationQueue();
  }

  @Bean
  @ConditionalOnMissingBean
  public SupportBusHandlerRegistrar supportBusHandlerRegistrar(
      ListableBeanFactory beanFactory, EventBroker eventBroker) {
    return new SupportBusHandlerRegistrar(beanFactory, eventBroker);
  }

  /**
   * Transcript persistence through {@code supportbus-jdbc}.
   */
  @Configuration(proxyBeanMethods = false)
  @ConditionalOnClass(JdbcConversationWriter.class)
  @ConditionalOnBean(DataSource.class)
  @ConditionalOnProperty(prefix = "supportbus.jdbc", name = "enabled", matchIfMissing = true)
  static class JdbcWriterConfiguration {

    @Bean
    @ConditionalOnMissingBean(ConversationWriter.class)
    public JdbcConversationWriter conversationWriter(DataSource dataSource,
        SupportBusProperties props) {
      return JdbcConversationWriter.builder()
          .connectionProvider(new DataSourceConnectionProvider(dataSource))
          .conversationsTable(props.getJdbc().getConversationsTable())
          .messagesTable(props.getJdbc().getMessagesTable())
          .build();
    }
  }
}
