package com.ivamare.exchange;

import com.ivamare.exchange.deadletter.DeadLetterSink;
import com.ivamare.exchange.deadletter.QueueDeadLetterSink;
import com.ivamare.exchange.hash.ContentHasher;
import com.ivamare.exchange.hash.DuplicateDetectionService;
import com.ivamare.exchange.hash.HashConfig;
import com.ivamare.exchange.output.OutputDispatcher;
import com.ivamare.exchange.output.OutputHandlerFactory;
import com.ivamare.exchange.policy.BackoffPolicy;
import com.ivamare.exchange.processor.DefaultTenantResolver;
import com.ivamare.exchange.processor.ProcessorHandlerFactory;
import com.ivamare.exchange.processor.TenantResolver;
import com.ivamare.exchange.store.EntityStore;
import com.ivamare.exchange.transport.BusClient;
import com.ivamare.exchange.transport.QueueClient;
import com.ivamare.exchange.transport.amqp.RabbitBusClient;
import com.ivamare.exchange.transport.pgmq.PgmqQueueClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.amqp.RabbitAutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Auto-configuration for the message exchange.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>PGMQ queue client (when a {@link JdbcTemplate} is available)</li>
 *   <li>RabbitMQ bus client (when a {@link RabbitTemplate} is available)</li>
 *   <li>Output handler factory and dispatcher</li>
 *   <li>Content hasher and duplicate detection (when an {@link EntityStore} is available)</li>
 *   <li>Tenant resolver and dead-letter sink</li>
 *   <li>Processor handler factory</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * exchange.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    RabbitAutoConfiguration.class
})
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "exchange", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ExchangeProperties.class)
public class ExchangeAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper exchangeObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    // --- Backoff ---

    @Bean
    @ConditionalOnMissingBean
    public BackoffPolicy backoffPolicy(ExchangeProperties properties) {
        ExchangeProperties.BackoffProperties backoff = properties.getBackoff();
        return new BackoffPolicy(
            backoff.getBaseDelaySeconds(),
            backoff.getMaxDelaySeconds(),
            backoff.getMultiplier(),
            backoff.isJitter()
        );
    }

    // --- Transports ---

    @Bean
    @ConditionalOnBean(JdbcTemplate.class)
    @ConditionalOnMissingBean
    public QueueClient queueClient(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new PgmqQueueClient(jdbcTemplate, objectMapper);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(RabbitTemplate.class)
    static class RabbitBusConfiguration {

        @Bean
        @ConditionalOnBean(RabbitTemplate.class)
        @ConditionalOnMissingBean
        public BusClient busClient(RabbitTemplate rabbitTemplate) {
            return new RabbitBusClient(rabbitTemplate);
        }
    }

    // --- Output ---

    @Bean
    @ConditionalOnMissingBean
    public OutputHandlerFactory outputHandlerFactory(
            ObjectProvider<QueueClient> queueClient,
            ObjectProvider<BusClient> busClient,
            ObjectMapper objectMapper,
            BackoffPolicy backoffPolicy,
            ExchangeProperties properties) {
        QueueClient queue = queueClient.getIfAvailable();
        BusClient bus = busClient.getIfAvailable();
        return new OutputHandlerFactory(
            queue != null ? () -> queue : null,
            bus != null ? () -> bus : null,
            objectMapper,
            backoffPolicy,
            properties.getQueue().toHandlerDefaults(),
            properties.getBus().toHandlerDefaults()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public OutputDispatcher outputDispatcher() {
        return new OutputDispatcher();
    }

    // --- Hashing ---

    @Bean
    @ConditionalOnMissingBean
    public ContentHasher contentHasher(ObjectMapper objectMapper, ExchangeProperties properties) {
        HashConfig config = new HashConfig(List.of(), properties.getHash().getIgnoreFields(), true);
        return new ContentHasher(objectMapper, config);
    }

    @Bean
    @ConditionalOnBean(EntityStore.class)
    @ConditionalOnMissingBean
    public DuplicateDetectionService duplicateDetectionService(EntityStore entityStore, ContentHasher contentHasher) {
        return new DuplicateDetectionService(entityStore, contentHasher);
    }

    // --- Processing ---

    @Bean
    @ConditionalOnMissingBean
    public TenantResolver tenantResolver(ExchangeProperties properties) {
        return new DefaultTenantResolver(properties.getTenantId());
    }

    @Bean
    @ConditionalOnBean(QueueClient.class)
    @ConditionalOnMissingBean
    public DeadLetterSink deadLetterSink(QueueClient queueClient, ExchangeProperties properties) {
        return new QueueDeadLetterSink(queueClient, properties.getDeadLetterQueue());
    }

    @Bean
    @ConditionalOnMissingBean
    public ProcessorHandlerFactory processorHandlerFactory(
            TenantResolver tenantResolver,
            ObjectProvider<DeadLetterSink> deadLetterSink,
            OutputDispatcher outputDispatcher,
            ObjectMapper objectMapper,
            ObjectProvider<EntityStore> entityStore,
            ContentHasher contentHasher,
            ObjectProvider<DuplicateDetectionService> duplicateDetection,
            OutputHandlerFactory outputHandlerFactory,
            ExchangeProperties properties) {
        DeadLetterSink sink = StringUtils.hasText(properties.getDeadLetterQueue())
            ? deadLetterSink.getIfAvailable()
            : null;
        return new ProcessorHandlerFactory(
            tenantResolver,
            sink,
            outputDispatcher,
            objectMapper,
            properties.getProcessing().getDeliveryMode(),
            entityStore.getIfAvailable(),
            contentHasher,
            duplicateDetection.getIfAvailable(),
            outputHandlerFactory
        );
    }
}
