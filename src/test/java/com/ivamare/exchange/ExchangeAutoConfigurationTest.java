package com.ivamare.exchange;

import com.ivamare.exchange.deadletter.DeadLetterSink;
import com.ivamare.exchange.deadletter.QueueDeadLetterSink;
import com.ivamare.exchange.hash.ContentHasher;
import com.ivamare.exchange.hash.DuplicateDetectionService;
import com.ivamare.exchange.output.OutputDispatcher;
import com.ivamare.exchange.output.OutputHandlerFactory;
import com.ivamare.exchange.policy.BackoffPolicy;
import com.ivamare.exchange.processor.DeliveryMode;
import com.ivamare.exchange.processor.ProcessorHandler;
import com.ivamare.exchange.processor.ProcessorHandlerFactory;
import com.ivamare.exchange.processor.TenantResolver;
import com.ivamare.exchange.model.ProcessingResult;
import com.ivamare.exchange.store.EntityStore;
import com.ivamare.exchange.transport.BusClient;
import com.ivamare.exchange.transport.QueueClient;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("ExchangeAutoConfiguration")
class ExchangeAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ExchangeAutoConfiguration.class))
        .withUserConfiguration(MockDataSourceConfig.class);

    @Test
    @DisplayName("should create all beans when enabled")
    void shouldCreateAllBeansWhenEnabled() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(ObjectMapper.class);
            assertThat(context).hasSingleBean(BackoffPolicy.class);
            assertThat(context).hasSingleBean(QueueClient.class);
            assertThat(context).hasSingleBean(OutputHandlerFactory.class);
            assertThat(context).hasSingleBean(OutputDispatcher.class);
            assertThat(context).hasSingleBean(ContentHasher.class);
            assertThat(context).hasSingleBean(TenantResolver.class);
            assertThat(context).hasSingleBean(DeadLetterSink.class);
            assertThat(context).hasSingleBean(ProcessorHandlerFactory.class);
        });
    }

    @Test
    @DisplayName("should not create optional beans without their dependencies")
    void shouldSkipOptionalBeans() {
        contextRunner.run(context -> {
            assertThat(context).doesNotHaveBean(BusClient.class);
            assertThat(context).doesNotHaveBean(DuplicateDetectionService.class);
        });
    }

    @Test
    @DisplayName("should create bus client when RabbitTemplate is available")
    void shouldCreateBusClient() {
        contextRunner
            .withUserConfiguration(RabbitConfig.class)
            .run(context -> assertThat(context).hasSingleBean(BusClient.class));
    }

    @Test
    @DisplayName("should create duplicate detection when EntityStore is available")
    void shouldCreateDuplicateDetection() {
        contextRunner
            .withUserConfiguration(EntityStoreConfig.class)
            .run(context -> assertThat(context).hasSingleBean(DuplicateDetectionService.class));
    }

    @Test
    @DisplayName("should not create beans when disabled")
    void shouldNotCreateBeansWhenDisabled() {
        contextRunner
            .withPropertyValues("exchange.enabled=false")
            .run(context -> {
                assertThat(context).doesNotHaveBean(ProcessorHandlerFactory.class);
                assertThat(context).doesNotHaveBean(QueueClient.class);
            });
    }

    @Test
    @DisplayName("should use custom ObjectMapper if provided")
    void shouldUseCustomObjectMapperIfProvided() {
        contextRunner
            .withUserConfiguration(CustomObjectMapperConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(ObjectMapper.class);
                assertThat(context.getBean(ObjectMapper.class)).isSameAs(CustomObjectMapperConfig.CUSTOM_MAPPER);
            });
    }

    @Test
    @DisplayName("should use custom QueueClient if provided")
    void shouldUseCustomQueueClientIfProvided() {
        contextRunner
            .withUserConfiguration(CustomQueueClientConfig.class)
            .run(context -> {
                assertThat(context).hasSingleBean(QueueClient.class);
                assertThat(context.getBean(QueueClient.class)).isSameAs(CustomQueueClientConfig.CUSTOM_CLIENT);
            });
    }

    @Test
    @DisplayName("should configure BackoffPolicy from properties")
    void shouldConfigureBackoffPolicyFromProperties() {
        contextRunner
            .withPropertyValues(
                "exchange.backoff.base-delay-seconds=2",
                "exchange.backoff.max-delay-seconds=60",
                "exchange.backoff.multiplier=3.0",
                "exchange.backoff.jitter=false"
            )
            .run(context -> {
                BackoffPolicy policy = context.getBean(BackoffPolicy.class);
                assertThat(policy.baseDelaySeconds()).isEqualTo(2);
                assertThat(policy.maxDelaySeconds()).isEqualTo(60);
                assertThat(policy.multiplier()).isEqualTo(3.0);
                assertThat(policy.jitter()).isFalse();
            });
    }

    @Test
    @DisplayName("should bind ExchangeProperties")
    void shouldBindExchangeProperties() {
        contextRunner
            .withPropertyValues(
                "exchange.tenant-id=acme",
                "exchange.dead-letter-queue=failed-messages",
                "exchange.queue.auto-create-queue=false",
                "exchange.queue.message-ttl-seconds=3600",
                "exchange.bus.destination-type=topic",
                "exchange.bus.time-to-live-seconds=120",
                "exchange.processing.delivery-mode=all_required",
                "exchange.hash.ignore-fields=created_at,audit"
            )
            .run(context -> {
                ExchangeProperties props = context.getBean(ExchangeProperties.class);
                assertThat(props.getTenantId()).isEqualTo("acme");
                assertThat(props.getDeadLetterQueue()).isEqualTo("failed-messages");
                assertThat(props.getQueue().isAutoCreateQueue()).isFalse();
                assertThat(props.getQueue().getMessageTtlSeconds()).isEqualTo(3600);
                assertThat(props.getBus().getDestinationType()).isEqualTo("topic");
                assertThat(props.getBus().getTimeToLiveSeconds()).isEqualTo(120);
                assertThat(props.getProcessing().getDeliveryMode()).isEqualTo(DeliveryMode.ALL_REQUIRED);
                assertThat(props.getHash().getIgnoreFields()).containsExactlyInAnyOrder("created_at", "audit");
                assertThat(((QueueDeadLetterSink) context.getBean(DeadLetterSink.class)).getQueueName())
                    .isEqualTo("failed-messages");
            });
    }

    @Test
    @DisplayName("should create handlers using the configured delivery mode")
    void shouldCreateHandlersWithConfiguredMode() {
        contextRunner
            .withPropertyValues("exchange.processing.delivery-mode=all_required")
            .run(context -> {
                ProcessorHandler handler = context.getBean(ProcessorHandlerFactory.class)
                    .create((message, ctx) -> ProcessingResult.createSuccess());
                assertThat(handler.getDeliveryMode()).isEqualTo(DeliveryMode.ALL_REQUIRED);
            });
    }

    @Configuration
    static class MockDataSourceConfig {
        @Bean
        public DataSource dataSource() {
            return mock(DataSource.class);
        }

        @Bean
        public JdbcTemplate jdbcTemplate() {
            return mock(JdbcTemplate.class);
        }
    }

    @Configuration
    static class RabbitConfig {
        @Bean
        public RabbitTemplate rabbitTemplate() {
            return mock(RabbitTemplate.class);
        }
    }

    @Configuration
    static class EntityStoreConfig {
        @Bean
        public EntityStore entityStore() {
            return mock(EntityStore.class);
        }
    }

    @Configuration
    static class CustomObjectMapperConfig {
        static final ObjectMapper CUSTOM_MAPPER = new ObjectMapper();

        @Bean
        public ObjectMapper objectMapper() {
            return CUSTOM_MAPPER;
        }
    }

    @Configuration
    static class CustomQueueClientConfig {
        static final QueueClient CUSTOM_CLIENT = mock(QueueClient.class);

        @Bean
        public QueueClient queueClient() {
            return CUSTOM_CLIENT;
        }
    }
}
