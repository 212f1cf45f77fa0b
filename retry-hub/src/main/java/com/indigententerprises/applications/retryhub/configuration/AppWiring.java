package com.indigententerprises.applications.retryhub.configuration;

import com.indigententerprises.applications.brokercore.configuration.BrokerConsumerSettings;
import com.indigententerprises.applications.brokercore.configuration.BrokerProducerSettings;
import com.indigententerprises.applications.brokercore.configuration.BrokerSettings;
import com.indigententerprises.applications.brokercore.domain.BrokerAcks;
import com.indigententerprises.applications.brokercore.infrastructure.BrokerConsumer;
import com.indigententerprises.applications.brokercore.infrastructure.KafkaBrokerAdapter;
import com.indigententerprises.applications.brokercore.serviceimplementations.BrokerRepository;
import com.indigententerprises.applications.brokercore.serviceimplementations.CorrelationPropagator;
import com.indigententerprises.applications.brokercore.serviceimplementations.EnvelopeCodec;
import com.indigententerprises.applications.brokercore.serviceimplementations.RetryDispatcher;
import com.indigententerprises.applications.brokercore.serviceimplementations.TopicNamer;
import com.indigententerprises.applications.brokercore.serviceinterfaces.BrokerAdapter;
import com.indigententerprises.applications.brokercore.serviceinterfaces.MessageHandler;
import com.indigententerprises.applications.retryhub.infrastructure.RetryHubRunner;
import com.indigententerprises.applications.retryhub.serviceimplementations.OfframpRelayHandler;

import org.springframework.beans.BeansException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.ApplicationContext;
import org.springframework.context.ApplicationContextAware;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AppWiring implements ApplicationContextAware {

    @Value("${retry.hub.bootstrap.servers}")
    private String bootstrapServers;

    @Value("${retry.hub.request.timeout.ms:5000}")
    private int requestTimeoutMs;

    @Value("${retry.hub.topics}")
    private String topics;

    @Value("${retry.hub.group.id}")
    private String groupId;

    @Value("${retry.hub.enable.auto.commit:false}")
    private boolean enableAutoCommit;

    @Value("${retry.hub.max.poll.records:100}")
    private int maxPollRecords;

    @Value("${retry.hub.max.poll.interval.ms:300000}")
    private int maxPollIntervalMs;

    @Value("${retry.hub.heartbeat.interval.ms:15000}")
    private int heartbeatIntervalMs;

    @Value("${retry.hub.session.timeout.ms:90000}")
    private int sessionTimeoutMs;

    @Value("${retry.hub.retry.max.times:0}")
    private int retryMaxTimes;

    @Value("${retry.hub.retry.delay.ms:3000}")
    private long retryDelayMs;

    @Value("${retry.hub.poll.timeout.ms:500}")
    private long pollTimeoutMs;

    @Value("${retry.hub.acks:all}")
    private String acks;

    @Value("${retry.hub.connections.max.idle.ms:10000}")
    private int connectionsMaxIdleMs;

    @Value("${retry.hub.delivery.timeout.ms:30000}")
    private long deliveryTimeoutMs;

    @Value("${retry.hub.offramp.topic}")
    private String offrampTopic;

    @Value("${retry.hub.service.name:retry-hub}")
    private String serviceName;

    private ApplicationContext applicationContext;

    @Override
    public void setApplicationContext(final ApplicationContext applicationContext) throws BeansException {
        this.applicationContext = applicationContext;
    }

    @Bean
    public ObjectMapper objectMapper() {
        final ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod="shutdown")
    public ExecutorService consumerExecutor() {
        return Executors.newSingleThreadExecutor();
    }

    @Bean
    public BrokerConsumerSettings brokerConsumerSettings() {
        return BrokerConsumerSettings.builder(new BrokerSettings(bootstrapServers, requestTimeoutMs))
                .topics(topics)
                .groupId(groupId)
                .enableAutoCommit(enableAutoCommit)
                .maxPollRecords(maxPollRecords)
                .maxPollIntervalMs(maxPollIntervalMs)
                .heartbeatIntervalMs(heartbeatIntervalMs)
                .sessionTimeoutMs(sessionTimeoutMs)
                .retryMaxTimes(retryMaxTimes)
                .build();
    }

    @Bean
    public BrokerProducerSettings brokerProducerSettings() {
        return BrokerProducerSettings.builder(new BrokerSettings(bootstrapServers, requestTimeoutMs))
                .acks(BrokerAcks.fromConfigValue(acks))
                .connectionsMaxIdleMs(connectionsMaxIdleMs)
                .build();
    }

    @Bean
    public BrokerAdapter brokerAdapter(
            final BrokerConsumerSettings consumerSettings,
            final BrokerProducerSettings producerSettings
    ) {
        return KafkaBrokerAdapter.create(consumerSettings, producerSettings, deliveryTimeoutMs);
    }

    @Bean
    public EnvelopeCodec envelopeCodec(final ObjectMapper objectMapper) {
        return new EnvelopeCodec(objectMapper);
    }

    @Bean
    public CorrelationPropagator correlationPropagator() {
        return new CorrelationPropagator();
    }

    @Bean
    public BrokerRepository brokerRepository(
            final BrokerAdapter brokerAdapter,
            final EnvelopeCodec envelopeCodec,
            final CorrelationPropagator correlationPropagator
    ) {
        return new BrokerRepository(
                brokerAdapter,
                envelopeCodec,
                correlationPropagator,
                Clock.systemUTC(),
                Map.of("service", serviceName)
        );
    }

    @Bean
    public RetryDispatcher retryDispatcher(
            final BrokerAdapter brokerAdapter,
            final BrokerRepository brokerRepository,
            final EnvelopeCodec envelopeCodec,
            final CorrelationPropagator correlationPropagator,
            final BrokerConsumerSettings consumerSettings
    ) {
        return new RetryDispatcher(
                brokerAdapter,
                brokerRepository,
                new TopicNamer(),
                envelopeCodec,
                correlationPropagator,
                consumerSettings.getRetryMaxTimes(),
                Duration.ofMillis(retryDelayMs)
        );
    }

    @Bean
    public BrokerConsumer brokerConsumer(
            final BrokerAdapter brokerAdapter,
            final RetryDispatcher retryDispatcher
    ) {
        return new BrokerConsumer(brokerAdapter, retryDispatcher, Duration.ofMillis(pollTimeoutMs));
    }

    @Bean
    public MessageHandler messageHandler(
            final EnvelopeCodec envelopeCodec,
            final BrokerRepository brokerRepository
    ) {
        return new OfframpRelayHandler(envelopeCodec, brokerRepository, offrampTopic);
    }

    @Bean
    public RetryHubRunner retryHubRunner(
            final BrokerConsumer brokerConsumer,
            final MessageHandler messageHandler
    ) {
        final RetryHubRunner retryHubRunner = new RetryHubRunner(brokerConsumer, messageHandler);
        retryHubRunner.setApplicationContext(applicationContext);
        return retryHubRunner;
    }

    @Bean
    public ApplicationRunner runner(
            final RetryHubRunner retryHubRunner,
            final ExecutorService consumerExecutor
    ) {
        return args -> {
            consumerExecutor.submit(retryHubRunner);
        };
    }
}
