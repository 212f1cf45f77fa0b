package com.indigententerprises.applications.brokercore.serviceimplementations;

import com.indigententerprises.applications.brokercore.domain.BrokerMessage;
import com.indigententerprises.applications.brokercore.domain.CorrelationContext;
import com.indigententerprises.applications.brokercore.serviceinterfaces.BrokerAdapter;
import com.indigententerprises.applications.brokercore.serviceinterfaces.TransportException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * produces enveloped messages: stamps the topic into the metadata trail, merges the
 * common metadata and attaches the correlation header.
 */
public class BrokerRepository {

    private static final Logger log = LoggerFactory.getLogger(BrokerRepository.class);

    // 2025-08-13T12:00:00+00:00, or 2025-08-13T12:00:00.120000+00:00 when there are microseconds
    private static final DateTimeFormatter WHOLE_SECONDS_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx", Locale.ROOT);
    private static final DateTimeFormatter MICROSECONDS_FORMAT =
            DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ss.SSSSSSxxx", Locale.ROOT);

    private final BrokerAdapter adapter;
    private final EnvelopeCodec envelopeCodec;
    private final CorrelationPropagator correlationPropagator;
    private final Clock clock;
    private final Map<String, Object> commonMetadata;

    public BrokerRepository(
            final BrokerAdapter adapter,
            final EnvelopeCodec envelopeCodec,
            final CorrelationPropagator correlationPropagator,
            final Clock clock,
            final Map<String, Object> commonMetadata
    ) {
        this.adapter = adapter;
        this.envelopeCodec = envelopeCodec;
        this.correlationPropagator = correlationPropagator;
        this.clock = clock;
        this.commonMetadata = commonMetadata == null ? Map.of() : new LinkedHashMap<>(commonMetadata);
    }

    public BrokerRepository(
            final BrokerAdapter adapter,
            final EnvelopeCodec envelopeCodec,
            final CorrelationPropagator correlationPropagator
    ) {
        this(adapter, envelopeCodec, correlationPropagator, Clock.systemUTC(), null);
    }

    public void produce(
            final String topic,
            final String key,
            final Map<String, Object> data,
            final Map<String, Object> metadata,
            final CorrelationContext context
    ) throws TransportException {
        produce(topic, EnvelopeCodec.keyBytes(key), data, metadata, context);
    }

    public void produce(
            final String topic,
            final byte[] key,
            final Map<String, Object> data,
            final Map<String, Object> metadata,
            final CorrelationContext context
    ) throws TransportException {
        final byte[] value = envelopeCodec.encode(data, producerMetadata(topic, metadata));

        adapter.produce(topic, EnvelopeCodec.keyBytes(key), value, correlationPropagator.headers(context));
        log.info("produced - topic: {} - key: {}", topic, BrokerMessage.keyAsString(key));
    }

    /**
     * the topic stamp comes first, common metadata overrides it, caller metadata overrides both.
     */
    public Map<String, Object> producerMetadata(final String topic, final Map<String, Object> metadata) {
        final Map<String, Object> result = new LinkedHashMap<>();
        result.put(topic.toLowerCase(Locale.ROOT), timestamp());
        result.putAll(commonMetadata);

        if (metadata != null) {
            result.putAll(metadata);
        }

        return result;
    }

    private String timestamp() {
        final OffsetDateTime now = OffsetDateTime.now(clock)
                .withOffsetSameInstant(ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.MICROS);

        return now.getNano() == 0 ? now.format(WHOLE_SECONDS_FORMAT) : now.format(MICROSECONDS_FORMAT);
    }
}
