package com.indigententerprises.applications.brokercore.serviceimplementations;

import com.indigententerprises.applications.brokercore.domain.BrokerMessage;
import com.indigententerprises.applications.brokercore.domain.CorrelationContext;
import com.indigententerprises.applications.brokercore.domain.DispatchOutcome;
import com.indigententerprises.applications.brokercore.domain.Envelope;
import com.indigententerprises.applications.brokercore.domain.ErrorKind;
import com.indigententerprises.applications.brokercore.domain.TopicName;
import com.indigententerprises.applications.brokercore.domain.TopicShape;
import com.indigententerprises.applications.brokercore.serviceinterfaces.BrokerAdapter;
import com.indigententerprises.applications.brokercore.serviceinterfaces.EnvelopeDecodeException;
import com.indigententerprises.applications.brokercore.serviceinterfaces.MalformedTopicException;
import com.indigententerprises.applications.brokercore.serviceinterfaces.MessageHandler;
import com.indigententerprises.applications.brokercore.serviceinterfaces.TransportException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.Optional;

/**
 * runs one consumed message through the handler and, when the handler fails, forwards it to
 * the next retry or dead-letter topic. the message is committed on every outcome; the only
 * way out without a commit is a transport failure while forwarding, in which case the
 * message is read again after the consumer restarts.
 */
public final class RetryDispatcher {

    private static final Logger log = LoggerFactory.getLogger(RetryDispatcher.class);

    public static final String ERROR_METADATA_KEY = "error";
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(3);

    private final BrokerAdapter adapter;
    private final BrokerRepository brokerRepository;
    private final TopicNamer topicNamer;
    private final EnvelopeCodec envelopeCodec;
    private final CorrelationPropagator correlationPropagator;
    private final int retryMaxTimes;
    private final Duration retryDelay;

    public RetryDispatcher(
            final BrokerAdapter adapter,
            final BrokerRepository brokerRepository,
            final TopicNamer topicNamer,
            final EnvelopeCodec envelopeCodec,
            final CorrelationPropagator correlationPropagator,
            final int retryMaxTimes,
            final Duration retryDelay
    ) {
        if (retryMaxTimes < 0) {
            throw new IllegalArgumentException("retryMaxTimes must not be negative: " + retryMaxTimes);
        }

        this.adapter = adapter;
        this.brokerRepository = brokerRepository;
        this.topicNamer = topicNamer;
        this.envelopeCodec = envelopeCodec;
        this.correlationPropagator = correlationPropagator;
        this.retryMaxTimes = retryMaxTimes;
        this.retryDelay = retryDelay == null ? DEFAULT_RETRY_DELAY : retryDelay;
    }

    public DispatchOutcome dispatch(final BrokerMessage message, final MessageHandler handler) throws TransportException {
        final CorrelationContext context = correlationPropagator.extract(message.getHeaders());

        context.getCorrelationId().ifPresent(id -> MDC.put(CorrelationPropagator.CORRELATION_ID_MDC_KEY, id));

        try {
            final DispatchOutcome outcome = handle(message, handler, context);

            commit(message);
            log.info("committed - topic: {} - key: {} - outcome: {}",
                    message.getTopic(), message.getKeyAsString(), outcome);

            return outcome;
        } finally {
            MDC.remove(CorrelationPropagator.CORRELATION_ID_MDC_KEY);
        }
    }

    private DispatchOutcome handle(
            final BrokerMessage message,
            final MessageHandler handler,
            final CorrelationContext context
    ) throws TransportException {
        try {
            log.info("consume - topic: {} - key: {}", message.getTopic(), message.getKeyAsString());
            handler.handle(message, context);
            return DispatchOutcome.SUCCEEDED;
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }

            log.error("{} - topic: {} - key: {} - error: {}",
                    ErrorKind.HANDLER_FAILED, message.getTopic(), message.getKeyAsString(), e.toString(), e);

            return reroute(message, context, e);
        }
    }

    private DispatchOutcome reroute(
            final BrokerMessage message,
            final CorrelationContext context,
            final Exception failure
    ) throws TransportException {
        final String key = message.getKeyAsString();
        final TopicName nextTopic;

        try {
            final Optional<TopicName> candidate = topicNamer.next(TopicName.parse(message.getTopic()), retryMaxTimes);

            if (candidate.isEmpty()) {
                log.error("exhausted - topic: {} - key: {} - no further routing", message.getTopic(), key);
                return DispatchOutcome.EXHAUSTED;
            } else {
                nextTopic = candidate.get();
            }
        } catch (MalformedTopicException e) {
            log.error("{} - topic: {} - key: {} - error: {}",
                    ErrorKind.MALFORMED_TOPIC, message.getTopic(), key, e.getMessage());
            return DispatchOutcome.EXHAUSTED;
        }

        final Envelope envelope;

        try {
            envelope = envelopeCodec.decode(message.getValue())
                    .withMetadata(ERROR_METADATA_KEY, failure.toString());
        } catch (EnvelopeDecodeException e) {
            // TODO: park undecodable values on the dead-letter topic as raw bytes instead of dropping them
            log.error("{} - topic: {} - key: {} - bytes: {} - error: {}",
                    ErrorKind.ENVELOPE_INVALID,
                    message.getTopic(),
                    key,
                    message.getValue() == null ? 0 : message.getValue().length,
                    e.getMessage());
            return DispatchOutcome.UNDECODABLE;
        }

        if (nextTopic.getShape() == TopicShape.DEAD_LETTER) {
            log.warn("dead-letter - topic: {} - key: {} - destination: {}", message.getTopic(), key, nextTopic);
        } else {
            log.info("retry - topic: {} - key: {} - wait: {}", nextTopic, key, retryDelay);
        }

        pause();

        // blocking client calls fail fast on a set interrupt flag; it is restored once the message is done
        final boolean interrupted = Thread.interrupted();

        try {
            brokerRepository.produce(
                    nextTopic.value(),
                    message.getKey(),
                    envelope.data(),
                    envelope.metadata(),
                    context
            );
        } catch (TransportException e) {
            log.error("{} - topic: {} - key: {} - destination: {}",
                    ErrorKind.PUBLISH_FAILED, message.getTopic(), key, nextTopic, e);
            throw e;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        return DispatchOutcome.REROUTED;
    }

    private void commit(final BrokerMessage message) throws TransportException {
        final boolean interrupted = Thread.interrupted();

        try {
            adapter.commit(message);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void pause() {
        if (retryDelay.isZero() || retryDelay.isNegative() || Thread.currentThread().isInterrupted()) {
            return;
        }

        try {
            Thread.sleep(retryDelay.toMillis());
        } catch (InterruptedException e) {
            // forward without the remaining delay; the consume loop sees the flag after the commit and stops
            Thread.currentThread().interrupt();
        }
    }
}
