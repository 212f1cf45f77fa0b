package com.indigententerprises.applications.brokercore.infrastructure;

import com.indigententerprises.applications.brokercore.domain.BrokerMessage;
import com.indigententerprises.applications.brokercore.domain.CorrelationContext;
import com.indigententerprises.applications.brokercore.domain.Envelope;
import com.indigententerprises.applications.brokercore.domain.MessageHeader;
import com.indigententerprises.applications.brokercore.serviceimplementations.BrokerRepository;
import com.indigententerprises.applications.brokercore.serviceimplementations.CorrelationPropagator;
import com.indigententerprises.applications.brokercore.serviceimplementations.EnvelopeCodec;
import com.indigententerprises.applications.brokercore.serviceimplementations.RetryDispatcher;
import com.indigententerprises.applications.brokercore.serviceimplementations.TopicNamer;
import com.indigententerprises.applications.brokercore.serviceinterfaces.BrokerAdapter;
import com.indigententerprises.applications.brokercore.serviceinterfaces.MessageHandler;
import com.indigententerprises.applications.brokercore.serviceinterfaces.TransportException;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class BrokerConsumerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-08-13T12:00:00Z"), ZoneOffset.UTC);

    private final EnvelopeCodec envelopeCodec = new EnvelopeCodec(new ObjectMapper());
    private final CorrelationPropagator correlationPropagator = new CorrelationPropagator();

    @Test
    public void testAlwaysFailingMessageWalksTheWholeChainWhileOtherTrafficFlows() throws Exception {
        final RedeliveringBrokerAdapter adapter = new RedeliveringBrokerAdapter();
        final BrokerRepository brokerRepository =
                new BrokerRepository(adapter, envelopeCodec, correlationPropagator, CLOCK, null);
        final RetryDispatcher dispatcher = new RetryDispatcher(
                adapter, brokerRepository, new TopicNamer(), envelopeCodec, correlationPropagator, 3, Duration.ZERO);
        final BrokerConsumer systemUnderTest = new BrokerConsumer(adapter, dispatcher, Duration.ofMillis(1));
        adapter.stopWhenIdle(systemUnderTest);

        brokerRepository.produce("ORDERS", "order-42", Map.of("orderId", 42), null, CorrelationContext.of("abc"));
        brokerRepository.produce("PAYMENTS", "payment-7", Map.of("paymentId", 7), null, CorrelationContext.empty());

        final List<String> handled = new ArrayList<>();
        final MessageHandler handler = (message, context) -> {
            handled.add(message.getTopic());

            if (message.getTopic().startsWith("ORDERS")) {
                throw new IllegalStateException("order service unavailable");
            }
        };

        systemUnderTest.consume(handler);

        Assertions.assertEquals(
                List.of("ORDERS", "PAYMENTS", "ORDERS-RETRY-1", "ORDERS-RETRY-2", "ORDERS-RETRY-3", "ORDERS-DLQ"),
                handled
        );
        Assertions.assertEquals(
                List.of("ORDERS", "PAYMENTS", "ORDERS-RETRY-1", "ORDERS-RETRY-2", "ORDERS-RETRY-3", "ORDERS-DLQ"),
                adapter.producedTopics
        );
        // one commit per consumed message, in consumption order
        Assertions.assertEquals(adapter.consumedTopics, adapter.committedTopics);
        Assertions.assertEquals(handled, adapter.committedTopics);

        final BrokerMessage deadLetter = adapter.lastProduced;
        Assertions.assertEquals("ORDERS-DLQ", deadLetter.getTopic());
        Assertions.assertEquals(
                List.of(MessageHeader.utf8(CorrelationPropagator.CORRELATION_ID_HEADER, "abc")),
                deadLetter.getHeaders()
        );

        final Envelope envelope = envelopeCodec.decode(deadLetter.getValue());
        Assertions.assertEquals(Map.of("orderId", 42), envelope.data());
        Assertions.assertEquals(
                Set.of("orders", "orders-retry-1", "orders-retry-2", "orders-retry-3", "orders-dlq", "error"),
                envelope.metadata().keySet()
        );
        Assertions.assertEquals(
                "java.lang.IllegalStateException: order service unavailable",
                envelope.metadata().get("error")
        );
        Assertions.assertTrue(adapter.disconnected);
    }

    @Test
    public void testTransportFailurePropagatesAndDisconnects() throws Exception {
        final BrokerAdapter adapter = mock(BrokerAdapter.class);
        final RetryDispatcher dispatcher = mock(RetryDispatcher.class);
        when(adapter.consume(any())).thenThrow(new TransportException("broker unavailable"));

        final BrokerConsumer systemUnderTest = new BrokerConsumer(adapter, dispatcher, Duration.ofMillis(1));

        Assertions.assertThrows(TransportException.class, () -> systemUnderTest.consume((m, c) -> {}));
        verify(adapter).disconnect();
        Assertions.assertFalse(systemUnderTest.isRunning());
    }

    @Test
    public void testShutdownBeforeConsumeStopsImmediately() throws Exception {
        final BrokerAdapter adapter = mock(BrokerAdapter.class);
        final RetryDispatcher dispatcher = mock(RetryDispatcher.class);
        final BrokerConsumer systemUnderTest = new BrokerConsumer(adapter, dispatcher, Duration.ofMillis(1));

        systemUnderTest.shutdown();
        systemUnderTest.consume((m, c) -> {});

        verify(adapter).wakeup();
        verify(adapter).connect();
        verify(adapter, never()).consume(any());
        verify(adapter).disconnect();
    }

    /**
     * in-memory transport: every produced message is appended to the stream this consumer reads.
     */
    private static final class RedeliveringBrokerAdapter implements BrokerAdapter {
        private final Deque<BrokerMessage> pending = new ArrayDeque<>();
        private final List<String> producedTopics = new ArrayList<>();
        private final List<String> consumedTopics = new ArrayList<>();
        private final List<String> committedTopics = new ArrayList<>();
        private BrokerConsumer owner;
        private BrokerMessage lastProduced;
        private long offset;
        private boolean disconnected;

        void stopWhenIdle(final BrokerConsumer owner) {
            this.owner = owner;
        }

        @Override
        public void connect() {}

        @Override
        public void disconnect() {
            disconnected = true;
        }

        @Override
        public void produce(final String topic, final byte[] key, final byte[] value, final List<MessageHeader> headers) {
            lastProduced = new BrokerMessage(topic, 0, offset++, key, value, headers);
            pending.add(lastProduced);
            producedTopics.add(topic);
        }

        @Override
        public List<BrokerMessage> consume(final Duration timeout) {
            if (pending.isEmpty()) {
                owner.shutdown();
                return List.of();
            } else {
                final BrokerMessage next = pending.poll();
                consumedTopics.add(next.getTopic());
                return List.of(next);
            }
        }

        @Override
        public void commit(final BrokerMessage message) {
            committedTopics.add(message.getTopic());
        }

        @Override
        public void wakeup() {}
    }
}
