package com.indigententerprises.applications.brokercore.infrastructure;

import com.indigententerprises.applications.brokercore.domain.BrokerMessage;
import com.indigententerprises.applications.brokercore.domain.MessageHeader;
import com.indigententerprises.applications.brokercore.serviceimplementations.CorrelationPropagator;
import com.indigententerprises.applications.brokercore.serviceinterfaces.TransportException;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.apache.kafka.common.serialization.ByteArraySerializer;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class KafkaBrokerAdapterTest {

    private static final TopicPartition ORDERS_0 = new TopicPartition("ORDERS", 0);

    private MockConsumer<byte[], byte[]> consumer;
    private MockProducer<byte[], byte[]> producer;
    private KafkaBrokerAdapter systemUnderTest;

    @BeforeEach
    public void setUp() throws TransportException {
        consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        producer = new MockProducer<>(true, new ByteArraySerializer(), new ByteArraySerializer());
        systemUnderTest = new KafkaBrokerAdapter(consumer, producer, List.of("ORDERS", "ORDERS-DLQ"), 1_000L);

        systemUnderTest.connect();
        consumer.rebalance(List.of(ORDERS_0));
        consumer.updateBeginningOffsets(Map.of(ORDERS_0, 0L));
    }

    private static byte[] bytes(final String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testConnectSubscribesToAllTopics() {
        Assertions.assertEquals(Set.of("ORDERS", "ORDERS-DLQ"), consumer.subscription());
    }

    @Test
    public void testConsumeMapsRecordsWithHeaders() throws TransportException {
        final ConsumerRecord<byte[], byte[]> record = new ConsumerRecord<>("ORDERS", 0, 0L, bytes("key"), bytes("{}"));
        record.headers().add(new RecordHeader(CorrelationPropagator.CORRELATION_ID_HEADER, bytes("abc")));
        consumer.addRecord(record);

        final List<BrokerMessage> messages = systemUnderTest.consume(Duration.ofMillis(10));

        Assertions.assertEquals(1, messages.size());
        final BrokerMessage message = messages.get(0);
        Assertions.assertEquals("ORDERS", message.getTopic());
        Assertions.assertEquals(0, message.getPartition());
        Assertions.assertEquals(0L, message.getOffset());
        Assertions.assertEquals("key", message.getKeyAsString());
        Assertions.assertArrayEquals(bytes("{}"), message.getValue());
        Assertions.assertEquals(
                List.of(MessageHeader.utf8(CorrelationPropagator.CORRELATION_ID_HEADER, "abc")),
                message.getHeaders()
        );
    }

    @Test
    public void testCommitStoresNextOffset() throws TransportException {
        consumer.addRecord(new ConsumerRecord<>("ORDERS", 0, 0L, bytes("a"), bytes("{}")));
        consumer.addRecord(new ConsumerRecord<>("ORDERS", 0, 1L, bytes("b"), bytes("{}")));

        final List<BrokerMessage> messages = systemUnderTest.consume(Duration.ofMillis(10));
        systemUnderTest.commit(messages.get(0));

        final Map<TopicPartition, OffsetAndMetadata> committed = consumer.committed(Set.of(ORDERS_0));
        Assertions.assertEquals(1L, committed.get(ORDERS_0).offset());

        systemUnderTest.commit(messages.get(1));
        Assertions.assertEquals(2L, consumer.committed(Set.of(ORDERS_0)).get(ORDERS_0).offset());
    }

    @Test
    public void testProduceSendsKeyValueAndHeaders() throws TransportException {
        systemUnderTest.produce(
                "ORDERS-RETRY-1",
                bytes("key"),
                bytes("{\"data\":{}}"),
                List.of(MessageHeader.utf8(CorrelationPropagator.CORRELATION_ID_HEADER, "abc"))
        );

        Assertions.assertEquals(1, producer.history().size());
        final ProducerRecord<byte[], byte[]> record = producer.history().get(0);
        Assertions.assertEquals("ORDERS-RETRY-1", record.topic());
        Assertions.assertArrayEquals(bytes("key"), record.key());
        Assertions.assertArrayEquals(bytes("{\"data\":{}}"), record.value());
        Assertions.assertArrayEquals(
                bytes("abc"),
                record.headers().lastHeader(CorrelationPropagator.CORRELATION_ID_HEADER).value()
        );
    }

    @Test
    public void testProduceWithoutAckFails() {
        final MockProducer<byte[], byte[]> silentProducer =
                new MockProducer<>(false, new ByteArraySerializer(), new ByteArraySerializer());
        final KafkaBrokerAdapter adapter = new KafkaBrokerAdapter(consumer, silentProducer, List.of("ORDERS"), 20L);

        Assertions.assertThrows(
                TransportException.class,
                () -> adapter.produce("ORDERS-RETRY-1", bytes("key"), bytes("{}"), List.of())
        );
    }

    @Test
    public void testWakeupEndsPollWithEmptyBatch() throws TransportException {
        consumer.addRecord(new ConsumerRecord<>("ORDERS", 0, 0L, bytes("a"), bytes("{}")));
        systemUnderTest.wakeup();

        Assertions.assertTrue(systemUnderTest.consume(Duration.ofMillis(10)).isEmpty());
    }

    @Test
    public void testPollFailureIsTransportException() {
        consumer.setPollException(new KafkaException("broker unavailable"));

        Assertions.assertThrows(TransportException.class, () -> systemUnderTest.consume(Duration.ofMillis(10)));
    }

    @Test
    public void testDisconnectClosesClients() {
        systemUnderTest.disconnect();

        Assertions.assertTrue(consumer.closed());
        Assertions.assertTrue(producer.closed());
    }
}
