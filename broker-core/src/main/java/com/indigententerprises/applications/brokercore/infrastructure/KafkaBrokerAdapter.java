package com.indigententerprises.applications.brokercore.infrastructure;

import com.indigententerprises.applications.brokercore.configuration.BrokerConsumerSettings;
import com.indigententerprises.applications.brokercore.configuration.BrokerProducerSettings;
import com.indigententerprises.applications.brokercore.domain.BrokerMessage;
import com.indigententerprises.applications.brokercore.domain.MessageHeader;
import com.indigententerprises.applications.brokercore.serviceinterfaces.BrokerAdapter;
import com.indigententerprises.applications.brokercore.serviceinterfaces.TransportException;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.internals.RecordHeader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class KafkaBrokerAdapter implements BrokerAdapter {

    private static final Logger log = LoggerFactory.getLogger(KafkaBrokerAdapter.class);

    private final Consumer<byte[], byte[]> consumer;
    private final Producer<byte[], byte[]> producer;
    private final List<String> topics;
    private final long produceTimeoutMs;

    public KafkaBrokerAdapter(
            final Consumer<byte[], byte[]> consumer,
            final Producer<byte[], byte[]> producer,
            final List<String> topics,
            final long produceTimeoutMs
    ) {
        this.consumer = consumer;
        this.producer = producer;
        this.topics = List.copyOf(topics);
        this.produceTimeoutMs = produceTimeoutMs;
    }

    public static KafkaBrokerAdapter create(
            final BrokerConsumerSettings consumerSettings,
            final BrokerProducerSettings producerSettings,
            final long produceTimeoutMs
    ) {
        return new KafkaBrokerAdapter(
                new KafkaConsumer<>(consumerSettings.toProperties()),
                new KafkaProducer<>(producerSettings.toProperties()),
                consumerSettings.subscriptionTopics(),
                produceTimeoutMs
        );
    }

    @Override
    public void connect() throws TransportException {
        try {
            consumer.subscribe(topics);
            log.info("subscribed - topics: {}", topics);
        } catch (KafkaException e) {
            throw new TransportException("unable to subscribe to " + topics, e);
        }
    }

    @Override
    public void disconnect() {
        try {
            producer.flush();
            producer.close();
        } catch (KafkaException e) {
            log.error("error closing producer", e);
        }

        try {
            consumer.close();
        } catch (KafkaException e) {
            log.error("error closing consumer", e);
        }
    }

    @Override
    public void produce(
            final String topic,
            final byte[] key,
            final byte[] value,
            final List<MessageHeader> headers
    ) throws TransportException {
        final List<Header> recordHeaders = new ArrayList<>(headers.size());

        for (final MessageHeader header : headers) {
            recordHeaders.add(new RecordHeader(header.getName(), header.getValue()));
        }

        final ProducerRecord<byte[], byte[]> record = new ProducerRecord<>(topic, null, key, value, recordHeaders);

        try {
            // wait for the ack: the source message is committed right after this returns
            producer.send(record).get(produceTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException | TimeoutException | KafkaException e) {
            throw new TransportException("unable to produce to " + topic, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("interrupted while producing to " + topic, e);
        }
    }

    @Override
    public List<BrokerMessage> consume(final Duration timeout) throws TransportException {
        final ConsumerRecords<byte[], byte[]> records;

        try {
            records = consumer.poll(timeout);
        } catch (WakeupException ignored) {
            // shutdown
            return Collections.emptyList();
        } catch (KafkaException e) {
            throw new TransportException("unable to poll " + topics, e);
        }

        final List<BrokerMessage> result = new ArrayList<>(records.count());

        for (final ConsumerRecord<byte[], byte[]> record : records) {
            result.add(toMessage(record));
        }

        return result;
    }

    @Override
    public void commit(final BrokerMessage message) throws TransportException {
        final TopicPartition tp = new TopicPartition(message.getTopic(), message.getPartition());
        final OffsetAndMetadata next = new OffsetAndMetadata(message.getOffset() + 1);

        try {
            try {
                consumer.commitSync(Collections.singletonMap(tp, next));
            } catch (WakeupException e) {
                // a pending wakeup is consumed by the first blocking call; the commit still has to happen
                consumer.commitSync(Collections.singletonMap(tp, next));
            }
        } catch (KafkaException e) {
            throw new TransportException("unable to commit " + message, e);
        }
    }

    @Override
    public void wakeup() {
        consumer.wakeup();
    }

    static BrokerMessage toMessage(final ConsumerRecord<byte[], byte[]> record) {
        final List<MessageHeader> headers = new ArrayList<>();

        for (final Header header : record.headers()) {
            headers.add(new MessageHeader(header.key(), header.value()));
        }

        return new BrokerMessage(
                record.topic(),
                record.partition(),
                record.offset(),
                record.key(),
                record.value(),
                headers
        );
    }
}
