package com.indigententerprises.applications.brokercore.serviceinterfaces;

import com.indigententerprises.applications.brokercore.domain.BrokerMessage;
import com.indigententerprises.applications.brokercore.domain.MessageHeader;

import java.time.Duration;
import java.util.List;

/**
 * the pub/sub transport as seen by the retry engine. implementations own their client
 * connections; callers never use one adapter from more than one thread.
 */
public interface BrokerAdapter {

    void connect() throws TransportException;

    void disconnect();

    /**
     * blocks until the transport acknowledges the write.
     */
    void produce(
            final String topic,
            final byte[] key,
            final byte[] value,
            final List<MessageHeader> headers
    ) throws TransportException;

    /**
     * next batch of messages, possibly empty when nothing arrived within the timeout.
     */
    List<BrokerMessage> consume(final Duration timeout) throws TransportException;

    /**
     * marks the message and everything before it on its partition as processed.
     */
    void commit(final BrokerMessage message) throws TransportException;

    /**
     * interrupts a blocking {@link #consume(Duration)} from another thread.
     */
    void wakeup();
}
