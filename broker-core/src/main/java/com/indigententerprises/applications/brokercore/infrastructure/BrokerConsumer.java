package com.indigententerprises.applications.brokercore.infrastructure;

import com.indigententerprises.applications.brokercore.domain.BrokerMessage;
import com.indigententerprises.applications.brokercore.serviceimplementations.RetryDispatcher;
import com.indigententerprises.applications.brokercore.serviceinterfaces.BrokerAdapter;
import com.indigententerprises.applications.brokercore.serviceinterfaces.MessageHandler;
import com.indigententerprises.applications.brokercore.serviceinterfaces.TransportException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;

/**
 * the consume loop of one consumer instance: messages are handled and committed strictly
 * one after another, in the order the transport delivers them.
 */
public final class BrokerConsumer {

    private static final Logger log = LoggerFactory.getLogger(BrokerConsumer.class);

    private final BrokerAdapter adapter;
    private final RetryDispatcher dispatcher;
    private final Duration pollTimeout;

    private volatile boolean running = true;

    public BrokerConsumer(
            final BrokerAdapter adapter,
            final RetryDispatcher dispatcher,
            final Duration pollTimeout
    ) {
        this.adapter = adapter;
        this.dispatcher = dispatcher;
        this.pollTimeout = pollTimeout;
    }

    /**
     * runs until {@link #shutdown()} is called, the thread is interrupted or the transport fails.
     * handler failures never end the loop. a consumer runs once; it cannot be restarted.
     */
    public void consume(final MessageHandler handler) throws TransportException {
        adapter.connect();

        try {
            while (isActive()) {
                final List<BrokerMessage> messages = adapter.consume(pollTimeout);

                for (final BrokerMessage message : messages) {
                    if (!isActive()) {
                        // uncommitted remainder is delivered again after the rebalance
                        break;
                    }

                    dispatcher.dispatch(message, handler);
                }
            }
        } finally {
            running = false;
            adapter.disconnect();
            log.info("consumer stopped");
        }
    }

    public void shutdown() {
        running = false;
        adapter.wakeup();
    }

    public boolean isRunning() {
        return running;
    }

    private boolean isActive() {
        return running && !Thread.currentThread().isInterrupted();
    }
}
