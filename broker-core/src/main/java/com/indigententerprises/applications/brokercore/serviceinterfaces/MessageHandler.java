package com.indigententerprises.applications.brokercore.serviceinterfaces;

import com.indigententerprises.applications.brokercore.domain.BrokerMessage;
import com.indigententerprises.applications.brokercore.domain.CorrelationContext;

/**
 * user code invoked once per consumed message. returning normally means the message was
 * handled; throwing sends it down the retry chain. the context must be handed to any
 * produce call made while handling so the trace survives the hop.
 */
@FunctionalInterface
public interface MessageHandler {
    void handle(BrokerMessage message, CorrelationContext context) throws Exception;
}
