package com.indigententerprises.applications.retryhub.serviceimplementations;

import com.indigententerprises.applications.brokercore.domain.BrokerMessage;
import com.indigententerprises.applications.brokercore.domain.CorrelationContext;
import com.indigententerprises.applications.brokercore.domain.Envelope;
import com.indigententerprises.applications.brokercore.serviceimplementations.BrokerRepository;
import com.indigententerprises.applications.brokercore.serviceimplementations.EnvelopeCodec;
import com.indigententerprises.applications.brokercore.serviceinterfaces.EnvelopeDecodeException;
import com.indigententerprises.applications.brokercore.serviceinterfaces.MessageHandler;
import com.indigententerprises.applications.brokercore.serviceinterfaces.TransportException;

/**
 * forwards the payload of every consumed envelope to the offramp topic, keeping its key,
 * its metadata trail and its correlation id. a failed forward is retried through the
 * retry topics like any other handler failure.
 */
public final class OfframpRelayHandler implements MessageHandler {

    private final EnvelopeCodec envelopeCodec;
    private final BrokerRepository brokerRepository;
    private final String offrampTopic;

    public OfframpRelayHandler(
            final EnvelopeCodec envelopeCodec,
            final BrokerRepository brokerRepository,
            final String offrampTopic
    ) {
        this.envelopeCodec = envelopeCodec;
        this.brokerRepository = brokerRepository;
        this.offrampTopic = offrampTopic;
    }

    @Override
    public void handle(
            final BrokerMessage message,
            final CorrelationContext context
    ) throws EnvelopeDecodeException, TransportException {
        final Envelope envelope = envelopeCodec.decode(message.getValue());

        brokerRepository.produce(
                offrampTopic,
                message.getKey(),
                envelope.data(),
                envelope.metadata(),
                context
        );
    }
}
