package com.indigententerprises.applications.brokercore.serviceimplementations;

import com.indigententerprises.applications.brokercore.domain.CorrelationContext;
import com.indigententerprises.applications.brokercore.domain.MessageHeader;

import java.util.List;
import java.util.UUID;

/**
 * moves the trace identifier between wire headers and the per-message {@link CorrelationContext}.
 */
public final class CorrelationPropagator {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";

    /**
     * first matching header wins.
     */
    public CorrelationContext extract(final List<MessageHeader> headers) {
        if (headers != null) {
            for (final MessageHeader header : headers) {
                if (CORRELATION_ID_HEADER.equals(header.getName()) && header.getValue() != null) {
                    return CorrelationContext.of(header.getValueAsString());
                }
            }
        }

        return CorrelationContext.empty();
    }

    public List<MessageHeader> headers(final CorrelationContext context) {
        if (context == null || !context.isPresent()) {
            return List.of();
        } else {
            return List.of(MessageHeader.utf8(CORRELATION_ID_HEADER, context.getCorrelationId().get()));
        }
    }

    /**
     * starts a new trace, for producers that originate messages rather than react to one.
     */
    public CorrelationContext create() {
        return CorrelationContext.of(UUID.randomUUID().toString());
    }
}
