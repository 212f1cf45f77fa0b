package com.indigententerprises.applications.brokercore.domain;

import java.util.Objects;
import java.util.Optional;

/**
 * the trace identifier bound to one message's processing cycle. passed by value from the
 * point of receipt down to every produce call made on behalf of that message.
 */
public final class CorrelationContext {
    private static final CorrelationContext EMPTY = new CorrelationContext(null);

    private final String correlationId;

    private CorrelationContext(final String correlationId) {
        this.correlationId = correlationId;
    }

    public static CorrelationContext empty() {
        return EMPTY;
    }

    public static CorrelationContext of(final String correlationId) {
        return new CorrelationContext(Objects.requireNonNull(correlationId, "correlationId"));
    }

    public Optional<String> getCorrelationId() {
        return Optional.ofNullable(correlationId);
    }

    public boolean isPresent() {
        return correlationId != null;
    }

    @Override
    public boolean equals(final Object o) {
        return o instanceof CorrelationContext
                && Objects.equals(correlationId, ((CorrelationContext) o).correlationId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(correlationId);
    }

    @Override
    public String toString() {
        return "CorrelationContext[" + (correlationId == null ? "" : correlationId) + "]";
    }
}
