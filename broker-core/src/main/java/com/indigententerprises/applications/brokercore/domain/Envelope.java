package com.indigententerprises.applications.brokercore.domain;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * wire form of every message in flight: the business payload plus the metadata trail
 * that grows by one entry per produced hop.
 */
@JsonPropertyOrder({"data", "metadata"})
public record Envelope(
        Map<String, Object> data,
        Map<String, Object> metadata
) {
    public Envelope {
        data = data == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        metadata = metadata == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * a new envelope with the same data and one extra (or replaced) metadata entry.
     */
    public Envelope withMetadata(final String key, final Object value) {
        final Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new Envelope(data, merged);
    }
}
