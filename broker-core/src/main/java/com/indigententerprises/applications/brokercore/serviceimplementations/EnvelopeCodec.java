package com.indigententerprises.applications.brokercore.serviceimplementations;

import com.indigententerprises.applications.brokercore.domain.Envelope;
import com.indigententerprises.applications.brokercore.serviceinterfaces.EnvelopeDecodeException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

public final class EnvelopeCodec {

    public static final String DATA_FIELD = "data";
    public static final String METADATA_FIELD = "metadata";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public EnvelopeCodec(final ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public byte[] encode(final Map<String, Object> data, final Map<String, Object> metadata) {
        return encode(new Envelope(data, metadata));
    }

    public byte[] encode(final Envelope envelope) {
        try {
            return objectMapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("envelope is not serializable", e);
        }
    }

    /**
     * lenient: a missing or null {@code data} / {@code metadata} field decodes as an empty map,
     * so payloads from producers that do not wrap their messages can still be routed.
     */
    public Envelope decode(final byte[] value) throws EnvelopeDecodeException {
        if (value == null) {
            throw new EnvelopeDecodeException("message has no value");
        }

        final JsonNode root;

        try {
            root = objectMapper.readTree(value);
        } catch (IOException e) {
            throw new EnvelopeDecodeException("value is not valid json", e);
        }

        if (root == null || !root.isObject()) {
            throw new EnvelopeDecodeException("envelope is not a json object");
        } else {
            return new Envelope(field(root, DATA_FIELD), field(root, METADATA_FIELD));
        }
    }

    private Map<String, Object> field(final JsonNode root, final String name) throws EnvelopeDecodeException {
        final JsonNode node = root.get(name);

        if (node == null || node.isNull()) {
            return Collections.emptyMap();
        } else if (!node.isObject()) {
            throw new EnvelopeDecodeException("envelope field '" + name + "' is not an object");
        } else {
            return objectMapper.convertValue(node, MAP_TYPE);
        }
    }

    public static byte[] keyBytes(final String key) {
        return key == null ? null : key.getBytes(StandardCharsets.UTF_8);
    }

    public static byte[] keyBytes(final byte[] key) {
        return key;
    }
}
