package com.indigententerprises.applications.brokercore.configuration;

import org.apache.kafka.clients.CommonClientConfigs;

import java.util.Properties;

/**
 * connection settings shared by the consumer and the producer side.
 */
public final class BrokerSettings {

    public static final int DEFAULT_REQUEST_TIMEOUT_MS = 5000;

    private final String bootstrapServers;
    private final int requestTimeoutMs;

    public BrokerSettings(final String bootstrapServers, final int requestTimeoutMs) {
        if (bootstrapServers == null || bootstrapServers.isBlank()) {
            throw new IllegalArgumentException("bootstrap servers are required");
        } else if (requestTimeoutMs <= 0) {
            throw new IllegalArgumentException("request timeout must be positive: " + requestTimeoutMs);
        }

        this.bootstrapServers = bootstrapServers;
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public BrokerSettings(final String bootstrapServers) {
        this(bootstrapServers, DEFAULT_REQUEST_TIMEOUT_MS);
    }

    public String getBootstrapServers() { return bootstrapServers; }
    public int getRequestTimeoutMs() { return requestTimeoutMs; }

    Properties toProperties() {
        final Properties props = new Properties();
        props.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(CommonClientConfigs.REQUEST_TIMEOUT_MS_CONFIG, String.valueOf(requestTimeoutMs));
        return props;
    }
}
