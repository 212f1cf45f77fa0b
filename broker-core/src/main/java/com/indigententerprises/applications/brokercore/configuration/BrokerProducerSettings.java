package com.indigententerprises.applications.brokercore.configuration;

import com.indigententerprises.applications.brokercore.domain.BrokerAcks;

import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.serialization.ByteArraySerializer;

import java.util.Objects;
import java.util.Properties;

public final class BrokerProducerSettings {

    private final BrokerSettings brokerSettings;
    private final BrokerAcks acks;
    private final int connectionsMaxIdleMs;

    private BrokerProducerSettings(final Builder builder) {
        this.brokerSettings = builder.brokerSettings;
        this.acks = builder.acks;
        this.connectionsMaxIdleMs = builder.connectionsMaxIdleMs;
    }

    public static Builder builder(final BrokerSettings brokerSettings) {
        return new Builder(brokerSettings);
    }

    public BrokerSettings getBrokerSettings() { return brokerSettings; }
    public BrokerAcks getAcks() { return acks; }
    public int getConnectionsMaxIdleMs() { return connectionsMaxIdleMs; }

    public Properties toProperties() {
        final Properties props = brokerSettings.toProperties();
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, acks.getConfigValue());
        // idempotence needs acks=all
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, String.valueOf(acks == BrokerAcks.ALL));
        props.put(ProducerConfig.CONNECTIONS_MAX_IDLE_MS_CONFIG, String.valueOf(connectionsMaxIdleMs));
        return props;
    }

    public static final class Builder {
        private final BrokerSettings brokerSettings;
        private BrokerAcks acks = BrokerAcks.ALL;
        private int connectionsMaxIdleMs = 10_000;

        private Builder(final BrokerSettings brokerSettings) {
            this.brokerSettings = Objects.requireNonNull(brokerSettings, "brokerSettings");
        }

        public Builder acks(final BrokerAcks acks) {
            this.acks = Objects.requireNonNull(acks, "acks");
            return this;
        }

        public Builder connectionsMaxIdleMs(final int connectionsMaxIdleMs) {
            this.connectionsMaxIdleMs = connectionsMaxIdleMs;
            return this;
        }

        public BrokerProducerSettings build() {
            if (connectionsMaxIdleMs <= 0) {
                throw new IllegalArgumentException("connections max idle ms must be positive: " + connectionsMaxIdleMs);
            } else {
                return new BrokerProducerSettings(this);
            }
        }
    }
}
