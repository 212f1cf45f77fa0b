package com.indigententerprises.applications.brokercore.domain;

public enum BrokerAcks {
    ALL("all"),
    ONE("1"),
    ZERO("0");

    private final String configValue;

    BrokerAcks(final String configValue) {
        this.configValue = configValue;
    }

    public String getConfigValue() {
        return configValue;
    }

    public static BrokerAcks fromConfigValue(final String value) throws IllegalArgumentException {
        for (final BrokerAcks acks : values()) {
            if (acks.configValue.equalsIgnoreCase(value)) {
                return acks;
            }
        }

        throw new IllegalArgumentException("unsupported acks value: " + value);
    }
}
