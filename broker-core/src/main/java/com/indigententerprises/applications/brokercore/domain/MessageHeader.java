package com.indigententerprises.applications.brokercore.domain;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

public final class MessageHeader {
    private final String name;
    private final byte[] value;

    public MessageHeader(final String name, final byte[] value) {
        this.name = Objects.requireNonNull(name, "name");
        this.value = value == null ? null : value.clone();
    }

    public static MessageHeader utf8(final String name, final String value) {
        return new MessageHeader(name, value.getBytes(StandardCharsets.UTF_8));
    }

    public String getName() { return name; }
    public byte[] getValue() { return value == null ? null : value.clone(); }

    public String getValueAsString() {
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        } else if (!(o instanceof MessageHeader)) {
            return false;
        } else {
            final MessageHeader other = (MessageHeader) o;
            return name.equals(other.name) && Arrays.equals(value, other.value);
        }
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return name + "=" + getValueAsString();
    }
}
