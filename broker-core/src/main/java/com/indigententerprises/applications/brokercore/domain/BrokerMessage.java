package com.indigententerprises.applications.brokercore.domain;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * a record pulled from the transport, independent of the client library that delivered it.
 */
public final class BrokerMessage {
    private final String topic;
    private final int partition;
    private final long offset;
    private final byte[] key;
    private final byte[] value;
    private final List<MessageHeader> headers;

    public BrokerMessage(
            final String topic,
            final int partition,
            final long offset,
            final byte[] key,
            final byte[] value,
            final List<MessageHeader> headers
    ) {
        this.topic = topic;
        this.partition = partition;
        this.offset = offset;
        this.key = key;
        this.value = value;
        this.headers = headers == null ? List.of() : List.copyOf(headers);
    }

    public String getTopic() { return topic; }
    public int getPartition() { return partition; }
    public long getOffset() { return offset; }
    public byte[] getKey() { return key; }
    public byte[] getValue() { return value; }
    public List<MessageHeader> getHeaders() { return headers; }

    /**
     * key rendered for log lines.
     */
    public String getKeyAsString() {
        return keyAsString(key);
    }

    public static String keyAsString(final byte[] key) {
        return key == null ? null : new String(key, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return topic + "-" + partition + "@" + offset;
    }
}
