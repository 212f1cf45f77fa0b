package com.indigententerprises.applications.brokercore.configuration;

import com.indigententerprises.applications.brokercore.domain.TopicName;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.regex.Pattern;

/**
 * consumer group settings. the configured topics are base topics; the retry and dead-letter
 * topics derived from them are subscribed as well so failed messages come back through the
 * same consumer.
 */
public final class BrokerConsumerSettings {

    public static final Pattern TOPIC_PATTERN = Pattern.compile("^[A-Za-z.-]+$");
    public static final int HEARTBEATS_PER_SESSION = 4;
    public static final int MAX_RETRY_MAX_TIMES = 3;

    private final BrokerSettings brokerSettings;
    private final String topics;
    private final String groupId;
    private final boolean enableAutoCommit;
    private final int maxPollRecords;
    private final int maxPollIntervalMs;
    private final int heartbeatIntervalMs;
    private final int sessionTimeoutMs;
    private final int retryMaxTimes;

    private BrokerConsumerSettings(final Builder builder) {
        this.brokerSettings = builder.brokerSettings;
        this.topics = builder.topics;
        this.groupId = builder.groupId;
        this.enableAutoCommit = builder.enableAutoCommit;
        this.maxPollRecords = builder.maxPollRecords;
        this.maxPollIntervalMs = builder.maxPollIntervalMs;
        this.heartbeatIntervalMs = builder.heartbeatIntervalMs;
        this.sessionTimeoutMs = builder.sessionTimeoutMs;
        this.retryMaxTimes = builder.retryMaxTimes;
    }

    public static Builder builder(final BrokerSettings brokerSettings) {
        return new Builder(brokerSettings);
    }

    public BrokerSettings getBrokerSettings() { return brokerSettings; }
    public String getTopics() { return topics; }
    public String getGroupId() { return groupId; }
    public boolean isEnableAutoCommit() { return enableAutoCommit; }
    public int getMaxPollRecords() { return maxPollRecords; }
    public int getMaxPollIntervalMs() { return maxPollIntervalMs; }
    public int getHeartbeatIntervalMs() { return heartbeatIntervalMs; }
    public int getSessionTimeoutMs() { return sessionTimeoutMs; }
    public int getRetryMaxTimes() { return retryMaxTimes; }

    public List<String> baseTopics() {
        return parseTopics(topics);
    }

    public List<String> deadLetterTopics() {
        final List<String> result = new ArrayList<>();

        for (final String topic : baseTopics()) {
            result.add(TopicName.deadLetter(topic).value());
        }

        return result;
    }

    public List<String> retryTopics() {
        final List<String> result = new ArrayList<>();

        for (final String topic : baseTopics()) {
            for (int attempt = 1; attempt <= retryMaxTimes; attempt++) {
                result.add(TopicName.retry(topic, attempt).value());
            }
        }

        return result;
    }

    /**
     * base topics, then their dead-letter topics, then the retry topics of each base topic.
     */
    public List<String> subscriptionTopics() {
        final List<String> result = new ArrayList<>(baseTopics());
        result.addAll(deadLetterTopics());
        result.addAll(retryTopics());
        return Collections.unmodifiableList(result);
    }

    public Properties toProperties() {
        final Properties props = brokerSettings.toProperties();
        props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, String.valueOf(enableAutoCommit));
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, String.valueOf(maxPollRecords));
        props.put(ConsumerConfig.MAX_POLL_INTERVAL_MS_CONFIG, String.valueOf(maxPollIntervalMs));
        props.put(ConsumerConfig.HEARTBEAT_INTERVAL_MS_CONFIG, String.valueOf(heartbeatIntervalMs));
        props.put(ConsumerConfig.SESSION_TIMEOUT_MS_CONFIG, String.valueOf(sessionTimeoutMs));
        return props;
    }

    static List<String> parseTopics(final String topics) {
        final List<String> result = new ArrayList<>();

        for (final String topic : topics.split(",")) {
            result.add(topic.trim());
        }

        return result;
    }

    public static final class Builder {
        private final BrokerSettings brokerSettings;
        private String topics;
        private String groupId;
        private boolean enableAutoCommit = false;
        private int maxPollRecords = 100;
        private int maxPollIntervalMs = 5 * 60 * 1000;
        private int heartbeatIntervalMs = 15 * 1000;
        private int sessionTimeoutMs = 90 * 1000;
        private int retryMaxTimes = 0;

        private Builder(final BrokerSettings brokerSettings) {
            this.brokerSettings = Objects.requireNonNull(brokerSettings, "brokerSettings");
        }

        public Builder topics(final String topics) {
            this.topics = topics;
            return this;
        }

        public Builder groupId(final String groupId) {
            this.groupId = groupId;
            return this;
        }

        public Builder enableAutoCommit(final boolean enableAutoCommit) {
            this.enableAutoCommit = enableAutoCommit;
            return this;
        }

        public Builder maxPollRecords(final int maxPollRecords) {
            this.maxPollRecords = maxPollRecords;
            return this;
        }

        public Builder maxPollIntervalMs(final int maxPollIntervalMs) {
            this.maxPollIntervalMs = maxPollIntervalMs;
            return this;
        }

        public Builder heartbeatIntervalMs(final int heartbeatIntervalMs) {
            this.heartbeatIntervalMs = heartbeatIntervalMs;
            return this;
        }

        public Builder sessionTimeoutMs(final int sessionTimeoutMs) {
            this.sessionTimeoutMs = sessionTimeoutMs;
            return this;
        }

        public Builder retryMaxTimes(final int retryMaxTimes) {
            this.retryMaxTimes = retryMaxTimes;
            return this;
        }

        public BrokerConsumerSettings build() throws IllegalArgumentException {
            if (topics == null || topics.isBlank()) {
                throw new IllegalArgumentException("topics are required");
            } else if (groupId == null || groupId.isBlank()) {
                throw new IllegalArgumentException("group id is required");
            } else if (maxPollRecords < 1 || maxPollRecords > 500) {
                throw new IllegalArgumentException("max poll records must be between 1 and 500: " + maxPollRecords);
            } else if (retryMaxTimes < 0 || retryMaxTimes > MAX_RETRY_MAX_TIMES) {
                throw new IllegalArgumentException(
                        "retry max times must be between 0 and " + MAX_RETRY_MAX_TIMES + ": " + retryMaxTimes);
            } else if (heartbeatIntervalMs <= 0 || sessionTimeoutMs <= 0) {
                throw new IllegalArgumentException("heartbeat interval and session timeout must be positive");
            } else if (maxPollIntervalMs < sessionTimeoutMs) {
                throw new IllegalArgumentException("max poll interval must be greater than session timeout");
            } else if (sessionTimeoutMs / heartbeatIntervalMs < HEARTBEATS_PER_SESSION) {
                throw new IllegalArgumentException(
                        "heartbeats per session must be greater than or equal to " + HEARTBEATS_PER_SESSION);
            }

            for (final String topic : parseTopics(topics)) {
                validateTopic(topic);
            }

            return new BrokerConsumerSettings(this);
        }

        private static void validateTopic(final String topic) {
            if (!TOPIC_PATTERN.matcher(topic).matches()) {
                throw new IllegalArgumentException(
                        "topic '" + topic + "' must contain only letters, dots and hyphens, pattern: "
                                + TOPIC_PATTERN.pattern());
            } else if (topic.contains(TopicName.RETRY_MARKER) || topic.endsWith(TopicName.DEAD_LETTER_MARKER)) {
                throw new IllegalArgumentException("topic '" + topic + "' must be a base topic, not a retry or dead-letter topic");
            }
        }
    }
}
