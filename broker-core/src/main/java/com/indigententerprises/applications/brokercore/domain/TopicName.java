package com.indigententerprises.applications.brokercore.domain;

import com.indigententerprises.applications.brokercore.serviceinterfaces.MalformedTopicException;

import java.util.Objects;

/**
 * a topic in one of its three routing shapes: {@code ORDERS}, {@code ORDERS-RETRY-2} or
 * {@code ORDERS-DLQ}. parsed once, then routed on the shape instead of the string.
 */
public final class TopicName {

    public static final String RETRY_MARKER = "-RETRY-";
    public static final String DEAD_LETTER_MARKER = "-DLQ";

    private final String baseName;
    private final TopicShape shape;
    private final int attempt;

    private TopicName(final String baseName, final TopicShape shape, final int attempt) {
        this.baseName = baseName;
        this.shape = shape;
        this.attempt = attempt;
    }

    public static TopicName base(final String baseName) {
        return new TopicName(requireBaseName(baseName), TopicShape.BASE, 0);
    }

    public static TopicName retry(final String baseName, final int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("retry attempt must be positive: " + attempt);
        } else {
            return new TopicName(requireBaseName(baseName), TopicShape.RETRY, attempt);
        }
    }

    public static TopicName deadLetter(final String baseName) {
        return new TopicName(requireBaseName(baseName), TopicShape.DEAD_LETTER, 0);
    }

    public static TopicName parse(final String topic) throws MalformedTopicException {
        if (topic == null || topic.isBlank()) {
            throw new MalformedTopicException("topic is empty");
        }

        if (topic.endsWith(DEAD_LETTER_MARKER) && topic.length() > DEAD_LETTER_MARKER.length()) {
            return deadLetter(topic.substring(0, topic.length() - DEAD_LETTER_MARKER.length()));
        }

        final int markerIndex = topic.indexOf(RETRY_MARKER);

        if (markerIndex == 0) {
            throw new MalformedTopicException("retry topic has no base name: " + topic);
        } else if (markerIndex > 0) {
            final String suffix = topic.substring(markerIndex + RETRY_MARKER.length());
            return retry(topic.substring(0, markerIndex), parseAttempt(topic, suffix));
        } else {
            return base(topic);
        }
    }

    private static int parseAttempt(final String topic, final String suffix) throws MalformedTopicException {
        if (suffix.isEmpty() || !suffix.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new MalformedTopicException("retry attempt is not a positive integer: " + topic);
        }

        try {
            final int attempt = Integer.parseInt(suffix);

            if (attempt < 1) {
                throw new MalformedTopicException("retry attempt is not a positive integer: " + topic);
            } else {
                return attempt;
            }
        } catch (NumberFormatException e) {
            throw new MalformedTopicException("retry attempt out of range: " + topic, e);
        }
    }

    private static String requireBaseName(final String baseName) {
        if (baseName == null || baseName.isEmpty()) {
            throw new IllegalArgumentException("base topic name is empty");
        } else {
            return baseName;
        }
    }

    public String getBaseName() { return baseName; }
    public TopicShape getShape() { return shape; }

    /**
     * retry attempt for {@link TopicShape#RETRY}, zero otherwise.
     */
    public int getAttempt() { return attempt; }

    public String value() {
        switch (shape) {
            case RETRY:
                return baseName + RETRY_MARKER + attempt;
            case DEAD_LETTER:
                return baseName + DEAD_LETTER_MARKER;
            default:
                return baseName;
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        } else if (!(o instanceof TopicName)) {
            return false;
        } else {
            final TopicName other = (TopicName) o;
            return attempt == other.attempt && shape == other.shape && baseName.equals(other.baseName);
        }
    }

    @Override
    public int hashCode() {
        return Objects.hash(baseName, shape, attempt);
    }

    @Override
    public String toString() {
        return value();
    }
}
