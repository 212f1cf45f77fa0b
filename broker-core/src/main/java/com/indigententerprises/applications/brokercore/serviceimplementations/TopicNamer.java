package com.indigententerprises.applications.brokercore.serviceimplementations;

import com.indigententerprises.applications.brokercore.domain.TopicName;
import com.indigententerprises.applications.brokercore.serviceinterfaces.MalformedTopicException;

import java.util.Optional;

/**
 * computes where a failed message goes next.
 *
 * <pre>
 * ORDERS          -> ORDERS-RETRY-1   (ORDERS-DLQ when the budget is 0)
 * ORDERS-RETRY-n  -> ORDERS-RETRY-n+1 while n &lt; budget, else ORDERS-DLQ
 * ORDERS-DLQ      -> nothing
 * </pre>
 */
public final class TopicNamer {

    public Optional<String> nextTopic(final String topic, final int retryMaxTimes) throws MalformedTopicException {
        return next(TopicName.parse(topic), retryMaxTimes).map(TopicName::value);
    }

    /**
     * @return the next destination, or empty when the message is already dead-lettered
     */
    public Optional<TopicName> next(final TopicName current, final int retryMaxTimes) {
        if (retryMaxTimes < 0) {
            throw new IllegalArgumentException("retryMaxTimes must not be negative: " + retryMaxTimes);
        }

        final String baseName = current.getBaseName();

        switch (current.getShape()) {
            case BASE:
                if (retryMaxTimes == 0) {
                    return Optional.of(TopicName.deadLetter(baseName));
                } else {
                    return Optional.of(TopicName.retry(baseName, 1));
                }
            case RETRY:
                if (current.getAttempt() < retryMaxTimes) {
                    return Optional.of(TopicName.retry(baseName, current.getAttempt() + 1));
                } else {
                    return Optional.of(TopicName.deadLetter(baseName));
                }
            case DEAD_LETTER:
                return Optional.empty();
            default:
                throw new IllegalStateException("unknown topic shape: " + current.getShape());
        }
    }
}
