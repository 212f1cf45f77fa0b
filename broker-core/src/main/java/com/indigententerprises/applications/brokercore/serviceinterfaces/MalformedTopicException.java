package com.indigententerprises.applications.brokercore.serviceinterfaces;

public class MalformedTopicException extends Exception {
    public MalformedTopicException(final String message) {
        super(message);
    }

    public MalformedTopicException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
