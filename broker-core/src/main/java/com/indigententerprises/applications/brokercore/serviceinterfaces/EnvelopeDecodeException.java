package com.indigententerprises.applications.brokercore.serviceinterfaces;

public class EnvelopeDecodeException extends Exception {
    public EnvelopeDecodeException(final String message) {
        super(message);
    }

    public EnvelopeDecodeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
