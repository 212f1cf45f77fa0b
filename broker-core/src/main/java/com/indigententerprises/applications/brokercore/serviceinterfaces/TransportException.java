package com.indigententerprises.applications.brokercore.serviceinterfaces;

public class TransportException extends Exception {
    public TransportException(final String message) {
        super(message);
    }

    public TransportException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
