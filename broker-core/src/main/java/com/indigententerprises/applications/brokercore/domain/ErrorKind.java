package com.indigententerprises.applications.brokercore.domain;

public enum ErrorKind {
    HANDLER_FAILED,
    MALFORMED_TOPIC,
    ENVELOPE_INVALID,
    PUBLISH_FAILED
}
