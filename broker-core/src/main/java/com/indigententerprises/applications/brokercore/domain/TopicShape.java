package com.indigententerprises.applications.brokercore.domain;

public enum TopicShape {
    BASE,
    RETRY,
    DEAD_LETTER
}
