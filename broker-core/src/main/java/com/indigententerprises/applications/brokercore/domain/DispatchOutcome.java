package com.indigententerprises.applications.brokercore.domain;

/**
 * terminal state of one consumed message. every outcome is committed.
 */
public enum DispatchOutcome {
    SUCCEEDED,
    REROUTED,
    EXHAUSTED,
    UNDECODABLE
}
