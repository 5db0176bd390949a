package io.conductor.storage;

public enum TransitionOutcome {
    APPLIED,
    NOT_FOUND,
    ALREADY_TERMINAL,
    /**
     * The record is still running but the update's precondition (such as age) did not hold.
     */
    NOT_ELIGIBLE
}
