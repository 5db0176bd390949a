package io.conductor.lifecycle;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ReportOutcome {
    /** The terminal state was written by this report. */
    RECORDED,
    /** The task had already reached a terminal state; nothing changed. */
    ALREADY_TERMINAL,
    NOT_FOUND,
    /** The ledger was unreachable; the report waits in the pending-report queue. */
    QUEUED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
