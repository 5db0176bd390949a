package io.conductor.output;

public enum EventKind {
    SESSION_START,
    TEXT,
    TOOL_CALL,
    TOOL_RESULT,
    RESULT,
    /** Valid JSON whose shape no decoder rule recognizes. */
    UNKNOWN,
    /** Line that is not JSON at all; {@code text} holds it verbatim. */
    UNPARSABLE
}
