package io.conductor.output;

public enum CommandType {
    TEST_RUNNER,
    TYPE_CHECKER,
    LINTER,
    OTHER
}
