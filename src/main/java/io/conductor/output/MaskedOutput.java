package io.conductor.output;

import java.util.List;

/**
 * Compressed form of one verbose tool output: a one-line verdict, structured error locations and,
 * when useful, the tail of the raw text. {@code rawSnippet} is {@code null} when omitted.
 */
public record MaskedOutput(String summary, List<ErrorLocation> errors, String rawSnippet) {
    public MaskedOutput {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public int size() {
        int total = summary.length();
        for (ErrorLocation error : errors) {
            total += error.weight();
        }
        return rawSnippet == null ? total : total + rawSnippet.length();
    }
}
