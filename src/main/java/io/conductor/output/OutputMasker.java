package io.conductor.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Compresses verbose test, type-check and lint output into a short verdict plus error locations.
 *
 * <p>The result depends only on the input text and command type. Its total size is bounded by
 * {@link #MAX_TOTAL_CHARS}: the snippet is trimmed first, then the error list is cut to
 * {@link #MAX_ERRORS} entries.
 */
public final class OutputMasker {
    public static final int MAX_SNIPPET_LINES = 20;
    public static final int MAX_TOTAL_CHARS = 2_000;
    public static final int MAX_ERRORS = 10;

    private static final Logger log = LoggerFactory.getLogger(OutputMasker.class);

    private static final Pattern PYTEST_PASSED = Pattern.compile("(\\d+)\\s+passed");
    private static final Pattern PYTEST_FAILED = Pattern.compile("(\\d+)\\s+failed");
    private static final Pattern PYTEST_ERROR = Pattern.compile("(\\d+)\\s+errors?\\b");
    private static final Pattern PYTEST_FAILED_TEST = Pattern.compile("FAILED\\s+([^:\\s]+)::(\\S+)\\s*-\\s*(.+?)(?:\\n|$)");
    private static final Pattern PYTHON_TRACE_ERROR = Pattern.compile("([^\\s:]+\\.py):(\\d+):\\s*(\\w+Error.+?)(?:\\n|$)");
    private static final Pattern JUNIT_TOTALS = Pattern.compile(
            "Tests run:\\s*(\\d+),\\s*Failures:\\s*(\\d+),\\s*Errors:\\s*(\\d+)(?:,\\s*Skipped:\\s*(\\d+))?");
    private static final Pattern JUNIT_FAILED_TEST = Pattern.compile(
            "^\\[ERROR\\]\\s+([\\w.$]+)[.#](\\w+)(?::(\\d+))?\\s+(.+)$", Pattern.MULTILINE);

    private static final Pattern MYPY_ERROR = Pattern.compile("^([^\\s:]+):(\\d+):(?:\\d+:)?\\s*error:\\s*(.+?)(?:\\s+\\[|$)",
            Pattern.MULTILINE);
    private static final Pattern MYPY_FOUND = Pattern.compile("Found\\s+(\\d+)\\s+errors?");
    private static final Pattern TSC_ERROR = Pattern.compile("^([^\\s(]+)\\((\\d+),\\d+\\):\\s*error\\s+(TS\\d+:\\s*.+)$",
            Pattern.MULTILINE);

    private static final Pattern LINT_ERROR = Pattern.compile("^([^\\s:]+):(\\d+):\\d+:\\s*([A-Z]+\\d+\\s+.+?)$",
            Pattern.MULTILINE);

    private OutputMasker() {
    }

    public static MaskedOutput mask(String raw, CommandType commandType) {
        if (raw == null || raw.isBlank()) {
            return new MaskedOutput("No output", List.of(), null);
        }
        try {
            MaskedOutput parsed = switch (commandType == null ? CommandType.OTHER : commandType) {
                case TEST_RUNNER -> parseTests(raw);
                case TYPE_CHECKER -> parseTypeCheck(raw);
                case LINTER -> parseLint(raw);
                case OTHER -> new MaskedOutput("? Unknown output", List.of(), lastLines(raw));
            };
            return enforceSizeLimit(parsed);
        } catch (RuntimeException e) {
            log.debug("Failed to mask {} output: {}", commandType, e.getMessage());
            return new MaskedOutput("? Parse error", List.of(), lastLines(raw));
        }
    }

    static String lastLines(String raw) {
        String[] lines = raw.strip().split("\n", -1);
        int from = Math.max(0, lines.length - MAX_SNIPPET_LINES);
        return String.join("\n", Arrays.copyOfRange(lines, from, lines.length));
    }

    private static MaskedOutput parseTests(String raw) {
        Matcher junit = JUNIT_TOTALS.matcher(raw);
        int[] totals = null;
        while (junit.find()) {
            // Maven prints per-class lines before the aggregate; the last one wins.
            totals = new int[]{
                    Integer.parseInt(junit.group(1)),
                    Integer.parseInt(junit.group(2)),
                    Integer.parseInt(junit.group(3))
            };
        }
        if (totals != null) {
            return junitResult(raw, totals[0], totals[1], totals[2]);
        }
        return pytestResult(raw);
    }

    private static MaskedOutput pytestResult(String raw) {
        int passed = firstInt(PYTEST_PASSED, raw);
        int failed = firstInt(PYTEST_FAILED, raw);
        int errorCount = firstInt(PYTEST_ERROR, raw);
        if (failed + errorCount > 0) {
            List<ErrorLocation> errors = new ArrayList<>();
            Matcher m = PYTEST_FAILED_TEST.matcher(raw);
            while (m.find()) {
                String file = m.group(1);
                Matcher line = Pattern.compile(Pattern.quote(file) + ":(\\d+):").matcher(raw);
                errors.add(new ErrorLocation(file, line.find() ? Integer.parseInt(line.group(1)) : 0, m.group(3).strip()));
            }
            if (errors.isEmpty() && errorCount > 0) {
                Matcher trace = PYTHON_TRACE_ERROR.matcher(raw);
                while (trace.find()) {
                    errors.add(new ErrorLocation(trace.group(1), Integer.parseInt(trace.group(2)), trace.group(3).strip()));
                }
            }
            List<String> parts = new ArrayList<>();
            if (failed > 0) {
                parts.add(failed + " failed");
            }
            if (errorCount > 0) {
                parts.add(errorCount + " error");
            }
            if (passed > 0) {
                parts.add(passed + " passed");
            }
            return new MaskedOutput("✗ " + String.join(", ", parts), errors, lastLines(raw));
        }
        if (passed > 0) {
            return new MaskedOutput("✓ " + passed + " passed", List.of(), null);
        }
        return new MaskedOutput("? Unknown test output", List.of(), lastLines(raw));
    }

    private static MaskedOutput junitResult(String raw, int run, int failures, int errorCount) {
        if (failures + errorCount == 0) {
            return new MaskedOutput("✓ " + run + " passed", List.of(), null);
        }
        List<ErrorLocation> errors = new ArrayList<>();
        Matcher m = JUNIT_FAILED_TEST.matcher(raw);
        while (m.find()) {
            String line = m.group(3);
            errors.add(new ErrorLocation(m.group(1), line == null ? 0 : Integer.parseInt(line),
                    m.group(2) + " " + m.group(4).strip()));
        }
        List<String> parts = new ArrayList<>();
        if (failures > 0) {
            parts.add(failures + " failed");
        }
        if (errorCount > 0) {
            parts.add(errorCount + " error");
        }
        int passed = run - failures - errorCount;
        if (passed > 0) {
            parts.add(passed + " passed");
        }
        return new MaskedOutput("✗ " + String.join(", ", parts), errors, lastLines(raw));
    }

    private static MaskedOutput parseTypeCheck(String raw) {
        Matcher found = MYPY_FOUND.matcher(raw);
        boolean counted = found.find();
        if (raw.contains("Success") || (counted && Integer.parseInt(found.group(1)) == 0)) {
            return new MaskedOutput("✓ types: Success", List.of(), null);
        }
        List<ErrorLocation> errors = new ArrayList<>();
        collect(MYPY_ERROR, raw, errors);
        collect(TSC_ERROR, raw, errors);
        if (counted) {
            return new MaskedOutput("✗ types: " + found.group(1) + " errors", errors, lastLines(raw));
        }
        if (!errors.isEmpty()) {
            return new MaskedOutput("✗ types: " + errors.size() + " errors", errors, lastLines(raw));
        }
        return new MaskedOutput("? Unknown type-check output", List.of(), lastLines(raw));
    }

    private static MaskedOutput parseLint(String raw) {
        List<ErrorLocation> errors = new ArrayList<>();
        collect(LINT_ERROR, raw, errors);
        if (!errors.isEmpty()) {
            return new MaskedOutput("✗ lint: " + errors.size() + " errors", errors, lastLines(raw));
        }
        return new MaskedOutput("✓ lint: clean", List.of(), null);
    }

    private static void collect(Pattern pattern, String raw, List<ErrorLocation> into) {
        Matcher m = pattern.matcher(raw);
        while (m.find()) {
            into.add(new ErrorLocation(m.group(1), Integer.parseInt(m.group(2)), m.group(3).strip()));
        }
    }

    private static int firstInt(Pattern pattern, String raw) {
        Matcher m = pattern.matcher(raw);
        return m.find() ? Integer.parseInt(m.group(1)) : 0;
    }

    private static MaskedOutput enforceSizeLimit(MaskedOutput output) {
        if (output.size() <= MAX_TOTAL_CHARS) {
            return output;
        }
        String summary = output.summary();
        List<ErrorLocation> errors = output.errors().size() > MAX_ERRORS
                ? output.errors().subList(0, MAX_ERRORS)
                : output.errors();
        int available = MAX_TOTAL_CHARS - summary.length();
        for (ErrorLocation error : errors) {
            available -= error.weight();
        }
        if (available > 0 && output.rawSnippet() != null) {
            String snippet = output.rawSnippet();
            return new MaskedOutput(summary, errors, snippet.substring(Math.max(0, snippet.length() - available)));
        }
        List<ErrorLocation> kept = new ArrayList<>();
        int budget = MAX_TOTAL_CHARS - summary.length();
        for (ErrorLocation error : errors) {
            if (error.weight() > budget) {
                break;
            }
            kept.add(error);
            budget -= error.weight();
        }
        return new MaskedOutput(summary, kept, null);
    }
}
