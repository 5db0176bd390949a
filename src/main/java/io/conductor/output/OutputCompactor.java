package io.conductor.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Folds a stream of agent events into counters and a rolling transcript of compact lines.
 *
 * <p>Shell results are masked with the type of the shell command that preceded them. The transcript
 * never exceeds {@code cliOutputMaxChars}; oldest lines are dropped first. All state is derived from
 * the consumed lines, so replaying the same lines rebuilds the same compactor (elapsed time aside).
 * Not thread-safe.
 */
public final class OutputCompactor {
    private static final Logger log = LoggerFactory.getLogger(OutputCompactor.class);
    private static final int DETAIL_CHARS = 80;
    private static final int ERROR_CHARS = 400;
    private static final int PREVIEW_CHARS = 100;
    private static final int TEXT_LINE_CHARS = 200;
    private static final int PENDING_TEXT_CHARS = TEXT_LINE_CHARS * 2;

    private final AgentStreamDecoder decoder;
    private final Clock clock;
    private final int cliOutputMaxChars;
    private final int summaryMaxChars;
    private final long startedAtMs;

    private final Map<ToolKind, Integer> toolCallsByKind = new EnumMap<>(ToolKind.class);
    private final Set<String> filesRead = new LinkedHashSet<>();
    private final Set<String> filesModified = new LinkedHashSet<>();
    private final Deque<String> transcript = new ArrayDeque<>();
    private final StringBuilder pendingText = new StringBuilder();
    private int transcriptChars;
    private int toolCalls;
    private int errors;
    private int unparsableLines;
    private String lastError;
    private String lastShellCommand;
    private CommandType lastCommandType = CommandType.OTHER;
    private boolean resultFailed;

    public OutputCompactor(AgentStreamDecoder decoder, Clock clock, int cliOutputMaxChars, int summaryMaxChars) {
        this.decoder = decoder;
        this.clock = clock;
        this.cliOutputMaxChars = Math.max(1, cliOutputMaxChars);
        this.summaryMaxChars = Math.max(1, summaryMaxChars);
        this.startedAtMs = clock.millis();
    }

    /**
     * Decodes and consumes one raw output line.
     *
     * @return compact lines produced for display, possibly empty
     */
    public List<String> acceptLine(String line) {
        List<String> out = new ArrayList<>();
        for (AgentEvent event : decoder.decode(line)) {
            out.addAll(accept(event));
        }
        return out;
    }

    public List<String> accept(AgentEvent event) {
        if (event.kind() == EventKind.TEXT) {
            bufferText(event.text());
            return List.of();
        }
        List<String> out = new ArrayList<>();
        flushText(out);
        switch (event.kind()) {
            case SESSION_START -> emit(out, event.text());
            case TOOL_CALL -> onToolCall(event, out);
            case TOOL_RESULT -> onToolResult(event, out);
            case RESULT -> onResult(event, out);
            case UNPARSABLE -> {
                unparsableLines++;
                emit(out, Texts.truncate(Texts.oneLine(event.text()), TEXT_LINE_CHARS));
            }
            case UNKNOWN -> log.debug("Skipping unrecognized agent event: {}", Texts.truncate(event.text(), 120));
            default -> {
            }
        }
        return out;
    }

    /**
     * Flushes buffered agent text. Call once the stream has ended.
     */
    public List<String> finish() {
        List<String> out = new ArrayList<>();
        flushText(out);
        return out;
    }

    private void onToolCall(AgentEvent event, List<String> out) {
        ToolKind kind = event.toolKind() == null ? ToolKind.OTHER : event.toolKind();
        toolCalls++;
        toolCallsByKind.merge(kind, 1, Integer::sum);
        String target = event.target() == null ? "" : event.target();
        String detail = target;
        switch (kind) {
            case READ -> {
                if (!target.isEmpty()) {
                    filesRead.add(target);
                }
                detail = fileName(target);
            }
            case EDIT -> {
                if (!target.isEmpty()) {
                    filesModified.add(target);
                }
                detail = fileName(target);
            }
            case SHELL -> {
                lastShellCommand = target;
                lastCommandType = CommandClassifier.classify(target);
            }
            default -> {
            }
        }
        String label = kind == ToolKind.OTHER && event.toolName() != null
                ? event.toolName().toUpperCase(Locale.ROOT)
                : kind.label();
        emit(out, "[" + Texts.truncate(label, 12) + "] " + Texts.truncate(Texts.oneLine(detail), DETAIL_CHARS));
    }

    private void onToolResult(AgentEvent event, List<String> out) {
        String content = event.text() == null ? "" : event.text();
        if (lastShellCommand != null && lastCommandType != CommandType.OTHER) {
            MaskedOutput masked = OutputMasker.mask(content, lastCommandType);
            lastShellCommand = null;
            lastCommandType = CommandType.OTHER;
            if (event.error() || masked.hasErrors()) {
                recordError(masked.summary());
                emit(out, "[FAILED] " + masked.summary());
            } else {
                emit(out, "[OK] " + masked.summary());
            }
            return;
        }
        lastShellCommand = null;
        String flat = Texts.oneLine(content);
        if (event.error()) {
            String message = Texts.truncate(flat, ERROR_CHARS);
            recordError(message);
            emit(out, "[FAILED] " + message);
            return;
        }
        String preview = Texts.truncate(flat, PREVIEW_CHARS);
        emit(out, preview.isEmpty() ? "[OK]" : "[OK] " + preview);
    }

    private void onResult(AgentEvent event, List<String> out) {
        if (event.error()) {
            resultFailed = true;
            String message = event.text() == null || event.text().isBlank()
                    ? "agent reported failure"
                    : Texts.truncate(Texts.oneLine(event.text()), ERROR_CHARS);
            recordError(message);
            emit(out, "[RESULT] failed: " + message);
        } else {
            emit(out, "[RESULT] ok");
        }
    }

    private void recordError(String message) {
        errors++;
        lastError = message;
    }

    // Text past PENDING_TEXT_CHARS is dropped until the next flush.
    private void bufferText(String text) {
        if (text == null || text.isEmpty()) {
            return;
        }
        int room = PENDING_TEXT_CHARS - pendingText.length();
        if (room > 0) {
            pendingText.append(text, 0, Math.min(room, text.length()));
        }
    }

    int bufferedTextChars() {
        return pendingText.length();
    }

    private void flushText(List<String> out) {
        if (pendingText.length() == 0) {
            return;
        }
        String text = Texts.oneLine(pendingText.toString());
        pendingText.setLength(0);
        if (!text.isEmpty()) {
            emit(out, Texts.truncate(text, TEXT_LINE_CHARS));
        }
    }

    private void emit(List<String> out, String line) {
        if (line == null || line.isEmpty()) {
            return;
        }
        String bounded = Texts.truncate(line, cliOutputMaxChars);
        out.add(bounded);
        transcript.addLast(bounded);
        transcriptChars += bounded.length() + 1;
        while (transcriptChars - 1 > cliOutputMaxChars && !transcript.isEmpty()) {
            transcriptChars -= transcript.removeFirst().length() + 1;
        }
    }

    /**
     * Compact transcript, newest lines last, at most {@code cliOutputMaxChars} long.
     */
    public String transcript() {
        return String.join("\n", transcript);
    }

    public ExecutionSummary summary() {
        return new ExecutionSummary(
                Math.max(0L, clock.millis() - startedAtMs),
                new ArrayList<>(filesRead),
                new ArrayList<>(filesModified),
                toolCalls,
                toolCallsByKind,
                errors,
                lastError
        );
    }

    public String summaryLine() {
        return summary().toSummaryLine(summaryMaxChars);
    }

    public List<String> filesModified() {
        return List.copyOf(filesModified);
    }

    public String lastError() {
        return lastError;
    }

    public int unparsableLines() {
        return unparsableLines;
    }

    public boolean resultFailed() {
        return resultFailed;
    }

    private static String fileName(String path) {
        if (path == null || path.isEmpty()) {
            return "?";
        }
        try {
            Path name = Paths.get(path).getFileName();
            return name == null ? path : name.toString();
        } catch (RuntimeException e) {
            return path;
        }
    }
}
