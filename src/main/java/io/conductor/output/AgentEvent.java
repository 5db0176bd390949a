package io.conductor.output;

/**
 * One decoded event from an agent's output stream.
 *
 * <p>Fields not meaningful for a kind are {@code null}: {@code toolName}, {@code toolKind} and
 * {@code target} are set on tool calls, {@code text} carries agent text, tool output, result text or
 * the raw line, and {@code error} marks failed tool results and failed runs.
 */
public record AgentEvent(
        EventKind kind,
        String toolName,
        ToolKind toolKind,
        String target,
        String text,
        boolean error
) {
    public static AgentEvent sessionStart(String description) {
        return new AgentEvent(EventKind.SESSION_START, null, null, null, description, false);
    }

    public static AgentEvent text(String text) {
        return new AgentEvent(EventKind.TEXT, null, null, null, text, false);
    }

    public static AgentEvent toolCall(String toolName, String target) {
        return new AgentEvent(EventKind.TOOL_CALL, toolName, ToolKind.fromToolName(toolName), target, null, false);
    }

    public static AgentEvent toolResult(String output, boolean error) {
        return new AgentEvent(EventKind.TOOL_RESULT, null, null, null, output, error);
    }

    public static AgentEvent result(String text, boolean error) {
        return new AgentEvent(EventKind.RESULT, null, null, null, text, error);
    }

    public static AgentEvent unknown(String raw) {
        return new AgentEvent(EventKind.UNKNOWN, null, null, null, raw, false);
    }

    public static AgentEvent unparsable(String raw) {
        return new AgentEvent(EventKind.UNPARSABLE, null, null, null, raw, false);
    }
}
