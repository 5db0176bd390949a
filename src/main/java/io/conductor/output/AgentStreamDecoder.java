package io.conductor.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import io.conductor.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes one stdout line of an agent CLI into zero or more {@link AgentEvent}s.
 *
 * <p>Understands the Claude {@code stream-json} shape, the Gemini {@code stream-json} shape, the
 * Codex {@code exec --json} item shape and a flat {@code {"type":"tool","tool":..,"cmd":..}} shape.
 * Known records that carry nothing worth reporting decode to an empty list. Decoding never throws.
 */
public final class AgentStreamDecoder {
    private static final Logger log = LoggerFactory.getLogger(AgentStreamDecoder.class);

    public List<AgentEvent> decode(String line) {
        if (line == null || line.isBlank()) {
            return List.of();
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(line);
        } catch (JsonProcessingException e) {
            log.debug("Unparsable agent output line: {}", e.getOriginalMessage());
            return List.of(AgentEvent.unparsable(line));
        }
        if (node == null || !node.isObject() || !node.path("type").isTextual()) {
            return List.of(AgentEvent.unknown(line));
        }
        try {
            return decodeObject(node, line);
        } catch (RuntimeException e) {
            log.debug("Failed to decode agent event {}: {}", node.path("type").asText(), e.toString());
            return List.of(AgentEvent.unknown(line));
        }
    }

    private List<AgentEvent> decodeObject(JsonNode node, String line) {
        String type = node.path("type").asText();
        return switch (type) {
            case "system" -> List.of(AgentEvent.sessionStart(sessionLabel(node.path("session_id").asText(""),
                    node.path("model").asText(""))));
            case "stream_event" -> claudeStreamEvent(node.path("event"));
            case "assistant" -> claudeToolUses(node.path("message").path("content"));
            case "user" -> claudeToolResults(node.path("message").path("content"));
            case "result" -> List.of(AgentEvent.result(node.path("result").asText(null), isFailedResult(node)));
            case "init" -> List.of(AgentEvent.sessionStart(sessionLabel(node.path("session_id").asText(""),
                    node.path("model").asText(""))));
            case "tool_use" -> List.of(toolCall(node.path("tool_name").asText("?"),
                    node.hasNonNull("parameters") ? node.path("parameters") : node.path("input")));
            case "tool_result" -> List.of(AgentEvent.toolResult(textOf(node.path("output")),
                    "error".equals(node.path("status").asText()) || node.path("is_error").asBoolean(false)));
            case "message" -> geminiMessage(node);
            case "tool" -> List.of(toolCall(node.path("tool").asText("?"), node));
            case "thread.started" -> List.of(AgentEvent.sessionStart(sessionLabel(node.path("thread_id").asText(""), "")));
            case "turn.started", "item.updated" -> List.of();
            case "turn.completed" -> List.of(AgentEvent.result(null, false));
            case "turn.failed" -> List.of(AgentEvent.result(node.path("error").path("message").asText(null), true));
            case "error" -> List.of(AgentEvent.result(node.path("message").asText(null), true));
            case "item.started" -> codexItemStarted(node.path("item"));
            case "item.completed" -> codexItemCompleted(node.path("item"));
            default -> List.of(AgentEvent.unknown(line));
        };
    }

    private List<AgentEvent> claudeStreamEvent(JsonNode event) {
        String eventType = event.path("type").asText("");
        if ("content_block_delta".equals(eventType)) {
            JsonNode delta = event.path("delta");
            if ("text_delta".equals(delta.path("type").asText())) {
                return List.of(AgentEvent.text(delta.path("text").asText("")));
            }
            return List.of();
        }
        if ("content_block_start".equals(eventType)) {
            JsonNode block = event.path("content_block");
            if ("tool_result".equals(block.path("type").asText())) {
                return List.of(AgentEvent.toolResult(textOf(block.path("content")),
                        block.path("is_error").asBoolean(false)));
            }
            return List.of();
        }
        if ("message_start".equals(eventType)) {
            String model = event.path("message").path("model").asText("");
            if (!model.isEmpty()) {
                return List.of(AgentEvent.sessionStart("[Model: " + model + "]"));
            }
        }
        return List.of();
    }

    private List<AgentEvent> claudeToolUses(JsonNode content) {
        List<AgentEvent> events = new ArrayList<>();
        for (JsonNode block : content) {
            if ("tool_use".equals(block.path("type").asText())) {
                events.add(toolCall(block.path("name").asText("?"), block.path("input")));
            }
        }
        return events;
    }

    private List<AgentEvent> claudeToolResults(JsonNode content) {
        List<AgentEvent> events = new ArrayList<>();
        for (JsonNode block : content) {
            if ("tool_result".equals(block.path("type").asText())) {
                events.add(AgentEvent.toolResult(textOf(block.path("content")), block.path("is_error").asBoolean(false)));
            }
        }
        return events;
    }

    private List<AgentEvent> geminiMessage(JsonNode node) {
        if (!"assistant".equals(node.path("role").asText())) {
            return List.of();
        }
        String content = textOf(node.path("content"));
        return content.isEmpty() ? List.of() : List.of(AgentEvent.text(content));
    }

    private List<AgentEvent> codexItemStarted(JsonNode item) {
        if ("command_execution".equals(item.path("type").asText())) {
            return List.of(AgentEvent.toolCall("command_execution", item.path("command").asText("")));
        }
        return List.of();
    }

    private List<AgentEvent> codexItemCompleted(JsonNode item) {
        String itemType = item.path("type").asText("");
        switch (itemType) {
            case "command_execution": {
                int exitCode = item.path("exit_code").asInt(0);
                return List.of(AgentEvent.toolResult(item.path("aggregated_output").asText(""),
                        exitCode != 0 || "failed".equals(item.path("status").asText())));
            }
            case "agent_message": {
                String text = item.path("text").asText("");
                return text.isEmpty() ? List.of() : List.of(AgentEvent.text(text));
            }
            case "file_change": {
                List<AgentEvent> events = new ArrayList<>();
                for (JsonNode change : item.path("changes")) {
                    events.add(AgentEvent.toolCall("apply_patch", change.path("path").asText("?")));
                }
                return events;
            }
            case "error":
                return List.of(AgentEvent.toolResult(item.path("message").asText(""), true));
            default:
                return List.of();
        }
    }

    private AgentEvent toolCall(String toolName, JsonNode input) {
        return AgentEvent.toolCall(toolName, targetOf(ToolKind.fromToolName(toolName), input));
    }

    private String targetOf(ToolKind kind, JsonNode input) {
        return switch (kind) {
            case READ, EDIT -> firstText(input, "file_path", "path", "absolute_path", "notebook_path", "file");
            case SHELL -> firstText(input, "command", "cmd");
            case SEARCH -> firstText(input, "pattern", "query", "path");
            case LIST -> firstText(input, "dir_path", "path");
            case TODO -> input.path("todos").size() + " items";
            case OTHER -> firstText(input, "command", "cmd", "path", "file_path", "url");
        };
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.path(field);
            if (value.isTextual() && !value.asText().isEmpty()) {
                return value.asText();
            }
            if (value.isArray() && value.size() > 0) {
                List<String> parts = new ArrayList<>();
                value.forEach(v -> parts.add(v.asText()));
                return String.join(" ", parts);
            }
        }
        return "";
    }

    private static boolean isFailedResult(JsonNode node) {
        if (node.path("is_error").asBoolean(false) || "error".equals(node.path("status").asText())) {
            return true;
        }
        if (node.path("subtype").asText("").startsWith("error")) {
            return true;
        }
        return node.has("passed") && !node.path("passed").asBoolean(true);
    }

    /**
     * Tool output is either a string or a list of {@code {"type":"text","text":..}} blocks.
     */
    private static String textOf(JsonNode content) {
        if (content == null || content.isMissingNode() || content.isNull()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            StringBuilder out = new StringBuilder();
            for (JsonNode part : content) {
                String text = part.isTextual() ? part.asText() : part.path("text").asText("");
                if (!text.isEmpty()) {
                    if (out.length() > 0) {
                        out.append('\n');
                    }
                    out.append(text);
                }
            }
            return out.toString();
        }
        return content.toString();
    }

    private static String sessionLabel(String sessionId, String model) {
        String shortId = sessionId.length() > 8 ? sessionId.substring(0, 8) : sessionId;
        StringBuilder out = new StringBuilder("[Session: ").append(shortId).append("...");
        if (!model.isEmpty()) {
            out.append(" | Model: ").append(model);
        }
        return out.append(']').toString();
    }
}
