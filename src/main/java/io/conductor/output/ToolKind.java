package io.conductor.output;

import java.util.Locale;
import java.util.Set;

/**
 * Coarse category of an agent tool call. Names from the different agent CLIs fold onto one kind.
 */
public enum ToolKind {
    READ("READ", Set.of("read", "read_file", "read_many_files")),
    EDIT("EDIT", Set.of("write", "edit", "multiedit", "write_file", "replace", "apply_patch", "notebookedit")),
    SHELL("BASH", Set.of("bash", "run_shell_command", "shell", "command_execution")),
    SEARCH("SEARCH", Set.of("glob", "grep", "findfiles", "searchtext", "search_file_content", "web_search")),
    LIST("LS", Set.of("ls", "list_directory", "readfolder")),
    TODO("TODO", Set.of("todowrite", "writetodos", "write_todos")),
    OTHER("TOOL", Set.of());

    private final String label;
    private final Set<String> names;

    ToolKind(String label, Set<String> names) {
        this.label = label;
        this.names = names;
    }

    public String label() {
        return label;
    }

    public static ToolKind fromToolName(String toolName) {
        if (toolName == null || toolName.isBlank()) {
            return OTHER;
        }
        String normalized = toolName.trim().toLowerCase(Locale.ROOT);
        for (ToolKind kind : values()) {
            if (kind.names.contains(normalized)) {
                return kind;
            }
        }
        return OTHER;
    }
}
