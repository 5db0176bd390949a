package io.conductor.agent;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class AgentCommandBuilderTest {

    @Test
    void stdinBackendGetsModelAndRepeatedDirFlags() {
        AgentBackend claude = AgentBackendRegistry.withDefaults().findByKind("claude").orElseThrow();

        List<String> argv = AgentCommandBuilder.build(claude, "opus", List.of("/a", "/b"), "prompt");

        int base = claude.command().size();
        Assertions.assertEquals(claude.command(), argv.subList(0, base));
        Assertions.assertEquals(List.of("--model", "opus", "--add-dir", "/a", "--add-dir", "/b"),
                argv.subList(base, argv.size()));
    }

    @Test
    void joinedDirectoriesAndDefaultModel() {
        AgentBackend gemini = AgentBackendRegistry.withDefaults().findByKind("gemini").orElseThrow();

        List<String> argv = AgentCommandBuilder.build(gemini, null, List.of("/a", "/b"), "prompt");

        Assertions.assertEquals(List.of("-m", "gemini-2.5-pro", "--include-directories", "/a,/b"),
                argv.subList(gemini.command().size(), argv.size()));
    }

    @Test
    void argumentBackendTakesPromptLast() {
        AgentBackend codex = AgentBackendRegistry.withDefaults().findByKind("codex").orElseThrow();

        List<String> argv = AgentCommandBuilder.build(codex, " gpt-5 ", List.of("/ignored"), "fix the bug");

        Assertions.assertEquals("fix the bug", argv.get(argv.size() - 1));
        Assertions.assertTrue(argv.contains("gpt-5"));
        Assertions.assertFalse(argv.contains("/ignored"));
    }
}
