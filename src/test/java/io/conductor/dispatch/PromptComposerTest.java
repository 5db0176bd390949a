package io.conductor.dispatch;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class PromptComposerTest {

    @Test
    void appendsSystemPromptAfterContent() {
        Assertions.assertEquals("Add tests\n\nKeep it small.",
                new PromptComposer(" Keep it small. ").compose("  Add tests\n"));
    }

    @Test
    void emptySystemPromptLeavesContentAlone() {
        Assertions.assertEquals("Add tests", new PromptComposer("").compose("Add tests"));
        Assertions.assertEquals("Add tests", new PromptComposer(null).compose("Add tests"));
    }
}
