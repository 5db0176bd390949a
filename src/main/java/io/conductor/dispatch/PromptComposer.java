package io.conductor.dispatch;

public final class PromptComposer {
    private final String systemPrompt;

    public PromptComposer(String systemPrompt) {
        this.systemPrompt = systemPrompt == null ? "" : systemPrompt.strip();
    }

    public String compose(String content) {
        String body = content == null ? "" : content.strip();
        if (systemPrompt.isEmpty()) {
            return body;
        }
        return body + "\n\n" + systemPrompt;
    }
}
