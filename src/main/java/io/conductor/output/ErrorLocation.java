package io.conductor.output;

public record ErrorLocation(String file, int line, String message) {
    int weight() {
        return file.length() + String.valueOf(line).length() + message.length();
    }
}
