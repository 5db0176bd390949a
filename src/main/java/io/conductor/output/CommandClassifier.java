package io.conductor.output;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Best-effort classification of a shell command line. Unknown, null and blank commands are
 * {@link CommandType#OTHER}; classification never throws.
 */
public final class CommandClassifier {
    private static final List<Pattern> TEST_RUNNERS = List.of(
            Pattern.compile("(^|[\\s;&|/])pytest\\b"),
            Pattern.compile("\\s-m\\s+pytest\\b"),
            Pattern.compile("(^|[\\s;&|/])(mvn|mvnw|\\./mvnw)\\b.*\\b(test|verify)\\b"),
            Pattern.compile("(^|[\\s;&|/])(gradle|gradlew|\\./gradlew)\\b.*\\btest\\b"),
            Pattern.compile("(^|[\\s;&|])(npm|yarn|pnpm)\\s+(run\\s+)?test\\b"),
            Pattern.compile("(^|[\\s;&|/])(jest|vitest)\\b"),
            Pattern.compile("(^|[\\s;&|])go\\s+test\\b"),
            Pattern.compile("(^|[\\s;&|])cargo\\s+test\\b"),
            Pattern.compile("(^|[\\s;&|])dotnet\\s+test\\b")
    );
    private static final List<Pattern> TYPE_CHECKERS = List.of(
            Pattern.compile("(^|[\\s;&|/])mypy\\b"),
            Pattern.compile("\\s-m\\s+mypy\\b"),
            Pattern.compile("(^|[\\s;&|/])pyright\\b"),
            Pattern.compile("(^|[\\s;&|/])tsc\\b")
    );
    private static final List<Pattern> LINTERS = List.of(
            Pattern.compile("(^|[\\s;&|/])(ruff|flake8|pylint|eslint|golangci-lint)\\b"),
            Pattern.compile("checkstyle"),
            Pattern.compile("lint")
    );

    private CommandClassifier() {
    }

    public static CommandType classify(String command) {
        if (command == null || command.isBlank()) {
            return CommandType.OTHER;
        }
        String normalized = command.trim().toLowerCase(Locale.ROOT);
        if (matchesAny(TEST_RUNNERS, normalized)) {
            return CommandType.TEST_RUNNER;
        }
        if (matchesAny(TYPE_CHECKERS, normalized)) {
            return CommandType.TYPE_CHECKER;
        }
        if (matchesAny(LINTERS, normalized)) {
            return CommandType.LINTER;
        }
        return CommandType.OTHER;
    }

    private static boolean matchesAny(List<Pattern> patterns, String command) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(command).find()) {
                return true;
            }
        }
        return false;
    }
}
