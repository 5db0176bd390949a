package io.conductor.config;

import io.conductor.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunable policy values, read from {@code conductor-settings.json} under the data root.
 *
 * <p>Every field falls back to its default independently when absent or below its minimum.
 */
public record DispatchSettings(
        long staleAfterMs,
        long dedupWindowMs,
        int cliOutputMaxChars,
        int summaryMaxChars,
        int reportRetryAttempts,
        long reportRetryBackoffMs,
        String systemPrompt
) {
    public static final String DEFAULT_SYSTEM_PROMPT = "Write clean, scalable, modular, efficient code. "
            + "Follow single responsibility principle. Do not repeat yourself. "
            + "Use consistent naming conventions. No unnecessary comments.";

    public static DispatchSettings defaults() {
        return new DispatchSettings(
                ConductorConfig.DEFAULT_STALE_AFTER_MS,
                ConductorConfig.DEFAULT_DEDUP_WINDOW_MS,
                ConductorConfig.DEFAULT_CLI_OUTPUT_MAX_CHARS,
                ConductorConfig.DEFAULT_SUMMARY_MAX_CHARS,
                ConductorConfig.DEFAULT_REPORT_RETRY_ATTEMPTS,
                ConductorConfig.DEFAULT_REPORT_RETRY_BACKOFF_MS,
                DEFAULT_SYSTEM_PROMPT
        );
    }

    public static DispatchSettings load(Path settingsFile) {
        DispatchSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + settingsFile, e);
        }
    }

    static DispatchSettings fromFile(SettingsFile file, DispatchSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new DispatchSettings(
                sanitizeLong(file.staleAfterMs(), defaults.staleAfterMs(), 1_000L),
                sanitizeLong(file.dedupWindowMs(), defaults.dedupWindowMs(), 0L),
                sanitizeInt(file.cliOutputMaxChars(), defaults.cliOutputMaxChars(), 256),
                sanitizeInt(file.summaryMaxChars(), defaults.summaryMaxChars(), 64),
                sanitizeInt(file.reportRetryAttempts(), defaults.reportRetryAttempts(), 1),
                sanitizeLong(file.reportRetryBackoffMs(), defaults.reportRetryBackoffMs(), 0L),
                file.systemPrompt() == null ? defaults.systemPrompt() : file.systemPrompt()
        );
    }

    public DispatchSettings withStaleAfterMs(long value) {
        return new DispatchSettings(value, dedupWindowMs, cliOutputMaxChars, summaryMaxChars,
                reportRetryAttempts, reportRetryBackoffMs, systemPrompt);
    }

    public DispatchSettings withDedupWindowMs(long value) {
        return new DispatchSettings(staleAfterMs, value, cliOutputMaxChars, summaryMaxChars,
                reportRetryAttempts, reportRetryBackoffMs, systemPrompt);
    }

    public DispatchSettings withReportRetry(int attempts, long backoffMs) {
        return new DispatchSettings(staleAfterMs, dedupWindowMs, cliOutputMaxChars, summaryMaxChars,
                attempts, backoffMs, systemPrompt);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null || raw < min) {
            return fallback;
        }
        return raw;
    }

    record SettingsFile(
            Long staleAfterMs,
            Long dedupWindowMs,
            Integer cliOutputMaxChars,
            Integer summaryMaxChars,
            Integer reportRetryAttempts,
            Long reportRetryBackoffMs,
            String systemPrompt
    ) {
    }
}
