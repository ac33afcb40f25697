package com.codeagent.guard.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

public record GatewaySettings(
        boolean enabled,
        Path configPath,
        int maxInputLength,
        boolean logBlockedRequests,
        Duration backendTimeout,
        int workerThreads
) {
    public static final String DEFAULT_CONFIG_PATH = "guardrails_config";
    public static final int DEFAULT_BACKEND_TIMEOUT_MILLIS = 2000;
    public static final int MIN_BACKEND_TIMEOUT_MILLIS = 100;
    public static final int DEFAULT_WORKER_THREADS = 4;

    private static final Dotenv DOTENV = Dotenv.configure().ignoreIfMissing().load();

    public GatewaySettings {
        Objects.requireNonNull(configPath, "configPath");
        Objects.requireNonNull(backendTimeout, "backendTimeout");
    }

    public static GatewaySettings fromEnvironment() {
        return fromSource(GatewaySettings::getEnv);
    }

    public static GatewaySettings defaults() {
        return fromSource(key -> null);
    }

    public static GatewaySettings fromSource(Function<String, String> lookup) {
        Objects.requireNonNull(lookup, "lookup");
        return new GatewaySettings(
                parseBoolean(lookup.apply("GUARDRAILS_ENABLED"), true),
                parsePath(lookup.apply("GUARDRAILS_CONFIG_PATH"), DEFAULT_CONFIG_PATH),
                parsePositiveInt(lookup.apply("GUARDRAILS_MAX_INPUT"), PolicyConfig.DEFAULT_MAX_INPUT_LENGTH),
                parseBoolean(lookup.apply("GUARDRAILS_LOG_BLOCKED"), true),
                parseDurationMillis(
                        lookup.apply("GUARDRAILS_BACKEND_TIMEOUT_MS"),
                        DEFAULT_BACKEND_TIMEOUT_MILLIS,
                        MIN_BACKEND_TIMEOUT_MILLIS
                ),
                Math.max(1, parsePositiveInt(lookup.apply("GUARDRAILS_WORKER_THREADS"), DEFAULT_WORKER_THREADS))
        );
    }

    private static String getEnv(String key) {
        String value = DOTENV.get(key);
        if (value == null || value.isBlank()) {
            return System.getenv(key);
        }
        return value;
    }

    // Only the literal "true" (any case) enables a flag.
    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim());
    }

    private static Path parsePath(String value, String defaultValue) {
        if (value == null || value.isBlank()) {
            return Path.of(defaultValue);
        }
        return Path.of(value.trim());
    }

    private static int parsePositiveInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed >= 1 ? parsed : defaultValue;
        } catch (NumberFormatException ignored) {
            return defaultValue;
        }
    }

    private static Duration parseDurationMillis(String value, int defaultMillis, int minimumMillis) {
        int millis = defaultMillis;
        if (value != null && !value.isBlank()) {
            try {
                millis = Integer.parseInt(value.trim());
            } catch (NumberFormatException ignored) {
                millis = defaultMillis;
            }
        }
        return Duration.ofMillis(Math.max(minimumMillis, millis));
    }
}
