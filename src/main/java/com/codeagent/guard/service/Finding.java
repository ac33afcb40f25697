package com.codeagent.guard.service;

import java.util.Objects;

/**
 * Internal record of why a check fired. {@code message} is for operators and logs and is never
 * handed back to the caller of the gateway.
 */
public record Finding(Category category, String matchedPattern, String message) {
    public enum Category {
        JAILBREAK,
        INJECTION,
        PATH_TRAVERSAL,
        LENGTH_VIOLATION,
        CONTROL_CHARACTER,
        OBFUSCATION_RATIO,
        BLOCKED_COMMAND_OUTPUT,
        SECRET_LEAK,
        DANGEROUS_CODE
    }

    public Finding {
        Objects.requireNonNull(category, "category");
        matchedPattern = matchedPattern == null ? "" : matchedPattern;
        message = message == null ? "" : message;
    }
}
