package com.codeagent.guard.config;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One compiled catalogue entry. {@code source} is the text as written in the catalogue,
 * {@code pattern} is what detection actually runs.
 */
public record PatternRule(String name, PatternCategory category, String source, Pattern pattern) {
    public PatternRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(pattern, "pattern");
    }

    public boolean matches(String candidate) {
        return candidate != null && pattern.matcher(candidate).find();
    }
}
