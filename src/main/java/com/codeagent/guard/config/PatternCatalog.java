package com.codeagent.guard.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;

/**
 * The pattern catalogue as stored in {@code guardrails/policy-catalog.json}. Entries are kept as
 * raw text here; compilation happens in {@link PolicyConfig}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PatternCatalog(String version, List<Entry> entries, List<Redaction> redactionRules) {
    public static final String DEFAULT_RESOURCE = "guardrails/policy-catalog.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(String name, PatternCategory category, String pattern) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Redaction(String name, String pattern, String replacement) {}

    public PatternCatalog {
        version = version == null || version.isBlank() ? "unversioned" : version.trim();
        entries = entries == null ? List.of() : List.copyOf(entries);
        redactionRules = redactionRules == null ? List.of() : List.copyOf(redactionRules);
    }

    public static PatternCatalog bundled() {
        return BundledHolder.CATALOG;
    }

    public static PatternCatalog fromResource(String resourcePath) {
        Objects.requireNonNull(resourcePath, "resourcePath");
        try (InputStream stream = PatternCatalog.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (stream == null) {
                throw new IllegalStateException("Missing pattern catalogue resource: " + resourcePath);
            }
            return MAPPER.readValue(stream, PatternCatalog.class);
        } catch (IOException error) {
            throw new IllegalStateException("Failed to load pattern catalogue " + resourcePath, error);
        }
    }

    public List<Entry> entriesOf(PatternCategory category) {
        return entries.stream()
                .filter(entry -> entry.category() == category)
                .toList();
    }

    private static final class BundledHolder {
        private static final PatternCatalog CATALOG = fromResource(DEFAULT_RESOURCE);
    }
}
