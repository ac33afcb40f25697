package com.codeagent.guard.config;

import com.codeagent.guard.util.PatternCompiler;
import com.codeagent.guard.util.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Immutable policy the gateway runs against. Pattern lists are compiled once, when the policy is
 * built; entries that fail to compile are skipped and listed in {@link #rejectedPatterns()}.
 */
public record PolicyConfig(
        boolean enabled,
        int maxInputLength,
        boolean logBlockedRequests,
        String catalogVersion,
        List<PatternRule> jailbreakPatterns,
        List<PatternRule> injectionPatterns,
        List<PatternRule> blockedCommands,
        List<PatternRule> blockedPaths,
        List<PatternRule> traversalPatterns,
        List<PatternRule> secretPatterns,
        List<PatternRule> dangerousCodePatterns,
        List<RedactionRule> redactionRules,
        List<String> rejectedPatterns
) {
    public static final int DEFAULT_MAX_INPUT_LENGTH = 100_000;

    private static final Logger log = LoggerFactory.getLogger(PolicyConfig.class);

    public PolicyConfig {
        if (maxInputLength < 1) {
            throw new IllegalArgumentException("maxInputLength must be positive, was " + maxInputLength);
        }
        catalogVersion = catalogVersion == null ? "unversioned" : catalogVersion;
        jailbreakPatterns = copy(jailbreakPatterns);
        injectionPatterns = copy(injectionPatterns);
        blockedCommands = copy(blockedCommands);
        blockedPaths = copy(blockedPaths);
        traversalPatterns = copy(traversalPatterns);
        secretPatterns = copy(secretPatterns);
        dangerousCodePatterns = copy(dangerousCodePatterns);
        redactionRules = copy(redactionRules);
        rejectedPatterns = copy(rejectedPatterns);
    }

    public static PolicyConfig defaults() {
        return fromCatalog(PatternCatalog.bundled(), true, DEFAULT_MAX_INPUT_LENGTH, true);
    }

    public static PolicyConfig fromSettings(GatewaySettings settings) {
        Objects.requireNonNull(settings, "settings");
        return fromCatalog(
                PatternCatalog.bundled(),
                settings.enabled(),
                settings.maxInputLength(),
                settings.logBlockedRequests()
        );
    }

    public static PolicyConfig fromCatalog(
            PatternCatalog catalog,
            boolean enabled,
            int maxInputLength,
            boolean logBlockedRequests
    ) {
        Objects.requireNonNull(catalog, "catalog");
        List<String> rejected = new ArrayList<>();
        PolicyConfig policy = new PolicyConfig(
                enabled,
                maxInputLength,
                logBlockedRequests,
                catalog.version(),
                compile(catalog, PatternCategory.JAILBREAK, rejected),
                compile(catalog, PatternCategory.INJECTION, rejected),
                compile(catalog, PatternCategory.BLOCKED_COMMAND, rejected),
                compile(catalog, PatternCategory.BLOCKED_PATH, rejected),
                compile(catalog, PatternCategory.TRAVERSAL, rejected),
                compile(catalog, PatternCategory.SECRET, rejected),
                compile(catalog, PatternCategory.DANGEROUS_CODE, rejected),
                compileRedactions(catalog.redactionRules(), rejected),
                rejected
        );
        if (!rejected.isEmpty()) {
            log.warn("Catalogue {} loaded with {} rejected pattern(s): {}", catalog.version(), rejected.size(), rejected);
        }
        return policy;
    }

    public PolicyConfig withEnabled(boolean value) {
        return new PolicyConfig(
                value,
                maxInputLength,
                logBlockedRequests,
                catalogVersion,
                jailbreakPatterns,
                injectionPatterns,
                blockedCommands,
                blockedPaths,
                traversalPatterns,
                secretPatterns,
                dangerousCodePatterns,
                redactionRules,
                rejectedPatterns
        );
    }

    public PolicyConfig withMaxInputLength(int value) {
        return new PolicyConfig(
                enabled,
                value,
                logBlockedRequests,
                catalogVersion,
                jailbreakPatterns,
                injectionPatterns,
                blockedCommands,
                blockedPaths,
                traversalPatterns,
                secretPatterns,
                dangerousCodePatterns,
                redactionRules,
                rejectedPatterns
        );
    }

    public PolicyConfig withLogBlockedRequests(boolean value) {
        return new PolicyConfig(
                enabled,
                maxInputLength,
                value,
                catalogVersion,
                jailbreakPatterns,
                injectionPatterns,
                blockedCommands,
                blockedPaths,
                traversalPatterns,
                secretPatterns,
                dangerousCodePatterns,
                redactionRules,
                rejectedPatterns
        );
    }

    private static List<PatternRule> compile(PatternCatalog catalog, PatternCategory category, List<String> rejected) {
        List<PatternRule> rules = new ArrayList<>();
        for (PatternCatalog.Entry entry : catalog.entriesOf(category)) {
            String name = entry.name() == null || entry.name().isBlank() ? category.name().toLowerCase(Locale.ROOT) : entry.name();
            String source = entry.pattern();
            if (source == null || source.isBlank()) {
                log.warn("Empty {} pattern ignored: {}", category, name);
                rejected.add(name);
                continue;
            }
            Optional<Pattern> compiled = switch (category) {
                case BLOCKED_COMMAND -> Optional.of(PatternCompiler.compileLiteral(source));
                case BLOCKED_PATH -> Optional.of(
                        PatternCompiler.compilePathGlob(TextNormalizer.normalizeBlockedPath(source))
                );
                default -> PatternCompiler.compileRegex(source);
            };
            if (compiled.isPresent()) {
                rules.add(new PatternRule(name, category, source, compiled.get()));
            } else {
                rejected.add(name);
            }
        }
        return rules;
    }

    private static List<RedactionRule> compileRedactions(List<PatternCatalog.Redaction> entries, List<String> rejected) {
        List<RedactionRule> rules = new ArrayList<>();
        for (PatternCatalog.Redaction entry : entries) {
            String name = entry.name() == null ? "redaction" : entry.name();
            Optional<Pattern> compiled = entry.pattern() == null
                    ? Optional.empty()
                    : PatternCompiler.compileRegex(entry.pattern());
            if (compiled.isEmpty() || entry.replacement() == null) {
                rejected.add(name);
                continue;
            }
            try {
                rules.add(new RedactionRule(name, compiled.get(), entry.replacement()));
            } catch (IllegalArgumentException error) {
                log.warn("Redaction rule ignored: {}", error.getMessage());
                rejected.add(name);
            }
        }
        return rules;
    }

    private static <T> List<T> copy(List<T> values) {
        return values == null ? List.of() : List.copyOf(values);
    }
}
