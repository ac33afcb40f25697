package com.codeagent.guard.service;

import com.codeagent.guard.config.PatternRule;
import com.codeagent.guard.config.PolicyConfig;
import com.codeagent.guard.util.TextNormalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateless checks over a piece of text. Each returns the first finding, or empty when the text
 * passes. A {@code null} text is checked as the empty string.
 */
public final class DetectionActions {
    private static final Logger log = LoggerFactory.getLogger(DetectionActions.class);
    private static final double MAX_SPECIAL_CHARACTER_RATIO = 0.5;

    private DetectionActions() {
    }

    public static Optional<Finding> checkJailbreak(String text, PolicyConfig policy) {
        return firstMatch(policy.jailbreakPatterns(), text)
                .map(rule -> new Finding(Finding.Category.JAILBREAK, rule.name(), "Jailbreak pattern matched"));
    }

    public static Optional<Finding> checkInjection(String text, PolicyConfig policy) {
        Optional<PatternRule> regex = firstMatch(policy.injectionPatterns(), text);
        if (regex.isPresent()) {
            return Optional.of(new Finding(
                    Finding.Category.INJECTION,
                    regex.get().name(),
                    "Injection pattern matched"
            ));
        }
        return firstMatch(policy.blockedCommands(), text)
                .map(rule -> new Finding(
                        Finding.Category.INJECTION,
                        rule.name(),
                        "Blocked command present: " + rule.source()
                ));
    }

    public static Optional<Finding> checkUnsafePath(String text, PolicyConfig policy) {
        String normalized = TextNormalizer.normalizePath(text);
        Optional<PatternRule> blocked = firstMatch(policy.blockedPaths(), normalized);
        if (blocked.isPresent()) {
            return Optional.of(new Finding(
                    Finding.Category.PATH_TRAVERSAL,
                    blocked.get().name(),
                    "Blocked path referenced: " + blocked.get().source()
            ));
        }
        return firstMatch(policy.traversalPatterns(), text)
                .map(rule -> new Finding(Finding.Category.PATH_TRAVERSAL, rule.name(), "Path traversal pattern matched"));
    }

    public static Optional<Finding> checkInputSafety(String text, PolicyConfig policy) {
        int length = TextNormalizer.length(text);
        if (length > policy.maxInputLength()) {
            return Optional.of(new Finding(
                    Finding.Category.LENGTH_VIOLATION,
                    "max-input-length",
                    "Input too long: " + length + " > " + policy.maxInputLength()
            ));
        }
        if (TextNormalizer.containsNul(text)) {
            return Optional.of(new Finding(Finding.Category.CONTROL_CHARACTER, "nul-byte", "Input contains a NUL character"));
        }
        double ratio = TextNormalizer.specialCharacterRatio(text);
        if (ratio > MAX_SPECIAL_CHARACTER_RATIO) {
            return Optional.of(new Finding(
                    Finding.Category.OBFUSCATION_RATIO,
                    "special-character-ratio",
                    String.format(Locale.ROOT, "High special character ratio: %.2f", ratio)
            ));
        }
        return Optional.empty();
    }

    public static Optional<Finding> checkOutputSafety(String text, PolicyConfig policy) {
        return firstMatch(policy.blockedCommands(), text)
                .map(rule -> new Finding(
                        Finding.Category.BLOCKED_COMMAND_OUTPUT,
                        rule.name(),
                        "Output contains blocked command: " + rule.source()
                ));
    }

    public static Optional<Finding> detectSecrets(String text, PolicyConfig policy) {
        return firstMatch(policy.secretPatterns(), text)
                .map(rule -> new Finding(Finding.Category.SECRET_LEAK, rule.name(), "Potential secret detected"));
    }

    public static Optional<Finding> checkDangerousCode(String text, PolicyConfig policy) {
        return firstMatch(policy.dangerousCodePatterns(), text)
                .map(rule -> new Finding(Finding.Category.DANGEROUS_CODE, rule.name(), "Dangerous code pattern matched"));
    }

    /** Every secret occurrence in {@code text}, each with a masked excerpt in its message. */
    public static List<Finding> scanSecrets(String text, PolicyConfig policy) {
        String candidate = TextNormalizer.orEmpty(text);
        List<Finding> findings = new ArrayList<>();
        for (PatternRule rule : policy.secretPatterns()) {
            try {
                Matcher matcher = rule.pattern().matcher(candidate);
                while (matcher.find()) {
                    findings.add(new Finding(
                            Finding.Category.SECRET_LEAK,
                            rule.name(),
                            "Potential secret at " + matcher.start() + ": " + RedactionEngine.mask(matcher.group())
                    ));
                }
            } catch (StackOverflowError error) {
                log.warn("Pattern {} overflowed on input of length {}; treated as no match", rule.name(), candidate.length());
            }
        }
        return findings;
    }

    static Optional<PatternRule> firstMatch(List<PatternRule> rules, String text) {
        String candidate = TextNormalizer.orEmpty(text);
        for (PatternRule rule : rules) {
            boolean matched;
            try {
                matched = rule.matches(candidate);
            } catch (StackOverflowError error) {
                log.warn("Pattern {} overflowed on input of length {}; treated as no match", rule.name(), candidate.length());
                matched = false;
            }
            if (matched) {
                log.debug("{} pattern fired: {}", rule.category(), rule.name());
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }
}
