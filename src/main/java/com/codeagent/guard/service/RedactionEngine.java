package com.codeagent.guard.service;

import com.codeagent.guard.config.PatternRule;
import com.codeagent.guard.config.PolicyConfig;
import com.codeagent.guard.config.RedactionRule;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Applies the policy's redaction rules in order. Provider-specific rules come before generic
 * key/value rules in the catalogue, and every replacement is stable under a second pass.
 */
public final class RedactionEngine {
    public static final String MASK = "***REDACTED***";
    public static final String BLOCKED_COMMAND_PLACEHOLDER = "[BLOCKED COMMAND]";

    private static final String BLOCKED_COMMAND_REPLACEMENT = Matcher.quoteReplacement(BLOCKED_COMMAND_PLACEHOLDER);

    private final List<RedactionRule> rules;
    private final List<PatternRule> blockedCommands;

    public RedactionEngine(PolicyConfig policy) {
        Objects.requireNonNull(policy, "policy");
        this.rules = policy.redactionRules();
        this.blockedCommands = policy.blockedCommands();
    }

    public String redact(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (RedactionRule rule : rules) {
            result = rule.apply(result);
        }
        return result;
    }

    public String sanitizeCommands(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (PatternRule command : blockedCommands) {
            result = command.pattern().matcher(result).replaceAll(BLOCKED_COMMAND_REPLACEMENT);
        }
        return result;
    }

    public static String mask(String token) {
        if (token == null || token.isEmpty()) {
            return "";
        }
        int length = token.length();
        if (length <= 8) {
            return "*".repeat(length);
        }
        return token.substring(0, 4) + "*".repeat(length - 8) + token.substring(length - 4);
    }
}
