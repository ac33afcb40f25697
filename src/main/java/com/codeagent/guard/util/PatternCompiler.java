package com.codeagent.guard.util;

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class PatternCompiler {
    private static final Logger log = LoggerFactory.getLogger(PatternCompiler.class);
    private static final Pattern NEVER_MATCHES = Pattern.compile("$a");

    private PatternCompiler() {
    }

    public static Optional<Pattern> compileRegex(String regex) {
        if (regex == null || regex.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        } catch (PatternSyntaxException error) {
            log.warn("Invalid regex ignored: {} ({})", regex, error.getDescription());
            return Optional.empty();
        }
    }

    public static Pattern compileLiteral(String literal) {
        if (literal == null || literal.isEmpty()) {
            return NEVER_MATCHES;
        }
        return Pattern.compile(Pattern.quote(literal), Pattern.CASE_INSENSITIVE);
    }

    /**
     * Compiles an already normalised path. A {@code *} stands for exactly one path segment, every
     * other character is literal.
     */
    public static Pattern compilePathGlob(String normalizedPath) {
        if (normalizedPath == null || normalizedPath.isEmpty()) {
            return NEVER_MATCHES;
        }
        if (normalizedPath.indexOf('*') < 0) {
            return compileLiteral(normalizedPath);
        }
        StringBuilder regex = new StringBuilder();
        int start = 0;
        int star;
        while ((star = normalizedPath.indexOf('*', start)) >= 0) {
            if (star > start) {
                regex.append(Pattern.quote(normalizedPath.substring(start, star)));
            }
            regex.append("[^/]*");
            start = star + 1;
        }
        if (start < normalizedPath.length()) {
            regex.append(Pattern.quote(normalizedPath.substring(start)));
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE);
    }
}
