package com.codeagent.guard.config;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record RedactionRule(String name, Pattern pattern, String replacement) {
    private static final Pattern GROUP_REFERENCE = Pattern.compile("\\$(\\d+)");

    public RedactionRule {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(replacement, "replacement");
        int groups = pattern.matcher("").groupCount();
        int highest = highestGroupReference(replacement);
        if (highest > groups) {
            throw new IllegalArgumentException(
                    "Replacement for " + name + " references group $" + highest + " but pattern has " + groups
            );
        }
    }

    public String apply(String text) {
        return pattern.matcher(text).replaceAll(replacement);
    }

    private static int highestGroupReference(String replacement) {
        Matcher matcher = GROUP_REFERENCE.matcher(replacement);
        int highest = 0;
        while (matcher.find()) {
            highest = Math.max(highest, Integer.parseInt(matcher.group(1)));
        }
        return highest;
    }
}
