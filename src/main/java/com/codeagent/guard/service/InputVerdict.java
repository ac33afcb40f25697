package com.codeagent.guard.service;

/** Outcome of an input check. {@code reason} is the user-facing rejection message, or null when safe. */
public record InputVerdict(boolean safe, String reason) {
    private static final InputVerdict ALLOWED = new InputVerdict(true, null);

    public InputVerdict {
        if (!safe && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("A blocked verdict needs a reason");
        }
        if (safe) {
            reason = null;
        }
    }

    public static InputVerdict allowed() {
        return ALLOWED;
    }

    public static InputVerdict blocked(String reason) {
        return new InputVerdict(false, reason);
    }

    public boolean blocked() {
        return !safe;
    }
}
