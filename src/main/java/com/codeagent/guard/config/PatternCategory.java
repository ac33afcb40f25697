package com.codeagent.guard.config;

public enum PatternCategory {
    JAILBREAK,
    INJECTION,
    BLOCKED_COMMAND,
    BLOCKED_PATH,
    TRAVERSAL,
    SECRET,
    DANGEROUS_CODE
}
