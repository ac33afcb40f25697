package com.codeagent.guard.service;

import java.util.List;

public record GatewayStatus(
        boolean enabled,
        boolean externalBackendAvailable,
        boolean externalBackendInitialized,
        String catalogVersion,
        List<String> inputRails,
        List<String> outputRails,
        int jailbreakPatterns,
        int injectionPatterns,
        int blockedCommands,
        int blockedPaths,
        int traversalPatterns,
        int secretPatterns,
        int dangerousCodePatterns,
        int redactionRules,
        int rejectedPatterns
) {}
