package com.codeagent.guard.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.codeagent.guard.config.PolicyConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ResponseStreamGuardTest {
    private final SafetyGateway gateway = SafetyGateway.create(PolicyConfig.defaults());

    @AfterEach
    void closeGateway() {
        gateway.close();
    }

    @Test
    void secretSplitAcrossChunksIsRedactedOnCompletion() {
        ResponseStreamGuard stream = gateway.openResponseStream();
        assertEquals("api_key = 'sk-abc123", stream.append("api_key = 'sk-abc123"));
        stream.append("def456ghi789jkl012mno345'");
        ResponseStreamGuard.Completion completion = stream.complete();
        assertTrue(completion.modified());
        assertEquals("api_key = '***REDACTED***'", completion.text());
    }

    @Test
    void cleanStreamIsUnmodified() {
        ResponseStreamGuard stream = gateway.openResponseStream();
        stream.append("def add(a, b):\n");
        stream.append(null);
        stream.append("    return a + b\n");
        ResponseStreamGuard.Completion completion = stream.complete();
        assertFalse(completion.modified());
        assertEquals("def add(a, b):\n    return a + b\n", completion.text());
        assertEquals(completion.text().length(), stream.bufferedLength());
    }

    @Test
    void completionIsFinal() {
        ResponseStreamGuard stream = gateway.openResponseStream();
        stream.append("run rm -rf / now");
        ResponseStreamGuard.Completion completion = stream.complete();
        assertEquals("run [BLOCKED COMMAND] now", completion.text());
        assertSame(completion, stream.complete());
        assertThrows(IllegalStateException.class, () -> stream.append("more"));
    }
}
