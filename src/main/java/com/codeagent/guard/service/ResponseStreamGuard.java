package com.codeagent.guard.service;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Accumulates a streamed model response. Chunks pass through unchanged as they arrive; the
 * assembled text is run through output processing once, on {@link #complete()}, so callers can
 * replace what they already displayed when {@link Completion#modified()} is set.
 */
public final class ResponseStreamGuard {
    private static final Logger log = LoggerFactory.getLogger(ResponseStreamGuard.class);

    public record Completion(String text, boolean modified) {}

    private final SafetyGateway gateway;
    private final StringBuilder buffer = new StringBuilder();
    private Completion completion;

    ResponseStreamGuard(SafetyGateway gateway) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
    }

    public synchronized String append(CharSequence chunk) {
        if (completion != null) {
            throw new IllegalStateException("Response stream already completed");
        }
        String text = chunk == null ? "" : chunk.toString();
        buffer.append(text);
        return text;
    }

    public synchronized Completion complete() {
        if (completion != null) {
            return completion;
        }
        String original = buffer.toString();
        String processed = gateway.processOutput(original);
        boolean modified = !original.equals(processed);
        if (modified) {
            log.info("Streamed response of length {} was modified by output processing", original.length());
        }
        completion = new Completion(processed, modified);
        return completion;
    }

    public synchronized int bufferedLength() {
        return buffer.length();
    }
}
