package com.codeagent.guard.service;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * An optional external policy engine consulted before the built-in checks. {@link #evaluate}
 * must return promptly; the work itself belongs in the returned future, which the gateway may
 * cancel.
 */
public interface PolicyBackend {
    record BackendMessage(String role, String content) {
        public BackendMessage {
            Objects.requireNonNull(role, "role");
            content = content == null ? "" : content;
        }

        public static BackendMessage user(String content) {
            return new BackendMessage("user", content);
        }
    }

    record BackendVerdict(boolean blocked, String message) {}

    boolean initialize();

    boolean isInitialized();

    CompletableFuture<BackendVerdict> evaluate(List<BackendMessage> messages);

    default boolean isAvailable() {
        return true;
    }

    static PolicyBackend none() {
        return NoBackend.INSTANCE;
    }

    enum NoBackend implements PolicyBackend {
        INSTANCE;

        @Override
        public boolean initialize() {
            return false;
        }

        @Override
        public boolean isInitialized() {
            return false;
        }

        @Override
        public CompletableFuture<BackendVerdict> evaluate(List<BackendMessage> messages) {
            return CompletableFuture.failedFuture(new BackendUnavailableException("No policy backend configured"));
        }

        @Override
        public boolean isAvailable() {
            return false;
        }
    }
}
