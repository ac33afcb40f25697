package com.codeagent.guard.service;

import com.codeagent.guard.config.GatewaySettings;
import com.codeagent.guard.config.PolicyConfig;
import com.codeagent.guard.service.PolicyBackend.BackendMessage;
import com.codeagent.guard.service.PolicyBackend.BackendVerdict;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Mediates text going into and coming out of the assistant. Input is rejected with a fixed,
 * category-level message; output is never rejected, only redacted and sanitized.
 */
public final class SafetyGateway implements AutoCloseable {
    public static final String JAILBREAK_MESSAGE =
            "I cannot help with that request. I'm designed to assist with legitimate coding tasks only.";
    public static final String INJECTION_MESSAGE =
            "Potentially dangerous command detected. Please rephrase your request without destructive operations.";
    public static final String PATH_MESSAGE =
            "Cannot access system directories or sensitive paths. Please specify a safe working directory.";
    public static final String VALIDATION_MESSAGE =
            "Input validation failed. Please check your request and try again.";
    public static final Duration DEFAULT_BACKEND_TIMEOUT =
            Duration.ofMillis(GatewaySettings.DEFAULT_BACKEND_TIMEOUT_MILLIS);

    private static final Logger log = LoggerFactory.getLogger(SafetyGateway.class);
    private static final Object SHARED_LOCK = new Object();
    private static volatile SafetyGateway shared;

    private static final String BACKEND_RAIL = "policy-backend";
    private static final List<String> OUTPUT_RAILS = List.of("secret-redaction", "command-sanitizer");

    private record Stage(
            String name,
            String rejectionMessage,
            BiFunction<String, PolicyConfig, Optional<Finding>> check
    ) {}

    private static final List<Stage> INPUT_STAGES = List.of(
            new Stage("jailbreak", JAILBREAK_MESSAGE, DetectionActions::checkJailbreak),
            new Stage("injection", INJECTION_MESSAGE, DetectionActions::checkInjection),
            new Stage("unsafe-path", PATH_MESSAGE, DetectionActions::checkUnsafePath),
            new Stage("input-safety", VALIDATION_MESSAGE, DetectionActions::checkInputSafety)
    );

    private final PolicyConfig policy;
    private final PolicyBackend backend;
    private final Duration backendTimeout;
    private final RedactionEngine redactionEngine;
    private final GatewayWorkers workers;
    private final boolean backendInitialized;
    private volatile boolean closed;

    private SafetyGateway(PolicyConfig policy, PolicyBackend backend, Duration backendTimeout, int workerThreads) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.backendTimeout = Objects.requireNonNull(backendTimeout, "backendTimeout");
        this.redactionEngine = new RedactionEngine(policy);
        this.workers = new GatewayWorkers(workerThreads);
        this.backendInitialized = policy.enabled() && initializeBackend(backend);
        if (!policy.enabled()) {
            log.warn("Safety gateway is DISABLED; all input is allowed and output is returned unchanged");
        }
    }

    public static SafetyGateway create(PolicyConfig policy) {
        return create(policy, PolicyBackend.none());
    }

    public static SafetyGateway create(PolicyConfig policy, PolicyBackend backend) {
        return create(policy, backend, DEFAULT_BACKEND_TIMEOUT, GatewaySettings.DEFAULT_WORKER_THREADS);
    }

    public static SafetyGateway create(
            PolicyConfig policy,
            PolicyBackend backend,
            Duration backendTimeout,
            int workerThreads
    ) {
        return new SafetyGateway(policy, backend, backendTimeout, workerThreads);
    }

    public static SafetyGateway fromSettings(GatewaySettings settings) {
        Objects.requireNonNull(settings, "settings");
        return create(
                PolicyConfig.fromSettings(settings),
                new HttpPolicyBackend(settings.configPath(), settings.backendTimeout()),
                settings.backendTimeout(),
                settings.workerThreads()
        );
    }

    public static SafetyGateway shared() {
        return shared(() -> fromSettings(GatewaySettings.fromEnvironment()));
    }

    /** Returns the shared gateway, building it with {@code factory} only if none exists yet. */
    public static SafetyGateway shared(Supplier<SafetyGateway> factory) {
        SafetyGateway current = shared;
        if (current != null) {
            return current;
        }
        synchronized (SHARED_LOCK) {
            if (shared == null) {
                shared = Objects.requireNonNull(factory.get(), "factory returned null");
            }
            return shared;
        }
    }

    public static void reset() {
        SafetyGateway previous;
        synchronized (SHARED_LOCK) {
            previous = shared;
            shared = null;
        }
        if (previous != null) {
            previous.close();
        }
    }

    public InputVerdict checkInput(String text) {
        ensureOpen();
        String candidate = text == null ? "" : text;
        if (!policy.enabled()) {
            return InputVerdict.allowed();
        }
        if (backendInitialized) {
            Optional<InputVerdict> fromBackend = consultBackend(candidate);
            if (fromBackend.isPresent()) {
                return fromBackend.get();
            }
        }
        return runBuiltInChecks(candidate);
    }

    public CompletableFuture<InputVerdict> checkInputAsync(String text) {
        return checkInputAsync(text, backendTimeout);
    }

    /**
     * Non-blocking input check. {@code deadline} bounds the backend call; cancelling the returned
     * future cancels a backend call still in flight.
     */
    public CompletableFuture<InputVerdict> checkInputAsync(String text, Duration deadline) {
        ensureOpen();
        Objects.requireNonNull(deadline, "deadline");
        String candidate = text == null ? "" : text;
        if (!policy.enabled()) {
            return CompletableFuture.completedFuture(InputVerdict.allowed());
        }
        Executor executor = workers.executorForCaller();
        if (!backendInitialized) {
            return CompletableFuture.supplyAsync(() -> runBuiltInChecks(candidate), executor);
        }

        CompletableFuture<BackendVerdict> backendCall = startBackendCall(candidate);
        Duration bound = deadline.compareTo(backendTimeout) < 0 ? deadline : backendTimeout;
        CompletableFuture<InputVerdict> result = backendCall
                .thenApply(Function.<BackendVerdict>identity())
                .orTimeout(Math.max(1, bound.toMillis()), TimeUnit.MILLISECONDS)
                .handle((verdict, error) -> {
                    if (error != null) {
                        boolean cancelledByCaller = backendCall.isCancelled();
                        backendCall.cancel(true);
                        if (!cancelledByCaller) {
                            logDegraded(unwrap(error));
                        }
                        return Optional.<BackendVerdict>empty();
                    }
                    return Optional.ofNullable(verdict);
                })
                .thenApplyAsync(verdict -> verdict
                        .filter(BackendVerdict::blocked)
                        .map(this::blockedByBackend)
                        .orElseGet(() -> runBuiltInChecks(candidate)), executor);
        result.whenComplete((ignored, error) -> {
            if (result.isCancelled()) {
                backendCall.cancel(true);
            }
        });
        return result;
    }

    public String processOutput(String text) {
        ensureOpen();
        if (!policy.enabled() || text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        Optional<Finding> secret = DetectionActions.detectSecrets(result, policy);
        if (secret.isPresent()) {
            log.info("Redacting output; secret pattern {} fired", secret.get().matchedPattern());
            result = redactionEngine.redact(result);
        }
        Optional<Finding> command = DetectionActions.checkOutputSafety(result, policy);
        if (command.isPresent()) {
            log.info("Sanitizing output; blocked command {} present", command.get().matchedPattern());
            result = redactionEngine.sanitizeCommands(result);
        }
        return result;
    }

    public CompletableFuture<String> processOutputAsync(String text) {
        ensureOpen();
        return CompletableFuture.supplyAsync(() -> processOutput(text), workers.executorForCaller());
    }

    public ResponseStreamGuard openResponseStream() {
        ensureOpen();
        return new ResponseStreamGuard(this);
    }

    public GatewayStatus getStatus() {
        return new GatewayStatus(
                policy.enabled(),
                backend.isAvailable(),
                backendInitialized,
                policy.catalogVersion(),
                inputRails(),
                OUTPUT_RAILS,
                policy.jailbreakPatterns().size(),
                policy.injectionPatterns().size(),
                policy.blockedCommands().size(),
                policy.blockedPaths().size(),
                policy.traversalPatterns().size(),
                policy.secretPatterns().size(),
                policy.dangerousCodePatterns().size(),
                policy.redactionRules().size(),
                policy.rejectedPatterns().size()
        );
    }

    /** Input rails in the order they run; the backend rail leads when it is in use. */
    private List<String> inputRails() {
        List<String> rails = new ArrayList<>();
        if (backendInitialized) {
            rails.add(BACKEND_RAIL);
        }
        INPUT_STAGES.forEach(stage -> rails.add(stage.name()));
        return List.copyOf(rails);
    }

    public PolicyConfig policy() {
        return policy;
    }

    public boolean isBackendInitialized() {
        return backendInitialized;
    }

    GatewayWorkers workers() {
        return workers;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        workers.close();
    }

    private InputVerdict runBuiltInChecks(String text) {
        for (Stage stage : INPUT_STAGES) {
            Optional<Finding> finding = stage.check().apply(text, policy);
            if (finding.isPresent()) {
                logBlocked(finding.get(), text);
                return InputVerdict.blocked(stage.rejectionMessage());
            }
        }
        return InputVerdict.allowed();
    }

    private Optional<InputVerdict> consultBackend(String text) {
        CompletableFuture<BackendVerdict> call = startBackendCall(text);
        try {
            BackendVerdict verdict = call.get(backendTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (verdict != null && verdict.blocked()) {
                return Optional.of(blockedByBackend(verdict));
            }
            return Optional.empty();
        } catch (TimeoutException error) {
            call.cancel(true);
            logDegraded(error);
            return Optional.empty();
        } catch (ExecutionException error) {
            logDegraded(unwrap(error));
            return Optional.empty();
        } catch (InterruptedException error) {
            Thread.currentThread().interrupt();
            call.cancel(true);
            logDegraded(error);
            return Optional.empty();
        }
    }

    private CompletableFuture<BackendVerdict> startBackendCall(String text) {
        try {
            CompletableFuture<BackendVerdict> call = backend.evaluate(List.of(BackendMessage.user(text)));
            return call == null
                    ? CompletableFuture.failedFuture(new BackendUnavailableException("Backend returned no result"))
                    : call;
        } catch (RuntimeException error) {
            return CompletableFuture.failedFuture(error);
        }
    }

    private InputVerdict blockedByBackend(BackendVerdict verdict) {
        String message = verdict.message() == null || verdict.message().isBlank()
                ? HttpPolicyBackend.DEFAULT_BLOCK_MESSAGE
                : verdict.message();
        if (policy.logBlockedRequests()) {
            log.warn("Blocked input: source=backend");
        }
        return InputVerdict.blocked(message);
    }

    private void logBlocked(Finding finding, String text) {
        if (!policy.logBlockedRequests()) {
            return;
        }
        log.warn(
                "Blocked input: category={} pattern={} length={}",
                finding.category(),
                finding.matchedPattern(),
                text.length()
        );
    }

    private void logDegraded(Throwable error) {
        String reason = error instanceof TimeoutException
                ? "timed out after " + backendTimeout.toMillis() + " ms"
                : error.getClass().getSimpleName() + ": " + error.getMessage();
        log.warn("Policy backend unavailable ({}); falling back to built-in checks", reason);
    }

    private static boolean initializeBackend(PolicyBackend backend) {
        try {
            return backend.initialize();
        } catch (RuntimeException error) {
            log.error("Policy backend initialization failed; using built-in checks only", error);
            return false;
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Safety gateway has been closed");
        }
    }
}
