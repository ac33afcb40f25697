package com.codeagent.guard.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.Test;

class GatewaySettingsTest {

    @Test
    void defaultsApplyWhenNothingIsSet() {
        GatewaySettings settings = GatewaySettings.defaults();
        assertTrue(settings.enabled());
        assertEquals(Path.of("guardrails_config"), settings.configPath());
        assertEquals(100_000, settings.maxInputLength());
        assertTrue(settings.logBlockedRequests());
        assertEquals(Duration.ofMillis(2000), settings.backendTimeout());
        assertEquals(4, settings.workerThreads());
    }

    @Test
    void readsEveryKey() {
        GatewaySettings settings = GatewaySettings.fromSource(Map.of(
                "GUARDRAILS_ENABLED", "TRUE",
                "GUARDRAILS_CONFIG_PATH", " /opt/guard ",
                "GUARDRAILS_MAX_INPUT", "5000",
                "GUARDRAILS_LOG_BLOCKED", "false",
                "GUARDRAILS_BACKEND_TIMEOUT_MS", "750",
                "GUARDRAILS_WORKER_THREADS", "2"
        )::get);
        assertTrue(settings.enabled());
        assertEquals(Path.of("/opt/guard"), settings.configPath());
        assertEquals(5000, settings.maxInputLength());
        assertFalse(settings.logBlockedRequests());
        assertEquals(Duration.ofMillis(750), settings.backendTimeout());
        assertEquals(2, settings.workerThreads());
    }

    @Test
    void onlyLiteralTrueEnables() {
        assertFalse(GatewaySettings.fromSource(Map.of("GUARDRAILS_ENABLED", "yes")::get).enabled());
        assertFalse(GatewaySettings.fromSource(Map.of("GUARDRAILS_ENABLED", "1")::get).enabled());
        assertTrue(GatewaySettings.fromSource(Map.of("GUARDRAILS_ENABLED", "  ")::get).enabled());
    }

    @Test
    void malformedNumbersFallBackToDefaults() {
        GatewaySettings settings = GatewaySettings.fromSource(Map.of(
                "GUARDRAILS_MAX_INPUT", "lots",
                "GUARDRAILS_BACKEND_TIMEOUT_MS", "soon",
                "GUARDRAILS_WORKER_THREADS", "-3"
        )::get);
        assertEquals(100_000, settings.maxInputLength());
        assertEquals(Duration.ofMillis(2000), settings.backendTimeout());
        assertEquals(4, settings.workerThreads());
    }

    @Test
    void backendTimeoutHasAFloor() {
        GatewaySettings settings = GatewaySettings.fromSource(Map.of("GUARDRAILS_BACKEND_TIMEOUT_MS", "5")::get);
        assertEquals(Duration.ofMillis(100), settings.backendTimeout());
    }
}
