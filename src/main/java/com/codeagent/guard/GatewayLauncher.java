package com.codeagent.guard;

import com.codeagent.guard.config.GatewaySettings;
import com.codeagent.guard.service.GatewayStatus;
import com.codeagent.guard.service.InputVerdict;
import com.codeagent.guard.service.SafetyGateway;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public final class GatewayLauncher {
    private GatewayLauncher() {
    }

    public static void main(String[] args) throws IOException {
        if (args.length == 0) {
            printUsage();
            System.exit(2);
            return;
        }
        GatewaySettings settings = GatewaySettings.fromEnvironment();
        SafetyGateway gateway = SafetyGateway.shared(() -> SafetyGateway.fromSettings(settings));
        int exitCode;
        try {
            exitCode = run(gateway, args[0], textArgument(args));
        } finally {
            SafetyGateway.reset();
        }
        System.exit(exitCode);
    }

    static int run(SafetyGateway gateway, String command, String text) throws IOException {
        switch (command) {
            case "check" -> {
                InputVerdict verdict = gateway.checkInput(text);
                if (verdict.safe()) {
                    System.out.println("ALLOWED");
                    return 0;
                }
                System.out.println("BLOCKED: " + verdict.reason());
                return 1;
            }
            case "redact" -> {
                System.out.print(gateway.processOutput(text));
                return 0;
            }
            case "status" -> {
                GatewayStatus status = gateway.getStatus();
                System.out.println(new ObjectMapper().writerWithDefaultPrettyPrinter().writeValueAsString(status));
                return 0;
            }
            default -> {
                System.err.println("Unknown command: " + command);
                printUsage();
                return 2;
            }
        }
    }

    private static String textArgument(String[] args) throws IOException {
        if (args.length > 1) {
            return String.join(" ", Arrays.copyOfRange(args, 1, args.length));
        }
        if (!"status".equals(args[0])) {
            return new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
        }
        return "";
    }

    private static void printUsage() {
        System.err.println("Usage: guardrails-gateway <check|redact|status> [text]");
        System.err.println("Without text, check and redact read from standard input.");
    }
}
