package com.graphivault.infrastructure.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link EncryptionGateway} that launches the collaborator as a child process per call.
 *
 * <p>Wire contract: the configured base command, then the operation name and
 * {@code --flag value} pairs. The child prints one JSON envelope
 * {@code {"success": bool, "data": ..., "error": "..."}} on stdout and exits.
 * Results are normalized as follows:
 * <ul>
 *   <li>launch or I/O failure, empty stdout, unparseable or flagless JSON: transport error</li>
 *   <li>non-zero exit: failure carrying the envelope's error, else stderr, else the exit code</li>
 *   <li>{@code success=false}: failure carrying the envelope's error</li>
 * </ul>
 */
@Slf4j
public class ProcessEncryptionGateway implements EncryptionGateway {

    private static final List<String> OUTPUT_FIELDS = List.of("data", "encrypted_path", "output_path", "path");

    private final CommandRunner commandRunner;
    private final List<String> baseCommand;
    private final PasswordTransport passwordTransport;
    private final ObjectMapper objectMapper;

    public ProcessEncryptionGateway(CommandRunner commandRunner, List<String> baseCommand,
                                    PasswordTransport passwordTransport, ObjectMapper objectMapper) {
        this.commandRunner = commandRunner;
        this.baseCommand = List.copyOf(baseCommand);
        this.passwordTransport = passwordTransport;
        this.objectMapper = objectMapper;
    }

    @Override
    public GatewayResult execute(GatewayRequest request) {
        List<String> command = buildCommand(request);
        String stdin = passwordTransport == PasswordTransport.STDIN && request.getPassword() != null
            ? stdinPayload(request.getPassword())
            : null;

        log.debug("Calling encryption gateway: {}", request);
        CommandRunner.CommandResult result;
        try {
            result = commandRunner.run(command, stdin);
        } catch (IOException e) {
            log.error("Failed to run encryption gateway for {}", request.getOperation(), e);
            return GatewayResult.transportError("Failed to run encryption gateway: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return GatewayResult.transportError("Interrupted while waiting for encryption gateway");
        }

        GatewayResult normalized = interpret(request, result);
        if (normalized.isSuccess()) {
            log.info("Encryption gateway {} succeeded", request.getOperation());
        } else {
            log.warn("Encryption gateway {} returned {}: {}",
                request.getOperation(), normalized.getOutcome(), normalized.getReason());
        }
        return normalized;
    }

    /**
     * The gateway reads one JSON object from stdin and takes the password from its {@code password} field.
     */
    String stdinPayload(String password) {
        return objectMapper.createObjectNode().put("password", password).toString();
    }

    List<String> buildCommand(GatewayRequest request) {
        List<String> command = new ArrayList<>(baseCommand);
        command.add(request.getOperation().commandName());
        if (request.getVaultRoot() != null) {
            command.add("--vault-path");
            command.add(request.getVaultRoot().toString());
        }
        if (request.getSourcePath() != null) {
            command.add("--file-path");
            command.add(request.getSourcePath().toString());
        }
        if (request.getOutputPath() != null) {
            command.add("--output-path");
            command.add(request.getOutputPath().toString());
        }
        if (passwordTransport == PasswordTransport.ARGUMENT && request.getPassword() != null) {
            command.add("--password");
            command.add(request.getPassword());
        }
        return command;
    }

    private GatewayResult interpret(GatewayRequest request, CommandRunner.CommandResult result) {
        String stderr = result.stderr() == null ? "" : result.stderr().strip();
        String stdout = result.stdout() == null ? "" : result.stdout().strip();

        // the gateway prints its envelope even when it exits non-zero
        Optional<JsonNode> envelope = Optional.empty();
        String parseFailure = null;
        if (!stdout.isEmpty()) {
            try {
                envelope = Optional.ofNullable(objectMapper.readTree(stdout))
                    .filter(node -> node.isObject() && node.path("success").isBoolean());
            } catch (JsonProcessingException e) {
                parseFailure = e.getOriginalMessage();
            }
        }

        if (result.exitCode() != 0) {
            Optional<String> reason = envelope.flatMap(node -> text(node, "error"));
            return GatewayResult.failure(reason.orElseGet(() -> stderr.isEmpty()
                ? "Encryption gateway exited with code " + result.exitCode()
                : stderr));
        }

        if (stdout.isEmpty()) {
            return GatewayResult.transportError(stderr.isEmpty()
                ? "Empty response from encryption gateway"
                : "Empty response from encryption gateway. stderr: " + stderr);
        }
        if (parseFailure != null) {
            return GatewayResult.transportError("Failed to parse encryption gateway response: " + parseFailure);
        }
        if (envelope.isEmpty()) {
            return GatewayResult.transportError("Encryption gateway response has no success flag");
        }
        return interpretEnvelope(request, envelope.get());
    }

    private GatewayResult interpretEnvelope(GatewayRequest request, JsonNode envelope) {
        if (!envelope.get("success").booleanValue()) {
            return GatewayResult.failure(text(envelope, "error").orElse("Unknown error"));
        }

        Optional<String> outputRef = findOutput(envelope);
        JsonNode data = envelope.get("data");
        if (outputRef.isEmpty() && data != null && data.isObject()) {
            outputRef = findOutput(data);
        }

        switch (request.getOperation()) {
            case ENCRYPT_FILE:
                return outputRef.map(GatewayResult::success)
                    .orElseGet(() -> GatewayResult.transportError("No encrypted path in encryption gateway response"));
            case DECRYPT_FILE:
                return GatewayResult.success(outputRef.orElseGet(() ->
                    request.getOutputPath() == null ? null : request.getOutputPath().toString()));
            default:
                return GatewayResult.success(outputRef.or(() -> text(envelope, "message")).orElse(null));
        }
    }

    private static Optional<String> findOutput(JsonNode node) {
        return OUTPUT_FIELDS.stream()
            .map(field -> text(node, field))
            .flatMap(Optional::stream)
            .findFirst();
    }

    private static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.textValue().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.textValue());
    }
}
