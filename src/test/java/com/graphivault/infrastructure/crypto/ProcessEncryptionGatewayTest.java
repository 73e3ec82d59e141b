package com.graphivault.infrastructure.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProcessEncryptionGatewayTest {

    private static final List<String> BASE = List.of("python", "gateway.py");
    private static final Path ROOT = Path.of("/vault");

    private final ObjectMapper objectMapper = new ObjectMapper();

    /** Records the last invocation and answers with a canned result. */
    private static class FakeRunner implements CommandRunner {
        private final CommandResult answer;
        private List<String> command;
        private String stdin;

        FakeRunner(int exitCode, String stdout, String stderr) {
            this.answer = new CommandResult(exitCode, stdout, stderr);
        }

        @Override
        public CommandResult run(List<String> command, String stdin) {
            this.command = new ArrayList<>(command);
            this.stdin = stdin;
            return answer;
        }
    }

    private GatewayResult encryptWith(CommandRunner runner) {
        ProcessEncryptionGateway gateway =
            new ProcessEncryptionGateway(runner, BASE, PasswordTransport.ARGUMENT, objectMapper);
        return gateway.execute(GatewayRequest.encrypt(ROOT, Path.of("/photos/a.jpg"), "secret"));
    }

    @Test
    void success_envelope_yields_encrypted_path() {
        FakeRunner runner = new FakeRunner(0, "{\"success\": true, \"data\": \"/vault/encrypted/enc_1.bin\"}", "");

        GatewayResult result = encryptWith(runner);

        assertEquals(GatewayResult.Outcome.SUCCESS, result.getOutcome());
        assertEquals("/vault/encrypted/enc_1.bin", result.getOutputRef());
        assertEquals(List.of("python", "gateway.py", "encrypt_file",
            "--vault-path", "/vault", "--file-path", "/photos/a.jpg", "--password", "secret"), runner.command);
        assertNull(runner.stdin);
    }

    @Test
    void encrypted_path_may_sit_inside_data_object() {
        FakeRunner runner = new FakeRunner(0,
            "{\"success\": true, \"data\": {\"encrypted_path\": \"encrypted/enc_2.bin\"}}", "");

        assertEquals("encrypted/enc_2.bin", encryptWith(runner).getOutputRef());
    }

    @Test
    void refusal_envelope_is_a_failure_with_reason() {
        GatewayResult result = encryptWith(new FakeRunner(0, "{\"success\": false, \"error\": \"Vault is locked\"}", ""));

        assertEquals(GatewayResult.Outcome.FAILURE, result.getOutcome());
        assertEquals("Vault is locked", result.getReason());
    }

    @Test
    void nonzero_exit_is_a_failure_carrying_stderr() {
        GatewayResult result = encryptWith(new FakeRunner(1, "", "Traceback: boom\n"));

        assertEquals(GatewayResult.Outcome.FAILURE, result.getOutcome());
        assertEquals("Traceback: boom", result.getReason());
    }

    @Test
    void nonzero_exit_reports_the_envelope_error() {
        FakeRunner runner = new FakeRunner(1, "{\n  \"success\": false,\n  \"error\": \"Invalid password\"\n}\n", "");
        ProcessEncryptionGateway gateway =
            new ProcessEncryptionGateway(runner, BASE, PasswordTransport.ARGUMENT, objectMapper);

        GatewayResult result = gateway.execute(GatewayRequest.lifecycle(GatewayOperation.UNLOCK, ROOT, "wrong"));

        assertEquals(GatewayResult.Outcome.FAILURE, result.getOutcome());
        assertEquals("Invalid password", result.getReason());
    }

    @Test
    void nonzero_exit_prefers_envelope_error_over_stderr() {
        GatewayResult result = encryptWith(new FakeRunner(1,
            "{\"success\": false, \"error\": \"Gateway error: disk full\"}", "Traceback: boom\n"));

        assertEquals(GatewayResult.Outcome.FAILURE, result.getOutcome());
        assertEquals("Gateway error: disk full", result.getReason());
    }

    @Test
    void nonzero_exit_without_any_text_names_the_exit_code() {
        GatewayResult result = encryptWith(new FakeRunner(3, "not json", ""));

        assertEquals(GatewayResult.Outcome.FAILURE, result.getOutcome());
        assertEquals("Encryption gateway exited with code 3", result.getReason());
    }

    @Test
    void empty_output_is_a_transport_error() {
        assertEquals(GatewayResult.Outcome.TRANSPORT_ERROR, encryptWith(new FakeRunner(0, "  \n", "")).getOutcome());
    }

    @Test
    void garbage_output_is_a_transport_error() {
        GatewayResult result = encryptWith(new FakeRunner(0, "Loading keys...\nnot json", ""));

        assertEquals(GatewayResult.Outcome.TRANSPORT_ERROR, result.getOutcome());
        assertTrue(result.getReason().startsWith("Failed to parse"));
    }

    @Test
    void envelope_without_success_flag_is_a_transport_error() {
        assertEquals(GatewayResult.Outcome.TRANSPORT_ERROR,
            encryptWith(new FakeRunner(0, "{\"data\": \"x\"}", "")).getOutcome());
    }

    @Test
    void encrypt_success_without_path_is_a_transport_error() {
        assertEquals(GatewayResult.Outcome.TRANSPORT_ERROR,
            encryptWith(new FakeRunner(0, "{\"success\": true}", "")).getOutcome());
    }

    @Test
    void launch_failure_is_a_transport_error() {
        GatewayResult result = encryptWith((command, stdin) -> {
            throw new IOException("No such file or directory");
        });

        assertEquals(GatewayResult.Outcome.TRANSPORT_ERROR, result.getOutcome());
        assertTrue(result.getReason().contains("No such file or directory"));
    }

    @Test
    void interruption_restores_the_flag() {
        GatewayResult result = encryptWith((command, stdin) -> {
            throw new InterruptedException();
        });

        assertEquals(GatewayResult.Outcome.TRANSPORT_ERROR, result.getOutcome());
        assertTrue(Thread.interrupted(), "interrupt flag should be set, and is cleared here");
    }

    @Test
    void stdin_transport_keeps_password_off_the_command_line() throws Exception {
        FakeRunner runner = new FakeRunner(0, "{\"success\": true, \"message\": \"Vault unlocked\"}", "");
        ProcessEncryptionGateway gateway =
            new ProcessEncryptionGateway(runner, BASE, PasswordTransport.STDIN, objectMapper);

        GatewayResult result = gateway.execute(GatewayRequest.lifecycle(GatewayOperation.UNLOCK, ROOT, "secret"));

        assertTrue(result.isSuccess());
        assertEquals("Vault unlocked", result.getOutputRef());
        assertFalse(runner.command.contains("secret"));
        assertEquals("secret", objectMapper.readTree(runner.stdin).get("password").textValue());
    }

    @Test
    void decrypt_falls_back_to_requested_output_path() {
        FakeRunner runner = new FakeRunner(0, "{\"success\": true}", "");
        ProcessEncryptionGateway gateway =
            new ProcessEncryptionGateway(runner, BASE, PasswordTransport.ARGUMENT, objectMapper);

        GatewayResult result = gateway.execute(GatewayRequest.decrypt(ROOT,
            Path.of("/vault/encrypted/enc_1.bin"), Path.of("/vault/temp/out.jpg"), "secret"));

        assertTrue(result.isSuccess());
        assertEquals(Path.of("/vault/temp/out.jpg").toString(), result.getOutputRef());
        assertTrue(runner.command.containsAll(List.of("decrypt_file", "--output-path")));
    }

    @Test
    void lock_sends_no_password() {
        FakeRunner runner = new FakeRunner(0, "{\"success\": true}", "");
        ProcessEncryptionGateway gateway =
            new ProcessEncryptionGateway(runner, BASE, PasswordTransport.ARGUMENT, objectMapper);

        GatewayResult result = gateway.execute(GatewayRequest.lifecycle(GatewayOperation.LOCK, ROOT, null));

        assertTrue(result.isSuccess());
        assertNull(result.getOutputRef());
        assertEquals(List.of("python", "gateway.py", "lock", "--vault-path", "/vault"), runner.command);
    }

    @Test
    void request_string_never_contains_password() {
        assertFalse(GatewayRequest.lifecycle(GatewayOperation.UNLOCK, ROOT, "hunter2").toString().contains("hunter2"));
    }
}
