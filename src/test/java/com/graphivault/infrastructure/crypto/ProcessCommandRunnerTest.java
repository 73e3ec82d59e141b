package com.graphivault.infrastructure.crypto;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessCommandRunnerTest {

    private final ProcessCommandRunner runner = new ProcessCommandRunner(null);

    @Test
    void captures_stdout_stderr_and_exit_code() throws Exception {
        CommandRunner.CommandResult result = runner.run(
            List.of("sh", "-c", "echo '{\"success\": true}'; echo warn >&2; exit 3"), null);

        assertEquals(3, result.exitCode());
        assertEquals("{\"success\": true}", result.stdout().strip());
        assertEquals("warn", result.stderr().strip());
    }

    @Test
    void feeds_stdin_to_the_child() throws Exception {
        CommandRunner.CommandResult result = runner.run(List.of("cat"), "secret\n");

        assertEquals(0, result.exitCode());
        assertEquals("secret\n", result.stdout());
    }

    @Test
    void missing_executable_fails_to_launch() {
        assertThrows(IOException.class, () -> runner.run(List.of("graphivault-no-such-binary"), null));
    }
}
