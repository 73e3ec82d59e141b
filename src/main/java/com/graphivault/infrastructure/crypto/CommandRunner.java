package com.graphivault.infrastructure.crypto;

import java.io.IOException;
import java.util.List;

/**
 * Runs an external command to completion.
 */
public interface CommandRunner {

    /**
     * @param stdin text written to the child's standard input, or null to close it immediately
     */
    CommandResult run(List<String> command, String stdin) throws IOException, InterruptedException;

    record CommandResult(int exitCode, String stdout, String stderr) {
    }
}
