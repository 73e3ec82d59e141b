package com.graphivault.infrastructure.crypto;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Stderr is drained on a separate thread so a chatty child cannot block on a full pipe.
 */
@Slf4j
public class ProcessCommandRunner implements CommandRunner {

    private final Path workingDirectory;

    public ProcessCommandRunner(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    @Override
    public CommandResult run(List<String> command, String stdin) throws IOException, InterruptedException {
        ProcessBuilder builder = new ProcessBuilder(command);
        if (workingDirectory != null) {
            builder.directory(workingDirectory.toFile());
        }

        Process process = builder.start();
        try {
            CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(process.getErrorStream()));

            try (OutputStream in = process.getOutputStream()) {
                if (stdin != null) {
                    in.write(stdin.getBytes(StandardCharsets.UTF_8));
                }
            }

            String stdout;
            try (InputStream out = process.getInputStream()) {
                stdout = new String(out.readAllBytes(), StandardCharsets.UTF_8);
            }
            int exitCode = process.waitFor();
            return new CommandResult(exitCode, stdout, joinStderr(stderr));
        } finally {
            if (process.isAlive()) {
                log.warn("Destroying gateway process that is still running");
                process.destroyForcibly();
            }
        }
    }

    private static String drain(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String joinStderr(CompletableFuture<String> stderr) throws IOException {
        try {
            return stderr.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof UncheckedIOException io) {
                throw io.getCause();
            }
            throw e;
        }
    }
}
