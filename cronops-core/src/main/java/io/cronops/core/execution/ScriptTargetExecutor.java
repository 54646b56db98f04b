package io.cronops.core.execution;

import io.cronops.core.job.ScriptTarget;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ScriptTargetExecutor implements TargetExecutor<ScriptTarget> {
    private static final Logger LOG = LoggerFactory.getLogger(ScriptTargetExecutor.class);

    private final String shell;
    private final int maxResponseChars;

    public ScriptTargetExecutor(String shell, int maxResponseChars) {
        this.shell = shell == null || shell.isBlank() ? "/bin/sh" : shell;
        this.maxResponseChars = Math.max(1, maxResponseChars);
    }

    @Override
    public DispatchResult execute(ScriptTarget target, Duration timeout) {
        Path stdout = null;
        Path stderr = null;
        try {
            // files instead of pipes so a chatty script cannot block on a full buffer
            stdout = Files.createTempFile("cronops-out-", ".log");
            stderr = Files.createTempFile("cronops-err-", ".log");
            Process process = new ProcessBuilder(shell, "-c", target.command())
                .redirectOutput(stdout.toFile())
                .redirectError(stderr.toFile())
                .start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                return DispatchResult.timeout("Script timed out after " + timeout.toMillis() + " ms");
            }

            String output = TargetExecutor.truncate(Files.readString(stdout, StandardCharsets.UTF_8), maxResponseChars);
            String errors = TargetExecutor.truncate(Files.readString(stderr, StandardCharsets.UTF_8), maxResponseChars);
            int exitCode = process.exitValue();
            if (exitCode == 0) {
                return DispatchResult.success(null, output);
            }
            String error = errors == null || errors.isBlank() ? "Script exited with code " + exitCode : errors.strip();
            return DispatchResult.failed(null, output, error);
        } catch (IOException e) {
            return DispatchResult.failed(null, null, "Failed to start script: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return DispatchResult.failed(null, null, "Script interrupted");
        } finally {
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    private static void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOG.debug("Could not delete temp file {}", path, e);
        }
    }
}
