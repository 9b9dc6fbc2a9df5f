package com.reduction.core.step;

import com.reduction.core.ArchiveContext;
import com.reduction.core.FailureKind;
import com.reduction.core.Placeholders;
import com.reduction.core.StepExecutionException;
import com.reduction.core.cache.Artifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command and captures its standard output.
 *
 * <p>The command is the whitespace-split {@code command} followed by {@code params}, each token
 * formatted against {@link ArchiveContext#placeholders()}. A non-zero exit fails the node;
 * exceeding the timeout or an interrupt cancels it and kills the process.
 */
public final class ExecStepExecutor implements StepExecutor<ExecStep> {
    private static final Logger log = LoggerFactory.getLogger(ExecStepExecutor.class);
    private static final int STDERR_EXCERPT = 512;

    private final Duration timeout;
    private final ExecutorService streamReaders;

    public ExecStepExecutor() {
        this(Duration.ZERO);
    }

    /** @param timeout per-command limit; zero or negative waits indefinitely */
    public ExecStepExecutor(Duration timeout) {
        this.timeout = timeout == null ? Duration.ZERO : timeout;
        this.streamReaders = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "reduction-exec-io");
            t.setDaemon(true);
            return t;
        });
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public Artifact execute(String nodeName, ExecStep step, Artifact input, ArchiveContext archive)
        throws StepExecutionException {
        List<String> command = commandLine(step, archive.placeholders());
        log.debug("exec '{}' archive={}: {}", nodeName, archive.archiveId(), command);

        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException launchError) {
            throw new StepExecutionException(FailureKind.EXEC_FAILED,
                "Failed to launch '" + command.get(0) + "': " + launchError.getMessage(), launchError);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException closeError) {
            log.debug("could not close stdin of '{}'", command.get(0), closeError);
        }

        Future<byte[]> stdout = streamReaders.submit(() -> readAll(process.getInputStream()));
        Future<byte[]> stderr = streamReaders.submit(() -> readAll(process.getErrorStream()));
        try {
            if (!awaitExit(process)) {
                process.destroyForcibly();
                throw new StepExecutionException(FailureKind.CANCELLED,
                    "'" + command.get(0) + "' timed out after " + timeout.toMillis() + " ms");
            }
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new StepExecutionException(FailureKind.EXEC_FAILED,
                    "'" + command.get(0) + "' exited with status " + exitCode + excerpt(stderr));
            }
            return Artifact.ofBytes(nodeName, stdout.get());
        } catch (InterruptedException interrupted) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new StepExecutionException(FailureKind.CANCELLED, "'" + command.get(0) + "' was cancelled", interrupted);
        } catch (ExecutionException readError) {
            throw new StepExecutionException(FailureKind.EXEC_FAILED,
                "Failed to read output of '" + command.get(0) + "': " + readError.getCause().getMessage(), readError.getCause());
        }
    }

    static List<String> commandLine(ExecStep step, Map<String, String> placeholders) throws StepExecutionException {
        List<String> command = new ArrayList<>();
        try {
            for (String token : step.command().trim().split("\\s+")) {
                command.add(Placeholders.format(token, placeholders));
            }
            for (String param : step.params()) {
                command.add(Placeholders.format(param, placeholders));
            }
        } catch (IllegalArgumentException badTemplate) {
            throw new StepExecutionException(FailureKind.EXEC_FAILED, badTemplate.getMessage(), badTemplate);
        }
        return command;
    }

    private boolean awaitExit(Process process) throws InterruptedException {
        if (timeout.isZero() || timeout.isNegative()) {
            process.waitFor();
            return true;
        }
        return process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private static byte[] readAll(InputStream stream) throws IOException {
        try (InputStream in = stream) {
            return in.readAllBytes();
        }
    }

    private static String excerpt(Future<byte[]> stderr) throws InterruptedException {
        String text;
        try {
            text = new String(stderr.get(), StandardCharsets.UTF_8).strip();
        } catch (ExecutionException unreadable) {
            log.debug("stderr unreadable", unreadable.getCause());
            return "";
        }
        if (text.isEmpty()) return "";
        if (text.length() > STDERR_EXCERPT) text = text.substring(0, STDERR_EXCERPT) + "...";
        return ": " + text;
    }
}
