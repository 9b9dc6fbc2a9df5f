package com.reduction.core.step;

import com.reduction.core.ArchiveContext;
import com.reduction.core.FailureKind;
import com.reduction.core.StepExecutionException;
import com.reduction.core.cache.Artifact;
import com.reduction.core.cache.InMemoryArtifactCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ExecStepExecutorTest {
    @TempDir
    Path workDir;

    private ArchiveContext archive;

    @BeforeEach
    void setup() throws Exception {
        archive = ArchiveContext.of("sos1", Files.createDirectories(workDir.resolve("files")), new InMemoryArtifactCache());
    }

    @Test
    void stdoutBecomesTheArtifact() throws Exception {
        Artifact out = new ExecStepExecutor().execute("A", new ExecStep("echo a", List.of()), null, archive);
        assertEquals("a\n", out.text());
        assertEquals("A", out.node());
    }

    @Test
    void placeholdersAreSubstitutedInParams() throws Exception {
        Artifact out = new ExecStepExecutor().execute("A", new ExecStep("echo", List.of("{archive}", "{filesdir}")), null, archive);
        assertEquals("sos1 " + archive.filesDir() + "\n", out.text());
    }

    @Test
    void commandLineKeepsEscapedBraces() throws Exception {
        List<String> command = ExecStepExecutor.commandLine(new ExecStep("tool --fmt {{x}}", List.of("{workdir}")),
            Map.of("workdir", "/w"));
        assertEquals(List.of("tool", "--fmt", "{x}", "/w"), command);
    }

    @Test
    void unknownPlaceholderFails() {
        StepExecutionException e = assertThrows(StepExecutionException.class,
            () -> new ExecStepExecutor().execute("A", new ExecStep("echo", List.of("{nope}")), null, archive));
        assertEquals(FailureKind.EXEC_FAILED, e.kind());
    }

    @Test
    void missingCommandFailsToLaunch() {
        StepExecutionException e = assertThrows(StepExecutionException.class,
            () -> new ExecStepExecutor().execute("A", new ExecStep("no-such-command-for-reduction-tests", List.of()), null, archive));
        assertEquals(FailureKind.EXEC_FAILED, e.kind());
    }

    @Test
    void nonZeroExitFails() {
        StepExecutionException e = assertThrows(StepExecutionException.class,
            () -> new ExecStepExecutor().execute("A", new ExecStep("sh", List.of("-c", "echo broken >&2; exit 3")), null, archive));
        assertEquals(FailureKind.EXEC_FAILED, e.kind());
        assertTrue(e.getMessage().contains("status 3"), e.getMessage());
        assertTrue(e.getMessage().contains("broken"), e.getMessage());
    }

    @Test
    void timeoutCancels() {
        ExecStepExecutor executor = new ExecStepExecutor(Duration.ofMillis(200));
        StepExecutionException e = assertThrows(StepExecutionException.class,
            () -> executor.execute("A", new ExecStep("sleep 10", List.of()), null, archive));
        assertEquals(FailureKind.CANCELLED, e.kind());
    }
}
