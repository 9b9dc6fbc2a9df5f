package com.reduction.core.step;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.reduction.core.ArchiveContext;
import com.reduction.core.Conclusion;
import com.reduction.core.Conclusions;
import com.reduction.core.FailureKind;
import com.reduction.core.Level;
import com.reduction.core.StepExecutionException;
import com.reduction.core.cache.Artifact;
import com.reduction.core.cache.InMemoryArtifactCache;
import com.reduction.core.jq.JqFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class StepExecutorsTest {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    @TempDir
    Path workDir;

    private ArchiveContext archive;
    private StepExecutors executors;

    @BeforeEach
    void setup() throws Exception {
        Path filesDir = Files.createDirectories(workDir.resolve("files"));
        archive = ArchiveContext.of("sos1", filesDir, new InMemoryArtifactCache());
        executors = StepExecutors.defaults();
    }

    private static JqStep jq(String filter) throws Exception {
        return new JqStep(JqFilter.compile(filter));
    }

    private static Artifact value(String json) throws Exception {
        return Artifact.ofValue("src", OBJECT_MAPPER.readTree(json));
    }

    private Conclusion analyse(Artifact input, AnalysisStep step) throws Exception {
        Artifact out = executors.execute("finding", step, input, archive);
        return Conclusions.fromValue(out.value());
    }

    private static AnalysisStep analysis(Level level, String description, Map<String, String> details) {
        return new AnalysisStep(level, "summary", description, details);
    }

    @Test
    void everyTypeHasAnExecutor() {
        for (StepType type : StepType.values()) {
            assertTrue(executors.has(type), type.id());
        }
    }

    @Test
    void yamlBlobDecodesToValue() throws Exception {
        Artifact out = executors.execute("json", new Yaml2JsonStep(), Artifact.ofText("src", "a:\n  - 1\n  - two\n"), archive);
        assertEquals(OBJECT_MAPPER.readTree("{\"a\":[1,\"two\"]}"), out.value());
        assertEquals("json", out.node());
    }

    @Test
    void malformedYamlIsADecodeFailure() {
        StepExecutionException e = assertThrows(StepExecutionException.class,
            () -> executors.execute("json", new Yaml2JsonStep(), Artifact.ofText("src", "key: [unclosed"), archive));
        assertEquals(FailureKind.DECODE_FAILED, e.kind());
    }

    @Test
    void jqOverPlainTextTreatsItAsAString() throws Exception {
        Artifact out = executors.execute("B", jq("."), Artifact.ofText("A", "a\n"), archive);
        assertEquals(OBJECT_MAPPER.readTree("[\"a\\n\"]"), out.value());
    }

    @Test
    void jqOverJsonBlobParsesIt() throws Exception {
        Artifact out = executors.execute("B", jq(".[].n"), Artifact.ofText("A", "[{\"n\":1},{\"n\":2}]"), archive);
        assertEquals(OBJECT_MAPPER.readTree("[1,2]"), out.value());
    }

    @Test
    void jqRuntimeErrorIsAFilterFailure() {
        StepExecutionException e = assertThrows(StepExecutionException.class,
            () -> executors.execute("B", jq(".a"), value("[1]"), archive));
        assertEquals(FailureKind.FILTER_FAILED, e.kind());
    }

    @Test
    void splitLinesHandlesEveryTerminator() throws Exception {
        Artifact out = executors.execute("C", new SplitLinesStep(), Artifact.ofText("B", "one\r\ntwo\rthree\nfour\n"), archive);
        assertEquals(OBJECT_MAPPER.readTree("[\"one\",\"two\",\"three\",\"four\"]"), out.value());
    }

    @Test
    void splitLinesJoinsSequenceEntries() throws Exception {
        Artifact out = executors.execute("C", new SplitLinesStep(), value("[\"a\\nb\", {\"k\":1}, 3]"), archive);
        assertEquals(OBJECT_MAPPER.readTree("[\"a\",\"b\",\"{\\\"k\\\":1}\",\"3\"]"), out.value());
    }

    @Test
    void chainMatchesManualSequencing() throws Exception {
        Artifact source = value("{\"x\":{\"issues\":[\"p\\nq\",\"r\"]},\"y\":{}}");
        JqStep filter = jq("[.[].issues|select(.)]|flatten|.[]");

        Artifact chained = executors.execute("chained", new ChainStep(List.of(filter, new SplitLinesStep())), source, archive);
        Artifact manual = executors.execute("manual", new SplitLinesStep(),
            executors.execute("intermediate", filter, source, archive), archive);

        assertEquals(manual.value(), chained.value());
        assertEquals("chained", chained.node());
    }

    @Test
    void chainFailureCarriesTheEntryKind() throws Exception {
        ChainStep chain = new ChainStep(List.of(new Yaml2JsonStep(), jq(".a")));
        StepExecutionException e = assertThrows(StepExecutionException.class,
            () -> executors.execute("chained", chain, Artifact.ofText("src", "- 1\n- 2\n"), archive));
        assertEquals(FailureKind.FILTER_FAILED, e.kind());
        assertTrue(e.getMessage().startsWith("chain entry 1 (jq)"), e.getMessage());
    }

    @Test
    void chainRejectsExecAndAnalysisEntries() {
        assertThrows(IllegalArgumentException.class,
            () -> new ChainStep(List.of(new ExecStep("echo", List.of()))));
        assertThrows(IllegalArgumentException.class,
            () -> new ChainStep(List.of(analysis(Level.INFO, "", Map.of()))));
        assertThrows(IllegalArgumentException.class, () -> new ChainStep(List.of()));
    }

    @Test
    void emptySequenceIsANormalConclusion() throws Exception {
        Conclusion conclusion = analyse(value("[]"), analysis(Level.WARNING, "", Map.of()));
        assertFalse(conclusion.abnormal());
        assertEquals(List.of(), conclusion.results());
    }

    @Test
    void sequenceEntriesBecomeResults() throws Exception {
        Conclusion conclusion = analyse(value("[\"a\", {\"b\":1}]"), analysis(Level.ERROR, "found", Map.of()));
        assertTrue(conclusion.abnormal());
        assertEquals(List.of("a", "{\"b\":1}"), conclusion.results());
        assertEquals(Level.ERROR, conclusion.level());
        assertEquals("finding", conclusion.name());
    }

    @Test
    void blobLinesBecomeResults() throws Exception {
        Conclusion conclusion = analyse(Artifact.ofText("src", "x\ny\n"), analysis(Level.INFO, "", Map.of()));
        assertEquals(List.of("x", "y"), conclusion.results());
    }

    @Test
    void detailRecordFillsDescriptionPlaceholders() throws Exception {
        Artifact input = value("{\"results\":[\"oom\"],\"detail\":{\"where\":{\"path\":\"var/log/syslog\",\"first_line\":12,\"text\":\"Out of memory\"}}}");
        Conclusion conclusion = analyse(input, analysis(Level.CRITICAL, "Saw {where} and {other}", Map.of("msg", "where")));

        assertTrue(conclusion.abnormal());
        assertEquals(List.of("oom"), conclusion.results());
        assertEquals("var/log/syslog", conclusion.details().get("where").path());
        assertEquals(12, conclusion.details().get("where").firstLine());
        assertEquals("Out of memory", conclusion.details().get("msg").text());
        assertEquals("Saw Out of memory and {other}", conclusion.renderedDescription());
    }

    @Test
    void detailOffsetResolvesToLine() throws Exception {
        Path log = archive.filesDir().resolve("var/log/syslog");
        Files.createDirectories(log.getParent());
        Files.write(log, "first\nsecond\nthird\n".getBytes(StandardCharsets.UTF_8));

        Artifact input = value("{\"results\":[\"x\"],\"detail\":{\"hit\":{\"path\":\"var/log/syslog\",\"offset\":8,\"text\":\"second\"}}}");
        Conclusion conclusion = analyse(input, analysis(Level.INFO, "{hit}", Map.of()));

        assertEquals(2, conclusion.details().get("hit").firstLine());
    }

    @Test
    void offsetsSharingAFileEachResolveToTheirLine() throws Exception {
        Path syslog = archive.filesDir().resolve("var/log/syslog");
        Path kern = archive.filesDir().resolve("var/log/kern.log");
        Files.createDirectories(syslog.getParent());
        Files.write(syslog, "first\nsecond\nthird\n".getBytes(StandardCharsets.UTF_8));
        Files.write(kern, "a\nb\n".getBytes(StandardCharsets.UTF_8));

        Artifact input = value("{\"results\":[\"x\"],\"detail\":{"
            + "\"one\":{\"path\":\"var/log/syslog\",\"offset\":0},"
            + "\"three\":{\"path\":\"var/log/syslog\",\"offset\":14},"
            + "\"kern\":{\"path\":\"var/log/kern.log\",\"offset\":2},"
            + "\"two\":{\"path\":\"/var/log/syslog\",\"offset\":8}}}");
        Conclusion conclusion = analyse(input, analysis(Level.INFO, "", Map.of()));

        assertEquals(1, conclusion.details().get("one").firstLine());
        assertEquals(2, conclusion.details().get("two").firstLine());
        assertEquals(3, conclusion.details().get("three").firstLine());
        assertEquals(2, conclusion.details().get("kern").firstLine());
    }

    @Test
    void plainRecordIsOneResult() throws Exception {
        Conclusion conclusion = analyse(value("{\"k\":\"v\"}"), analysis(Level.INFO, "", Map.of()));
        assertEquals(List.of("{\"k\":\"v\"}"), conclusion.results());

        JsonNode empty = OBJECT_MAPPER.readTree("{}");
        assertFalse(analyse(Artifact.ofValue("src", empty), analysis(Level.INFO, "", Map.of())).abnormal());
    }

    @Test
    void replacedExecutorIsUsed() throws Exception {
        executors.register(StepType.SPLITLINES, (StepExecutor<SplitLinesStep>) (name, step, input, ctx) -> Artifact.ofText(name, "stub"));
        assertEquals("stub", executors.execute("C", new SplitLinesStep(), Artifact.ofText("B", "x"), archive).text());
    }
}
