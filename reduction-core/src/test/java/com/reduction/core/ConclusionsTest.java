package com.reduction.core;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ConclusionsTest {

    private static Conclusion conclusion(String name, Level level, List<String> results) {
        return new Conclusion(name, level, name + " summary", "", !results.isEmpty(), results, Map.of());
    }

    @Test
    void countsResultEntriesOfAbnormalConclusionsOnly() {
        Map<Level, Integer> counts = Conclusions.levelCounts(List.of(
            conclusion("issues", Level.WARNING, List.of("a", "b")),
            conclusion("bugs", Level.ERROR, List.of("c")),
            conclusion("quiet", Level.CRITICAL, List.of())));

        assertEquals(2, counts.get(Level.WARNING));
        assertEquals(1, counts.get(Level.ERROR));
        assertEquals(0, counts.get(Level.CRITICAL));
        assertEquals(Level.values().length, counts.size());
    }

    @Test
    void findingsAreOrderedBySeverity() {
        List<Finding> findings = Conclusions.findings(List.of(
            conclusion("issues", Level.WARNING, List.of("a")),
            conclusion("bugs", Level.ERROR, List.of("c"))));

        assertEquals(List.of("c", "a"), findings.stream().map(Finding::text).toList());
        assertEquals("bugs", findings.get(0).conclusion());
        assertEquals("bugs summary", findings.get(0).summary());
    }

    @Test
    void valueKeepsWireNames() throws Exception {
        Conclusion original = new Conclusion("n", Level.DEBUG, "s", "see {d}", true, List.of("r"),
            Map.of("d", new Detail("etc/hosts", 3, "localhost")));

        var value = Conclusions.toValue(original);

        assertEquals("debug", value.get("level").asText());
        assertEquals(3, value.get("details").get("d").get("first_line").asInt());
        assertFalse(value.has("normal"));
        assertEquals(original, Conclusions.fromValue(value));
    }

    @Test
    void levelIdsAreValidated() {
        assertEquals(Level.WARNING, Level.fromId("Warning"));
        assertThrows(IllegalArgumentException.class, () -> Level.fromId("fatal"));
    }
}
