package com.reduction.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/** Conversion of conclusions to and from structured artifacts, and their aggregation. */
public final class Conclusions {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private Conclusions() {}

    public static JsonNode toValue(Conclusion conclusion) {
        return OBJECT_MAPPER.valueToTree(conclusion);
    }

    public static Conclusion fromValue(JsonNode value) throws JsonProcessingException {
        return OBJECT_MAPPER.treeToValue(value, Conclusion.class);
    }

    /**
     * Number of result entries per level over abnormal conclusions. Every level is present;
     * normal conclusions count for nothing.
     */
    public static Map<Level, Integer> levelCounts(Collection<Conclusion> conclusions) {
        Map<Level, Integer> counts = new EnumMap<>(Level.class);
        for (Level level : Level.values()) counts.put(level, 0);
        for (Conclusion conclusion : conclusions) {
            if (!conclusion.abnormal()) continue;
            counts.merge(conclusion.level(), conclusion.results().size(), Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }

    /** Result entries of abnormal conclusions, most severe level first, then in input order. */
    public static List<Finding> findings(Collection<Conclusion> conclusions) {
        List<Finding> findings = new ArrayList<>();
        for (Level level : Level.values()) {
            for (Conclusion conclusion : conclusions) {
                if (!conclusion.abnormal() || conclusion.level() != level) continue;
                for (String result : conclusion.results()) {
                    findings.add(new Finding(conclusion.name(), level, conclusion.summary(), result));
                }
            }
        }
        return findings;
    }
}
