package com.reduction.core.step;

import com.fasterxml.jackson.databind.JsonNode;
import com.reduction.core.ArchiveContext;
import com.reduction.core.Conclusion;
import com.reduction.core.Conclusions;
import com.reduction.core.Detail;
import com.reduction.core.cache.Artifact;
import com.reduction.core.lines.LineOffsets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Wraps the source artifact into a {@link Conclusion}.
 *
 * <p>A sequence contributes one result per entry and a blob one result per line. A record with a
 * {@code results} or {@code detail} field supplies its results and its detail entries
 * ({@code path}, {@code first_line} or byte {@code offset}, {@code text}) for description
 * placeholders; any other non-empty record is a single result. The conclusion is abnormal
 * whenever there is at least one result.
 */
public final class AnalysisStepExecutor implements StepExecutor<AnalysisStep> {
    private static final Logger log = LoggerFactory.getLogger(AnalysisStepExecutor.class);

    @Override
    public Artifact execute(String nodeName, AnalysisStep step, Artifact input, ArchiveContext archive) {
        List<String> results = new ArrayList<>();
        Map<String, Detail> available = new LinkedHashMap<>();

        if (input.isBytes()) {
            results.addAll(ArtifactValues.lines(input.text()));
        } else {
            JsonNode value = input.value();
            if (value.isObject() && (value.has("results") || value.has("detail"))) {
                addEntries(value.path("results"), results);
                readDetails(value.path("detail"), archive.filesDir(), new HashMap<>(), available);
            } else {
                addEntries(value, results);
            }
        }

        Map<String, Detail> details = new LinkedHashMap<>(available);
        for (Map.Entry<String, String> binding : step.details().entrySet()) {
            Detail bound = available.get(binding.getValue());
            if (bound != null) details.put(binding.getKey(), bound);
        }

        Conclusion conclusion = new Conclusion(nodeName, step.level(), step.summary(), step.description(),
            !results.isEmpty(), results, details);
        return Artifact.ofValue(nodeName, Conclusions.toValue(conclusion));
    }

    private static void addEntries(JsonNode value, List<String> results) {
        if (value == null || value.isNull() || value.isMissingNode()) return;
        if (value.isArray()) {
            value.elements().forEachRemaining(entry -> results.add(ArtifactValues.entryText(entry)));
        } else if (value.isObject()) {
            if (value.size() > 0) results.add(value.toString());
        } else if (value.isTextual()) {
            if (!value.textValue().isEmpty()) results.add(value.textValue());
        } else if (!value.isBoolean() || value.booleanValue()) {
            results.add(value.asText());
        }
    }

    /** {@code indexes} holds one line index per file so entries in the same file scan it once. */
    private static void readDetails(JsonNode detailRecord, Path filesDir, Map<Path, LineOffsets> indexes,
                                    Map<String, Detail> out) {
        if (!detailRecord.isObject()) return;
        Iterator<Map.Entry<String, JsonNode>> fields = detailRecord.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode entry = field.getValue();
            if (entry.isTextual()) {
                out.put(field.getKey(), new Detail(null, null, entry.textValue()));
            } else if (entry.isObject()) {
                String path = entry.hasNonNull("path") ? entry.get("path").asText() : null;
                String text = entry.hasNonNull("text") ? entry.get("text").asText() : null;
                Integer firstLine = entry.hasNonNull("first_line") ? entry.get("first_line").asInt() : null;
                if (firstLine == null && path != null && entry.hasNonNull("offset")) {
                    firstLine = lineAt(filesDir, path, entry.get("offset").asLong(), indexes);
                }
                out.put(field.getKey(), new Detail(path, firstLine, text));
            }
        }
    }

    private static Integer lineAt(Path filesDir, String path, long offset, Map<Path, LineOffsets> indexes) {
        Path file = filesDir.resolve(path.startsWith("/") ? path.substring(1) : path).normalize();
        if (!file.startsWith(filesDir.normalize())) {
            log.warn("detail path '{}' escapes the files directory, line not resolved", path);
            return null;
        }
        try {
            OptionalInt line = indexes.computeIfAbsent(file, LineOffsets::of).line(offset);
            return line.isPresent() ? line.getAsInt() : null;
        } catch (IOException unreadable) {
            log.warn("cannot resolve line of offset {} in {}: {}", offset, file, unreadable.getMessage());
            return null;
        }
    }
}
