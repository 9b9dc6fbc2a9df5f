package com.reduction.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Severity-leveled finding of an {@code analysis} node. Snapshots are regenerated, never edited.
 *
 * @param details placeholder name to the archive location it links to
 */
public record Conclusion(
    @JsonProperty("name") String name,
    @JsonProperty("level") Level level,
    @JsonProperty("summary") String summary,
    @JsonProperty("description") String description,
    @JsonProperty("abnormal") boolean abnormal,
    @JsonProperty("results") List<String> results,
    @JsonProperty("details") Map<String, Detail> details
) {
    public Conclusion {
        name = Objects.requireNonNull(name, "name");
        level = Objects.requireNonNull(level, "level");
        summary = summary == null ? "" : summary;
        description = description == null ? "" : description;
        results = results == null ? List.of() : List.copyOf(results);
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    @JsonIgnore
    public boolean normal() {
        return !abnormal;
    }

    /** The description with each {@code {placeholder}} replaced by its detail text. */
    @JsonIgnore
    public String renderedDescription() {
        return Placeholders.render(description, token -> {
            Detail detail = details.get(token);
            return detail == null ? null : detail.text();
        });
    }
}
