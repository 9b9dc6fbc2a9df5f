package com.reduction.core.step;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.reduction.core.ArchiveContext;
import com.reduction.core.cache.Artifact;

public final class SplitLinesStepExecutor implements StepExecutor<SplitLinesStep> {
    @Override
    public Artifact execute(String nodeName, SplitLinesStep step, Artifact input, ArchiveContext archive) {
        ArrayNode lines = JsonNodeFactory.instance.arrayNode();
        for (String line : ArtifactValues.lines(ArtifactValues.toText(input))) {
            lines.add(line);
        }
        return Artifact.ofValue(nodeName, lines);
    }
}
