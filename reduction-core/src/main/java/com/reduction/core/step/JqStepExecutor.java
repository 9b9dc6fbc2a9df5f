package com.reduction.core.step;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.reduction.core.ArchiveContext;
import com.reduction.core.FailureKind;
import com.reduction.core.StepExecutionException;
import com.reduction.core.cache.Artifact;
import com.reduction.core.jq.JqException;

import java.util.List;

/** Emits every value the filter produces as one sequence; no values is a valid, empty result. */
public final class JqStepExecutor implements StepExecutor<JqStep> {
    @Override
    public Artifact execute(String nodeName, JqStep step, Artifact input, ArchiveContext archive)
        throws StepExecutionException {
        List<JsonNode> results;
        try {
            results = step.filter().apply(ArtifactValues.toValue(input));
        } catch (JqException filterError) {
            throw new StepExecutionException(FailureKind.FILTER_FAILED, filterError.getMessage(), filterError);
        }
        ArrayNode sequence = JsonNodeFactory.instance.arrayNode(results.size());
        sequence.addAll(results);
        return Artifact.ofValue(nodeName, sequence);
    }
}
