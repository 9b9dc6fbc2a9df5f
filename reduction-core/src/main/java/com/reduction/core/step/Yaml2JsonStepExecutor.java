package com.reduction.core.step;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.reduction.core.ArchiveContext;
import com.reduction.core.FailureKind;
import com.reduction.core.StepExecutionException;
import com.reduction.core.cache.Artifact;

import java.io.IOException;

/** Decodes a YAML (and therefore also JSON) document blob into a structured value. */
public final class Yaml2JsonStepExecutor implements StepExecutor<Yaml2JsonStep> {
    private static final YAMLMapper YAML_MAPPER = new YAMLMapper();

    @Override
    public Artifact execute(String nodeName, Yaml2JsonStep step, Artifact input, ArchiveContext archive)
        throws StepExecutionException {
        if (input.isValue()) return Artifact.ofValue(nodeName, input.value());
        try {
            JsonNode value = YAML_MAPPER.readTree(input.bytes());
            if (value == null || value.isMissingNode()) value = NullNode.getInstance();
            return Artifact.ofValue(nodeName, value);
        } catch (IOException decodeError) {
            throw new StepExecutionException(FailureKind.DECODE_FAILED,
                "Failed to decode '" + input.node() + "' as YAML: " + decodeError.getMessage(), decodeError);
        }
    }
}
