package com.reduction.core.step;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.reduction.core.cache.Artifact;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/** Conversions between blob and structured artifacts shared by the executors. */
public final class ArtifactValues {
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
        .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private ArtifactValues() {}

    /** The artifact as a structured value; a blob that is not JSON becomes one string. */
    public static JsonNode toValue(Artifact artifact) {
        if (artifact.isValue()) return artifact.value();
        String text = artifact.text();
        JsonNode parsed;
        try {
            parsed = OBJECT_MAPPER.readTree(text);
        } catch (JsonProcessingException notJson) {
            return TextNode.valueOf(text);
        }
        return parsed == null || parsed.isMissingNode() ? TextNode.valueOf(text) : parsed;
    }

    /** The artifact as one text blob; sequence entries are joined with newlines. */
    public static String toText(Artifact artifact) {
        if (artifact.isBytes()) return artifact.text();
        JsonNode value = artifact.value();
        if (!value.isArray()) return entryText(value);
        StringBuilder text = new StringBuilder();
        Iterator<JsonNode> elements = value.elements();
        while (elements.hasNext()) {
            text.append(entryText(elements.next()));
            if (elements.hasNext()) text.append('\n');
        }
        return text.toString();
    }

    /** Strings as-is, everything else as compact JSON. */
    public static String entryText(JsonNode value) {
        return value.isTextual() ? value.textValue() : value.toString();
    }

    /** Splits on {@code \n}, {@code \r\n} or {@code \r}; a trailing terminator adds no empty line. */
    public static List<String> lines(String text) {
        List<String> lines = new ArrayList<>();
        int start = 0;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\n' || c == '\r') {
                lines.add(text.substring(start, i));
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') i++;
                start = i + 1;
            }
            i++;
        }
        if (start < text.length()) lines.add(text.substring(start));
        return lines;
    }
}
