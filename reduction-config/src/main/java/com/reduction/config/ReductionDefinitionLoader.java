package com.reduction.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.reduction.core.DefinitionException;
import com.reduction.core.Level;
import com.reduction.core.ReductionNode;
import com.reduction.core.ReductionSet;
import com.reduction.core.jq.JqException;
import com.reduction.core.jq.JqFilter;
import com.reduction.core.step.AnalysisStep;
import com.reduction.core.step.ChainStep;
import com.reduction.core.step.ExecStep;
import com.reduction.core.step.JqStep;
import com.reduction.core.step.SplitLinesStep;
import com.reduction.core.step.Step;
import com.reduction.core.step.StepType;
import com.reduction.core.step.Yaml2JsonStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads reduction definitions from YAML or JSON into a validated {@link ReductionSet}.
 *
 * <p>A document is a list of node records; a single record is read as a one-element list.
 * Malformed documents raise {@link IOException}; documents that parse but describe an unsound
 * set raise {@link DefinitionException}, and no set is built.
 */
public final class ReductionDefinitionLoader {
    private static final Logger log = LoggerFactory.getLogger(ReductionDefinitionLoader.class);
    // YAML is a superset of JSON, so one mapper reads both.
    private static final ObjectMapper OBJECT_MAPPER = new YAMLMapper();

    private static final Set<String> NODE_FIELDS = Set.of("name", "type", "source");
    private static final Map<StepType, Set<String>> STEP_FIELDS = new EnumMap<>(StepType.class);

    static {
        STEP_FIELDS.put(StepType.EXEC, Set.of("exec", "command", "params"));
        STEP_FIELDS.put(StepType.YAML2JSON, Set.of());
        STEP_FIELDS.put(StepType.JQ, Set.of("jq", "raw"));
        STEP_FIELDS.put(StepType.SPLITLINES, Set.of());
        STEP_FIELDS.put(StepType.CHAIN, Set.of("chain"));
        STEP_FIELDS.put(StepType.ANALYSIS, Set.of("level", "summary", "description", "details"));
    }

    private ReductionDefinitionLoader() {}

    /**
     * Loads a definition file, or every {@code .yaml}, {@code .yml} and {@code .json} file below a
     * directory in sorted path order, into one set.
     */
    public static ReductionSet load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        List<Path> files;
        if (Files.isDirectory(path)) {
            try (Stream<Path> walk = Files.walk(path)) {
                files = walk.filter(Files::isRegularFile)
                    .filter(ReductionDefinitionLoader::isDefinitionFile)
                    .sorted()
                    .collect(Collectors.toList());
            }
        } else {
            files = List.of(path);
        }

        List<ReductionNode> nodes = new ArrayList<>();
        for (Path file : files) {
            JsonNode root;
            try (InputStream in = Files.newInputStream(file)) {
                root = OBJECT_MAPPER.readTree(in);
            }
            try {
                nodes.addAll(parseNodes(root));
            } catch (DefinitionException invalid) {
                throw new DefinitionException(file + ": " + invalid.getMessage(), invalid);
            }
        }
        ReductionSet set = ReductionSet.of(nodes);
        log.info("Loaded {} reductions from {} file(s) under {}", set.size(), files.size(), path);
        return set;
    }

    public static ReductionSet load(InputStream in) throws IOException {
        Objects.requireNonNull(in, "in");
        return parse(OBJECT_MAPPER.readTree(in));
    }

    public static ReductionSet load(String document) throws IOException {
        Objects.requireNonNull(document, "document");
        return parse(OBJECT_MAPPER.readTree(document));
    }

    /** Builds a set from an already parsed document. */
    public static ReductionSet parse(JsonNode root) {
        return ReductionSet.of(parseNodes(root));
    }

    private static List<ReductionNode> parseNodes(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) return List.of();
        List<ReductionNode> nodes = new ArrayList<>();
        if (root.isObject()) {
            nodes.add(parseNode(root, 0));
        } else if (root.isArray()) {
            for (int i = 0; i < root.size(); i++) nodes.add(parseNode(root.get(i), i));
        } else {
            throw new DefinitionException("Reduction definitions must be a list of records");
        }
        return nodes;
    }

    private static ReductionNode parseNode(JsonNode record, int index) {
        if (record == null || !record.isObject()) {
            throw new DefinitionException("Reduction #" + index + " must be a record");
        }
        String name = text(record, "name");
        if (name == null || name.isBlank()) throw new DefinitionException("Reduction #" + index + " has no name");

        StepType type = stepType(record, "Reduction '" + name + "'");
        checkFields(record, NODE_FIELDS, type, "Reduction '" + name + "'");
        String source = text(record, "source");
        Step step = parseStep(record, type, "Reduction '" + name + "'");
        try {
            return new ReductionNode(name, source, step);
        } catch (IllegalArgumentException invalid) {
            throw new DefinitionException(invalid.getMessage(), invalid);
        }
    }

    private static Step parseStep(JsonNode record, StepType type, String where) {
        return switch (type) {
            case EXEC -> parseExec(record, where);
            case YAML2JSON -> new Yaml2JsonStep();
            case JQ -> new JqStep(compile(required(record, "jq", where), where));
            case SPLITLINES -> new SplitLinesStep();
            case CHAIN -> parseChain(record, where);
            case ANALYSIS -> parseAnalysis(record, where);
        };
    }

    private static ExecStep parseExec(JsonNode record, String where) {
        String command = record.has("exec") ? text(record, "exec") : text(record, "command");
        if (command == null || command.isBlank()) throw new DefinitionException(where + " requires field 'exec'");

        List<String> params = new ArrayList<>();
        JsonNode paramsNode = record.get("params");
        if (paramsNode != null && !paramsNode.isNull()) {
            if (paramsNode.isArray()) {
                for (JsonNode param : paramsNode) {
                    if (!param.isValueNode()) throw new DefinitionException(where + " field 'params' must hold plain values");
                    params.add(param.asText());
                }
            } else if (paramsNode.isValueNode()) {
                params.add(paramsNode.asText());
            } else {
                throw new DefinitionException(where + " field 'params' must be text or a list");
            }
        }
        return new ExecStep(command, params);
    }

    private static ChainStep parseChain(JsonNode record, String where) {
        JsonNode entries = record.get("chain");
        if (entries == null || !entries.isArray() || entries.isEmpty()) {
            throw new DefinitionException(where + " requires a non-empty 'chain' list");
        }
        List<Step> steps = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            JsonNode entry = entries.get(i);
            String entryWhere = where + " chain entry #" + i;
            if (!entry.isObject()) throw new DefinitionException(entryWhere + " must be a record");
            if (entry.has("name")) throw new DefinitionException(entryWhere + " must not have a name");
            if (entry.has("source")) throw new DefinitionException(entryWhere + " must not have a source");

            StepType type = stepType(entry, entryWhere);
            if (type == StepType.EXEC || type == StepType.ANALYSIS) {
                throw new DefinitionException(entryWhere + " cannot be of type '" + type.id() + "'");
            }
            checkFields(entry, Set.of("type"), type, entryWhere);
            steps.add(parseStep(entry, type, entryWhere));
        }
        return new ChainStep(steps);
    }

    private static AnalysisStep parseAnalysis(JsonNode record, String where) {
        Level level = Level.INFO;
        String levelText = text(record, "level");
        if (levelText != null) {
            try {
                level = Level.fromId(levelText);
            } catch (IllegalArgumentException invalid) {
                throw new DefinitionException(where + " has " + invalid.getMessage(), invalid);
            }
        }
        String summary = text(record, "summary");
        String description = text(record, "description");

        Map<String, String> details = new LinkedHashMap<>();
        JsonNode bindings = record.get("details");
        if (bindings != null && !bindings.isNull()) {
            if (!bindings.isObject()) throw new DefinitionException(where + " field 'details' must be a record");
            Iterator<Map.Entry<String, JsonNode>> fields = bindings.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> binding = fields.next();
                if (!binding.getValue().isTextual()) {
                    throw new DefinitionException(where + " detail binding '" + binding.getKey() + "' must name a detail key");
                }
                details.put(binding.getKey(), binding.getValue().textValue());
            }
        }
        return new AnalysisStep(level, summary == null ? "" : summary, description == null ? "" : description, details);
    }

    private static JqFilter compile(String expression, String where) {
        try {
            return JqFilter.compile(expression);
        } catch (JqException invalid) {
            throw new DefinitionException(where + " has an invalid jq filter: " + invalid.getMessage(), invalid);
        }
    }

    private static StepType stepType(JsonNode record, String where) {
        String id = text(record, "type");
        if (id == null) throw new DefinitionException(where + " has no type");
        return StepType.fromId(id)
            .orElseThrow(() -> new DefinitionException(where + " has unknown type '" + id + "'"));
    }

    private static void checkFields(JsonNode record, Set<String> common, StepType type, String where) {
        Set<String> allowed = STEP_FIELDS.get(type);
        Iterator<String> names = record.fieldNames();
        while (names.hasNext()) {
            String field = names.next();
            if (!common.contains(field) && !allowed.contains(field)) {
                throw new DefinitionException(where + " has field '" + field + "' not valid for type '" + type.id() + "'");
            }
        }
    }

    private static String required(JsonNode record, String field, String where) {
        String value = text(record, field);
        if (value == null || value.isBlank()) throw new DefinitionException(where + " requires field '" + field + "'");
        return value;
    }

    private static String text(JsonNode record, String field) {
        JsonNode value = record.get(field);
        if (value == null || value.isNull()) return null;
        if (!value.isValueNode()) throw new DefinitionException("Field '" + field + "' must be text, got " + value.getNodeType().name().toLowerCase(Locale.ROOT));
        return value.asText();
    }

    private static boolean isDefinitionFile(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yaml") || name.endsWith(".yml") || name.endsWith(".json");
    }
}
