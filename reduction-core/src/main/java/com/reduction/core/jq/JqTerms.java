package com.reduction.core.jq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;

/** Evaluation semantics of the supported filter terms. */
final class JqTerms {
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private JqTerms() {}

    static JqExpr identity() {
        return input -> List.of(input);
    }

    static JqExpr literal(JsonNode value) {
        return input -> List.of(value);
    }

    static JqExpr field(JqExpr target, String name) {
        return input -> {
            List<JsonNode> out = new ArrayList<>();
            for (JsonNode value : target.eval(input)) {
                if (isNull(value)) {
                    out.add(NullNode.getInstance());
                } else if (value.isObject()) {
                    JsonNode member = value.get(name);
                    out.add(member == null ? NullNode.getInstance() : member);
                } else {
                    throw new JqException("Cannot index " + typeName(value) + " with \"" + name + "\"");
                }
            }
            return out;
        };
    }

    static JqExpr index(JqExpr target, int index) {
        return input -> {
            List<JsonNode> out = new ArrayList<>();
            for (JsonNode value : target.eval(input)) {
                if (isNull(value)) {
                    out.add(NullNode.getInstance());
                } else if (value.isArray()) {
                    int resolved = index < 0 ? value.size() + index : index;
                    JsonNode element = resolved >= 0 ? value.get(resolved) : null;
                    out.add(element == null ? NullNode.getInstance() : element);
                } else {
                    throw new JqException("Cannot index " + typeName(value) + " with number");
                }
            }
            return out;
        };
    }

    static JqExpr iterate(JqExpr target) {
        return input -> {
            List<JsonNode> out = new ArrayList<>();
            for (JsonNode value : target.eval(input)) {
                if (!value.isArray() && !value.isObject()) {
                    throw new JqException("Cannot iterate over " + typeName(value));
                }
                value.elements().forEachRemaining(out::add);
            }
            return out;
        };
    }

    static JqExpr optional(JqExpr target) {
        return input -> {
            try {
                return target.eval(input);
            } catch (JqException suppressed) {
                return List.of();
            }
        };
    }

    static JqExpr pipe(JqExpr left, JqExpr right) {
        return input -> {
            List<JsonNode> out = new ArrayList<>();
            for (JsonNode value : left.eval(input)) {
                out.addAll(right.eval(value));
            }
            return out;
        };
    }

    static JqExpr comma(JqExpr left, JqExpr right) {
        return input -> {
            List<JsonNode> out = new ArrayList<>(left.eval(input));
            out.addAll(right.eval(input));
            return out;
        };
    }

    static JqExpr collect(JqExpr body) {
        return input -> {
            ArrayNode array = NODES.arrayNode();
            array.addAll(body.eval(input));
            return List.of(array);
        };
    }

    static JqExpr emptyArray() {
        return input -> List.of(NODES.arrayNode());
    }

    static JqExpr equality(JqExpr left, JqExpr right, boolean negate) {
        return input -> {
            List<JsonNode> rights = right.eval(input);
            List<JsonNode> lefts = left.eval(input);
            List<JsonNode> out = new ArrayList<>();
            for (JsonNode r : rights) {
                for (JsonNode l : lefts) {
                    out.add(BooleanNode.valueOf(valueEquals(l, r) != negate));
                }
            }
            return out;
        };
    }

    static JqExpr select(JqExpr condition) {
        return input -> {
            List<JsonNode> out = new ArrayList<>();
            for (JsonNode result : condition.eval(input)) {
                if (truthy(result)) out.add(input);
            }
            return out;
        };
    }

    static JqExpr map(JqExpr body) {
        return collect(pipe(iterate(identity()), body));
    }

    static JqExpr flatten() {
        return input -> {
            if (!input.isArray()) throw new JqException("Cannot flatten " + typeName(input));
            ArrayNode flat = NODES.arrayNode();
            flattenInto(input, flat);
            return List.of(flat);
        };
    }

    static JqExpr length() {
        return input -> {
            if (isNull(input)) return List.of(NODES.numberNode(0));
            if (input.isTextual()) {
                String text = input.textValue();
                return List.of(NODES.numberNode(text.codePointCount(0, text.length())));
            }
            if (input.isArray() || input.isObject()) return List.of(NODES.numberNode(input.size()));
            if (input.isNumber()) return List.of(NODES.numberNode(input.decimalValue().abs()));
            throw new JqException(typeName(input) + " has no length");
        };
    }

    static JqExpr keys() {
        return input -> {
            ArrayNode keys = NODES.arrayNode();
            if (input.isObject()) {
                TreeSet<String> sorted = new TreeSet<>();
                input.fieldNames().forEachRemaining(sorted::add);
                sorted.forEach(keys::add);
            } else if (input.isArray()) {
                for (int i = 0; i < input.size(); i++) keys.add(i);
            } else {
                throw new JqException(typeName(input) + " has no keys");
            }
            return List.of(keys);
        };
    }

    static JqExpr not() {
        return input -> List.of(BooleanNode.valueOf(!truthy(input)));
    }

    static JqExpr empty() {
        return input -> List.of();
    }

    static boolean truthy(JsonNode value) {
        if (isNull(value)) return false;
        return !value.isBoolean() || value.booleanValue();
    }

    private static void flattenInto(JsonNode array, ArrayNode out) {
        Iterator<JsonNode> elements = array.elements();
        while (elements.hasNext()) {
            JsonNode element = elements.next();
            if (element.isArray()) {
                flattenInto(element, out);
            } else {
                out.add(element);
            }
        }
    }

    private static boolean valueEquals(JsonNode left, JsonNode right) {
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue()) == 0;
        }
        if (isNull(left) && isNull(right)) return true;
        return left.equals(right);
    }

    private static boolean isNull(JsonNode value) {
        return value == null || value.isNull() || value.isMissingNode();
    }

    static String typeName(JsonNode value) {
        if (isNull(value)) return "null";
        if (value.isBoolean()) return "boolean";
        if (value.isNumber()) return "number";
        if (value.isTextual()) return "string";
        if (value.isArray()) return "array";
        if (value.isObject()) return "object";
        return value.getNodeType().name().toLowerCase();
    }
}
