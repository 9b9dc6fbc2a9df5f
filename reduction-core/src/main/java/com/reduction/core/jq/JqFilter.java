package com.reduction.core.jq;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * A compiled filter in the jq subset used by reduction definitions.
 *
 * <p>Supported: identity ({@code .}), field access ({@code .a}, {@code ."a-b"}, {@code .["a"]}),
 * indexing ({@code .[0]}), iteration ({@code .[]}), the optional operator ({@code ?}), pipes,
 * comma, array construction, parentheses, string/number/boolean/null literals,
 * {@code ==} and {@code !=}, and the builtins {@code select(f)}, {@code map(f)}, {@code flatten},
 * {@code length}, {@code keys}, {@code not} and {@code empty}.
 *
 * <p>Instances are immutable and safe for concurrent use.
 */
public final class JqFilter {
    private final String expression;
    private final JqExpr root;

    private JqFilter(String expression, JqExpr root) {
        this.expression = expression;
        this.root = root;
    }

    public static JqFilter compile(String expression) throws JqException {
        Objects.requireNonNull(expression, "expression");
        return new JqFilter(expression, new JqParser(expression).parse());
    }

    public String expression() {
        return expression;
    }

    /** Every value the filter emits for {@code input}, in emission order. */
    public List<JsonNode> apply(JsonNode input) throws JqException {
        return root.eval(Objects.requireNonNull(input, "input"));
    }

    @Override
    public String toString() {
        return expression;
    }
}
