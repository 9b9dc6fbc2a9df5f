package com.reduction.core.jq;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/** One compiled filter term: maps an input value to the stream of values it emits. */
@FunctionalInterface
interface JqExpr {
    List<JsonNode> eval(JsonNode input) throws JqException;
}
