package com.reduction.core;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/** A pointer to one line of one archive file. {@code firstLine} is 1-based, null when unknown. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Detail(
    @JsonProperty("path") String path,
    @JsonProperty("first_line") Integer firstLine,
    @JsonProperty("text") String text
) {}
