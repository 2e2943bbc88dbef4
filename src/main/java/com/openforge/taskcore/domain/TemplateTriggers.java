package com.openforge.taskcore.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Keyword / regex triggers used when semantic matching is unavailable.
 * Patterns are Java regex strings matched case-insensitively.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TemplateTriggers(
        List<String> patterns,
        List<String> keywords
) {

    public static TemplateTriggers none() {
        return new TemplateTriggers(List.of(), List.of());
    }
}
