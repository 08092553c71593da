package com.glyphforge.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A single matching rule of a pattern.
 *
 * @param command   what the rule does
 * @param target    tag name for tag rules, property name for pluck rules
 * @param values    literals for tag rules, regular expressions for pluck rules
 */
public record Rule(
    @JsonProperty("command") RuleCommand command,
    @JsonProperty("target") String target,
    @JsonProperty("values") List<String> values
) {

    public Rule {
        Objects.requireNonNull(command, "command");
        Objects.requireNonNull(target, "target");
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static Rule tag(String tag, String... literals) {
        return new Rule(RuleCommand.TAG, tag, List.of(literals));
    }

    public static Rule pluck(String property, String... regexes) {
        return new Rule(RuleCommand.PLUCK, property, List.of(regexes));
    }
}
