package com.glyphforge.runtime.matching;

import java.util.Map;

/**
 * Result of evaluating one rule.
 *
 * @param applicable false when the rule does not apply to the subject; such rules are left
 *                   out of the confidence denominator
 * @param passed     whether the rule held
 * @param properties properties contributed on a pass
 */
public record RuleOutcome(boolean applicable, boolean passed, Map<String, Object> properties) {

    private static final RuleOutcome NOT_APPLICABLE = new RuleOutcome(false, false, Map.of());
    private static final RuleOutcome FAILED = new RuleOutcome(true, false, Map.of());

    public RuleOutcome {
        properties = properties == null ? Map.of() : Map.copyOf(properties);
    }

    public static RuleOutcome pass(Map<String, Object> properties) {
        return new RuleOutcome(true, true, properties);
    }

    public static RuleOutcome fail() {
        return FAILED;
    }

    public static RuleOutcome notApplicable() {
        return NOT_APPLICABLE;
    }
}
