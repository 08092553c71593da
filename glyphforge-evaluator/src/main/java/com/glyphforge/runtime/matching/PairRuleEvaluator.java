package com.glyphforge.runtime.matching;

import com.glyphforge.api.model.ComponentPair;
import com.glyphforge.api.model.Rule;

import java.util.Map;

/**
 * Evaluates a rule of a relationship pattern against an ordered component pair.
 * Implementations return {@link RuleOutcome#notApplicable()} for rules they do not handle.
 */
@FunctionalInterface
public interface PairRuleEvaluator {

    RuleOutcome evaluate(Rule rule, ComponentPair pair);

    /**
     * Tag rules pass when a literal occurs in both components; pluck rules are not
     * applicable.
     */
    static PairRuleEvaluator tagsOnly() {
        return (rule, pair) -> switch (rule.command()) {
            case TAG -> ComponentRuleEvaluator.containsAnyLiteral(rule, pair.source())
                && ComponentRuleEvaluator.containsAnyLiteral(rule, pair.target())
                ? RuleOutcome.pass(Map.of())
                : RuleOutcome.fail();
            case PLUCK -> RuleOutcome.notApplicable();
        };
    }
}
