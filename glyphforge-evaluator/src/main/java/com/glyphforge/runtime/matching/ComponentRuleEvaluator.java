package com.glyphforge.runtime.matching;

import com.glyphforge.api.model.ComponentView;
import com.glyphforge.api.model.Rule;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates tag and pluck rules against a single component's content lines.
 *
 * <ul>
 *   <li>tag: passes if any literal occurs in a content line; sets {@code has_<tag>}</li>
 *   <li>pluck: passes if the expression is found in a content line; the first match is
 *       stored under the rule's target</li>
 * </ul>
 * Never throws for malformed rules; an invalid expression simply fails.
 */
public class ComponentRuleEvaluator {

    public static final String HAS_PREFIX = "has_";

    private final RegexCache regexCache;

    public ComponentRuleEvaluator() {
        this(new RegexCache());
    }

    public ComponentRuleEvaluator(RegexCache regexCache) {
        this.regexCache = regexCache;
    }

    public RuleOutcome evaluate(Rule rule, ComponentView component) {
        return switch (rule.command()) {
            case TAG -> evaluateTag(rule, component);
            case PLUCK -> evaluatePluck(rule, component);
        };
    }

    static boolean containsAnyLiteral(Rule rule, ComponentView component) {
        for (String literal : rule.values()) {
            if (literal.isEmpty()) {
                continue;
            }
            for (String line : component.contentLines()) {
                if (line.contains(literal)) {
                    return true;
                }
            }
        }
        return false;
    }

    private RuleOutcome evaluateTag(Rule rule, ComponentView component) {
        return containsAnyLiteral(rule, component)
            ? RuleOutcome.pass(Map.of(HAS_PREFIX + rule.target(), Boolean.TRUE))
            : RuleOutcome.fail();
    }

    private RuleOutcome evaluatePluck(Rule rule, ComponentView component) {
        for (String regex : rule.values()) {
            Optional<Pattern> pattern = regexCache.get(regex);
            if (pattern.isEmpty()) {
                continue;
            }
            for (String line : component.contentLines()) {
                Matcher matcher = pattern.get().matcher(line);
                if (matcher.find()) {
                    return RuleOutcome.pass(Map.of(rule.target(), matcher.group()));
                }
            }
        }
        return RuleOutcome.fail();
    }
}
