package com.glyphforge.compiler.library;

import com.glyphforge.api.exceptions.RegistrationException;
import com.glyphforge.api.model.PatternDefinition;
import com.glyphforge.api.model.PatternKind;
import com.glyphforge.api.model.Rule;
import com.glyphforge.compiler.analysis.PatternOverlapAnalyzer;
import com.glyphforge.compiler.registry.PatternRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BuiltInPatternsTest {

    @Test
    @DisplayName("Should register the built-in patterns in library order")
    void testRegistration() {
        PatternRegistry registry = BuiltInPatterns.newRegistry();

        assertThat(registry.patterns()).extracting(PatternDefinition::id)
            .containsExactlyElementsOf(BuiltInPatterns.IDS);
        assertThat(registry.patterns()).extracting(PatternDefinition::kind).containsOnly(PatternKind.TRACK);
    }

    @Test
    @DisplayName("Should define the expected literals and extractions")
    void testDefinitions() {
        PatternRegistry registry = BuiltInPatterns.newRegistry();

        assertThat(registry.get("button").rules()).containsExactly(Rule.tag("button", "[", "]"));
        assertThat(registry.get("checkbox").tagLiterals()).containsExactly("☐", "☑", "[ ]", "[X]", "[x]");
        assertThat(registry.get("text_field").rules()).containsExactly(
            Rule.tag("text_field", "_____", "____", "......"),
            Rule.pluck("field_text", "([A-Za-z0-9_]+)"));
    }

    @Test
    @DisplayName("Should refuse to load twice into the same registry")
    void testDoubleLoad() {
        PatternRegistry registry = BuiltInPatterns.newRegistry();

        assertThatThrownBy(() -> BuiltInPatterns.registerInto(registry))
            .isInstanceOf(RegistrationException.class);
    }

    @Test
    @DisplayName("Should not contain overlapping patterns")
    void testNoOverlaps() {
        assertThat(new PatternOverlapAnalyzer().analyze(BuiltInPatterns.newRegistry()).hasOverlaps()).isFalse();
    }
}
