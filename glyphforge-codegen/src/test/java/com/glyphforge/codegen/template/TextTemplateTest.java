package com.glyphforge.codegen.template;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TextTemplateTest {

    @Test
    @DisplayName("Should substitute known placeholders and indent every non-empty line")
    void testRender() {
        TextTemplate template = new TextTemplate("{var} = Button(text='{text}')", "", "{var}.show()");

        assertThat(template.render("  ", Map.of("var", "ok", "text", "OK")))
            .containsExactly("  ok = Button(text='OK')", "", "  ok.show()");
    }

    @Test
    @DisplayName("Should leave unknown placeholders and literal braces untouched")
    void testUnknownPlaceholders() {
        assertThat(TextTemplate.substitute("class {name} extends Base { {children}", Map.of("name", "Form")))
            .isEqualTo("class Form extends Base { {children}");
    }

    @Test
    @DisplayName("Should not interpret replacement values as group references")
    void testReplacementQuoting() {
        assertThat(TextTemplate.substitute("price {text}", Map.of("text", "$1 \\n")))
            .isEqualTo("price $1 \\n");
    }
}
