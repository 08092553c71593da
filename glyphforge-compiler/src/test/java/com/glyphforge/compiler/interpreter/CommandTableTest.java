package com.glyphforge.compiler.interpreter;

import com.glyphforge.compiler.ast.DeltaBracket;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandTableTest {

    @Test
    @DisplayName("Should reject a second handler for the same command")
    void testDuplicateRegistration() {
        CommandTable<DeltaBracket, List<String>> table =
            new CommandTable<DeltaBracket, List<String>>("delta").register("val", InterpretationRun::val);

        assertThatThrownBy(() -> table.register("val", InterpretationRun::val))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("Duplicate delta command 'val'");
    }

    @Test
    @DisplayName("Should expose the built-in command set per level")
    void testBuiltInTables() {
        assertThat(CommandTables.ALPHA.commands()).containsExactly("hunt", "Track", "RACK");
        assertThat(CommandTables.BETA.commands())
            .contains("INIT", "GATHER", "GET", "HARVEST", "HARV", "trap", "scent", "snare");
        assertThat(CommandTables.GAMMA.commands())
            .containsExactly("param", "tag", "pluck", "trap", "scent", "snare");
        assertThat(CommandTables.DELTA.commands()).containsExactly("val");
    }

    @Test
    @DisplayName("Should resolve names through enclosing scopes with shadowing")
    void testScopeChain() {
        Scope root = new Scope();
        root.define("a", "1");
        Scope child = root.child();
        child.define("b", "2");
        Scope grandchild = child.child();
        grandchild.define("a", "3");

        assertThat(grandchild.lookup("a")).contains("3");
        assertThat(grandchild.lookup("b")).contains("2");
        assertThat(child.lookup("a")).contains("1");
        assertThat(root.lookup("b")).isEmpty();
    }
}
