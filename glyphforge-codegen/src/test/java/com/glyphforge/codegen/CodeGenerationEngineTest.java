package com.glyphforge.codegen;

import com.glyphforge.api.model.BoundingBox;
import com.glyphforge.codegen.template.TemplateSet;
import com.glyphforge.codegen.template.TemplateSets;
import com.glyphforge.codegen.template.TextTemplate;
import com.glyphforge.infra.telemetry.TracingService;
import com.glyphforge.model.AbstractComponent;
import com.glyphforge.model.ComponentModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CodeGenerationEngineTest {

    private CodeGenerationEngine engine;
    private ComponentModel model;

    @BeforeEach
    void setUp() {
        engine = new CodeGenerationEngine(TracingService.noopTracer());
        model = new ComponentModel();
    }

    private AbstractComponent add(String id, String role, BoundingBox bounds, String text) {
        AbstractComponent component = model.add(new AbstractComponent(id, role, bounds, List.of()));
        if (text != null) {
            component.setProperty("text", text);
        }
        return component;
    }

    /** Frame c0 at (0,0)-(11,4) holding button c1 at (2,1)-(5,1) and label c2 at (2,3)-(6,3). */
    private void formModel() {
        add("c0", "container", new BoundingBox(0, 0, 11, 4), null);
        add("c1", "button", new BoundingBox(2, 1, 5, 1), "OK");
        add("c2", "label", new BoundingBox(2, 3, 6, 3), "Name");
        model.attach("c0", "c1");
        model.attach("c0", "c2");
    }

    @Test
    @DisplayName("Should generate a tkinter application with widgets placed relative to their parent")
    void testTkinter() {
        formModel();

        String code = engine.generate(model, "tkinter");

        assertThat(code)
            .startsWith("import tkinter as tk\nfrom tkinter import ttk\n")
            .contains("        self.title('ASCII UI Application')")
            .contains("        self.geometry('800x600')")
            .contains("        self.container_c0 = tk.Frame(self, borderwidth=1, relief='solid')\n"
                + "        self.container_c0.place(x=0, y=0, width=96, height=80)\n"
                + "        self.button_c1 = tk.Button(self.container_c0, text='OK')\n"
                + "        self.button_c1.place(x=16, y=16, width=32, height=16)\n"
                + "        self.label_c2 = tk.Label(self.container_c0, text='Name')\n")
            .endsWith("if __name__ == '__main__':\n    app = Application()\n    app.mainloop()\n");
    }

    @Test
    @DisplayName("Should generate a swing frame honouring options and indenting children")
    void testSwing() {
        formModel();

        String code = engine.generate(model, TemplateSets.swing(),
            Map.of("class_name", "LoginForm", "cell_width", "10", "title", "Login"));

        assertThat(code)
            .contains("public class LoginForm extends JFrame {")
            .contains("        super(\"Login\");")
            .contains("        JPanel container_c0 = new JPanel(null);")
            .contains("        container_c0.setBounds(0, 0, 120, 80);")
            .contains("            JButton button_c1 = new JButton(\"OK\");")
            .contains("            button_c1.setBounds(20, 16, 40, 16);")
            .contains("            container_c0.add(button_c1);")
            .contains("new LoginForm().setVisible(true)");
        assertThat(code.indexOf("button_c1")).isLessThan(code.indexOf("label_c2"));
    }

    @Test
    @DisplayName("Should substitute child blocks at the children placeholder")
    void testChildrenPlaceholder() {
        formModel();
        TemplateSet html = TemplateSet.builder("html")
            .template("container", new TextTemplate("<div id=\"{id}\">", "{children}", "</div>"))
            .defaultTemplate(new TextTemplate("<span>{text}</span>"))
            .indentStep("  ")
            .build();

        String code = engine.generate(model, html, Map.of());

        assertThat(code).isEqualTo("<div id=\"c0\">\n  <span>OK</span>\n  <span>Name</span>\n</div>\n");
    }

    @Test
    @DisplayName("Should skip components without a template together with their subtree")
    void testSkipWithoutTemplate() {
        formModel();
        add("c3", "button", new BoundingBox(20, 0, 24, 0), "Help");
        TemplateSet buttonsOnly = TemplateSet.builder("buttons")
            .template("button", new TextTemplate("button {id} {text}"))
            .build();

        String code = engine.generate(model, buttonsOnly, Map.of());

        assertThat(code).isEqualTo("button c3 Help\n");
    }

    @Test
    @DisplayName("Should escape quotes in component text and ignore invalid scale options")
    void testEscapingAndInvalidOptions() {
        add("c0", "label", new BoundingBox(1, 1, 6, 1), "it's \"ok\"");

        String code = engine.generate(model, TemplateSets.tkinter(),
            Map.of("cell_width", "wide", "cell_height", "-3"));

        assertThat(code).contains("text='it\\'s \\\"ok\\\"'")
            .contains("place(x=8, y=16)");
    }

    @Test
    @DisplayName("Should emit only prologue and epilogue for an empty model")
    void testEmptyModel() {
        String code = engine.generate(model, "swing");

        assertThat(code).contains("setLayout(null);").doesNotContain(".add(");
        assertThatThrownBy(() -> engine.generate(model, "cobol"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should derive identifier-safe variable names")
    void testVariableName() {
        AbstractComponent component = new AbstractComponent("c-7", "text_field", new BoundingBox(0, 0, 0, 0), List.of());
        AbstractComponent unclassified = new AbstractComponent("c8", null, new BoundingBox(0, 0, 0, 0), List.of());

        assertThat(CodeGenerationEngine.variableName(component)).isEqualTo("text_field_c_7");
        assertThat(CodeGenerationEngine.variableName(unclassified)).isEqualTo("component_c8");
    }
}
