package com.glyphforge.codegen.template;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Built-in template sets, by toolkit name.
 */
public final class TemplateSets {

    public static final String TKINTER = "tkinter";
    public static final String SWING = "swing";

    private static final Map<String, TemplateSet> SETS = new LinkedHashMap<>();

    static {
        SETS.put(TKINTER, tkinter());
        SETS.put(SWING, swing());
    }

    private TemplateSets() {
    }

    public static TemplateSet get(String toolkit) {
        TemplateSet set = SETS.get(toolkit);
        if (set == null) {
            throw new IllegalArgumentException(
                "Unknown toolkit '" + toolkit + "', expected one of " + SETS.keySet());
        }
        return set;
    }

    public static Set<String> names() {
        return SETS.keySet();
    }

    /** Python Tkinter application with absolutely placed widgets. */
    public static TemplateSet tkinter() {
        return TemplateSet.builder(TKINTER)
            .prologue(
                "import tkinter as tk",
                "from tkinter import ttk",
                "",
                "",
                "class Application(tk.Tk):",
                "    def __init__(self):",
                "        super().__init__()",
                "        self.title('{title}')",
                "        self.geometry('{window_width}x{window_height}')",
                "        self.create_widgets()",
                "",
                "    def create_widgets(self):")
            .epilogue(
                "        pass",
                "",
                "",
                "if __name__ == '__main__':",
                "    app = Application()",
                "    app.mainloop()")
            // python blocks end with indentation, so nested widgets stay at method level
            .rootIndent("        ")
            .indentStep("")
            .rootReference("self")
            .referenceFormat("self.{var}")
            .defaultOption("title", "ASCII UI Application")
            .defaultOption("window_width", "800")
            .defaultOption("window_height", "600")
            .template("container", new TextTemplate(
                "self.{var} = tk.Frame({parent}, borderwidth=1, relief='solid')",
                "self.{var}.place(x={px}, y={py}, width={pw}, height={ph})"))
            .template("button", new TextTemplate(
                "self.{var} = tk.Button({parent}, text='{text}')",
                "self.{var}.place(x={px}, y={py}, width={pw}, height={ph})"))
            .template("label", new TextTemplate(
                "self.{var} = tk.Label({parent}, text='{text}')",
                "self.{var}.place(x={px}, y={py})"))
            .template("text_field", new TextTemplate(
                "self.{var} = ttk.Entry({parent})",
                "self.{var}.place(x={px}, y={py}, width={pw})"))
            .template("checkbox", new TextTemplate(
                "self.{var}_value = tk.BooleanVar()",
                "self.{var} = tk.Checkbutton({parent}, text='{text}', variable=self.{var}_value)",
                "self.{var}.place(x={px}, y={py})"))
            .defaultTemplate(new TextTemplate(
                "# {role} {id}",
                "self.{var} = tk.Label({parent}, text='{text}')",
                "self.{var}.place(x={px}, y={py})"))
            .build();
    }

    /** Java Swing frame with a null layout. */
    public static TemplateSet swing() {
        return TemplateSet.builder(SWING)
            .prologue(
                "import javax.swing.*;",
                "import java.awt.*;",
                "",
                "public class {class_name} extends JFrame {",
                "",
                "    public {class_name}() {",
                "        super(\"{title}\");",
                "        setDefaultCloseOperation(JFrame.EXIT_ON_CLOSE);",
                "        setLayout(null);",
                "        setSize({window_width}, {window_height});")
            .epilogue(
                "    }",
                "",
                "    public static void main(String[] args) {",
                "        SwingUtilities.invokeLater(() -> new {class_name}().setVisible(true));",
                "    }",
                "}")
            .rootIndent("        ")
            .indentStep("    ")
            .rootReference("this")
            .referenceFormat("{var}")
            .defaultOption("title", "ASCII UI Application")
            .defaultOption("window_width", "800")
            .defaultOption("window_height", "600")
            .defaultOption("class_name", "GeneratedUI")
            .template("container", new TextTemplate(
                "JPanel {var} = new JPanel(null);",
                "{var}.setBorder(BorderFactory.createLineBorder(Color.BLACK));",
                "{var}.setBounds({px}, {py}, {pw}, {ph});",
                "{parent}.add({var});"))
            .template("button", widget("JButton", "new JButton(\"{text}\")"))
            .template("label", widget("JLabel", "new JLabel(\"{text}\")"))
            .template("text_field", widget("JTextField", "new JTextField()"))
            .template("checkbox", widget("JCheckBox", "new JCheckBox(\"{text}\")"))
            .defaultTemplate(new TextTemplate(
                "// {role} {id}",
                "JLabel {var} = new JLabel(\"{text}\");",
                "{var}.setBounds({px}, {py}, {pw}, {ph});",
                "{parent}.add({var});"))
            .build();
    }

    private static TextTemplate widget(String type, String constructor) {
        return new TextTemplate(
            type + " {var} = " + constructor + ";",
            "{var}.setBounds({px}, {py}, {pw}, {ph});",
            "{parent}.add({var});");
    }
}
