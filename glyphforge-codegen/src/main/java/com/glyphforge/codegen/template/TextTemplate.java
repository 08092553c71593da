package com.glyphforge.codegen.template;

import com.glyphforge.model.AbstractComponent;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Line template with {@code {name}} placeholders. Placeholders without a value are left as
 * written, so literal braces in the target language need no escaping.
 */
public final class TextTemplate implements ComponentTemplate {

    public static final String CHILDREN = "{children}";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_]+)}");

    private final List<String> lines;

    public TextTemplate(String... lines) {
        this(List.of(lines));
    }

    public TextTemplate(List<String> lines) {
        this.lines = List.copyOf(lines);
    }

    public List<String> lines() {
        return lines;
    }

    @Override
    public List<String> render(AbstractComponent component, String indent, Map<String, String> variables) {
        return render(indent, variables);
    }

    public List<String> render(String indent, Map<String, String> variables) {
        List<String> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            out.add(line.isEmpty() ? line : indent + substitute(line, variables));
        }
        return out;
    }

    public static String substitute(String text, Map<String, String> variables) {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder sb = new StringBuilder(text.length());
        while (matcher.find()) {
            String value = variables.get(matcher.group(1));
            matcher.appendReplacement(sb, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
