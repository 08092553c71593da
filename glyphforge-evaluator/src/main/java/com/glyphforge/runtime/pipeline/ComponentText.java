package com.glyphforge.runtime.pipeline;

import java.util.List;

/**
 * Derives the display text of a component from its content lines: checkbox marks and one
 * pair of enclosing brackets are removed, lines are joined with single spaces.
 */
final class ComponentText {

    private static final List<String> CHECK_MARKS = List.of("[ ]", "[X]", "[x]", "☐", "☑");
    private static final String OPENING = "[(<{";
    private static final String CLOSING = "])>}";

    private ComponentText() {
    }

    static String derive(List<String> contentLines) {
        StringBuilder joined = new StringBuilder();
        for (String line : contentLines) {
            String stripped = line.strip();
            if (stripped.isEmpty()) {
                continue;
            }
            if (joined.length() > 0) {
                joined.append(' ');
            }
            joined.append(stripped);
        }
        String text = joined.toString();
        for (String mark : CHECK_MARKS) {
            if (text.startsWith(mark)) {
                return text.substring(mark.length()).strip();
            }
        }
        if (text.length() >= 2) {
            int open = OPENING.indexOf(text.charAt(0));
            if (open >= 0 && text.charAt(text.length() - 1) == CLOSING.charAt(open)) {
                return text.substring(1, text.length() - 1).strip();
            }
        }
        return text;
    }
}
