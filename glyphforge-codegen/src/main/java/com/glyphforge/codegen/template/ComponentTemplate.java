package com.glyphforge.codegen.template;

import com.glyphforge.model.AbstractComponent;

import java.util.List;
import java.util.Map;

/**
 * Renders one component as a block of source lines.
 */
@FunctionalInterface
public interface ComponentTemplate {

    /**
     * @param component the component being rendered
     * @param indent    prefix for every returned line
     * @param variables generation options overlaid with the component's placeholder values
     * @return rendered lines; a line whose trimmed text is {@link TextTemplate#CHILDREN}
     *         marks where child blocks go
     */
    List<String> render(AbstractComponent component, String indent, Map<String, String> variables);
}
