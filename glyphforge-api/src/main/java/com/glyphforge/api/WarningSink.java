package com.glyphforge.api;

import com.glyphforge.api.model.DslWarning;

/**
 * Receives non-fatal diagnostics. Warnings never abort compilation or recognition.
 */
@FunctionalInterface
public interface WarningSink {

    void warn(DslWarning warning);

    static WarningSink discarding() {
        return warning -> { };
    }
}
