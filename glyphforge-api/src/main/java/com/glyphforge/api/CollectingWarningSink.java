package com.glyphforge.api;

import com.glyphforge.api.model.DslWarning;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * Default {@link WarningSink}: logs every warning at WARNING level and keeps it.
 * Thread-safe.
 */
public class CollectingWarningSink implements WarningSink {
    private static final Logger logger = Logger.getLogger(CollectingWarningSink.class.getName());

    private final List<DslWarning> warnings = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void warn(DslWarning warning) {
        logger.warning(warning.toString());
        warnings.add(warning);
    }

    public List<DslWarning> getWarnings() {
        synchronized (warnings) {
            return List.copyOf(warnings);
        }
    }

    public void clear() {
        warnings.clear();
    }
}
