package com.glyphforge.api.model;

/**
 * Kind of a registered pattern. Track and gather patterns are evaluated against single
 * components, relate patterns against ordered component pairs.
 */
public enum PatternKind {
    TRACK(true),
    GATHER(true),
    RELATE(false);

    private final boolean componentApplicable;

    PatternKind(boolean componentApplicable) {
        this.componentApplicable = componentApplicable;
    }

    public boolean isComponentApplicable() {
        return componentApplicable;
    }

    public boolean isRelationshipApplicable() {
        return !componentApplicable;
    }
}
