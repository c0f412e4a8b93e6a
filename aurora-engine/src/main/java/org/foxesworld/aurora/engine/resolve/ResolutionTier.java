package org.foxesworld.aurora.engine.resolve;

/** Priority tiers of cross-installation resolution, highest first. */
public enum ResolutionTier {
    OVERRIDE("Override folder"),
    INSTALLATION_ROOT("Installation root"),
    MODULE_PRIMARY("Modules (.mod)"),
    MODULE_COMPOSITE("Modules (.rim/.erf)"),
    CHITIN("Chitin BIFs");

    private final String displayName;

    ResolutionTier(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() { return displayName; }
}
