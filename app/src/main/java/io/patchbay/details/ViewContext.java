package io.patchbay.details;

import io.patchbay.patch.PatchSet;
import org.jetbrains.annotations.Nullable;

/** Committed state of one patch-details view. Replaced wholesale on every flush, never mutated in place. */
public record ViewContext(@Nullable PatchSet patch, Preferences preferences, boolean visible) {

    public ViewContext withPatch(@Nullable PatchSet newPatch) {
        return new ViewContext(newPatch, preferences, visible);
    }

    public ViewContext withPreferences(Preferences newPreferences) {
        return new ViewContext(patch, newPreferences, visible);
    }

    public ViewContext withVisible(boolean newVisible) {
        return new ViewContext(patch, preferences, newVisible);
    }
}
