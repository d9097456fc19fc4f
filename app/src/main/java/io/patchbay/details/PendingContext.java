package io.patchbay.details;

import io.patchbay.patch.PatchSet;
import org.jetbrains.annotations.Nullable;

/**
 * Sparse overlay of not-yet-committed changes to a {@link ViewContext}. A field that is not touched leaves the
 * committed value alone; {@code hasPatch} distinguishes "clear the patch" from "patch not touched".
 */
public record PendingContext(
        boolean hasPatch, @Nullable PatchSet patch, @Nullable Preferences preferences, @Nullable Boolean visible) {

    public static final PendingContext EMPTY = new PendingContext(false, null, null, null);

    public static PendingContext ofPatch(@Nullable PatchSet patch) {
        return new PendingContext(true, patch, null, null);
    }

    public static PendingContext ofPreferences(Preferences preferences) {
        return new PendingContext(false, null, preferences, null);
    }

    public static PendingContext ofVisible(boolean visible) {
        return new PendingContext(false, null, null, visible);
    }

    public boolean isEmpty() {
        return !hasPatch && preferences == null && visible == null;
    }

    /** Field-wise last-writer-wins: every field touched by {@code newer} replaces the one here. */
    public PendingContext merge(PendingContext newer) {
        return new PendingContext(
                hasPatch || newer.hasPatch,
                newer.hasPatch ? newer.patch : patch,
                newer.preferences != null ? newer.preferences : preferences,
                newer.visible != null ? newer.visible : visible);
    }

    public ViewContext applyTo(ViewContext committed) {
        return new ViewContext(
                hasPatch ? patch : committed.patch(),
                preferences != null ? preferences : committed.preferences(),
                visible != null ? visible : committed.visible());
    }
}
