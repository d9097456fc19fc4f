package io.patchbay.details;

import io.patchbay.util.Json;
import org.jetbrains.annotations.Nullable;

/**
 * One complete snapshot for the rendering layer. Each snapshot stands on its own; consumers never patch a previous
 * one.
 *
 * @param timestamp epoch millis at which the snapshot was built
 */
public record PatchDetailsState(
        String webviewId, long timestamp, @Nullable PatchDetails patch, Preferences preferences) {

    public String toJson() {
        return Json.toJson(this);
    }
}
