package io.patchbay.details;

import io.patchbay.config.PatchbaySettings;

/** The settings a patch-details view renders with; sent along with every snapshot. */
public record Preferences(
        boolean avatars, String dateFormat, FilesPreferences files, String indentGuides, boolean autolinksEnabled) {

    public static Preferences fromSettings(PatchbaySettings settings) {
        return new Preferences(
                settings.isAvatarsEnabled(),
                settings.getDateFormat(),
                new FilesPreferences(
                        settings.getFilesLayout(),
                        settings.isFilesCompact(),
                        settings.getFilesIcon(),
                        settings.getFilesThreshold()),
                settings.getIndentGuides(),
                settings.isAutolinksEnabled());
    }

    public Preferences withFiles(FilesPreferences newFiles) {
        return new Preferences(avatars, dateFormat, newFiles, indentGuides, autolinksEnabled);
    }
}
