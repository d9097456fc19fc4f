package io.patchbay.config;

import java.util.Set;

@FunctionalInterface
public interface SettingsChangeListener {

    /** Called after a write, with the keys whose values actually changed. Never called with an empty set. */
    void settingsChanged(Set<String> changedKeys);
}
