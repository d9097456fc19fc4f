package io.patchbay.details;

public enum FileActionKind {
    OPEN,
    OPEN_ON_REMOTE,
    COMPARE_WORKING,
    COMPARE_PREVIOUS,
    /** Let the user choose one of the other actions. */
    SHOW_ACTIONS
}
