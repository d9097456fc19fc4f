package io.patchbay.details;

/**
 * How the changed-files tree is laid out.
 *
 * @param layout {@code auto}, {@code list} or {@code tree}
 * @param compact whether single-child folders are collapsed into one row
 * @param icon {@code type} or {@code status}
 * @param threshold file count above which {@code auto} switches from list to tree
 */
public record FilesPreferences(String layout, boolean compact, String icon, int threshold) {}
