package io.patchbay.git;

import org.jetbrains.annotations.Nullable;

/** A file touched by a diff. {@code originalPath} is set for renames and copies only. */
public record GitFileChange(String path, @Nullable String originalPath, FileStatus status, String repoPath) {}
