package io.patchbay.git;

import org.eclipse.jgit.diff.DiffEntry;

/** Per-file change status, using git's one-letter codes. */
public enum FileStatus {
    ADDED('A'),
    MODIFIED('M'),
    DELETED('D'),
    RENAMED('R'),
    COPIED('C');

    private final char code;

    FileStatus(char code) {
        this.code = code;
    }

    public char code() {
        return code;
    }

    static FileStatus from(DiffEntry.ChangeType changeType) {
        return switch (changeType) {
            case ADD -> ADDED;
            case MODIFY -> MODIFIED;
            case DELETE -> DELETED;
            case RENAME -> RENAMED;
            case COPY -> COPIED;
        };
    }
}
