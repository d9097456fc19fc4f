package io.patchbay.git;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/**
 * Immutable snapshot of a commit. {@code files} is only populated for commits materialized from a patch; log entries
 * carry an empty list.
 */
public record CommitInfo(
        String sha,
        @Nullable String parentSha,
        String message,
        String authorName,
        String authorEmail,
        Instant date,
        Path repoPath,
        List<GitFileChange> files) {

    public CommitInfo {
        files = List.copyOf(files);
    }

    public String shortSha() {
        return sha.length() > 7 ? sha.substring(0, 7) : sha;
    }

    /** First line of the message. */
    public String summary() {
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }

    public Optional<GitFileChange> findFile(String path) {
        return files.stream().filter(f -> f.path().equals(path)).findFirst();
    }
}
