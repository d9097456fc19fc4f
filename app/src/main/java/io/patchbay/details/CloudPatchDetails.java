package io.patchbay.details;

import io.patchbay.git.GitFileChange;
import java.time.Instant;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public record CloudPatchDetails(
        String id,
        @Nullable String linkUrl,
        @Nullable String message,
        Author author,
        Instant createdAt,
        Instant updatedAt,
        @Nullable String baseRef,
        @Nullable String repoPath,
        @Nullable List<GitFileChange> files,
        List<Autolink> autolinks,
        @Nullable DerivationError autolinkError)
        implements PatchDetails {

    public CloudPatchDetails {
        files = files == null ? null : List.copyOf(files);
        autolinks = List.copyOf(autolinks);
    }
}
