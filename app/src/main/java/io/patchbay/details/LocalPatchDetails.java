package io.patchbay.details;

import io.patchbay.git.GitFileChange;
import java.util.List;
import org.jetbrains.annotations.Nullable;

public record LocalPatchDetails(
        String contentsRef,
        @Nullable String message,
        @Nullable String baseRef,
        @Nullable String repoPath,
        @Nullable List<GitFileChange> files,
        List<Autolink> autolinks,
        @Nullable DerivationError autolinkError)
        implements PatchDetails {

    public LocalPatchDetails {
        files = files == null ? null : List.copyOf(files);
        autolinks = List.copyOf(autolinks);
    }
}
