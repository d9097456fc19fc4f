package io.patchbay.patch;

import io.patchbay.git.CommitInfo;
import io.patchbay.git.GitFileChange;
import io.patchbay.git.PatchRepository;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Diff contents plus the derived fields that get filled in lazily: the repository it belongs to, the base it applies
 * on, the changed files parsed from the diff and the materialized commit.
 *
 * <p>Derived fields stay null until something populates them. Instances are compared by identity.
 */
public abstract sealed class GitPatch permits LocalPatch, RemotePatch {

    private volatile @Nullable String baseRef;
    private volatile @Nullable List<GitFileChange> files;
    private volatile @Nullable PatchRepository repo;
    private volatile @Nullable CommitInfo resolvedCommit;

    /** Raw unified diff, or null when the contents have not been downloaded yet. */
    public abstract @Nullable String contents();

    public @Nullable String baseRef() {
        return baseRef;
    }

    public void setBaseRef(@Nullable String baseRef) {
        this.baseRef = baseRef;
    }

    public @Nullable List<GitFileChange> files() {
        return files;
    }

    public void setFiles(@Nullable List<GitFileChange> files) {
        this.files = files == null ? null : List.copyOf(files);
    }

    public @Nullable PatchRepository repo() {
        return repo;
    }

    public void setRepo(@Nullable PatchRepository repo) {
        this.repo = repo;
    }

    public @Nullable CommitInfo resolvedCommit() {
        return resolvedCommit;
    }

    public void setResolvedCommit(@Nullable CommitInfo resolvedCommit) {
        this.resolvedCommit = resolvedCommit;
    }
}
