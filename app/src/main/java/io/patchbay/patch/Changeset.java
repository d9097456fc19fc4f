package io.patchbay.patch;

import java.time.Instant;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * A versioned group of per-repository patches under a draft. {@code parentChangesetId} links to the previous
 * version; a publish creates exactly one changeset.
 */
public record Changeset(
        String id,
        String draftId,
        @Nullable String parentChangesetId,
        String gitProfileId,
        Instant createdAt,
        Instant updatedAt,
        List<RemotePatch> patches,
        @Nullable String userId) {

    public Changeset {
        patches = List.copyOf(patches);
    }
}
