package io.patchbay.patch;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Nullable;

/** A published draft and its changesets, oldest first. {@code id} is assigned by the server. */
public record CloudPatch(
        String id,
        @Nullable String linkUrl,
        @Nullable String title,
        @Nullable String description,
        Instant createdAt,
        Instant updatedAt,
        String createdBy,
        boolean isPublic,
        @Nullable String organizationId,
        List<Changeset> changesets)
        implements PatchSet {

    public CloudPatch {
        changesets = List.copyOf(changesets);
    }

    @Override
    public PatchKind kind() {
        return PatchKind.CLOUD;
    }

    public Optional<Changeset> currentChangeset() {
        return changesets.isEmpty() ? Optional.empty() : Optional.of(changesets.get(0));
    }

    /** Dereferences {@code changesets[0].patches[0]}; its absence is a precondition failure. */
    @Override
    public RemotePatch target() {
        var changeset = currentChangeset()
                .orElseThrow(() -> new IllegalStateException("Cloud patch " + id + " has no changesets"));
        if (changeset.patches().isEmpty()) {
            throw new IllegalStateException("Changeset " + changeset.id() + " of cloud patch " + id + " has no patches");
        }
        return changeset.patches().get(0);
    }

    public CloudPatch withChangesets(List<Changeset> newChangesets) {
        return new CloudPatch(
                id, linkUrl, title, description, createdAt, updatedAt, createdBy, isPublic, organizationId, newChangesets);
    }
}
