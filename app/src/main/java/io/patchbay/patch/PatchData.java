package io.patchbay.patch;

/** Flat view of a stored patch row, optionally with its downloaded contents (empty when not requested). */
public record PatchData(
        String id,
        String draftId,
        String gitProfileId,
        String gitRepositoryName,
        String gitBranchName,
        String contents) {}
