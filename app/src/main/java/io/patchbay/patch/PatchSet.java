package io.patchbay.patch;

/**
 * A patch as shown by the patch-details view: either a local diff or a published cloud patch.
 *
 * <p>Callers must branch on {@link #kind()} (or {@code instanceof}) before touching variant-specific state.
 */
public sealed interface PatchSet permits LocalPatch, CloudPatch {

    PatchKind kind();

    /**
     * The patch that carries the diff contents and the enrichment fields (repository, base, files, commit).
     *
     * @throws IllegalStateException if a cloud patch has no changeset or no patch to dereference
     */
    GitPatch target();
}
