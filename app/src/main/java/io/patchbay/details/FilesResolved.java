package io.patchbay.details;

import io.patchbay.git.GitFileChange;
import io.patchbay.patch.GitPatch;
import io.patchbay.patch.PatchSet;
import java.util.List;

/**
 * Result of the lazy diff-file resolution, addressed to the patch it was computed for. The reconciler drops it unless
 * {@code key} is still the committed patch (compared by identity).
 */
public record FilesResolved(PatchSet key, GitPatch target, List<GitFileChange> files) {

    public FilesResolved {
        files = List.copyOf(files);
    }
}
