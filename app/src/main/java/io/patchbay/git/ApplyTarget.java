package io.patchbay.git;

/** Where a previewed patch commit gets applied. */
public enum ApplyTarget {
    /** Cherry-pick onto the current branch. */
    HEAD,
    /** Create a new branch at the patch commit and check it out. */
    BRANCH,
    /** Apply the diff to the working tree without committing. */
    WORKTREE
}
