package io.patchbay.git;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.jetbrains.annotations.Blocking;

/** The source-control operations the patch engine needs from a repository. All methods may block. */
public interface PatchRepository {

    Path root();

    /** The remote whose host maps to a known provider, preferring {@code origin}, then {@code upstream}. */
    @Blocking
    Optional<GitRemoteProvider> getBestRemoteWithProvider() throws GitRepoException;

    @Blocking
    Optional<GitUser> getCurrentUser() throws GitRepoException;

    /** The checked-out branch name; empty when it cannot be determined. */
    @Blocking
    String getCurrentBranch() throws GitRepoException;

    /** The sha of the root commit reachable from HEAD, identifying the repository across clones. */
    @Blocking
    Optional<String> getUniqueRepositoryId() throws GitRepoException;

    @Blocking
    List<CommitInfo> getLog(int maxCount) throws GitRepoException;

    /**
     * Applies {@code contents} on top of {@code baseRef} and writes the result as a commit that no ref points to.
     * The working tree and index are left untouched.
     */
    @Blocking
    CommitInfo createUnreachableCommitForPatch(String contents, String baseRef, String message)
            throws GitRepoException;

    /**
     * Applies a materialized patch commit to the repository.
     *
     * @return a short description of what was done, e.g. the branch that was created
     */
    @Blocking
    String applyPatch(CommitInfo commit, String contents, ApplyTarget target) throws GitRepoException;
}
