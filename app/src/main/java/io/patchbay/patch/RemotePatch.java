package io.patchbay.patch;

import org.jetbrains.annotations.Nullable;

/**
 * One repository's diff stored server-side. Carries upload data while the content is still to be written and
 * download data once it is stored; never both.
 */
public final class RemotePatch extends GitPatch {

    private final String id;
    private final String baseBranchName;
    private final String baseCommitSha;
    private final String changesetId;
    private final String filename;
    private final @Nullable String gitRepositoryId;
    private final @Nullable SecureData secureUploadData;
    private final @Nullable SecureData secureDownloadData;
    private volatile @Nullable String contents;

    public RemotePatch(
            String id,
            String baseBranchName,
            String baseCommitSha,
            String changesetId,
            String filename,
            @Nullable String gitRepositoryId,
            @Nullable SecureData secureUploadData,
            @Nullable SecureData secureDownloadData) {
        if (secureUploadData != null && secureDownloadData != null) {
            throw new IllegalArgumentException("Patch " + id + " cannot carry both upload and download data");
        }
        this.id = id;
        this.baseBranchName = baseBranchName;
        this.baseCommitSha = baseCommitSha;
        this.changesetId = changesetId;
        this.filename = filename;
        this.gitRepositoryId = gitRepositoryId;
        this.secureUploadData = secureUploadData;
        this.secureDownloadData = secureDownloadData;
    }

    public String id() {
        return id;
    }

    public String baseBranchName() {
        return baseBranchName;
    }

    public String baseCommitSha() {
        return baseCommitSha;
    }

    public String changesetId() {
        return changesetId;
    }

    public String filename() {
        return filename;
    }

    public @Nullable String gitRepositoryId() {
        return gitRepositoryId;
    }

    public @Nullable SecureData secureUploadData() {
        return secureUploadData;
    }

    public @Nullable SecureData secureDownloadData() {
        return secureDownloadData;
    }

    public boolean isUploaded() {
        return secureUploadData == null;
    }

    @Override
    public @Nullable String contents() {
        return contents;
    }

    public void setContents(@Nullable String contents) {
        this.contents = contents;
    }

    /** Copy describing the same row after its content was stored: upload data dropped, contents known. */
    public RemotePatch finalized(String uploadedContents) {
        var copy = new RemotePatch(
                id, baseBranchName, baseCommitSha, changesetId, filename, gitRepositoryId, null, secureDownloadData);
        copy.setContents(uploadedContents);
        copy.setBaseRef(baseRef());
        copy.setRepo(repo());
        return copy;
    }

    @Override
    public String toString() {
        return "RemotePatch[" + id + ", changeset=" + changesetId + "]";
    }
}
