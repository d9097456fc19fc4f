package io.patchbay.cloud;

import org.jetbrains.annotations.Nullable;

/**
 * A publish that failed after the draft was created. The draft (and the changeset and patch rows, when they were
 * created) stay on the server; nothing is rolled back.
 */
public class PartialPublishException extends CloudPatchException {

    private final String draftId;
    private final @Nullable String changesetId;
    private final @Nullable String patchId;

    public PartialPublishException(
            String draftId, @Nullable String changesetId, @Nullable String patchId, CloudPatchException cause) {
        super(
                cause.getErrorType(),
                "Publish failed after creating draft " + draftId + describe(changesetId, patchId) + ": "
                        + cause.getMessage(),
                cause.getStatusCode(),
                cause);
        this.draftId = draftId;
        this.changesetId = changesetId;
        this.patchId = patchId;
    }

    private static String describe(@Nullable String changesetId, @Nullable String patchId) {
        var sb = new StringBuilder();
        if (changesetId != null) {
            sb.append(", changeset ").append(changesetId);
        }
        if (patchId != null) {
            sb.append(", patch ").append(patchId);
        }
        return sb.toString();
    }

    public String getDraftId() {
        return draftId;
    }

    public @Nullable String getChangesetId() {
        return changesetId;
    }

    public @Nullable String getPatchId() {
        return patchId;
    }
}
