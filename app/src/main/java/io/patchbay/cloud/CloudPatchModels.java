package io.patchbay.cloud;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.patchbay.patch.SecureData;
import java.time.Instant;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/** Wire shapes of the cloud patch API. Every response wraps its payload in {@code {"data": ...}}. */
public final class CloudPatchModels {

    private CloudPatchModels() {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DataEnvelope<T>(@Nullable T data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record CreatedDraft(@Nullable String id) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DraftDto(
            @Nullable String id,
            @Nullable String deepLink,
            @Nullable String title,
            @Nullable String description,
            @Nullable Instant createdAt,
            @Nullable Instant updatedAt,
            @Nullable String createdBy,
            @JsonProperty("isPublic") @Nullable Boolean isPublic,
            @Nullable String organizationId) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChangesetDto(
            @Nullable String id,
            @Nullable String draftId,
            @Nullable String parentChangesetId,
            @Nullable String gitProfileId,
            @Nullable Instant createdAt,
            @Nullable Instant updatedAt,
            @Nullable List<PatchRowDto> patches,
            @Nullable String userId) {}

    /** A patch row. Which fields are filled depends on the endpoint that returned it. */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record PatchRowDto(
            @Nullable String id,
            @Nullable String draftId,
            @Nullable String changesetId,
            @Nullable String baseBranchName,
            @Nullable String baseCommitSha,
            @Nullable String filename,
            @Nullable String gitRepositoryId,
            @Nullable String gitProfileId,
            @Nullable String gitRepositoryName,
            @Nullable String gitBranchName,
            @Nullable SecureData secureUploadData,
            @Nullable SecureData secureDownloadData) {}

    public record CreateChangesetRequest(String gitProfileId, List<ChangesetPatchRequest> patches) {}

    public record ChangesetPatchRequest(String baseCommitSha, String baseBranchName, GitRepoData gitRepoData) {}

    /** Repository origin metadata; serialized as {@code {}} when the first commit is unknown. */
    public record GitRepoData(@Nullable String initialCommitSha) {}

    public record UpdatePatchRequest(
            String baseCommitSha,
            String gitProfileId,
            String gitProvider,
            String gitRepositoryName,
            String gitRepositoryOwner,
            String gitBranchName) {}
}
