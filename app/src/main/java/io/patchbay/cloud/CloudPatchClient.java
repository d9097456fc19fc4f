package io.patchbay.cloud;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.google.common.net.UrlEscapers;
import io.patchbay.cloud.CloudPatchModels.ChangesetDto;
import io.patchbay.cloud.CloudPatchModels.ChangesetPatchRequest;
import io.patchbay.cloud.CloudPatchModels.CreateChangesetRequest;
import io.patchbay.cloud.CloudPatchModels.CreatedDraft;
import io.patchbay.cloud.CloudPatchModels.DataEnvelope;
import io.patchbay.cloud.CloudPatchModels.DraftDto;
import io.patchbay.cloud.CloudPatchModels.GitRepoData;
import io.patchbay.cloud.CloudPatchModels.PatchRowDto;
import io.patchbay.cloud.CloudPatchModels.UpdatePatchRequest;
import io.patchbay.git.GitRemoteProvider;
import io.patchbay.git.GitRepoException;
import io.patchbay.git.GitUser;
import io.patchbay.git.PatchRepository;
import io.patchbay.patch.Changeset;
import io.patchbay.patch.CloudPatch;
import io.patchbay.patch.PatchData;
import io.patchbay.patch.PatchDataResult;
import io.patchbay.patch.RemotePatch;
import io.patchbay.patch.SecureData;
import io.patchbay.util.Json;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Publishes local diffs as cloud patches and reads them back.
 *
 * <p>Stateless: construct one per {@link ServerConnection} and pass it to whoever needs it. Every operation runs on
 * the supplied executor and makes each remote call exactly once. Multi-step operations are not transactional; see
 * {@link PartialPublishException}.
 */
public class CloudPatchClient {
    private static final Logger logger = LogManager.getLogger(CloudPatchClient.class);

    /** Placeholder some callers report instead of a real first commit. */
    static final String NONEXISTENT_COMMIT_SHA = "0000000000000000000000000000000000000000";

    private final ServerConnection connection;
    private final Executor executor;

    public CloudPatchClient(ServerConnection connection, Executor executor) {
        this.connection = connection;
        this.executor = executor;
    }

    /**
     * Publishes {@code contents} as a new draft with one changeset holding one patch based on {@code baseCommit}.
     *
     * <p>Fails with {@link CloudPatchException.ErrorType#MISSING_PROVIDER} when no remote maps to a known provider, and
     * with {@link PartialPublishException} when anything after the draft creation fails.
     */
    public CompletableFuture<CloudPatch> create(PatchRepository repository, String baseCommit, String contents) {
        var remoteFuture = resolveSettled("remote provider", repository::getBestRemoteWithProvider);
        var userFuture = resolveSettled("current user", repository::getCurrentUser);
        var branchFuture = resolveSettled("current branch", () -> Optional.of(repository.getCurrentBranch()));

        return CompletableFuture.allOf(remoteFuture, userFuture, branchFuture)
                .thenApplyAsync(
                        ignored -> {
                            try {
                                return publish(
                                        repository,
                                        baseCommit,
                                        contents,
                                        remoteFuture.join(),
                                        userFuture.join(),
                                        branchFuture.join());
                            } catch (CloudPatchException e) {
                                throw new CompletionException(e);
                            }
                        },
                        executor);
    }

    /** Fetches a draft and its changesets; empty when the draft does not exist. */
    public CompletableFuture<Optional<CloudPatch>> get(String draftId) {
        return async(() -> fetchDraft(draftId));
    }

    /** Fetches the changesets of a draft; empty when the server has none for it. */
    public CompletableFuture<Optional<List<Changeset>>> getChangesets(String draftId) {
        return async(() -> fetchChangesets(draftId));
    }

    /**
     * Lists the patches of a draft. With {@code includeContents} every patch is downloaded concurrently and a failed
     * download only marks its own result as failed.
     */
    public CompletableFuture<List<PatchDataResult>> getPatches(String draftId, boolean includeContents) {
        return async(() -> listPatchRows(draftId)).thenCompose(rows -> {
            var futures = rows.stream()
                    .map(row -> toPatchDataResult(row, includeContents))
                    .toList();
            return CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0]))
                    .thenApply(ignored ->
                            futures.stream().map(CompletableFuture::join).toList());
        });
    }

    public CompletableFuture<PatchData> getPatch(String patchId) {
        return async(() -> {
            var row = fetchPatchRow(patchId);
            return toPatchData(row, patchId, download(requireDownloadData(row, patchId)));
        });
    }

    public CompletableFuture<String> getPatchContents(String patchId) {
        return async(() -> download(requireDownloadData(fetchPatchRow(patchId), patchId)));
    }

    // ---- publish ----

    private CloudPatch publish(
            PatchRepository repository,
            String baseCommit,
            String contents,
            Optional<GitRemoteProvider> remote,
            Optional<GitUser> user,
            Optional<String> branch)
            throws CloudPatchException {
        var provider = remote.orElseThrow(() -> new CloudPatchException(
                CloudPatchException.ErrorType.MISSING_PROVIDER, "No Git provider found for " + repository.root()));
        var gitProfileId = user.map(GitUser::profileId).orElse("");
        var branchName = branch.orElse("");

        var draftId = createDraft();
        var draft = fetchDraft(draftId)
                .orElseThrow(() -> new CloudPatchException(
                        CloudPatchException.ErrorType.INVALID_RESPONSE,
                        "Draft " + draftId + " was created but could not be read back"));

        String changesetId = null;
        String patchId = null;
        try {
            var changesetDto = createChangeset(
                    draftId, gitProfileId, baseCommit, branchName, initialCommitSha(repository));
            changesetId = requireField(changesetDto.id(), "changeset id");
            var rows = changesetDto.patches();
            if (rows == null || rows.isEmpty()) {
                throw new CloudPatchException(
                        CloudPatchException.ErrorType.INVALID_RESPONSE, "Changeset " + changesetId + " has no patches");
            }
            var row = rows.get(0);
            patchId = requireField(row.id(), "patch id");
            var uploadData = row.secureUploadData();
            if (uploadData == null) {
                throw new CloudPatchException(
                        CloudPatchException.ErrorType.INVALID_RESPONSE,
                        "Patch " + patchId + " has no upload location");
            }

            upload(requireEndpoint(uploadData, "Patch " + patchId + " upload location"), contents);
            updatePatch(
                    patchId,
                    new UpdatePatchRequest(
                            baseCommit,
                            gitProfileId,
                            provider.id(),
                            provider.repositoryName(),
                            provider.owner(),
                            branchName));

            var created = toRemotePatch(row, changesetId, baseCommit, branchName);
            created.setBaseRef(baseCommit);
            created.setRepo(repository);
            var finalized = created.finalized(contents);
            var changeset = toChangeset(changesetDto, draftId, List.of(finalized));
            logger.info("Published patch {} in changeset {} of draft {}", patchId, changesetId, draftId);
            return draft.withChangesets(List.of(changeset));
        } catch (CloudPatchException e) {
            logger.warn("Publish of draft {} failed after creation: {}", draftId, e.getMessage());
            throw new PartialPublishException(draftId, changesetId, patchId, e);
        }
    }

    private String createDraft() throws CloudPatchException {
        var request = ApiRequest.of("POST", apiUri("v1/drafts"));
        var response = send(request, true);
        requireSuccess(request, response);
        CreatedDraft created = readData(response, envelopeOf(CreatedDraft.class), "draft creation response");
        var id = requireField(created == null ? null : created.id(), "draft id");
        logger.debug("Created draft {}", id);
        return id;
    }

    private ChangesetDto createChangeset(
            String draftId,
            String gitProfileId,
            String baseCommit,
            String branchName,
            @Nullable String initialCommitSha)
            throws CloudPatchException {
        var body = new CreateChangesetRequest(
                gitProfileId,
                List.of(new ChangesetPatchRequest(baseCommit, branchName, new GitRepoData(initialCommitSha))));
        var request = ApiRequest.of("POST", apiUri("v1/drafts/" + segment(draftId) + "/changesets"))
                .withJsonBody(Json.toJson(body));
        var response = send(request, true);
        requireSuccess(request, response);
        ChangesetDto dto = readData(response, envelopeOf(ChangesetDto.class), "changeset creation response");
        if (dto == null) {
            throw new CloudPatchException(
                    CloudPatchException.ErrorType.INVALID_RESPONSE, "Empty changeset creation response");
        }
        return dto;
    }

    private void upload(ApiRequest target, String contents) throws CloudPatchException {
        var request = target.withBody(contents, ApiRequest.TEXT);
        var response = send(request, false);
        requireSuccess(request, response);
        logger.debug("Uploaded {} chars to pre-signed location", contents.length());
    }

    private void updatePatch(String patchId, UpdatePatchRequest body) throws CloudPatchException {
        var request = ApiRequest.of("PATCH", apiUri("v1/patches/" + segment(patchId)))
                .withJsonBody(Json.toJson(body));
        requireSuccess(request, send(request, true));
    }

    private @Nullable String initialCommitSha(PatchRepository repository) {
        try {
            var sha = repository.getUniqueRepositoryId().orElse(null);
            if (sha == null || sha.isBlank() || "-".equals(sha) || NONEXISTENT_COMMIT_SHA.equals(sha)) {
                return null;
            }
            return sha;
        } catch (GitRepoException e) {
            logger.warn("Unable to determine the first commit of {}: {}", repository.root(), e.getMessage());
            return null;
        }
    }

    // ---- reads ----

    private Optional<CloudPatch> fetchDraft(String draftId) throws CloudPatchException {
        var request = ApiRequest.get(apiUri("v1/drafts/" + segment(draftId)));
        var response = send(request, true);
        if (response.code() == 404) {
            logger.debug("Draft {} not found", draftId);
            return Optional.empty();
        }
        requireSuccess(request, response);
        DraftDto dto = readData(response, envelopeOf(DraftDto.class), "draft " + draftId);
        if (dto == null) {
            throw new CloudPatchException(CloudPatchException.ErrorType.INVALID_RESPONSE, "Draft " + draftId + " has no data");
        }
        var changesets = fetchChangesets(draftId).orElse(List.of());
        return Optional.of(new CloudPatch(
                requireField(dto.id(), "draft id"),
                dto.deepLink(),
                dto.title(),
                dto.description(),
                requireField(dto.createdAt(), "draft createdAt"),
                requireField(dto.updatedAt(), "draft updatedAt"),
                Objects.requireNonNullElse(dto.createdBy(), ""),
                Boolean.TRUE.equals(dto.isPublic()),
                dto.organizationId(),
                changesets));
    }

    private Optional<List<Changeset>> fetchChangesets(String draftId) throws CloudPatchException {
        var request = ApiRequest.get(apiUri("v1/drafts/" + segment(draftId) + "/changesets"));
        var response = send(request, true);
        if (response.code() == 404) {
            logger.debug("No changesets for draft {}", draftId);
            return Optional.empty();
        }
        requireSuccess(request, response);
        List<ChangesetDto> dtos = readData(response, envelopeOfList(ChangesetDto.class), "changesets of " + draftId);
        if (dtos == null) {
            return Optional.empty();
        }
        var changesets = new ArrayList<Changeset>(dtos.size());
        for (var dto : dtos) {
            var changesetId = requireField(dto.id(), "changeset id");
            var patches = new ArrayList<RemotePatch>();
            for (var row : Objects.requireNonNullElse(dto.patches(), List.<PatchRowDto>of())) {
                patches.add(toRemotePatch(row, changesetId, "", ""));
            }
            changesets.add(toChangeset(dto, draftId, patches));
        }
        return Optional.of(changesets);
    }

    private List<PatchRowDto> listPatchRows(String draftId) throws CloudPatchException {
        var request = ApiRequest.get(apiUri("v1/drafts/" + segment(draftId) + "/patches"));
        var response = send(request, true);
        requireSuccess(request, response);
        List<PatchRowDto> rows = readData(response, envelopeOfList(PatchRowDto.class), "patches of " + draftId);
        return rows == null ? List.of() : rows;
    }

    private PatchRowDto fetchPatchRow(String patchId) throws CloudPatchException {
        var request = ApiRequest.get(apiUri("v1/patches/" + segment(patchId)));
        var response = send(request, true);
        requireSuccess(request, response);
        PatchRowDto row = readData(response, envelopeOf(PatchRowDto.class), "patch " + patchId);
        if (row == null) {
            throw new CloudPatchException(CloudPatchException.ErrorType.INVALID_RESPONSE, "Patch " + patchId + " has no data");
        }
        return row;
    }

    private CompletableFuture<PatchDataResult> toPatchDataResult(PatchRowDto row, boolean includeContents) {
        var id = Objects.requireNonNullElse(row.id(), "");
        if (!includeContents) {
            return CompletableFuture.completedFuture(PatchDataResult.success(toPatchData(row, id, "")));
        }
        return async(() -> toPatchData(row, id, download(requireDownloadData(row, id))))
                .handle((data, ex) -> {
                    if (ex == null) {
                        return PatchDataResult.success(data);
                    }
                    var cause = unwrap(ex);
                    logger.warn("Download of patch {} failed: {}", id, cause.getMessage());
                    return PatchDataResult.failure(id, Objects.requireNonNullElse(cause.getMessage(), cause.toString()));
                });
    }

    private String download(ApiRequest source) throws CloudPatchException {
        var request = source.withHeader("Accept", "text/plain");
        var response = send(request, false);
        requireSuccess(request, response);
        return response.body();
    }

    private static ApiRequest requireDownloadData(PatchRowDto row, String patchId) throws CloudPatchException {
        var data = row.secureDownloadData();
        if (data == null) {
            throw new CloudPatchException(
                    CloudPatchException.ErrorType.INVALID_RESPONSE, "Patch " + patchId + " has no download location");
        }
        return requireEndpoint(data, "Patch " + patchId + " download location");
    }

    /** Turns a pre-signed endpoint into a request; a missing method or a missing or non-absolute URL is rejected. */
    private static ApiRequest requireEndpoint(SecureData target, String what) throws CloudPatchException {
        @Nullable String url = target.url();
        @Nullable String method = target.method();
        if (url == null || url.isBlank() || method == null || method.isBlank()) {
            throw new CloudPatchException(
                    CloudPatchException.ErrorType.INVALID_RESPONSE, what + " is missing its url or method");
        }
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new CloudPatchException(
                    CloudPatchException.ErrorType.INVALID_RESPONSE, what + " has a malformed url: " + url, e);
        }
        if (!uri.isAbsolute() || uri.getHost() == null) {
            throw new CloudPatchException(
                    CloudPatchException.ErrorType.INVALID_RESPONSE, what + " is not an absolute url: " + url);
        }
        return withHost(ApiRequest.of(method.trim(), uri), target);
    }

    // ---- mapping ----

    private static RemotePatch toRemotePatch(
            PatchRowDto row, String changesetId, String fallbackBaseSha, String fallbackBranch)
            throws CloudPatchException {
        try {
            return new RemotePatch(
                    requireField(row.id(), "patch id"),
                    Objects.requireNonNullElse(row.baseBranchName(), fallbackBranch),
                    Objects.requireNonNullElse(row.baseCommitSha(), fallbackBaseSha),
                    Objects.requireNonNullElse(row.changesetId(), changesetId),
                    Objects.requireNonNullElse(row.filename(), ""),
                    row.gitRepositoryId(),
                    row.secureUploadData(),
                    row.secureDownloadData());
        } catch (IllegalArgumentException e) {
            throw new CloudPatchException(CloudPatchException.ErrorType.INVALID_RESPONSE, e.getMessage(), e);
        }
    }

    private static Changeset toChangeset(ChangesetDto dto, String draftId, List<RemotePatch> patches)
            throws CloudPatchException {
        return new Changeset(
                requireField(dto.id(), "changeset id"),
                Objects.requireNonNullElse(dto.draftId(), draftId),
                dto.parentChangesetId(),
                Objects.requireNonNullElse(dto.gitProfileId(), ""),
                requireField(dto.createdAt(), "changeset createdAt"),
                requireField(dto.updatedAt(), "changeset updatedAt"),
                patches,
                dto.userId());
    }

    private static PatchData toPatchData(PatchRowDto row, String patchId, String contents) {
        return new PatchData(
                Objects.requireNonNullElse(row.id(), patchId),
                Objects.requireNonNullElse(row.draftId(), ""),
                Objects.requireNonNullElse(row.gitProfileId(), ""),
                Objects.requireNonNullElse(row.gitRepositoryName(), ""),
                Objects.requireNonNullElse(row.gitBranchName(), ""),
                contents);
    }

    // ---- plumbing ----

    private URI apiUri(String path) {
        return connection.baseApiUri().resolve(path);
    }

    private static String segment(String id) {
        return UrlEscapers.urlPathSegmentEscaper().escape(id);
    }

    private static ApiRequest withHost(ApiRequest request, SecureData target) {
        var host = target.host();
        return host.isEmpty() ? request : request.withHeader("Host", host);
    }

    private ApiResponse send(ApiRequest request, boolean authenticated) throws CloudPatchException {
        try {
            return authenticated ? connection.fetch(request) : connection.fetchUnauthenticated(request);
        } catch (IOException e) {
            throw new CloudPatchException(
                    CloudPatchException.ErrorType.NETWORK_ERROR,
                    "Network error during " + request + ": " + e.getMessage(),
                    e);
        }
    }

    private static void requireSuccess(ApiRequest request, ApiResponse response) throws CloudPatchException {
        if (!response.isSuccessful()) {
            throw CloudPatchException.http(
                    response.code(), request.method() + " " + request.uri().getPath() + " failed with status " + response.code());
        }
    }

    private static <T> @Nullable T readData(ApiResponse response, JavaType envelopeType, String what)
            throws CloudPatchException {
        try {
            DataEnvelope<T> envelope = Json.fromJson(response.body(), envelopeType);
            return envelope == null ? null : envelope.data();
        } catch (JsonProcessingException e) {
            throw new CloudPatchException(
                    CloudPatchException.ErrorType.INVALID_RESPONSE,
                    "Failed to parse " + what + ": " + e.getOriginalMessage(),
                    e);
        }
    }

    private static JavaType envelopeOf(Class<?> payload) {
        var types = Json.getMapper().getTypeFactory();
        return types.constructParametricType(DataEnvelope.class, payload);
    }

    private static JavaType envelopeOfList(Class<?> element) {
        var types = Json.getMapper().getTypeFactory();
        return types.constructParametricType(DataEnvelope.class, types.constructCollectionType(List.class, element));
    }

    private static <T> T requireField(@Nullable T value, String name) throws CloudPatchException {
        if (value == null) {
            throw new CloudPatchException(CloudPatchException.ErrorType.INVALID_RESPONSE, "Response is missing " + name);
        }
        return value;
    }

    private <T> CompletableFuture<Optional<T>> resolveSettled(String what, Callable<Optional<T>> resolver) {
        return CompletableFuture.supplyAsync(
                () -> {
                    try {
                        return resolver.call();
                    } catch (Exception e) {
                        logger.warn("Unable to resolve {}: {}", what, e.getMessage());
                        return Optional.<T>empty();
                    }
                },
                executor);
    }

    private <T> CompletableFuture<T> async(CloudCall<T> call) {
        return CompletableFuture.supplyAsync(
                () -> {
                    try {
                        return call.run();
                    } catch (CloudPatchException e) {
                        throw new CompletionException(e);
                    }
                },
                executor);
    }

    /** Strips the {@link CompletionException} / {@link ExecutionException} wrapping of an async failure. */
    public static Throwable unwrap(Throwable t) {
        var current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @FunctionalInterface
    private interface CloudCall<T> {
        T run() throws CloudPatchException;
    }
}
