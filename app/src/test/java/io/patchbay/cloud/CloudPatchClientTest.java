package io.patchbay.cloud;

import static org.junit.jupiter.api.Assertions.*;

import io.patchbay.patch.RemotePatch;
import io.patchbay.testutil.FakeCloudServer;
import io.patchbay.testutil.FakeRepository;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CloudPatchClientTest {

    private static final String DIFF = "diff --git a/a.txt b/a.txt\n--- a/a.txt\n+++ b/a.txt\n@@ -1 +1 @@\n-a\n+b\n";

    private ExecutorService executor;
    private FakeCloudServer server;
    private FakeRepository repo;
    private CloudPatchClient client;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        server = new FakeCloudServer();
        repo = new FakeRepository(Path.of("/work/widgets"));
        client = new CloudPatchClient(server, executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }

    private static CloudPatchException failure(CompletableFuture<?> future) {
        var e = assertThrows(ExecutionException.class, () -> future.get(10, TimeUnit.SECONDS));
        var cause = CloudPatchClient.unwrap(e);
        return assertInstanceOf(CloudPatchException.class, cause);
    }

    @Test
    void createRunsTheProtocolInOrder() throws Exception {
        var created = await(client.create(repo, "base-sha", DIFF));

        assertEquals(
                List.of(
                        "POST /v1/drafts",
                        "GET /v1/drafts/draft-1",
                        "GET /v1/drafts/draft-1/changesets",
                        "POST /v1/drafts/draft-1/changesets",
                        "PUT /upload/patch-3",
                        "PATCH /v1/patches/patch-3"),
                server.requestLines());

        assertEquals("draft-1", created.id());
        assertEquals("https://app.test/drafts/draft-1", created.linkUrl());
        assertEquals(1, created.changesets().size());
        RemotePatch target = created.target();
        assertEquals("patch-3", target.id());
        assertEquals("cs-2", target.changesetId());
        assertEquals(DIFF, target.contents());
        assertEquals("base-sha", target.baseRef());
        assertSame(repo, target.repo());
        assertTrue(target.isUploaded());
    }

    @Test
    void createSendsRepositoryMetadata() throws Exception {
        await(client.create(repo, "base-sha", DIFF));

        var changesetRequest = server.lastChangesetRequest();
        assertNotNull(changesetRequest);
        assertEquals("test@example.com", changesetRequest.gitProfileId());
        assertEquals("base-sha", changesetRequest.patches().get(0).baseCommitSha());
        assertEquals("main", changesetRequest.patches().get(0).baseBranchName());
        assertEquals("root-sha", changesetRequest.patches().get(0).gitRepoData().initialCommitSha());

        var update = server.lastUpdate();
        assertNotNull(update);
        assertEquals("github", update.gitProvider());
        assertEquals("widgets", update.gitRepositoryName());
        assertEquals("acme", update.gitRepositoryOwner());
        assertEquals("main", update.gitBranchName());
    }

    @Test
    void uploadGoesUnauthenticatedToThePresignedLocation() throws Exception {
        await(client.create(repo, "base-sha", DIFF));

        var upload = server.exchanges().stream()
                .filter(x -> x.request().method().equals("PUT"))
                .findFirst()
                .orElseThrow();
        assertFalse(upload.authenticated());
        assertEquals(FakeCloudServer.BLOB_HOST, upload.request().headers().get("Host"));
        assertEquals(ApiRequest.TEXT, upload.request().contentType());
        assertTrue(server.exchanges().stream()
                .filter(x -> x.request().uri().getHost().equals("api.test"))
                .allMatch(FakeCloudServer.Exchange::authenticated));
    }

    @Test
    void uploadedContentsRoundTrip() throws Exception {
        var created = await(client.create(repo, "base-sha", DIFF));
        var patchId = created.target().id();

        assertEquals(DIFF, server.blob(patchId));
        assertEquals(DIFF, await(client.getPatchContents(patchId)));

        var data = await(client.getPatch(patchId));
        assertEquals(DIFF, data.contents());
        assertEquals("widgets", data.gitRepositoryName());
        assertEquals("draft-1", data.draftId());
    }

    @Test
    void placeholderFirstCommitIsNotSent() throws Exception {
        repo.uniqueId = CloudPatchClient.NONEXISTENT_COMMIT_SHA;

        await(client.create(repo, "base-sha", DIFF));

        var changesetRequest = server.lastChangesetRequest();
        assertNotNull(changesetRequest);
        assertNull(changesetRequest.patches().get(0).gitRepoData().initialCommitSha());
    }

    @Test
    void createWithoutProviderFailsBeforeAnyRequest() {
        repo.provider = null;

        var e = failure(client.create(repo, "base-sha", DIFF));

        assertEquals(CloudPatchException.ErrorType.MISSING_PROVIDER, e.getErrorType());
        assertTrue(server.exchanges().isEmpty());
    }

    @Test
    void failedUploadReportsWhatWasCreated() {
        server.failWith("PUT /upload/", 503);

        var e = failure(client.create(repo, "base-sha", DIFF));

        var partial = assertInstanceOf(PartialPublishException.class, e);
        assertEquals("draft-1", partial.getDraftId());
        assertEquals("cs-2", partial.getChangesetId());
        assertEquals("patch-3", partial.getPatchId());
        assertEquals(CloudPatchException.ErrorType.HTTP_ERROR, partial.getErrorType());
        assertEquals(503, partial.getStatusCode());
        assertFalse(server.requestLines().contains("PATCH /v1/patches/patch-3"));
    }

    @Test
    void failedChangesetCreationHasNoChangesetId() {
        server.disconnectOn("POST /v1/drafts/draft-1/changesets");

        var e = failure(client.create(repo, "base-sha", DIFF));

        var partial = assertInstanceOf(PartialPublishException.class, e);
        assertEquals("draft-1", partial.getDraftId());
        assertNull(partial.getChangesetId());
        assertNull(partial.getPatchId());
        assertEquals(CloudPatchException.ErrorType.NETWORK_ERROR, partial.getErrorType());
    }

    @Test
    void uploadLocationWithoutUrlIsPartialInvalidResponse() {
        server.respondWith(
                "POST /v1/drafts/draft-1/changesets",
                200,
                """
                {"data":{"id":"cs-9","draftId":"draft-1","gitProfileId":"",
                 "patches":[{"id":"patch-9","secureUploadData":{"method":"PUT","headers":{}}}]}}
                """);

        var e = failure(client.create(repo, "base-sha", DIFF));

        var partial = assertInstanceOf(PartialPublishException.class, e);
        assertEquals("draft-1", partial.getDraftId());
        assertEquals("cs-9", partial.getChangesetId());
        assertEquals("patch-9", partial.getPatchId());
        assertEquals(CloudPatchException.ErrorType.INVALID_RESPONSE, partial.getErrorType());
        assertTrue(server.requestLines().stream().noneMatch(line -> line.startsWith("PUT ")));
    }

    @Test
    void uploadLocationWithMalformedUrlIsPartialInvalidResponse() {
        server.respondWith(
                "POST /v1/drafts/draft-1/changesets",
                200,
                """
                {"data":{"id":"cs-9","draftId":"draft-1","gitProfileId":"",
                 "patches":[{"id":"patch-9","secureUploadData":{"url":"not a url","method":"PUT"}}]}}
                """);

        var e = failure(client.create(repo, "base-sha", DIFF));

        var partial = assertInstanceOf(PartialPublishException.class, e);
        assertEquals("patch-9", partial.getPatchId());
        assertEquals(CloudPatchException.ErrorType.INVALID_RESPONSE, partial.getErrorType());
    }

    @Test
    void downloadLocationWithoutMethodIsInvalidResponse() {
        server.respondWith(
                "GET /v1/patches/p1",
                200,
                """
                {"data":{"id":"p1","secureDownloadData":{"url":"https://blob.test/download/p1"}}}
                """);

        var e = failure(client.getPatchContents("p1"));

        assertEquals(CloudPatchException.ErrorType.INVALID_RESPONSE, e.getErrorType());
    }

    @Test
    void relativeDownloadLocationIsInvalidResponse() {
        server.respondWith(
                "GET /v1/patches/p1",
                200,
                """
                {"data":{"id":"p1","secureDownloadData":{"url":"/download/p1","method":"GET"}}}
                """);

        var e = failure(client.getPatch("p1"));

        assertEquals(CloudPatchException.ErrorType.INVALID_RESPONSE, e.getErrorType());
        assertEquals(List.of("GET /v1/patches/p1"), server.requestLines());
    }

    @Test
    void failedDraftCreationIsNotPartial() {
        server.failWith("POST /v1/drafts", 500);

        var e = failure(client.create(repo, "base-sha", DIFF));

        assertFalse(e instanceof PartialPublishException);
        assertEquals(CloudPatchException.ErrorType.HTTP_ERROR, e.getErrorType());
        assertEquals(500, e.getStatusCode());
    }

    @Test
    void getMissingDraftIsEmpty() throws Exception {
        assertTrue(await(client.get("nope")).isEmpty());
    }

    @Test
    void getDegradesMissingChangesetsToEmpty() throws Exception {
        var draftId = server.addDraft();
        server.dropChangesets(draftId);

        var patch = await(client.get(draftId)).orElseThrow();

        assertEquals(draftId, patch.id());
        assertEquals("Fix things", patch.title());
        assertTrue(patch.isPublic());
        assertTrue(patch.changesets().isEmpty());
        assertTrue(await(client.getChangesets(draftId)).isEmpty());
    }

    @Test
    void getReturnsStoredChangesets() throws Exception {
        var draftId = server.addDraft();
        var patchId = server.addStoredPatch(draftId, DIFF);

        var patch = await(client.get(draftId)).orElseThrow();

        assertEquals(patchId, patch.target().id());
        assertNull(patch.target().contents());
        assertNotNull(patch.target().secureDownloadData());
    }

    @Test
    void batchDownloadIsolatesFailures() throws Exception {
        var draftId = server.addDraft();
        var first = server.addStoredPatch(draftId, "first");
        var missing = server.addStoredPatch(draftId, null);
        var third = server.addStoredPatch(draftId, "third");

        var results = await(client.getPatches(draftId, true));

        assertEquals(3, results.size());
        assertEquals(first, results.get(0).id());
        assertEquals("first", results.get(0).data().contents());
        assertEquals(missing, results.get(1).id());
        assertFalse(results.get(1).isSuccess());
        assertNotNull(results.get(1).error());
        assertEquals(third, results.get(2).id());
        assertEquals("third", results.get(2).data().contents());
    }

    @Test
    void batchWithoutContentsDownloadsNothing() throws Exception {
        var draftId = server.addDraft();
        server.addStoredPatch(draftId, "first");

        var results = await(client.getPatches(draftId, false));

        assertEquals(1, results.size());
        assertEquals("", results.get(0).data().contents());
        assertTrue(server.exchanges().stream().noneMatch(x -> !x.authenticated()));
    }

    @Test
    void malformedBodyIsInvalidResponse() {
        server.respondWith("GET /v1/drafts/d1", 200, "{not json");

        var e = failure(client.get("d1"));

        assertEquals(CloudPatchException.ErrorType.INVALID_RESPONSE, e.getErrorType());
    }

    @Test
    void serverErrorsKeepTheirStatus() {
        server.failWith("GET /v1/patches/p1", 502);

        var e = failure(client.getPatchContents("p1"));

        assertEquals(CloudPatchException.ErrorType.HTTP_ERROR, e.getErrorType());
        assertEquals(502, e.getStatusCode());
    }

    @Test
    void unwrapStripsAsyncWrappers() {
        var root = new IllegalStateException("root");
        var wrapped = new ExecutionException(new CompletionException(root));

        assertSame(root, CloudPatchClient.unwrap(wrapped));
    }
}
