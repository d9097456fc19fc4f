package io.patchbay.details;

import static org.junit.jupiter.api.Assertions.*;

import io.patchbay.cloud.CloudPatchClient;
import io.patchbay.config.PatchbaySettings;
import io.patchbay.git.ApplyTarget;
import io.patchbay.git.GitRepoException;
import io.patchbay.patch.LocalPatch;
import io.patchbay.patch.RemotePatch;
import io.patchbay.testutil.FakeCloudServer;
import io.patchbay.testutil.FakeRepository;
import io.patchbay.testutil.RecordingHost;
import io.patchbay.testutil.TestRepos;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PatchDetailsControllerTest {

    @TempDir
    Path configDir;

    private ScheduledExecutorService scheduler;
    private PatchbaySettings settings;
    private FakeCloudServer server;
    private RecordingHost host;
    private FakeRepository repo;
    private PatchExplainer explainer;
    private PatchDetailsController controller;
    private LocalPatch patch;

    @BeforeEach
    void setUp() throws Exception {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        settings = new PatchbaySettings(configDir.resolve(PatchbaySettings.SETTINGS_FILE_NAME));
        // debounced flushes never fire during a test; immediate ones are asserted on
        settings.set(PatchbaySettings.DEBOUNCE_MILLIS, "60000");
        server = new FakeCloudServer();
        host = new RecordingHost();
        repo = new FakeRepository(Path.of("/work/widgets"));
        repo.log = List.of(FakeRepository.commit("base1", "Base commit", repo.root()));
        explainer = (commit, contents) -> CompletableFuture.completedFuture("Changes line2 of hello.txt");
        controller = newController();
        patch = new LocalPatch(URI.create("file:///tmp/hello.diff"), TestRepos.HELLO_DIFF);
    }

    private PatchDetailsController newController() {
        return new PatchDetailsController(
                "view-1",
                host,
                settings,
                new CloudPatchClient(server, Runnable::run),
                (commit, contents) -> explainer.explain(commit, contents),
                new DetailsProjector(Runnable::run),
                scheduler,
                Runnable::run);
    }

    @AfterEach
    void tearDown() {
        controller.close();
        scheduler.shutdownNow();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    // ---- missing-context guard ----

    @Test
    void cancelledRepositoryPickDefers() throws Exception {
        controller.showPatch(patch, false, true);

        var commit = await(controller.getUnreachablePatchCommit());

        assertTrue(commit.isEmpty());
        assertEquals(1, host.repositoryPicks.get());
        assertEquals(0, host.commitPicks.get());
        assertNull(patch.repo());
        assertTrue(host.errors.isEmpty());
    }

    @Test
    void cancelledBasePickDefers() throws Exception {
        patch.setRepo(repo);
        controller.showPatch(patch, false, true);

        var commit = await(controller.getUnreachablePatchCommit());

        assertTrue(commit.isEmpty());
        assertEquals(0, host.repositoryPicks.get());
        assertEquals(1, host.commitPicks.get());
        assertNull(patch.baseRef());
        assertEquals(0, repo.materializeCalls.get());
    }

    @Test
    void failedMaterializationClearsTheBase() throws Exception {
        patch.setRepo(repo);
        patch.setBaseRef("base1");
        repo.materializeFailure = new GitRepoException("hunk 1 does not apply");
        controller.showPatch(patch, false, true);

        var commit = await(controller.getUnreachablePatchCommit());

        assertTrue(commit.isEmpty());
        assertEquals(List.of("Unable to preview the patch on base 'base1': hunk 1 does not apply"), host.errors);
        assertNull(patch.baseRef());
        assertNull(patch.resolvedCommit());
    }

    @Test
    void missingContextIsAskedForInOrderThenCached() throws Exception {
        host.repositoryAnswer = Optional.of(repo);
        host.commitAnswer = commits -> Optional.of(commits.get(0));
        controller.showPatch(patch, false, true);

        var commit = await(controller.getUnreachablePatchCommit()).orElseThrow();

        assertSame(repo, patch.repo());
        assertEquals("base1", patch.baseRef());
        assertSame(commit, patch.resolvedCommit());
        assertEquals("base1", commit.parentSha());
        assertEquals(PatchDetailsController.PATCH_COMMIT_MESSAGE, commit.message());

        assertSame(commit, await(controller.getUnreachablePatchCommit()).orElseThrow());
        assertEquals(1, repo.materializeCalls.get());
        assertEquals(1, host.repositoryPicks.get());
        assertEquals(1, host.commitPicks.get());
    }

    @Test
    void nothingSelectedMeansNoCommit() throws Exception {
        assertTrue(await(controller.getUnreachablePatchCommit()).isEmpty());
        assertEquals(0, host.repositoryPicks.get());
    }

    @Test
    void cloudPatchContentsAreDownloadedBeforeMaterializing() throws Exception {
        var draftId = server.addDraft();
        server.addStoredPatch(draftId, TestRepos.HELLO_DIFF);
        var opened = await(controller.open(draftId)).orElseThrow();
        RemotePatch target = opened.target();
        target.setRepo(repo);
        target.setBaseRef("base1");

        var commit = await(controller.getUnreachablePatchCommit()).orElseThrow();

        assertEquals(TestRepos.HELLO_DIFF, target.contents());
        assertEquals("hello.txt", commit.files().get(0).path());
    }

    // ---- commands ----

    private void selectMaterializablePatch() {
        patch.setRepo(repo);
        patch.setBaseRef("base1");
        controller.showPatch(patch, false, true);
    }

    @Test
    void applyPatchDelegatesToTheRepository() throws Exception {
        selectMaterializablePatch();

        await(controller.handle(new PatchCommand.ApplyPatch(ApplyTarget.BRANCH)));

        assertEquals(List.of(ApplyTarget.BRANCH), repo.applied());
        assertEquals(List.of("Applied feedfac to BRANCH"), host.infos);
    }

    @Test
    void fileActionsResolveTheFileInThePatchCommit() throws Exception {
        selectMaterializablePatch();

        await(controller.handle(new PatchCommand.FileAction(FileActionKind.COMPARE_PREVIOUS, "hello.txt", null)));
        await(controller.handle(new PatchCommand.FileAction(FileActionKind.OPEN, "nope.txt", null)));

        assertEquals(1, host.fileActions.size());
        var call = host.fileActions.get(0);
        assertEquals(FileActionKind.COMPARE_PREVIOUS, call.kind());
        assertEquals("hello.txt", call.file().path());
        assertEquals(List.of("'nope.txt' is not part of this patch"), host.errors);
    }

    @Test
    void explainSendsTheSummary() throws Exception {
        selectMaterializablePatch();

        await(controller.handle(new PatchCommand.Explain("c1")));

        assertEquals(List.of(ExplainResult.success("c1", "Changes line2 of hello.txt")), host.explanations);
    }

    @Test
    void explainFailureIsSentAsAnError() throws Exception {
        explainer = (commit, contents) -> CompletableFuture.failedFuture(new IllegalStateException("model unavailable"));
        selectMaterializablePatch();

        await(controller.handle(new PatchCommand.Explain("c2")));

        assertEquals(1, host.explanations.size());
        var result = host.explanations.get(0);
        assertTrue(result.isError());
        assertEquals("c2", result.completionId());
        assertEquals("model unavailable", result.error().message());
    }

    @Test
    void selectingAnotherRepositoryResetsTheBase() throws Exception {
        selectMaterializablePatch();
        var other = new FakeRepository(Path.of("/work/other"));
        host.openAnswer = path -> Optional.of(other);

        await(controller.handle(new PatchCommand.SelectRepo("/work/other")));

        assertEquals(List.of(Path.of("/work/other")), host.openedPaths);
        assertSame(other, patch.repo());
        assertNull(patch.baseRef());
        assertNull(patch.resolvedCommit());
        assertEquals(0, host.repositoryPicks.get());
    }

    @Test
    void selectBaseWithoutRepositoryAsksForTheRepository() throws Exception {
        controller.showPatch(patch, false, true);

        await(controller.handle(new PatchCommand.SelectBase()));

        assertEquals(1, host.repositoryPicks.get());
        assertEquals(0, host.commitPicks.get());
    }

    @Test
    void selectBaseStoresThePickedCommit() throws Exception {
        patch.setRepo(repo);
        controller.showPatch(patch, false, true);
        host.commitAnswer = commits -> Optional.of(commits.get(0));

        await(controller.handle(new PatchCommand.SelectBase()));

        assertEquals("base1", patch.baseRef());
        assertTrue(controller.reconciler().hasPending());
    }

    // ---- preferences and visibility ----

    @Test
    void changedFilePreferencesArePersistedAndStaged() {
        var files = new FilesPreferences("tree", false, "status", PatchbaySettings.DEFAULT_FILES_THRESHOLD);

        controller.handle(new PatchCommand.UpdatePreferences(files));

        assertEquals("tree", settings.getFilesLayout());
        assertFalse(settings.isFilesCompact());
        assertEquals("status", settings.getFilesIcon());
        var pending = controller.reconciler().pending();
        assertNotNull(pending);
        assertEquals(files, pending.preferences().files());
    }

    @Test
    void unchangedFilePreferencesAreNotWritten() {
        var notified = new ArrayList<Set<String>>();
        settings.addListener(notified::add);
        var committed = controller.reconciler().context().preferences().files();

        controller.updatePreferences(committed);

        assertTrue(notified.isEmpty());
        assertFalse(controller.reconciler().hasPending());
    }

    @Test
    void settingsChangesStageNewPreferences() throws Exception {
        settings.set(PatchbaySettings.AUTOLINKS_ENABLED, "false");

        var pending = controller.reconciler().pending();
        assertNotNull(pending);
        assertFalse(pending.preferences().autolinksEnabled());
    }

    @Test
    void firstRevealAfterBootstrapDoesNotResend() {
        var initial = controller.bootstrap();
        assertNull(initial.patch());

        controller.onVisibilityChanged(true);

        assertEquals(0, controller.reconciler().generation());
        assertTrue(host.states.isEmpty());
    }

    @Test
    void firstRevealSendsWhatChangedSinceBootstrap() {
        controller.bootstrap();
        patch.setFiles(List.of());
        controller.showPatch(patch, false, false);

        controller.onVisibilityChanged(true);

        assertEquals(1, controller.reconciler().generation());
        assertEquals(1, host.states.size());
        assertNotNull(host.states.get(0).patch());
    }

    @Test
    void laterRevealsResend() {
        controller.bootstrap();
        controller.onVisibilityChanged(true);
        controller.onVisibilityChanged(false);

        controller.onVisibilityChanged(true);

        assertEquals(1, controller.reconciler().generation());
    }

    // ---- cloud ----

    @Test
    void publishShowsTheNewCloudPatch() throws Exception {
        var created = await(controller.publish(repo, "base1", TestRepos.HELLO_DIFF)).orElseThrow();

        assertEquals(List.of("Published patch https://app.test/drafts/draft-1"), host.infos);
        assertSame(created, controller.reconciler().context().patch());
    }

    @Test
    void failedPublishReportsAndKeepsState() throws Exception {
        controller.showPatch(patch, false, true);
        server.failWith("POST /v1/drafts", 500);

        var result = await(controller.publish(repo, "base1", TestRepos.HELLO_DIFF));

        assertTrue(result.isEmpty());
        assertEquals(1, host.errors.size());
        assertTrue(host.errors.get(0).startsWith("Unable to publish the patch: "), host.errors.get(0));
        assertSame(patch, controller.reconciler().context().patch());
    }

    @Test
    void openingAMissingCloudPatchSaysSo() throws Exception {
        assertTrue(await(controller.open("nope")).isEmpty());

        assertEquals(List.of("Cloud patch 'nope' was not found"), host.errors);
    }
}
