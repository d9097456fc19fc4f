package io.patchbay.details;

import io.patchbay.cloud.CloudPatchClient;
import io.patchbay.config.PatchbaySettings;
import io.patchbay.config.SettingsChangeListener;
import io.patchbay.git.ApplyTarget;
import io.patchbay.git.CommitInfo;
import io.patchbay.git.GitRepoException;
import io.patchbay.git.PatchRepository;
import io.patchbay.patch.CloudPatch;
import io.patchbay.patch.GitPatch;
import io.patchbay.patch.PatchSet;
import io.patchbay.patch.RemotePatch;
import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

/**
 * Drives one patch-details view: turns selection, visibility, settings changes and {@link PatchCommand}s into updates
 * of its {@link PatchDetailsReconciler}, and talks to the host for everything interactive.
 *
 * <p>Operations that need a commit go through {@link #getUnreachablePatchCommit()}, which asks for whatever is missing
 * (repository first, then base) before materializing the patch.
 */
public class PatchDetailsController implements SettingsChangeListener, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(PatchDetailsController.class);

    static final String PATCH_COMMIT_MESSAGE = "PATCH";
    static final int BASE_PICKER_LOG_SIZE = 100;

    private static final Set<String> PREFERENCE_KEYS = Set.of(
            PatchbaySettings.AVATARS,
            PatchbaySettings.DATE_FORMAT,
            PatchbaySettings.FILES_LAYOUT,
            PatchbaySettings.FILES_COMPACT,
            PatchbaySettings.FILES_ICON,
            PatchbaySettings.FILES_THRESHOLD,
            PatchbaySettings.INDENT_GUIDES,
            PatchbaySettings.AUTOLINKS_ENABLED);

    private final PatchDetailsHost host;
    private final PatchbaySettings settings;
    private final CloudPatchClient cloud;
    private final PatchExplainer explainer;
    private final Executor executor;
    private final PatchDetailsReconciler reconciler;

    private volatile boolean bootstrapping = true;

    public PatchDetailsController(
            String webviewId,
            PatchDetailsHost host,
            PatchbaySettings settings,
            CloudPatchClient cloud,
            PatchExplainer explainer,
            DetailsProjector projector,
            ScheduledExecutorService scheduler,
            Executor executor) {
        this.host = host;
        this.settings = settings;
        this.cloud = cloud;
        this.explainer = explainer;
        this.executor = executor;
        var initial = new ViewContext(null, Preferences.fromSettings(settings), false);
        this.reconciler = new PatchDetailsReconciler(
                webviewId, initial, projector, host::notifyDidChangeState, scheduler, settings.getDebounce());
        settings.addListener(this);
    }

    @VisibleForTesting
    PatchDetailsReconciler reconciler() {
        return reconciler;
    }

    /** Initial state for the first paint; it is returned rather than sent. The view counts as visible from here on. */
    public PatchDetailsState bootstrap() {
        reconciler.updatePending(PendingContext.ofVisible(true), false);
        return reconciler.bootstrap();
    }

    /** Shows {@code patch} (or nothing, when null). */
    public void showPatch(@Nullable PatchSet patch, boolean force, boolean immediate) {
        reconciler.updatePending(PendingContext.ofPatch(patch), force);
        reconciler.scheduleNotify(immediate);
    }

    public void onVisibilityChanged(boolean visible) {
        reconciler.updatePending(PendingContext.ofVisible(visible), false);
        if (!visible) {
            return;
        }

        // the first reveal comes right after bootstrap, which already delivered the state
        if (bootstrapping) {
            bootstrapping = false;
            if (!reconciler.hasPending()) {
                return;
            }
        }
        reconciler.scheduleNotify(true);
    }

    @Override
    public void settingsChanged(Set<String> changedKeys) {
        if (changedKeys.contains(PatchbaySettings.DEBOUNCE_MILLIS)) {
            reconciler.setDebounce(settings.getDebounce());
        }
        if (changedKeys.stream().anyMatch(PREFERENCE_KEYS::contains)) {
            reconciler.updatePending(PendingContext.ofPreferences(Preferences.fromSettings(settings)), false);
        }
        reconciler.scheduleNotify(false);
    }

    // ---- commands ----

    /** Dispatches a command from the view. The future completes once the command has been fully handled. */
    public CompletableFuture<Void> handle(PatchCommand command) {
        logger.debug("Handling {} for {}", command, reconciler.webviewId());
        if (command instanceof PatchCommand.ApplyPatch apply) {
            return applyPatch(apply.target());
        } else if (command instanceof PatchCommand.SelectRepo select) {
            return selectRepo(select.repoPath());
        } else if (command instanceof PatchCommand.SelectBase) {
            return selectBase();
        } else if (command instanceof PatchCommand.FileAction action) {
            return fileAction(action.kind(), action.path());
        } else if (command instanceof PatchCommand.UpdatePreferences update) {
            updatePreferences(update.files());
            return CompletableFuture.completedFuture(null);
        } else if (command instanceof PatchCommand.Explain explain) {
            return explain(explain.completionId());
        }
        return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown command " + command));
    }

    private CompletableFuture<Void> applyPatch(ApplyTarget target) {
        return getUnreachablePatchCommit()
                .thenAcceptAsync(
                        commit -> {
                            if (commit.isEmpty()) {
                                return;
                            }
                            var patch = currentTarget();
                            var repo = patch == null ? null : patch.repo();
                            var contents = patch == null ? null : patch.contents();
                            if (repo == null || contents == null) {
                                return;
                            }
                            try {
                                var message = repo.applyPatch(commit.get(), contents, target);
                                host.showInformationMessage(message);
                            } catch (GitRepoException e) {
                                logger.warn("Applying patch to {} failed", target, e);
                                host.showErrorMessage("Unable to apply the patch: " + e.getMessage());
                            }
                        },
                        executor)
                .exceptionally(ex -> reportFailure("Unable to apply the patch", ex));
    }

    private CompletableFuture<Void> selectRepo(@Nullable String repoPath) {
        var target = currentTarget();
        if (target == null) {
            return CompletableFuture.completedFuture(null);
        }
        var pick = repoPath == null
                ? host.pickRepository(
                        "Patch Details: Select Repository", "Choose which repository this patch belongs to")
                : host.openRepository(Path.of(repoPath));
        return pick.thenAccept(repo -> {
                    if (repo.isEmpty() || repo.get() == target.repo()) {
                        return;
                    }
                    target.setRepo(repo.get());
                    // a new repository invalidates the base and anything built on it
                    target.setBaseRef(null);
                    target.setResolvedCommit(null);
                    refreshPatch();
                })
                .exceptionally(ex -> reportFailure("Unable to select a repository", ex));
    }

    private CompletableFuture<Void> selectBase() {
        var target = currentTarget();
        if (target == null) {
            return CompletableFuture.completedFuture(null);
        }
        var repo = target.repo();
        if (repo == null) {
            return selectRepo(null);
        }
        return pickBase(repo)
                .thenAccept(base -> {
                    if (base.isEmpty() || base.get().sha().equals(target.baseRef())) {
                        return;
                    }
                    target.setBaseRef(base.get().sha());
                    target.setResolvedCommit(null);
                    refreshPatch();
                })
                .exceptionally(ex -> reportFailure("Unable to select a base", ex));
    }

    private CompletableFuture<Void> fileAction(FileActionKind kind, String path) {
        return getUnreachablePatchCommit()
                .thenAccept(commit -> {
                    if (commit.isEmpty()) {
                        return;
                    }
                    var file = commit.get().findFile(path);
                    if (file.isEmpty()) {
                        logger.warn("File {} is not part of patch commit {}", path, commit.get().shortSha());
                        host.showErrorMessage("'" + path + "' is not part of this patch");
                        return;
                    }
                    host.executeFileAction(kind, commit.get(), file.get());
                })
                .exceptionally(ex -> reportFailure("Unable to open '" + path + "'", ex));
    }

    /** Persists changed file-tree preferences and stages them; a no-op when nothing differs. */
    public void updatePreferences(FilesPreferences files) {
        var committed = reconciler.context().preferences();
        if (committed.files().equals(files)) {
            return;
        }

        var pending = reconciler.pending();
        var current = pending != null && pending.preferences() != null ? pending.preferences() : committed;
        var old = committed.files();

        Map<String, @Nullable String> changes = new HashMap<>();
        if (old.compact() != files.compact()) {
            changes.put(PatchbaySettings.FILES_COMPACT, Boolean.toString(files.compact()));
        }
        if (!old.icon().equals(files.icon())) {
            changes.put(PatchbaySettings.FILES_ICON, files.icon());
        }
        if (!old.layout().equals(files.layout())) {
            changes.put(PatchbaySettings.FILES_LAYOUT, files.layout());
        }
        if (old.threshold() != files.threshold()) {
            changes.put(PatchbaySettings.FILES_THRESHOLD, Integer.toString(files.threshold()));
        }
        try {
            settings.update(changes);
        } catch (IOException e) {
            logger.error("Failed to save file preferences to {}", settings.getFile(), e);
        }

        reconciler.updatePending(PendingContext.ofPreferences(current.withFiles(files)), false);
        reconciler.scheduleNotify(false);
    }

    private CompletableFuture<Void> explain(@Nullable String completionId) {
        var target = currentTarget();
        if (target == null) {
            return CompletableFuture.completedFuture(null);
        }
        return getUnreachablePatchCommit()
                .thenCompose(commit -> {
                    if (commit.isEmpty()) {
                        return CompletableFuture.<Void>completedFuture(null);
                    }
                    var contents = target.contents();
                    return explainer
                            .explain(commit.get(), contents == null ? "" : contents)
                            .thenAccept(summary -> host.notifyDidExplain(ExplainResult.success(completionId, summary)));
                })
                .exceptionally(ex -> {
                    var cause = CloudPatchClient.unwrap(ex);
                    logger.warn("Explaining the patch failed", cause);
                    host.notifyDidExplain(ExplainResult.failure(completionId, messageOf(cause)));
                    return null;
                });
    }

    // ---- missing-context guard ----

    /**
     * Resolves the commit the current patch produces on its base, asking for what is missing in this order: the
     * repository, then the base. Completes with empty when the user cancels a picker or when materialization fails; in
     * the latter case the base is cleared and an error is shown, so the next attempt asks for a base again.
     */
    public CompletableFuture<Optional<CommitInfo>> getUnreachablePatchCommit() {
        var patch = reconciler.context().patch();
        if (patch == null) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        GitPatch target;
        try {
            target = patch.target();
        } catch (IllegalStateException e) {
            return CompletableFuture.failedFuture(e);
        }

        return ensureRepo(target).thenCompose(repo -> {
            if (repo.isEmpty()) {
                return CompletableFuture.completedFuture(Optional.<CommitInfo>empty());
            }
            return ensureBase(target, repo.get()).thenCompose(base -> {
                if (base.isEmpty()) {
                    return CompletableFuture.completedFuture(Optional.<CommitInfo>empty());
                }
                var resolved = target.resolvedCommit();
                if (resolved != null) {
                    return CompletableFuture.completedFuture(Optional.of(resolved));
                }
                return ensureContents(target)
                        .thenApplyAsync(contents -> materialize(target, repo.get(), base.get(), contents), executor);
            });
        });
    }

    private CompletableFuture<Optional<PatchRepository>> ensureRepo(GitPatch target) {
        var repo = target.repo();
        if (repo != null) {
            return CompletableFuture.completedFuture(Optional.of(repo));
        }
        return host.pickRepository(
                        "Patch Details: Select Repository", "Choose which repository this patch belongs to")
                .thenApply(pick -> {
                    pick.ifPresent(target::setRepo);
                    return pick;
                });
    }

    private CompletableFuture<Optional<String>> ensureBase(GitPatch target, PatchRepository repo) {
        var baseRef = target.baseRef();
        if (baseRef != null) {
            return CompletableFuture.completedFuture(Optional.of(baseRef));
        }
        return pickBase(repo).thenApply(pick -> {
            pick.ifPresent(commit -> target.setBaseRef(commit.sha()));
            return pick.map(CommitInfo::sha);
        });
    }

    private CompletableFuture<Optional<CommitInfo>> pickBase(PatchRepository repo) {
        return CompletableFuture.supplyAsync(
                        () -> {
                            try {
                                return repo.getLog(BASE_PICKER_LOG_SIZE);
                            } catch (GitRepoException e) {
                                throw new CompletionException(e);
                            }
                        },
                        executor)
                .thenCompose(commits -> host.pickCommit(
                        "Patch Details: Select Base",
                        "Choose the base which this patch was created from or should be applied to",
                        commits));
    }

    private CompletableFuture<String> ensureContents(GitPatch target) {
        var contents = target.contents();
        if (contents != null) {
            return CompletableFuture.completedFuture(contents);
        }
        if (target instanceof RemotePatch remote) {
            return cloud.getPatchContents(remote.id()).thenApply(downloaded -> {
                remote.setContents(downloaded);
                return downloaded;
            });
        }
        return CompletableFuture.completedFuture("");
    }

    private Optional<CommitInfo> materialize(GitPatch target, PatchRepository repo, String base, String contents) {
        try {
            var commit = repo.createUnreachableCommitForPatch(contents, base, PATCH_COMMIT_MESSAGE);
            target.setResolvedCommit(commit);
            refreshPatch();
            return Optional.of(commit);
        } catch (GitRepoException e) {
            logger.warn("Materializing the patch on {} failed: {}", base, e.getMessage());
            host.showErrorMessage("Unable to preview the patch on base '" + base + "': " + e.getMessage());
            target.setBaseRef(null);
            refreshPatch();
            return Optional.empty();
        }
    }

    // ---- cloud ----

    /**
     * Publishes a diff and shows the resulting cloud patch. Runs to completion even if the view moves on to another
     * patch meanwhile.
     */
    public CompletableFuture<Optional<CloudPatch>> publish(PatchRepository repository, String baseSha, String contents) {
        return cloud.create(repository, baseSha, contents)
                .thenApply(created -> {
                    var where = created.linkUrl() != null ? created.linkUrl() : created.id();
                    host.showInformationMessage("Published patch " + where);
                    showPatch(created, false, true);
                    return Optional.of(created);
                })
                .exceptionally(ex -> {
                    var cause = CloudPatchClient.unwrap(ex);
                    logger.warn("Publishing patch failed", cause);
                    host.showErrorMessage("Unable to publish the patch: " + messageOf(cause));
                    return Optional.empty();
                });
    }

    /** Fetches a cloud patch by id and shows it. */
    public CompletableFuture<Optional<CloudPatch>> open(String cloudId) {
        return cloud.get(cloudId)
                .thenApply(found -> {
                    if (found.isEmpty()) {
                        host.showErrorMessage("Cloud patch '" + cloudId + "' was not found");
                        return found;
                    }
                    showPatch(found.get(), false, true);
                    return found;
                })
                .exceptionally(ex -> {
                    var cause = CloudPatchClient.unwrap(ex);
                    logger.warn("Opening cloud patch {} failed", cloudId, cause);
                    host.showErrorMessage("Unable to open cloud patch '" + cloudId + "': " + messageOf(cause));
                    return Optional.empty();
                });
    }

    // ---- helpers ----

    private @Nullable GitPatch currentTarget() {
        var patch = reconciler.context().patch();
        if (patch == null) {
            return null;
        }
        try {
            return patch.target();
        } catch (IllegalStateException e) {
            logger.warn("Current patch has nothing to act on: {}", e.getMessage());
            return null;
        }
    }

    /** Re-sends the current patch after one of its derived fields changed in place. */
    private void refreshPatch() {
        var patch = reconciler.context().patch();
        if (patch != null) {
            reconciler.updatePending(PendingContext.ofPatch(patch), true);
            reconciler.scheduleNotify(false);
        }
    }

    private @Nullable Void reportFailure(String what, Throwable ex) {
        var cause = CloudPatchClient.unwrap(ex);
        logger.warn("{}", what, cause);
        host.showErrorMessage(what + ": " + messageOf(cause));
        return null;
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }

    @Override
    public void close() {
        settings.removeListener(this);
        reconciler.dispose();
    }
}
