package io.patchbay.details;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.patchbay.git.CommitInfo;
import io.patchbay.git.DiffFiles;
import io.patchbay.git.GitFileChange;
import io.patchbay.git.GitRepoException;
import io.patchbay.git.PatchRepository;
import io.patchbay.patch.CloudPatch;
import io.patchbay.patch.GitPatch;
import io.patchbay.patch.LocalPatch;
import io.patchbay.patch.PatchSet;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

/**
 * Builds {@link PatchDetails} from a {@link ViewContext}.
 *
 * <p>Missing file lists are resolved in the background, once per {@link GitPatch} instance: concurrent projections of
 * the same patch share the in-flight parse. Autolink derivation runs under the caller's {@link DerivationToken} and
 * yields nothing once the token is cancelled.
 */
public class DetailsProjector {
    private static final Logger logger = LogManager.getLogger(DetailsProjector.class);

    /** {@code #123} or {@code GH-123}, not preceded by a word character or '/'. */
    private static final Pattern ISSUE_REF = Pattern.compile("(?<![\\w/])(?:#|GH-)(\\d+)\\b");

    private final Executor executor;

    // weakKeys: identity comparison, entries go away with their patch
    private final Cache<GitPatch, CompletableFuture<List<GitFileChange>>> filesCache =
            Caffeine.newBuilder().weakKeys().build();

    public DetailsProjector(Executor executor) {
        this.executor = executor;
    }

    /**
     * Projects the context. The returned future fails with {@link CancellationException} if {@code token} is cancelled
     * before the projection is complete, and with {@link IllegalStateException} for a cloud patch that has no
     * changeset or patch to show.
     */
    public CompletableFuture<Projection> project(ViewContext context, DerivationToken token) {
        var patch = context.patch();
        if (patch == null) {
            return CompletableFuture.completedFuture(Projection.EMPTY);
        }

        GitPatch target;
        try {
            token.throwIfCancelled();
            target = patch.target();
        } catch (IllegalStateException e) {
            // also a cancelled token
            return CompletableFuture.failedFuture(e);
        }

        @Nullable CompletableFuture<FilesResolved> enrichment = null;
        if (target.files() == null) {
            enrichment = resolveFiles(patch, target);
        }
        var pendingEnrichment = enrichment;

        return deriveAutolinks(target, context.preferences(), token).thenApply(links -> {
            token.throwIfCancelled();
            return new Projection(toDetails(patch, target, links), pendingEnrichment);
        });
    }

    /**
     * Parses the target's diff into its file list. The work is shared by every caller asking about the same
     * {@link GitPatch} instance; a failed parse is evicted so a later projection can try again.
     */
    public CompletableFuture<FilesResolved> resolveFiles(PatchSet key, GitPatch target) {
        var created = new CompletableFuture<List<GitFileChange>>();
        var files = filesCache.get(target, k -> created);
        if (files == created) {
            executor.execute(() -> parseFiles(target, created));
        }
        return files.thenApply(list -> new FilesResolved(key, target, list));
    }

    private void parseFiles(GitPatch target, CompletableFuture<List<GitFileChange>> future) {
        try {
            var contents = target.contents();
            var repo = target.repo();
            var repoPath = repo == null ? "" : repo.root().toString();
            var files = contents == null ? List.<GitFileChange>of() : DiffFiles.parse(contents, repoPath);
            logger.debug("Resolved {} file(s) for {}", files.size(), target);
            future.complete(files);
        } catch (IOException | RuntimeException e) {
            logger.warn("Unable to parse the files of {}: {}", target, e.getMessage());
            filesCache.asMap().remove(target, future);
            future.completeExceptionally(e);
        }
    }

    @VisibleForTesting
    boolean hasCachedFiles(GitPatch target) {
        return filesCache.getIfPresent(target) != null;
    }

    // ---- autolinks ----

    private CompletableFuture<AutolinkResult> deriveAutolinks(
            GitPatch target, Preferences preferences, DerivationToken token) {
        CommitInfo commit = target.resolvedCommit();
        PatchRepository repo = target.repo();
        if (!preferences.autolinksEnabled() || commit == null || repo == null) {
            return CompletableFuture.completedFuture(AutolinkResult.NONE);
        }

        return CompletableFuture.supplyAsync(
                () -> {
                    try {
                        token.throwIfCancelled();
                        var provider = repo.getBestRemoteWithProvider().orElse(null);
                        token.throwIfCancelled();
                        if (provider == null) {
                            return AutolinkResult.NONE;
                        }
                        var links = new ArrayList<Autolink>();
                        for (var ref : findIssueReferences(commit.message())) {
                            token.throwIfCancelled();
                            var url = provider.issueUrl(ref.number());
                            if (url != null) {
                                links.add(new Autolink(ref.id(), url));
                            }
                        }
                        return new AutolinkResult(links, null);
                    } catch (GitRepoException e) {
                        logger.warn("Autolink derivation for {} failed: {}", commit.shortSha(), e.getMessage());
                        return new AutolinkResult(List.of(), new DerivationError(e.getMessage()));
                    }
                },
                executor)
                .exceptionally(ex -> {
                    var cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof CancellationException ce) {
                        throw ce;
                    }
                    logger.warn("Autolink derivation for {} failed", commit.shortSha(), cause);
                    var message = cause.getMessage() == null ? cause.toString() : cause.getMessage();
                    return new AutolinkResult(List.of(), new DerivationError(message));
                });
    }

    /** Distinct issue references in order of first appearance. */
    static List<IssueRef> findIssueReferences(String text) {
        var seen = new LinkedHashSet<IssueRef>();
        var matcher = ISSUE_REF.matcher(text);
        while (matcher.find()) {
            seen.add(new IssueRef(matcher.group(), matcher.group(1)));
        }
        return List.copyOf(seen);
    }

    record IssueRef(String id, String number) {}

    private record AutolinkResult(List<Autolink> links, @Nullable DerivationError error) {
        static final AutolinkResult NONE = new AutolinkResult(List.of(), null);
    }

    // ---- details ----

    private static PatchDetails toDetails(PatchSet patch, GitPatch target, AutolinkResult autolinks) {
        var commit = target.resolvedCommit();
        var repo = target.repo();
        var repoPath = repo == null ? null : repo.root().toString();
        if (patch instanceof LocalPatch local) {
            return new LocalPatchDetails(
                    local.contentsRef().toString(),
                    commit == null ? null : commit.message(),
                    target.baseRef(),
                    repoPath,
                    target.files(),
                    autolinks.links(),
                    autolinks.error());
        } else if (patch instanceof CloudPatch cloud) {
            return new CloudPatchDetails(
                    cloud.id(),
                    cloud.linkUrl(),
                    cloudMessage(cloud, commit),
                    new Author(
                            cloud.createdBy(),
                            commit == null ? null : commit.authorName(),
                            commit == null ? null : commit.authorEmail()),
                    cloud.createdAt(),
                    cloud.updatedAt(),
                    target.baseRef(),
                    repoPath,
                    target.files(),
                    autolinks.links(),
                    autolinks.error());
        }
        throw new IllegalArgumentException("Unknown patch kind " + patch.kind());
    }

    private static @Nullable String cloudMessage(CloudPatch cloud, @Nullable CommitInfo commit) {
        var title = cloud.title();
        if (title == null || title.isBlank()) {
            return commit == null ? null : commit.message();
        }
        var description = cloud.description();
        return description == null || description.isBlank() ? title : title + "\n\n" + description;
    }
}
