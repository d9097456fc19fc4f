package io.patchbay.git;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.api.CherryPickResult;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.lib.CommitBuilder;
import org.eclipse.jgit.lib.Constants;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.patch.PatchApplier;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.revwalk.RevSort;
import org.eclipse.jgit.revwalk.RevWalk;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

/** JGit-backed {@link PatchRepository}. */
public class GitRepo implements PatchRepository, AutoCloseable {
    private static final Logger logger = LogManager.getLogger(GitRepo.class);

    private final Path root;
    private final Repository repository;
    private final Git git;

    public GitRepo(Path projectRoot) throws IOException {
        var builder = new FileRepositoryBuilder().findGitDir(projectRoot.toFile());
        if (builder.getGitDir() == null) {
            throw new IOException("No git repository found at " + projectRoot);
        }
        this.repository = builder.build();
        this.git = new Git(repository);
        this.root = repository.isBare()
                ? repository.getDirectory().toPath().toAbsolutePath().normalize()
                : repository.getWorkTree().toPath().toAbsolutePath().normalize();
        logger.debug("Opened git repository at {}", root);
    }

    @Override
    public Path root() {
        return root;
    }

    @VisibleForTesting
    Repository getRepository() {
        return repository;
    }

    /** Resolves a ref or abbreviated sha to the full sha of the commit it names. */
    public String resolveCommit(String ref) throws GitRepoException {
        try {
            var id = repository.resolve(ref + "^{commit}");
            if (id == null) {
                throw new GitRepoException("Unknown revision '" + ref + "'");
            }
            return id.getName();
        } catch (IOException e) {
            throw new GitRepoException("Failed to resolve '" + ref + "'", e);
        }
    }

    @Override
    public Optional<GitRemoteProvider> getBestRemoteWithProvider() {
        var config = repository.getConfig();
        var names = new ArrayList<>(config.getSubsections("remote"));
        names.sort(Comparator.comparingInt(GitRepo::remotePriority).thenComparing(Comparator.naturalOrder()));
        for (var name : names) {
            var url = config.getString("remote", name, "url");
            if (url == null) {
                continue;
            }
            var provider = RemoteProviders.parse(name, url);
            if (provider != null) {
                return Optional.of(provider);
            }
            logger.debug("Remote {} ({}) does not map to a known provider", name, url);
        }
        return Optional.empty();
    }

    private static int remotePriority(String remoteName) {
        return switch (remoteName) {
            case "origin" -> 0;
            case "upstream" -> 1;
            default -> 2;
        };
    }

    @Override
    public Optional<GitUser> getCurrentUser() {
        var config = repository.getConfig();
        var name = config.getString("user", null, "name");
        var email = config.getString("user", null, "email");
        if (name == null && email == null) {
            return Optional.empty();
        }
        return Optional.of(new GitUser(name, email));
    }

    @Override
    public String getCurrentBranch() throws GitRepoException {
        try {
            var branch = repository.getBranch();
            return branch == null ? "" : branch;
        } catch (IOException e) {
            throw new GitRepoException("Failed to read current branch of " + root, e);
        }
    }

    @Override
    public Optional<String> getUniqueRepositoryId() throws GitRepoException {
        try (var walk = new RevWalk(repository)) {
            var head = repository.resolve(Constants.HEAD);
            if (head == null) {
                return Optional.empty();
            }
            walk.markStart(walk.parseCommit(head));
            walk.sort(RevSort.TOPO);
            walk.sort(RevSort.REVERSE, true);
            var first = walk.next();
            return first == null ? Optional.empty() : Optional.of(first.getName());
        } catch (IOException e) {
            throw new GitRepoException("Failed to find the root commit of " + root, e);
        }
    }

    @Override
    public List<CommitInfo> getLog(int maxCount) throws GitRepoException {
        try {
            if (repository.resolve(Constants.HEAD) == null) {
                return List.of();
            }
            var result = new ArrayList<CommitInfo>();
            for (var commit : git.log().setMaxCount(maxCount).call()) {
                result.add(toCommitInfo(commit, List.of()));
            }
            return result;
        } catch (IOException | GitAPIException e) {
            throw new GitRepoException("Failed to read log of " + root, e);
        }
    }

    @Override
    public CommitInfo createUnreachableCommitForPatch(String contents, String baseRef, String message)
            throws GitRepoException {
        try (var inserter = repository.newObjectInserter();
                var walk = new RevWalk(repository)) {
            var baseId = repository.resolve(baseRef + "^{commit}");
            if (baseId == null) {
                throw new GitRepoException("Unknown base '" + baseRef + "'");
            }
            var base = walk.parseCommit(baseId);

            var applier = new PatchApplier(repository, base.getTree(), inserter);
            var result = applier.applyPatch(new ByteArrayInputStream(contents.getBytes(StandardCharsets.UTF_8)));
            if (!result.getErrors().isEmpty()) {
                throw new GitRepoException("Patch does not apply on " + base.abbreviate(7).name() + ": "
                        + result.getErrors().get(0));
            }

            var ident = new PersonIdent(repository);
            var builder = new CommitBuilder();
            builder.setTreeId(result.getTreeId());
            builder.setParentId(base);
            builder.setAuthor(ident);
            builder.setCommitter(ident);
            builder.setMessage(message);
            ObjectId commitId = inserter.insert(builder);
            inserter.flush();

            var commit = walk.parseCommit(commitId);
            var files = DiffFiles.parse(contents, root.toString());
            logger.debug("Created unreachable commit {} for patch on {}", commit.getName(), baseRef);
            return toCommitInfo(commit, files);
        } catch (IOException | GitAPIException e) {
            if (e instanceof GitRepoException gre) {
                throw gre;
            }
            throw new GitRepoException("Failed to create a commit for the patch on '" + baseRef + "': " + e.getMessage(), e);
        }
    }

    @Override
    public String applyPatch(CommitInfo commit, String contents, ApplyTarget target) throws GitRepoException {
        try {
            return switch (target) {
                case HEAD -> cherryPick(commit);
                case BRANCH -> checkoutNewBranch(commit);
                case WORKTREE -> applyToWorkingTree(contents);
            };
        } catch (GitAPIException e) {
            if (e instanceof GitRepoException gre) {
                throw gre;
            }
            throw new GitRepoException("Failed to apply patch " + commit.shortSha() + " to " + target, e);
        }
    }

    private String cherryPick(CommitInfo commit) throws GitAPIException {
        var result = git.cherryPick().include(ObjectId.fromString(commit.sha())).call();
        if (result.getStatus() != CherryPickResult.CherryPickStatus.OK) {
            throw new GitRepoException("Cherry-pick of " + commit.shortSha() + " failed: " + result.getStatus());
        }
        var branch = getCurrentBranch();
        logger.info("Cherry-picked patch commit {} onto {}", commit.shortSha(), branch);
        return "Applied patch onto " + branch;
    }

    private String checkoutNewBranch(CommitInfo commit) throws GitAPIException {
        var name = "patch/" + commit.shortSha();
        git.branchCreate().setName(name).setStartPoint(commit.sha()).call();
        git.checkout().setName(name).call();
        logger.info("Created branch {} at patch commit {}", name, commit.shortSha());
        return "Created branch " + name;
    }

    private String applyToWorkingTree(String contents) throws GitAPIException {
        var result = git.apply()
                .setPatch(new ByteArrayInputStream(contents.getBytes(StandardCharsets.UTF_8)))
                .call();
        int updated = result.getUpdatedFiles().size();
        logger.info("Applied patch to {} file(s) in the working tree of {}", updated, root);
        return "Applied patch to " + updated + " file(s) in the working tree";
    }

    private CommitInfo toCommitInfo(RevCommit commit, List<GitFileChange> files) {
        var author = commit.getAuthorIdent();
        @Nullable String parent = commit.getParentCount() > 0 ? commit.getParent(0).getName() : null;
        return new CommitInfo(
                commit.getName(),
                parent,
                commit.getFullMessage(),
                author.getName(),
                author.getEmailAddress(),
                Instant.ofEpochSecond(commit.getCommitTime()),
                root,
                files);
    }

    @Override
    public void close() {
        git.close();
        repository.close();
    }

    @Override
    public String toString() {
        return "GitRepo[" + root + "]";
    }
}
