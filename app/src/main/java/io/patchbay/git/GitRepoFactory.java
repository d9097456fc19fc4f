package io.patchbay.git;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;

public class GitRepoFactory {
    private static final Logger logger = LogManager.getLogger(GitRepoFactory.class);

    /** Returns true if {@code dir} is inside a readable git repository. */
    public static boolean hasGitRepo(Path dir) {
        try {
            var builder = new FileRepositoryBuilder().findGitDir(dir.toFile());
            if (builder.getGitDir() == null) {
                return false;
            }
            try (var repo = builder.build()) {
                return repo.getObjectDatabase().exists();
            }
        } catch (IOException e) {
            logger.warn("Could not read git repo at {}: {}", dir, e.getMessage());
            return false;
        }
    }

    /** Opens the repository containing {@code dir}, or empty if there is none. */
    public static Optional<GitRepo> open(Path dir) {
        if (!hasGitRepo(dir)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new GitRepo(dir));
        } catch (IOException e) {
            logger.warn("Failed to open git repo at {}", dir, e);
            return Optional.empty();
        }
    }
}
