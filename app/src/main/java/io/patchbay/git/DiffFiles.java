package io.patchbay.git;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.patch.FileHeader;
import org.eclipse.jgit.patch.Patch;

/** Extracts the list of changed files from unified diff text. Needs no repository. */
public final class DiffFiles {
    private static final Logger logger = LogManager.getLogger(DiffFiles.class);

    private DiffFiles() {}

    /**
     * Parses {@code contents} and returns one entry per file header, in diff order.
     *
     * @param repoPath stored on each entry; empty when the patch is not tied to a repository yet
     */
    public static List<GitFileChange> parse(String contents, String repoPath) throws IOException {
        var patch = new Patch();
        patch.parse(new ByteArrayInputStream(contents.getBytes(StandardCharsets.UTF_8)));
        if (!patch.getErrors().isEmpty()) {
            logger.debug("Diff parsed with {} format error(s); first: {}", patch.getErrors().size(), patch.getErrors().get(0));
        }

        var result = new ArrayList<GitFileChange>();
        for (FileHeader header : patch.getFiles()) {
            result.add(toFileChange(header, repoPath));
        }
        return List.copyOf(result);
    }

    private static GitFileChange toFileChange(FileHeader header, String repoPath) {
        var status = FileStatus.from(header.getChangeType());
        return switch (status) {
            case DELETED -> new GitFileChange(header.getOldPath(), null, status, repoPath);
            case RENAMED, COPIED -> new GitFileChange(header.getNewPath(), header.getOldPath(), status, repoPath);
            default -> new GitFileChange(stripDevNull(header.getNewPath(), header.getOldPath()), null, status, repoPath);
        };
    }

    private static String stripDevNull(String newPath, String oldPath) {
        return DiffEntry.DEV_NULL.equals(newPath) ? oldPath : newPath;
    }
}
