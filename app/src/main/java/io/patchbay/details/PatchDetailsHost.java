package io.patchbay.details;

import io.patchbay.git.CommitInfo;
import io.patchbay.git.GitFileChange;
import io.patchbay.git.PatchRepository;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * The editor integration around a patch-details view: the channel snapshots are sent on, pickers, messages and file
 * opening. Pickers complete with empty when the user cancels.
 */
public interface PatchDetailsHost {

    void notifyDidChangeState(PatchDetailsState state);

    void notifyDidExplain(ExplainResult result);

    CompletableFuture<Optional<PatchRepository>> pickRepository(String title, String placeholder);

    CompletableFuture<Optional<PatchRepository>> openRepository(Path repoPath);

    CompletableFuture<Optional<CommitInfo>> pickCommit(String title, String placeholder, List<CommitInfo> commits);

    void executeFileAction(FileActionKind kind, CommitInfo commit, GitFileChange file);

    void showInformationMessage(String message);

    void showErrorMessage(String message);
}
