package io.patchbay.details;

import io.patchbay.git.ApplyTarget;
import org.jetbrains.annotations.Nullable;

/** Requests sent by the rendering layer to {@link PatchDetailsController#handle(PatchCommand)}. */
public sealed interface PatchCommand {

    record ApplyPatch(ApplyTarget target) implements PatchCommand {}

    /** Attach the patch to a repository; without a path the user is asked to pick one. */
    record SelectRepo(@Nullable String repoPath) implements PatchCommand {}

    record SelectBase() implements PatchCommand {}

    record FileAction(FileActionKind kind, String path, @Nullable String repoPath) implements PatchCommand {}

    record UpdatePreferences(FilesPreferences files) implements PatchCommand {}

    /** Ask for an AI summary; the answer is correlated by {@code completionId}. */
    record Explain(@Nullable String completionId) implements PatchCommand {}
}
