package io.patchbay.details;

import io.patchbay.git.CommitInfo;
import java.util.concurrent.CompletableFuture;

/** Summarizes a materialized patch commit in prose. */
@FunctionalInterface
public interface PatchExplainer {

    CompletableFuture<String> explain(CommitInfo commit, String contents);
}
