package io.patchbay.details;

import org.jetbrains.annotations.Nullable;

/** Answer to an {@link PatchCommand.Explain}: either a summary (possibly null) or an error, never both. */
public record ExplainResult(@Nullable String completionId, @Nullable String summary, @Nullable Failure error) {

    public record Failure(String message) {}

    public static ExplainResult success(@Nullable String completionId, @Nullable String summary) {
        return new ExplainResult(completionId, summary, null);
    }

    public static ExplainResult failure(@Nullable String completionId, String message) {
        return new ExplainResult(completionId, null, new Failure(message));
    }

    public boolean isError() {
        return error != null;
    }
}
