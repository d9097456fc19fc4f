package io.patchbay.patch;

import org.jetbrains.annotations.Nullable;

/** Outcome of one item of a batch fetch; a failed item carries its error instead of data. */
public record PatchDataResult(String id, @Nullable PatchData data, @Nullable String error) {

    public static PatchDataResult success(PatchData data) {
        return new PatchDataResult(data.id(), data, null);
    }

    public static PatchDataResult failure(String id, String error) {
        return new PatchDataResult(id, null, error);
    }

    public boolean isSuccess() {
        return data != null;
    }
}
