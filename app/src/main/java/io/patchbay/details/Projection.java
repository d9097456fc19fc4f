package io.patchbay.details;

import java.util.concurrent.CompletableFuture;
import org.jetbrains.annotations.Nullable;

/**
 * Output of {@link DetailsProjector#project}: the details to render now, plus the pending file resolution when the
 * details had to be built without files.
 */
public record Projection(@Nullable PatchDetails details, @Nullable CompletableFuture<FilesResolved> enrichment) {

    public static final Projection EMPTY = new Projection(null, null);
}
