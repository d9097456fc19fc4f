package io.patchbay.details;

import java.util.concurrent.CancellationException;

/**
 * Cancellation flag owned by one flush generation. Derivation steps call {@link #throwIfCancelled()} before doing work
 * and before publishing results.
 */
public final class DerivationToken {

    private final long generation;
    private volatile boolean cancelled;

    public DerivationToken(long generation) {
        this.generation = generation;
    }

    public long generation() {
        return generation;
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void throwIfCancelled() {
        if (cancelled) {
            throw new CancellationException("Derivation for generation " + generation + " was superseded");
        }
    }

    @Override
    public String toString() {
        return "DerivationToken[" + generation + (cancelled ? ", cancelled]" : "]");
    }
}
