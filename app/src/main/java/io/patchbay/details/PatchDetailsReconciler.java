package io.patchbay.details;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;
import org.jetbrains.annotations.VisibleForTesting;

/**
 * Owns the committed {@link ViewContext} of one patch-details view and the {@link PendingContext} overlay that
 * producers write into.
 *
 * <p>Updates are merged into the overlay synchronously. A flush commits the overlay, cancels the previous generation's
 * {@link DerivationToken} and asks the {@link DetailsProjector} for a snapshot; only the snapshot of the newest
 * generation is handed to the consumer, and always under this object's monitor so that snapshots arrive in
 * generation order. Flushes are either immediate or trailing-edge debounced.
 */
public class PatchDetailsReconciler {
    private static final Logger logger = LogManager.getLogger(PatchDetailsReconciler.class);

    public enum State {
        IDLE,
        PENDING_SCHEDULED,
        FLUSHING
    }

    private final String webviewId;
    private final DetailsProjector projector;
    private final Consumer<PatchDetailsState> consumer;
    private final ScheduledExecutorService scheduler;
    private volatile Duration debounce;

    private ViewContext context;
    private @Nullable PendingContext pending;
    private @Nullable ScheduledFuture<?> debounceTask;
    private @Nullable DerivationToken currentToken;
    private @Nullable FilesResolved lastEnrichment;
    private @Nullable PatchDetailsState lastState;
    private long generation;
    private State state = State.IDLE;
    private boolean disposed;

    public PatchDetailsReconciler(
            String webviewId,
            ViewContext initial,
            DetailsProjector projector,
            Consumer<PatchDetailsState> consumer,
            ScheduledExecutorService scheduler,
            Duration debounce) {
        this.webviewId = webviewId;
        this.context = initial;
        this.projector = projector;
        this.consumer = consumer;
        this.scheduler = scheduler;
        this.debounce = debounce;
    }

    /**
     * Merges {@code partial} into the pending overlay, field by field. A field is skipped when its committed value
     * already equals the new one and no other value for it is pending; the patch is compared by identity, everything
     * else by value. {@code force} stages every touched field regardless.
     *
     * @return whether anything was staged
     */
    public synchronized boolean updatePending(PendingContext partial, boolean force) {
        if (disposed) {
            return false;
        }
        var current = pending == null ? PendingContext.EMPTY : pending;

        boolean stagePatch = partial.hasPatch() && (force || current.hasPatch() || context.patch() != partial.patch());
        boolean stagePreferences = partial.preferences() != null
                && (force
                        || current.preferences() != null
                        || !Objects.equals(context.preferences(), partial.preferences()));
        boolean stageVisible = partial.visible() != null
                && (force || current.visible() != null || context.visible() != partial.visible());

        if (!stagePatch && !stagePreferences && !stageVisible) {
            return false;
        }

        pending = current.merge(new PendingContext(
                stagePatch,
                stagePatch ? partial.patch() : null,
                stagePreferences ? partial.preferences() : null,
                stageVisible ? partial.visible() : null));
        if (state == State.IDLE) {
            state = State.PENDING_SCHEDULED;
        }
        return true;
    }

    /** Flushes now when {@code immediate}, otherwise (re)starts the debounce timer. */
    public void scheduleNotify(boolean immediate) {
        if (immediate) {
            flush(false);
            return;
        }
        synchronized (this) {
            if (disposed) {
                return;
            }
            cancelDebounce();
            state = State.PENDING_SCHEDULED;
            debounceTask = scheduler.schedule(() -> flush(false), debounce.toMillis(), TimeUnit.MILLISECONDS);
        }
    }

    /**
     * Commits the pending overlay and starts a new derivation generation. Without pending changes this does nothing
     * unless {@code force} is set, in which case the committed context is re-projected.
     */
    public void flush(boolean force) {
        ViewContext snapshot;
        DerivationToken token;
        synchronized (this) {
            if (disposed) {
                return;
            }
            cancelDebounce();
            if (pending == null && !force) {
                if (state == State.PENDING_SCHEDULED) {
                    state = currentToken == null ? State.IDLE : State.FLUSHING;
                }
                return;
            }
            if (pending != null) {
                context = pending.applyTo(context);
                pending = null;
            }
            if (currentToken != null) {
                currentToken.cancel();
            }
            token = new DerivationToken(++generation);
            currentToken = token;
            state = State.FLUSHING;
            snapshot = context;
        }

        logger.trace("Flushing {} generation {}", webviewId, token.generation());
        projector.project(snapshot, token).whenComplete((projection, ex) -> onProjected(snapshot, token, projection, ex));
    }

    private void onProjected(
            ViewContext snapshot, DerivationToken token, @Nullable Projection projection, @Nullable Throwable ex) {
        synchronized (this) {
            if (disposed || token != currentToken || token.isCancelled()) {
                logger.trace("Dropping superseded projection of generation {}", token.generation());
                return;
            }
            currentToken = null;
            state = pending == null ? State.IDLE : State.PENDING_SCHEDULED;

            if (ex != null) {
                var cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                if (!(cause instanceof CancellationException)) {
                    // the consumer keeps showing the last good snapshot
                    logger.warn("Unable to build patch details for {}", webviewId, cause);
                }
                return;
            }

            var details = projection == null ? null : projection.details();
            var newState = new PatchDetailsState(
                    webviewId, System.currentTimeMillis(), details, snapshot.preferences());
            lastState = newState;
            consumer.accept(newState);
        }

        var enrichment = projection == null ? null : projection.enrichment();
        if (enrichment != null) {
            enrichment.whenComplete(this::onEnrichment);
        }
    }

    private void onEnrichment(@Nullable FilesResolved resolved, @Nullable Throwable ex) {
        if (ex != null) {
            logger.warn("File resolution for {} failed: {}", webviewId, ex.getMessage());
        } else if (resolved != null) {
            applyEnrichment(resolved);
        }
    }

    /**
     * Applies a file resolution to the committed patch it was computed for. Ignored when the view has since moved to
     * another patch, and when the same resolution was already applied.
     *
     * @return whether the resolution was applied
     */
    public boolean applyEnrichment(FilesResolved resolved) {
        synchronized (this) {
            if (disposed || resolved == lastEnrichment) {
                return false;
            }
            if (context.patch() != resolved.key()) {
                logger.debug("Discarding file resolution for {}; it is no longer selected", resolved.key());
                return false;
            }
            lastEnrichment = resolved;
            resolved.target().setFiles(resolved.files());
            updatePending(PendingContext.ofPatch(resolved.key()), true);
        }
        scheduleNotify(true);
        return true;
    }

    /** Commits pending changes and returns the resulting snapshot without notifying the consumer. */
    public PatchDetailsState bootstrap() {
        ViewContext snapshot;
        synchronized (this) {
            cancelDebounce();
            if (pending != null) {
                context = pending.applyTo(context);
                pending = null;
            }
            state = currentToken == null ? State.IDLE : State.FLUSHING;
            snapshot = context;
        }

        PatchDetails details = null;
        try {
            var projection = projector.project(snapshot, new DerivationToken(0)).join();
            details = projection.details();
            var enrichment = projection.enrichment();
            if (enrichment != null) {
                enrichment.whenComplete(this::onEnrichment);
            }
        } catch (CompletionException | CancellationException e) {
            logger.warn("Unable to build initial patch details for {}", webviewId, e);
        }

        var initial = new PatchDetailsState(webviewId, System.currentTimeMillis(), details, snapshot.preferences());
        synchronized (this) {
            lastState = initial;
        }
        return initial;
    }

    /** Stops the debounce timer and cancels the outstanding derivation. Later calls on this object do nothing. */
    public synchronized void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;
        cancelDebounce();
        if (currentToken != null) {
            currentToken.cancel();
            currentToken = null;
        }
        pending = null;
        state = State.IDLE;
        logger.debug("Disposed reconciler for {}", webviewId);
    }

    private void cancelDebounce() {
        if (debounceTask != null) {
            debounceTask.cancel(false);
            debounceTask = null;
        }
    }

    public void setDebounce(Duration debounce) {
        this.debounce = debounce;
    }

    public String webviewId() {
        return webviewId;
    }

    public synchronized ViewContext context() {
        return context;
    }

    public synchronized boolean hasPending() {
        return pending != null;
    }

    public synchronized @Nullable PendingContext pending() {
        return pending;
    }

    public synchronized State state() {
        return state;
    }

    public synchronized @Nullable PatchDetailsState lastState() {
        return lastState;
    }

    @VisibleForTesting
    synchronized long generation() {
        return generation;
    }
}
