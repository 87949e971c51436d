package dev.evalkit.eval;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Cooperative cancellation signal for evaluations.
 *
 * <p>The engine only ever polls {@link #isDone()}; it never blocks on a context. A child context
 * is done when it, or any of its ancestors, has been cancelled.
 */
@ThreadSafe
public final class EvalContext {
    private static final EvalContext BACKGROUND = new EvalContext(null, false);

    @Nullable private final EvalContext parent;
    private final boolean cancellable;
    private final AtomicReference<CancellationException> cancellation = new AtomicReference<>();

    private EvalContext(@Nullable EvalContext parent, boolean cancellable) {
        this.parent = parent;
        this.cancellable = cancellable;
    }

    /** A context which is never cancelled. */
    public static EvalContext background() {
        return BACKGROUND;
    }

    /** A new root context which may be cancelled with {@link #cancel()}. */
    public static EvalContext cancellable() {
        return new EvalContext(null, true);
    }

    /** A cancellable context which is also cancelled whenever this context is. */
    public EvalContext child() {
        return new EvalContext(this, true);
    }

    /**
     * Cancel this context and all of its children.
     *
     * @return false if the context was already cancelled
     */
    public boolean cancel() {
        return cancel("evaluation cancelled");
    }

    public boolean cancel(String reason) {
        if (!cancellable) {
            throw new IllegalStateException("the background context cannot be cancelled");
        }
        return cancellation.compareAndSet(null, new CancellationException(reason));
    }

    public boolean isDone() {
        return error().isPresent();
    }

    /** The exception recorded by the first cancellation of this context or an ancestor. */
    public Optional<CancellationException> error() {
        var own = cancellation.get();
        if (own != null) {
            return Optional.of(own);
        }
        return parent == null ? Optional.empty() : parent.error();
    }
}
