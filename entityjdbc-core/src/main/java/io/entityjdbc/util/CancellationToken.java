package io.entityjdbc.util;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal passed to asynchronous operations. Callbacks registered
 * with {@link #onCancel(Runnable)} run once, on the thread calling {@link #cancel()}, or
 * immediately if the token is already cancelled.
 */
public final class CancellationToken {
    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken(false, false);

    public static CancellationToken create() {
        return new CancellationToken(true, false);
    }

    public static CancellationToken cancelled() {
        return new CancellationToken(true, true);
    }

    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override
        void close();
    }

    private final boolean cancellable;

    private final AtomicBoolean cancelled;

    private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

    private CancellationToken(boolean cancellable, boolean cancelled) {
        this.cancellable = cancellable;
        this.cancelled = new AtomicBoolean(cancelled);
    }

    public boolean isCancellable() {
        return cancellable;
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Request cancellation and run the registered callbacks.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     */
    public boolean cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("Token cannot be cancelled");
        }
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        for (Runnable callback : callbacks) {
            callback.run();
        }
        callbacks.clear();
        return true;
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("The operation was cancelled");
        }
    }

    public Registration onCancel(Runnable callback) {
        Assert.notNull(callback, "callback is null");
        if (!cancellable) {
            return () -> {
            };
        }
        AtomicBoolean invoked = new AtomicBoolean();
        Runnable once = () -> {
            if (invoked.compareAndSet(false, true)) {
                callback.run();
            }
        };
        callbacks.add(once);
        // Cancelled between the check in the caller and the registration
        if (isCancellationRequested()) {
            callbacks.remove(once);
            once.run();
        }
        return () -> callbacks.remove(once);
    }

    @Override
    public String toString() {
        return "CancellationToken{" +
                "cancellable=" + cancellable +
                ", cancelled=" + cancelled +
                '}';
    }
}
