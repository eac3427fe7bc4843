package io.entityjdbc.retry;

import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

import io.entityjdbc.util.Assert;

/**
 * Flag marking that an attempt of a retrying execution strategy is in progress. Strategies
 * invoked while the flag is set run their operation once without retrying, so only the
 * outermost strategy retries.
 *
 * <p>The flag is bound to the thread that starts an attempt. Asynchronous operations carry it
 * into their continuations with a {@link Snapshot} taken while the attempt starts, typically
 * by scheduling the continuations on an executor returned by {@link #bind(Executor)}:
 * <pre>{@code
 * strategy.executeAsync(() -> {
 *     Executor executor = ExecutionSuspension.bind(pool);
 *     return CompletableFuture.supplyAsync(this::load, executor)
 *             .thenComposeAsync(v -> other.executeAsync(() -> save(v)), executor);
 * }, token);
 * }</pre>
 */
public final class ExecutionSuspension {
    private static final ThreadLocal<Boolean> SUSPENDED = new ThreadLocal<>();

    private ExecutionSuspension() {
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }

    public static boolean isSuspended() {
        return Boolean.TRUE.equals(SUSPENDED.get());
    }

    /**
     * Set the flag until the returned scope is closed, restoring the previous value.
     *
     * @return scope to close when the attempt is over
     */
    public static Scope suspend() {
        return set(true);
    }

    /**
     * @return the flag of the calling thread, to be re-established elsewhere
     */
    public static Snapshot capture() {
        return isSuspended() ? Snapshot.ACTIVE : Snapshot.INACTIVE;
    }

    /**
     * Shorthand for {@code capture().bind(executor)}.
     */
    public static Executor bind(Executor executor) {
        return capture().bind(executor);
    }

    private static Scope set(boolean suspended) {
        final boolean previous = isSuspended();
        apply(suspended);
        return () -> apply(previous);
    }

    private static void apply(boolean suspended) {
        if (suspended) {
            SUSPENDED.set(Boolean.TRUE);
        } else {
            SUSPENDED.remove();
        }
    }

    /**
     * Captured value of the flag. Work wrapped by a snapshot runs with the captured value on
     * whatever thread executes it, and the thread's own value is restored afterwards.
     */
    public static final class Snapshot {
        static final Snapshot ACTIVE = new Snapshot(true);

        static final Snapshot INACTIVE = new Snapshot(false);

        private final boolean suspended;

        private Snapshot(boolean suspended) {
            this.suspended = suspended;
        }

        public boolean isSuspended() {
            return suspended;
        }

        /**
         * Re-establish the captured value on the calling thread until the scope is closed.
         */
        public Scope restore() {
            return set(suspended);
        }

        public Runnable wrap(Runnable task) {
            Assert.notNull(task, "task is null");
            return () -> {
                try (Scope ignored = restore()) {
                    task.run();
                }
            };
        }

        public <T> Supplier<T> wrap(Supplier<T> supplier) {
            Assert.notNull(supplier, "supplier is null");
            return () -> {
                try (Scope ignored = restore()) {
                    return supplier.get();
                }
            };
        }

        public <T, R> Function<T, R> wrap(Function<T, R> function) {
            Assert.notNull(function, "function is null");
            return value -> {
                try (Scope ignored = restore()) {
                    return function.apply(value);
                }
            };
        }

        /**
         * @return executor running every task with the captured value
         */
        public Executor bind(Executor executor) {
            Assert.notNull(executor, "executor is null");
            return task -> executor.execute(wrap(task));
        }

        @Override
        public String toString() {
            return "Snapshot{" +
                    "suspended=" + suspended +
                    '}';
        }
    }
}
