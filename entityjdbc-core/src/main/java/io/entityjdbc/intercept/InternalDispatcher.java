package io.entityjdbc.intercept;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.Consumer;

import io.entityjdbc.util.Assert;
import io.entityjdbc.util.AsyncSqlCallable;
import io.entityjdbc.util.ExceptionUtils;
import io.entityjdbc.util.SqlCallable;

/**
 * Invokes the registered interceptors of one capability around operations.
 *
 * <p>Registration replaces the interceptor list under a lock. Dispatch reads the current list
 * without locking, so an in-flight dispatch keeps using the list it started with.
 * Interceptors run sequentially in registration order in both phases.
 *
 * @param <T> the interceptor capability
 */
public class InternalDispatcher<T extends DbInterceptor> {
    private final Class<T> interceptorType;

    private final Object lock = new Object();

    private volatile List<T> interceptors = Collections.emptyList();

    public InternalDispatcher(Class<T> interceptorType) {
        Assert.notNull(interceptorType, "interceptorType is null");
        this.interceptorType = interceptorType;
    }

    public Class<T> getInterceptorType() {
        return interceptorType;
    }

    /**
     * Register the interceptor if it implements this dispatcher's capability.
     *
     * @param interceptor the interceptor
     * @return true if it was registered
     */
    public boolean add(DbInterceptor interceptor) {
        Assert.notNull(interceptor, "interceptor is null");
        if (!interceptorType.isInstance(interceptor)) {
            return false;
        }
        synchronized (lock) {
            List<T> copy = new ArrayList<>(interceptors);
            copy.add(interceptorType.cast(interceptor));
            interceptors = Collections.unmodifiableList(copy);
        }
        return true;
    }

    /**
     * Unregister the first registration of the interceptor. No-op if it is not registered.
     *
     * @param interceptor the interceptor
     * @return true if it was removed
     */
    public boolean remove(DbInterceptor interceptor) {
        Assert.notNull(interceptor, "interceptor is null");
        if (!interceptorType.isInstance(interceptor)) {
            return false;
        }
        synchronized (lock) {
            List<T> copy = new ArrayList<>(interceptors);
            if (!copy.remove(interceptorType.cast(interceptor))) {
                return false;
            }
            interceptors = Collections.unmodifiableList(copy);
        }
        return true;
    }

    public List<T> getInterceptors() {
        return interceptors;
    }

    public boolean isEmpty() {
        return interceptors.isEmpty();
    }

    public void dispatch(Consumer<T> action) {
        for (T interceptor : interceptors) {
            action.accept(interceptor);
        }
    }

    /**
     * Fold the interceptors into a value, in registration order.
     */
    public <R> R dispatch(R seed, BiFunction<R, T, R> accumulator) {
        R result = seed;
        for (T interceptor : interceptors) {
            result = accumulator.apply(result, interceptor);
        }
        return result;
    }

    /**
     * Run an operation surrounded by the executing and executed hooks of every interceptor.
     * Without interceptors the operation is simply invoked. Otherwise the operation runs
     * unless an executing hook suppressed it, the executed hooks run whether it succeeded or
     * failed, and the outcome left on the context is returned or thrown.
     *
     * @param operation the operation
     * @param context the context shared by the interceptors
     * @param executing the executing hook
     * @param executed the executed hook
     * @param <R> result type
     * @param <C> context type
     * @return the result on the context
     * @throws SQLException if the context holds an SQLException after the executed hooks
     */
    public <R, C extends MutableInterceptionContext<R>> R dispatch(SqlCallable<R> operation,
                                                                   C context,
                                                                   BiConsumer<T, C> executing,
                                                                   BiConsumer<T, C> executed)
            throws SQLException {
        Assert.notNull(operation, "operation is null");
        Assert.notNull(context, "context is null");

        List<T> snapshot = interceptors;
        if (snapshot.isEmpty()) {
            return operation.call();
        }

        for (T interceptor : snapshot) {
            executing.accept(interceptor, context);
        }

        InterceptionContextMutableData<R> mutableData = context.getMutableData();
        if (!mutableData.isExecutionSuppressed()) {
            try {
                mutableData.setExecuted(operation.call());
            } catch (SQLException | RuntimeException ex) {
                mutableData.setExceptionThrown(ex);
            }
        }

        for (T interceptor : snapshot) {
            executed.accept(interceptor, context);
        }

        if (mutableData.getException() != null) {
            throw ExceptionUtils.<RuntimeException>rethrow(mutableData.getException());
        }
        return mutableData.getResult();
    }

    /**
     * Asynchronous variant of {@link #dispatch(SqlCallable, MutableInterceptionContext,
     * BiConsumer, BiConsumer)}. The executed hooks run once when the operation's future
     * completes, whether it succeeded, failed or was cancelled. The returned future fails with
     * the exception left on the context, is cancelled if the operation was cancelled and no
     * exception was set, and otherwise completes with the result on the context.
     */
    public <R, C extends MutableInterceptionContext<R>> CompletableFuture<R> dispatchAsync(
            AsyncSqlCallable<R> operation,
            C context,
            BiConsumer<T, C> executing,
            BiConsumer<T, C> executed) {
        Assert.notNull(operation, "operation is null");
        Assert.notNull(context, "context is null");

        List<T> snapshot = interceptors;
        if (snapshot.isEmpty()) {
            return start(operation);
        }

        try {
            for (T interceptor : snapshot) {
                executing.accept(interceptor, context);
            }
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }

        final InterceptionContextMutableData<R> mutableData = context.getMutableData();
        final boolean suppressed = mutableData.isExecutionSuppressed();

        CompletableFuture<R> future = suppressed
                ? CompletableFuture.completedFuture(mutableData.getResult())
                : start(operation);

        CompletableFuture<R> result = new CompletableFuture<>();

        future.whenComplete((value, failure) -> {
            Throwable ex = failure != null ? ExceptionUtils.unwrapCompletionException(failure) : null;
            boolean cancelled = ex instanceof CancellationException;

            if (ex == null) {
                if (!suppressed) {
                    mutableData.setTaskStatus(TaskStatus.RAN_TO_COMPLETION);
                    mutableData.setExecuted(value);
                } else {
                    mutableData.setTaskStatus(mutableData.getException() != null
                            ? TaskStatus.FAULTED : TaskStatus.RAN_TO_COMPLETION);
                }
            } else if (cancelled) {
                mutableData.setTaskStatus(TaskStatus.CANCELED);
                mutableData.setExecuted(null);
            } else {
                mutableData.setTaskStatus(TaskStatus.FAULTED);
                mutableData.setExceptionThrown(ex);
            }

            try {
                for (T interceptor : snapshot) {
                    executed.accept(interceptor, context);
                }
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
                return;
            }

            if (mutableData.getException() != null) {
                result.completeExceptionally(mutableData.getException());
            } else if (cancelled) {
                result.cancel(false);
            } else {
                result.complete(mutableData.getResult());
            }
        });

        return result;
    }

    private static <R> CompletableFuture<R> start(AsyncSqlCallable<R> operation) {
        try {
            CompletionStage<R> stage = operation.start();
            Assert.state(stage != null, "Asynchronous operation returned no completion stage");
            return stage.toCompletableFuture();
        } catch (SQLException | RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    @Override
    public String toString() {
        return "InternalDispatcher{" +
                "interceptorType=" + interceptorType.getSimpleName() +
                ", interceptors=" + interceptors.size() +
                '}';
    }
}
