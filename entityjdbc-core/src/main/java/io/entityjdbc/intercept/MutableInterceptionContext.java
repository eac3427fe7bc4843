package io.entityjdbc.intercept;

/**
 * Interception context carrying the outcome of a dispatched operation. Interceptors read the
 * outcome in their executed hooks and may replace it, or pre-set it in their executing hooks
 * to suppress the operation.
 *
 * @param <R> the operation result type
 */
public interface MutableInterceptionContext<R> {
    InterceptionContextMutableData<R> getMutableData();

    default boolean isExecuted() {
        return getMutableData().isExecuted();
    }

    default boolean isExecutionSuppressed() {
        return getMutableData().isExecutionSuppressed();
    }

    default void suppressExecution() {
        getMutableData().suppressExecution();
    }

    default R getOriginalResult() {
        return getMutableData().getOriginalResult();
    }

    default R getResult() {
        return getMutableData().getResult();
    }

    default void setResult(R result) {
        getMutableData().setResult(result);
    }

    default Throwable getOriginalException() {
        return getMutableData().getOriginalException();
    }

    default Throwable getException() {
        return getMutableData().getException();
    }

    default void setException(Throwable exception) {
        getMutableData().setException(exception);
    }

    /**
     * @return terminal state of the operation, or null for synchronous operations
     */
    default TaskStatus getTaskStatus() {
        return getMutableData().getTaskStatus();
    }

    default Object getUserState() {
        return getMutableData().getUserState();
    }

    default void setUserState(Object userState) {
        getMutableData().setUserState(userState);
    }

    default Object findUserState(String key) {
        return getMutableData().findUserState(key);
    }

    default void setUserState(String key, Object value) {
        getMutableData().setUserState(key, value);
    }
}
