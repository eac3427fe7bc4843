package io.entityjdbc.intercept;

import java.util.HashMap;
import java.util.Map;

import io.entityjdbc.util.Assert;

/**
 * The mutable part of a result-carrying interception context, shared by all interceptors of
 * one dispatched operation. Setting a result or an exception before the operation executed
 * suppresses its execution.
 *
 * <p>Instances are confined to a single dispatch. Interceptors run sequentially, so no
 * synchronization is needed.
 *
 * @param <R> the operation result type
 */
public class InterceptionContextMutableData<R> {
    private boolean executed;

    private boolean executionSuppressed;

    private R originalResult;

    private R result;

    private Throwable originalException;

    private Throwable exception;

    private TaskStatus taskStatus;

    private Object userState;

    private Map<String, Object> userStates;

    public boolean isExecuted() {
        return executed;
    }

    public boolean isExecutionSuppressed() {
        return executionSuppressed;
    }

    /**
     * Prevent the operation from executing.
     *
     * @throws IllegalStateException if the operation already executed
     */
    public void suppressExecution() {
        if (!executionSuppressed && executed) {
            throw new IllegalStateException("Execution cannot be suppressed after the operation has executed");
        }
        executionSuppressed = true;
    }

    public R getOriginalResult() {
        return originalResult;
    }

    public R getResult() {
        return result;
    }

    public void setResult(R result) {
        if (!executed) {
            suppressExecution();
        }
        this.result = result;
    }

    public Throwable getOriginalException() {
        return originalException;
    }

    public Throwable getException() {
        return exception;
    }

    public void setException(Throwable exception) {
        if (!executed) {
            suppressExecution();
        }
        this.exception = exception;
    }

    public TaskStatus getTaskStatus() {
        return taskStatus;
    }

    public void setTaskStatus(TaskStatus taskStatus) {
        this.taskStatus = taskStatus;
    }

    public Object getUserState() {
        return userState;
    }

    public void setUserState(Object userState) {
        this.userState = userState;
    }

    /**
     * @param key the key the state was stored under
     * @return the state, or null if none was stored under the key
     */
    public Object findUserState(String key) {
        Assert.notNull(key, "key is null");
        return userStates != null ? userStates.get(key) : null;
    }

    /**
     * Store state under a key, so that several interceptors of one operation can keep their
     * own state without overwriting each other's.
     */
    public void setUserState(String key, Object value) {
        Assert.notNull(key, "key is null");
        if (userStates == null) {
            userStates = new HashMap<>();
        }
        userStates.put(key, value);
    }

    /**
     * Record the result of the executed operation.
     */
    public void setExecuted(R result) {
        this.executed = true;
        this.result = result;
        this.originalResult = result;
    }

    /**
     * Record the exception thrown by the executed operation.
     */
    public void setExceptionThrown(Throwable exception) {
        this.executed = true;
        this.exception = exception;
        this.originalException = exception;
    }

    @Override
    public String toString() {
        return "InterceptionContextMutableData{" +
                "executed=" + executed +
                ", executionSuppressed=" + executionSuppressed +
                ", result=" + result +
                ", exception=" + exception +
                ", taskStatus=" + taskStatus +
                '}';
    }
}
