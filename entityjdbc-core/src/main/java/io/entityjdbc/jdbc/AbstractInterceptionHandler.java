package io.entityjdbc.jdbc;

import java.lang.reflect.InvocationHandler;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.sql.SQLException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.entityjdbc.intercept.Dispatchers;
import io.entityjdbc.util.Assert;
import io.entityjdbc.util.ExceptionUtils;

/**
 * Base class of invocation handlers routing JDBC calls of a delegate through the
 * interception dispatchers.
 *
 * @param <T> the JDBC type of the delegate
 */
public abstract class AbstractInterceptionHandler<T> implements InvocationHandler {
    protected final Logger logger = LoggerFactory.getLogger(getClass());

    private final T delegate;

    private final Dispatchers dispatchers;

    protected AbstractInterceptionHandler(T delegate, Dispatchers dispatchers) {
        Assert.notNull(delegate, "delegate is null");
        Assert.notNull(dispatchers, "dispatchers is null");
        this.delegate = delegate;
        this.dispatchers = dispatchers;
    }

    public T getDelegate() {
        return delegate;
    }

    public Dispatchers getDispatchers() {
        return dispatchers;
    }

    @Override
    public final Object invoke(Object proxy, Method method, Object[] args) throws Throwable {
        if (method.getDeclaringClass() == Object.class) {
            switch (method.getName()) {
                case "equals":
                    return proxy == args[0];
                case "hashCode":
                    return System.identityHashCode(proxy);
                case "toString":
                    return toString();
                default:
                    return proceed(method, args);
            }
        }
        return doInvoke(proxy, method, args == null ? new Object[0] : args);
    }

    protected abstract Object doInvoke(Object proxy, Method method, Object[] args) throws Throwable;

    /**
     * Invoke the method on the delegate, propagating the exception it threw.
     */
    protected final Object proceed(Method method, Object[] args) throws SQLException {
        try {
            return method.invoke(delegate, args);
        } catch (InvocationTargetException e) {
            throw ExceptionUtils.<RuntimeException>rethrow(e.getTargetException());
        } catch (IllegalAccessException e) {
            throw new IllegalStateException("Unable to invoke " + method.toGenericString(), e);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "delegate=" + delegate +
                '}';
    }
}
