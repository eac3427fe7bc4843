package io.entityjdbc.retry;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

import io.entityjdbc.util.Assert;

/**
 * Thread-bound marker of a user-initiated transaction. Retrying execution strategies refuse
 * to start while a scope is open, since a retry must own the transaction boundary.
 *
 * <p>Scopes nest and must be closed in reverse order of creation:
 * <pre>
 * try (TransactionScope scope = TransactionScope.begin("transfer")) {
 *     ...
 * }
 * </pre>
 */
public final class TransactionScope implements AutoCloseable {
    private static final ThreadLocal<Deque<TransactionScope>> ACTIVE_SCOPES
            = ThreadLocal.withInitial(ArrayDeque::new);

    public static TransactionScope begin() {
        return begin("transaction");
    }

    public static TransactionScope begin(String name) {
        Assert.hasText(name, "name is empty");
        TransactionScope scope = new TransactionScope(name, Thread.currentThread());
        ACTIVE_SCOPES.get().push(scope);
        return scope;
    }

    public static boolean isActive() {
        return !ACTIVE_SCOPES.get().isEmpty();
    }

    public static Optional<TransactionScope> current() {
        return Optional.ofNullable(ACTIVE_SCOPES.get().peek());
    }

    private final String name;

    private final Thread owner;

    private boolean closed;

    private TransactionScope(String name, Thread owner) {
        this.name = name;
        this.owner = owner;
    }

    public String getName() {
        return name;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        Assert.state(Thread.currentThread() == owner,
                "Transaction scope [" + name + "] must be closed by the thread that opened it");
        Deque<TransactionScope> scopes = ACTIVE_SCOPES.get();
        Assert.state(scopes.peek() == this,
                "Transaction scope [" + name + "] closed out of order");
        scopes.pop();
        if (scopes.isEmpty()) {
            ACTIVE_SCOPES.remove();
        }
        closed = true;
    }

    @Override
    public String toString() {
        return "TransactionScope{" +
                "name='" + name + '\'' +
                ", closed=" + closed +
                '}';
    }
}
