package io.entityjdbc.intercept;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import io.entityjdbc.util.Assert;

/**
 * Base class of immutable interception contexts. A context carries the sessions an event is
 * associated with and whether the event belongs to an asynchronous call. The {@code with}
 * methods return modified copies of the concrete context type and leave this instance
 * unchanged. Every copy drops sessions that have been closed in the meantime.
 *
 * @param <C> the concrete context type
 */
public abstract class AbstractInterceptionContext<C extends AbstractInterceptionContext<C>> {
    private final List<Session> sessions;

    private final boolean async;

    protected AbstractInterceptionContext() {
        this.sessions = Collections.emptyList();
        this.async = false;
    }

    protected AbstractInterceptionContext(AbstractInterceptionContext<?> copyFrom) {
        this(copyFrom.sessions, copyFrom.async);
    }

    protected AbstractInterceptionContext(Collection<? extends Session> sessions, boolean async) {
        Assert.notNull(sessions, "sessions is null");
        this.sessions = openSessions(sessions);
        this.async = async;
    }

    static List<Session> openSessions(Collection<? extends Session> sessions) {
        List<Session> result = new ArrayList<>(sessions.size());
        for (Session session : sessions) {
            if (!session.isClosed() && !containsIdentity(result, session)) {
                result.add(session);
            }
        }
        return Collections.unmodifiableList(result);
    }

    private static boolean containsIdentity(List<Session> sessions, Session session) {
        for (Session s : sessions) {
            if (s == session) {
                return true;
            }
        }
        return false;
    }

    /**
     * @return associated sessions in order of association, excluding closed ones
     */
    public List<Session> getSessions() {
        List<Session> open = new ArrayList<>(sessions.size());
        for (Session session : sessions) {
            if (!session.isClosed()) {
                open.add(session);
            }
        }
        return Collections.unmodifiableList(open);
    }

    public boolean hasSession(Session session) {
        return session != null && !session.isClosed() && containsIdentity(sessions, session);
    }

    public boolean isAsync() {
        return async;
    }

    public C withSession(Session session) {
        Assert.notNull(session, "session is null");
        List<Session> union = new ArrayList<>(sessions);
        union.add(session);
        return copy(union, async);
    }

    public C asAsync() {
        return copy(sessions, true);
    }

    /**
     * Create a copy of the concrete context with the given sessions and async flag, retaining
     * all other state of this context.
     */
    protected abstract C copy(Collection<? extends Session> sessions, boolean async);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "sessions=" + sessions.size() +
                ", async=" + async +
                '}';
    }
}
