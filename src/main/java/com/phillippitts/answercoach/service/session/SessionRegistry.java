package com.phillippitts.answercoach.service.session;

import com.phillippitts.answercoach.exception.SessionNotFoundException;
import com.phillippitts.answercoach.service.engine.CoverageSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Index of sessions by id. Holds no session state itself.
 *
 * <p>Finalized sessions stay queryable until more than {@code retainFinalized} later sessions were
 * finalized; the oldest are then dropped.
 */
public final class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final Map<UUID, CoverageSession> sessions = new ConcurrentHashMap<>();
    private final Deque<UUID> finalizedOrder = new ArrayDeque<>();
    private final int retainFinalized;

    public SessionRegistry(int retainFinalized) {
        if (retainFinalized < 0) {
            throw new IllegalArgumentException("retainFinalized must be >= 0");
        }
        this.retainFinalized = retainFinalized;
    }

    public void register(CoverageSession session) {
        Objects.requireNonNull(session, "session");
        if (sessions.putIfAbsent(session.getId(), session) != null) {
            throw new IllegalStateException("Session already registered: " + session.getId());
        }
    }

    /**
     * @throws SessionNotFoundException if no session has this id
     */
    public CoverageSession get(UUID id) {
        CoverageSession session = id == null ? null : sessions.get(id);
        if (session == null) {
            throw new SessionNotFoundException(id);
        }
        return session;
    }

    /**
     * Records that a session was finalized and evicts the oldest finalized ones beyond the limit.
     */
    public synchronized void markFinalized(UUID id) {
        finalizedOrder.addLast(id);
        while (finalizedOrder.size() > retainFinalized) {
            UUID evicted = finalizedOrder.removeFirst();
            sessions.remove(evicted);
            LOG.debug("Evicted finalized session {}", evicted);
        }
    }

    public int activeCount() {
        int n = 0;
        for (CoverageSession s : sessions.values()) {
            if (!s.isFinalized()) {
                n++;
            }
        }
        return n;
    }

    public Collection<CoverageSession> all() {
        return List.copyOf(sessions.values());
    }
}
