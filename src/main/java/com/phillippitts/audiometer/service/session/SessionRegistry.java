package com.phillippitts.audiometer.service.session;

import com.phillippitts.audiometer.exception.SessionConflictException;
import com.phillippitts.audiometer.exception.SessionNotFoundException;
import com.phillippitts.audiometer.service.metrics.StreamMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide table of live sessions, keyed by client session id.
 *
 * <p>A session id is bound to the connection that initialized it. Lookups name both, so a
 * stale or foreign connection can never reach another connection's state.
 *
 * <p><b>Thread Safety:</b> backed by a {@link ConcurrentHashMap}; each operation is atomic
 * per session id. No lock spans more than one session.
 */
@Component
public class SessionRegistry {

    private static final Logger LOG = LogManager.getLogger(SessionRegistry.class);

    private final ConcurrentMap<String, AudioSession> sessions = new ConcurrentHashMap<>();

    public SessionRegistry(StreamMetrics metrics) {
        metrics.registerActiveSessions(this, SessionRegistry::size);
    }

    /**
     * Binds a session, replacing an earlier session of the same connection.
     *
     * @param session newly built session
     * @return the session it replaced, or null
     * @throws SessionConflictException if the id belongs to a different connection
     */
    public AudioSession register(AudioSession session) {
        Objects.requireNonNull(session, "session must not be null");
        AudioSession[] replaced = new AudioSession[1];
        sessions.compute(session.id(), (id, existing) -> {
            if (existing != null && !existing.connectionId().equals(session.connectionId())) {
                throw new SessionConflictException(id);
            }
            replaced[0] = existing;
            return session;
        });
        if (replaced[0] != null) {
            replaced[0].markClosed();
            LOG.debug("Session re-initialized: sampleRate={}, channels={}", session.sampleRate(), session.channels());
        } else {
            LOG.debug("Session registered: sampleRate={}, channels={}", session.sampleRate(), session.channels());
        }
        return replaced[0];
    }

    /**
     * @param sessionId    client session id
     * @param connectionId connection the message arrived on
     * @return the live session
     * @throws SessionNotFoundException if no session is bound to that id and connection
     */
    public AudioSession require(String sessionId, String connectionId) {
        AudioSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null || session.isClosed() || !session.connectionId().equals(connectionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    public Optional<AudioSession> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Unbinds the session if it belongs to the given connection. The returned session is
     * marked closed; further lookups fail.
     *
     * @return the removed session, or empty if none was bound to that connection
     */
    public Optional<AudioSession> remove(String sessionId, String connectionId) {
        if (sessionId == null) {
            return Optional.empty();
        }
        AudioSession[] removed = new AudioSession[1];
        sessions.computeIfPresent(sessionId, (id, existing) -> {
            if (existing.connectionId().equals(connectionId)) {
                removed[0] = existing;
                return null;
            }
            return existing;
        });
        if (removed[0] != null) {
            removed[0].markClosed();
        }
        return Optional.ofNullable(removed[0]);
    }

    /** @return snapshot of live sessions */
    public List<AudioSession> sessions() {
        return List.copyOf(sessions.values());
    }

    public int size() {
        return sessions.size();
    }
}
