package net.imagetools.repository;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import net.imagetools.model.Session;
import org.springframework.stereotype.Repository;

@Repository
public class SessionRepository {

    private final Map<String, Session> sessions = new ConcurrentHashMap<>();

    public Session save(Session session) {
        sessions.put(session.id(), session);
        return session;
    }

    public Optional<Session> findById(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * Atomically replaces a stored session, empty when it no longer exists.
     */
    public Optional<Session> update(String sessionId, UnaryOperator<Session> change) {
        return Optional.ofNullable(sessions.computeIfPresent(sessionId, (id, session) -> change.apply(session)));
    }

    public List<Session> findExpired(Instant now) {
        return sessions.values().stream()
            .filter(session -> session.isExpiredAt(now))
            .toList();
    }

    public boolean delete(String sessionId) {
        return sessions.remove(sessionId) != null;
    }

    public long count() {
        return sessions.size();
    }
}
