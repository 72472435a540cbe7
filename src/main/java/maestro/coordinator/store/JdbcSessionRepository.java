package maestro.coordinator.store;

import maestro.coordinator.model.Session;
import maestro.coordinator.model.SessionStatus;
import maestro.coordinator.repository.SessionRepository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * SessionRepository backed by the {@link RecordStore}.
 */
public class JdbcSessionRepository implements SessionRepository {

    private static final Comparator<Session> MOST_RECENT_FIRST = Comparator
            .comparing(Session::startedAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()))
            .thenComparing(Session::id);

    private final RecordStore store;

    public JdbcSessionRepository(RecordStore store) {
        this.store = store;
    }

    @Override
    public void save(Session session) {
        store.commit(RecordBatch.create().session(session));
    }

    @Override
    public Optional<Session> findById(String sessionId) {
        return store.find(RecordKind.SESSION, sessionId, Session.class);
    }

    @Override
    public List<Session> findAll() {
        return filter(s -> true);
    }

    @Override
    public List<Session> findByProjectId(String projectId) {
        return filter(s -> s.projectId().equals(projectId));
    }

    @Override
    public List<Session> findByStatus(SessionStatus status) {
        return filter(s -> s.status() == status);
    }

    @Override
    public List<Session> findByTaskId(String taskId) {
        return filter(s -> s.hasTask(taskId));
    }

    @Override
    public int count() {
        return store.count(RecordKind.SESSION);
    }

    @Override
    public boolean delete(String sessionId) {
        if (findById(sessionId).isEmpty()) {
            return false;
        }
        store.commit(RecordBatch.create().delete(RecordKind.SESSION, sessionId));
        return true;
    }

    private List<Session> filter(Predicate<Session> predicate) {
        return store.list(RecordKind.SESSION, Session.class).stream()
                .filter(predicate)
                .sorted(MOST_RECENT_FIRST)
                .collect(Collectors.toList());
    }
}
