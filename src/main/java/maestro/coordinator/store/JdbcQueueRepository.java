package maestro.coordinator.store;

import maestro.coordinator.model.WorkQueue;
import maestro.coordinator.repository.QueueRepository;

import java.util.List;
import java.util.Optional;

/**
 * QueueRepository backed by the {@link RecordStore}.
 */
public class JdbcQueueRepository implements QueueRepository {

    private final RecordStore store;

    public JdbcQueueRepository(RecordStore store) {
        this.store = store;
    }

    @Override
    public void save(WorkQueue queue) {
        store.commit(RecordBatch.create().queue(queue));
    }

    @Override
    public Optional<WorkQueue> findBySessionId(String sessionId) {
        return store.find(RecordKind.QUEUE, sessionId, WorkQueue.class);
    }

    @Override
    public List<WorkQueue> findAll() {
        return store.list(RecordKind.QUEUE, WorkQueue.class);
    }

    @Override
    public boolean delete(String sessionId) {
        if (findBySessionId(sessionId).isEmpty()) {
            return false;
        }
        store.commit(RecordBatch.create().delete(RecordKind.QUEUE, sessionId));
        return true;
    }
}
