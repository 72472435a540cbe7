package maestro.coordinator.store;

import maestro.coordinator.model.Ordering;
import maestro.coordinator.model.OrderingEntity;
import maestro.coordinator.repository.OrderingRepository;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * OrderingRepository backed by the {@link RecordStore}, one record per project and entity kind.
 */
public class JdbcOrderingRepository implements OrderingRepository {

    private final RecordStore store;

    public JdbcOrderingRepository(RecordStore store) {
        this.store = store;
    }

    @Override
    public void save(Ordering ordering) {
        store.commit(RecordBatch.create().ordering(ordering));
    }

    @Override
    public Optional<Ordering> find(String projectId, OrderingEntity entityType) {
        return store.find(RecordKind.ORDERING, Ordering.key(projectId, entityType), Ordering.class);
    }

    @Override
    public List<Ordering> findByProjectId(String projectId) {
        return store.list(RecordKind.ORDERING, Ordering.class).stream()
                .filter(ordering -> ordering.projectId().equals(projectId))
                .collect(Collectors.toList());
    }
}
