package maestro.coordinator.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import maestro.coordinator.error.StorageException;
import maestro.coordinator.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Durable record storage per {@link RecordKind} with an in-memory mirror.
 * <p>
 * Reads are served from the mirror. {@link #commit} writes a batch to the
 * database in a single transaction and only then applies it to the mirror
 * under the write guard, so readers see either none or all of a batch.
 * A failed transaction leaves the mirror untouched.
 * <p>
 * The store does not serialize writers of the same record; services hold
 * per-entity locks around their read-modify-commit sequences.
 */
public final class RecordStore {

    private static final Logger log = LoggerFactory.getLogger(RecordStore.class);

    private final Database db;
    private final ObjectMapper mapper = Jsons.mapper();
    private final Map<RecordKind, ConcurrentHashMap<String, Object>> mirror = new EnumMap<>(RecordKind.class);
    private final ReentrantReadWriteLock guard = new ReentrantReadWriteLock();

    public RecordStore(Database db) {
        this.db = db;
        for (RecordKind kind : RecordKind.values()) {
            mirror.put(kind, new ConcurrentHashMap<>());
        }
    }

    /**
     * Replace the mirror with the records currently in the database.
     * Rows whose body cannot be decoded are skipped and logged.
     */
    public void reload() {
        Map<RecordKind, Map<String, Object>> loaded = new EnumMap<>(RecordKind.class);
        for (RecordKind kind : RecordKind.values()) {
            loaded.put(kind, readKind(kind));
        }

        guard.writeLock().lock();
        try {
            loaded.forEach((kind, records) -> {
                ConcurrentHashMap<String, Object> target = mirror.get(kind);
                target.clear();
                target.putAll(records);
            });
        } finally {
            guard.writeLock().unlock();
        }
        log.info("Record store loaded: {} projects, {} tasks, {} sessions, {} queues, {} task lists",
                count(RecordKind.PROJECT), count(RecordKind.TASK),
                count(RecordKind.SESSION), count(RecordKind.QUEUE), count(RecordKind.TASK_LIST));
    }

    public <T> Optional<T> find(RecordKind kind, String id, Class<T> type) {
        if (id == null) {
            return Optional.empty();
        }
        guard.readLock().lock();
        try {
            return Optional.ofNullable(mirror.get(kind).get(id)).map(type::cast);
        } finally {
            guard.readLock().unlock();
        }
    }

    public <T> List<T> list(RecordKind kind, Class<T> type) {
        guard.readLock().lock();
        try {
            List<T> result = new ArrayList<>(mirror.get(kind).size());
            for (Object record : mirror.get(kind).values()) {
                result.add(type.cast(record));
            }
            return result;
        } finally {
            guard.readLock().unlock();
        }
    }

    public int count(RecordKind kind) {
        return mirror.get(kind).size();
    }

    /**
     * Run several reads against one consistent view; no batch is applied meanwhile.
     */
    public <T> T read(Supplier<T> reader) {
        guard.readLock().lock();
        try {
            return reader.get();
        } finally {
            guard.readLock().unlock();
        }
    }

    /**
     * Persist a batch atomically, then publish it to the mirror.
     *
     * @throws StorageException if the transaction fails
     */
    public void commit(RecordBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        List<RecordBatch.Op> ops = batch.ops();
        List<String> bodies = new ArrayList<>(ops.size());
        for (RecordBatch.Op op : ops) {
            bodies.add(op.isDelete() ? null : encode(op));
        }

        writeThrough(ops, bodies);

        guard.writeLock().lock();
        try {
            for (RecordBatch.Op op : ops) {
                if (op.isDelete()) {
                    mirror.get(op.kind()).remove(op.id());
                } else {
                    mirror.get(op.kind()).put(op.id(), op.record());
                }
            }
        } finally {
            guard.writeLock().unlock();
        }
        log.debug("Committed batch of {} record(s)", ops.size());
    }

    private void writeThrough(List<RecordBatch.Op> ops, List<String> bodies) {
        String upsert = """
                    MERGE INTO records (kind, id, body, updated_at)
                    KEY (kind, id)
                    VALUES (?, ?, ?, ?)
                """;
        String delete = "DELETE FROM records WHERE kind = ? AND id = ?";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement put = conn.prepareStatement(upsert);
                    PreparedStatement del = conn.prepareStatement(delete)) {
                Timestamp now = Timestamp.from(Instant.now());
                for (int i = 0; i < ops.size(); i++) {
                    RecordBatch.Op op = ops.get(i);
                    if (op.isDelete()) {
                        del.setString(1, op.kind().column());
                        del.setString(2, op.id());
                        del.executeUpdate();
                    } else {
                        put.setString(1, op.kind().column());
                        put.setString(2, op.id());
                        put.setString(3, bodies.get(i));
                        put.setTimestamp(4, now);
                        put.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            log.error("Failed to commit batch of {} record(s): {}", ops.size(), e.getMessage());
            throw new StorageException("Failed to persist records", e);
        }
    }

    private Map<String, Object> readKind(RecordKind kind) {
        String sql = "SELECT id, body FROM records WHERE kind = ?";
        Map<String, Object> records = new LinkedHashMap<>();

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, kind.column());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String id = rs.getString("id");
                    String body = rs.getString("body");
                    try {
                        records.put(id, mapper.readValue(body, kind.type()));
                    } catch (JsonProcessingException | RuntimeException e) {
                        log.error("Skipping unreadable {} record {}: {}", kind.column(), id, e.getMessage());
                    }
                }
            }
            conn.commit();
            return records;
        } catch (SQLException e) {
            throw new StorageException("Failed to load " + kind.column() + " records", e);
        }
    }

    private String encode(RecordBatch.Op op) {
        try {
            return mapper.writeValueAsString(op.record());
        } catch (JsonProcessingException e) {
            throw new StorageException("Failed to encode " + op.kind().column() + " " + op.id(), e);
        }
    }
}
