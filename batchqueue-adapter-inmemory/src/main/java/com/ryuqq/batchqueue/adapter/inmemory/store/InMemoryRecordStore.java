package com.ryuqq.batchqueue.adapter.inmemory.store;

import com.ryuqq.batchqueue.core.error.ConflictException;
import com.ryuqq.batchqueue.core.error.ValidationException;
import com.ryuqq.batchqueue.core.model.RecordFields;
import com.ryuqq.batchqueue.core.model.StoredRecord;
import com.ryuqq.batchqueue.core.spi.RecordStore;
import com.ryuqq.batchqueue.core.spi.SelectionAddition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;

/**
 * In-memory implementation of {@link RecordStore} SPI.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>recordsById:</strong> ConcurrentHashMap&lt;Long, StoredRecord&gt; - O(1) lookup by id</li>
 *   <li><strong>recordsInOrder:</strong> CopyOnWriteArrayList&lt;StoredRecord&gt; - insertion order for paging</li>
 *   <li><strong>selectionOrder / selectionSet:</strong> ordered selection plus membership index,
 *       guarded by the instance monitor</li>
 * </ul>
 *
 * <p><strong>Concurrency:</strong> READ and WRITE batches run on different timer threads, so reads may
 * observe the store while a write batch mutates it. Records are append-only, which keeps
 * {@link #getAll()} views valid while a create is in flight. Selection reads return snapshots.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Creates copy the ordered record array</li>
 * </ul>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public class InMemoryRecordStore implements RecordStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRecordStore.class);

    /**
     * Upper bound of the random age given to seeded records (about 115 days).
     */
    private static final long MAX_SEED_AGE_MILLIS = 10_000_000_000L;

    private final ConcurrentHashMap<Long, StoredRecord> recordsById;
    private final CopyOnWriteArrayList<StoredRecord> recordsInOrder;
    private final List<Long> selectionOrder;
    private final Set<Long> selectionSet;
    private final Clock clock;
    private long maxId;

    /**
     * Creates an empty store.
     */
    public InMemoryRecordStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates an empty store with the given clock for createdAt timestamps.
     *
     * @param clock clock used for new records
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryRecordStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.recordsById = new ConcurrentHashMap<>();
        this.recordsInOrder = new CopyOnWriteArrayList<>();
        this.selectionOrder = new ArrayList<>();
        this.selectionSet = new HashSet<>();
        this.clock = clock;
        this.maxId = 0L;
    }

    /**
     * Creates a store seeded with {@code count} generated records (ids 1..count).
     *
     * <p>Record N is named {@code "Item N"}, described as {@code "Description for item N"} and
     * belongs to {@code "Category ((N-1)/10 + 1)"}. createdAt is a random instant in the past.</p>
     *
     * @param count number of records to generate
     * @return seeded store
     * @throws IllegalArgumentException if count is negative
     */
    public static InMemoryRecordStore seeded(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0 (current: " + count + ")");
        }
        InMemoryRecordStore store = new InMemoryRecordStore();
        long now = store.clock.millis();
        ThreadLocalRandom random = ThreadLocalRandom.current();

        List<StoredRecord> generated = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            long id = i + 1L;
            generated.add(new StoredRecord(
                id,
                "Item " + id,
                "Description for item " + id,
                "Category " + (i / 10 + 1),
                Instant.ofEpochMilli(now - random.nextLong(MAX_SEED_AGE_MILLIS))
            ));
        }
        store.loadAll(generated);
        log.info("Seeded {} records", count);
        return store;
    }

    private synchronized void loadAll(List<StoredRecord> records) {
        for (StoredRecord record : records) {
            recordsById.put(record.id(), record);
            maxId = Math.max(maxId, record.id());
        }
        recordsInOrder.addAll(records);
    }

    @Override
    public boolean exists(long id) {
        return recordsById.containsKey(id);
    }

    @Override
    public Optional<StoredRecord> getById(long id) {
        return Optional.ofNullable(recordsById.get(id));
    }

    @Override
    public List<StoredRecord> getByIds(Collection<Long> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        List<StoredRecord> found = new ArrayList<>(ids.size());
        for (Long id : ids) {
            StoredRecord record = recordsById.get(id);
            if (record != null) {
                found.add(record);
            }
        }
        return found;
    }

    @Override
    public List<StoredRecord> getAll() {
        return Collections.unmodifiableList(recordsInOrder);
    }

    @Override
    public synchronized List<Long> getSelectionOrder() {
        return List.copyOf(selectionOrder);
    }

    @Override
    public synchronized SelectionAddition addToSelection(List<Long> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        List<Long> added = new ArrayList<>();
        List<Long> alreadyPresent = new ArrayList<>();
        for (Long id : ids) {
            if (selectionSet.add(id)) {
                selectionOrder.add(id);
                added.add(id);
            } else {
                alreadyPresent.add(id);
            }
        }
        return new SelectionAddition(added, alreadyPresent);
    }

    @Override
    public synchronized void setSelectionOrder(List<Long> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        Set<Long> replacement = new HashSet<>(ids);
        if (replacement.size() != ids.size()) {
            throw new IllegalArgumentException("selection order cannot contain duplicates: " + ids);
        }
        selectionOrder.clear();
        selectionOrder.addAll(ids);
        selectionSet.clear();
        selectionSet.addAll(replacement);
    }

    @Override
    public synchronized int removeFromSelection(Collection<Long> ids) {
        if (ids == null) {
            throw new IllegalArgumentException("ids cannot be null");
        }
        int removed = 0;
        for (Long id : new HashSet<>(ids)) {
            if (selectionSet.remove(id)) {
                selectionOrder.remove(id);
                removed++;
            }
        }
        return removed;
    }

    /**
     * Stores a new record.
     *
     * <p>Without a candidate id the next id is {@code max(existing ids) + 1}, seeded ids included.
     * Once {@link Long#MAX_VALUE} is taken no id is left to allocate.</p>
     *
     * @throws ConflictException if the candidate id is already taken
     * @throws ValidationException if no candidate id is given and the id space is exhausted
     */
    @Override
    public synchronized StoredRecord create(Long candidateId, RecordFields fields) {
        if (fields == null) {
            throw new IllegalArgumentException("fields cannot be null");
        }
        long id = candidateId != null ? candidateId : nextId();
        StoredRecord record = StoredRecord.of(id, fields, clock.instant());

        if (recordsById.putIfAbsent(id, record) != null) {
            throw new ConflictException(id);
        }
        recordsInOrder.add(record);
        maxId = Math.max(maxId, id);
        return record;
    }

    private long nextId() {
        try {
            return Math.addExact(maxId, 1L);
        } catch (ArithmeticException e) {
            throw new ValidationException("Invalid input", "no record id available after " + maxId, e);
        }
    }

    @Override
    public int size() {
        return recordsById.size();
    }

    /**
     * Removes all records and the selection. Used by tests.
     */
    public synchronized void clear() {
        recordsById.clear();
        recordsInOrder.clear();
        selectionOrder.clear();
        selectionSet.clear();
        maxId = 0L;
    }
}
