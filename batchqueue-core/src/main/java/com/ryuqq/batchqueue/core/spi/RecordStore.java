package com.ryuqq.batchqueue.core.spi;

import com.ryuqq.batchqueue.core.model.RecordFields;
import com.ryuqq.batchqueue.core.model.StoredRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Backing store SPI for records and the ordered selection.
 *
 * <p>The store is accessed exclusively by the batch executor. Its own invariants
 * (selection references existing records only, no duplicate ids in the selection)
 * are upheld by the executor's handlers, which validate before mutating.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: read batches and write batches may run on different threads</li>
 *   <li>Near O(1) lookups by id</li>
 *   <li>{@link #getAll()} returns records in a stable order so pagination is deterministic</li>
 *   <li>Returned collections are snapshots or unmodifiable views; callers never mutate them</li>
 * </ul>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public interface RecordStore {

    /**
     * Checks whether a record with the given id exists.
     *
     * @param id the record id
     * @return true if present
     */
    boolean exists(long id);

    /**
     * Looks up a single record.
     *
     * @param id the record id
     * @return the record, or empty if absent
     */
    Optional<StoredRecord> getById(long id);

    /**
     * Looks up several records, preserving the requested order and silently skipping absent ids.
     *
     * @param ids the record ids
     * @return records found
     * @throws IllegalArgumentException if ids is null
     */
    List<StoredRecord> getByIds(Collection<Long> ids);

    /**
     * Returns every record in stable (insertion) order.
     *
     * @return unmodifiable list of all records
     */
    List<StoredRecord> getAll();

    /**
     * Returns the current selection order.
     *
     * @return snapshot of the selected ids
     */
    List<Long> getSelectionOrder();

    /**
     * Appends ids that are not yet selected.
     *
     * <p>Duplicates inside the request are collapsed. Existence of the ids is the caller's concern.</p>
     *
     * @param ids ids to select
     * @return newly added ids and ids that were already selected
     * @throws IllegalArgumentException if ids is null
     */
    SelectionAddition addToSelection(List<Long> ids);

    /**
     * Replaces the selection order.
     *
     * <p>The caller guarantees the new order is a permutation of the current selection.</p>
     *
     * @param ids the new order
     * @throws IllegalArgumentException if ids is null
     */
    void setSelectionOrder(List<Long> ids);

    /**
     * Removes every matching id from the selection.
     *
     * @param ids ids to deselect
     * @return number of ids actually removed
     * @throws IllegalArgumentException if ids is null
     */
    int removeFromSelection(Collection<Long> ids);

    /**
     * Creates a record.
     *
     * <p>When {@code candidateId} is null the store allocates the next unused id
     * (greater than every id seen so far).</p>
     *
     * @param candidateId the requested id, or null
     * @param fields the record fields
     * @return the stored record with its generation timestamp
     * @throws IllegalArgumentException if fields is null
     * @throws com.ryuqq.batchqueue.core.error.ConflictException if candidateId is already taken
     * @throws com.ryuqq.batchqueue.core.error.ValidationException if no id is left to allocate
     */
    StoredRecord create(Long candidateId, RecordFields fields);

    /**
     * Returns the number of stored records.
     *
     * @return record count
     */
    int size();
}
