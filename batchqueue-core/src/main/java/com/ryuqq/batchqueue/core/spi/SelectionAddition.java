package com.ryuqq.batchqueue.core.spi;

import java.util.List;

/**
 * Outcome of {@link RecordStore#addToSelection(List)}.
 *
 * @param added ids appended to the selection, in request order
 * @param alreadyPresent ids that were selected before the call
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
public record SelectionAddition(List<Long> added, List<Long> alreadyPresent) {

    public SelectionAddition {
        added = List.copyOf(added);
        alreadyPresent = List.copyOf(alreadyPresent);
    }
}
