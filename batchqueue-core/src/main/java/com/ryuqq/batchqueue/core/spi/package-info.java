/**
 * Service Provider Interfaces.
 *
 * <ul>
 *   <li>{@link com.ryuqq.batchqueue.core.spi.RecordStore} - backing store for records and selection</li>
 *   <li>{@link com.ryuqq.batchqueue.core.spi.BatchExecutor} - strategy that executes drained batches</li>
 *   <li>{@link com.ryuqq.batchqueue.core.spi.BatchTimer} - injectable timer/clock</li>
 * </ul>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
package com.ryuqq.batchqueue.core.spi;
