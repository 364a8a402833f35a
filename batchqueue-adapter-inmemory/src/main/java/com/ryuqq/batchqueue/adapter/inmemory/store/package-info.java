/**
 * In-memory {@link com.ryuqq.batchqueue.core.spi.RecordStore} implementation.
 *
 * <p>Used by the runner's default context and by the contract tests in batchqueue-testkit.</p>
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
package com.ryuqq.batchqueue.adapter.inmemory.store;
