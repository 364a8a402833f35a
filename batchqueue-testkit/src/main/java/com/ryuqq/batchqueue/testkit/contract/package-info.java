/**
 * Contract tests every {@link com.ryuqq.batchqueue.application.queue.RequestQueue} implementation must pass.
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
package com.ryuqq.batchqueue.testkit.contract;
