/**
 * Deterministic time for scheduler tests.
 *
 * @author BatchQueue Team
 * @since 1.0.0
 */
package com.ryuqq.batchqueue.testkit.time;
