/**
 * Core domain model: actions, payloads, dedup keys and the pending-entry/batch types.
 *
 * <h2>Actions &amp; Payloads</h2>
 * <ul>
 *   <li>{@link com.ryuqq.batchqueue.core.model.Action} - six domain actions with their READ/WRITE class</li>
 *   <li>{@link com.ryuqq.batchqueue.core.model.PageQuery}, {@link com.ryuqq.batchqueue.core.model.SelectionQuery},
 *       {@link com.ryuqq.batchqueue.core.model.IdList}, {@link com.ryuqq.batchqueue.core.model.NewRecord} - payloads</li>
 *   <li>{@link com.ryuqq.batchqueue.core.model.DedupKeys} - deterministic dedup key derivation</li>
 * </ul>
 *
 * <h2>Scheduling Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.batchqueue.core.model.PendingEntry} - one logical request and its waiters</li>
 *   <li>{@link com.ryuqq.batchqueue.core.model.Waiter} - one caller and its future</li>
 *   <li>{@link com.ryuqq.batchqueue.core.model.Batch} - immutable drain snapshot</li>
 * </ul>
 *
 * @since 1.0.0
 * @author BatchQueue Team
 */
package com.ryuqq.batchqueue.core.model;
