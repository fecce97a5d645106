/**
 * File-based advisory lock adapter.
 *
 * <p>{@link com.ryuqq.pipeline.adapter.file.lock.FileLockManager} implements the
 * {@link com.ryuqq.pipeline.core.spi.LockManager} SPI with one {@code <resource>.lock} file per
 * resource. The lock file holds a JSON {@link com.ryuqq.pipeline.core.model.LockRecord}.</p>
 *
 * <h2>Files</h2>
 * <ul>
 *   <li><strong>{@code .lock}:</strong> created atomically (temp file + hard link, or CREATE_NEW)</li>
 *   <li><strong>{@code .lock.steal}:</strong> short-lived guard serializing takeover and heartbeat rewrites</li>
 *   <li><strong>{@code .lock.release}:</strong> cooperative release request written by a waiting process</li>
 * </ul>
 *
 * <h2>Liveness</h2>
 *
 * <p>Holders refresh {@code lastHeartbeat} on a daemon scheduler. A record whose heartbeat is older
 * than the heartbeat timeout is stale and may be taken over; every takeover increments the
 * generation so a previous holder detects the loss before committing.</p>
 *
 * <h2>Limitations</h2>
 * <ul>
 *   <li>Staleness compares wall clocks of different processes</li>
 *   <li>Locks are advisory: processes that bypass the manager are not excluded</li>
 * </ul>
 *
 * @see com.ryuqq.pipeline.core.spi.LockManager
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.file.lock;
