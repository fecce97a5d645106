package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.error.LockLostException;
import com.ryuqq.pipeline.core.model.LockRecord;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Advisory lock SPI guarding one resource path across threads and processes.
 *
 * <p>A resource is the file the lock protects; implementations keep the lock record
 * next to it. At most one holder owns a resource at a time. A holder that stops
 * heartbeating becomes stale and may be taken over.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>Never overwrite a valid (non-stale) lock held by someone else</li>
 *   <li>An interrupted or timed-out acquisition leaves no partial record</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * if (lockManager.acquire(resource, holderId, 5000).isGranted()) {
 *     try {
 *         // read-modify-write
 *         lockManager.assertHeld(resource, holderId);
 *         // commit
 *     } finally {
 *         lockManager.release(resource, holderId);
 *     }
 * }
 * </pre>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public interface LockManager extends AutoCloseable {

    /**
     * Acquires the lock, waiting up to {@code timeoutMs}.
     *
     * @param resource the protected resource path
     * @param holderId unique identity of the caller
     * @param timeoutMs maximum wait in milliseconds
     * @return GRANTED or TIMED_OUT
     * @throws com.ryuqq.pipeline.core.error.LockAcquisitionException if the wait is interrupted
     *         or the lock file cannot be written
     */
    LockAcquisition acquire(Path resource, String holderId, long timeoutMs);

    /**
     * Releases the lock if {@code holderId} owns it.
     *
     * @return RELEASED, or NOT_HOLDER when another holder owns it or no lock exists
     */
    LockRelease release(Path resource, String holderId);

    /**
     * Refreshes the heartbeat of a held lock.
     *
     * @throws LockLostException if the record is gone or owned by someone else
     */
    void renew(Path resource, String holderId);

    /**
     * Whether the current lock record's heartbeat is older than the timeout.
     *
     * @return false when no lock exists
     */
    boolean isStale(Path resource);

    /**
     * Reads the current lock record.
     */
    Optional<LockRecord> inspect(Path resource);

    /**
     * Verifies the caller still owns the lock, immediately before committing.
     *
     * @throws LockLostException if the heartbeat recorded a loss or the record names someone else
     */
    void assertHeld(Path resource, String holderId);

    /**
     * Lists resources whose lock records are stale.
     *
     * @param limit maximum number of resources to return
     * @return resource paths, at most {@code limit}
     */
    List<Path> findStaleLocks(int limit);

    /**
     * Removes a stale lock record under the takeover guard.
     *
     * @return true if a stale record was removed
     */
    boolean breakStaleLock(Path resource);

    /**
     * Stops heartbeats and releases every lock held through this instance.
     */
    @Override
    void close();
}
