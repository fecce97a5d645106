package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.adapter.file.lock.FileLockManager;
import com.ryuqq.pipeline.application.coordinator.StateCoordinator;
import com.ryuqq.pipeline.core.error.ErrorCategory;
import com.ryuqq.pipeline.core.error.ErrorClassifier;
import com.ryuqq.pipeline.core.error.LockAcquisitionException;
import com.ryuqq.pipeline.core.error.ProjectNotFoundException;
import com.ryuqq.pipeline.core.error.RetryExhaustedException;
import com.ryuqq.pipeline.core.error.StorageException;
import com.ryuqq.pipeline.core.model.ProjectId;
import com.ryuqq.pipeline.core.model.SectionName;
import com.ryuqq.pipeline.core.statemachine.ProjectState;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: which failures the coordinator retries.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>lock contention is transient: retried until the policy gives up</li>
 *   <li>contention that clears within the retry window succeeds</li>
 *   <li>missing projects and corrupt files are fatal: raised on the first attempt</li>
 * </ul>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class RetryClassificationContractTest extends AbstractContractTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Test
    void testLockContention_RetriedThenExhausted() {
        // Given: another manager holds the info lock and never releases it
        ProjectId projectId = initializeProject("001");
        StateCoordinator impatient = newCoordinator(config.withLockTimeoutMs(50), transientAttempts(3));

        try (FileLockManager holder = new FileLockManager(config)) {
            Path resource = sectionFile(projectId, SectionName.INFO);
            assertTrue(holder.acquire(resource, "long-running-writer", 1_000).isGranted());

            // When/Then
            RetryExhaustedException exhausted = assertThrows(RetryExhaustedException.class,
                    () -> impatient.writeSection(projectId, SectionName.INFO, json("{\"a\":1}"), "blocked"));
            assertEquals(3, exhausted.getAttemptCount());
            assertInstanceOf(LockAcquisitionException.class, exhausted.getCause());
            assertEquals(ErrorCategory.TRANSIENT, classifier.classify(exhausted.getCause()));
            assertEquals(ErrorCategory.FATAL, classifier.classify(exhausted));
        }
    }

    @Test
    void testLockContention_ClearsWithinRetryWindow() throws Exception {
        // Given
        ProjectId projectId = initializeProject("002");
        StateCoordinator patient = newCoordinator(config.withLockTimeoutMs(100));
        FileLockManager holder = new FileLockManager(config);
        Path resource = sectionFile(projectId, SectionName.INFO);
        assertTrue(holder.acquire(resource, "short-writer", 1_000).isGranted());

        // When: the holder releases shortly after the write starts
        Thread releaser = new Thread(() -> {
            sleep(150);
            holder.close();
        });
        releaser.start();
        patient.writeSection(projectId, SectionName.INFO, json("{\"a\":1}"), "eventually");
        releaser.join(5_000);

        // Then
        assertEquals(1, patient.version(projectId, SectionName.INFO));
    }

    @Test
    void testMissingProject_FatalWithoutRetry() {
        ProjectId missing = ProjectId.of("missing");

        ProjectNotFoundException notFound = assertThrows(ProjectNotFoundException.class,
                () -> coordinator.transition(missing, ProjectState.CLARIFYING));

        assertEquals(ErrorCategory.FATAL, classifier.classify(notFound));
        assertFalse(notFound.isRetryable());
    }

    @Test
    void testCorruptSection_FatalWithoutRetry() throws IOException {
        // Given
        ProjectId projectId = initializeProject("003");
        Files.write(sectionFile(projectId, SectionName.DOCUMENTS), "{not json".getBytes(StandardCharsets.UTF_8));

        // When/Then
        StorageException corrupt = assertThrows(StorageException.class,
                () -> coordinator.version(projectId, SectionName.DOCUMENTS));
        assertTrue(corrupt.isCorrupt());
        assertEquals("STORE-002", corrupt.getErrorCode().code());
    }
}
