package com.ryuqq.pipeline.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ProjectId Value Object 테스트.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
class ProjectIdTest {

    @Test
    void of_ValidValue_CreatesProjectId() {
        // When
        ProjectId projectId = ProjectId.of("001");

        // Then
        assertEquals("001", projectId.getValue());
        assertEquals("001", projectId.toString());
    }

    @Test
    void of_ValidValueWithHyphensAndUnderscores_CreatesProjectId() {
        // When
        ProjectId projectId = ProjectId.of("order_service-v2");

        // Then
        assertEquals("order_service-v2", projectId.getValue());
    }

    @Test
    void of_NullOrBlank_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> ProjectId.of(null));
        assertThrows(IllegalArgumentException.class, () -> ProjectId.of("  "));
    }

    @Test
    void of_PathTraversal_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ProjectId.of("../etc")
        );
        assertTrue(exception.getMessage().contains("invalid characters"));
    }

    @Test
    void of_TooLong_ThrowsException() {
        // Given
        String value = "a".repeat(256);

        // When & Then
        assertThrows(IllegalArgumentException.class, () -> ProjectId.of(value));
        assertDoesNotThrow(() -> ProjectId.of("a".repeat(255)));
    }

    @Test
    void equals_SameValue_AreEqual() {
        assertEquals(ProjectId.of("abc"), ProjectId.of("abc"));
        assertEquals(ProjectId.of("abc").hashCode(), ProjectId.of("abc").hashCode());
        assertNotEquals(ProjectId.of("abc"), ProjectId.of("abd"));
    }
}
