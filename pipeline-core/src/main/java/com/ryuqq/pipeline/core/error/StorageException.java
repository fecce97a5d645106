package com.ryuqq.pipeline.core.error;

import java.nio.file.Path;

/**
 * 파일시스템 입출력 실패 (STORE-001, TRANSIENT) 또는 손상된 레코드 (STORE-002, FATAL).
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public class StorageException extends PipelineStateException {

    private StorageException(ErrorCode errorCode, String message, Path path, Throwable cause) {
        super(errorCode, message, context("path", path == null ? null : path.toString()), cause);
    }

    public static StorageException io(Path path, String operation, Throwable cause) {
        return new StorageException(ErrorCode.STORAGE_IO,
            "Failed to " + operation + " " + path + ": " + (cause == null ? "unknown" : cause.getMessage()),
            path, cause);
    }

    public static StorageException corrupt(Path path, Throwable cause) {
        return new StorageException(ErrorCode.STORAGE_CORRUPT,
            "Corrupt state file " + path + ": " + (cause == null ? "unknown" : cause.getMessage()),
            path, cause);
    }

    public boolean isCorrupt() {
        return getErrorCode() == ErrorCode.STORAGE_CORRUPT;
    }
}
