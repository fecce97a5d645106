/**
 * Durable file write helpers (temp file, fsync, atomic rename).
 *
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.file.io;
