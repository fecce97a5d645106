/**
 * Configuration of the coordination core.
 *
 * @since 1.0.0
 * @author Pipeline Team
 */
package com.ryuqq.pipeline.core.config;
