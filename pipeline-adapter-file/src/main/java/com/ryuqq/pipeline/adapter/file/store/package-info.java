/**
 * File-backed versioned state store.
 *
 * <p>Layout under the configured base path:</p>
 * <pre>
 * &lt;base&gt;/&lt;projectId&gt;/_project.json
 * &lt;base&gt;/&lt;projectId&gt;/&lt;section&gt;.json
 * &lt;base&gt;/&lt;projectId&gt;/&lt;section&gt;.json.lock
 * </pre>
 *
 * <p>Every write runs under the section lock, bumps the section version by one, appends a
 * bounded history entry and replaces the file atomically. Change events are published after
 * the lock is released.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.file.store;
