/**
 * Log4j2 ThreadContext (MDC) plumbing.
 *
 * <p>MDC keys:
 * <ul>
 *   <li>{@code requestId}, {@code method}, {@code uri} - set by
 *       {@link com.phillippitts.streamscribe.config.logging.MdcFilter} per HTTP request</li>
 *   <li>{@code sessionId} - set by the session worker for every task it runs</li>
 * </ul>
 *
 * <p>{@link com.phillippitts.streamscribe.config.logging.MdcTaskDecorator} carries the context
 * across executor hand-offs.
 */
package com.phillippitts.streamscribe.config.logging;
