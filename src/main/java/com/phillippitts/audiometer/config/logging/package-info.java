/**
 * Logging infrastructure and MDC (Mapped Diagnostic Context) configuration.
 *
 * <p>This package provides structured logging capabilities using Log4j2 with MDC for
 * request correlation and per-session tracing across asynchronous boundaries.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.audiometer.config.logging.MdcFilter} - Servlet filter
 *       that injects {@code requestId} (and {@code sessionId} when present) into MDC for
 *       every HTTP request and WebSocket handshake</li>
 * </ul>
 *
 * <p>MDC Keys:
 * <ul>
 *   <li>{@code requestId} - Unique identifier for each HTTP request (UUID format)</li>
 *   <li>{@code sessionId} - Browser session id; also set by the WebSocket handler,
 *       metering ticks and recording writers</li>
 * </ul>
 *
 * <p>Log Format:
 * <pre>
 * 2025-10-17 15:42:32.529 [thread-name] [req=requestId session=sessionId] LEVEL logger.name - message
 * </pre>
 *
 * @see com.phillippitts.audiometer.config.logging.MdcFilter
 * @since 1.0
 */
package com.phillippitts.audiometer.config.logging;
