/**
 * Application-wide configuration beans and properties.
 *
 * <p>This package contains Spring configuration classes that define beans and load
 * externalized configuration from {@code application.properties}.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.phillippitts.audiometer.config.AudioFormatConfig} - Startup check of the
 *       PCM stream format (16-bit, little-endian, stereo processing) and metering settings</li>
 *   <li>{@link com.phillippitts.audiometer.config.ThreadPoolConfig} - Recording writer pool
 *       and metering scheduler</li>
 *   <li>{@link com.phillippitts.audiometer.config.WebSocketConfig} - Registers the audio
 *       WebSocket endpoint</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - Typed {@code @ConfigurationProperties} classes</li>
 *   <li>{@code config.orchestration} - Stream orchestrator wiring</li>
 *   <li>{@code config.logging} - Logging infrastructure configuration (MDC filters)</li>
 * </ul>
 *
 * @see com.phillippitts.audiometer.config.AudioFormatConfig
 * @see com.phillippitts.audiometer.config.ThreadPoolConfig
 * @since 1.0
 */
package com.phillippitts.audiometer.config;
