/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.audiometer.exception.AudioMeterException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.audiometer.exception.ProtocolException} - Malformed or
 *       unknown control message; ignored, session continues</li>
 *   <li>{@link com.phillippitts.audiometer.exception.InvalidFrameException} - Undecodable
 *       PCM frame; dropped, session continues</li>
 *   <li>{@link com.phillippitts.audiometer.exception.StorageException} - Recording write or
 *       finalize failure; recording marked failed, metering continues</li>
 *   <li>{@link com.phillippitts.audiometer.exception.SessionNotFoundException} - Message
 *       for an unknown or closed session; connection closed</li>
 *   <li>{@link com.phillippitts.audiometer.exception.SessionConflictException} - Session id
 *       owned by another connection; connection closed</li>
 * </ul>
 *
 * <p>Out-of-range DSP parameters are clamped rather than rejected, so there is no
 * exception type for them.
 *
 * <p>None of these errors escapes the session that raised it.
 *
 * @since 1.0
 */
package com.phillippitts.audiometer.exception;
