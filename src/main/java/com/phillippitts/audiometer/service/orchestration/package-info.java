/**
 * Per-session stream orchestration.
 *
 * <p>{@link com.phillippitts.audiometer.service.orchestration.StreamOrchestrator} is the
 * single entry point the WebSocket layer calls. For every session it owns the DSP chain,
 * the metering registration and the active recording.
 *
 * <p>Frame path:
 * <ol>
 *   <li>decode PCM16LE into a stereo buffer (mono is duplicated)</li>
 *   <li>gain, optional low-pass, level and analysis accumulation</li>
 *   <li>append processed or raw audio to the recording, if one is active</li>
 * </ol>
 *
 * <p>Rejected frames are published as
 * {@link com.phillippitts.audiometer.service.orchestration.event.FrameRejectedEvent}.
 *
 * @since 1.0
 */
package com.phillippitts.audiometer.service.orchestration;
