/**
 * WebSocket protocol for audio sessions.
 *
 * <p>One connection per browser tab at {@code /ws/audio?session_id=<id>}. Inbound text
 * frames are JSON control messages ({@code init}, {@code start_record}, {@code stop_record},
 * {@code set_params}); inbound binary frames are interleaved 16-bit little-endian PCM.
 * Outbound frames are {@code meter} and {@code recording_saved} JSON documents.
 */
package com.phillippitts.audiometer.presentation.websocket;
