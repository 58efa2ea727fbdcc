package com.phillippitts.audiometer.service.recording.event;

import java.time.Instant;

/**
 * Published when a recording stops accepting audio because a write, enqueue or
 * finalize step failed. The partial file stays on disk.
 *
 * @param sessionId session that owned the recording
 * @param filename  file name inside the recordings directory
 * @param reason    short failure reason (enqueue-timeout, io-error, finalize-timeout)
 * @param at        when the failure was detected
 */
public record RecordingFailedEvent(String sessionId, String filename, String reason, Instant at) {
}
