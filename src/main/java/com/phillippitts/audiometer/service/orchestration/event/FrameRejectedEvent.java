package com.phillippitts.audiometer.service.orchestration.event;

import java.time.Instant;

/**
 * Published when a binary audio frame is dropped because it cannot be decoded.
 *
 * @param sessionId  session the frame arrived on
 * @param frameBytes size of the rejected payload
 * @param reason     short reason (empty, misaligned)
 * @param at         when the frame was rejected
 */
public record FrameRejectedEvent(String sessionId, int frameBytes, String reason, Instant at) {
}
