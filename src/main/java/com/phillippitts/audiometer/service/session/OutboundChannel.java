package com.phillippitts.audiometer.service.session;

import com.phillippitts.audiometer.domain.MeteringSample;
import com.phillippitts.audiometer.domain.Recording;

/**
 * Outgoing side of a session's connection. Implementations must never block the caller
 * for long: messages that cannot be sent promptly are dropped.
 */
public interface OutboundChannel {

    /** Sends one metering sample. */
    void sendMeter(MeteringSample sample);

    /** Notifies the client that a recording was finalized and stored. */
    void sendRecordingSaved(Recording recording);

    boolean isOpen();

    /** @return transport-level connection identifier */
    String connectionId();
}
