package com.phillippitts.audiometer.presentation.websocket;

import com.phillippitts.audiometer.domain.ParameterUpdate;

import java.util.Objects;

/**
 * A parsed control message. Fields the client omitted are null.
 *
 * @param action     requested action
 * @param sampleRate {@code sample_rate} field (init, start_record)
 * @param channels   {@code channels} field (init, start_record)
 * @param params     DSP fields (set_params); empty for other actions
 */
public record ControlMessage(
        ControlAction action,
        Integer sampleRate,
        Integer channels,
        ParameterUpdate params
) {

    public ControlMessage {
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(params, "params must not be null");
    }
}
