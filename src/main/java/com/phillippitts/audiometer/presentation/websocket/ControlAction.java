package com.phillippitts.audiometer.presentation.websocket;

import java.util.Optional;

/**
 * Actions a client may request in a control message.
 */
public enum ControlAction {
    INIT("init"),
    START_RECORD("start_record"),
    STOP_RECORD("stop_record"),
    SET_PARAMS("set_params");

    private final String wireName;

    ControlAction(String wireName) {
        this.wireName = wireName;
    }

    /** @return the name used in the {@code action} field */
    public String wireName() {
        return wireName;
    }

    public static Optional<ControlAction> fromWire(String name) {
        for (ControlAction action : values()) {
            if (action.wireName.equals(name)) {
                return Optional.of(action);
            }
        }
        return Optional.empty();
    }
}
