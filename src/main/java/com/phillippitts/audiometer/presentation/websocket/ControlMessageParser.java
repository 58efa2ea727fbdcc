package com.phillippitts.audiometer.presentation.websocket;

import com.phillippitts.audiometer.domain.ParameterUpdate;
import com.phillippitts.audiometer.exception.ProtocolException;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * Parses control messages of the form {@code {"action": "...", ...}}.
 *
 * <p>Numeric fields accept JSON numbers or numeric strings; {@code filter_enabled} accepts
 * a boolean or {@code "true"}/{@code "false"}. Unknown fields are ignored.
 */
final class ControlMessageParser {

    static final String ACTION = "action";
    static final String SAMPLE_RATE = "sample_rate";
    static final String CHANNELS = "channels";
    static final String GAIN = "gain";
    static final String FILTER_ENABLED = "filter_enabled";
    static final String CUTOFF_FREQ = "cutoff_freq";
    static final String INTEGRATION_TIME = "integration_time";

    private ControlMessageParser() {}

    /**
     * @param text raw text frame
     * @return parsed message
     * @throws ProtocolException if the text is not a JSON object, the action is missing or
     *         unknown, or a field has the wrong type
     */
    static ControlMessage parse(String text) {
        JSONObject json;
        try {
            json = new JSONObject(text);
        } catch (JSONException e) {
            throw new ProtocolException("Control message is not a JSON object", e);
        }

        Object rawAction = json.opt(ACTION);
        if (!(rawAction instanceof String name)) {
            throw new ProtocolException("Control message has no action");
        }
        ControlAction action = ControlAction.fromWire(name)
                .orElseThrow(() -> new ProtocolException("Unknown action", name));

        return switch (action) {
            case INIT, START_RECORD -> new ControlMessage(action,
                    optInt(json, SAMPLE_RATE, name), optInt(json, CHANNELS, name), emptyUpdate());
            case STOP_RECORD -> new ControlMessage(action, null, null, emptyUpdate());
            case SET_PARAMS -> new ControlMessage(action, null, null, new ParameterUpdate(
                    optDouble(json, GAIN, name),
                    optBoolean(json, FILTER_ENABLED, name),
                    optDouble(json, CUTOFF_FREQ, name),
                    optDouble(json, INTEGRATION_TIME, name)));
        };
    }

    private static ParameterUpdate emptyUpdate() {
        return new ParameterUpdate(null, null, null, null);
    }

    private static Integer optInt(JSONObject json, String key, String action) {
        Double value = optDouble(json, key, action);
        return value == null ? null : value.intValue();
    }

    private static Double optDouble(JSONObject json, String key, String action) {
        Object value = json.opt(key);
        if (value == null || JSONObject.NULL.equals(value)) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                throw new ProtocolException("Field '" + key + "' is not a number", action);
            }
        }
        throw new ProtocolException("Field '" + key + "' is not a number", action);
    }

    private static Boolean optBoolean(JSONObject json, String key, String action) {
        Object value = json.opt(key);
        if (value == null || JSONObject.NULL.equals(value)) {
            return null;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            if ("true".equalsIgnoreCase(s.trim())) {
                return Boolean.TRUE;
            }
            if ("false".equalsIgnoreCase(s.trim())) {
                return Boolean.FALSE;
            }
        }
        throw new ProtocolException("Field '" + key + "' is not a boolean", action);
    }
}
