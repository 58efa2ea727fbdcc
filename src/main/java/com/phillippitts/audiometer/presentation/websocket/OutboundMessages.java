package com.phillippitts.audiometer.presentation.websocket;

import com.phillippitts.audiometer.domain.MeteringSample;
import com.phillippitts.audiometer.domain.Recording;
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * JSON documents sent to clients.
 *
 * <pre>
 * {"type":"meter","rms":-23.5,"spectrum":[...],"panning":0.1}
 * {"type":"recording_saved","id":7,"filename":"rec_20240101_120000_ab12cd34.wav"}
 * </pre>
 */
final class OutboundMessages {

    static final String TYPE_METER = "meter";
    static final String TYPE_RECORDING_SAVED = "recording_saved";

    private OutboundMessages() {}

    static String meter(MeteringSample sample) {
        JSONArray spectrum = new JSONArray();
        for (double band : sample.spectrum()) {
            spectrum.put(band);
        }
        return new JSONObject()
                .put("type", TYPE_METER)
                .put("rms", sample.rmsDb())
                .put("spectrum", spectrum)
                .put("panning", sample.panning())
                .toString();
    }

    static String recordingSaved(Recording recording) {
        return new JSONObject()
                .put("type", TYPE_RECORDING_SAVED)
                .put("id", recording.id())
                .put("filename", recording.filename())
                .toString();
    }
}
