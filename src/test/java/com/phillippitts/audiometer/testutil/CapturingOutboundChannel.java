package com.phillippitts.audiometer.testutil;

import com.phillippitts.audiometer.domain.MeteringSample;
import com.phillippitts.audiometer.domain.Recording;
import com.phillippitts.audiometer.service.session.OutboundChannel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test double for {@link OutboundChannel} that records everything sent to it.
 */
public class CapturingOutboundChannel implements OutboundChannel {

    private final String connectionId;
    private final List<MeteringSample> meters = new CopyOnWriteArrayList<>();
    private final List<Recording> savedRecordings = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;

    public CapturingOutboundChannel(String connectionId) {
        this.connectionId = connectionId;
    }

    @Override
    public void sendMeter(MeteringSample sample) {
        meters.add(sample);
    }

    @Override
    public void sendRecordingSaved(Recording recording) {
        savedRecordings.add(recording);
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    @Override
    public String connectionId() {
        return connectionId;
    }

    public void close() {
        open = false;
    }

    public List<MeteringSample> meters() {
        return meters;
    }

    public List<Recording> savedRecordings() {
        return savedRecordings;
    }
}
