package com.phillippitts.audiometer.service.health;

import com.phillippitts.audiometer.service.metering.MeteringScheduler;
import com.phillippitts.audiometer.service.recording.RecordingService;
import com.phillippitts.audiometer.service.recording.RecordingStore;
import com.phillippitts.audiometer.service.session.AudioSession;
import com.phillippitts.audiometer.service.session.SessionRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Health indicator for live sessions and recording storage.
 *
 * <ul>
 *   <li>UP: recordings directory is writable</li>
 *   <li>DOWN: recordings directory missing or read-only (live metering still works,
 *       but every recording would fail)</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class SessionHealthIndicator implements HealthIndicator {

    private final SessionRegistry registry;
    private final MeteringScheduler meteringScheduler;
    private final RecordingService recordingService;
    private final RecordingStore recordingStore;

    public SessionHealthIndicator(SessionRegistry registry,
                                  MeteringScheduler meteringScheduler,
                                  RecordingService recordingService,
                                  RecordingStore recordingStore) {
        this.registry = registry;
        this.meteringScheduler = meteringScheduler;
        this.recordingService = recordingService;
        this.recordingStore = recordingStore;
    }

    @Override
    public Health health() {
        List<AudioSession> sessions = registry.sessions();
        long recording = sessions.stream().filter(AudioSession::isRecording).count();

        Health.Builder builder = recordingService.isDirectoryWritable()
                ? Health.up()
                : Health.down().withDetail("error", "Recordings directory is not writable");

        return builder
                .withDetail("activeSessions", sessions.size())
                .withDetail("recordingSessions", recording)
                .withDetail("meteredSessions", meteringScheduler.activeCount())
                .withDetail("storedRecordings", recordingStore.count())
                .withDetail("recordingsDirectory", recordingService.directory().toAbsolutePath().toString())
                .build();
    }
}
