package com.phillippitts.audiometer.config.orchestration;

import com.phillippitts.audiometer.config.properties.DspProperties;
import com.phillippitts.audiometer.config.properties.MeteringProperties;
import com.phillippitts.audiometer.config.properties.RecordingProperties;
import com.phillippitts.audiometer.service.metering.MeteringScheduler;
import com.phillippitts.audiometer.service.metrics.StreamMetrics;
import com.phillippitts.audiometer.service.orchestration.DefaultStreamOrchestrator;
import com.phillippitts.audiometer.service.orchestration.StreamOrchestrator;
import com.phillippitts.audiometer.service.recording.RecordingService;
import com.phillippitts.audiometer.service.session.SessionRegistry;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the {@link StreamOrchestrator} explicitly so the WebSocket layer depends only on
 * the interface.
 */
@Configuration
public class OrchestrationConfig {

    @Bean
    public StreamOrchestrator streamOrchestrator(SessionRegistry registry,
                                                 MeteringScheduler meteringScheduler,
                                                 RecordingService recordingService,
                                                 DspProperties dspProperties,
                                                 MeteringProperties meteringProperties,
                                                 RecordingProperties recordingProperties,
                                                 StreamMetrics metrics,
                                                 ApplicationEventPublisher publisher) {
        return new DefaultStreamOrchestrator(registry, meteringScheduler, recordingService,
                dspProperties, meteringProperties, recordingProperties, metrics, publisher);
    }
}
