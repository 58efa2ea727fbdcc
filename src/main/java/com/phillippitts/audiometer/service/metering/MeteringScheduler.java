package com.phillippitts.audiometer.service.metering;

import com.phillippitts.audiometer.config.logging.MdcFilter;
import com.phillippitts.audiometer.config.properties.MeteringProperties;
import com.phillippitts.audiometer.domain.MeteringSample;
import com.phillippitts.audiometer.service.dsp.MeterReading;
import com.phillippitts.audiometer.service.session.AudioSession;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Emits metering for every registered session at a fixed wall-clock cadence,
 * independent of how often audio frames arrive.
 *
 * <p>Each tick copies the engine's state under its lock and runs the FFT outside it, so
 * ingestion is never held up by spectrum work. A failing tick is logged and the next
 * one runs normally.
 */
@Component
public class MeteringScheduler {

    private static final Logger LOG = LogManager.getLogger(MeteringScheduler.class);

    private final TaskScheduler scheduler;
    private final Duration interval;
    private final double intervalSeconds;
    private final Map<String, Registration> tasks = new ConcurrentHashMap<>();

    private record Registration(AudioSession session, ScheduledFuture<?> future) {
    }

    public MeteringScheduler(@Qualifier("meteringTaskScheduler") TaskScheduler scheduler,
                             MeteringProperties properties) {
        this.scheduler = scheduler;
        this.interval = Duration.ofMillis(properties.getIntervalMs());
        this.intervalSeconds = properties.getIntervalMs() / 1000.0;
    }

    /**
     * Starts metering a session, replacing any earlier registration under the same id.
     */
    public void register(AudioSession session) {
        ScheduledFuture<?> future = scheduler.scheduleAtFixedRate(() -> tick(session), interval);
        Registration previous = tasks.put(session.id(), new Registration(session, future));
        if (previous != null) {
            previous.future().cancel(false);
        }
    }

    /**
     * Stops metering a session. A newer registration under the same id is left alone.
     */
    public void unregister(AudioSession session) {
        Registration current = tasks.get(session.id());
        if (current != null && current.session() == session && tasks.remove(session.id(), current)) {
            current.future().cancel(false);
        }
    }

    public boolean isRegistered(AudioSession session) {
        Registration current = tasks.get(session.id());
        return current != null && current.session() == session;
    }

    public int activeCount() {
        return tasks.size();
    }

    void tick(AudioSession session) {
        if (session.isClosed() || !session.outbound().isOpen()) {
            return;
        }
        ThreadContext.put(MdcFilter.SESSION_ID, session.id());
        try {
            MeterReading reading = session.engine().read();
            MeteringSample sample = session.meter().tick(reading, intervalSeconds);
            session.outbound().sendMeter(sample);
        } catch (RuntimeException e) {
            LOG.warn("Metering tick failed: {}", e.getMessage(), e);
        } finally {
            ThreadContext.remove(MdcFilter.SESSION_ID);
        }
    }

    @PreDestroy
    void cancelAll() {
        tasks.values().forEach(r -> r.future().cancel(false));
        tasks.clear();
    }
}
