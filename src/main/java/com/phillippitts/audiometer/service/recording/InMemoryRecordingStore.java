package com.phillippitts.audiometer.service.recording;

import com.phillippitts.audiometer.domain.Recording;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Default {@link RecordingStore}: metadata lives for the lifetime of the process.
 */
@Component
public class InMemoryRecordingStore implements RecordingStore {

    private final Map<Long, Recording> recordings = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong(1);

    @Override
    public Recording save(Recording recording) {
        Objects.requireNonNull(recording, "recording must not be null");
        Recording stored = recording.withId(nextId.getAndIncrement());
        recordings.put(stored.id(), stored);
        return stored;
    }

    @Override
    public List<Recording> findBySession(String sessionId) {
        return recordings.values().stream()
                .filter(r -> r.sessionId().equals(sessionId))
                .sorted(Comparator.comparing(Recording::createdAt).reversed()
                        .thenComparing(Comparator.comparingLong(Recording::id).reversed()))
                .toList();
    }

    @Override
    public Optional<Recording> findByFilename(String filename) {
        return recordings.values().stream()
                .filter(r -> r.filename().equals(filename))
                .findFirst();
    }

    @Override
    public boolean delete(long id) {
        return recordings.remove(id) != null;
    }

    @Override
    public int count() {
        return recordings.size();
    }
}
