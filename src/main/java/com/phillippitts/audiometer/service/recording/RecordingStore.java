package com.phillippitts.audiometer.service.recording;

import com.phillippitts.audiometer.domain.Recording;

import java.util.List;
import java.util.Optional;

/**
 * Metadata store for finished recordings. The WAV files themselves live in the
 * recordings directory; the store only tracks what was saved.
 */
public interface RecordingStore {

    /**
     * Persists a recording and assigns its id.
     *
     * @param recording recording metadata (id ignored)
     * @return the stored copy carrying its assigned id
     */
    Recording save(Recording recording);

    /** @return recordings of one session, newest first */
    List<Recording> findBySession(String sessionId);

    Optional<Recording> findByFilename(String filename);

    /** @return true if a recording with this id existed */
    boolean delete(long id);

    int count();
}
