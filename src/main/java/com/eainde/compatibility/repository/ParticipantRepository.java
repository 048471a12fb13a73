package com.eainde.compatibility.repository;

import java.util.Optional;

/**
 * Externally owned store of participants, keyed by id.
 */
public interface ParticipantRepository {

    Optional<ParticipantRecord> findById(String id);

    /** Returns the existing participant, or stores and returns a new one with an empty profile. */
    ParticipantRecord getOrCreate(String id);

    /** Stores the participant, recomputing its profile confidence score. */
    ParticipantRecord save(ParticipantRecord participant);
}
