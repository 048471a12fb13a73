package com.eainde.compatibility.repository;

import com.eainde.compatibility.profile.Profile;
import com.eainde.compatibility.profile.ProfileCompletenessCalculator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe, process-local {@link ParticipantRepository}.
 *
 * <p>Every saved profile gets its confidence score recomputed from its content, so the
 * stored score always reflects how complete the profile is.</p>
 */
@Slf4j
@Repository
public class InMemoryParticipantRepository implements ParticipantRepository {

    private final Map<String, ParticipantRecord> participants = new ConcurrentHashMap<>();
    private final ProfileCompletenessCalculator completenessCalculator;
    private final Clock clock;

    @Autowired
    public InMemoryParticipantRepository(ProfileCompletenessCalculator completenessCalculator) {
        this(completenessCalculator, Clock.systemUTC());
    }

    public InMemoryParticipantRepository(ProfileCompletenessCalculator completenessCalculator, Clock clock) {
        this.completenessCalculator = completenessCalculator;
        this.clock = clock;
    }

    @Override
    public Optional<ParticipantRecord> findById(String id) {
        return Optional.ofNullable(participants.get(id));
    }

    @Override
    public ParticipantRecord getOrCreate(String id) {
        return participants.computeIfAbsent(id, key -> {
            log.info("Creating participant {}", key);
            return new ParticipantRecord(key, Profile.empty(), clock.instant());
        });
    }

    @Override
    public ParticipantRecord save(ParticipantRecord participant) {
        Profile scored = completenessCalculator.withComputedConfidence(participant.profile());
        ParticipantRecord stamped = participant.withProfile(scored, clock.instant());
        participants.put(stamped.id(), stamped);
        log.debug("Saved participant {} (profile confidence {})", stamped.id(), scored.confidenceScore());
        return stamped;
    }

    public int size() {
        return participants.size();
    }
}
