package com.example.bulkscheduler.service.registry;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-job execution lock: at most one in-flight execution per job id.
 * <p>
 * A caller that fails to acquire must skip its attempt, never queue it.
 * Release belongs in a finally block so a failed run cannot wedge the job.
 * <p>
 * Each acquisition gets its own {@link Holder}. Release only removes the lock
 * if it still belongs to that holder: teardown may clear the lock of a running
 * execution, and the next execution's lock must survive the old one finishing.
 */
@Slf4j
@Component
public class ExecutionLock {

    private final ConcurrentHashMap<Long, Holder> held = new ConcurrentHashMap<>();
    private final Clock clock;

    public ExecutionLock(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return the new holder, or empty if an execution already holds the lock
     */
    public Optional<Holder> tryAcquire(Long jobId) {
        var holder = new Holder(jobId, clock.instant());
        var existing = held.putIfAbsent(jobId, holder);
        if (existing != null) {
            log.debug("Execution lock for job {} already held since {}", jobId, existing.getAcquiredAt());
            return Optional.empty();
        }
        return Optional.of(holder);
    }

    /**
     * Release the lock if it is still owned by this holder.
     *
     * @return false when the lock was cleared or taken over in the meantime
     */
    public boolean release(Holder holder) {
        var released = held.remove(holder.getJobId(), holder);
        if (!released) {
            log.debug("Execution lock for job {} was cleared before release", holder.getJobId());
        }
        return released;
    }

    public boolean isHeld(Long jobId) {
        return held.containsKey(jobId);
    }

    /**
     * When the current holder acquired the lock
     */
    public Optional<Instant> heldSince(Long jobId) {
        return Optional.ofNullable(held.get(jobId)).map(Holder::getAcquiredAt);
    }

    public int heldCount() {
        return held.size();
    }

    void clear(Long jobId) {
        if (held.remove(jobId) != null) {
            log.debug("Cleared execution lock for job {}", jobId);
        }
    }

    void clearAll() {
        held.clear();
    }

    /**
     * One acquisition of the lock. Compared by identity.
     */
    @Getter
    public static final class Holder {

        private final Long jobId;
        private final Instant acquiredAt;

        private Holder(Long jobId, Instant acquiredAt) {
            this.jobId = jobId;
            this.acquiredAt = acquiredAt;
        }
    }
}
