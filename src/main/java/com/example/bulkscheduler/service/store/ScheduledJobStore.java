package com.example.bulkscheduler.service.store;

import com.example.bulkscheduler.domain.entity.JobRunLog;
import com.example.bulkscheduler.domain.entity.ScheduledJob;
import com.example.bulkscheduler.domain.repository.JobRunLogRepository;
import com.example.bulkscheduler.domain.repository.ScheduledJobRepository;
import com.example.bulkscheduler.exception.JobNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Persisted job table and run history.
 * <p>
 * Every write commits before the method returns, so callers can arm timers
 * knowing the row exists. Config edits go through {@link #update}, which
 * applies changes to a managed entity and writes only the changed columns;
 * run statistics go through the record* methods, which never touch config columns.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScheduledJobStore {

    private static final int MAX_ERROR_LENGTH = 4000;

    private final ScheduledJobRepository jobRepository;
    private final JobRunLogRepository runLogRepository;

    // === Reads ===

    @Transactional(readOnly = true)
    public List<ScheduledJob> findAll() {
        return jobRepository.findAllByOrderByCreatedAtAsc();
    }

    @Transactional(readOnly = true)
    public List<ScheduledJob> findByUser(Long userId) {
        return jobRepository.findByUserIdOrderByCreatedAtAsc(userId);
    }

    @Transactional(readOnly = true)
    public List<ScheduledJob> findActive() {
        return jobRepository.findByIsActiveTrueOrderByIdAsc();
    }

    @Transactional(readOnly = true)
    public Optional<ScheduledJob> findById(Long jobId) {
        return jobRepository.findById(jobId);
    }

    @Transactional(readOnly = true)
    public boolean exists(Long jobId) {
        return jobRepository.existsById(jobId);
    }

    @Transactional(readOnly = true)
    public List<JobRunLog> recentRuns(Long jobId) {
        return runLogRepository.findTop50ByJobIdOrderByStartedAtDesc(jobId);
    }

    // === Config Writes ===

    @Transactional
    public ScheduledJob insert(ScheduledJob job) {
        var saved = jobRepository.save(job);
        log.info("Stored job {} ('{}')", saved.getId(), saved.getName());
        return saved;
    }

    /**
     * Load, modify and flush a job in one transaction.
     *
     * @throws JobNotFoundException if the job does not exist
     */
    @Transactional
    public ScheduledJob update(Long jobId, Consumer<ScheduledJob> changes) {
        var job = jobRepository.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        changes.accept(job);
        return jobRepository.saveAndFlush(job);
    }

    @Transactional
    public void delete(Long jobId) {
        if (!jobRepository.existsById(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        jobRepository.deleteById(jobId);
        log.info("Deleted job {}", jobId);
    }

    // === Run Statistics ===

    @Transactional
    public void recordRunStart(Long jobId, Instant startedAt, Instant nextRunAt) {
        warnIfMissing(jobId, jobRepository.recordRunStart(jobId, startedAt, nextRunAt));
    }

    @Transactional
    public void recordSuccess(Long jobId, Instant now) {
        warnIfMissing(jobId, jobRepository.recordSuccess(jobId, now));
    }

    @Transactional
    public void recordFailure(Long jobId, String error, Instant now) {
        warnIfMissing(jobId, jobRepository.recordFailure(jobId, truncate(error), now));
    }

    @Transactional
    public void recordBlocked(Long jobId, String reason, Instant now) {
        warnIfMissing(jobId, jobRepository.recordBlocked(jobId, truncate(reason), now));
    }

    @Transactional
    public JobRunLog saveRunLog(JobRunLog runLog) {
        return runLogRepository.save(runLog);
    }

    private void warnIfMissing(Long jobId, int updated) {
        // The row can disappear while a run is in flight; its statistics are then dropped
        if (updated == 0) {
            log.warn("Job {} no longer exists, run statistics not recorded", jobId);
        }
    }

    private String truncate(String text) {
        if (text == null || text.length() <= MAX_ERROR_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
