package com.example.bulkscheduler.domain.repository;

import com.example.bulkscheduler.domain.entity.ScheduledJob;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;

/**
 * Repository for ScheduledJob entity.
 * <p>
 * Run statistics are written with single-row UPDATE statements that only
 * touch statistics columns, so they compose with concurrent config edits.
 */
@Repository
public interface ScheduledJobRepository extends JpaRepository<ScheduledJob, Long> {

    List<ScheduledJob> findAllByOrderByCreatedAtAsc();

    List<ScheduledJob> findByUserIdOrderByCreatedAtAsc(Long userId);

    /**
     * Jobs that must have an armed timer
     */
    List<ScheduledJob> findByIsActiveTrueOrderByIdAsc();

    long countByIsActiveTrue();

    long countByConsecutiveFailuresGreaterThan(int failures);

    /**
     * Bookkeeping at the start of an attempt: last run, next run, total runs.
     */
    @Modifying
    @Query("""
            UPDATE ScheduledJob j
            SET j.lastRunAt = :startedAt,
                j.nextRunAt = :nextRunAt,
                j.totalRuns = j.totalRuns + 1,
                j.updatedAt = :startedAt
            WHERE j.id = :jobId
            """)
    int recordRunStart(
            @Param("jobId") Long jobId,
            @Param("startedAt") Instant startedAt,
            @Param("nextRunAt") Instant nextRunAt
    );

    @Modifying
    @Query("""
            UPDATE ScheduledJob j
            SET j.consecutiveFailures = 0,
                j.lastError = NULL,
                j.updatedAt = :now
            WHERE j.id = :jobId
            """)
    int recordSuccess(@Param("jobId") Long jobId, @Param("now") Instant now);

    @Modifying
    @Query("""
            UPDATE ScheduledJob j
            SET j.consecutiveFailures = j.consecutiveFailures + 1,
                j.lastError = :error,
                j.updatedAt = :now
            WHERE j.id = :jobId
            """)
    int recordFailure(@Param("jobId") Long jobId, @Param("error") String error, @Param("now") Instant now);

    /**
     * A blocked attempt only leaves its reason behind; counters stay untouched.
     */
    @Modifying
    @Query("""
            UPDATE ScheduledJob j
            SET j.lastError = :reason,
                j.updatedAt = :now
            WHERE j.id = :jobId
            """)
    int recordBlocked(@Param("jobId") Long jobId, @Param("reason") String reason, @Param("now") Instant now);
}
