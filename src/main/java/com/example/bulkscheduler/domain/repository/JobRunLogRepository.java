package com.example.bulkscheduler.domain.repository;

import com.example.bulkscheduler.domain.entity.JobRunLog;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for JobRunLog entity
 */
@Repository
public interface JobRunLogRepository extends JpaRepository<JobRunLog, UUID> {

    /**
     * Most recent attempts of a job, newest first
     */
    List<JobRunLog> findTop50ByJobIdOrderByStartedAtDesc(Long jobId);
}
