package com.example.bulkscheduler.service.registry;

/**
 * Receives a job's timer fire. Called on an execution thread, never on the timer thread.
 */
@FunctionalInterface
public interface JobFireHandler {

    void onFire(Long jobId);

    /**
     * Called on the timer thread when the execution pool refused a fire; the fire is dropped.
     */
    default void onRejected(Long jobId) {
    }
}
