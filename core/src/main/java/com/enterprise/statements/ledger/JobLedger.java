package com.enterprise.statements.ledger;

import com.enterprise.statements.model.JobRecord;
import com.enterprise.statements.model.JobUpdate;

import java.util.Optional;

/**
 * Record store holding job status and result metadata.
 *
 * <p>Implementations raise {@link com.enterprise.statements.exception.LedgerException}
 * when the store itself fails.
 */
public interface JobLedger {

    /**
     * Fetch a job by its handle.
     */
    Optional<JobRecord> getJob(String executionId);

    /**
     * Merge the supplied fields into the job record. {@code updated_at} is set
     * on every call, {@code started_at} when moving to EXECUTING and
     * {@code finished_at} when moving to a terminal status.
     */
    void updateJob(String executionId, JobUpdate update);
}
