package com.enterprise.statements.exception;

import com.enterprise.statements.model.JobStatus;
import lombok.Getter;

/**
 * Raised when a job is asked to run from a status it cannot leave.
 */
@Getter
public class JobStateException extends StatementWorkerException {
    private final String executionId;
    private final JobStatus status;

    public JobStateException(String executionId, JobStatus status) {
        super("Job " + executionId + " is already " + status);
        this.executionId = executionId;
        this.status = status;
    }
}
