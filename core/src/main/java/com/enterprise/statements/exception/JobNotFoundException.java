package com.enterprise.statements.exception;

import lombok.Getter;

@Getter
public class JobNotFoundException extends StatementWorkerException {
    private final String executionId;

    public JobNotFoundException(String executionId) {
        super("No job found for handle: " + executionId);
        this.executionId = executionId;
    }
}
