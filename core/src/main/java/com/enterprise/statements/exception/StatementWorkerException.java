package com.enterprise.statements.exception;

/**
 * Base type for every failure raised by the statement pipeline.
 */
public class StatementWorkerException extends RuntimeException {

    public StatementWorkerException(String message) {
        super(message);
    }

    public StatementWorkerException(String message, Throwable cause) {
        super(message, cause);
    }
}
