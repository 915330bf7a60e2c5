package com.enterprise.statements.exception;

/**
 * A part or manifest could not be encoded or stored.
 */
public class ResultWriteException extends StatementWorkerException {

    public ResultWriteException(String message) {
        super(message);
    }

    public ResultWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
