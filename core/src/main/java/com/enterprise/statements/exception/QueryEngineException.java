package com.enterprise.statements.exception;

public class QueryEngineException extends StatementWorkerException {

    public QueryEngineException(String message) {
        super(message);
    }

    public QueryEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
