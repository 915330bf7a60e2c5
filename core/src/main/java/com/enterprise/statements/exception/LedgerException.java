package com.enterprise.statements.exception;

public class LedgerException extends StatementWorkerException {

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
