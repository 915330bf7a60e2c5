package com.enterprise.statements.engine;

/**
 * Executes SQL and exposes the result as a lazy sequence of Arrow batches.
 */
public interface QueryEngine {

    /**
     * Start executing {@code sqlText}.
     *
     * @return an open stream owned by the caller, who must close it
     * @throws com.enterprise.statements.exception.QueryEngineException if the statement cannot be started
     */
    BatchStream execute(String sqlText);
}
