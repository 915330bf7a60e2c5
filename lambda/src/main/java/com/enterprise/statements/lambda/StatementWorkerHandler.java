package com.enterprise.statements.lambda;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.SQSEvent;
import com.enterprise.statements.lambda.config.WorkerConfig;
import com.enterprise.statements.model.ExecutionSummary;
import com.enterprise.statements.pipeline.StatementExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lambda handler triggered by SQS messages naming queued statement jobs.
 *
 * Workflow per message:
 * 1. Derive the execution_id from the message body
 * 2. Run the statement (ledger EXECUTING, parts and manifest to S3)
 * 3. Ledger ends COMPLETED or FAILED; the failure is logged, not retried
 */
public class StatementWorkerHandler implements RequestHandler<SQSEvent, String> {

    private static final Logger log = LoggerFactory.getLogger(StatementWorkerHandler.class);

    private final StatementExecutor executor;

    public StatementWorkerHandler() {
        this(DefaultRuntime.EXECUTOR);
    }

    public StatementWorkerHandler(StatementExecutor executor) {
        this.executor = executor;
    }

    @Override
    public String handleRequest(SQSEvent event, Context context) {
        log.info("Received SQS event with {} records", event.getRecords().size());

        for (SQSEvent.SQSMessage message : event.getRecords()) {
            String executionId = JobMessages.executionIdOf(message.getBody());
            if (executionId == null) {
                log.warn("Could not derive execution_id from message {}. Skipping.", message.getMessageId());
                continue;
            }

            try {
                ExecutionSummary summary = executor.execute(executionId);
                log.info("Statement {} finished: status={}, parts={}, rows={}",
                        executionId, summary.getStatus(), summary.getParts().size(), summary.getTotalRows());
            } catch (RuntimeException e) {
                log.error("Processing failed for executionId={}", executionId, e);
            }
        }

        return "OK";
    }

    // SDK clients and the DuckDB database are reused across warm starts
    private static final class DefaultRuntime {
        static final StatementExecutor EXECUTOR = WorkerRuntime.create(WorkerConfig.fromEnvironment(System.getenv()));
    }
}
