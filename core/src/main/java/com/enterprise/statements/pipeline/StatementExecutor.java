package com.enterprise.statements.pipeline;

import com.enterprise.statements.engine.BatchStream;
import com.enterprise.statements.engine.QueryEngine;
import com.enterprise.statements.exception.JobNotFoundException;
import com.enterprise.statements.exception.JobStateException;
import com.enterprise.statements.ledger.JobLedger;
import com.enterprise.statements.model.ColumnInfo;
import com.enterprise.statements.model.ExecutionSummary;
import com.enterprise.statements.model.JobRecord;
import com.enterprise.statements.model.JobStatus;
import com.enterprise.statements.model.JobUpdate;
import com.enterprise.statements.model.Manifest;
import com.enterprise.statements.model.PartDescriptor;
import com.enterprise.statements.store.ObjectStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.memory.BufferAllocator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one queued statement end to end and keeps its ledger record in step
 * with what has been written.
 *
 * <p>Workflow:
 * <ol>
 *   <li>Load the job; unknown handles raise {@link JobNotFoundException}, terminal
 *       jobs raise {@link JobStateException}, neither touches the ledger</li>
 *   <li>A job without query text is marked FAILED and the call returns normally</li>
 *   <li>Mark EXECUTING</li>
 *   <li>Stream batches from the engine into a {@link BatchAccumulator}; every flush
 *       unit becomes the next {@code part_NNNN} file</li>
 *   <li>Write {@code manifest.json}</li>
 *   <li>Mark COMPLETED with row, size, column and telemetry totals</li>
 * </ol>
 * Any failure after step 2, {@link Error}s included, marks the job FAILED and is
 * rethrown. Parts written
 * before the failure stay in the object store.
 *
 * <p>The executor keeps no per-job state, so one instance may run distinct
 * jobs concurrently. It does not guard against two concurrent runs of the
 * same handle.
 */
@Slf4j
public class StatementExecutor {

    static final String MISSING_SQL_TEXT = "missing sqlText";

    private final JobLedger ledger;
    private final QueryEngine engine;
    private final ObjectStore objectStore;
    private final PartEncoder partEncoder;
    private final ManifestBuilder manifestBuilder;
    private final BufferAllocator allocator;
    private final ExecutorSettings settings;

    public StatementExecutor(JobLedger ledger, QueryEngine engine, ObjectStore objectStore,
            BufferAllocator allocator, ExecutorSettings settings) {
        this(ledger, engine, objectStore, new ParquetPartEncoder(settings.getWriteSettings()),
                new ManifestBuilder(), allocator, settings);
    }

    public StatementExecutor(JobLedger ledger, QueryEngine engine, ObjectStore objectStore,
            PartEncoder partEncoder, ManifestBuilder manifestBuilder, BufferAllocator allocator,
            ExecutorSettings settings) {
        this.ledger = ledger;
        this.engine = engine;
        this.objectStore = objectStore;
        this.partEncoder = partEncoder;
        this.manifestBuilder = manifestBuilder;
        this.allocator = allocator;
        this.settings = settings;
    }

    public ExecutionSummary execute(String executionId) {
        JobRecord job = ledger.getJob(executionId)
                .orElseThrow(() -> new JobNotFoundException(executionId));

        if (job.getStatus() != null && job.getStatus().isTerminal()) {
            throw new JobStateException(executionId, job.getStatus());
        }

        String sqlText = job.getSqlText();
        if (sqlText == null || sqlText.isBlank()) {
            log.warn("Job {} has no query text, marking FAILED", executionId);
            ledger.updateJob(executionId, JobUpdate.failed(MISSING_SQL_TEXT));
            return ExecutionSummary.rejected(executionId, MISSING_SQL_TEXT);
        }

        try {
            ledger.updateJob(executionId, JobUpdate.executing());
            log.info("Executing statement {}", executionId);

            ExecutionSummary summary = run(executionId, sqlText);

            ledger.updateJob(executionId, JobUpdate.completed(summary.getTotalRows(), summary.getColumns(),
                    summary.getTotalSizeEstimate(), summary.getManifestPath(), summary.getTelemetry()));
            log.info("Statement {} completed: {} parts, {} rows, ~{} bytes",
                    executionId, summary.getParts().size(), summary.getTotalRows(), summary.getTotalSizeEstimate());
            return summary;

        } catch (RuntimeException | Error e) {
            // an Error must not leave the job EXECUTING either
            log.error("Error executing statement {}", executionId, e);
            markFailed(executionId, e);
            throw e;
        }
    }

    private ExecutionSummary run(String executionId, String sqlText) {
        List<PartDescriptor> parts = new ArrayList<>();
        List<ColumnInfo> columns;
        Map<String, Object> telemetry;

        try (BatchStream stream = engine.execute(sqlText);
             BatchAccumulator accumulator = new BatchAccumulator(allocator, settings.getFlushThresholdBytes())) {

            while (stream.hasNext()) {
                Optional<FlushUnit> unit = accumulator.append(stream.next());
                if (unit.isPresent()) {
                    parts.add(writePart(executionId, parts.size(), unit.get()));
                }
            }
            Optional<FlushUnit> remainder = accumulator.drain();
            if (remainder.isPresent()) {
                parts.add(writePart(executionId, parts.size(), remainder.get()));
            }

            columns = stream.columns();
            telemetry = stream.telemetry();
        }

        Manifest manifest = manifestBuilder.build(parts, columns, settings.getWriteSettings());
        String manifestPath = ResultPaths.manifestPath(settings.getBucket(), executionId);
        objectStore.writeBytes(manifestPath, manifestBuilder.toJson(manifest));
        log.info("Manifest written: {}", manifestPath);

        return ExecutionSummary.builder()
                .executionId(executionId)
                .status(JobStatus.COMPLETED)
                .parts(manifest.getParts())
                .totalRows(manifest.getTotalRows())
                .totalSizeEstimate(manifest.getTotalSizeEstimate())
                .manifestPath(manifestPath)
                .telemetry(telemetry)
                .columns(manifest.getColumns())
                .build();
    }

    private PartDescriptor writePart(String executionId, int index, FlushUnit unit) {
        try (unit) {
            String path = ResultPaths.partPath(settings.getBucket(), executionId, index, partEncoder.fileExtension());
            objectStore.writeBytes(path, partEncoder.encode(unit.getTable()));

            PartDescriptor part = new PartDescriptor(index, unit.getRowCount(), unit.getApproxSizeBytes(), path);
            log.info("Part {} written: {} rows, ~{} bytes from {} batches -> {}",
                    index, part.getRowCount(), part.getApproxSizeBytes(), unit.getBatchCount(), path);
            return part;
        }
    }

    private void markFailed(String executionId, Throwable cause) {
        try {
            ledger.updateJob(executionId, JobUpdate.failed(describe(cause)));
        } catch (RuntimeException ledgerFailure) {
            log.error("Failed to record FAILED status for {}", executionId, ledgerFailure);
            cause.addSuppressed(ledgerFailure);
        }
    }

    static String describe(Throwable e) {
        String message = e.getMessage();
        return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : message;
    }
}
