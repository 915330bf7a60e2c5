package com.enterprise.statements.engine;

import com.enterprise.statements.exception.QueryEngineException;
import com.enterprise.statements.model.ColumnInfo;
import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.duckdb.DuckDBResultSet;

import java.io.IOException;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;

/**
 * Batch stream over DuckDB's native Arrow export of a JDBC result set.
 *
 * <p>Owns the connection, statement and result set it was created with and
 * closes them together with the Arrow reader.
 */
@Slf4j
public class DuckDbBatchStream implements BatchStream {

    private final Connection connection;
    private final Statement statement;
    private final ResultSet resultSet;
    private final ArrowReader reader;
    private final long startNanos;

    private boolean batchLoaded = false;
    private boolean exhausted = false;
    private boolean closed = false;
    private long rowCount = 0;
    private int batchCount = 0;
    private long elapsedMillis = -1;

    DuckDbBatchStream(Connection connection, Statement statement, ResultSet resultSet,
            BufferAllocator allocator, int batchSize, long startNanos) throws SQLException {
        this.connection = connection;
        this.statement = statement;
        this.resultSet = resultSet;
        this.startNanos = startNanos;

        DuckDBResultSet duckResultSet = resultSet.unwrap(DuckDBResultSet.class);
        this.reader = (ArrowReader) duckResultSet.arrowExportStream(allocator, batchSize);
        log.debug("DuckDbBatchStream created with batchSize={}", batchSize);
    }

    @Override
    public boolean hasNext() {
        if (closed || exhausted) {
            return false;
        }
        if (batchLoaded) {
            return true;
        }
        try {
            batchLoaded = reader.loadNextBatch();
        } catch (IOException e) {
            throw new QueryEngineException("Failed to read result batch: " + e.getMessage(), e);
        }
        if (!batchLoaded) {
            exhausted = true;
            elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        }
        return batchLoaded;
    }

    @Override
    public VectorSchemaRoot next() {
        if (!hasNext()) {
            throw new NoSuchElementException("No more batches");
        }
        VectorSchemaRoot batch = root();
        batchLoaded = false;
        rowCount += batch.getRowCount();
        batchCount++;
        if (log.isDebugEnabled()) {
            log.debug("Batch {}: {} rows (total: {})", batchCount, batch.getRowCount(), rowCount);
        }
        return batch;
    }

    @Override
    public List<ColumnInfo> columns() {
        return ArrowTypeNames.columnsOf(root().getSchema());
    }

    @Override
    public Map<String, Object> telemetry() {
        Map<String, Object> telemetry = new LinkedHashMap<>();
        telemetry.put("engine", "duckdb");
        telemetry.put("batches", batchCount);
        telemetry.put("rows", rowCount);
        telemetry.put("elapsed_ms", elapsedMillis >= 0
                ? elapsedMillis
                : TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
        return telemetry;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        log.debug("Closing DuckDbBatchStream: {} batches, {} rows", batchCount, rowCount);

        closeQuietly(reader, "ArrowReader");
        closeQuietly(resultSet, "ResultSet");
        closeQuietly(statement, "Statement");
        closeQuietly(connection, "Connection");
    }

    private VectorSchemaRoot root() {
        try {
            return reader.getVectorSchemaRoot();
        } catch (IOException e) {
            throw new QueryEngineException("Failed to read result schema: " + e.getMessage(), e);
        }
    }

    static void closeQuietly(AutoCloseable resource, String name) {
        if (resource != null) {
            try {
                resource.close();
            } catch (Exception e) {
                log.warn("Error closing {}: {}", name, e.getMessage());
            }
        }
    }
}
