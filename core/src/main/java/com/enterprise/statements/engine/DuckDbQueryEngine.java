package com.enterprise.statements.engine;

import com.enterprise.statements.exception.QueryEngineException;
import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.memory.BufferAllocator;
import org.duckdb.DuckDBConnection;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * {@link QueryEngine} running statements on an embedded DuckDB database.
 *
 * <p>Each statement runs on its own duplicate of a shared root connection, so
 * concurrent executions see the same database without sharing a JDBC
 * connection.
 */
@Slf4j
public class DuckDbQueryEngine implements QueryEngine, AutoCloseable {

    public static final String DEFAULT_URL = "jdbc:duckdb:";
    public static final int DEFAULT_BATCH_SIZE = 100_000;

    private final DuckDBConnection rootConnection;
    private final BufferAllocator allocator;
    private final int batchSize;

    /**
     * @param jdbcUrl DuckDB JDBC url, {@code jdbc:duckdb:} for an in-memory database
     * @param allocator allocator for result batches (caller retains ownership)
     * @param batchSize rows per exported batch
     */
    public DuckDbQueryEngine(String jdbcUrl, BufferAllocator allocator, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.allocator = allocator;
        this.batchSize = batchSize;
        try {
            this.rootConnection = (DuckDBConnection) DriverManager.getConnection(jdbcUrl);
        } catch (SQLException e) {
            throw new QueryEngineException("Failed to open DuckDB at " + jdbcUrl, e);
        }
        log.info("DuckDbQueryEngine opened {} with batchSize={}", jdbcUrl, batchSize);
    }

    @Override
    public BatchStream execute(String sqlText) {
        if (log.isDebugEnabled()) {
            String truncated = sqlText.length() > 100 ? sqlText.substring(0, 100) + "..." : sqlText;
            log.debug("Executing statement (batchSize={}): {}", batchSize, truncated);
        }

        long startNanos = System.nanoTime();
        Connection connection = null;
        Statement statement = null;
        ResultSet resultSet = null;
        try {
            connection = rootConnection.duplicate();
            statement = connection.createStatement();
            resultSet = statement.executeQuery(sqlText);
            return new DuckDbBatchStream(connection, statement, resultSet, allocator, batchSize, startNanos);
        } catch (SQLException e) {
            DuckDbBatchStream.closeQuietly(resultSet, "ResultSet");
            DuckDbBatchStream.closeQuietly(statement, "Statement");
            DuckDbBatchStream.closeQuietly(connection, "Connection");
            throw new QueryEngineException("Query failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        DuckDbBatchStream.closeQuietly(rootConnection, "DuckDB root connection");
    }
}
