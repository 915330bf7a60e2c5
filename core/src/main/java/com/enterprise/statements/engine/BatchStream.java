package com.enterprise.statements.engine;

import com.enterprise.statements.model.ColumnInfo;
import org.apache.arrow.vector.VectorSchemaRoot;

import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Finite, forward-only sequence of result batches from one statement.
 *
 * <p>The {@link VectorSchemaRoot} returned by {@link #next()} stays owned by the
 * stream and may be reloaded by the following {@code hasNext()}; consumers copy
 * what they need to keep. {@code hasNext()} and {@code next()} raise
 * {@link com.enterprise.statements.exception.QueryEngineException} when the
 * engine fails mid-stream.
 */
public interface BatchStream extends Iterator<VectorSchemaRoot>, AutoCloseable {

    /**
     * Result columns in order, available even when the result is empty.
     */
    List<ColumnInfo> columns();

    /**
     * Engine statistics for the statement. Complete only once the stream is exhausted.
     */
    Map<String, Object> telemetry();

    @Override
    void close();
}
