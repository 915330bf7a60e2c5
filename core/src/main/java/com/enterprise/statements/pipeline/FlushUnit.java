package com.enterprise.statements.pipeline;

import lombok.Getter;
import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Buffered batches concatenated into one table, ready to be written as a part.
 * Closing it releases the table's memory.
 */
@Getter
public class FlushUnit implements AutoCloseable {
    private final VectorSchemaRoot table;
    private final int batchCount;
    private final long approxSizeBytes;

    FlushUnit(VectorSchemaRoot table, int batchCount, long approxSizeBytes) {
        this.table = table;
        this.batchCount = batchCount;
        this.approxSizeBytes = approxSizeBytes;
    }

    public long getRowCount() {
        return table.getRowCount();
    }

    @Override
    public void close() {
        table.close();
    }
}
