package com.enterprise.statements.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.util.VectorSchemaRootAppender;

import java.util.Optional;

/**
 * Buffers result batches and cuts them into flush units once their estimated
 * in-memory footprint reaches a byte threshold.
 *
 * <p>The footprint is the sum of each appended batch's column buffer sizes
 * ({@link FieldVector#getBufferSize()}). It is an approximation: it ignores
 * allocation slack and says nothing about the encoded or compressed size of
 * the resulting part. The threshold is a trigger, not a cap. A batch is never
 * split, so a single batch larger than the threshold becomes one unit on its
 * own.
 *
 * <p>Appended batches are copied into memory owned by this accumulator, so the
 * caller's batch may be reused or released immediately afterwards. Not thread
 * safe; one instance serves one statement.
 */
@Slf4j
public class BatchAccumulator implements AutoCloseable {

    public static final long DEFAULT_THRESHOLD_BYTES = 256L * 1024 * 1024;

    private final BufferAllocator allocator;
    private final long thresholdBytes;

    private VectorSchemaRoot buffer;
    private int bufferedBatches = 0;
    private long bufferedBytes = 0;

    public BatchAccumulator(BufferAllocator allocator, long thresholdBytes) {
        if (thresholdBytes <= 0) {
            throw new IllegalArgumentException("thresholdBytes must be positive: " + thresholdBytes);
        }
        this.allocator = allocator;
        this.thresholdBytes = thresholdBytes;
    }

    /**
     * Buffer {@code batch}; returns a flush unit when the buffered estimate
     * reaches the threshold. Empty batches are ignored.
     */
    public Optional<FlushUnit> append(VectorSchemaRoot batch) {
        if (batch.getRowCount() == 0) {
            return Optional.empty();
        }
        if (buffer == null) {
            buffer = VectorSchemaRoot.create(batch.getSchema(), allocator);
            buffer.allocateNew();
        }
        VectorSchemaRootAppender.append(buffer, batch);
        bufferedBatches++;
        bufferedBytes += footprintOf(batch);

        if (bufferedBytes >= thresholdBytes) {
            log.debug("Threshold reached: {} bytes in {} batches", bufferedBytes, bufferedBatches);
            return Optional.of(flush());
        }
        return Optional.empty();
    }

    /**
     * Flush whatever is still buffered. Call once the source is exhausted.
     */
    public Optional<FlushUnit> drain() {
        if (buffer == null) {
            return Optional.empty();
        }
        return Optional.of(flush());
    }

    public long getBufferedBytes() {
        return bufferedBytes;
    }

    public int getBufferedBatches() {
        return bufferedBatches;
    }

    public long getThresholdBytes() {
        return thresholdBytes;
    }

    /**
     * Estimated footprint of one batch: the byte size of every column buffer.
     */
    public static long footprintOf(VectorSchemaRoot batch) {
        long total = 0;
        for (FieldVector vector : batch.getFieldVectors()) {
            total += vector.getBufferSize();
        }
        return total;
    }

    private FlushUnit flush() {
        FlushUnit unit = new FlushUnit(buffer, bufferedBatches, bufferedBytes);
        buffer = null;
        bufferedBatches = 0;
        bufferedBytes = 0;
        return unit;
    }

    /**
     * Release anything still buffered.
     */
    @Override
    public void close() {
        if (buffer != null) {
            buffer.close();
            buffer = null;
            bufferedBatches = 0;
            bufferedBytes = 0;
        }
    }
}
