package com.enterprise.statements.pipeline;

import com.enterprise.statements.model.WriteSettings;
import lombok.Builder;
import lombok.Value;

/**
 * Per-executor configuration, fixed at construction.
 */
@Value
@Builder
public class ExecutorSettings {
    public static final String DEFAULT_BUCKET = "statement-results";

    @Builder.Default
    String bucket = DEFAULT_BUCKET;

    @Builder.Default
    long flushThresholdBytes = BatchAccumulator.DEFAULT_THRESHOLD_BYTES;

    @Builder.Default
    WriteSettings writeSettings = WriteSettings.defaults();

    public static ExecutorSettings defaults() {
        return ExecutorSettings.builder().build();
    }
}
