package com.enterprise.statements.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one {@code execute} call that did not raise.
 */
@Value
@Builder
public class ExecutionSummary {
    String executionId;
    JobStatus status;
    String error;
    @Builder.Default
    List<PartDescriptor> parts = List.of();
    @Builder.Default
    List<ColumnInfo> columns = List.of();
    long totalRows;
    long totalSizeEstimate;
    String manifestPath;
    @Builder.Default
    Map<String, Object> telemetry = Map.of();

    public static ExecutionSummary rejected(String executionId, String error) {
        return ExecutionSummary.builder()
                .executionId(executionId)
                .status(JobStatus.FAILED)
                .error(error)
                .build();
    }
}
