package com.enterprise.statements.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Partial job fields for a merge-style ledger update. Null fields are left
 * unchanged; timestamps are assigned by the ledger when the update is applied.
 */
@Value
@Builder
public class JobUpdate {
    JobStatus status;
    String error;
    Long totalRows;
    List<ColumnInfo> columns;
    Long totalSizeEstimate;
    String resultManifestPath;
    Map<String, Object> telemetry;

    public static JobUpdate executing() {
        return JobUpdate.builder().status(JobStatus.EXECUTING).build();
    }

    public static JobUpdate failed(String error) {
        return JobUpdate.builder().status(JobStatus.FAILED).error(error).build();
    }

    public static JobUpdate completed(long totalRows, List<ColumnInfo> columns, long totalSizeEstimate,
            String resultManifestPath, Map<String, Object> telemetry) {
        return JobUpdate.builder()
                .status(JobStatus.COMPLETED)
                .totalRows(totalRows)
                .columns(columns)
                .totalSizeEstimate(totalSizeEstimate)
                .resultManifestPath(resultManifestPath)
                .telemetry(telemetry)
                .build();
    }
}
