package com.enterprise.statements.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobRecord {
    private String executionId;
    private String sqlText;
    private JobStatus status;
    private Instant startedAt;
    private Instant updatedAt;
    private Instant finishedAt;
    private String error; // only set when FAILED
    private Long totalRows;
    private List<ColumnInfo> columns;
    private Long totalSizeEstimate;
    private String resultManifestPath;
    private Map<String, Object> telemetry;
}
