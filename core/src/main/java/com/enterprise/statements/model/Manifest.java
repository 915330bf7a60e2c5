package com.enterprise.statements.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Descriptor of every part written for one job, stored next to the parts as
 * {@code manifest.json}.
 */
@Value
@Builder
@JsonPropertyOrder({"parts", "total_parts", "total_rows", "total_size_estimate", "compression",
        "compression_level", "write_statistics", "columns", "created_at"})
public class Manifest {
    @JsonProperty("parts")
    List<PartDescriptor> parts;

    @JsonProperty("total_parts")
    int totalParts;

    @JsonProperty("total_rows")
    long totalRows;

    @JsonProperty("total_size_estimate")
    long totalSizeEstimate;

    @JsonProperty("compression")
    String compression;

    @JsonProperty("compression_level")
    int compressionLevel;

    @JsonProperty("write_statistics")
    boolean writeStatistics;

    @JsonProperty("columns")
    List<ColumnInfo> columns;

    @JsonProperty("created_at")
    Instant createdAt;
}
