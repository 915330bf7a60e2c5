package com.enterprise.statements.pipeline;

import com.enterprise.statements.exception.ResultWriteException;
import com.enterprise.statements.model.ColumnInfo;
import com.enterprise.statements.model.Manifest;
import com.enterprise.statements.model.PartDescriptor;
import com.enterprise.statements.model.WriteSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Aggregates written parts into a {@link Manifest} and renders it as JSON.
 */
public class ManifestBuilder {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Clock clock;

    public ManifestBuilder() {
        this(Clock.systemUTC());
    }

    public ManifestBuilder(Clock clock) {
        this.clock = clock;
    }

    public Manifest build(List<PartDescriptor> parts, List<ColumnInfo> columns, WriteSettings settings) {
        long totalRows = 0;
        long totalSize = 0;
        for (PartDescriptor part : parts) {
            totalRows += part.getRowCount();
            totalSize += part.getApproxSizeBytes();
        }
        return Manifest.builder()
                .parts(List.copyOf(parts))
                .totalParts(parts.size())
                .totalRows(totalRows)
                .totalSizeEstimate(totalSize)
                .compression(settings.getCompression())
                .compressionLevel(settings.getCompressionLevel())
                .writeStatistics(settings.isWriteStatistics())
                .columns(List.copyOf(columns))
                .createdAt(Instant.now(clock))
                .build();
    }

    /**
     * UTF-8 JSON form of the manifest.
     */
    public byte[] toJson(Manifest manifest) {
        try {
            return MAPPER.writeValueAsBytes(manifest);
        } catch (JsonProcessingException e) {
            throw new ResultWriteException("Failed to serialize manifest", e);
        }
    }
}
