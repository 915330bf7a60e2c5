package com.enterprise.statements.model;

import lombok.Builder;
import lombok.Value;

/**
 * Part file write options, recorded verbatim in the manifest.
 */
@Value
@Builder
public class WriteSettings {
    public static final String DEFAULT_COMPRESSION = "zstd";
    public static final int DEFAULT_COMPRESSION_LEVEL = 1;

    @Builder.Default
    String compression = DEFAULT_COMPRESSION;

    @Builder.Default
    int compressionLevel = DEFAULT_COMPRESSION_LEVEL;

    @Builder.Default
    boolean writeStatistics = false;

    public static WriteSettings defaults() {
        return WriteSettings.builder().build();
    }
}
