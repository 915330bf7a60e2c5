package com.enterprise.statements.lambda.config;

import com.enterprise.statements.engine.DuckDbQueryEngine;
import com.enterprise.statements.model.WriteSettings;
import com.enterprise.statements.pipeline.BatchAccumulator;
import com.enterprise.statements.pipeline.ExecutorSettings;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Worker settings read from the Lambda environment.
 */
@Value
@Builder
public class WorkerConfig {
    static final String DEFAULT_REGION = "us-east-1";

    String resultsBucket;
    String dynamoDbTable;
    String region;
    long flushThresholdBytes;
    String compression;
    int compressionLevel;
    boolean writeStatistics;
    int engineBatchSize;
    String duckDbUrl;
    boolean createBucket;

    public static WorkerConfig fromEnvironment(Map<String, String> env) {
        String table = env.get("DYNAMODB_TABLE");
        if (table == null || table.isBlank()) {
            throw new IllegalStateException("DYNAMODB_TABLE env var not set");
        }
        return WorkerConfig.builder()
                .resultsBucket(value(env, "RESULTS_BUCKET", ExecutorSettings.DEFAULT_BUCKET))
                .dynamoDbTable(table)
                .region(value(env, "AWS_REGION_NAME", DEFAULT_REGION))
                .flushThresholdBytes(Long.parseLong(value(env, "FLUSH_THRESHOLD_BYTES",
                        String.valueOf(BatchAccumulator.DEFAULT_THRESHOLD_BYTES))))
                .compression(value(env, "COMPRESSION", WriteSettings.DEFAULT_COMPRESSION))
                .compressionLevel(Integer.parseInt(value(env, "COMPRESSION_LEVEL",
                        String.valueOf(WriteSettings.DEFAULT_COMPRESSION_LEVEL))))
                .writeStatistics(Boolean.parseBoolean(value(env, "WRITE_STATISTICS", "false")))
                .engineBatchSize(Integer.parseInt(value(env, "ENGINE_BATCH_SIZE",
                        String.valueOf(DuckDbQueryEngine.DEFAULT_BATCH_SIZE))))
                .duckDbUrl(value(env, "DUCKDB_URL", DuckDbQueryEngine.DEFAULT_URL))
                .createBucket(Boolean.parseBoolean(value(env, "CREATE_BUCKET", "false")))
                .build();
    }

    public ExecutorSettings toExecutorSettings() {
        return ExecutorSettings.builder()
                .bucket(resultsBucket)
                .flushThresholdBytes(flushThresholdBytes)
                .writeSettings(WriteSettings.builder()
                        .compression(compression)
                        .compressionLevel(compressionLevel)
                        .writeStatistics(writeStatistics)
                        .build())
                .build();
    }

    private static String value(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value == null || value.isBlank()) ? defaultValue : value.trim();
    }
}
