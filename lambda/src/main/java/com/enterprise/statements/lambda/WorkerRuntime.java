package com.enterprise.statements.lambda;

import com.enterprise.statements.engine.DuckDbQueryEngine;
import com.enterprise.statements.lambda.config.WorkerConfig;
import com.enterprise.statements.ledger.DynamoDbJobLedger;
import com.enterprise.statements.pipeline.StatementExecutor;
import com.enterprise.statements.store.S3ObjectStore;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Builds the production executor: DynamoDB ledger, DuckDB engine, S3 store.
 */
final class WorkerRuntime {

    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    private WorkerRuntime() {
    }

    static StatementExecutor create(WorkerConfig config) {
        Region region = Region.of(config.getRegion());
        S3Client s3Client = S3Client.builder().region(region).build();
        DynamoDbClient dynamoDbClient = DynamoDbClient.builder().region(region).build();
        BufferAllocator allocator = new RootAllocator(Long.MAX_VALUE);

        S3ObjectStore objectStore = new S3ObjectStore(s3Client);
        if (config.isCreateBucket()) {
            objectStore.ensureBucket(config.getResultsBucket());
        }

        log.info("Worker configured: bucket={}, table={}, region={}, flushThresholdBytes={}, compression={}({})",
                config.getResultsBucket(), config.getDynamoDbTable(), config.getRegion(),
                config.getFlushThresholdBytes(), config.getCompression(), config.getCompressionLevel());

        return new StatementExecutor(
                new DynamoDbJobLedger(dynamoDbClient, config.getDynamoDbTable()),
                new DuckDbQueryEngine(config.getDuckDbUrl(), allocator, config.getEngineBatchSize()),
                objectStore,
                allocator,
                config.toExecutorSettings());
    }
}
