package com.enterprise.statements.store;

import com.enterprise.statements.exception.ResultWriteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.BucketAlreadyOwnedByYouException;
import software.amazon.awssdk.services.s3.model.CreateBucketRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * {@link ObjectStore} over S3. Paths take the form {@code bucket/key}.
 */
@Slf4j
@RequiredArgsConstructor
public class S3ObjectStore implements ObjectStore {

    static final String PARQUET_CONTENT_TYPE = "application/vnd.apache.parquet";
    static final String JSON_CONTENT_TYPE = "application/json";
    static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

    private final S3Client s3Client;

    @Override
    public void writeBytes(String path, byte[] bytes) {
        int slash = path.indexOf('/');
        if (slash <= 0 || slash == path.length() - 1) {
            throw new ResultWriteException("Object path must be bucket/key: " + path);
        }
        String bucket = path.substring(0, slash);
        String key = path.substring(slash + 1);

        log.info("Uploading {} bytes to s3://{}/{}", bytes.length, bucket, key);
        try {
            s3Client.putObject(
                    PutObjectRequest.builder()
                            .bucket(bucket)
                            .key(key)
                            .contentType(contentTypeFor(key))
                            .build(),
                    RequestBody.fromBytes(bytes));
        } catch (SdkException e) {
            throw new ResultWriteException("Failed to write s3://" + bucket + "/" + key, e);
        }
    }

    /**
     * Create the bucket if it does not exist yet. Only "already owned by you"
     * is tolerated; any other failure propagates.
     */
    public void ensureBucket(String bucket) {
        try {
            s3Client.createBucket(CreateBucketRequest.builder().bucket(bucket).build());
            log.info("Created bucket {}", bucket);
        } catch (BucketAlreadyOwnedByYouException e) {
            log.debug("Bucket {} already exists", bucket);
        }
    }

    static String contentTypeFor(String key) {
        if (key.endsWith(".parquet")) {
            return PARQUET_CONTENT_TYPE;
        }
        if (key.endsWith(".json")) {
            return JSON_CONTENT_TYPE;
        }
        return DEFAULT_CONTENT_TYPE;
    }
}
