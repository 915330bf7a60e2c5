package com.enterprise.statements.pipeline;

/**
 * Object paths for a job's output: {@code bucket/handle/part_0000.ext} and
 * {@code bucket/handle/manifest.json}.
 */
public final class ResultPaths {

    public static final String MANIFEST_FILE = "manifest.json";

    private ResultPaths() {
    }

    public static String partPath(String bucket, String executionId, int index, String extension) {
        return String.format("%s/%s/part_%04d.%s", bucket, executionId, index, extension);
    }

    public static String manifestPath(String bucket, String executionId) {
        return bucket + "/" + executionId + "/" + MANIFEST_FILE;
    }
}
