package com.enterprise.statements.store;

/**
 * Destination for part files and manifests.
 */
public interface ObjectStore {

    /**
     * Write {@code bytes} at {@code path}, replacing any existing object.
     *
     * @throws com.enterprise.statements.exception.ResultWriteException if the write fails
     */
    void writeBytes(String path, byte[] bytes);
}
