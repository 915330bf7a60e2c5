package com.enterprise.statements.pipeline;

import org.apache.arrow.vector.VectorSchemaRoot;

/**
 * Encodes one flush unit into the bytes of a part file.
 */
public interface PartEncoder {

    /**
     * File extension of encoded parts, without the dot.
     */
    String fileExtension();

    /**
     * @throws com.enterprise.statements.exception.ResultWriteException if encoding fails
     */
    byte[] encode(VectorSchemaRoot table);
}
