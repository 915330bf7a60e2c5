package com.enterprise.statements.lambda;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts the job handle from a queue message body: either the bare handle
 * or {@code {"execution_id": "..."}}.
 */
final class JobMessages {

    private static final Logger log = LoggerFactory.getLogger(JobMessages.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private JobMessages() {
    }

    /**
     * @return the handle, or null when the body carries none
     */
    static String executionIdOf(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        String trimmed = body.trim();
        if (!trimmed.startsWith("{")) {
            return trimmed;
        }
        try {
            JsonNode id = MAPPER.readTree(trimmed).get("execution_id");
            if (id == null || !id.isTextual() || id.asText().isBlank()) {
                return null;
            }
            return id.asText().trim();
        } catch (JsonProcessingException e) {
            log.warn("Unparseable job message: {}", e.getOriginalMessage());
            return null;
        }
    }
}
