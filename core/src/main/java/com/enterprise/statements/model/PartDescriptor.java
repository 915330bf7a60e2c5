package com.enterprise.statements.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

/**
 * One persisted output file. Serialized into the manifest as
 * {@code {"path", "rows", "approx_size"}}; the index is implied by position.
 */
@Value
@JsonPropertyOrder({"path", "rows", "approx_size"})
public class PartDescriptor {
    @JsonIgnore
    int index;

    @JsonProperty("rows")
    long rowCount;

    @JsonProperty("approx_size")
    long approxSizeBytes;

    @JsonProperty("path")
    String path;
}
