package com.enterprise.statements.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Value;

@Value
@JsonPropertyOrder({"name", "type"})
public class ColumnInfo {
    String name;
    String type;
}
