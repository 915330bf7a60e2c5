package com.enterprise.statements.ledger;

import com.enterprise.statements.exception.LedgerException;
import com.enterprise.statements.model.ColumnInfo;
import com.enterprise.statements.model.JobRecord;
import com.enterprise.statements.model.JobStatus;
import com.enterprise.statements.model.JobUpdate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link JobLedger} backed by a DynamoDB table keyed by {@code execution_id}.
 */
@Slf4j
@RequiredArgsConstructor
public class DynamoDbJobLedger implements JobLedger {

    static final String KEY = "execution_id";
    private static final int MAX_ERROR_LENGTH = 500;

    private final DynamoDbClient dynamoDbClient;
    private final String tableName;
    private final Clock clock;

    public DynamoDbJobLedger(DynamoDbClient dynamoDbClient, String tableName) {
        this(dynamoDbClient, tableName, Clock.systemUTC());
    }

    @Override
    public Optional<JobRecord> getJob(String executionId) {
        GetItemResponse response;
        try {
            response = dynamoDbClient.getItem(GetItemRequest.builder()
                    .tableName(tableName)
                    .key(Map.of(KEY, attr(executionId)))
                    .consistentRead(true)
                    .build());
        } catch (SdkException e) {
            throw new LedgerException("Failed to read job " + executionId, e);
        }

        if (!response.hasItem() || response.item().isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapToRecord(response.item()));
        } catch (IllegalArgumentException | DateTimeException e) {
            throw new LedgerException("Unreadable job " + executionId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void updateJob(String executionId, JobUpdate update) {
        String now = Instant.now(clock).toString();
        Map<String, AttributeValue> values = new HashMap<>();
        Map<String, String> names = new HashMap<>();
        List<String> assignments = new ArrayList<>();

        set(assignments, values, names, "updated_at", attr(now));

        if (update.getStatus() != null) {
            set(assignments, values, names, "status", attr(update.getStatus().name()));
            if (update.getStatus() == JobStatus.EXECUTING) {
                set(assignments, values, names, "started_at", attr(now));
            } else if (update.getStatus().isTerminal()) {
                set(assignments, values, names, "finished_at", attr(now));
            }
        }
        if (update.getError() != null) {
            String error = update.getError();
            String truncated = error.length() > MAX_ERROR_LENGTH ? error.substring(0, MAX_ERROR_LENGTH) : error;
            set(assignments, values, names, "error", attr(truncated));
        }
        if (update.getTotalRows() != null) {
            set(assignments, values, names, "total_rows", num(update.getTotalRows()));
        }
        if (update.getColumns() != null) {
            set(assignments, values, names, "columns", columnsAttr(update.getColumns()));
        }
        if (update.getTotalSizeEstimate() != null) {
            set(assignments, values, names, "total_size_estimate", num(update.getTotalSizeEstimate()));
        }
        if (update.getResultManifestPath() != null) {
            set(assignments, values, names, "result_manifest_path", attr(update.getResultManifestPath()));
        }
        if (update.getTelemetry() != null) {
            set(assignments, values, names, "telemetry", telemetryAttr(update.getTelemetry()));
        }

        try {
            dynamoDbClient.updateItem(UpdateItemRequest.builder()
                    .tableName(tableName)
                    .key(Map.of(KEY, attr(executionId)))
                    .updateExpression("SET " + String.join(", ", assignments))
                    .expressionAttributeValues(values)
                    .expressionAttributeNames(names)
                    .build());
        } catch (SdkException e) {
            throw new LedgerException("Failed to update job " + executionId, e);
        }

        log.info("Updated job: executionId={}, status={}", executionId, update.getStatus());
    }

    // ─── helpers ────────────────────────────────────────────────────────────

    // every attribute goes through a name placeholder; "status" and "columns" are reserved words
    private static void set(List<String> assignments, Map<String, AttributeValue> values,
            Map<String, String> names, String attribute, AttributeValue value) {
        String placeholder = "#" + attribute;
        names.put(placeholder, attribute);
        values.put(":" + attribute, value);
        assignments.add(placeholder + " = :" + attribute);
    }

    private static AttributeValue attr(String value) {
        return AttributeValue.builder().s(value == null ? "" : value).build();
    }

    private static AttributeValue num(Number value) {
        return AttributeValue.builder().n(value.toString()).build();
    }

    private static AttributeValue columnsAttr(List<ColumnInfo> columns) {
        List<AttributeValue> list = new ArrayList<>(columns.size());
        for (ColumnInfo column : columns) {
            list.add(AttributeValue.builder()
                    .m(Map.of("name", attr(column.getName()), "type", attr(column.getType())))
                    .build());
        }
        return AttributeValue.builder().l(list).build();
    }

    private static AttributeValue telemetryAttr(Map<String, Object> telemetry) {
        Map<String, AttributeValue> map = new LinkedHashMap<>();
        telemetry.forEach((key, value) -> {
            if (value == null) {
                map.put(key, AttributeValue.builder().nul(true).build());
            } else if (value instanceof Number) {
                map.put(key, num((Number) value));
            } else if (value instanceof Boolean) {
                map.put(key, AttributeValue.builder().bool((Boolean) value).build());
            } else {
                map.put(key, attr(value.toString()));
            }
        });
        return AttributeValue.builder().m(map).build();
    }

    JobRecord mapToRecord(Map<String, AttributeValue> item) {
        String status = str(item, "status");
        return JobRecord.builder()
                .executionId(str(item, KEY))
                .sqlText(str(item, "sql_text"))
                .status(status == null || status.isEmpty() ? null : JobStatus.valueOf(status))
                .startedAt(instant(item, "started_at"))
                .updatedAt(instant(item, "updated_at"))
                .finishedAt(instant(item, "finished_at"))
                .error(str(item, "error"))
                .totalRows(lng(item, "total_rows"))
                .columns(columns(item))
                .totalSizeEstimate(lng(item, "total_size_estimate"))
                .resultManifestPath(str(item, "result_manifest_path"))
                .telemetry(telemetry(item))
                .build();
    }

    private static String str(Map<String, AttributeValue> item, String key) {
        AttributeValue v = item.get(key);
        return (v != null && v.s() != null) ? v.s() : null;
    }

    private static Long lng(Map<String, AttributeValue> item, String key) {
        AttributeValue v = item.get(key);
        return (v != null && v.n() != null) ? Long.valueOf(v.n()) : null;
    }

    private static Instant instant(Map<String, AttributeValue> item, String key) {
        String value = str(item, key);
        return value == null || value.isEmpty() ? null : Instant.parse(value);
    }

    private static List<ColumnInfo> columns(Map<String, AttributeValue> item) {
        AttributeValue v = item.get("columns");
        if (v == null || !v.hasL()) {
            return null;
        }
        List<ColumnInfo> columns = new ArrayList<>();
        for (AttributeValue entry : v.l()) {
            columns.add(new ColumnInfo(str(entry.m(), "name"), str(entry.m(), "type")));
        }
        return columns;
    }

    // integral values stay Long; anything with a fraction or exponent is a Double
    private static Number number(String n) {
        if (n.indexOf('.') >= 0 || n.indexOf('e') >= 0 || n.indexOf('E') >= 0) {
            return Double.valueOf(n);
        }
        return Long.valueOf(n);
    }

    private static Map<String, Object> telemetry(Map<String, AttributeValue> item) {
        AttributeValue v = item.get("telemetry");
        if (v == null || !v.hasM()) {
            return null;
        }
        Map<String, Object> telemetry = new LinkedHashMap<>();
        v.m().forEach((key, value) -> {
            if (value.n() != null) {
                telemetry.put(key, number(value.n()));
            } else if (value.bool() != null) {
                telemetry.put(key, value.bool());
            } else if (value.s() != null) {
                telemetry.put(key, value.s());
            } else {
                telemetry.put(key, null);
            }
        });
        return telemetry;
    }
}
