package com.enterprise.statements.ledger;

import com.enterprise.statements.exception.LedgerException;
import com.enterprise.statements.model.ColumnInfo;
import com.enterprise.statements.model.JobRecord;
import com.enterprise.statements.model.JobStatus;
import com.enterprise.statements.model.JobUpdate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DynamoDbJobLedgerTest {

    private static final String TABLE = "statement_jobs";
    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final RecordingDynamoDb dynamoDb = new RecordingDynamoDb();
    private final DynamoDbJobLedger ledger =
            new DynamoDbJobLedger(dynamoDb, TABLE, Clock.fixed(NOW, ZoneOffset.UTC));

    // ─── getJob ───────────────────────────────────────────────────────────

    @Test
    @DisplayName("reads a job with a consistent read on execution_id")
    void readsJob() {
        Map<String, AttributeValue> item = new LinkedHashMap<>();
        item.put("execution_id", s("q1"));
        item.put("sql_text", s("SELECT 1"));
        item.put("status", s("QUEUED"));
        item.put("updated_at", s("2024-02-01T00:00:00Z"));
        dynamoDb.item = item;

        Optional<JobRecord> job = ledger.getJob("q1");

        assertThat(job).isPresent();
        assertThat(job.get().getExecutionId()).isEqualTo("q1");
        assertThat(job.get().getSqlText()).isEqualTo("SELECT 1");
        assertThat(job.get().getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.get().getUpdatedAt()).isEqualTo(Instant.parse("2024-02-01T00:00:00Z"));
        assertThat(job.get().getStartedAt()).isNull();

        GetItemRequest request = dynamoDb.lastGet;
        assertThat(request.tableName()).isEqualTo(TABLE);
        assertThat(request.key()).containsEntry("execution_id", s("q1"));
        assertThat(request.consistentRead()).isTrue();
    }

    @Test
    @DisplayName("a missing item is an empty result")
    void missingJob() {
        assertThat(ledger.getJob("nope")).isEmpty();
    }

    @Test
    @DisplayName("completed fields parse back from an item")
    void readsCompletedJob() {
        Map<String, AttributeValue> item = new LinkedHashMap<>();
        item.put("execution_id", s("q1"));
        item.put("status", s("COMPLETED"));
        item.put("total_rows", n("25000"));
        item.put("total_size_estimate", n("203125"));
        item.put("result_manifest_path", s("statement-results/q1/manifest.json"));
        item.put("columns", AttributeValue.builder().l(
                AttributeValue.builder().m(Map.of("name", s("id"), "type", s("int64"))).build()).build());
        item.put("telemetry", AttributeValue.builder().m(Map.of(
                "engine", s("duckdb"),
                "rows", n("25000"),
                "ratio", n("0.5"),
                "cached", AttributeValue.builder().bool(true).build())).build());
        dynamoDb.item = item;

        JobRecord job = ledger.getJob("q1").orElseThrow();

        assertThat(job.getStatus()).isEqualTo(JobStatus.COMPLETED);
        assertThat(job.getTotalRows()).isEqualTo(25_000L);
        assertThat(job.getTotalSizeEstimate()).isEqualTo(203_125L);
        assertThat(job.getResultManifestPath()).isEqualTo("statement-results/q1/manifest.json");
        assertThat(job.getColumns()).containsExactly(new ColumnInfo("id", "int64"));
        assertThat(job.getTelemetry())
                .containsEntry("engine", "duckdb")
                .containsEntry("rows", 25_000L)
                .containsEntry("ratio", 0.5)
                .containsEntry("cached", true);
        assertThat(job.getTelemetry().get("rows")).isInstanceOf(Long.class);
        assertThat(job.getTelemetry().get("ratio")).isInstanceOf(Double.class);
    }

    @Test
    @DisplayName("integral telemetry numbers keep their Long type, fractional and exponent ones are Double")
    void telemetryNumberTypes() {
        Map<String, AttributeValue> item = new LinkedHashMap<>();
        item.put("execution_id", s("q1"));
        item.put("status", s("COMPLETED"));
        item.put("telemetry", AttributeValue.builder().m(Map.of(
                "parts", n("3"),
                "bytes", n("9007199254740993"),
                "elapsed", n("1.25"),
                "scale", n("1E+3"))).build());
        dynamoDb.item = item;

        Map<String, Object> telemetry = ledger.getJob("q1").orElseThrow().getTelemetry();

        assertThat(telemetry.get("parts")).isEqualTo(3L);
        assertThat(telemetry.get("bytes")).isEqualTo(9_007_199_254_740_993L);
        assertThat(telemetry.get("elapsed")).isEqualTo(1.25);
        assertThat(telemetry.get("scale")).isEqualTo(1000.0);
    }

    @Test
    @DisplayName("an unknown status in the item is a LedgerException")
    void unreadableStatus() {
        Map<String, AttributeValue> item = new LinkedHashMap<>();
        item.put("execution_id", s("q1"));
        item.put("status", s("queued"));
        dynamoDb.item = item;

        assertThatThrownBy(() -> ledger.getJob("q1"))
                .isInstanceOf(LedgerException.class)
                .hasMessageContaining("q1")
                .hasCauseInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("a malformed timestamp in the item is a LedgerException")
    void unreadableTimestamp() {
        Map<String, AttributeValue> item = new LinkedHashMap<>();
        item.put("execution_id", s("q1"));
        item.put("status", s("EXECUTING"));
        item.put("started_at", s("yesterday"));
        dynamoDb.item = item;

        assertThatThrownBy(() -> ledger.getJob("q1"))
                .isInstanceOf(LedgerException.class)
                .hasCauseInstanceOf(DateTimeException.class);
    }

    @Test
    @DisplayName("read failures are wrapped")
    void readFailure() {
        dynamoDb.failure = SdkClientException.create("connection reset");

        assertThatThrownBy(() -> ledger.getJob("q1"))
                .isInstanceOf(LedgerException.class)
                .hasMessageContaining("q1")
                .hasCauseInstanceOf(SdkClientException.class);
    }

    // ─── updateJob ────────────────────────────────────────────────────────

    @Test
    @DisplayName("EXECUTING sets status, started_at and updated_at")
    void executingUpdate() {
        ledger.updateJob("q1", JobUpdate.executing());

        UpdateItemRequest request = dynamoDb.lastUpdate;
        assertThat(request.tableName()).isEqualTo(TABLE);
        assertThat(request.key()).containsEntry("execution_id", s("q1"));
        assertThat(request.updateExpression())
                .startsWith("SET ")
                .contains("#status = :status", "#started_at = :started_at", "#updated_at = :updated_at")
                .doesNotContain("finished_at");
        assertThat(request.expressionAttributeNames()).containsEntry("#status", "status");
        assertThat(request.expressionAttributeValues())
                .containsEntry(":status", s("EXECUTING"))
                .containsEntry(":started_at", s(NOW.toString()))
                .containsEntry(":updated_at", s(NOW.toString()));
    }

    @Test
    @DisplayName("COMPLETED writes results, columns and telemetry")
    void completedUpdate() {
        Map<String, Object> telemetry = new LinkedHashMap<>();
        telemetry.put("engine", "duckdb");
        telemetry.put("rows", 25_000L);
        telemetry.put("spilled", false);
        telemetry.put("note", null);

        ledger.updateJob("q1", JobUpdate.completed(25_000, List.of(new ColumnInfo("id", "int64")),
                203_125, "statement-results/q1/manifest.json", telemetry));

        UpdateItemRequest request = dynamoDb.lastUpdate;
        Map<String, AttributeValue> values = request.expressionAttributeValues();
        assertThat(request.updateExpression()).contains("#finished_at = :finished_at").doesNotContain("started_at");
        assertThat(values.get(":status").s()).isEqualTo("COMPLETED");
        assertThat(values.get(":total_rows").n()).isEqualTo("25000");
        assertThat(values.get(":total_size_estimate").n()).isEqualTo("203125");
        assertThat(values.get(":result_manifest_path").s()).isEqualTo("statement-results/q1/manifest.json");
        assertThat(values.get(":columns").l()).hasSize(1);
        assertThat(values.get(":columns").l().get(0).m()).containsEntry("name", s("id")).containsEntry("type", s("int64"));

        Map<String, AttributeValue> stored = values.get(":telemetry").m();
        assertThat(stored.get("engine").s()).isEqualTo("duckdb");
        assertThat(stored.get("rows").n()).isEqualTo("25000");
        assertThat(stored.get("spilled").bool()).isFalse();
        assertThat(stored.get("note").nul()).isTrue();
        assertThat(request.expressionAttributeNames())
                .containsEntry("#columns", "columns")
                .containsEntry("#telemetry", "telemetry");
    }

    @Test
    @DisplayName("FAILED truncates long errors")
    void failedUpdateTruncates() {
        ledger.updateJob("q1", JobUpdate.failed("x".repeat(800)));

        Map<String, AttributeValue> values = dynamoDb.lastUpdate.expressionAttributeValues();
        assertThat(values.get(":status").s()).isEqualTo("FAILED");
        assertThat(values.get(":error").s()).hasSize(500);
        assertThat(values).containsKey(":finished_at");
    }

    @Test
    @DisplayName("fields left null are not written")
    void partialUpdate() {
        ledger.updateJob("q1", JobUpdate.builder().totalRows(3L).build());

        UpdateItemRequest request = dynamoDb.lastUpdate;
        assertThat(request.expressionAttributeValues()).containsOnlyKeys(":updated_at", ":total_rows");
        assertThat(request.updateExpression()).isEqualTo("SET #updated_at = :updated_at, #total_rows = :total_rows");
    }

    @Test
    @DisplayName("write failures are wrapped")
    void updateFailure() {
        dynamoDb.failure = SdkClientException.create("throttled");

        assertThatThrownBy(() -> ledger.updateJob("q1", JobUpdate.executing()))
                .isInstanceOf(LedgerException.class)
                .hasMessage("Failed to update job q1");
    }

    // ─── fakes ────────────────────────────────────────────────────────────

    private static AttributeValue s(String value) {
        return AttributeValue.builder().s(value).build();
    }

    private static AttributeValue n(String value) {
        return AttributeValue.builder().n(value).build();
    }

    private static class RecordingDynamoDb implements DynamoDbClient {
        Map<String, AttributeValue> item;
        RuntimeException failure;
        GetItemRequest lastGet;
        UpdateItemRequest lastUpdate;

        @Override
        public GetItemResponse getItem(GetItemRequest request) {
            lastGet = request;
            if (failure != null) {
                throw failure;
            }
            return item == null ? GetItemResponse.builder().build() : GetItemResponse.builder().item(item).build();
        }

        @Override
        public UpdateItemResponse updateItem(UpdateItemRequest request) {
            lastUpdate = request;
            if (failure != null) {
                throw failure;
            }
            return UpdateItemResponse.builder().build();
        }

        @Override
        public String serviceName() {
            return SERVICE_NAME;
        }

        @Override
        public void close() {
        }
    }
}
