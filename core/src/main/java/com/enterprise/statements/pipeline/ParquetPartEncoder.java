package com.enterprise.statements.pipeline;

import com.enterprise.statements.exception.ResultWriteException;
import com.enterprise.statements.model.WriteSettings;
import lombok.extern.slf4j.Slf4j;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.DateDayVector;
import org.apache.arrow.vector.DateMilliVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.TimeStampVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.parquet.column.ParquetProperties;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.io.api.Binary;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Type;
import org.apache.parquet.schema.Types;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Encodes Arrow tables as Parquet files with v2 data pages.
 *
 * <p>Integers, floating point, booleans, strings, binaries, dates and
 * timestamps map to their Parquet equivalents. Every other Arrow type
 * (decimals, nested types, intervals) is written as its string form.
 * All columns are optional.
 *
 * <p>The configured compression level is only passed to zstd. Other
 * codecs run at their own default level.
 */
@Slf4j
public class ParquetPartEncoder implements PartEncoder {

    static final String ZSTD_LEVEL_KEY = "parquet.compression.codec.zstd.level";
    private static final long MILLIS_PER_DAY = 86_400_000L;

    private final WriteSettings settings;
    private final CompressionCodecName codec;

    public ParquetPartEncoder(WriteSettings settings) {
        this.settings = settings;
        try {
            this.codec = CompressionCodecName.fromConf(settings.getCompression());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported compression codec: " + settings.getCompression(), e);
        }
        if (!appliesLevel(codec)) {
            log.warn("Compression level {} is ignored for codec {}", settings.getCompressionLevel(), codec);
        }
    }

    static boolean appliesLevel(CompressionCodecName codec) {
        return codec == CompressionCodecName.ZSTD;
    }

    @Override
    public String fileExtension() {
        return "parquet";
    }

    @Override
    public byte[] encode(VectorSchemaRoot table) {
        List<ColumnWriter> columns = new ArrayList<>();
        Types.MessageTypeBuilder schemaBuilder = Types.buildMessage();
        for (FieldVector vector : table.getFieldVectors()) {
            ColumnWriter column = columnFor(vector);
            schemaBuilder.addField(column.parquetType);
            columns.add(column);
        }
        MessageType schema = schemaBuilder.named("result");
        SimpleGroupFactory groups = new SimpleGroupFactory(schema);
        ByteArrayOutputFile out = new ByteArrayOutputFile();

        ExampleParquetWriter.Builder builder = ExampleParquetWriter.builder(out)
                .withType(schema)
                .withCompressionCodec(codec)
                .withWriterVersion(ParquetProperties.WriterVersion.PARQUET_2_0)
                .withStatisticsEnabled(settings.isWriteStatistics())
                .withDictionaryEncoding(true);
        if (appliesLevel(codec)) {
            builder.config(ZSTD_LEVEL_KEY, String.valueOf(settings.getCompressionLevel()));
        }

        try (ParquetWriter<Group> writer = builder.build()) {

            int rows = table.getRowCount();
            for (int row = 0; row < rows; row++) {
                Group group = groups.newGroup();
                for (int col = 0; col < columns.size(); col++) {
                    columns.get(col).write(group, col, row);
                }
                writer.write(group);
            }
        } catch (IOException e) {
            throw new ResultWriteException("Failed to encode parquet part: " + e.getMessage(), e);
        }

        byte[] bytes = out.toByteArray();
        log.debug("Encoded {} rows x {} columns into {} parquet bytes ({})",
                table.getRowCount(), columns.size(), bytes.length, codec);
        return bytes;
    }

    // ─── Arrow -> Parquet column mapping ───────────────────────────────────

    private static ColumnWriter columnFor(FieldVector vector) {
        Field field = vector.getField();
        String name = field.getName();
        ArrowType type = field.getType();

        switch (type.getTypeID()) {
            case Bool:
                return new ColumnWriter(vector, optional(PrimitiveTypeName.BOOLEAN, null, name),
                        (g, c, r) -> g.add(c, ((BitVector) vector).get(r) != 0));
            case Int: {
                ArrowType.Int intType = (ArrowType.Int) type;
                BaseIntVector ints = (BaseIntVector) vector;
                if (intType.getBitWidth() == 64 || (!intType.getIsSigned() && intType.getBitWidth() == 32)) {
                    return new ColumnWriter(vector, optional(PrimitiveTypeName.INT64,
                            intType.getBitWidth() == 64
                                    ? LogicalTypeAnnotation.intType(64, intType.getIsSigned())
                                    : LogicalTypeAnnotation.intType(64, true), name),
                            (g, c, r) -> g.add(c, ints.getValueAsLong(r)));
                }
                return new ColumnWriter(vector, optional(PrimitiveTypeName.INT32,
                        LogicalTypeAnnotation.intType(intType.getBitWidth(), intType.getIsSigned()), name),
                        (g, c, r) -> g.add(c, (int) ints.getValueAsLong(r)));
            }
            case FloatingPoint:
                if (vector instanceof Float4Vector) {
                    return new ColumnWriter(vector, optional(PrimitiveTypeName.FLOAT, null, name),
                            (g, c, r) -> g.add(c, ((Float4Vector) vector).get(r)));
                }
                if (vector instanceof Float8Vector) {
                    return new ColumnWriter(vector, optional(PrimitiveTypeName.DOUBLE, null, name),
                            (g, c, r) -> g.add(c, ((Float8Vector) vector).get(r)));
                }
                return asString(vector, name);
            case Utf8:
            case LargeUtf8:
                return new ColumnWriter(vector, optional(PrimitiveTypeName.BINARY,
                        LogicalTypeAnnotation.stringType(), name),
                        (g, c, r) -> g.add(c, vector.getObject(r).toString()));
            case Binary:
            case LargeBinary:
            case FixedSizeBinary:
                return new ColumnWriter(vector, optional(PrimitiveTypeName.BINARY, null, name),
                        (g, c, r) -> g.add(c, Binary.fromConstantByteArray((byte[]) vector.getObject(r))));
            case Date:
                if (vector instanceof DateDayVector) {
                    return new ColumnWriter(vector, optional(PrimitiveTypeName.INT32,
                            LogicalTypeAnnotation.dateType(), name),
                            (g, c, r) -> g.add(c, ((DateDayVector) vector).get(r)));
                }
                return new ColumnWriter(vector, optional(PrimitiveTypeName.INT32,
                        LogicalTypeAnnotation.dateType(), name),
                        (g, c, r) -> g.add(c, (int) Math.floorDiv(((DateMilliVector) vector).get(r), MILLIS_PER_DAY)));
            case Timestamp:
                return timestamp((TimeStampVector) vector, (ArrowType.Timestamp) type, name);
            default:
                return asString(vector, name);
        }
    }

    private static ColumnWriter timestamp(TimeStampVector vector, ArrowType.Timestamp type, String name) {
        boolean utc = type.getTimezone() != null;
        switch (type.getUnit()) {
            case SECOND:
                return new ColumnWriter(vector, optional(PrimitiveTypeName.INT64,
                        LogicalTypeAnnotation.timestampType(utc, LogicalTypeAnnotation.TimeUnit.MILLIS), name),
                        (g, c, r) -> g.add(c, vector.get(r) * 1000L));
            case MILLISECOND:
                return new ColumnWriter(vector, optional(PrimitiveTypeName.INT64,
                        LogicalTypeAnnotation.timestampType(utc, LogicalTypeAnnotation.TimeUnit.MILLIS), name),
                        (g, c, r) -> g.add(c, vector.get(r)));
            case MICROSECOND:
                return new ColumnWriter(vector, optional(PrimitiveTypeName.INT64,
                        LogicalTypeAnnotation.timestampType(utc, LogicalTypeAnnotation.TimeUnit.MICROS), name),
                        (g, c, r) -> g.add(c, vector.get(r)));
            default:
                return new ColumnWriter(vector, optional(PrimitiveTypeName.INT64,
                        LogicalTypeAnnotation.timestampType(utc, LogicalTypeAnnotation.TimeUnit.NANOS), name),
                        (g, c, r) -> g.add(c, vector.get(r)));
        }
    }

    private static ColumnWriter asString(FieldVector vector, String name) {
        return new ColumnWriter(vector, optional(PrimitiveTypeName.BINARY, LogicalTypeAnnotation.stringType(), name),
                (g, c, r) -> g.add(c, String.valueOf(vector.getObject(r))));
    }

    private static Type optional(PrimitiveTypeName primitive, LogicalTypeAnnotation annotation, String name) {
        if (annotation == null) {
            return Types.optional(primitive).named(name);
        }
        return Types.optional(primitive).as(annotation).named(name);
    }

    @FunctionalInterface
    private interface ValueWriter {
        void write(Group group, int column, int row);
    }

    private static final class ColumnWriter {
        private final FieldVector vector;
        private final Type parquetType;
        private final ValueWriter writer;

        ColumnWriter(FieldVector vector, Type parquetType, ValueWriter writer) {
            this.vector = vector;
            this.parquetType = parquetType;
            this.writer = writer;
        }

        void write(Group group, int column, int row) {
            // nulls are left out of the group
            if (!vector.isNull(row)) {
                writer.write(group, column, row);
            }
        }
    }
}
