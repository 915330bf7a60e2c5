package com.enterprise.statements.engine;

import com.enterprise.statements.model.ColumnInfo;
import org.apache.arrow.vector.types.TimeUnit;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.Schema;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Renders Arrow types as short, stable names ({@code int64}, {@code string},
 * {@code timestamp[us, tz=UTC]}) for the manifest and the ledger.
 */
public final class ArrowTypeNames {

    private ArrowTypeNames() {
    }

    public static List<ColumnInfo> columnsOf(Schema schema) {
        List<ColumnInfo> columns = new ArrayList<>(schema.getFields().size());
        for (Field field : schema.getFields()) {
            columns.add(new ColumnInfo(field.getName(), describe(field)));
        }
        return columns;
    }

    public static String describe(Field field) {
        ArrowType type = field.getType();
        switch (type.getTypeID()) {
            case List:
                return "list<" + describeChildren(field) + ">";
            case LargeList:
                return "large_list<" + describeChildren(field) + ">";
            case Struct:
                return "struct<" + describeChildren(field) + ">";
            case Map:
                return "map<" + describeChildren(field) + ">";
            default:
                return describe(type);
        }
    }

    public static String describe(ArrowType type) {
        switch (type.getTypeID()) {
            case Null:
                return "null";
            case Bool:
                return "bool";
            case Int: {
                ArrowType.Int intType = (ArrowType.Int) type;
                return (intType.getIsSigned() ? "int" : "uint") + intType.getBitWidth();
            }
            case FloatingPoint:
                switch (((ArrowType.FloatingPoint) type).getPrecision()) {
                    case HALF:
                        return "halffloat";
                    case SINGLE:
                        return "float";
                    default:
                        return "double";
                }
            case Utf8:
                return "string";
            case LargeUtf8:
                return "large_string";
            case Binary:
                return "binary";
            case LargeBinary:
                return "large_binary";
            case FixedSizeBinary:
                return "fixed_size_binary[" + ((ArrowType.FixedSizeBinary) type).getByteWidth() + "]";
            case Decimal: {
                ArrowType.Decimal decimal = (ArrowType.Decimal) type;
                return "decimal" + decimal.getBitWidth() + "(" + decimal.getPrecision() + ", " + decimal.getScale() + ")";
            }
            case Date:
                switch (((ArrowType.Date) type).getUnit()) {
                    case DAY:
                        return "date32[day]";
                    default:
                        return "date64[ms]";
                }
            case Time: {
                ArrowType.Time time = (ArrowType.Time) type;
                return "time" + time.getBitWidth() + "[" + unit(time.getUnit()) + "]";
            }
            case Timestamp: {
                ArrowType.Timestamp timestamp = (ArrowType.Timestamp) type;
                String tz = timestamp.getTimezone();
                return "timestamp[" + unit(timestamp.getUnit()) + (tz == null ? "" : ", tz=" + tz) + "]";
            }
            case Duration:
                return "duration[" + unit(((ArrowType.Duration) type).getUnit()) + "]";
            default:
                return type.getTypeID().name().toLowerCase(Locale.ROOT);
        }
    }

    private static String describeChildren(Field field) {
        return field.getChildren().stream()
                .map(child -> child.getName() + ": " + describe(child))
                .collect(Collectors.joining(", "));
    }

    private static String unit(TimeUnit unit) {
        switch (unit) {
            case SECOND:
                return "s";
            case MILLISECOND:
                return "ms";
            case MICROSECOND:
                return "us";
            default:
                return "ns";
        }
    }
}
