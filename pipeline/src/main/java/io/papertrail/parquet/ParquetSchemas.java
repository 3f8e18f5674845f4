package io.papertrail.parquet;

import io.papertrail.config.ColumnType;
import io.papertrail.config.SchemaField;
import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.LogicalTypeAnnotation;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.PrimitiveType.PrimitiveTypeName;
import org.apache.parquet.schema.Type;
import org.apache.parquet.schema.Types;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps between logical column types and Parquet schemas. Every column is optional. Text becomes UTF-8
 * BINARY, integers INT64, floats DOUBLE and integer lists the standard three-level LIST group.
 */
public final class ParquetSchemas {
    static final String SCHEMA_NAME = "schema";

    private ParquetSchemas() {}

    public static MessageType messageType(List<SchemaField> fields) {
        List<Type> types = new ArrayList<>(fields.size());
        for (SchemaField f : fields) types.add(type(f));
        return new MessageType(SCHEMA_NAME, types);
    }

    static Type type(SchemaField f) {
        return switch (f.type()) {
            case INTEGER -> Types.optional(PrimitiveTypeName.INT64).named(f.name());
            case FLOAT -> Types.optional(PrimitiveTypeName.DOUBLE).named(f.name());
            case STRING -> Types.optional(PrimitiveTypeName.BINARY).as(LogicalTypeAnnotation.stringType()).named(f.name());
            case INTEGER_LIST -> Types.optionalGroup().as(LogicalTypeAnnotation.listType())
                    .repeatedGroup()
                    .optional(PrimitiveTypeName.INT64).named("element")
                    .named("list")
                    .named(f.name());
        };
    }

    /** Logical view of a file schema, for files this engine wrote and for compatible foreign ones. */
    public static List<SchemaField> fields(MessageType schema) {
        List<SchemaField> out = new ArrayList<>(schema.getFieldCount());
        for (Type t : schema.getFields()) out.add(new SchemaField(t.getName(), columnType(t)));
        return out;
    }

    static ColumnType columnType(Type t) {
        if (t.isPrimitive()) return primitiveType(t.asPrimitiveType(), t.getName());
        GroupType g = t.asGroupType();
        if (g.getLogicalTypeAnnotation() instanceof LogicalTypeAnnotation.ListLogicalTypeAnnotation && g.getFieldCount() == 1) {
            Type repeated = g.getType(0);
            Type element = repeated.isPrimitive() ? repeated : repeated.asGroupType().getType(0);
            if (element.isPrimitive() && primitiveType(element.asPrimitiveType(), t.getName()) == ColumnType.INTEGER) {
                return ColumnType.INTEGER_LIST;
            }
        }
        throw new IllegalArgumentException("unsupported nested column: " + t.getName());
    }

    private static ColumnType primitiveType(PrimitiveType p, String name) {
        return switch (p.getPrimitiveTypeName()) {
            case INT32, INT64, BOOLEAN -> ColumnType.INTEGER;
            case FLOAT, DOUBLE -> ColumnType.FLOAT;
            case BINARY, FIXED_LEN_BYTE_ARRAY -> ColumnType.STRING;
            default -> throw new IllegalArgumentException("unsupported column type " + p.getPrimitiveTypeName() + " for " + name);
        };
    }
}
