package io.papertrail.parquet;

import io.papertrail.config.SchemaField;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.schema.GroupType;
import org.apache.parquet.schema.Type;

import java.util.ArrayList;
import java.util.List;

/** Converts between example-API {@link Group}s and positional Java values. */
public final class ParquetValues {
    private ParquetValues() {}

    public static Object[] read(Group g, GroupType schema) {
        Object[] row = new Object[schema.getFieldCount()];
        for (int i = 0; i < row.length; i++) row[i] = read(g, i, schema.getType(i));
        return row;
    }

    static Object read(Group g, int field, Type type) {
        if (g.getFieldRepetitionCount(field) == 0) return null;
        if (!type.isPrimitive()) return readList(g.getGroup(field, 0), type.asGroupType());
        return readPrimitive(g, field, 0, type);
    }

    private static Object readPrimitive(Group g, int field, int index, Type type) {
        return switch (type.asPrimitiveType().getPrimitiveTypeName()) {
            case INT32 -> (long) g.getInteger(field, index);
            case INT64 -> g.getLong(field, index);
            case BOOLEAN -> g.getBoolean(field, index) ? 1L : 0L;
            case FLOAT -> (double) g.getFloat(field, index);
            case DOUBLE -> g.getDouble(field, index);
            default -> g.getString(field, index);
        };
    }

    private static List<Long> readList(Group list, GroupType listType) {
        Type repeated = listType.getType(0);
        int n = list.getFieldRepetitionCount(0);
        List<Long> out = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            if (repeated.isPrimitive()) {
                out.add((Long) readPrimitive(list, 0, i, repeated));
                continue;
            }
            Group item = list.getGroup(0, i);
            Type element = repeated.asGroupType().getType(0);
            out.add(item.getFieldRepetitionCount(0) == 0 ? null : (Long) readPrimitive(item, 0, 0, element));
        }
        return out;
    }

    /** Appends one row to an empty group; nulls are left absent. */
    public static void write(Group g, List<SchemaField> fields, Object[] row) {
        for (int i = 0; i < fields.size(); i++) {
            Object v = row[i];
            if (v == null) continue;
            switch (fields.get(i).type()) {
                case INTEGER -> g.add(i, ((Number) v).longValue());
                case FLOAT -> g.add(i, ((Number) v).doubleValue());
                case STRING -> g.add(i, v.toString());
                case INTEGER_LIST -> {
                    Group list = g.addGroup(i);
                    for (Object e : (List<?>) v) {
                        Group item = list.addGroup(0);
                        if (e != null) item.add(0, ((Number) e).longValue());
                    }
                }
            }
        }
    }
}
