package io.papertrail.transform;

import io.papertrail.config.ColumnType;
import io.papertrail.config.SchemaField;
import io.papertrail.config.TypeConfig;
import io.papertrail.core.Record;
import io.papertrail.core.Transform;
import io.papertrail.error.CsvParseException;
import io.papertrail.source.CsvRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Coerces raw text rows to typed positional values following the header order of the source. Null tokens
 * become null; anything else that does not parse as its declared type fails the run.
 */
public class TypeCoercionTransform implements Transform<CsvRow, Object[]> {
    private final String sourceName;
    private final TypeConfig config;
    private final List<SchemaField> schema;
    private final ColumnType[] types;

    public TypeCoercionTransform(String sourceName, List<String> header, TypeConfig config) {
        this.sourceName = sourceName;
        this.config = config;
        List<SchemaField> fields = new ArrayList<>(header.size());
        for (String h : header) fields.add(new SchemaField(h, config.typeOf(h)));
        this.schema = List.copyOf(fields);
        this.types = new ColumnType[fields.size()];
        for (int i = 0; i < types.length; i++) types[i] = fields.get(i).type();
    }

    /** Realized schema of the rows this transform produces. */
    public List<SchemaField> schema() { return schema; }

    @Override
    public Record<Object[]> apply(Record<CsvRow> input) throws CsvParseException {
        CsvRow row = input.payload();
        Object[] out = new Object[types.length];
        for (int i = 0; i < types.length; i++) {
            String raw = row.get(i);
            if (config.isNullToken(raw)) continue;
            try {
                out[i] = switch (types[i]) {
                    case INTEGER -> ValueParsers.parseInteger(raw);
                    case FLOAT -> ValueParsers.parseFloat(raw);
                    case STRING -> raw;
                    case INTEGER_LIST -> throw new IllegalStateException("list column in text source");
                };
            } catch (NumberFormatException e) {
                throw new CsvParseException(sourceName, input.rowNumber(), input.line(), schema.get(i).name(),
                        row.raw(config.delimiter()), "cannot parse '" + raw + "' as " + types[i], e);
            }
        }
        return input.withPayload(out);
    }
}
