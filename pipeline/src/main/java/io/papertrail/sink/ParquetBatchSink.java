package io.papertrail.sink;

import io.papertrail.config.EngineConfig;
import io.papertrail.config.SchemaField;
import io.papertrail.core.BatchSink;
import io.papertrail.core.Record;
import io.papertrail.error.OutputWriteException;
import io.papertrail.parquet.ParquetFiles;
import io.papertrail.parquet.ParquetSchemas;
import io.papertrail.parquet.ParquetValues;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.SimpleGroupFactory;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.example.ExampleParquetWriter;
import org.apache.parquet.schema.MessageType;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes positional rows to a Parquet file. The writer is opened once, on {@link #open(List)}, when the
 * caller knows the realized schema; rows must follow that schema's column order.
 */
public class ParquetBatchSink implements BatchSink<Object[]> {
    static final String ZSTD_LEVEL_KEY = "parquet.compression.codec.zstd.level";

    private final String sourceName;
    private final Path output;
    private final EngineConfig config;
    private List<SchemaField> fields;
    private SimpleGroupFactory groups;
    private ParquetWriter<Group> writer;
    private long written = 0;

    public ParquetBatchSink(String sourceName, Path output, EngineConfig config) {
        this.sourceName = sourceName;
        this.output = output;
        this.config = config;
    }

    public boolean isOpen() { return writer != null; }

    public long written() { return written; }

    public Path output() { return output; }

    public void open(List<SchemaField> schema) throws OutputWriteException {
        if (writer != null) throw new IllegalStateException("already open: " + output);
        this.fields = List.copyOf(schema);
        MessageType type = ParquetSchemas.messageType(fields);
        Configuration conf = new Configuration(false);
        conf.setInt(ZSTD_LEVEL_KEY, config.compressionLevel());
        try {
            this.writer = ExampleParquetWriter.builder(ParquetFiles.output(output))
                    .withType(type)
                    .withConf(conf)
                    .withCompressionCodec(config.compression())
                    .withRowGroupSize(config.rowGroupBytes())
                    .withWriteMode(ParquetFileWriter.Mode.OVERWRITE)
                    .build();
        } catch (IOException e) {
            throw new OutputWriteException(sourceName, output, e);
        }
        this.groups = new SimpleGroupFactory(type);
    }

    @Override
    public void acceptBatch(List<Record<Object[]>> records) throws OutputWriteException {
        if (writer == null) throw new IllegalStateException("writer not opened: " + output);
        try {
            for (Record<Object[]> r : records) {
                Group g = groups.newGroup();
                ParquetValues.write(g, fields, r.payload());
                writer.write(g);
            }
        } catch (IOException e) {
            throw new OutputWriteException(sourceName, output, e);
        }
        written += records.size();
    }

    @Override
    public void close() throws OutputWriteException {
        if (writer == null) return;
        try {
            writer.close();
        } catch (IOException e) {
            throw new OutputWriteException(sourceName, output, e);
        } finally {
            writer = null;
        }
    }
}
