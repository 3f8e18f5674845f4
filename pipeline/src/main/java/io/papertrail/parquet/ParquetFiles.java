package io.papertrail.parquet;

import io.papertrail.config.SchemaField;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.hadoop.metadata.ParquetMetadata;
import org.apache.parquet.io.InputFile;
import org.apache.parquet.io.OutputFile;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/** Entry points for local Parquet files. */
public final class ParquetFiles {
    private ParquetFiles() {}

    public static InputFile input(Path path) { return new NioInputFile(path); }

    public static OutputFile output(Path path) { return new NioOutputFile(path); }

    public static ParquetFileReader open(Path path) throws IOException {
        return ParquetFileReader.open(input(path));
    }

    /** Row count from the footer alone; no data pages are read. */
    public static long rowCount(Path path) throws IOException {
        try (ParquetFileReader reader = open(path)) {
            return rowCount(reader.getFooter());
        }
    }

    static long rowCount(ParquetMetadata footer) {
        long total = 0;
        for (BlockMetaData b : footer.getBlocks()) total += b.getRowCount();
        return total;
    }

    public static List<SchemaField> schema(Path path) throws IOException {
        try (ParquetFileReader reader = open(path)) {
            return ParquetSchemas.fields(reader.getFooter().getFileMetaData().getSchema());
        }
    }
}
