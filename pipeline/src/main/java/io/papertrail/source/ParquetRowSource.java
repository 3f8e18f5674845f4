package io.papertrail.source;

import io.papertrail.config.SchemaField;
import io.papertrail.core.Record;
import io.papertrail.core.Source;
import io.papertrail.error.SourceUnreadableException;
import io.papertrail.parquet.ParquetFiles;
import io.papertrail.parquet.ParquetSchemas;
import io.papertrail.parquet.ParquetValues;
import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.metadata.BlockMetaData;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.Type;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Streams the rows of a local Parquet file one row group at a time, reading only the requested columns.
 * Payloads are positional values in projection order; seq is the 0-based row index in the file.
 * {@link #skipTo(long)} jumps forward without decoding row groups that hold no wanted row.
 */
public class ParquetRowSource implements Source<Object[]> {
    private final Path path;
    private final ParquetFileReader reader;
    private final MessageType projection;
    private final MessageColumnIO columnIO;
    private final List<SchemaField> fields;
    private final long totalRows;

    private PageReadStore pages;
    private RecordReader<Group> groupRows;
    private long groupRemaining = 0;
    private long nextIndex = 0;
    private boolean finished = false;

    /** Reads every column. */
    public ParquetRowSource(Path path) throws SourceUnreadableException {
        this(path, null);
    }

    /**
     * @param columns columns to read in the order wanted; null reads every column
     */
    public ParquetRowSource(Path path, List<String> columns) throws SourceUnreadableException {
        this.path = path;
        try {
            this.reader = ParquetFiles.open(path);
        } catch (IOException e) {
            throw new SourceUnreadableException(path.toString(), "cannot open parquet file: " + e.getMessage(), e);
        }
        MessageType fileSchema = reader.getFooter().getFileMetaData().getSchema();
        if (columns == null) {
            this.projection = fileSchema;
        } else {
            List<Type> types = new ArrayList<>(columns.size());
            for (String c : columns) {
                if (!fileSchema.containsField(c)) {
                    throw closeAfterFailure(new SourceUnreadableException(path.toString(), "column not present: " + c, null));
                }
                types.add(fileSchema.getType(c));
            }
            this.projection = new MessageType(fileSchema.getName(), types);
        }
        try {
            this.fields = ParquetSchemas.fields(projection);
        } catch (IllegalArgumentException e) {
            throw closeAfterFailure(new SourceUnreadableException(path.toString(), e.getMessage(), e));
        }
        reader.setRequestedSchema(projection);
        this.columnIO = new ColumnIOFactory().getColumnIO(projection, fileSchema);
        long rows = 0;
        for (BlockMetaData b : reader.getFooter().getBlocks()) rows += b.getRowCount();
        this.totalRows = rows;
    }

    public List<SchemaField> fields() { return fields; }

    public long totalRows() { return totalRows; }

    @Override
    public Optional<Record<Object[]>> poll() throws SourceUnreadableException {
        if (finished) return Optional.empty();
        while (groupRemaining == 0) {
            if (!nextGroup()) return Optional.empty();
        }
        Group g = rows().read();
        groupRemaining--;
        long idx = nextIndex++;
        return Optional.of(new Record<>(idx, idx + 1, ParquetValues.read(g, projection)));
    }

    /**
     * Positions the source so the next {@link #poll()} returns row {@code index}. Only forward moves are
     * allowed; whole row groups before the target are skipped undecoded.
     */
    public void skipTo(long index) throws SourceUnreadableException {
        if (index < nextIndex) throw new IllegalArgumentException("cannot move back from " + nextIndex + " to " + index);
        while (!finished && nextIndex + groupRemaining <= index) {
            nextIndex += groupRemaining;
            groupRemaining = 0;
            if (!nextGroup()) return;
        }
        while (nextIndex < index) {
            rows().read();
            groupRemaining--;
            nextIndex++;
        }
    }

    private boolean nextGroup() throws SourceUnreadableException {
        try {
            pages = reader.readNextRowGroup();
        } catch (IOException e) {
            finished = true;
            throw new SourceUnreadableException(path.toString(), "cannot read row group: " + e.getMessage(), e);
        }
        groupRows = null;
        if (pages == null) {
            finished = true;
            return false;
        }
        groupRemaining = pages.getRowCount();
        return true;
    }

    private RecordReader<Group> rows() {
        if (groupRows == null) groupRows = columnIO.getRecordReader(pages, new GroupRecordConverter(projection));
        return groupRows;
    }

    @Override
    public boolean isFinished() { return finished; }

    @Override
    public void close() throws SourceUnreadableException {
        finished = true;
        try {
            reader.close();
        } catch (IOException e) {
            throw new SourceUnreadableException(path.toString(), "close failed: " + e.getMessage(), e);
        }
    }

    private SourceUnreadableException closeAfterFailure(SourceUnreadableException failure) {
        try {
            reader.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
        return failure;
    }
}
