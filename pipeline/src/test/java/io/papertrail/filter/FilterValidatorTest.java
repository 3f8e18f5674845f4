package io.papertrail.filter;

import io.papertrail.ContributionRows;
import io.papertrail.Fixtures;
import io.papertrail.core.Record;
import io.papertrail.error.FilterValidationException;
import io.papertrail.error.RowCountMismatchException;
import io.papertrail.error.SampleMismatchException;
import io.papertrail.metrics.Metrics;
import io.papertrail.sink.ParquetBatchSink;
import io.papertrail.source.ParquetRowSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

public class FilterValidatorTest {
    private final Metrics metrics = Fixtures.metrics();
    private final FilterValidator validator = new FilterValidator(metrics);
    private final RowCondition organizational = RowCondition.notEqualTo("contributor.type", "I");

    private Path dir;
    private Path source;
    private Path output;

    @BeforeEach
    void setUp() throws Exception {
        dir = Files.createTempDirectory("filterval");
        ContributionRows rows = new ContributionRows();
        String[] types = {"I", "C", "P", null, "I", "L"};
        for (int i = 0; i < 300; i++) {
            rows.add("r" + (i % 17), 1980 + 2 * (i % 20), types[i % types.length], i % 11 == 0 ? null : i * 2.5);
        }
        source = rows.write(dir.resolve("contributions.parquet"));
        output = dir.resolve("organizational.parquet");
        new RowFilter(Fixtures.engine(), metrics).filter(source, output, organizational);
    }

    /** Rewrites the filtered output after applying an edit to its rows. */
    private Path tamper(Consumer<List<Object[]>> edit) throws Exception {
        List<Object[]> rows = new ArrayList<>();
        try (ParquetRowSource src = new ParquetRowSource(output)) {
            Optional<Record<Object[]>> r;
            while ((r = src.poll()).isPresent()) rows.add(r.get().payload());
        }
        edit.accept(rows);
        List<Record<Object[]>> records = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) records.add(new Record<>(i, i + 1, rows.get(i)));
        Path tampered = dir.resolve("tampered.parquet");
        try (ParquetBatchSink sink = new ParquetBatchSink("tampered", tampered, Fixtures.engine())) {
            sink.open(ContributionRows.SCHEMA);
            sink.acceptBatch(records);
        }
        return tampered;
    }

    @Test
    void faithful_output_passes_all_tiers() throws Exception {
        FilterValidationResult result = validator.validate(source, output, organizational, 1000, new Random(5));
        assertTrue(result.allValid());
        assertEquals(300, result.sourceRows());
        assertEquals(150, result.expectedRows());
        assertEquals(150, result.outputRows());
        assertEquals(150, result.sampleSize());
        assertEquals(1, metrics.timer(Metrics.FILTER_VALIDATE_TIME + ".tier3").getCount());
    }

    @Test
    void dropped_row_fails_row_count_tier() throws Exception {
        Path tampered = tamper(rows -> rows.remove(rows.size() - 1));
        RowCountMismatchException e = assertThrows(RowCountMismatchException.class,
                () -> validator.validate(source, tampered, organizational, 10, new Random(5)));
        assertEquals(150, e.expected());
        assertEquals(149, e.actual());
    }

    @Test
    void individual_row_in_output_fails_condition_tier() throws Exception {
        Path tampered = tamper(rows -> rows.get(7)[2] = "I");
        FilterValidationException e = assertThrows(FilterValidationException.class,
                () -> validator.validate(source, tampered, organizational, 10, new Random(5)));
        assertEquals(1, e.violations());
        assertEquals("contributor.type != 'I'", e.condition());
        assertEquals(0, metrics.timer(Metrics.FILTER_VALIDATE_TIME + ".tier3").getCount());
    }

    @Test
    void altered_amount_fails_full_sample() throws Exception {
        Path tampered = tamper(rows -> rows.get(40)[3] = 0.5);
        SampleMismatchException e = assertThrows(SampleMismatchException.class,
                () -> validator.validate(source, tampered, organizational, 1000, new Random(5)));
        assertEquals(40, e.rowIndex());
        assertEquals("amount", e.column());
        assertEquals(0.5, e.actual());
    }
}
