package io.papertrail.finance;

import io.papertrail.config.ColumnType;
import io.papertrail.config.EngineConfig;
import io.papertrail.config.TypeConfig;
import io.papertrail.core.Record;
import io.papertrail.parquet.ParquetFiles;
import io.papertrail.source.ParquetRowSource;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.IntFunction;

import static org.junit.jupiter.api.Assertions.*;

public class PaperTrailMainTest {
    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private int run(String... args) {
        CommandLine cmd = new CommandLine(new PaperTrailMain(new EngineConfig(500, CompressionCodecName.ZSTD, 3, 1 << 20, 1)));
        cmd.setOut(new PrintWriter(out));
        cmd.setErr(new PrintWriter(err));
        return cmd.execute(args);
    }

    /** Writes {@code n} rows for a dataset; columns not in {@code overrides} get a value of their declared type. */
    private static Path writeDataset(Path file, DatasetCatalog dataset, int n, Map<String, IntFunction<String>> overrides) throws Exception {
        TypeConfig cfg = dataset.config();
        StringBuilder sb = new StringBuilder(String.join(",", cfg.expectedColumns())).append('\n');
        for (int i = 0; i < n; i++) {
            List<String> values = new ArrayList<>();
            for (String c : cfg.expectedColumns()) {
                IntFunction<String> f = overrides.get(c);
                if (f != null) {
                    values.add(f.apply(i));
                } else if (cfg.typeOf(c) == ColumnType.INTEGER) {
                    values.add(String.valueOf(i));
                } else if (cfg.typeOf(c) == ColumnType.FLOAT) {
                    values.add(i % 5 == 0 ? "" : (i + 0.25) + "");
                } else {
                    values.add(c + "-" + i);
                }
            }
            sb.append(String.join(",", values)).append('\n');
        }
        Files.write(file, sb.toString().getBytes(StandardCharsets.ISO_8859_1));
        return file;
    }

    @Test
    void no_subcommand_prints_usage() {
        assertEquals(PaperTrailMain.EXIT_USAGE, run());
        assertTrue(err.toString().contains("convert"));
    }

    @Test
    void unknown_dataset_type_is_a_usage_error() throws Exception {
        Path dir = Files.createTempDirectory("cli");
        assertEquals(PaperTrailMain.EXIT_USAGE, run("convert", "-t", "fec", dir.resolve("x.csv").toString(), dir.resolve("x.parquet").toString()));
        assertTrue(err.toString().contains("unknown dataset type"));
    }

    @Test
    void converts_votes_detected_from_file_name() throws Exception {
        Path dir = Files.createTempDirectory("cli");
        Path csv = writeDataset(dir.resolve("HSall_votes.csv"), DatasetCatalog.VOTEVIEW_VOTES, 1200, Map.of());
        Path parquet = dir.resolve("votes.parquet");

        assertEquals(PaperTrailMain.EXIT_OK, run("convert", csv.toString(), parquet.toString(), "--seed", "5"), err.toString());
        assertEquals(1200, ParquetFiles.rowCount(parquet));
        String report = out.toString();
        assertTrue(report.contains("voteview-votes"));
        assertTrue(report.contains("SUCCESS"));
        assertTrue(report.contains("tier 3 sample:    PASS"));
        assertTrue(report.contains("metrics: rows=1200"));
    }

    @Test
    void every_dataset_converts_and_validates() throws Exception {
        Path dir = Files.createTempDirectory("cli");
        for (DatasetCatalog d : DatasetCatalog.values()) {
            Path csv = writeDataset(dir.resolve(d.datasetName() + ".csv"), d, 50, Map.of());
            Path parquet = dir.resolve(d.datasetName() + ".parquet");
            assertEquals(PaperTrailMain.EXIT_OK, run("convert", "-t", d.datasetName(), csv.toString(), parquet.toString()), d + ": " + err);
            assertEquals(d.config().expectedColumns().size(), ParquetFiles.schema(parquet).size());
        }
    }

    @Test
    void malformed_value_fails_the_run() throws Exception {
        Path dir = Files.createTempDirectory("cli");
        Path csv = writeDataset(dir.resolve("HSall_votes.csv"), DatasetCatalog.VOTEVIEW_VOTES, 10,
                Map.of("prob", i -> i == 6 ? "high" : "0.5"));
        assertEquals(PaperTrailMain.EXIT_FAILED, run("convert", csv.toString(), dir.resolve("v.parquet").toString()));
        assertTrue(err.toString().contains("row 7"), err.toString());
    }

    @Test
    void missing_source_fails_the_run() throws Exception {
        Path dir = Files.createTempDirectory("cli");
        assertEquals(PaperTrailMain.EXIT_FAILED, run("convert", dir.resolve("absent_votes.csv").toString(), dir.resolve("v.parquet").toString()));
        assertTrue(err.toString().startsWith("ERROR:"));
    }

    @Test
    void builds_one_row_per_legislator() throws Exception {
        Path dir = Files.createTempDirectory("cli");
        Path csv = writeDataset(dir.resolve("HSall_members.csv"), DatasetCatalog.VOTEVIEW_MEMBERS, 60, Map.of(
                "congress", i -> String.valueOf(90 + i % 15),
                "bioguide_id", i -> i % 13 == 0 ? "" : "B" + (i % 4)));
        Path members = dir.resolve("members.parquet");
        Path legislators = dir.resolve("legislators.parquet");

        assertEquals(PaperTrailMain.EXIT_OK, run("convert", csv.toString(), members.toString()), err.toString());
        assertEquals(PaperTrailMain.EXIT_OK, run("legislators", members.toString(), legislators.toString(), "--seed", "1"), err.toString());

        List<Object> keys = new ArrayList<>();
        try (ParquetRowSource src = new ParquetRowSource(legislators, List.of("bioguide_id", "congresses_served"))) {
            Optional<Record<Object[]>> r;
            while ((r = src.poll()).isPresent()) {
                keys.add(r.get().payload()[0]);
                for (Object c : (List<?>) r.get().payload()[1]) assertTrue((Long) c >= 96);
            }
        }
        assertEquals(List.of("B0", "B1", "B2", "B3"), keys);
        assertTrue(out.toString().contains("tier 1 completeness: PASS"));
    }

    @Test
    void builds_recipient_totals() throws Exception {
        Path dir = Files.createTempDirectory("cli");
        Path csv = writeDataset(dir.resolve("contribDB_2020.csv"), DatasetCatalog.DIME_CONTRIBUTIONS, 80, Map.of(
                "bonica.rid", i -> "cand" + (i % 7),
                "contributor.type", i -> i % 3 == 0 ? "I" : i % 2 == 0 ? "C" : "",
                "cycle", i -> String.valueOf(2010 + 2 * (i % 5))));
        Path contributions = dir.resolve("contributions.parquet");
        Path recipients = dir.resolve("recipients.parquet");

        assertEquals(PaperTrailMain.EXIT_OK, run("convert", csv.toString(), contributions.toString()), err.toString());
        assertEquals(PaperTrailMain.EXIT_OK, run("recipients", contributions.toString(), recipients.toString()), err.toString());
        assertEquals(7, ParquetFiles.rowCount(recipients));

        long individual = 0;
        long organizational = 0;
        long total = 0;
        try (ParquetRowSource src = new ParquetRowSource(recipients, List.of("contribution_count", "individual_count", "organizational_count"))) {
            Optional<Record<Object[]>> r;
            while ((r = src.poll()).isPresent()) {
                total += (Long) r.get().payload()[0];
                individual += (Long) r.get().payload()[1];
                organizational += (Long) r.get().payload()[2];
            }
        }
        assertEquals(80, total);
        assertEquals(27, individual);
        assertEquals(26, organizational);
    }

    @Test
    void extracts_organizational_contributions() throws Exception {
        Path dir = Files.createTempDirectory("cli");
        Path csv = writeDataset(dir.resolve("contribDB_2020.csv"), DatasetCatalog.DIME_CONTRIBUTIONS, 90, Map.of(
                "contributor.type", i -> i % 3 == 0 ? "I" : i % 3 == 1 ? "C" : ""));
        Path contributions = dir.resolve("contributions.parquet");
        Path organizational = dir.resolve("organizational.parquet");

        assertEquals(PaperTrailMain.EXIT_OK, run("convert", csv.toString(), contributions.toString()), err.toString());
        assertEquals(PaperTrailMain.EXIT_OK, run("organizational", contributions.toString(), organizational.toString(), "--seed", "2"), err.toString());
        assertEquals(30, ParquetFiles.rowCount(organizational));
        assertEquals(ParquetFiles.schema(contributions), ParquetFiles.schema(organizational));
        String report = out.toString();
        assertTrue(report.contains("30 of 90 rows kept"), report);
        assertTrue(report.contains("tier 2 condition: PASS"), report);
    }
}
