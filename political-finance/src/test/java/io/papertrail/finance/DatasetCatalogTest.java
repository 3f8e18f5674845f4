package io.papertrail.finance;

import io.papertrail.config.ColumnType;
import io.papertrail.config.TypeConfig;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

public class DatasetCatalogTest {

    @Test
    void column_counts_match_published_layouts() {
        assertEquals(45, DatasetCatalog.DIME_CONTRIBUTIONS.config().expectedColumns().size());
        assertEquals(65, DatasetCatalog.DIME_RECIPIENTS.config().expectedColumns().size());
        assertEquals(43, DatasetCatalog.DIME_CONTRIBUTORS.config().expectedColumns().size());
        assertEquals(22, DatasetCatalog.VOTEVIEW_MEMBERS.config().expectedColumns().size());
        assertEquals(18, DatasetCatalog.VOTEVIEW_ROLLCALLS.config().expectedColumns().size());
        assertEquals(6, DatasetCatalog.VOTEVIEW_VOTES.config().expectedColumns().size());
    }

    @Test
    void every_dataset_has_a_numeric_checksum_and_declared_keys() {
        for (DatasetCatalog d : DatasetCatalog.values()) {
            TypeConfig cfg = d.config();
            assertSame(cfg, d.config());
            assertEquals(cfg.expectedColumns().size(), new HashSet<>(cfg.expectedColumns()).size(), d.datasetName());
            String checksum = cfg.checksumColumn().orElseThrow();
            assertTrue(cfg.typeOf(checksum).isNumeric(), d.datasetName());
            assertFalse(cfg.keyColumns().isEmpty(), d.datasetName());
        }
    }

    @Test
    void dime_exports_are_latin1_with_mysql_nulls() {
        TypeConfig cfg = DatasetCatalog.DIME_CONTRIBUTIONS.config();
        assertEquals(StandardCharsets.ISO_8859_1, cfg.charset());
        assertTrue(cfg.isNullToken("\\N"));
        assertEquals(ColumnType.FLOAT, cfg.typeOf("amount"));
        assertEquals(ColumnType.STRING, cfg.typeOf("contributor.zipcode"));
        assertEquals(ColumnType.FLOAT, DatasetCatalog.DIME_CONTRIBUTORS.config().typeOf("amount.2024"));
        assertTrue(DatasetCatalog.VOTEVIEW_MEMBERS.config().isNullToken("N/A"));
    }

    @Test
    void detects_dataset_from_file_name() {
        assertEquals(DatasetCatalog.DIME_RECIPIENTS, DatasetCatalog.detect("dime_recipients_1979_2024.csv.gz"));
        assertEquals(DatasetCatalog.DIME_CONTRIBUTORS, DatasetCatalog.detect("dime_contributors_1979_2024.csv"));
        assertEquals(DatasetCatalog.VOTEVIEW_MEMBERS, DatasetCatalog.detect("HSall_members.csv"));
        assertEquals(DatasetCatalog.VOTEVIEW_ROLLCALLS, DatasetCatalog.detect("HSall_rollcalls.csv"));
        assertEquals(DatasetCatalog.VOTEVIEW_VOTES, DatasetCatalog.detect("HSall_votes.csv"));
        assertEquals(DatasetCatalog.DIME_CONTRIBUTIONS, DatasetCatalog.detect("contribDB_2020.csv.gz"));
    }

    @Test
    void resolves_names_case_insensitively() {
        assertEquals(DatasetCatalog.VOTEVIEW_VOTES, DatasetCatalog.fromName("Voteview-Votes"));
        assertEquals(DatasetCatalog.DIME_CONTRIBUTIONS, DatasetCatalog.fromName("dime_contributions"));
        assertThrows(IllegalArgumentException.class, () -> DatasetCatalog.fromName("fec"));
    }
}
