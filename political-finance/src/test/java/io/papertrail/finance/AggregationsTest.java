package io.papertrail.finance;

import io.papertrail.aggregate.AggregationSpec;
import io.papertrail.aggregate.OutputColumn;
import io.papertrail.aggregate.Reduction;
import io.papertrail.config.TypeConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AggregationsTest {

    @Test
    void legislator_rollup_reads_only_member_columns() {
        AggregationSpec spec = Aggregations.distinctLegislators(Aggregations.DEFAULT_MIN_CONGRESS);
        TypeConfig members = DatasetCatalog.VOTEVIEW_MEMBERS.config();
        for (String c : spec.sourceColumns()) assertTrue(members.expectedColumns().contains(c), c);
        assertEquals("bioguide_id", spec.keyOutputColumn());
        assertEquals(96L, spec.minOrder().orElseThrow());
        assertTrue(spec.columns().stream().anyMatch(c -> c.reduction() == Reduction.LIST && c.name().equals("congresses_served")));
        assertFalse(spec.includes("B000001", 95L));
        assertTrue(spec.includes("B000001", 96L));
        assertFalse(spec.includes(null, 100L));
    }

    @Test
    void recipient_rollup_reads_only_contribution_columns() {
        AggregationSpec spec = Aggregations.recipientTotals();
        TypeConfig contributions = DatasetCatalog.DIME_CONTRIBUTIONS.config();
        for (String c : spec.sourceColumns()) assertTrue(contributions.expectedColumns().contains(c), c);
        assertTrue(spec.minOrder().isEmpty());
        assertTrue(spec.sourceColumns().contains("contributor.type"));
    }

    @Test
    void recipient_rollup_carries_type_split_columns() {
        List<String> names = Aggregations.recipientTotals().columns().stream().map(OutputColumn::name).toList();
        assertEquals(List.of("bonica.rid", "recipient.name", "recipient.party", "recipient.type", "recipient.state",
                "candidate.cfscore", "total_amount", "avg_amount", "contribution_count", "individual_total",
                "individual_count", "organizational_total", "organizational_count", "first_cycle", "last_cycle"), names);
    }

    @Test
    void organizational_condition_drops_individuals_and_untyped_rows() {
        assertTrue(Aggregations.ORGANIZATIONAL.test("C"));
        assertTrue(Aggregations.ORGANIZATIONAL.test("PAC"));
        assertFalse(Aggregations.ORGANIZATIONAL.test("I"));
        assertFalse(Aggregations.ORGANIZATIONAL.test(null));
        assertTrue(DatasetCatalog.DIME_CONTRIBUTIONS.config().expectedColumns().contains(Aggregations.ORGANIZATIONAL.column()));
    }
}
