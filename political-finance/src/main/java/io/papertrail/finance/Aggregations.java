package io.papertrail.finance;

import io.papertrail.aggregate.AggregationSpec;
import io.papertrail.filter.RowCondition;

/** Roll-ups derived from converted datasets. */
public final class Aggregations {
    /** 96th Congress, 1979-1980, the first cycle DIME covers. */
    public static final int DEFAULT_MIN_CONGRESS = 96;

    /** DIME marks individual donors with contributor type {@code I}; every other type is an organization. */
    public static final String INDIVIDUAL = "I";

    /** Rows from PACs, corporations, committees, unions and other organizations. Rows with no type are dropped. */
    public static final RowCondition ORGANIZATIONAL = RowCondition.notEqualTo("contributor.type", INDIVIDUAL);
    public static final RowCondition INDIVIDUALS = RowCondition.equalTo("contributor.type", INDIVIDUAL);

    private Aggregations() {}

    /**
     * One row per legislator from Voteview members: latest name, state, party and NOMINATE scores, plus the
     * ordered list of congresses served.
     */
    public static AggregationSpec distinctLegislators(int minCongress) {
        return AggregationSpec.builder("distinct-legislators")
                .key("bioguide_id")
                .orderBy("congress")
                .minOrder(minCongress)
                .latest("bioname")
                .latest("state_abbrev")
                .latest("party_code")
                .list("congresses_served", "congress")
                .min("first_congress", "congress")
                .max("last_congress", "congress")
                .latest("nominate_dim1")
                .latest("nominate_dim2")
                .build();
    }

    /**
     * Contribution totals per DIME recipient from converted contributions, split into individual and
     * organizational donors. Descriptive columns come from the recipient's latest cycle.
     */
    public static AggregationSpec recipientTotals() {
        return AggregationSpec.builder("recipient-totals")
                .key("bonica.rid")
                .orderBy("cycle")
                .latest("recipient.name")
                .latest("recipient.party")
                .latest("recipient.type")
                .latest("recipient.state")
                .latest("candidate.cfscore")
                .sum("total_amount", "amount")
                .avg("avg_amount", "amount")
                .count("contribution_count", "bonica.rid")
                .sumWhere("individual_total", "amount", INDIVIDUALS)
                .countWhere("individual_count", "bonica.rid", INDIVIDUALS)
                .sumWhere("organizational_total", "amount", ORGANIZATIONAL)
                .countWhere("organizational_count", "bonica.rid", ORGANIZATIONAL)
                .min("first_cycle", "cycle")
                .max("last_cycle", "cycle")
                .build();
    }
}
