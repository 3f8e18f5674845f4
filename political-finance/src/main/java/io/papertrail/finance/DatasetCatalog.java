package io.papertrail.finance;

import io.papertrail.config.TypeConfig;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Type configurations of the DIME campaign-finance exports and the Voteview congressional tables.
 * Identifier, code and ZIP columns stay text so leading zeros survive.
 */
public enum DatasetCatalog {
    DIME_CONTRIBUTIONS("dime-contributions") {
        @Override
        TypeConfig build() {
            return dime(datasetName)
                    .integers("cycle")
                    .strings("transaction.id", "transaction.type")
                    .floats("amount")
                    .strings("date", "bonica.cid", "contributor.name", "contributor.lname", "contributor.fname",
                            "contributor.mname", "contributor.suffix", "contributor.title", "contributor.ffname",
                            "contributor.type", "contributor.gender", "contributor.address", "contributor.city",
                            "contributor.state", "contributor.zipcode", "contributor.occupation", "contributor.employer",
                            "occ.standardized", "is.corp", "recipient.name", "bonica.rid", "recipient.party",
                            "recipient.type", "recipient.state", "seat", "election.type", "latitude", "longitude")
                    .floats("gis.confidence", "contributor.cfscore", "candidate.cfscore")
                    .strings("contributor.district", "censustract")
                    .integers("excluded.from.scaling")
                    .strings("efec.memo", "efec.memo2", "efec.transaction.id.orig", "bk.ref.transaction.id",
                            "efec.org.orig", "efec.comid.orig", "efec.form.type")
                    .checksumColumn("amount")
                    .keyColumns("transaction.id", "bonica.cid", "contributor.name", "amount")
                    .build();
        }
    },
    DIME_RECIPIENTS("dime-recipients") {
        @Override
        TypeConfig build() {
            return dime(datasetName)
                    .strings("election")
                    .floats("cycle", "fecyear")
                    .strings("bonica.rid", "bonica.cid", "name", "lname", "ffname", "fname", "mname", "title", "suffix",
                            "party", "state", "seat", "district", "distcyc", "ico.status", "cand.gender", "pwinner",
                            "gwinner", "s.elec.stat", "r.elec.stat", "fec.cand.status", "recipient.type", "igcat",
                            "comtype", "ICPSR", "ICPSR2", "Cand.ID", "FEC.ID", "NID", "before.switch.ICPSR",
                            "after.switch.ICPSR", "party.orig", "nimsp.party", "nimsp.candidate.ICO.code",
                            "nimsp.district", "nimsp.office", "nimsp.candidate.status", "included_in_scaling")
                    .floats("num.givers", "num.givers.total", "recipient.cfscore", "recipient.cfscore.dyn",
                            "contributor.cfscore", "dwdime", "dwnom1", "dwnom2", "ps.dwnom1", "ps.dwnom2", "irt.cfscore",
                            "composite.score", "total.receipts", "total.disbursements", "total.indiv.contribs",
                            "total.unitemized", "total.pac.contribs", "total.party.contribs",
                            "total.contribs.from.candidate", "ind.exp.support", "ind.exp.oppose", "prim.vote.pct",
                            "gen.vote.pct", "district.pres.vs")
                    .checksumColumn("recipient.cfscore")
                    .keyColumns("bonica.rid", "bonica.cid", "name")
                    .build();
        }
    },
    DIME_CONTRIBUTORS("dime-contributors") {
        @Override
        TypeConfig build() {
            TypeConfig.Builder b = dime(datasetName)
                    .strings("bonica.cid", "contributor.type", "most.recent.contributor.name",
                            "most.recent.contributor.address", "most.recent.contributor.city",
                            "most.recent.contributor.zipcode", "most.recent.contributor.state",
                            "most.recent.contributor.occupation", "most.recent.contributor.employer",
                            "most.recent.transaction.id", "most.recent.transaction.date", "contributor.gender",
                            "is.corp", "is.projected")
                    .floats("num.distinct", "most.recent.contributor.latitude", "most.recent.contributor.longitude",
                            "contributor.cfscore", "first_cycle_active", "last_cycle_active");
            for (int year = 1980; year <= 2024; year += 2) b.floats("amount." + year);
            return b.checksumColumn("contributor.cfscore")
                    .keyColumns("bonica.cid", "most.recent.contributor.name")
                    .build();
        }
    },
    VOTEVIEW_MEMBERS("voteview-members") {
        @Override
        TypeConfig build() {
            return voteview(datasetName)
                    .integers("congress")
                    .strings("chamber")
                    .integers("icpsr")
                    .floats("state_icpsr", "district_code")
                    .strings("state_abbrev")
                    .floats("party_code", "occupancy", "last_means")
                    .strings("bioname", "bioguide_id")
                    .floats("born", "died", "nominate_dim1", "nominate_dim2", "nominate_log_likelihood",
                            "nominate_geo_mean_probability", "nominate_number_of_votes", "nominate_number_of_errors",
                            "conditional", "nokken_poole_dim1", "nokken_poole_dim2")
                    .checksumColumn("nominate_number_of_votes")
                    .keyColumns("icpsr", "congress", "chamber", "bioname")
                    .defaultSampleSize(1000)
                    .build();
        }
    },
    VOTEVIEW_ROLLCALLS("voteview-rollcalls") {
        @Override
        TypeConfig build() {
            return voteview(datasetName)
                    .integers("congress")
                    .strings("chamber")
                    .integers("rollnumber")
                    .strings("date")
                    .floats("session", "clerk_rollnumber")
                    .integers("yea_count", "nay_count")
                    .floats("nominate_mid_1", "nominate_mid_2", "nominate_spread_1", "nominate_spread_2",
                            "nominate_log_likelihood")
                    .strings("bill_number", "vote_result", "vote_desc", "vote_question", "dtl_desc")
                    .checksumColumn("yea_count")
                    .keyColumns("congress", "chamber", "rollnumber", "date")
                    .defaultSampleSize(1000)
                    .build();
        }
    },
    VOTEVIEW_VOTES("voteview-votes") {
        @Override
        TypeConfig build() {
            return voteview(datasetName)
                    .integers("congress")
                    .strings("chamber")
                    .floats("rollnumber", "icpsr", "cast_code", "prob")
                    .checksumColumn("cast_code")
                    .keyColumns("congress", "chamber", "rollnumber", "icpsr", "cast_code")
                    .defaultSampleSize(2000)
                    .build();
        }
    };

    final String datasetName;
    private TypeConfig config;

    DatasetCatalog(String name) {
        this.datasetName = name;
    }

    abstract TypeConfig build();

    public String datasetName() { return datasetName; }

    public synchronized TypeConfig config() {
        if (config == null) config = build();
        return config;
    }

    public static DatasetCatalog fromName(String name) {
        for (DatasetCatalog d : values()) {
            if (d.datasetName.equalsIgnoreCase(name) || d.name().equalsIgnoreCase(name)) return d;
        }
        throw new IllegalArgumentException("unknown dataset type: " + name);
    }

    /** Guesses the dataset from a file name; anything unrecognised is taken as DIME contributions. */
    public static DatasetCatalog detect(String fileName) {
        String n = fileName.toLowerCase(Locale.ROOT);
        if (n.contains("recipient")) return DIME_RECIPIENTS;
        if (n.contains("contributor")) return DIME_CONTRIBUTORS;
        if (n.contains("member")) return VOTEVIEW_MEMBERS;
        if (n.contains("rollcall")) return VOTEVIEW_ROLLCALLS;
        if (n.contains("vote")) return VOTEVIEW_VOTES;
        return DIME_CONTRIBUTIONS;
    }

    // DIME exports are MySQL dumps in Latin-1 with \N for null
    private static TypeConfig.Builder dime(String name) {
        return TypeConfig.builder(name).nullTokens("\\N", "").charset(StandardCharsets.ISO_8859_1);
    }

    private static TypeConfig.Builder voteview(String name) {
        return TypeConfig.builder(name).nullTokens("", "N/A");
    }
}
