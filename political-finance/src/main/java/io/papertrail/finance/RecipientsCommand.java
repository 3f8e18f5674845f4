package io.papertrail.finance;

import io.papertrail.aggregate.AggregationOptions;
import io.papertrail.aggregate.AggregationResult;
import io.papertrail.error.ConversionException;
import io.papertrail.runtime.ConversionEngine;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "recipients", mixinStandardHelpOptions = true,
        description = "Build contribution totals per recipient from a converted DIME contributions Parquet file")
public final class RecipientsCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    PaperTrailMain parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "DIME contributions Parquet file")
    Path source;

    @CommandLine.Parameters(index = "1", description = "Output Parquet path")
    Path output;

    @CommandLine.Option(names = "--aggregation-sample-size", defaultValue = "100", description = "Keys re-derived by the integrity tier (default: ${DEFAULT-VALUE})")
    int aggregationSampleSize;

    @CommandLine.Option(names = "--deep-sample-size", defaultValue = "50", description = "Keys checked by the sample tier (default: ${DEFAULT-VALUE})")
    int deepSampleSize;

    @CommandLine.Option(names = "--no-validate", description = "Skip the validation tiers")
    boolean noValidate;

    @CommandLine.Option(names = "--seed", description = "Seed for key sampling")
    Long seed;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        out.println("[" + Instant.now() + "] Aggregating recipients: " + source);
        ConversionEngine engine = parent.injector().getInstance(ConversionEngine.class);
        AggregationOptions options = new AggregationOptions(!noValidate, aggregationSampleSize, deepSampleSize, seed);
        try {
            AggregationResult result = engine.aggregate(source, output, Aggregations.recipientTotals(), options);
            Reports.printAggregation(out, result);
        } catch (ConversionException e) {
            err.println("ERROR: " + e.getMessage());
            return PaperTrailMain.EXIT_FAILED;
        } finally {
            Reports.printMetrics(out, parent.injector());
            out.flush();
        }
        return PaperTrailMain.EXIT_OK;
    }
}
