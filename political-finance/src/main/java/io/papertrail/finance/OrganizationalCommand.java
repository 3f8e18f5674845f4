package io.papertrail.finance;

import io.papertrail.error.ConversionException;
import io.papertrail.filter.FilterOptions;
import io.papertrail.filter.FilterResult;
import io.papertrail.runtime.ConversionEngine;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "organizational", mixinStandardHelpOptions = true,
        description = "Extract contributions from organizations (contributor type other than I) from a converted DIME contributions Parquet file")
public final class OrganizationalCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    PaperTrailMain parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "DIME contributions Parquet file")
    Path source;

    @CommandLine.Parameters(index = "1", description = "Output Parquet path")
    Path output;

    @CommandLine.Option(names = "--sample-size", defaultValue = "100", description = "Output rows compared with their source rows (default: ${DEFAULT-VALUE})")
    int sampleSize;

    @CommandLine.Option(names = "--no-validate", description = "Skip the validation tiers")
    boolean noValidate;

    @CommandLine.Option(names = "--seed", description = "Seed for row sampling")
    Long seed;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        out.println("[" + Instant.now() + "] Extracting organizational contributions: " + source);
        ConversionEngine engine = parent.injector().getInstance(ConversionEngine.class);
        FilterOptions options = new FilterOptions(!noValidate, sampleSize, seed);
        try {
            FilterResult result = engine.filter(source, output, Aggregations.ORGANIZATIONAL, options);
            Reports.printFilter(out, result);
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
