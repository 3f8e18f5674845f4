package io.papertrail.finance;

import io.papertrail.config.ConversionOptions;
import io.papertrail.config.TypeConfig;
import io.papertrail.error.ConversionException;
import io.papertrail.runtime.ConversionEngine;
import io.papertrail.runtime.ConversionResult;
import io.papertrail.source.SourceHandle;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "convert", mixinStandardHelpOptions = true,
        description = "Convert a delimited DIME or Voteview file (optionally .gz, local or http(s)) to Parquet")
public final class ConvertCommand implements Callable<Integer> {
    @CommandLine.ParentCommand
    PaperTrailMain parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", description = "Source file path or URL")
    String source;

    @CommandLine.Parameters(index = "1", description = "Output Parquet path")
    Path output;

    @CommandLine.Option(names = {"-t", "--type"}, description = "Dataset type, e.g. dime-contributions, voteview-votes; detected from the file name when omitted")
    String type;

    @CommandLine.Option(names = "--no-validate", description = "Skip the validation tiers")
    boolean noValidate;

    @CommandLine.Option(names = "--sample-size", description = "Rows re-read by the sample tier (default: per dataset)")
    Integer sampleSize;

    @CommandLine.Option(names = "--batch-size", description = "Rows per batch (default: engine setting)")
    Integer batchSize;

    @CommandLine.Option(names = "--seed", description = "Seed for sample selection")
    Long seed;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        DatasetCatalog dataset;
        try {
            dataset = type != null ? DatasetCatalog.fromName(type) : DatasetCatalog.detect(fileName(source));
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return PaperTrailMain.EXIT_USAGE;
        }
        TypeConfig config = dataset.config();
        ConversionOptions options = ConversionOptions.defaults()
                .withValidate(!noValidate)
                .withSampleSize(sampleSize)
                .withBatchSize(batchSize)
                .withSeed(seed);

        out.println("[" + Instant.now() + "] Converting: " + source);
        out.println("  Dataset: " + dataset.datasetName());
        ConversionEngine engine = parent.injector().getInstance(ConversionEngine.class);
        try {
            ConversionResult result = engine.convert(SourceHandle.parse(source), output, config, options);
            Reports.printConversion(out, result);
        } catch (ConversionException e) {
            err.println("ERROR: " + e.getMessage());
            return PaperTrailMain.EXIT_FAILED;
        } finally {
            Reports.printMetrics(out, parent.injector());
            out.flush();
        }
        return PaperTrailMain.EXIT_OK;
    }

    private static String fileName(String location) {
        int slash = location.lastIndexOf('/');
        return slash >= 0 ? location.substring(slash + 1) : location;
    }
}
