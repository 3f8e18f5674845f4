package io.papertrail.finance;

import com.google.inject.Guice;
import com.google.inject.Injector;
import io.papertrail.config.EngineConfig;
import io.papertrail.ingestor.ConversionModule;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/**
 * Command-line front end: converts DIME and Voteview exports to Parquet, builds the per-legislator and
 * per-recipient roll-ups and extracts organizational contributions, validating each output before reporting
 * success.
 */
@CommandLine.Command(name = "paper-trail", mixinStandardHelpOptions = true,
        description = "Convert political-finance datasets to Parquet with tiered validation",
        subcommands = {ConvertCommand.class, LegislatorsCommand.class, RecipientsCommand.class, OrganizationalCommand.class})
public final class PaperTrailMain implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    private final EngineConfig config;
    private Injector injector;

    public PaperTrailMain() {
        this(EngineConfig.fromEnv());
    }

    PaperTrailMain(EngineConfig config) {
        this.config = config;
    }

    public static void main(String[] args) {
        int code = new CommandLine(new PaperTrailMain()).execute(args);
        System.exit(code);
    }

    synchronized Injector injector() {
        if (injector == null) injector = Guice.createInjector(new ConversionModule(config));
        return injector;
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getErr());
        return EXIT_USAGE;
    }
}
