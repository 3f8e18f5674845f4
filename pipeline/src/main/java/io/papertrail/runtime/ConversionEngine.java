package io.papertrail.runtime;

import io.papertrail.aggregate.AggregationOptions;
import io.papertrail.aggregate.AggregationResult;
import io.papertrail.aggregate.AggregationSpec;
import io.papertrail.aggregate.AggregationValidationResult;
import io.papertrail.aggregate.AggregationValidator;
import io.papertrail.aggregate.GroupingAggregator;
import io.papertrail.config.ConversionOptions;
import io.papertrail.config.EngineConfig;
import io.papertrail.config.TypeConfig;
import io.papertrail.error.ConversionException;
import io.papertrail.filter.FilterOptions;
import io.papertrail.filter.FilterResult;
import io.papertrail.filter.FilterValidationResult;
import io.papertrail.filter.FilterValidator;
import io.papertrail.filter.RowCondition;
import io.papertrail.filter.RowFilter;
import io.papertrail.source.RowCounter;
import io.papertrail.source.SourceHandle;
import io.papertrail.validate.SchemaValidator;
import io.papertrail.validate.TieredValidator;
import io.papertrail.validate.ValidationContext;
import io.papertrail.validate.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Random;

/**
 * Caller-facing entry point. A conversion counts the source rows, streams the source into Parquet, checks
 * the realized schema and, when asked, runs the validation tiers. Aggregations and row filters work on
 * converted Parquet files, each with its own validation tiers. Runs share no mutable state, so one engine
 * may serve concurrent runs on different outputs.
 */
public class ConversionEngine {
    private static final Logger log = LoggerFactory.getLogger(ConversionEngine.class);

    private final EngineConfig config;
    private final RowCounter rowCounter;
    private final StreamingConverter converter;
    private final SchemaValidator schemaValidator;
    private final TieredValidator tieredValidator;
    private final GroupingAggregator aggregator;
    private final AggregationValidator aggregationValidator;
    private final RowFilter rowFilter;
    private final FilterValidator filterValidator;

    public ConversionEngine(EngineConfig config, RowCounter rowCounter, StreamingConverter converter,
                            SchemaValidator schemaValidator, TieredValidator tieredValidator,
                            GroupingAggregator aggregator, AggregationValidator aggregationValidator,
                            RowFilter rowFilter, FilterValidator filterValidator) {
        this.config = config;
        this.rowCounter = rowCounter;
        this.converter = converter;
        this.schemaValidator = schemaValidator;
        this.tieredValidator = tieredValidator;
        this.aggregator = aggregator;
        this.aggregationValidator = aggregationValidator;
        this.rowFilter = rowFilter;
        this.filterValidator = filterValidator;
    }

    public ConversionResult convert(SourceHandle source, Path output, TypeConfig typeConfig, ConversionOptions options) throws ConversionException {
        long expected = rowCounter.count(source, typeConfig);
        StreamingStats stats = converter.convert(source, output, typeConfig, options.batchSizeOr(config.batchSize()));
        schemaValidator.validate(source.name(), stats.observedSchema(), typeConfig);
        ValidationResult validation = null;
        if (options.validate()) {
            int sampleSize = options.sampleSizeOr(typeConfig.defaultSampleSize());
            validation = validate(source, output, stats, typeConfig, sampleSize, expected, options.seed());
        } else {
            log.info("Validation skipped for {} ({} source rows counted)", source.name(), expected);
        }
        return new ConversionResult(source.name(), output, stats.rowCount(), validation, stats);
    }

    /** Validates an existing output, re-counting the source rows first. */
    public ValidationResult validate(SourceHandle source, Path output, StreamingStats stats, TypeConfig typeConfig, int sampleSize) throws ConversionException {
        return validate(source, output, stats, typeConfig, sampleSize, rowCounter.count(source, typeConfig), null);
    }

    public ValidationResult validate(SourceHandle source, Path output, StreamingStats stats, TypeConfig typeConfig,
                                     int sampleSize, long expectedRowCount, Long seed) throws ConversionException {
        log.info("Validating {} against {} ({} expected rows, sample {})", output, source.name(), expectedRowCount, sampleSize);
        ValidationContext ctx = new ValidationContext(source, output, stats, typeConfig, expectedRowCount, sampleSize, random(seed));
        ValidationResult result = tieredValidator.validate(ctx);
        log.info("All validation tiers passed for {}", output);
        return result;
    }

    public AggregationResult aggregate(Path source, Path output, AggregationSpec spec, AggregationOptions options) throws ConversionException {
        GroupingAggregator.Outcome outcome = aggregator.aggregate(source, output, spec);
        AggregationValidationResult validation = null;
        if (options.validate()) {
            validation = aggregationValidator.validate(source, output, spec, options.aggregationSampleSize(),
                    options.deepSampleSize(), random(options.seed()));
        }
        return new AggregationResult(source, output, outcome.sourceRows(), outcome.outputKeys(), validation);
    }

    /** Writes the rows of a Parquet source that satisfy {@code keep} to a new Parquet file. */
    public FilterResult filter(Path source, Path output, RowCondition keep, FilterOptions options) throws ConversionException {
        RowFilter.Outcome outcome = rowFilter.filter(source, output, keep);
        FilterValidationResult validation = null;
        if (options.validate()) {
            validation = filterValidator.validate(source, output, keep, options.sampleSize(), random(options.seed()));
        }
        return new FilterResult(source, output, keep, outcome.sourceRows(), outcome.keptRows(), validation);
    }

    private static Random random(Long seed) {
        return seed != null ? new Random(seed) : new Random();
    }
}
