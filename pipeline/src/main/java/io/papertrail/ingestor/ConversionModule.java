package io.papertrail.ingestor;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.papertrail.aggregate.AggregationValidator;
import io.papertrail.aggregate.GroupingAggregator;
import io.papertrail.config.EngineConfig;
import io.papertrail.filter.FilterValidator;
import io.papertrail.filter.RowFilter;
import io.papertrail.metrics.Metrics;
import io.papertrail.runtime.ConversionEngine;
import io.papertrail.runtime.StreamingConverter;
import io.papertrail.source.RowCounter;
import io.papertrail.validate.SchemaValidator;
import io.papertrail.validate.TieredValidator;

public class ConversionModule extends AbstractModule {
    private final EngineConfig config;

    public ConversionModule(EngineConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(EngineConfig.class).toInstance(config);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides RowCounter rowCounter(Metrics metrics) { return new RowCounter(metrics); }

    @Provides StreamingConverter converter(Metrics metrics) { return new StreamingConverter(config, metrics); }

    @Provides TieredValidator tieredValidator(Metrics metrics) { return TieredValidator.standard(metrics); }

    @Provides GroupingAggregator aggregator(Metrics metrics) { return new GroupingAggregator(config, metrics); }

    @Provides AggregationValidator aggregationValidator(Metrics metrics) { return new AggregationValidator(metrics); }

    @Provides RowFilter rowFilter(Metrics metrics) { return new RowFilter(config, metrics); }

    @Provides FilterValidator filterValidator(Metrics metrics) { return new FilterValidator(metrics); }

    @Provides @Singleton ConversionEngine engine(RowCounter counter, StreamingConverter converter, TieredValidator validator,
                                                 GroupingAggregator aggregator, AggregationValidator aggregationValidator,
                                                 RowFilter rowFilter, FilterValidator filterValidator) {
        return new ConversionEngine(config, counter, converter, new SchemaValidator(), validator, aggregator, aggregationValidator,
                rowFilter, filterValidator);
    }
}
