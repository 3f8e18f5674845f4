package io.papertrail.ingestor;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.papertrail.Fixtures;
import io.papertrail.config.ConversionOptions;
import io.papertrail.config.EngineConfig;
import io.papertrail.metrics.Metrics;
import io.papertrail.runtime.ConversionEngine;
import io.papertrail.source.SourceHandle;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class ConversionModuleTest {

    @Test
    void engine_and_metrics_are_shared_singletons() {
        Injector injector = Guice.createInjector(new ConversionModule(Fixtures.engine()));
        assertSame(injector.getInstance(ConversionEngine.class), injector.getInstance(ConversionEngine.class));
        assertSame(injector.getInstance(MetricRegistry.class), injector.getInstance(Metrics.class).registry());
        assertEquals(1000, injector.getInstance(EngineConfig.class).batchSize());
    }

    @Test
    void conversion_records_metrics_in_the_shared_registry() throws Exception {
        Injector injector = Guice.createInjector(new ConversionModule(Fixtures.engine()));
        Path dir = Files.createTempDirectory("module");
        SourceHandle source = SourceHandle.of(Fixtures.write(dir, "a.csv", Fixtures.AMOUNTS));
        injector.getInstance(ConversionEngine.class).convert(source, dir.resolve("a.parquet"), Fixtures.amounts(), ConversionOptions.defaults());

        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        assertEquals(5, registry.meter(Metrics.CONVERT_ROWS).getCount());
        assertEquals(1, registry.timer(Metrics.ROWCOUNT_TIME).getCount());
        assertEquals(1, registry.timer("validate.tier1.time").getCount());
        assertEquals(1, registry.timer("validate.tier3.time").getCount());
    }
}
