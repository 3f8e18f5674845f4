package io.papertrail.validate;

import com.codahale.metrics.Timer;
import io.papertrail.error.ConversionException;
import io.papertrail.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs validation tiers strictly in order. The first failing tier raises and later tiers never run.
 */
public class TieredValidator {
    private static final Logger log = LoggerFactory.getLogger(TieredValidator.class);

    private final List<ValidationTier> tiers;
    private final Metrics metrics;

    public TieredValidator(List<ValidationTier> tiers, Metrics metrics) {
        this.tiers = List.copyOf(tiers);
        this.metrics = metrics;
    }

    /** Row count, then checksum, then sample. */
    public static TieredValidator standard(Metrics metrics) {
        return new TieredValidator(List.of(new RowCountTier(), new ChecksumTier(), new SampleTier()), metrics);
    }

    public ValidationResult validate(ValidationContext ctx) throws ConversionException {
        ValidationResult.Builder result = ValidationResult.builder();
        for (int i = 0; i < tiers.size(); i++) {
            ValidationTier tier = tiers.get(i);
            int n = i + 1;
            try (Timer.Context ignored = metrics.tierTimer(n).time()) {
                tier.verify(ctx, result);
            } catch (ConversionException e) {
                log.warn("Tier {} ({}) FAILED for {}", n, tier.name(), ctx.sourceName());
                throw e;
            }
            log.info("Tier {} ({}) PASS", n, tier.name());
        }
        return result.build();
    }
}
