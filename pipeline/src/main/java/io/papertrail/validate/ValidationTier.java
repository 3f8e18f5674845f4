package io.papertrail.validate;

import io.papertrail.error.ConversionException;

/**
 * One gate of the validation sequence. A tier records what it checked on the result builder and throws on
 * the first disagreement.
 */
public interface ValidationTier {
    String name();

    void verify(ValidationContext ctx, ValidationResult.Builder result) throws ConversionException;
}
