package io.papertrail.core;

import io.papertrail.error.ConversionException;

/**
 * Transform maps one input record to exactly one output record, keeping its seq and line.
 */
public interface Transform<I, O> {
    Record<O> apply(Record<I> input) throws ConversionException;
}
