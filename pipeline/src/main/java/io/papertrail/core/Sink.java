package io.papertrail.core;

import io.papertrail.error.ConversionException;

/**
 * Sink consumes records in source order.
 */
public interface Sink<T> extends AutoCloseable {
    void accept(Record<T> record) throws ConversionException;

    @Override
    default void close() throws ConversionException {}
}
