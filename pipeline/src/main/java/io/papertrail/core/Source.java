package io.papertrail.core;

import io.papertrail.error.ConversionException;

import java.util.Optional;

/**
 * A finite, forward-only producer of records in source order.
 */
public interface Source<T> extends AutoCloseable {
    /**
     * Fetch the next record. Returns empty once the source is exhausted, after which {@link #isFinished()}
     * reports true.
     */
    Optional<Record<T>> poll() throws ConversionException;

    boolean isFinished();

    @Override
    default void close() throws ConversionException {}
}
