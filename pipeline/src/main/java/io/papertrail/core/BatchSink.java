package io.papertrail.core;

import io.papertrail.error.ConversionException;

import java.util.List;

/** Sink capability to consume records in batches for IO efficiency. */
public interface BatchSink<T> extends Sink<T> {
    void acceptBatch(List<Record<T>> records) throws ConversionException;

    @Override
    default void accept(Record<T> record) throws ConversionException {
        acceptBatch(List.of(record));
    }
}
