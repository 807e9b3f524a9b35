package com.kotsin.aggregation.source;

import com.kotsin.aggregation.exception.SourceDecodeException;

import java.io.IOException;

/**
 * Pull-based boundary to an external decoder.
 *
 * A source yields decoded values in input order. End-of-input is signalled only
 * by {@link #hasNext()} returning {@code false}; malformed input throws
 * {@link SourceDecodeException}. Values that are not field mappings, {@code null}
 * included, are returned as-is and rejected downstream.
 */
public interface RecordSource extends AutoCloseable {

    String getName();

    /**
     * @return {@code true} while another decoded value is available
     */
    boolean hasNext() throws SourceDecodeException;

    /**
     * @return the next decoded value, which may itself be {@code null}
     * @throws java.util.NoSuchElementException once input is exhausted
     */
    Object next() throws SourceDecodeException;

    @Override
    void close() throws IOException;
}
