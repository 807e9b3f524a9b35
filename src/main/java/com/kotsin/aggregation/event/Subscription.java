package com.kotsin.aggregation.event;

/**
 * Handle returned by {@code subscribe}; closing it detaches the handler.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    void unsubscribe();

    @Override
    default void close() {
        unsubscribe();
    }
}
