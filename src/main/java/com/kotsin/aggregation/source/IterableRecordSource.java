package com.kotsin.aggregation.source;

import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * In-memory source over already decoded values.
 */
public class IterableRecordSource implements RecordSource {

    private final String name;
    private final Iterator<?> values;
    private volatile boolean closed;

    public IterableRecordSource(String name, Iterable<?> values) {
        this.name = name;
        this.values = values.iterator();
    }

    public static IterableRecordSource of(String name, Object... values) {
        List<Object> list = Arrays.asList(values);
        return new IterableRecordSource(name, list);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean hasNext() {
        return !closed && values.hasNext();
    }

    @Override
    public Object next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Source '" + name + "' is exhausted");
        }
        return values.next();
    }

    @Override
    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
