package com.kotsin.aggregation.source;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.kotsin.aggregation.exception.SourceDecodeException;
import com.kotsin.aggregation.model.FieldValue;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Decodes CSV with a header row into field mappings.
 *
 * Empty lines are skipped and numeric cells are cast to numbers. A row whose
 * column count differs from the header is a decode error. The underlying input
 * is opened on the first {@link #hasNext()} so open failures surface as decode errors.
 */
@Slf4j
public class CsvRecordSource implements RecordSource {

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.FAIL_ON_MISSING_COLUMNS)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .build();

    private static final ObjectReader READER = MAPPER
            .readerFor(Map.class)
            .with(CsvSchema.emptySchema().withHeader());

    @FunctionalInterface
    public interface ReaderOpener {
        Reader open() throws IOException;
    }

    private final String name;
    private final ReaderOpener opener;

    private volatile Reader reader;
    private volatile MappingIterator<Map<String, String>> rows;
    private volatile long rowNumber;
    private volatile boolean closed;

    public CsvRecordSource(String name, ReaderOpener opener) {
        this.name = name;
        this.opener = opener;
    }

    public static CsvRecordSource fromPath(Path path) {
        return new CsvRecordSource(path.getFileName().toString(),
                () -> Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    public static CsvRecordSource fromStream(String name, InputStream in) {
        return new CsvRecordSource(name, () -> new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    public static CsvRecordSource fromString(String name, String content) {
        return new CsvRecordSource(name, () -> new StringReader(content));
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public synchronized boolean hasNext() {
        if (closed) {
            return false;
        }
        try {
            if (rows == null) {
                reader = opener.open();
                rows = READER.readValues(reader);
            }
            return rows.hasNextValue();
        } catch (IOException | RuntimeJsonMappingException e) {
            throw decodeError(e);
        }
    }

    @Override
    public synchronized Object next() {
        if (!hasNext()) {
            throw new NoSuchElementException("CSV source '" + name + "' is exhausted");
        }
        try {
            Map<String, String> row = rows.nextValue();
            rowNumber++;

            Map<String, Object> decoded = new LinkedHashMap<>();
            row.forEach((field, cell) -> decoded.put(field, FieldValue.parse(cell)));
            return decoded;
        } catch (IOException | RuntimeJsonMappingException e) {
            throw decodeError(e);
        }
    }

    private SourceDecodeException decodeError(Exception e) {
        return new SourceDecodeException("Malformed CSV in '" + name + "' after row " + rowNumber
                + ": " + e.getMessage(), e);
    }

    public long getRowNumber() {
        return rowNumber;
    }

    /**
     * Not synchronized with {@link #hasNext()} or {@link #next()} so a blocked read can be interrupted by closing.
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        try {
            if (rows != null) {
                rows.close();
            }
        } finally {
            if (reader != null) {
                reader.close();
            }
        }
        log.debug("Closed CSV source '{}' after {} rows", name, rowNumber);
    }
}
