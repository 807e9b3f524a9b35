package com.kotsin.aggregation.source;

import com.kotsin.aggregation.exception.SourceDecodeException;
import com.kotsin.aggregation.model.FieldValue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CsvRecordSource")
class CsvRecordSourceTest {

    @SuppressWarnings("unchecked")
    private static List<Map<String, FieldValue>> drain(RecordSource source) {
        List<Map<String, FieldValue>> rows = new ArrayList<>();
        while (source.hasNext()) {
            rows.add((Map<String, FieldValue>) source.next());
        }
        return rows;
    }

    // ========== DECODING TESTS ==========

    @Test
    @DisplayName("Header row should name the fields and numeric cells should be cast")
    void testDecode() {
        CsvRecordSource source = CsvRecordSource.fromString("sales.csv", "category,value\nA,10\nB,2.5\n");

        List<Map<String, FieldValue>> rows = drain(source);

        assertEquals(2, rows.size());
        assertEquals(List.of("category", "value"), List.copyOf(rows.get(0).keySet()));
        assertFalse(rows.get(0).get("category").isNumeric());
        assertEquals("A", rows.get(0).get("category").asText());
        assertEquals(10.0, rows.get(0).get("value").asDouble());
        assertEquals(2.5, rows.get(1).get("value").asDouble());
        assertEquals(2, source.getRowNumber());
    }

    @Test
    @DisplayName("Empty lines should be skipped")
    void testSkipEmptyLines() {
        CsvRecordSource source = CsvRecordSource.fromString("gaps.csv", "id,value\n1,10\n\n2,20\n\n");

        assertEquals(2, drain(source).size());
    }

    @Test
    @DisplayName("A header without rows should yield no records")
    void testHeaderOnly() {
        CsvRecordSource source = CsvRecordSource.fromString("empty.csv", "id,value\n");

        assertFalse(source.hasNext());
        assertThrows(NoSuchElementException.class, source::next);
    }

    @Test
    @DisplayName("Should read from a file on disk")
    void testFromPath(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("data.csv");
        Files.writeString(file, "id,value\n1,10\n2,20\n3,30\n", StandardCharsets.UTF_8);

        try (CsvRecordSource source = CsvRecordSource.fromPath(file)) {
            assertEquals("data.csv", source.getName());
            assertEquals(3, drain(source).size());
        }
    }

    // ========== DECODE ERROR TESTS ==========

    @Test
    @DisplayName("A row with more cells than the header should be a decode error")
    void testTooManyColumns() {
        CsvRecordSource source = CsvRecordSource.fromString("invalid.csv", "invalid,csv,format\na,b,c,d\n");

        assertThrows(SourceDecodeException.class, source::next);
    }

    @Test
    @DisplayName("A row with fewer cells than the header should be a decode error")
    void testMissingColumns() {
        CsvRecordSource source = CsvRecordSource.fromString("short.csv", "a,b,c\n1,2,3\n4\n");

        assertNotNull(source.next());
        assertThrows(SourceDecodeException.class, source::next);
    }

    @Test
    @DisplayName("A file that cannot be opened should surface as a decode error")
    void testMissingFile(@TempDir Path dir) {
        CsvRecordSource source = CsvRecordSource.fromPath(dir.resolve("nope.csv"));

        assertThrows(SourceDecodeException.class, source::next);
    }

    // ========== LIFECYCLE TESTS ==========

    @Test
    @DisplayName("A closed source should report end-of-input and close idempotently")
    void testClose() throws IOException {
        CsvRecordSource source = CsvRecordSource.fromString("rows.csv", "id\n1\n2\n");
        assertNotNull(source.next());

        source.close();
        source.close();

        assertFalse(source.hasNext());
    }

    @Test
    @DisplayName("In-memory source should yield its values then end")
    void testIterableSource() {
        IterableRecordSource source = IterableRecordSource.of("mem", Map.of("id", 1), Map.of("id", 2));

        assertNotNull(source.next());
        assertNotNull(source.next());
        assertFalse(source.hasNext());
        source.close();
        assertTrue(source.isClosed());
    }

    @Test
    @DisplayName("A null element should be yielded as a value, not read as end-of-input")
    void testIterableSource_NullElement() {
        IterableRecordSource source = new IterableRecordSource("mem",
                Arrays.asList(Map.of("id", 1), null, Map.of("id", 3)));

        assertNotNull(source.next());
        assertTrue(source.hasNext());
        assertNull(source.next());
        assertTrue(source.hasNext());
        assertNotNull(source.next());
        assertFalse(source.hasNext());
    }
}
