package org.redcap.lite.engine.execution;

import org.junit.jupiter.api.Test;
import org.redcap.lite.column.RedcapValueArray;
import org.redcap.lite.column.RowMask;
import org.redcap.lite.column.ValueMismatchException;
import org.redcap.lite.types.Category;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DatasetTest {

    private static Dataset sample() {
        return Dataset.fromRows(
                List.of("record_id", "age", "sex"),
                List.of(
                        List.of("1", "34", "0"),
                        List.of("2", "", "1"),
                        List.of("3", "71", "1")));
    }

    @Test
    void fromRowsBuildsColumnsInHeaderOrder() {
        Dataset dataset = sample();

        assertEquals(3, dataset.rowCount());
        assertEquals(List.of("record_id", "age", "sex"), List.copyOf(dataset.fieldNames()));
        assertEquals(List.of("34", "", "71"), dataset.rawColumn("age").castToList());
        assertTrue(dataset.hasField("sex"));
        assertFalse(dataset.hasField("weight"));
    }

    @Test
    void fromRowsRejectsRaggedRows() {
        ValueMismatchException e = assertThrows(ValueMismatchException.class,
                () -> Dataset.fromRows(List.of("a", "b"), List.of(List.of("1", "2"), List.of("3"))));
        assertEquals(2, e.getExpected());
        assertEquals(1, e.getActual());
    }

    @Test
    void fromRowsRejectsDuplicateFields() {
        assertThrows(IllegalArgumentException.class,
                () -> Dataset.fromRows(List.of("a", "a"), List.of(List.of("1", "2"))));
    }

    @Test
    void fromColumnsRejectsUnequalLengths() {
        Map<String, List<String>> columns = new LinkedHashMap<>();
        columns.put("a", List.of("1", "2"));
        columns.put("b", List.of("1"));
        assertThrows(ValueMismatchException.class, () -> Dataset.fromColumns(columns));
    }

    @Test
    void emptyDatasetHasNoRows() {
        Dataset dataset = Dataset.fromColumns(Map.of());
        assertEquals(0, dataset.rowCount());
        assertTrue(dataset.fieldNames().isEmpty());
    }

    @Test
    void columnIsClassifiedOnceAndReused() {
        Dataset dataset = sample();
        RedcapValueArray age = dataset.column("age");

        assertSame(age, dataset.column("age"));
        assertEquals(Category.NUMBER, age.category(0));
        assertEquals(Category.MISSING, age.category(1));
    }

    @Test
    void unknownFieldRaises() {
        UnknownFieldException e = assertThrows(UnknownFieldException.class, () -> sample().column("weight"));
        assertEquals(Set.of("weight"), e.getUnknownFields());
        assertTrue(e.getMessage().contains("weight"));
    }

    @Test
    void filterKeepsSelectedRowsInOrder() {
        Dataset filtered = sample().filter(RowMask.of(true, false, true));

        assertEquals(2, filtered.rowCount());
        assertEquals(List.of("1", "3"), filtered.rawColumn("record_id").castToList());
        assertEquals(List.of("34", "71"), filtered.rawColumn("age").castToList());
        assertEquals(sample().fieldNames(), filtered.fieldNames());
    }

    @Test
    void filterRejectsMaskOfWrongLength() {
        assertThrows(ValueMismatchException.class, () -> sample().filter(RowMask.of(true)));
    }
}
