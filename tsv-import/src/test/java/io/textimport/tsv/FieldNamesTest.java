package io.textimport.tsv;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FieldNamesTest {
    @Test
    void accepts_distinct_compatible_names() {
        assertEquals(List.of("a", "b.c", "b.d", "ab"), FieldNames.validate(List.of("a", "b.c", "b.d", "ab")));
    }

    @Test
    void rejects_malformed_names() {
        assertThrows(IllegalArgumentException.class, () -> FieldNames.validate(List.of()));
        assertThrows(IllegalArgumentException.class, () -> FieldNames.validate(List.of("a", " ")));
        assertThrows(IllegalArgumentException.class, () -> FieldNames.validate(List.of(".a")));
        assertThrows(IllegalArgumentException.class, () -> FieldNames.validate(List.of("a.")));
        assertThrows(IllegalArgumentException.class, () -> FieldNames.validate(List.of("a..b")));
    }

    @Test
    void rejects_identical_and_conflicting_names() {
        IllegalArgumentException same = assertThrows(IllegalArgumentException.class, () -> FieldNames.validate(List.of("a", "a")));
        assertEquals("fields cannot be identical: 'a' and 'a'", same.getMessage());
        IllegalArgumentException nested = assertThrows(IllegalArgumentException.class, () -> FieldNames.validate(List.of("a.b", "a")));
        assertEquals("fields 'a.b' and 'a' are incompatible", nested.getMessage());
    }
}
