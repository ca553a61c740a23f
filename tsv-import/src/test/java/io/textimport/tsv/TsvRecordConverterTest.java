package io.textimport.tsv;

import io.textimport.core.StructuredDocument;
import io.textimport.error.ConversionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TsvRecordConverterTest {
    private static final List<String> AB = List.of("a", "b");

    @Test
    void binds_tokens_to_fields_as_strings_by_default() throws Exception {
        var conv = new TsvRecordConverter(TsvOptions.defaults());
        StructuredDocument doc = conv.convert(AB, "1\t2\r\n", 0);
        assertEquals(StructuredDocument.builder().append("a", "1").append("b", "2").build(), doc);
    }

    @Test
    void short_record_is_accepted_unless_strict() throws Exception {
        var lenient = new TsvRecordConverter(TsvOptions.defaults());
        assertEquals(StructuredDocument.builder().append("a", "5").build(), lenient.convert(AB, "5", 4));

        var strict = new TsvRecordConverter(new TsvOptions(false, true, false));
        ConversionException e = assertThrows(ConversionException.class, () -> strict.convert(AB, "5", 4));
        assertEquals(4, e.index());
        assertEquals("expected 2 field(s) but found 1 in document #4", e.getMessage());
    }

    @Test
    void extra_tokens_get_positional_names() throws Exception {
        var conv = new TsvRecordConverter(TsvOptions.defaults());
        StructuredDocument doc = conv.convert(AB, "1\t2\t3\t4", 0);
        assertEquals("3", doc.get("field2"));
        assertEquals("4", doc.get("field3"));
        assertEquals(4, doc.size());
    }

    @Test
    void positional_name_clashing_with_a_field_is_an_error() {
        var conv = new TsvRecordConverter(TsvOptions.defaults());
        ConversionException e = assertThrows(ConversionException.class,
                () -> conv.convert(List.of("a", "field2"), "x\ty\tz", 9));
        assertEquals("duplicate field name - on field2 - for token #3 ('z') in document #9", e.getMessage());
        assertEquals(9, e.index());
    }

    @Test
    void infers_numeric_types_when_enabled() throws Exception {
        var conv = new TsvRecordConverter(new TsvOptions(true, false, false));
        StructuredDocument doc = conv.convert(List.of("i", "l", "d", "s", "e"), "42\t12345678901\t-1.5\t0x1F\t1e3", 0);
        assertEquals(42, doc.get("i"));
        assertEquals(12345678901L, doc.get("l"));
        assertEquals(-1.5, doc.get("d"));
        assertEquals("0x1F", doc.get("s"));
        assertEquals(1000.0, doc.get("e"));
        assertEquals("1f", TsvRecordConverter.parseValue("1f"));
        assertEquals(1.0E19, TsvRecordConverter.parseValue("10000000000000000000"));
    }

    @Test
    void dotted_fields_build_nested_documents() throws Exception {
        var conv = new TsvRecordConverter(TsvOptions.defaults());
        StructuredDocument doc = conv.convert(List.of("name", "addr.city", "addr.zip"), "ann\tOslo\t0150", 0);
        StructuredDocument addr = assertInstanceOf(StructuredDocument.class, doc.get("addr"));
        assertEquals("Oslo", addr.get("city"));
        assertEquals("0150", addr.get("zip"));
    }

    @Test
    void blanks_are_skipped_when_requested() throws Exception {
        var conv = new TsvRecordConverter(new TsvOptions(false, false, true));
        StructuredDocument doc = conv.convert(List.of("a", "b", "c"), "1\t\t3", 0);
        assertNull(doc.get("b"));
        assertEquals(2, doc.size());
    }
}
