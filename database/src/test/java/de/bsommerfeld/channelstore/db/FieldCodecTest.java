package de.bsommerfeld.channelstore.db;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldCodecTest {

    @Test
    void encodeList_shouldWriteExplicitEmptyArray() {
        assertEquals("[]", FieldCodec.encodeList(List.of()));
        assertEquals("[]", FieldCodec.encodeList(null));
    }

    @Test
    void encodeList_shouldWriteJsonArray() {
        assertEquals("[\"09:00\",\"18:00\"]", FieldCodec.encodeList(List.of("09:00", "18:00")));
    }

    @Test
    void listRoundTrip_shouldPreserveAwkwardValues() {
        List<String> values = List.of("a,b", "quote\"inside", "back\\slash", "", "  padded  ", "Привет", "[]");

        assertEquals(values, FieldCodec.decodeList(FieldCodec.encodeList(values)));
    }

    @Test
    void listRoundTrip_shouldPreserveEmptyList() {
        assertEquals(List.of(), FieldCodec.decodeList(FieldCodec.encodeList(List.of())));
    }

    @Test
    void setRoundTrip_shouldPreserveInsertionOrder() {
        var words = new LinkedHashSet<>(List.of("spam", "ads", "crypto"));

        assertEquals(List.of("spam", "ads", "crypto"),
                List.copyOf(FieldCodec.decodeSet(FieldCodec.encodeList(words))));
    }

    @Test
    void decodeList_shouldTreatNullColumnAsEmpty() {
        assertTrue(FieldCodec.decodeList(null).isEmpty());
        assertTrue(FieldCodec.decodeSet(null).isEmpty());
    }

    @Test
    void decodeList_shouldReadAsciiEscapedArrays() {
        // ensure_ascii-style output as written by other JSON tools
        assertEquals(List.of("Привет"), FieldCodec.decodeList("[\"\\u041f\\u0440\\u0438\\u0432\\u0435\\u0442\"]"));
    }

    @Test
    void decodeList_shouldRejectNonArrayText() {
        assertThrows(IllegalStateException.class, () -> FieldCodec.decodeList("spam,ads"));
    }

    @Test
    void booleanRoundTrip_shouldBeExact() {
        assertTrue(FieldCodec.decodeBoolean(FieldCodec.encodeBoolean(true)));
        assertFalse(FieldCodec.decodeBoolean(FieldCodec.encodeBoolean(false)));
        assertEquals(1, FieldCodec.encodeBoolean(true));
        assertEquals(0, FieldCodec.encodeBoolean(false));
    }

    @Test
    void decodeBoolean_shouldTreatAnyNonzeroAsTrue() {
        assertTrue(FieldCodec.decodeBoolean(2));
        assertTrue(FieldCodec.decodeBoolean(-1));
    }
}
