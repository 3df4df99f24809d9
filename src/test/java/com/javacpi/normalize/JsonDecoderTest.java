package com.javacpi.normalize;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.javacpi.shared.error.FailureKind;
import com.javacpi.shared.error.MalformedOutputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonDecoderTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void singleObjectAndArrayDecodeAlike() {
        var one = JsonDecoder.oneOrMany("{\"Path\":\"C:\\\\a.vhdx\"}\r\n");
        var many = JsonDecoder.oneOrMany("[{\"Path\":\"C:\\\\a.vhdx\"},{\"Path\":\"C:\\\\b.vhdx\"}]");

        assertEquals(1, one.size());
        assertEquals(2, many.size());
        assertEquals(one.get(0), many.get(0));
    }

    @Test
    void blankOutputIsNoItems() {
        assertTrue(JsonDecoder.oneOrMany("  \r\n").isEmpty());
    }

    @Test
    void rejectsNonJson() {
        var e = assertThrows(MalformedOutputException.class, () -> JsonDecoder.oneOrMany("WARNING: oops"));
        assertEquals(FailureKind.MALFORMED_OUTPUT, e.kind());
        assertTrue(e.getMessage().contains("WARNING: oops"));
        assertEquals("WARNING: oops", e.rawText());

        assertThrows(MalformedOutputException.class, () -> JsonDecoder.object("{\"Name\": "));
        assertThrows(MalformedOutputException.class, () -> JsonDecoder.object(""));
        assertThrows(MalformedOutputException.class, () -> JsonDecoder.object("[1, 2]"));
    }

    @Test
    void longOutputIsAbbreviatedInMessage() {
        var raw = "[" + "1,".repeat(1000) + "1]";
        var e = assertThrows(MalformedOutputException.class, () -> JsonDecoder.object(raw));
        assertTrue(e.getMessage().length() < 700);
        assertEquals(raw, e.rawText());
    }

    @Test
    void textUnwrapsGuidObjects() throws Exception {
        var node = MAPPER.readTree("{\"Id\":{\"Guid\":\"1234-abcd\"},\"Name\":\"web\",\"Notes\":null}");

        assertEquals("1234-abcd", JsonDecoder.text(node, "Id", "unknown"));
        assertEquals("web", JsonDecoder.text(node, "Name", "unknown"));
        assertEquals("unknown", JsonDecoder.text(node, "Notes", "unknown"));
        assertEquals("unknown", JsonDecoder.text(node, "Missing", "unknown"));
    }

    @Test
    void integerReadsNumbersAndNumericText() throws Exception {
        var node = MAPPER.readTree("{\"a\":5,\"b\":\"7\",\"c\":2.0,\"d\":\"x\",\"e\":null}");

        assertEquals(5, JsonDecoder.integer(node, "a", -1));
        assertEquals(7, JsonDecoder.integer(node, "b", -1));
        assertEquals(2, JsonDecoder.integer(node, "c", -1));
        assertEquals(-1, JsonDecoder.integer(node, "d", -1));
        assertEquals(-1, JsonDecoder.integer(node, "e", -1));
    }
}
