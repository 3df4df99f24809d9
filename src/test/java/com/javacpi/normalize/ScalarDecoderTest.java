package com.javacpi.normalize;

import com.javacpi.shared.error.MalformedOutputException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScalarDecoderTest {

    @Test
    void countReadsLastNonBlankLine() {
        assertEquals(1, ScalarDecoder.count("1\r\n"));
        assertEquals(3, ScalarDecoder.count("WARNING: module loaded\r\n3\r\n\r\n"));
        assertEquals(0, ScalarDecoder.count(""));
    }

    @Test
    void countRejectsNonIntegers() {
        assertThrows(MalformedOutputException.class, () -> ScalarDecoder.count("many"));
        assertThrows(MalformedOutputException.class, () -> ScalarDecoder.count("1.5"));
    }

    @Test
    void boolIsCaseInsensitive() {
        assertTrue(ScalarDecoder.bool("True\r\n"));
        assertTrue(ScalarDecoder.bool("true"));
        assertFalse(ScalarDecoder.bool("False"));
        assertFalse(ScalarDecoder.bool(""));
    }

    @Test
    void boolRejectsAnythingElse() {
        assertThrows(MalformedOutputException.class, () -> ScalarDecoder.bool("yes"));
        assertThrows(MalformedOutputException.class, () -> ScalarDecoder.bool("1"));
    }
}
