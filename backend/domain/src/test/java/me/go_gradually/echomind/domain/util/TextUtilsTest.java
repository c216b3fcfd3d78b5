package me.go_gradually.echomind.domain.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextUtilsTest {

    @Test
    void trimToLength_returnsOriginalWhenShortEnough() {
        assertEquals("abc", TextUtils.trimToLength("abc", 5));
    }

    @Test
    void trimToLength_returnsEmptyForNull() {
        assertEquals("", TextUtils.trimToLength(null, 5));
    }

    @Test
    void ellipsize_appendsDotsOnlyWhenTruncated() {
        assertEquals("abc", TextUtils.ellipsize("abc", 3));
        assertEquals("ab...", TextUtils.ellipsize("abcdef", 2));
    }

    @Test
    void tail_keepsLastCharacters() {
        assertEquals("world", TextUtils.tail("hello world", 5));
    }

    @Test
    void firstNonBlank_fallsBackOnBlank() {
        assertEquals("x", TextUtils.firstNonBlank("  ", "x"));
        assertTrue(TextUtils.isBlank(null));
    }
}
