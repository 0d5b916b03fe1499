package com.jexfmt.format;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class SigilEscaperTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "s | abc     | ''  | ~s(abc)",
        "s | a)b     | ''  | ~s[a)b]",
        "w | foo bar | a   | ~w(foo bar)a",
        "r | ^foo$   | ''  | ~r/^foo$/",
        "R | a/b     | i   | ~R(a/b)i",
        "r | a/b     | i   | ~r(a/b)i",
    })
    public void testDelimiterSelection(char sigil, String content, String modifiers, String expected) {
        assertEquals(expected, SigilEscaper.render(sigil, content, modifiers));
    }

    @Test
    public void testFallbackDoesNotEscapePrimaryCloser() {
        String rendered = SigilEscaper.render('s', "f(x)", "");
        assertEquals("~s[f(x)]", rendered);
        assertFalse(rendered.contains("\\"));
    }

    @Test
    public void testBothDelimitersPresentEscapesFallbackCloser() {
        assertEquals("~s[a)\\]b]", SigilEscaper.render('s', "a)]b", ""));
        assertEquals("~r(a/\\)b)", SigilEscaper.render('r', "a/)b", ""));
    }

    @Test
    public void testEmptyContent() {
        assertEquals("~s()", SigilEscaper.render('s', "", ""));
    }

    @Test
    public void testEscape() {
        assertEquals("x\\]y\\]", SigilEscaper.escape("x]y]", ']'));
        assertEquals("plain", SigilEscaper.escape("plain", ']'));
    }
}
