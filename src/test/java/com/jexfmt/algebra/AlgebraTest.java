package com.jexfmt.algebra;

import com.jexfmt.ast.AtomicLiteral;
import org.eclipse.collections.impl.factory.Lists;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

public class AlgebraTest {

    @ParameterizedTest
    @CsvSource({
        "ok, :ok",
        "valid?, :valid?",
        "nil, nil",
        "true, true",
        "false, false",
        "Elixir.Foo.Bar, Foo.Bar",
        "'foo bar', ':\"foo bar\"'",
    })
    public void testSymbols(String name, String expected) {
        assertEquals(expected, Algebra.literalText(AtomicLiteral.symbol(name)));
    }

    @Test
    public void testStrings() {
        assertEquals("\"hello\"", Algebra.literalText(AtomicLiteral.of("hello")));
        assertEquals("\"say \\\"hi\\\"\\n\"", Algebra.literalText(AtomicLiteral.of("say \"hi\"\n")));
        assertEquals("\"a\\\\b\\t\"", Algebra.literalText(AtomicLiteral.of("a\\b\t")));
        assertEquals("\"\\#{x} #1\"", Algebra.literalText(AtomicLiteral.of("#{x} #1")));
    }

    @Test
    public void testNumbers() {
        assertEquals("42", Algebra.literalText(AtomicLiteral.of(42L)));
        assertEquals("-7", Algebra.literalText(AtomicLiteral.of(-7L)));
        assertEquals("1.5", Algebra.literalText(AtomicLiteral.of(1.5)));
        assertEquals("1.0", Algebra.literalText(AtomicLiteral.of(1.0)));
        assertEquals("1.0e10", Algebra.literalText(AtomicLiteral.of(1.0e10)));
    }

    @Test
    public void testSurroundManyEmpty() {
        Doc doc = Algebra.surroundMany("[", Lists.immutable.<String>empty(), "]", FormatOptions.DEFAULT,
            (item, opts) -> Algebra.text(item));
        assertEquals("[]", DocRenderer.render(doc, 10));
    }

    @Test
    public void testSurroundManyFitsOnOneLine() {
        Doc doc = Algebra.surroundMany("{", Lists.immutable.of("a", "b", "c"), "}", FormatOptions.DEFAULT,
            (item, opts) -> Algebra.text(item));
        assertEquals("{a, b, c}", DocRenderer.render(doc, 80));
    }

    @Test
    public void testSurroundManyBreaksOnePerLine() {
        Doc doc = Algebra.surroundMany("%{", Lists.immutable.of("alpha", "beta", "gamma"), "}", FormatOptions.DEFAULT,
            (item, opts) -> Algebra.text(item));
        assertEquals("%{alpha,\n  beta,\n  gamma}", DocRenderer.render(doc, 10));
    }

    @Test
    public void testConcatDropsEmpty() {
        Doc text = Algebra.text("x");
        assertSame(text, Algebra.concat(Algebra.empty(), text));
        assertSame(text, Algebra.concat(text, Algebra.text("")));
    }
}
