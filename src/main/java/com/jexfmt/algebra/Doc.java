package com.jexfmt.algebra;

/**
 * Layout document. Values are built through {@link Algebra} and turned into
 * text by {@link DocRenderer}.
 */
public sealed interface Doc {
    record Empty() implements Doc {}
    record Text(String text) implements Doc {}
    record Concat(Doc left, Doc right) implements Doc {}
    record Nest(int indent, Doc doc) implements Doc {}
    // Rendered as flat text inside a flat group, as a newline otherwise.
    record Line(String flat) implements Doc {}
    record Group(Doc doc) implements Doc {}
}
