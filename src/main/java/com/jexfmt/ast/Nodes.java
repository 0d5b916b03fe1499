package com.jexfmt.ast;

import org.eclipse.collections.impl.factory.Lists;

/**
 * Shorthand constructors for building trees by hand.
 */
public final class Nodes {
    private Nodes() {
    }

    public static Node symbol(String name) {
        return new Node.Atomic(AtomicLiteral.symbol(name));
    }

    public static Node string(String value) {
        return new Node.Atomic(AtomicLiteral.of(value));
    }

    public static Node integer(long value) {
        return new Node.Atomic(AtomicLiteral.of(value));
    }

    public static Node decimal(double value) {
        return new Node.Atomic(AtomicLiteral.of(value));
    }

    public static Node var(String name) {
        return new Node.Identifier(name);
    }

    public static Node list(Node... items) {
        return new Node.Sequence(Lists.immutable.of(items));
    }

    public static Node tuple(Node... items) {
        return new Node.Tuple(Lists.immutable.of(items));
    }

    public static Node.Pair pair(Node key, Node value) {
        return new Node.Pair(key, value);
    }

    public static Node map(Node.Pair... pairs) {
        return new Node.MapLiteral(Lists.immutable.of(pairs));
    }

    // A keyword entry is a two-element tuple keyed by a symbol.
    public static Node keyword(String key, Node value) {
        return tuple(symbol(key), value);
    }

    public static Node alias(String... segments) {
        return new Node.AliasPath(Lists.immutable.of(segments));
    }

    public static Node call(String name, Node... args) {
        return new Node.Call(name, Lists.immutable.of(args));
    }

    public static Node qualifiedCall(Node path, String name, Node... args) {
        return new Node.QualifiedCall(path, name, Lists.immutable.of(args));
    }

    public static Node anonymousCall(String capturedName, Node... args) {
        return new Node.AnonymousCall(capturedName, Lists.immutable.of(args));
    }
}
