package com.jexfmt.ast;

public sealed interface AtomicLiteral {
    record SymbolLiteral(String name) implements AtomicLiteral {}
    record StringLiteral(String value) implements AtomicLiteral {}
    record IntegerLiteral(long value) implements AtomicLiteral {}
    record FloatLiteral(double value) implements AtomicLiteral {}

    static AtomicLiteral symbol(String name) {
        return new SymbolLiteral(name);
    }

    static AtomicLiteral of(String value) {
        return new StringLiteral(value);
    }

    static AtomicLiteral of(long value) {
        return new IntegerLiteral(value);
    }

    static AtomicLiteral of(double value) {
        return new FloatLiteral(value);
    }
}
