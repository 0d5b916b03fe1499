package com.jexfmt.algebra;

public record FormatOptions(int maxWidth) {
    public static final int DEFAULT_WIDTH = 80;
    public static final FormatOptions DEFAULT = new FormatOptions(DEFAULT_WIDTH);

    public FormatOptions {
        if (maxWidth <= 0) {
            throw new IllegalArgumentException("Max width must be positive: " + maxWidth);
        }
    }
}
