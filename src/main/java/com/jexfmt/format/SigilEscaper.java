package com.jexfmt.format;

/**
 * Picks delimiters for a sigil so that its content needs as little escaping
 * as possible, and renders the sigil as a single piece of text.
 */
public final class SigilEscaper {
    private static final String SIGIL_MARKER = "~";

    private record Delimiters(char open, char close) {}

    private static final Delimiters SLASHES = new Delimiters('/', '/');
    private static final Delimiters PARENS = new Delimiters('(', ')');
    private static final Delimiters BRACKETS = new Delimiters('[', ']');

    private SigilEscaper() {
    }

    public static String render(char sigil, String rawContent, String modifiers) {
        Delimiters delimiters = choose(sigil, rawContent);
        return SIGIL_MARKER + sigil + delimiters.open()
            + escape(rawContent, delimiters.close())
            + delimiters.close() + modifiers;
    }

    private static Delimiters choose(char sigil, String content) {
        boolean regex = sigil == 'r' || sigil == 'R';
        Delimiters primary = regex ? SLASHES : PARENS;
        Delimiters fallback = regex ? PARENS : BRACKETS;
        return content.indexOf(primary.close()) >= 0 ? fallback : primary;
    }

    static String escape(String content, char close) {
        if (content.indexOf(close) < 0) {
            return content;
        }

        StringBuilder result = new StringBuilder(content.length() + 8);
        for (int i = 0; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == close) {
                result.append('\\');
            }
            result.append(c);
        }
        return result.toString();
    }
}
