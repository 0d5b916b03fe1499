package com.jexfmt.algebra;

import com.jexfmt.ast.AtomicLiteral;
import org.eclipse.collections.api.list.ListIterable;

import java.util.function.BiFunction;
import java.util.regex.Pattern;

/**
 * Document combinators and literal formatting.
 */
public final class Algebra {
    private static final Doc EMPTY = new Doc.Empty();
    private static final String ITEM_SEPARATOR = ",";
    private static final String ALIAS_PREFIX = "Elixir.";
    private static final Pattern PLAIN_SYMBOL = Pattern.compile("[A-Za-z_][A-Za-z0-9_@]*[?!]?");

    private Algebra() {
    }

    public static Doc empty() {
        return EMPTY;
    }

    public static Doc text(String text) {
        return text.isEmpty() ? EMPTY : new Doc.Text(text);
    }

    public static Doc concat(Doc left, Doc right) {
        if (left instanceof Doc.Empty) {
            return right;
        }
        if (right instanceof Doc.Empty) {
            return left;
        }
        return new Doc.Concat(left, right);
    }

    public static Doc concat(Doc... docs) {
        Doc result = EMPTY;
        for (Doc doc : docs) {
            result = concat(result, doc);
        }
        return result;
    }

    public static Doc nest(int indent, Doc doc) {
        if (indent == 0 || doc instanceof Doc.Empty) {
            return doc;
        }
        return new Doc.Nest(indent, doc);
    }

    public static Doc line(String flat) {
        return new Doc.Line(flat);
    }

    public static Doc group(Doc doc) {
        return new Doc.Group(doc);
    }

    /**
     * Lays out {@code open}, the formatted items separated by commas, then
     * {@code close}. The items go on one line when they fit, otherwise one
     * per line, aligned just past {@code open}.
     */
    public static <T> Doc surroundMany(String open, ListIterable<T> items, String close,
                                       FormatOptions options,
                                       BiFunction<? super T, FormatOptions, Doc> itemFormatter) {
        if (items.isEmpty()) {
            return text(open + close);
        }

        Doc body = EMPTY;
        boolean first = true;
        for (T item : items) {
            if (!first) {
                body = concat(body, text(ITEM_SEPARATOR), line(" "));
            }
            first = false;
            body = concat(body, itemFormatter.apply(item, options));
        }

        return group(concat(text(open), nest(open.length(), body), text(close)));
    }

    public static Doc literal(AtomicLiteral value) {
        return text(literalText(value));
    }

    public static String literalText(AtomicLiteral value) {
        if (value instanceof AtomicLiteral.SymbolLiteral symbol) {
            return symbolText(symbol.name());
        }
        if (value instanceof AtomicLiteral.StringLiteral string) {
            return "\"" + escapeString(string.value()) + "\"";
        }
        if (value instanceof AtomicLiteral.IntegerLiteral integer) {
            return Long.toString(integer.value());
        }
        if (value instanceof AtomicLiteral.FloatLiteral decimal) {
            return Double.toString(decimal.value()).replace('E', 'e');
        }
        throw new IllegalStateException("Unknown literal: " + value);
    }

    public static boolean isPlainSymbol(String name) {
        return PLAIN_SYMBOL.matcher(name).matches();
    }

    public static boolean isAliasSymbol(String name) {
        return name.startsWith(ALIAS_PREFIX);
    }

    private static String symbolText(String name) {
        return switch (name) {
            case "nil", "true", "false" -> name;
            default -> {
                if (isAliasSymbol(name)) {
                    yield name.substring(ALIAS_PREFIX.length());
                }
                yield isPlainSymbol(name) ? ":" + name : ":\"" + escapeString(name) + "\"";
            }
        };
    }

    public static String escapeString(String s) {
        // Fast path: nothing to escape
        boolean needsEscaping = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\\' || c == '"' || c == '\n' || c == '\r' || c == '\t' || c == '#') {
                needsEscaping = true;
                break;
            }
        }

        if (!needsEscaping) {
            return s;
        }

        StringBuilder result = new StringBuilder(s.length() + 16);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> result.append("\\\\");
                case '"'  -> result.append("\\\"");
                case '\n' -> result.append("\\n");
                case '\r' -> result.append("\\r");
                case '\t' -> result.append("\\t");
                // "#{" would start an interpolation
                case '#'  -> result.append(i + 1 < s.length() && s.charAt(i + 1) == '{' ? "\\#" : "#");
                default   -> result.append(c);
            }
        }
        return result.toString();
    }
}
