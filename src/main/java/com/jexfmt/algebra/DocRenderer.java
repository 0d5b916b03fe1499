package com.jexfmt.algebra;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;

/**
 * Renders documents to text. A group is laid out flat when everything up to
 * the next break of an enclosing broken group fits in the remaining width.
 */
public final class DocRenderer {
    private enum Mode { FLAT, BREAK }

    private record Frame(int indent, Mode mode, Doc doc) {}

    private DocRenderer() {
    }

    public static String render(Doc doc, FormatOptions options) {
        return render(doc, options.maxWidth());
    }

    public static String render(Doc doc, int width) {
        StringBuilder sb = new StringBuilder();
        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(0, Mode.BREAK, doc));
        int column = 0;

        while (!stack.isEmpty()) {
            Frame frame = stack.pop();
            Doc current = frame.doc();

            if (current instanceof Doc.Text text) {
                sb.append(text.text());
                // sigil content may span lines
                int newline = text.text().lastIndexOf('\n');
                column = newline >= 0
                    ? text.text().length() - newline - 1
                    : column + text.text().length();
            } else if (current instanceof Doc.Concat concat) {
                stack.push(new Frame(frame.indent(), frame.mode(), concat.right()));
                stack.push(new Frame(frame.indent(), frame.mode(), concat.left()));
            } else if (current instanceof Doc.Nest nest) {
                stack.push(new Frame(frame.indent() + nest.indent(), frame.mode(), nest.doc()));
            } else if (current instanceof Doc.Line line) {
                if (frame.mode() == Mode.FLAT) {
                    sb.append(line.flat());
                    column += line.flat().length();
                } else {
                    sb.append('\n').append(" ".repeat(frame.indent()));
                    column = frame.indent();
                }
            } else if (current instanceof Doc.Group group) {
                Frame flat = new Frame(frame.indent(), Mode.FLAT, group.doc());
                if (frame.mode() == Mode.FLAT || fits(width - column, flat, stack)) {
                    stack.push(flat);
                } else {
                    stack.push(new Frame(frame.indent(), Mode.BREAK, group.doc()));
                }
            }
        }

        return sb.toString();
    }

    /**
     * Single-line text of a document, ignoring width.
     */
    public static String flat(Doc doc) {
        StringBuilder sb = new StringBuilder();
        Deque<Doc> stack = new ArrayDeque<>();
        stack.push(doc);
        while (!stack.isEmpty()) {
            Doc current = stack.pop();
            if (current instanceof Doc.Text text) {
                sb.append(text.text());
            } else if (current instanceof Doc.Concat concat) {
                stack.push(concat.right());
                stack.push(concat.left());
            } else if (current instanceof Doc.Nest nest) {
                stack.push(nest.doc());
            } else if (current instanceof Doc.Line line) {
                sb.append(line.flat());
            } else if (current instanceof Doc.Group group) {
                stack.push(group.doc());
            }
        }
        return sb.toString();
    }

    private static boolean fits(int remaining, Frame candidate, Deque<Frame> rest) {
        Deque<Frame> pending = new ArrayDeque<>();
        pending.push(candidate);
        Iterator<Frame> following = rest.iterator();

        while (remaining >= 0) {
            if (pending.isEmpty()) {
                if (!following.hasNext()) {
                    return true;
                }
                pending.push(following.next());
            }

            Frame frame = pending.pop();
            Doc current = frame.doc();

            if (current instanceof Doc.Text text) {
                int newline = text.text().indexOf('\n');
                if (newline >= 0) {
                    return remaining >= newline;
                }
                remaining -= text.text().length();
            } else if (current instanceof Doc.Concat concat) {
                pending.push(new Frame(frame.indent(), frame.mode(), concat.right()));
                pending.push(new Frame(frame.indent(), frame.mode(), concat.left()));
            } else if (current instanceof Doc.Nest nest) {
                pending.push(new Frame(frame.indent() + nest.indent(), frame.mode(), nest.doc()));
            } else if (current instanceof Doc.Line line) {
                if (frame.mode() == Mode.BREAK) {
                    return true;
                }
                remaining -= line.flat().length();
            } else if (current instanceof Doc.Group group) {
                pending.push(new Frame(frame.indent(), frame.mode(), group.doc()));
            }
        }
        return false;
    }
}
