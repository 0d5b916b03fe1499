package com.jexfmt.ast;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * Quoted expression tree. The set of variants is closed: every variant
 * dispatches through {@link NodeVisitor}, so a new variant does not compile
 * until each visitor handles it.
 */
public sealed interface Node {
    <R> R accept(NodeVisitor<R> visitor);

    record Sequence(ImmutableList<Node> items) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSequence(this);
        }
    }

    record MapLiteral(ImmutableList<Pair> pairs) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitMap(this);
        }
    }

    record Pair(Node key, Node value) {}

    record Tuple(ImmutableList<Node> items) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTuple(this);
        }
    }

    record FunctionRef(String name, int arity) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFunctionRef(this);
        }
    }

    record Negate(Node inner) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitNegate(this);
        }
    }

    record AliasPath(ImmutableList<String> segments) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAliasPath(this);
        }
    }

    record AnonymousCall(String capturedName, ImmutableList<Node> args) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAnonymousCall(this);
        }
    }

    record AttributeRef(String name) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAttributeRef(this);
        }
    }

    record AttributeSet(String name, Node value) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAttributeSet(this);
        }
    }

    record Identifier(String name) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIdentifier(this);
        }
    }

    record IndexAccess(Node base, Node key) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIndexAccess(this);
        }
    }

    record QualifiedRef(Node path, String name) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitQualifiedRef(this);
        }
    }

    record QualifiedCall(Node path, String name, ImmutableList<Node> args) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitQualifiedCall(this);
        }
    }

    record Call(String name, ImmutableList<Node> args) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    // Sigil form: ~<sigil><delimited content><modifiers>
    record QuotedLiteral(char sigil, String rawContent, String modifiers) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitQuotedLiteral(this);
        }
    }

    record Atomic(AtomicLiteral value) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAtomic(this);
        }
    }
}
