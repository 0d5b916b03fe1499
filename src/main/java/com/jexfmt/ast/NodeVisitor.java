package com.jexfmt.ast;

public interface NodeVisitor<R> {
    R visitSequence(Node.Sequence node);

    R visitMap(Node.MapLiteral node);

    R visitTuple(Node.Tuple node);

    R visitFunctionRef(Node.FunctionRef node);

    R visitNegate(Node.Negate node);

    R visitAliasPath(Node.AliasPath node);

    R visitAnonymousCall(Node.AnonymousCall node);

    R visitAttributeRef(Node.AttributeRef node);

    R visitAttributeSet(Node.AttributeSet node);

    R visitIdentifier(Node.Identifier node);

    R visitIndexAccess(Node.IndexAccess node);

    R visitQualifiedRef(Node.QualifiedRef node);

    R visitQualifiedCall(Node.QualifiedCall node);

    R visitCall(Node.Call node);

    R visitQuotedLiteral(Node.QuotedLiteral node);

    R visitAtomic(Node.Atomic node);
}
