package com.jexfmt.format;

import com.jexfmt.algebra.Doc;
import com.jexfmt.algebra.DocRenderer;
import com.jexfmt.algebra.FormatOptions;
import com.jexfmt.ast.Node;

public class ExpressionFormatter {
    private final FormatOptions options;

    public ExpressionFormatter() {
        this(FormatOptions.DEFAULT);
    }

    public ExpressionFormatter(FormatOptions options) {
        this.options = options;
    }

    public Doc toDocument(Node node) {
        return NodeFormatter.format(node, Context.root(options));
    }

    public String format(Node node) {
        return DocRenderer.render(toDocument(node), options);
    }
}
