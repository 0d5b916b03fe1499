package com.jexfmt.format;

import com.jexfmt.algebra.Algebra;
import com.jexfmt.algebra.Doc;
import com.jexfmt.algebra.DocRenderer;
import com.jexfmt.ast.AtomicLiteral;
import com.jexfmt.ast.Node;
import com.jexfmt.ast.NodeVisitor;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.EnumSet;
import java.util.Set;

import static com.jexfmt.algebra.Algebra.concat;
import static com.jexfmt.algebra.Algebra.nest;
import static com.jexfmt.algebra.Algebra.surroundMany;
import static com.jexfmt.algebra.Algebra.text;

/**
 * Turns one node into a document. A formatter is bound to the context of the
 * node it formats; children are formatted by new formatters bound to the
 * context pushed for them.
 */
public final class NodeFormatter implements NodeVisitor<Doc> {
    // Calls written without parentheses: "import Foo, only: [bar: 1]"
    static final ImmutableSet<String> BARE_DIRECTIVES = Sets.immutable.of("import", "require");

    // Only the final argument may be written as a bracketless keyword list
    private static final Set<ContextTag> CALL_TAIL_TAG = EnumSet.of(ContextTag.CALL_TAIL);

    private final Context ctx;

    public NodeFormatter(Context ctx) {
        this.ctx = ctx;
    }

    public static Doc format(Node node, Context ctx) {
        return node.accept(new NodeFormatter(ctx));
    }

    @Override
    public Doc visitSequence(Node.Sequence node) {
        Context inner = ctx.push(ContextTag.LIST);
        if (!isKeywordList(node.items())) {
            return surroundMany("[", node.items(), "]", ctx.options(), (item, opts) -> format(item, inner));
        }
        if (ctx.topIsAnyOf(CALL_TAIL_TAG)) {
            return surroundMany("", node.items(), "", ctx.options(), (item, opts) -> keywordEntry((Node.Tuple) item, inner));
        }
        return surroundMany("[", node.items(), "]", ctx.options(), (item, opts) -> keywordEntry((Node.Tuple) item, inner));
    }

    @Override
    public Doc visitMap(Node.MapLiteral node) {
        if (node.pairs().allSatisfy(pair -> keywordKey(pair.key()) != null)) {
            Context inner = ctx.push(ContextTag.KEYWORD);
            return surroundMany("%{", node.pairs(), "}", ctx.options(),
                (pair, opts) -> keywordEntry(keywordKey(pair.key()), pair.value(), inner));
        }

        Context valueCtx = ctx.push(ContextTag.MAP);
        return surroundMany("%{", node.pairs(), "}", ctx.options(),
            (pair, opts) -> concat(format(pair.key(), ctx), text(" => "), format(pair.value(), valueCtx)));
    }

    @Override
    public Doc visitTuple(Node.Tuple node) {
        Context inner = ctx.push(ContextTag.TUPLE);
        return surroundMany("{", node.items(), "}", ctx.options(), (item, opts) -> format(item, inner));
    }

    @Override
    public Doc visitFunctionRef(Node.FunctionRef node) {
        return text(node.name() + "/" + node.arity());
    }

    @Override
    public Doc visitNegate(Node.Negate node) {
        if (isLiteralZero(node.inner())) {
            return text("0");
        }
        Doc inner = format(node.inner(), ctx.push(ContextTag.NEGATIVE));
        // "--" lexes as an operator
        if (DocRenderer.flat(inner).startsWith("-")) {
            return concat(text("-("), inner, text(")"));
        }
        return concat(text("-"), inner);
    }

    @Override
    public Doc visitAliasPath(Node.AliasPath node) {
        return text(node.segments().makeString("."));
    }

    @Override
    public Doc visitAnonymousCall(Node.AnonymousCall node) {
        return call(node.capturedName() + ".", node.args(), ctx, false);
    }

    @Override
    public Doc visitAttributeRef(Node.AttributeRef node) {
        return text("@" + node.name());
    }

    @Override
    public Doc visitAttributeSet(Node.AttributeSet node) {
        String prefix = "@" + node.name() + " ";
        Doc value = format(node.value(), ctx.push(ContextTag.MODULE_ATTRIBUTE));
        return concat(text(prefix), nest(prefix.length(), value));
    }

    @Override
    public Doc visitIdentifier(Node.Identifier node) {
        return text(node.name());
    }

    @Override
    public Doc visitIndexAccess(Node.IndexAccess node) {
        Context inner = ctx.push(ContextTag.ACCESS);
        return concat(format(node.base(), inner), text("["), format(node.key(), inner), text("]"));
    }

    @Override
    public Doc visitQualifiedRef(Node.QualifiedRef node) {
        return text(qualifiedName(node.path(), node.name(), ctx.push(ContextTag.CALL)));
    }

    @Override
    public Doc visitQualifiedCall(Node.QualifiedCall node) {
        String name = qualifiedName(node.path(), node.name(), ctx.push(ContextTag.CALL));
        return call(name, node.args(), ctx, false);
    }

    @Override
    public Doc visitCall(Node.Call node) {
        return call(node.name(), node.args(), ctx, BARE_DIRECTIVES.contains(node.name()));
    }

    @Override
    public Doc visitQuotedLiteral(Node.QuotedLiteral node) {
        return text(SigilEscaper.render(node.sigil(), node.rawContent(), node.modifiers()));
    }

    @Override
    public Doc visitAtomic(Node.Atomic node) {
        return Algebra.literal(node.value());
    }

    /**
     * {@code name(args)}, or {@code name args} for a bare directive. Broken
     * argument lists align just past the opening delimiter. The final
     * argument sees {@link ContextTag#CALL_TAIL}, the others the call's own tag.
     */
    private static Doc call(String name, ImmutableList<Node> args, Context parent, boolean bare) {
        if (bare && args.isEmpty()) {
            return text(name);
        }
        Context argCtx = parent.push(bare ? ContextTag.BARE_CALL : ContextTag.CALL);
        Context tailCtx = parent.push(ContextTag.CALL_TAIL);

        MutableList<Doc> formatted = Lists.mutable.empty();
        for (int i = 0; i < args.size(); i++) {
            formatted.add(format(args.get(i), i == args.size() - 1 ? tailCtx : argCtx));
        }

        String open = bare ? " " : "(";
        String close = bare ? "" : ")";
        Doc argList = surroundMany(open, formatted, close, parent.options(), (doc, opts) -> doc);
        return concat(text(name), nest(name.length(), argList));
    }

    private static String qualifiedName(Node path, String name, Context pathCtx) {
        return DocRenderer.flat(format(path, pathCtx)) + "." + name;
    }

    private static Doc keywordEntry(Node.Tuple entry, Context inner) {
        return keywordEntry(keywordKey(entry.items().get(0)), entry.items().get(1), inner);
    }

    private static Doc keywordEntry(String key, Node value, Context inner) {
        String label = Algebra.isPlainSymbol(key) ? key : "\"" + Algebra.escapeString(key) + "\"";
        return concat(text(label + ": "), format(value, inner));
    }

    static boolean isKeywordList(ImmutableList<Node> items) {
        return items.notEmpty() && items.allSatisfy(NodeFormatter::isKeywordEntry);
    }

    private static boolean isKeywordEntry(Node item) {
        return item instanceof Node.Tuple tuple
            && tuple.items().size() == 2
            && keywordKey(tuple.items().get(0)) != null;
    }

    /**
     * Name of a symbol usable as a keyword key, or null if {@code key} is not one.
     */
    private static String keywordKey(Node key) {
        if (key instanceof Node.Atomic atomic
            && atomic.value() instanceof AtomicLiteral.SymbolLiteral symbol
            && !Algebra.isAliasSymbol(symbol.name())) {
            return symbol.name();
        }
        return null;
    }

    private static boolean isLiteralZero(Node node) {
        return node instanceof Node.Atomic atomic
            && atomic.value() instanceof AtomicLiteral.IntegerLiteral integer
            && integer.value() == 0;
    }
}
