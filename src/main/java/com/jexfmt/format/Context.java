package com.jexfmt.format;

import com.jexfmt.algebra.FormatOptions;
import org.eclipse.collections.api.stack.ImmutableStack;
import org.eclipse.collections.impl.factory.Stacks;

import java.util.Set;

/**
 * Ancestor kinds of the node being formatted, innermost first, together with
 * the active options. Pushing returns a new context and leaves this one
 * untouched, so one context can be handed to any number of children.
 */
public record Context(ImmutableStack<ContextTag> stack, FormatOptions options) {

    public static Context root(FormatOptions options) {
        return new Context(Stacks.immutable.empty(), options);
    }

    public Context push(ContextTag tag) {
        return new Context(stack.push(tag), options);
    }

    public boolean topIsAnyOf(Set<ContextTag> tags) {
        return !stack.isEmpty() && tags.contains(stack.peek());
    }
}
