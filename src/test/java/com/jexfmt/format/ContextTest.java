package com.jexfmt.format;

import com.jexfmt.algebra.FormatOptions;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

public class ContextTest {

    @Test
    public void testRootHasNoParent() {
        Context root = Context.root(FormatOptions.DEFAULT);
        assertTrue(root.stack().isEmpty());
        assertFalse(root.topIsAnyOf(EnumSet.allOf(ContextTag.class)));
    }

    @Test
    public void testPushReturnsNewContext() {
        Context root = Context.root(new FormatOptions(40));
        Context call = root.push(ContextTag.CALL);
        Context list = call.push(ContextTag.LIST);

        assertTrue(root.stack().isEmpty());
        assertTrue(call.topIsAnyOf(EnumSet.of(ContextTag.CALL, ContextTag.BARE_CALL)));
        assertFalse(list.topIsAnyOf(EnumSet.of(ContextTag.CALL, ContextTag.BARE_CALL)));
        assertTrue(list.topIsAnyOf(EnumSet.of(ContextTag.LIST)));
        assertEquals(2, list.stack().size());
        assertEquals(40, list.options().maxWidth());
    }

    @Test
    public void testSiblingsShareParent() {
        Context parent = Context.root(FormatOptions.DEFAULT).push(ContextTag.TUPLE);
        Context first = parent.push(ContextTag.NEGATIVE);
        Context second = parent.push(ContextTag.ACCESS);

        assertTrue(first.topIsAnyOf(EnumSet.of(ContextTag.NEGATIVE)));
        assertTrue(second.topIsAnyOf(EnumSet.of(ContextTag.ACCESS)));
        assertTrue(parent.topIsAnyOf(EnumSet.of(ContextTag.TUPLE)));
    }

    @Test
    public void testContextsAreValues() {
        Context a = Context.root(FormatOptions.DEFAULT).push(ContextTag.MAP);
        Context b = Context.root(FormatOptions.DEFAULT).push(ContextTag.MAP);
        assertEquals(a, b);
    }

    @Test
    public void testInvalidWidth() {
        assertThrows(IllegalArgumentException.class, () -> new FormatOptions(0));
        assertThrows(IllegalArgumentException.class, () -> new FormatOptions(-3));
    }
}
