package com.jexfmt.format;

/**
 * Kind of an enclosing node, as recorded on the {@link Context} stack.
 */
public enum ContextTag {
    LIST,
    KEYWORD,
    MAP,
    TUPLE,
    NEGATIVE,
    CALL,
    BARE_CALL,
    // final argument of a call or bare directive
    CALL_TAIL,
    MODULE_ATTRIBUTE,
    ACCESS
}
