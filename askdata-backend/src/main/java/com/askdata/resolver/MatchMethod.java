package com.askdata.resolver;

/**
 * How a phrase matched a column.
 */
public enum MatchMethod {
    EXACT,
    NORMALIZED,
    CONTAINMENT,
    SYNONYM,
    TOKEN
}
