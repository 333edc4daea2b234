package io.lazytable.kernel.selection;

/**
 * How the rows of a table are addressed.
 */
public enum SelectorKind {
    INDEX,
    TIMESTAMP,
    INTERVAL
}
