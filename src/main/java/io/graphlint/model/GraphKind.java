package io.graphlint.model;

/**
 * Category of a graph inside a program.
 */
public enum GraphKind {
    EVENT_GRAPH,
    FUNCTION_GRAPH,
    MACRO_GRAPH
}
