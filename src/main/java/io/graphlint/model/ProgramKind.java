package io.graphlint.model;

/**
 * Kind of program.
 * Interface programs only declare signatures that other programs implement.
 */
public enum ProgramKind {
    STANDARD,
    INTERFACE
}
