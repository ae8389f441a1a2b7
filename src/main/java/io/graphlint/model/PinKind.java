package io.graphlint.model;

/**
 * What a pin carries.
 */
public enum PinKind {
    /** Control flow: execution order between nodes. */
    EXEC,
    /** A value. */
    DATA,
    /** An event binding; links a delegate node to the handler it binds. */
    DELEGATE
}
