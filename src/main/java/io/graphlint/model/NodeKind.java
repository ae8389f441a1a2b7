package io.graphlint.model;

/**
 * Closed set of node categories.
 * Detectors switch on this tag instead of inspecting host node types.
 */
public enum NodeKind {
    /** Engine or overridden event (BeginPlay, Tick, ...). */
    EVENT,
    /** User-defined event. */
    CUSTOM_EVENT,
    /** Event fired by a component (overlap, hit, ...). */
    COMPONENT_BOUND_EVENT,
    /** Entry node of a function graph. */
    FUNCTION_ENTRY,
    /** Entry or exit node of a macro graph. */
    TUNNEL,
    CALL_FUNCTION,
    VARIABLE_GET,
    VARIABLE_SET,
    DYNAMIC_CAST,
    LOOP,
    BRANCH,
    MACRO_INSTANCE,
    LITERAL,
    DELEGATE_ADD,
    DELEGATE_ASSIGN,
    DELEGATE_REMOVE,
    DELEGATE_CLEAR,
    DELEGATE_CALL,
    /** Any other node; heuristics fall back to its title and host class name. */
    GENERIC;

    /**
     * Returns true for nodes that start execution on their own.
     */
    public boolean isEvent() {
        return this == EVENT || this == CUSTOM_EVENT || this == COMPONENT_BOUND_EVENT;
    }

    /**
     * Returns true for any multicast-delegate node (bind, unbind or call).
     */
    public boolean isDelegate() {
        return switch (this) {
            case DELEGATE_ADD, DELEGATE_ASSIGN, DELEGATE_REMOVE, DELEGATE_CLEAR, DELEGATE_CALL -> true;
            default -> false;
        };
    }

    /**
     * Returns true for delegate nodes that bind a handler.
     */
    public boolean isDelegateBinding() {
        return this == DELEGATE_ADD || this == DELEGATE_ASSIGN;
    }
}
