package io.graphlint.source;

import io.graphlint.model.ProgramId;

/**
 * Thrown when a program id cannot be materialized into graph data.
 */
public class ProgramLoadException extends Exception {

    private final ProgramId programId;

    public ProgramLoadException(ProgramId programId, String message) {
        super(message);
        this.programId = programId;
    }

    public ProgramLoadException(ProgramId programId, String message, Throwable cause) {
        super(message, cause);
        this.programId = programId;
    }

    public ProgramId getProgramId() {
        return programId;
    }
}
