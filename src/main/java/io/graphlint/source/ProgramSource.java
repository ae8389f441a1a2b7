package io.graphlint.source;

import io.graphlint.model.Program;
import io.graphlint.model.ProgramId;

import java.util.List;

/**
 * Host-side access to the programs of a project.
 * Implementations may load lazily; {@link #loadProgram} can block on first access.
 */
public interface ProgramSource {

    /**
     * Lists programs whose path starts with any of the given prefixes.
     *
     * @param pathFilters Path prefixes (e.g. "/Game/Enemies"); empty lists every program
     * @return Matching program ids, in a stable order
     */
    List<ProgramId> listCandidatePrograms(List<String> pathFilters);

    /**
     * Materializes the graph data of a program.
     *
     * @throws ProgramLoadException if the program cannot be loaded
     */
    Program loadProgram(ProgramId id) throws ProgramLoadException;
}
