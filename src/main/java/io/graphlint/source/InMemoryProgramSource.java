package io.graphlint.source;

import io.graphlint.model.Program;
import io.graphlint.model.ProgramId;
import io.graphlint.model.TypeInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A {@link ProgramSource} over programs already held in memory, in registration order.
 * Program ids carry the names of the program's parent chain as ancestors.
 */
public class InMemoryProgramSource implements ProgramSource {

    private final Map<String, ProgramId> ids = new LinkedHashMap<>();
    private final Map<String, Program> programs = new LinkedHashMap<>();

    public static InMemoryProgramSource of(Program... programs) {
        InMemoryProgramSource source = new InMemoryProgramSource();
        for (Program program : programs) {
            source.add(program);
        }
        return source;
    }

    /**
     * Registers a program, replacing any program with the same path.
     */
    public synchronized InMemoryProgramSource add(Program program) {
        List<String> ancestors = program.parentType()
                .map(parent -> parent.chain().stream().map(TypeInfo::name).toList())
                .orElse(List.of());
        ids.put(program.path(), new ProgramId(program.path(), program.name(), ancestors));
        programs.put(program.path(), program);
        return this;
    }

    @Override
    public synchronized List<ProgramId> listCandidatePrograms(List<String> pathFilters) {
        if (pathFilters == null || pathFilters.isEmpty()) {
            return List.copyOf(ids.values());
        }
        List<ProgramId> result = new ArrayList<>();
        for (ProgramId id : ids.values()) {
            for (String filter : pathFilters) {
                if (id.path().startsWith(filter)) {
                    result.add(id);
                    break;
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public synchronized Program loadProgram(ProgramId id) throws ProgramLoadException {
        Program program = programs.get(id.path());
        if (program == null) {
            throw new ProgramLoadException(id, "No program registered at " + id.path());
        }
        return program;
    }

    public synchronized int size() {
        return programs.size();
    }
}
