package com.example.gridfill.engine;

import com.example.gridfill.engine.command.AreaCommand;
import com.example.gridfill.engine.command.FormulaParams;
import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.engine.grid.TemplateSnapshot;

import java.util.List;
import java.util.Map;

/**
 * A template parsed once: its raw bytes, a snapshot of every cell and the command tree. Immutable, so one
 * instance can back any number of concurrent fills.
 */
public final class CompiledTemplate {
    private final String name;
    private final byte[] content;
    private final TemplateSnapshot snapshot;
    private final List<AreaCommand> areas;
    private final Map<CellRef, FormulaParams> formulaParams;

    CompiledTemplate(String name, byte[] content, TemplateSnapshot snapshot, List<AreaCommand> areas,
                     Map<CellRef, FormulaParams> formulaParams) {
        this.name = name;
        this.content = content.clone();
        this.snapshot = snapshot;
        this.areas = List.copyOf(areas);
        this.formulaParams = Map.copyOf(formulaParams);
    }

    public String getName() {
        return name;
    }

    /**
     * Copy of the template bytes; every fill opens its own document from them.
     */
    public byte[] getContent() {
        return content.clone();
    }

    public TemplateSnapshot getSnapshot() {
        return snapshot;
    }

    public List<AreaCommand> getAreas() {
        return areas;
    }

    /**
     * Options declared with {@code jx:params}, keyed by formula cell.
     */
    public Map<CellRef, FormulaParams> getFormulaParams() {
        return formulaParams;
    }

    public boolean hasCommands() {
        return !areas.isEmpty();
    }
}
