package com.example.gridfill.engine.transform;

import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.engine.grid.Region;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Bookkeeping for one area pass onto one output sheet: where every template cell was copied, which formulas
 * still have to be rewritten, and which rows, columns and merges have already been claimed.
 */
class TargetGrid {
    private final String sheet;
    private final Map<CellRef, List<Copy>> copies = new HashMap<>();
    private final List<FormulaCell> formulas = new ArrayList<>();
    private final Set<CellRef> written = new HashSet<>();
    private final List<Region> merges = new ArrayList<>();
    private final SortedSet<Integer> autoHeightRows = new TreeSet<>();
    private final Set<Integer> sizedRows = new HashSet<>();
    private final Set<Integer> sizedColumns = new HashSet<>();

    TargetGrid(String sheet) {
        this.sheet = sheet;
    }

    String getSheet() {
        return sheet;
    }

    void record(CellRef source, CellRef target, IterationPath path) {
        copies.computeIfAbsent(source, key -> new ArrayList<>()).add(new Copy(target, path));
        written.add(target);
    }

    void markWritten(CellRef target) {
        written.add(target);
    }

    boolean isWritten(CellRef target) {
        return written.contains(target);
    }

    List<Copy> copiesOf(CellRef source) {
        return copies.getOrDefault(source, Collections.emptyList());
    }

    /**
     * Copies of every template cell inside {@code source}.
     */
    List<Copy> copiesIn(Region source) {
        List<Copy> found = new ArrayList<>();
        for (Map.Entry<CellRef, List<Copy>> entry : copies.entrySet()) {
            if (source.contains(entry.getKey())) {
                found.addAll(entry.getValue());
            }
        }
        return found;
    }

    void addFormula(FormulaCell formula) {
        formulas.add(formula);
        written.add(formula.getTarget());
    }

    List<FormulaCell> getFormulas() {
        return formulas;
    }

    /**
     * @return false when the region overlaps a merge already declared in this pass
     */
    boolean claimMerge(Region region) {
        for (Region merged : merges) {
            if (merged.intersects(region)) {
                return false;
            }
        }
        merges.add(region);
        return true;
    }

    boolean claimRowHeight(int row) {
        return sizedRows.add(row);
    }

    boolean claimColumnWidth(int col) {
        return sizedColumns.add(col);
    }

    void markAutoHeight(int row) {
        autoHeightRows.add(row);
    }

    SortedSet<Integer> getAutoHeightRows() {
        return autoHeightRows;
    }

    @Value
    static class Copy {
        CellRef target;
        IterationPath path;
    }

    /**
     * A formula waiting for reference rewriting: placeholders already substituted, references still template ones.
     */
    @Value
    static class FormulaCell {
        CellRef source;
        CellRef target;
        String formula;
        IterationPath path;
    }
}
