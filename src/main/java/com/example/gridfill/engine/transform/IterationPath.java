package com.example.gridfill.engine.transform;

import com.example.gridfill.engine.command.EachCommand;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The chain of each iterations a cell was rendered under, outermost first. Used to keep formula references
 * inside one iteration instead of spreading them over every copy.
 */
public final class IterationPath {
    public static final IterationPath ROOT = new IterationPath(Collections.emptyList());

    private final List<Step> steps;

    private IterationPath(List<Step> steps) {
        this.steps = steps;
    }

    public IterationPath enter(EachCommand each, int index) {
        List<Step> next = new ArrayList<>(steps.size() + 1);
        next.addAll(steps);
        next.add(new Step(each, index));
        return new IterationPath(Collections.unmodifiableList(next));
    }

    /**
     * True when both paths agree on the iteration index of every each they have in common.
     */
    public boolean isCompatibleWith(IterationPath other) {
        int shared = Math.min(steps.size(), other.steps.size());
        for (int i = 0; i < shared; i++) {
            Step mine = steps.get(i);
            Step theirs = other.steps.get(i);
            if (mine.each != theirs.each) {
                return true;
            }
            if (mine.index != theirs.index) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        StringBuilder out = new StringBuilder("[");
        for (Step step : steps) {
            if (out.length() > 1) {
                out.append(" > ");
            }
            out.append(step.each.getRegion().getAnchor()).append('#').append(step.index);
        }
        return out.append(']').toString();
    }

    private static final class Step {
        private final EachCommand each;
        private final int index;

        private Step(EachCommand each, int index) {
            this.each = each;
            this.index = index;
        }
    }
}
