package com.example.gridfill.engine.command;

import com.example.gridfill.engine.grid.Region;
import com.example.gridfill.exception.TemplateConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Nests parsed commands by geometric containment. Areas become roots; every other command is attached to the
 * smallest area, each or if whose region contains it. When two containers declare the same region,
 * the one declared first encloses the other, so {@code jx:each} followed by {@code jx:if} on one cell filters
 * every copy.
 */
@Slf4j
public class CommandTreeBuilder {
    public static final String REGION_OUT_OF_BOUNDS = "REGION_OUT_OF_BOUNDS";
    public static final String OVERLAPPING_COMMANDS = "OVERLAPPING_COMMANDS";
    public static final String EMPTY_EACH_REGION = "EMPTY_EACH_REGION";
    public static final String MULTISHEET_NESTING = "MULTISHEET_NESTING";

    /**
     * @param commands every command of the template, in declaration order (sheet by sheet, row by row)
     * @return the area roots, in declaration order, with their subtrees attached
     */
    public List<AreaCommand> build(List<CommandNode> commands) {
        Map<CommandNode, Integer> order = new IdentityHashMap<>();
        List<AreaCommand> areas = new ArrayList<>();
        List<CommandNode> nested = new ArrayList<>();
        for (CommandNode command : commands) {
            order.put(command, order.size());
            checkNotEmpty(command);
            if (command instanceof AreaCommand) {
                areas.add((AreaCommand) command);
            } else {
                nested.add(command);
            }
        }
        checkDisjoint(areas);

        // largest first, so every container is placed before anything it can hold
        nested.sort(Comparator.comparingLong((CommandNode c) -> c.getRegion().getCellCount()).reversed()
                .thenComparingInt(order::get));
        List<ContainerCommand> containers = new ArrayList<>(areas);
        for (CommandNode command : nested) {
            ContainerCommand parent = findParent(command, containers);
            parent.addChild(command);
            if (command instanceof ContainerCommand) {
                containers.add((ContainerCommand) command);
            }
        }
        for (ContainerCommand container : containers) {
            container.freeze();
            checkDisjoint(container.getChildren());
            if (container instanceof IfCommand) {
                checkIfBranches((IfCommand) container);
            }
        }
        for (AreaCommand area : areas) {
            checkMultisheet(area, false, new int[1]);
            log.debug("Built command tree for area {} with {} direct children", area.getRegion(), area.getChildren().size());
        }
        return areas;
    }

    /**
     * Smallest container holding the whole region of {@code command}; among equal sizes the one placed last
     * (deepest). A command that only partly overlaps a nested container lands beside it, where the sibling check
     * reports the overlap.
     */
    private ContainerCommand findParent(CommandNode command, List<ContainerCommand> containers) {
        Region region = command.getRegion();
        ContainerCommand best = smallest(containers, candidate -> candidate.contains(region));
        if (best != null) {
            return best;
        }
        ContainerCommand holder = smallest(containers, candidate -> candidate.contains(region.getAnchor()));
        if (holder == null) {
            throw new TemplateConfigurationException(REGION_OUT_OF_BOUNDS,
                    command.describe() + " is not inside any jx:area", region.getAnchor().toString());
        }
        throw new TemplateConfigurationException(REGION_OUT_OF_BOUNDS,
                command.describe() + " region " + region + " extends beyond " + holder.describe() + " region " + holder.getRegion(),
                region.getAnchor().toString());
    }

    private static ContainerCommand smallest(List<ContainerCommand> containers, Predicate<Region> accepts) {
        ContainerCommand best = null;
        for (ContainerCommand candidate : containers) {
            if (!accepts.test(candidate.getRegion())) {
                continue;
            }
            if (best == null || candidate.getRegion().getCellCount() <= best.getRegion().getCellCount()) {
                best = candidate;
            }
        }
        return best;
    }

    private void checkNotEmpty(CommandNode command) {
        Region region = command.getRegion();
        if (!region.isEmpty()) {
            return;
        }
        if (command instanceof EachCommand) {
            throw new TemplateConfigurationException(EMPTY_EACH_REGION,
                    command.describe() + " has an empty block: lastCell precedes the anchor", region.getAnchor().toString());
        }
        throw new TemplateConfigurationException(REGION_OUT_OF_BOUNDS,
                command.describe() + " lastCell precedes the anchor", region.getAnchor().toString());
    }

    private void checkDisjoint(List<? extends CommandNode> siblings) {
        for (int i = 0; i < siblings.size(); i++) {
            for (int j = i + 1; j < siblings.size(); j++) {
                CommandNode a = siblings.get(i);
                CommandNode b = siblings.get(j);
                if (a.getRegion().intersects(b.getRegion())) {
                    throw new TemplateConfigurationException(OVERLAPPING_COMMANDS,
                            a.describe() + " " + a.getRegion() + " overlaps " + b.describe() + " " + b.getRegion(),
                            b.getRegion().getAnchor().toString());
                }
            }
        }
    }

    private void checkIfBranches(IfCommand ifCommand) {
        for (Region branch : new Region[]{ifCommand.getThenRegion(), ifCommand.getElseRegion()}) {
            if (branch == null) {
                continue;
            }
            if (branch.isEmpty() || !ifCommand.getRegion().contains(branch)) {
                throw new TemplateConfigurationException(REGION_OUT_OF_BOUNDS,
                        ifCommand.describe() + " area " + branch + " is not inside " + ifCommand.getRegion(),
                        ifCommand.getRegion().getAnchor().toString());
            }
        }
        for (CommandNode child : ifCommand.getChildren()) {
            boolean inThen = ifCommand.getThenRegion().contains(child.getRegion());
            boolean inElse = ifCommand.getElseRegion() != null && ifCommand.getElseRegion().contains(child.getRegion());
            if (!inThen && !inElse) {
                throw new TemplateConfigurationException(REGION_OUT_OF_BOUNDS,
                        child.describe() + " lies outside both branches of " + ifCommand.describe(),
                        child.getRegion().getAnchor().toString());
            }
        }
    }

    /**
     * A multisheet each may not sit inside another each, and an area may hold at most one.
     */
    private void checkMultisheet(CommandNode node, boolean insideEach, int[] count) {
        for (CommandNode child : node.getChildren()) {
            if (child instanceof EachCommand && ((EachCommand) child).isMultisheet()) {
                if (insideEach || ++count[0] > 1) {
                    throw new TemplateConfigurationException(MULTISHEET_NESTING,
                            child.describe() + ": a multisheet each must be the only one in its area and not nested in another each",
                            child.getRegion().getAnchor().toString());
                }
            }
            checkMultisheet(child, insideEach || child instanceof EachCommand, count);
        }
    }
}
