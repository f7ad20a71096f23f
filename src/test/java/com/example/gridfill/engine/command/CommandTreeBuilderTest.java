package com.example.gridfill.engine.command;

import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.exception.TemplateConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CommandTreeBuilderTest {

    private final CommandParser parser = new CommandParser();
    private final CommandTreeBuilder builder = new CommandTreeBuilder();
    private final List<CommandNode> commands = new ArrayList<>();

    private void declare(String a1, String annotation) {
        commands.addAll(parser.parse(annotation, CellRef.parse(a1, "Sheet1")).getCommands());
    }

    @Test
    public void testNestsByContainment() {
        declare("A1", "jx:area(lastCell=\"D6\")");
        declare("A2", "jx:each(items=\"depts\" var=\"d\" lastCell=\"D4\")");
        declare("B3", "jx:each(items=\"d.staff\" var=\"s\" lastCell=\"C3\")");
        declare("A6", "jx:if(condition=\"showTotal\" lastCell=\"D6\")");

        List<AreaCommand> areas = builder.build(commands);

        assertEquals(1, areas.size());
        AreaCommand area = areas.get(0);
        assertEquals(2, area.getChildren().size());
        EachCommand outer = (EachCommand) area.getChildren().get(0);
        assertEquals("depts", outer.getItems());
        assertTrue(area.getChildren().get(1) instanceof IfCommand);
        assertEquals(1, outer.getChildren().size());
        assertEquals("d.staff", ((EachCommand) outer.getChildren().get(0)).getItems());
    }

    @Test
    public void testEqualRegionsNestInDeclarationOrder() {
        declare("A1", "jx:area(lastCell=\"B2\")");
        declare("A2", "jx:each(items=\"xs\" var=\"x\" lastCell=\"B2\")\njx:if(condition=\"x.visible\" lastCell=\"B2\")");

        AreaCommand area = builder.build(commands).get(0);

        EachCommand each = (EachCommand) area.getChildren().get(0);
        assertTrue(each.getChildren().get(0) instanceof IfCommand);
    }

    @Test
    public void testChildrenAreOrderedByPosition() {
        declare("A1", "jx:area(lastCell=\"E5\")");
        declare("D2", "jx:mergeCells(cols=\"2\" rows=\"1\" lastCell=\"E2\")");
        declare("A4", "jx:autoRowHeight(lastCell=\"E4\")");
        declare("A2", "jx:grid(headers=\"h\" data=\"d\" lastCell=\"B2\")");

        List<CommandNode> children = builder.build(commands).get(0).getChildren();

        assertTrue(children.get(0) instanceof GridCommand);
        assertTrue(children.get(1) instanceof MergeCellsCommand);
        assertTrue(children.get(2) instanceof AutoRowHeightCommand);
    }

    @Test
    public void testCommandOutsideAnyAreaFails() {
        declare("A1", "jx:area(lastCell=\"B2\")");
        declare("D5", "jx:each(items=\"xs\" var=\"x\" lastCell=\"D5\")");

        TemplateConfigurationException e = assertThrows(TemplateConfigurationException.class, () -> builder.build(commands));
        assertEquals(CommandTreeBuilder.REGION_OUT_OF_BOUNDS, e.getCode());
        assertEquals("Sheet1!D5", e.getLocation());
    }

    @Test
    public void testCommandSpillingOutOfItsParentFails() {
        declare("A1", "jx:area(lastCell=\"B2\")");
        declare("A2", "jx:each(items=\"xs\" var=\"x\" lastCell=\"C2\")");

        assertEquals(CommandTreeBuilder.REGION_OUT_OF_BOUNDS,
                assertThrows(TemplateConfigurationException.class, () -> builder.build(commands)).getCode());
    }

    @Test
    public void testOverlappingSiblingsFail() {
        declare("A1", "jx:area(lastCell=\"D4\")");
        declare("A2", "jx:each(items=\"xs\" var=\"x\" lastCell=\"B3\")");
        declare("B3", "jx:each(items=\"ys\" var=\"y\" lastCell=\"C4\")");

        assertEquals(CommandTreeBuilder.OVERLAPPING_COMMANDS,
                assertThrows(TemplateConfigurationException.class, () -> builder.build(commands)).getCode());
    }

    @Test
    public void testOverlappingConditionsReportTheSharedCell() {
        declare("A1", "jx:area(lastCell=\"D4\")");
        declare("A2", "jx:if(condition=\"a\" lastCell=\"B3\")");
        declare("B3", "jx:if(condition=\"b\" lastCell=\"C4\")");

        TemplateConfigurationException e = assertThrows(TemplateConfigurationException.class, () -> builder.build(commands));
        assertEquals(CommandTreeBuilder.OVERLAPPING_COMMANDS, e.getCode());
        assertEquals("Sheet1!B3", e.getLocation());
    }

    @Test
    public void testOverlappingAreasFail() {
        declare("A1", "jx:area(lastCell=\"B2\")");
        declare("B2", "jx:area(lastCell=\"C3\")");

        assertEquals(CommandTreeBuilder.OVERLAPPING_COMMANDS,
                assertThrows(TemplateConfigurationException.class, () -> builder.build(commands)).getCode());
    }

    @Test
    public void testEmptyEachRegionFails() {
        declare("A1", "jx:area(lastCell=\"C3\")");
        declare("B2", "jx:each(items=\"xs\" var=\"x\" lastCell=\"A1\")");

        assertEquals(CommandTreeBuilder.EMPTY_EACH_REGION,
                assertThrows(TemplateConfigurationException.class, () -> builder.build(commands)).getCode());
    }

    @Test
    public void testIfChildOutsideBranchesFails() {
        declare("A1", "jx:area(lastCell=\"B4\")");
        declare("A2", "jx:if(condition=\"c\" lastCell=\"B4\" areas=[\"A2:B2\",\"A3:B3\"])");
        declare("A4", "jx:each(items=\"xs\" var=\"x\" lastCell=\"B4\")");

        assertEquals(CommandTreeBuilder.REGION_OUT_OF_BOUNDS,
                assertThrows(TemplateConfigurationException.class, () -> builder.build(commands)).getCode());
    }

    @Test
    public void testMultisheetInsideEachFails() {
        declare("A1", "jx:area(lastCell=\"B4\")");
        declare("A2", "jx:each(items=\"xs\" var=\"x\" lastCell=\"B4\")");
        declare("A3", "jx:each(items=\"x.ys\" var=\"y\" multisheet=\"names\" lastCell=\"B3\")");

        assertEquals(CommandTreeBuilder.MULTISHEET_NESTING,
                assertThrows(TemplateConfigurationException.class, () -> builder.build(commands)).getCode());
    }

    @Test
    public void testAreasOnSeveralSheetsAreIndependentRoots() {
        declare("A1", "jx:area(lastCell=\"B2\")");
        commands.addAll(parser.parse("jx:area(lastCell=\"B2\")", CellRef.of("Sheet2", 0, 0)).getCommands());

        List<AreaCommand> areas = builder.build(commands);

        assertEquals(2, areas.size());
        assertEquals("Sheet2", areas.get(1).getRegion().getSheet());
    }
}
