package com.example.gridfill.engine.command;

import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.engine.grid.ImageType;
import com.example.gridfill.engine.grid.Region;
import com.example.gridfill.exception.TemplateParseException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the annotation text of one cell into command declarations.
 * <p>
 * Every line starting with {@code jx:} is a declaration of the form {@code jx:name(key="value" ...)}; other
 * lines (comment author, notes) are ignored. Values may be quoted with straight or typographic quotes, and
 * {@code areas} also accepts a bracketed list. {@code jx:params} is not a command: it carries formula options
 * for the annotated cell.
 */
@Slf4j
public class CommandParser {
    public static final String UNKNOWN_COMMAND = "UNKNOWN_COMMAND";
    public static final String MISSING_ATTRIBUTE = "MISSING_ATTRIBUTE";
    public static final String MALFORMED_COMMAND = "MALFORMED_COMMAND";
    public static final String INVALID_CELL_REFERENCE = "INVALID_CELL_REFERENCE";
    public static final String INVALID_ATTRIBUTE = "INVALID_ATTRIBUTE";

    private static final String PREFIX = "jx:";
    private static final String PARAMS = "params";
    private static final Pattern DECLARATION = Pattern.compile("^jx:([A-Za-z]+)\\s*\\((.*)\\)\\s*$", Pattern.DOTALL);

    public ParsedAnnotation parse(String annotation, CellRef anchor) {
        List<CommandNode> commands = new ArrayList<>();
        FormulaParams params = null;
        if (annotation == null) {
            return new ParsedAnnotation(commands, null);
        }
        for (String rawLine : annotation.split("\\r\\n|\\r|\\n")) {
            String line = rawLine.trim();
            if (!line.startsWith(PREFIX)) {
                continue;
            }
            Matcher matcher = DECLARATION.matcher(line);
            if (!matcher.matches()) {
                throw new TemplateParseException(MALFORMED_COMMAND, "Cannot parse declaration '" + line + "'", anchor.toString());
            }
            String name = matcher.group(1);
            Map<String, String> attributes = parseAttributes(matcher.group(2), anchor);
            if (PARAMS.equals(name)) {
                params = toFormulaParams(attributes, anchor);
                continue;
            }
            CommandType type = CommandType.fromName(name);
            if (type == null) {
                throw new TemplateParseException(UNKNOWN_COMMAND, "Unknown command 'jx:" + name + "'", anchor.toString());
            }
            CommandNode command = build(type, attributes, anchor);
            log.debug("Parsed {}", command);
            commands.add(command);
        }
        return new ParsedAnnotation(commands, params);
    }

    private CommandNode build(CommandType type, Map<String, String> attributes, CellRef anchor) {
        requireAttribute(type, CommandType.LAST_CELL, attributes, anchor);
        for (String required : type.getRequiredAttributes()) {
            requireAttribute(type, required, attributes, anchor);
        }
        Region region = Region.of(anchor, parseCell(attributes.get(CommandType.LAST_CELL), anchor));
        switch (type) {
            case AREA:
                return new AreaCommand(region, attributes);
            case EACH:
                return new EachCommand(region, attributes, parseDirection(attributes.get("direction"), anchor),
                        parseGroupOrder(attributes.get("groupOrder"), anchor));
            case IF:
                return buildIf(region, attributes, anchor);
            case GRID:
                return new GridCommand(region, attributes);
            case IMAGE:
                return new ImageCommand(region, attributes, parseImageType(attributes.get("imageType"), anchor),
                        parseScale("scaleX", attributes, anchor), parseScale("scaleY", attributes, anchor));
            case MERGE_CELLS:
                return new MergeCellsCommand(region, attributes);
            case AUTO_ROW_HEIGHT:
                return new AutoRowHeightCommand(region, attributes);
            case UPDATE_CELL:
                return new UpdateCellCommand(region, attributes);
            default:
                throw new IllegalStateException("Unhandled command type " + type);
        }
    }

    private IfCommand buildIf(Region region, Map<String, String> attributes, CellRef anchor) {
        String areas = attributes.get("areas");
        if (areas == null || areas.isBlank()) {
            return new IfCommand(region, attributes, null, null);
        }
        String body = areas.trim();
        if (body.startsWith("[") && body.endsWith("]")) {
            body = body.substring(1, body.length() - 1);
        }
        List<Region> regions = new ArrayList<>();
        for (String part : body.split(",")) {
            String range = stripQuotes(part.trim());
            if (range.isEmpty()) {
                continue;
            }
            String[] corners = range.split(":");
            if (corners.length != 2) {
                throw new TemplateParseException(INVALID_CELL_REFERENCE, "Invalid area '" + range + "' in jx:if areas", anchor.toString());
            }
            regions.add(Region.of(parseCell(corners[0], anchor), parseCell(corners[1], anchor)));
        }
        if (regions.isEmpty() || regions.size() > 2) {
            throw new TemplateParseException(INVALID_ATTRIBUTE, "jx:if areas must list one or two ranges but was " + areas, anchor.toString());
        }
        return new IfCommand(region, attributes, regions.get(0), regions.size() > 1 ? regions.get(1) : null);
    }

    private Map<String, String> parseAttributes(String body, CellRef anchor) {
        Map<String, String> attributes = new LinkedHashMap<>();
        int i = 0;
        int length = body.length();
        while (i < length) {
            char c = body.charAt(i);
            if (Character.isWhitespace(c) || c == ',') {
                i++;
                continue;
            }
            int keyStart = i;
            while (i < length && (Character.isLetterOrDigit(body.charAt(i)) || body.charAt(i) == '_')) {
                i++;
            }
            if (i == keyStart) {
                throw malformed("Unexpected '" + c + "' in attributes", body, anchor);
            }
            String key = body.substring(keyStart, i);
            i = skipWhitespace(body, i);
            if (i >= length || body.charAt(i) != '=') {
                throw malformed("Attribute '" + key + "' has no value", body, anchor);
            }
            i = skipWhitespace(body, i + 1);
            if (i >= length) {
                throw malformed("Attribute '" + key + "' has no value", body, anchor);
            }
            char open = body.charAt(i);
            int end;
            String value;
            if (open == '[') {
                end = body.indexOf(']', i);
                if (end < 0) {
                    throw malformed("Unclosed '[' in attribute '" + key + "'", body, anchor);
                }
                value = body.substring(i, end + 1);
            } else if (isOpeningQuote(open)) {
                end = findClosingQuote(body, i + 1, open);
                if (end < 0) {
                    throw malformed("Unterminated value of attribute '" + key + "'", body, anchor);
                }
                value = body.substring(i + 1, end);
            } else {
                throw malformed("Value of attribute '" + key + "' must be quoted", body, anchor);
            }
            attributes.put(key, value);
            i = end + 1;
        }
        return attributes;
    }

    private FormulaParams toFormulaParams(Map<String, String> attributes, CellRef anchor) {
        FormulaStrategy strategy = FormulaStrategy.DEFAULT;
        String rawStrategy = attributes.get("formulaStrategy");
        if (rawStrategy != null && !rawStrategy.isBlank()) {
            try {
                strategy = FormulaStrategy.valueOf(rawStrategy.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new TemplateParseException(INVALID_ATTRIBUTE, "Unknown formulaStrategy '" + rawStrategy + "'", anchor.toString(), e);
            }
        }
        String defaultValue = attributes.getOrDefault("defaultValue", FormulaParams.DEFAULTS.getDefaultValue());
        return new FormulaParams(strategy, defaultValue);
    }

    private void requireAttribute(CommandType type, String name, Map<String, String> attributes, CellRef anchor) {
        String value = attributes.get(name);
        if (value == null || value.isBlank()) {
            throw new TemplateParseException(MISSING_ATTRIBUTE,
                    "jx:" + type.getCommandName() + " requires attribute '" + name + "'", anchor.toString());
        }
    }

    private CellRef parseCell(String text, CellRef anchor) {
        CellRef cell;
        try {
            cell = CellRef.parse(text.trim(), anchor.getSheet());
        } catch (IllegalArgumentException e) {
            throw new TemplateParseException(INVALID_CELL_REFERENCE, e.getMessage(), anchor.toString(), e);
        }
        if (anchor.getSheet() != null && !anchor.getSheet().equals(cell.getSheet())) {
            throw new TemplateParseException(INVALID_CELL_REFERENCE,
                    "Cell " + text + " is not on sheet '" + anchor.getSheet() + "'", anchor.toString());
        }
        return cell;
    }

    private Direction parseDirection(String value, CellRef anchor) {
        if (value == null || value.isBlank()) {
            return Direction.DOWN;
        }
        try {
            return Direction.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TemplateParseException(INVALID_ATTRIBUTE, "direction must be DOWN or RIGHT but was '" + value + "'", anchor.toString(), e);
        }
    }

    private GroupOrder parseGroupOrder(String value, CellRef anchor) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return GroupOrder.parse(value);
        } catch (IllegalArgumentException e) {
            throw new TemplateParseException(INVALID_ATTRIBUTE, e.getMessage(), anchor.toString(), e);
        }
    }

    private ImageType parseImageType(String value, CellRef anchor) {
        try {
            return ImageType.fromAttribute(value);
        } catch (IllegalArgumentException e) {
            throw new TemplateParseException(INVALID_ATTRIBUTE, "Unsupported imageType '" + value + "'", anchor.toString(), e);
        }
    }

    private double parseScale(String name, Map<String, String> attributes, CellRef anchor) {
        String value = attributes.get(name);
        if (value == null || value.isBlank()) {
            return 1.0;
        }
        try {
            double scale = Double.parseDouble(value.trim());
            if (scale <= 0) {
                throw new NumberFormatException("not positive");
            }
            return scale;
        } catch (NumberFormatException e) {
            throw new TemplateParseException(INVALID_ATTRIBUTE, name + " must be a positive number but was '" + value + "'", anchor.toString(), e);
        }
    }

    private static boolean isOpeningQuote(char c) {
        return c == '"' || c == '\'' || c == '“' || c == '‘';
    }

    /**
     * A value opened with a double quote may close with the straight or the typographic variant, and likewise
     * for single quotes; the other quote family may appear inside the value.
     */
    private static int findClosingQuote(String body, int from, char open) {
        boolean doubleFamily = open == '"' || open == '“';
        for (int i = from; i < body.length(); i++) {
            char c = body.charAt(i);
            if (doubleFamily ? (c == '"' || c == '”') : (c == '\'' || c == '’')) {
                return i;
            }
        }
        return -1;
    }

    private static String stripQuotes(String text) {
        String result = text;
        if (!result.isEmpty() && isOpeningQuote(result.charAt(0))) {
            result = result.substring(1);
        }
        if (!result.isEmpty()) {
            char last = result.charAt(result.length() - 1);
            if (last == '"' || last == '\'' || last == '”' || last == '’') {
                result = result.substring(0, result.length() - 1);
            }
        }
        return result;
    }

    private static int skipWhitespace(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    private static TemplateParseException malformed(String message, String body, CellRef anchor) {
        return new TemplateParseException(MALFORMED_COMMAND, message + " in (" + body + ")", anchor.toString());
    }
}
