package com.example.gridfill.engine.transform;

import com.example.gridfill.engine.command.FormulaParams;
import com.example.gridfill.engine.command.FormulaStrategy;
import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.engine.grid.Region;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites the cell references of every formula rendered in an area pass so they point at the output copies
 * of the template cells they named. References to cells outside the area are left alone; formulas are never
 * evaluated.
 */
@Slf4j
class FormulaProcessor {
    /** Operand limit of a spreadsheet function; longer lists are joined with '+'. */
    static final int MAX_LIST_OPERANDS = 255;

    private static final Pattern REFERENCE = Pattern.compile(
            "(?<![A-Za-z0-9_.$'!:])"
                    + "((?:'(?:[^']|'')+'|[A-Za-z_][A-Za-z0-9_.]*)!)?"
                    + "(\\$?)([A-Z]{1,3})(\\$?)([0-9]+)"
                    + "(?::(\\$?)([A-Z]{1,3})(\\$?)([0-9]+))?"
                    + "(?![A-Za-z0-9_(!])");

    private final FillSession session;

    FormulaProcessor(FillSession session) {
        this.session = session;
    }

    void process(Region area, TargetGrid targets) {
        for (TargetGrid.FormulaCell formula : targets.getFormulas()) {
            String rewritten = rewrite(formula, area, targets);
            log.debug("Formula {} -> {} at {}", formula.getFormula(), rewritten, formula.getTarget());
            session.getDocument().writeFormula(formula.getTarget(), rewritten);
        }
    }

    /**
     * The formula with its references replaced, string literals untouched.
     */
    String rewrite(TargetGrid.FormulaCell formula, Region area, TargetGrid targets) {
        FormulaParams params = session.formulaParams(formula.getSource());
        String text = formula.getFormula();
        StringBuilder out = new StringBuilder();
        int pos = 0;
        while (pos < text.length()) {
            int open = text.indexOf('"', pos);
            if (open < 0) {
                out.append(rewriteReferences(text.substring(pos), formula, area, targets, params));
                break;
            }
            out.append(rewriteReferences(text.substring(pos, open), formula, area, targets, params));
            int close = closingQuote(text, open + 1);
            if (close < 0) {
                out.append(text.substring(open));
                break;
            }
            out.append(text, open, close + 1);
            pos = close + 1;
        }
        return out.toString();
    }

    private String rewriteReferences(String chunk, TargetGrid.FormulaCell formula, Region area, TargetGrid targets,
                                     FormulaParams params) {
        Matcher matcher = REFERENCE.matcher(chunk);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(out, Matcher.quoteReplacement(replace(matcher, formula, area, targets, params)));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private String replace(Matcher matcher, TargetGrid.FormulaCell formula, Region area, TargetGrid targets,
                           FormulaParams params) {
        String prefix = matcher.group(1);
        String sheet = prefix == null ? formula.getSource().getSheet() : unquote(prefix.substring(0, prefix.length() - 1));
        CellRef first = CellRef.parse(matcher.group(3) + matcher.group(5), sheet);
        boolean absCol = !matcher.group(2).isEmpty();
        boolean absRow = !matcher.group(4).isEmpty();
        if (matcher.group(7) == null) {
            if (!area.contains(first)) {
                return matcher.group();
            }
            List<CellRef> copies = select(targets.copiesOf(first), formula, params);
            if (copies.isEmpty()) {
                return params.getDefaultValue();
            }
            return join(copies, prefix != null, absCol, absRow, formula.getTarget().getSheet());
        }
        CellRef last = CellRef.parse(matcher.group(7) + matcher.group(9), sheet);
        Region range = Region.of(sheet, Math.min(first.getRow(), last.getRow()), Math.min(first.getCol(), last.getCol()),
                Math.max(first.getRow(), last.getRow()), Math.max(first.getCol(), last.getCol()));
        if (!area.contains(range)) {
            return matcher.group();
        }
        List<CellRef> copies = select(targets.copiesIn(range), formula, params);
        if (copies.isEmpty()) {
            return params.getDefaultValue();
        }
        int top = Integer.MAX_VALUE;
        int left = Integer.MAX_VALUE;
        int bottom = Integer.MIN_VALUE;
        int right = Integer.MIN_VALUE;
        for (CellRef copy : copies) {
            top = Math.min(top, copy.getRow());
            left = Math.min(left, copy.getCol());
            bottom = Math.max(bottom, copy.getRow());
            right = Math.max(right, copy.getCol());
        }
        String targetSheet = copies.get(0).getSheet();
        String start = sheetPrefix(targetSheet, prefix != null, formula.getTarget().getSheet())
                + CellRef.of(targetSheet, top, left).toA1(absCol, absRow);
        if (top == bottom && left == right) {
            return start;
        }
        boolean absEndCol = !matcher.group(6).isEmpty();
        boolean absEndRow = !matcher.group(8).isEmpty();
        return start + ":" + CellRef.of(targetSheet, bottom, right).toA1(absEndCol, absEndRow);
    }

    /**
     * Copies the formula may use: from a compatible iteration and, under a row or column strategy, on the
     * formula's own row or column.
     */
    private List<CellRef> select(List<TargetGrid.Copy> copies, TargetGrid.FormulaCell formula, FormulaParams params) {
        List<CellRef> selected = new ArrayList<>();
        CellRef target = formula.getTarget();
        for (TargetGrid.Copy copy : copies) {
            if (!copy.getPath().isCompatibleWith(formula.getPath())) {
                continue;
            }
            if (params.getStrategy() == FormulaStrategy.BY_ROW && copy.getTarget().getRow() != target.getRow()) {
                continue;
            }
            if (params.getStrategy() == FormulaStrategy.BY_COLUMN && copy.getTarget().getCol() != target.getCol()) {
                continue;
            }
            selected.add(copy.getTarget());
        }
        selected.sort(Comparator.naturalOrder());
        return selected;
    }

    private String join(List<CellRef> copies, boolean prefixed, boolean absCol, boolean absRow, String formulaSheet) {
        CellRef first = copies.get(0);
        String prefix = sheetPrefix(first.getSheet(), prefixed, formulaSheet);
        if (copies.size() == 1) {
            return prefix + first.toA1(absCol, absRow);
        }
        CellRef last = copies.get(copies.size() - 1);
        if (isContiguous(copies)) {
            return prefix + first.toA1(absCol, absRow) + ":" + last.toA1(absCol, absRow);
        }
        String separator = copies.size() > MAX_LIST_OPERANDS ? "+" : ",";
        StringBuilder out = new StringBuilder();
        for (CellRef copy : copies) {
            if (out.length() > 0) {
                out.append(separator);
            }
            out.append(prefix).append(copy.toA1(absCol, absRow));
        }
        return out.toString();
    }

    /**
     * True when sorted copies form one unbroken run down a column or along a row.
     */
    static boolean isContiguous(List<CellRef> sorted) {
        boolean column = true;
        boolean row = true;
        for (int i = 1; i < sorted.size(); i++) {
            CellRef previous = sorted.get(i - 1);
            CellRef current = sorted.get(i);
            column &= current.getCol() == previous.getCol() && current.getRow() == previous.getRow() + 1;
            row &= current.getRow() == previous.getRow() && current.getCol() == previous.getCol() + 1;
        }
        return column || row;
    }

    private static String sheetPrefix(String targetSheet, boolean prefixed, String formulaSheet) {
        if (prefixed || (targetSheet != null && !targetSheet.equals(formulaSheet))) {
            return CellRef.quoteSheet(targetSheet) + "!";
        }
        return "";
    }

    private static String unquote(String sheet) {
        if (sheet.length() >= 2 && sheet.startsWith("'") && sheet.endsWith("'")) {
            return sheet.substring(1, sheet.length() - 1).replace("''", "'");
        }
        return sheet;
    }

    /**
     * Index of the quote closing a string literal; a doubled quote inside the literal is an escaped quote.
     */
    private static int closingQuote(String text, int from) {
        int i = from;
        while (i < text.length()) {
            if (text.charAt(i) == '"') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                    i += 2;
                    continue;
                }
                return i;
            }
            i++;
        }
        return -1;
    }
}
