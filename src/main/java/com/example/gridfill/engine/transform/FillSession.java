package com.example.gridfill.engine.transform;

import com.example.gridfill.engine.Diagnostic;
import com.example.gridfill.engine.FillOptions;
import com.example.gridfill.engine.command.FormulaParams;
import com.example.gridfill.engine.expression.ExpressionEvaluator;
import com.example.gridfill.engine.expression.Notation;
import com.example.gridfill.engine.expression.Scope;
import com.example.gridfill.engine.expression.TemplateText;
import com.example.gridfill.engine.grid.CellRef;
import com.example.gridfill.engine.grid.GridDocument;
import com.example.gridfill.engine.grid.TemplateSnapshot;
import com.example.gridfill.exception.ExpressionEvaluationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * State shared by every pass of one fill: the output document, the template snapshot, the options and the
 * diagnostics collected so far.
 */
@Slf4j
@Getter
class FillSession {
    private final GridDocument document;
    private final TemplateSnapshot snapshot;
    private final ExpressionEvaluator evaluator;
    private final FillOptions options;
    private final Notation notation;
    private final Map<CellRef, FormulaParams> formulaParams;
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    FillSession(GridDocument document, TemplateSnapshot snapshot, ExpressionEvaluator evaluator, FillOptions options,
                Map<CellRef, FormulaParams> formulaParams) {
        this.document = document;
        this.snapshot = snapshot;
        this.evaluator = evaluator;
        this.options = options;
        this.notation = options.notation();
        this.formulaParams = formulaParams;
    }

    /**
     * Handles an expression failure at a template location: rethrows it in fail-fast mode, otherwise records
     * a diagnostic and, when asked to, annotates the output cell.
     *
     * @param source template cell or command anchor the expression belongs to
     * @param target output cell left empty because of the failure, or null
     */
    void recover(ExpressionEvaluationException e, CellRef source, CellRef target) {
        String location = source == null ? null : source.toString();
        if (options.isFailFast()) {
            throw e.at(location);
        }
        record(new Diagnostic(e.getCode(), location, e.getDescription()));
        if (target != null && options.isAnnotateErrors()) {
            document.writeComment(target, e.getCode() + ": " + e.getDescription());
        }
    }

    /**
     * Evaluates a command attribute. Attributes are bare expressions ({@code items="employees"}), but a value
     * wrapped in the notation markers ({@code items="${employees}"}) is accepted as well.
     */
    Object evaluate(String attribute, Scope scope) {
        return evaluator.evaluate(TemplateText.unwrapAttribute(attribute, notation), scope);
    }

    void record(Diagnostic diagnostic) {
        diagnostics.add(diagnostic);
        log.warn("Fill diagnostic {}", diagnostic);
    }

    FormulaParams formulaParams(CellRef source) {
        return formulaParams.getOrDefault(source, FormulaParams.DEFAULTS);
    }
}
