package com.example.gridfill.engine.expression;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parses and evaluates expressions. Parsed trees are cached by source text, so one evaluator can be shared by
 * every fill that runs in the process.
 */
@Slf4j
public class ExpressionEvaluator {
    private final FunctionRegistry functions;
    private final Map<String, Expression> parsed = new ConcurrentHashMap<>();

    public ExpressionEvaluator() {
        this(FunctionRegistry.standard());
    }

    public ExpressionEvaluator(FunctionRegistry functions) {
        this.functions = functions;
    }

    /**
     * @throws com.example.gridfill.exception.ExpressionEvaluationException with code
     *         {@code MALFORMED_EXPRESSION} or {@code UNKNOWN_FUNCTION}
     */
    public Expression parse(String source) {
        Expression cached = parsed.get(source);
        if (cached != null) {
            return cached;
        }
        Expression expression = new ExpressionParser(source, functions).parse();
        parsed.putIfAbsent(source, expression);
        log.trace("Parsed expression '{}'", source);
        return expression;
    }

    public Object evaluate(String source, Scope scope) {
        return parse(source).evaluate(scope, functions);
    }

    public boolean evaluateCondition(String source, Scope scope) {
        return Coercions.toCondition(evaluate(source, scope));
    }

    /**
     * Value of a cell text: the native value for a single expression, otherwise every part rendered as text and
     * concatenated.
     */
    public Object evaluateText(TemplateText text, Scope scope) {
        if (text.isSingleExpression()) {
            for (TemplateText.Segment segment : text.getSegments()) {
                if (segment.isExpression()) {
                    return evaluate(segment.getText(), scope);
                }
            }
        }
        StringBuilder out = new StringBuilder();
        for (TemplateText.Segment segment : text.getSegments()) {
            if (segment.isExpression()) {
                out.append(Coercions.toText(evaluate(segment.getText(), scope)));
            } else {
                out.append(segment.getText());
            }
        }
        return out.toString();
    }
}
