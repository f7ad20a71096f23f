package com.example.gridfill.engine.expression;

import com.example.gridfill.exception.ExpressionEvaluationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Parsed expression tree. Nodes are immutable and may be evaluated concurrently against different scopes.
 */
public interface Expression {
    String UNRESOLVED_VARIABLE = "UNRESOLVED_VARIABLE";

    Object evaluate(Scope scope, FunctionRegistry functions);

    final class Literal implements Expression {
        private final Object value;

        Literal(Object value) {
            this.value = value;
        }

        @Override
        public Object evaluate(Scope scope, FunctionRegistry functions) {
            return value;
        }
    }

    final class Variable implements Expression {
        private final String name;

        Variable(String name) {
            this.name = name;
        }

        @Override
        public Object evaluate(Scope scope, FunctionRegistry functions) {
            if (!scope.contains(name)) {
                throw new ExpressionEvaluationException(UNRESOLVED_VARIABLE, "Unresolved variable '" + name + "'");
            }
            return scope.lookup(name);
        }
    }

    /**
     * {@code target.name}; a null target or a missing property yields null.
     */
    final class Property implements Expression {
        private final Expression target;
        private final String name;

        Property(Expression target, String name) {
            this.target = target;
            this.name = name;
        }

        @Override
        public Object evaluate(Scope scope, FunctionRegistry functions) {
            return PropertyAccess.get(target.evaluate(scope, functions), name);
        }
    }

    final class Unary implements Expression {
        private final Token.Type op;
        private final Expression operand;

        Unary(Token.Type op, Expression operand) {
            this.op = op;
            this.operand = operand;
        }

        @Override
        public Object evaluate(Scope scope, FunctionRegistry functions) {
            Object value = operand.evaluate(scope, functions);
            if (op == Token.Type.NOT) {
                return !Coercions.toCondition(value);
            }
            return Coercions.negate(value);
        }
    }

    final class Binary implements Expression {
        private final Token.Type op;
        private final Expression left;
        private final Expression right;

        Binary(Token.Type op, Expression left, Expression right) {
            this.op = op;
            this.left = left;
            this.right = right;
        }

        @Override
        public Object evaluate(Scope scope, FunctionRegistry functions) {
            if (op == Token.Type.AND) {
                return Coercions.toCondition(left.evaluate(scope, functions))
                        && Coercions.toCondition(right.evaluate(scope, functions));
            }
            if (op == Token.Type.OR) {
                return Coercions.toCondition(left.evaluate(scope, functions))
                        || Coercions.toCondition(right.evaluate(scope, functions));
            }
            Object l = left.evaluate(scope, functions);
            Object r = right.evaluate(scope, functions);
            switch (op) {
                case PLUS:
                    return Coercions.add(l, r);
                case MINUS:
                    return Coercions.arithmetic("-", l, r);
                case STAR:
                    return Coercions.arithmetic("*", l, r);
                case SLASH:
                    return Coercions.arithmetic("/", l, r);
                case PERCENT:
                    return Coercions.arithmetic("%", l, r);
                case EQ:
                    return Coercions.equal(l, r);
                case NE:
                    return !Coercions.equal(l, r);
                case LT:
                    return Coercions.compare(l, r) < 0;
                case LE:
                    return Coercions.compare(l, r) <= 0;
                case GT:
                    return Coercions.compare(l, r) > 0;
                case GE:
                    return Coercions.compare(l, r) >= 0;
                default:
                    throw new IllegalStateException("Unexpected operator " + op);
            }
        }
    }

    final class Conditional implements Expression {
        private final Expression condition;
        private final Expression whenTrue;
        private final Expression whenFalse;

        Conditional(Expression condition, Expression whenTrue, Expression whenFalse) {
            this.condition = condition;
            this.whenTrue = whenTrue;
            this.whenFalse = whenFalse;
        }

        @Override
        public Object evaluate(Scope scope, FunctionRegistry functions) {
            return Coercions.toCondition(condition.evaluate(scope, functions))
                    ? whenTrue.evaluate(scope, functions)
                    : whenFalse.evaluate(scope, functions);
        }
    }

    final class Call implements Expression {
        private final String name;
        private final List<Expression> arguments;

        Call(String name, List<Expression> arguments) {
            this.name = name;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        public Object evaluate(Scope scope, FunctionRegistry functions) {
            List<Object> values = new ArrayList<>(arguments.size());
            for (Expression argument : arguments) {
                values.add(argument.evaluate(scope, functions));
            }
            return functions.lookup(name).apply(values);
        }
    }
}
