package com.example.gridfill.engine.expression;

import com.example.gridfill.exception.ExpressionEvaluationException;

import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Conversion rules applied wherever two values meet in an expression.
 * <ul>
 *     <li>{@code +} concatenates when either side is a string (null renders as empty text), otherwise both sides
 *     must be numbers.</li>
 *     <li>{@code - * / %} and ordering comparisons require numbers on both sides; ordering also accepts two
 *     strings, two booleans or two mutually comparable objects (dates).</li>
 *     <li>Integral operands stay integral except for division; any {@link BigDecimal} operand switches to
 *     decimal arithmetic; everything else is computed as double.</li>
 *     <li>Strings that look like numbers are never converted implicitly.</li>
 * </ul>
 */
public final class Coercions {
    public static final String TYPE_MISMATCH = "TYPE_MISMATCH";
    public static final String ARITHMETIC_ERROR = "ARITHMETIC_ERROR";

    private Coercions() {
    }

    public static Object add(Object left, Object right) {
        ValueKind lk = ValueKind.of(left);
        ValueKind rk = ValueKind.of(right);
        if (lk == ValueKind.STRING || rk == ValueKind.STRING) {
            return toText(left) + toText(right);
        }
        requireNumbers("+", left, right);
        Number a = (Number) left;
        Number b = (Number) right;
        if (isDecimal(a) || isDecimal(b)) {
            return toBigDecimal(a).add(toBigDecimal(b));
        }
        if (isIntegral(a) && isIntegral(b)) {
            try {
                return Math.addExact(a.longValue(), b.longValue());
            } catch (ArithmeticException overflow) {
                return a.doubleValue() + b.doubleValue();
            }
        }
        return a.doubleValue() + b.doubleValue();
    }

    public static Object arithmetic(String op, Object left, Object right) {
        requireNumbers(op, left, right);
        Number a = (Number) left;
        Number b = (Number) right;
        if (("/".equals(op) || "%".equals(op)) && b.doubleValue() == 0.0) {
            throw new ExpressionEvaluationException(ARITHMETIC_ERROR, "Division by zero in '" + op + "'");
        }
        if (isDecimal(a) || isDecimal(b)) {
            BigDecimal x = toBigDecimal(a);
            BigDecimal y = toBigDecimal(b);
            switch (op) {
                case "-":
                    return x.subtract(y);
                case "*":
                    return x.multiply(y);
                case "/":
                    return x.divide(y, MathContext.DECIMAL64);
                default:
                    return x.remainder(y);
            }
        }
        if (isIntegral(a) && isIntegral(b) && !"/".equals(op)) {
            long x = a.longValue();
            long y = b.longValue();
            try {
                switch (op) {
                    case "-":
                        return Math.subtractExact(x, y);
                    case "*":
                        return Math.multiplyExact(x, y);
                    default:
                        return x % y;
                }
            } catch (ArithmeticException overflow) {
                return "-".equals(op) ? (double) x - y : (double) x * y;
            }
        }
        double x = a.doubleValue();
        double y = b.doubleValue();
        switch (op) {
            case "-":
                return x - y;
            case "*":
                return x * y;
            case "/":
                return x / y;
            default:
                return x % y;
        }
    }

    public static Object negate(Object value) {
        if (ValueKind.of(value) != ValueKind.NUMBER) {
            throw new ExpressionEvaluationException(TYPE_MISMATCH, "Cannot negate " + describe(value));
        }
        Number n = (Number) value;
        if (isDecimal(n)) {
            return toBigDecimal(n).negate();
        }
        if (isIntegral(n)) {
            return -n.longValue();
        }
        return -n.doubleValue();
    }

    public static boolean equal(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        ValueKind lk = ValueKind.of(left);
        ValueKind rk = ValueKind.of(right);
        if (lk == ValueKind.NUMBER && rk == ValueKind.NUMBER) {
            return compareNumbers((Number) left, (Number) right) == 0;
        }
        if (lk == ValueKind.STRING && rk == ValueKind.STRING) {
            return left.toString().equals(right.toString());
        }
        return Objects.equals(left, right);
    }

    /**
     * Ordering used by {@code < <= > >=}. Raises a type mismatch for operands that have no common order.
     */
    @SuppressWarnings("unchecked")
    public static int compare(Object left, Object right) {
        ValueKind lk = ValueKind.of(left);
        ValueKind rk = ValueKind.of(right);
        if (lk == ValueKind.NUMBER && rk == ValueKind.NUMBER) {
            return compareNumbers((Number) left, (Number) right);
        }
        if (lk == ValueKind.STRING && rk == ValueKind.STRING) {
            return left.toString().compareTo(right.toString());
        }
        if (lk == ValueKind.BOOLEAN && rk == ValueKind.BOOLEAN) {
            return Boolean.compare((Boolean) left, (Boolean) right);
        }
        if (left instanceof Comparable && right != null && left.getClass().isInstance(right)) {
            return ((Comparable<Object>) left).compareTo(right);
        }
        throw new ExpressionEvaluationException(TYPE_MISMATCH,
                "Cannot compare " + describe(left) + " with " + describe(right));
    }

    /**
     * Lenient ordering for sort keys: nulls first, numbers numerically, comparable objects of one class
     * naturally, anything else by its text form. Never fails.
     */
    @SuppressWarnings("unchecked")
    public static int sortCompare(Object left, Object right) {
        if (left == null || right == null) {
            return left == null ? (right == null ? 0 : -1) : 1;
        }
        if (left instanceof Number && right instanceof Number) {
            return compareNumbers((Number) left, (Number) right);
        }
        if (left instanceof Comparable && left.getClass().isInstance(right)) {
            return ((Comparable<Object>) left).compareTo(right);
        }
        return toText(left).compareTo(toText(right));
    }

    /**
     * Strict truth test for conditions: null is false, booleans are themselves, anything else is a mismatch.
     */
    public static boolean toCondition(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new ExpressionEvaluationException(TYPE_MISMATCH, "Condition must be boolean but was " + describe(value));
    }

    /**
     * Elements of a sequence value; null yields an empty list.
     */
    public static List<Object> toList(Object value) {
        List<Object> items = new ArrayList<>();
        if (value == null) {
            return items;
        }
        if (value instanceof Collection) {
            items.addAll((Collection<?>) value);
        } else if (value instanceof Iterable) {
            for (Object item : (Iterable<?>) value) {
                items.add(item);
            }
        } else if (value.getClass().isArray() && !(value instanceof byte[])) {
            int length = Array.getLength(value);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(value, i));
            }
        } else {
            throw new ExpressionEvaluationException(TYPE_MISMATCH, "Expected a sequence but got " + describe(value));
        }
        return items;
    }

    /**
     * Text rendering used for concatenation: null is empty, whole doubles drop their fraction.
     */
    public static String toText(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).stripTrailingZeros().toPlainString();
        }
        return value.toString();
    }

    public static String describe(Object value) {
        ValueKind kind = ValueKind.of(value);
        return kind == ValueKind.NULL ? "null" : kind.name().toLowerCase(java.util.Locale.ROOT) + " '" + toText(value) + "'";
    }

    static int compareNumbers(Number a, Number b) {
        if (isIntegral(a) && isIntegral(b)) {
            return Long.compare(a.longValue(), b.longValue());
        }
        if (isDecimal(a) || isDecimal(b)) {
            return toBigDecimal(a).compareTo(toBigDecimal(b));
        }
        return Double.compare(a.doubleValue(), b.doubleValue());
    }

    private static void requireNumbers(String op, Object left, Object right) {
        if (ValueKind.of(left) != ValueKind.NUMBER || ValueKind.of(right) != ValueKind.NUMBER) {
            throw new ExpressionEvaluationException(TYPE_MISMATCH,
                    "Operator '" + op + "' needs numbers but got " + describe(left) + " and " + describe(right));
        }
    }

    private static boolean isIntegral(Number n) {
        return n instanceof Integer || n instanceof Long || n instanceof Short || n instanceof Byte
                || (n instanceof BigInteger && ((BigInteger) n).bitLength() < 64);
    }

    private static boolean isDecimal(Number n) {
        return n instanceof BigDecimal;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) {
            return (BigDecimal) n;
        }
        if (isIntegral(n)) {
            return BigDecimal.valueOf(n.longValue());
        }
        return BigDecimal.valueOf(n.doubleValue());
    }
}
