package com.example.gridfill.engine.expression;

import com.example.gridfill.exception.ExpressionEvaluationException;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Functions callable from expressions. The standard registry holds
 * {@code hyperlink(url, label)}, {@code size(x)}, {@code upper(s)}, {@code lower(s)}, {@code trim(s)}
 * and {@code coalesce(a, b, ...)}.
 */
public final class FunctionRegistry {
    public static final String UNKNOWN_FUNCTION = "UNKNOWN_FUNCTION";

    private final Map<String, Function<List<Object>, Object>> functions = new ConcurrentHashMap<>();

    public static FunctionRegistry standard() {
        FunctionRegistry registry = new FunctionRegistry();
        registry.register("hyperlink", args -> {
            arity("hyperlink", args, 1, 2);
            String url = Coercions.toText(args.get(0));
            String label = args.size() > 1 ? Coercions.toText(args.get(1)) : "";
            return new HyperlinkValue(url, label);
        });
        registry.register("size", args -> {
            arity("size", args, 1, 1);
            Object value = args.get(0);
            switch (ValueKind.of(value)) {
                case NULL:
                    return 0L;
                case STRING:
                    return (long) value.toString().length();
                case MAPPING:
                    return (long) ((Map<?, ?>) value).size();
                case BINARY:
                    return (long) ((byte[]) value).length;
                case SEQUENCE:
                    return (long) Coercions.toList(value).size();
                default:
                    throw new ExpressionEvaluationException(Coercions.TYPE_MISMATCH,
                            "size() is not defined for " + Coercions.describe(value));
            }
        });
        registry.register("upper", args -> {
            arity("upper", args, 1, 1);
            return args.get(0) == null ? null : Coercions.toText(args.get(0)).toUpperCase(Locale.ROOT);
        });
        registry.register("lower", args -> {
            arity("lower", args, 1, 1);
            return args.get(0) == null ? null : Coercions.toText(args.get(0)).toLowerCase(Locale.ROOT);
        });
        registry.register("trim", args -> {
            arity("trim", args, 1, 1);
            return args.get(0) == null ? null : Coercions.toText(args.get(0)).trim();
        });
        registry.register("coalesce", args -> {
            for (Object arg : args) {
                if (arg != null) {
                    return arg;
                }
            }
            return null;
        });
        return registry;
    }

    public FunctionRegistry register(String name, Function<List<Object>, Object> function) {
        functions.put(name, function);
        return this;
    }

    public boolean contains(String name) {
        return functions.containsKey(name);
    }

    Function<List<Object>, Object> lookup(String name) {
        Function<List<Object>, Object> function = functions.get(name);
        if (function == null) {
            throw new ExpressionEvaluationException(UNKNOWN_FUNCTION, "Unknown function '" + name + "'");
        }
        return function;
    }

    private static void arity(String name, List<Object> args, int min, int max) {
        if (args.size() < min || args.size() > max) {
            throw new ExpressionEvaluationException(Coercions.TYPE_MISMATCH,
                    name + "() takes " + (min == max ? String.valueOf(min) : min + " to " + max)
                            + " argument(s) but got " + args.size());
        }
    }
}
