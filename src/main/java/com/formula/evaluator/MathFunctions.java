package com.formula.evaluator;

import com.formula.exception.EvaluationException;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Built-in function library. Hosts may register additional functions keyed by name and arity range.
 */
public class MathFunctions implements FunctionLibrary {

    public static final int MAX_FACTORIAL = 170;
    public static final int VARARGS = Integer.MAX_VALUE;

    private record Entry(int minArity, int maxArity, MathFunction function) {
        boolean accepts(int arity) {
            return arity >= minArity && arity <= maxArity;
        }
    }

    private final Map<String, List<Entry>> functions = new ConcurrentHashMap<>();
    private final Set<String> impure = ConcurrentHashMap.newKeySet();

    /**
     * Library with every built-in function registered.
     */
    public static MathFunctions standard() {
        MathFunctions library = new MathFunctions();
        library.registerBuiltIns();
        return library;
    }

    /**
     * Register a function for an arity range. Later registrations win for overlapping arities.
     */
    public MathFunctions register(String name, int minArity, int maxArity, MathFunction function) {
        functions.computeIfAbsent(normalize(name), k -> new CopyOnWriteArrayList<>())
                .add(0, new Entry(minArity, maxArity, function));
        return this;
    }

    public MathFunctions register(String name, int arity, MathFunction function) {
        return register(name, arity, arity, function);
    }

    /**
     * Register a function whose result may change between calls; it is never constant-folded.
     */
    public MathFunctions registerImpure(String name, int minArity, int maxArity, MathFunction function) {
        impure.add(normalize(name));
        return register(name, minArity, maxArity, function);
    }

    @Override
    public Optional<MathFunction> lookup(String name, int arity) {
        List<Entry> entries = functions.get(normalize(name));
        if (entries == null) {
            return Optional.empty();
        }
        for (Entry entry : entries) {
            if (entry.accepts(arity)) {
                return Optional.of(entry.function());
            }
        }
        return Optional.empty();
    }

    @Override
    public boolean isDefined(String name) {
        return functions.containsKey(normalize(name));
    }

    @Override
    public boolean isPure(String name) {
        return !impure.contains(normalize(name));
    }

    public Set<String> names() {
        return new HashSet<>(functions.keySet());
    }

    private static String normalize(String name) {
        return name.toUpperCase(Locale.ROOT);
    }

    private void registerBuiltIns() {
        // Basic
        register("ABS", 1, args -> Math.abs(args[0]));
        register("SQRT", 1, args -> {
            requireAtLeast("SQRT", args[0], 0);
            return Math.sqrt(args[0]);
        });
        register("ROUND", 1, 2, MathFunctions::round);
        register("FLOOR", 1, args -> Math.floor(args[0]));
        register("CEIL", 1, args -> Math.ceil(args[0]));
        register("CEILING", 1, args -> Math.ceil(args[0]));
        register("TRUNC", 1, args -> truncate(args[0]));
        register("TRUNCATE", 1, args -> truncate(args[0]));
        register("SIGN", 1, args -> Math.signum(args[0]));
        register("MOD", 2, args -> {
            if (args[1] == 0.0) {
                throw EvaluationException.moduloByZero();
            }
            return args[0] % args[1];
        });
        register("POW", 2, args -> power(args[0], args[1]));

        // Aggregates
        register("MIN", 1, VARARGS, args -> {
            double min = args[0];
            for (double value : args) {
                min = Math.min(min, value);
            }
            return min;
        });
        register("MAX", 1, VARARGS, args -> {
            double max = args[0];
            for (double value : args) {
                max = Math.max(max, value);
            }
            return max;
        });
        register("SUM", 1, VARARGS, MathFunctions::sum);
        register("AVG", 1, VARARGS, args -> sum(args) / args.length);
        register("AVERAGE", 1, VARARGS, args -> sum(args) / args.length);
        register("COUNT", 0, VARARGS, args -> args.length);

        // Trigonometry
        register("SIN", 1, args -> Math.sin(args[0]));
        register("COS", 1, args -> Math.cos(args[0]));
        register("TAN", 1, args -> Math.tan(args[0]));
        register("ASIN", 1, args -> {
            requireRange("ASIN", args[0], -1, 1);
            return Math.asin(args[0]);
        });
        register("ACOS", 1, args -> {
            requireRange("ACOS", args[0], -1, 1);
            return Math.acos(args[0]);
        });
        register("ATAN", 1, args -> Math.atan(args[0]));
        register("ATAN2", 2, args -> Math.atan2(args[0], args[1]));
        register("SINH", 1, args -> Math.sinh(args[0]));
        register("COSH", 1, args -> Math.cosh(args[0]));
        register("TANH", 1, args -> Math.tanh(args[0]));
        register("RADIANS", 1, args -> Math.toRadians(args[0]));
        register("DEGREES", 1, args -> Math.toDegrees(args[0]));

        // Logarithms and constants
        register("LOG", 1, args -> {
            requirePositive("LOG", args[0]);
            return Math.log(args[0]);
        });
        register("LOG10", 1, args -> {
            requirePositive("LOG10", args[0]);
            return Math.log10(args[0]);
        });
        register("EXP", 1, args -> Math.exp(args[0]));
        register("PI", 0, args -> Math.PI);
        register("E", 0, args -> Math.E);

        // Integer functions
        register("GCD", 2, VARARGS, args -> {
            long result = toInteger("GCD", args[0]);
            for (int i = 1; i < args.length; i++) {
                result = gcd(result, toInteger("GCD", args[i]));
            }
            return Math.abs(result);
        });
        register("LCM", 2, VARARGS, args -> {
            long result = toInteger("LCM", args[0]);
            for (int i = 1; i < args.length; i++) {
                long next = toInteger("LCM", args[i]);
                if (result == 0 || next == 0) {
                    return 0;
                }
                result = Math.abs(result / gcd(result, next) * next);
            }
            return Math.abs(result);
        });
        register("FACTORIAL", 1, args -> factorial(args[0]));
        register("COMB", 2, MathFunctions::combination);
        register("COMBINATION", 2, MathFunctions::combination);
        register("PERM", 2, MathFunctions::permutation);
        register("PERMUTATION", 2, MathFunctions::permutation);

        registerImpure("RANDOM", 0, 0, args -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Rounds half to even, optionally at a number of decimal places.
     */
    static double round(double[] args) {
        if (args.length == 1) {
            return Math.rint(args[0]);
        }
        double multiplier = Math.pow(10, (int) args[1]);
        return Math.rint(args[0] * multiplier) / multiplier;
    }

    static double power(double base, double exponent) {
        double result = Math.pow(base, exponent);
        if (Double.isNaN(result)) {
            throw EvaluationException.domain("POW", base);
        }
        return result;
    }

    private static double truncate(double value) {
        return value < 0 ? Math.ceil(value) : Math.floor(value);
    }

    private static double sum(double[] args) {
        double total = 0;
        for (double value : args) {
            total += value;
        }
        return total;
    }

    private static double factorial(double value) {
        if (value < 0 || value != Math.floor(value)) {
            throw EvaluationException.domain("FACTORIAL", value);
        }
        if (value > MAX_FACTORIAL) {
            throw new EvaluationException(EvaluationException.Kind.DOMAIN_ERROR,
                    "FACTORIAL argument " + value + " exceeds " + MAX_FACTORIAL);
        }
        double result = 1.0;
        for (int i = 2; i <= (int) value; i++) {
            result *= i;
        }
        return result;
    }

    private static double combination(double[] args) {
        long n = toInteger("COMBINATION", args[0]);
        long k = toInteger("COMBINATION", args[1]);
        if (n < 0 || k < 0) {
            throw EvaluationException.domain("COMBINATION", Math.min(n, k));
        }
        if (k > n) {
            return 0;
        }
        return factorial(n) / (factorial(k) * factorial(n - k));
    }

    private static double permutation(double[] args) {
        long n = toInteger("PERMUTATION", args[0]);
        long k = toInteger("PERMUTATION", args[1]);
        if (n < 0 || k < 0) {
            throw EvaluationException.domain("PERMUTATION", Math.min(n, k));
        }
        if (k > n) {
            return 0;
        }
        return factorial(n) / factorial(n - k);
    }

    private static long gcd(long a, long b) {
        a = Math.abs(a);
        b = Math.abs(b);
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }

    private static long toInteger(String function, double value) {
        if (value != Math.floor(value)) {
            throw EvaluationException.domain(function, value);
        }
        return (long) value;
    }

    private static void requireAtLeast(String function, double value, double minimum) {
        if (value < minimum) {
            throw EvaluationException.domain(function, value);
        }
    }

    private static void requirePositive(String function, double value) {
        if (value <= 0) {
            throw EvaluationException.domain(function, value);
        }
    }

    private static void requireRange(String function, double value, double min, double max) {
        if (value < min || value > max) {
            throw EvaluationException.domain(function, value);
        }
    }
}
