package com.formulagraph.app.expression;

import com.formulagraph.app.exceptions.EvaluationException;
import com.formulagraph.app.models.ConditionalMode;
import com.formulagraph.app.models.EvaluationErrorType;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * The closed set of spreadsheet functions the evaluator understands.
 * Aggregates (SUM, AVERAGE, MAX, MIN) accept ranges and skip the text and logical
 * values inside them; scalar arguments are coerced.
 */
enum BuiltinFunction {

    SUM(1, -1) {
        @Override
        Object apply(List<Object> args) {
            double total = 0;
            for (double number : numbers(args)) {
                total += number;
            }
            return Values.checked(total, "SUM");
        }
    },
    AVERAGE(1, -1) {
        @Override
        Object apply(List<Object> args) {
            List<Double> numbers = numbers(args);
            if (numbers.isEmpty()) {
                throw new EvaluationException(EvaluationErrorType.DIVISION_BY_ZERO, "AVERAGE of no numbers");
            }
            double total = 0;
            for (double number : numbers) {
                total += number;
            }
            return Values.checked(total / numbers.size(), "AVERAGE");
        }
    },
    MAX(1, -1) {
        @Override
        Object apply(List<Object> args) {
            List<Double> numbers = numbers(args);
            double max = numbers.isEmpty() ? 0 : Double.NEGATIVE_INFINITY;
            for (double number : numbers) {
                max = Math.max(max, number);
            }
            return max;
        }
    },
    MIN(1, -1) {
        @Override
        Object apply(List<Object> args) {
            List<Double> numbers = numbers(args);
            double min = numbers.isEmpty() ? 0 : Double.POSITIVE_INFINITY;
            for (double number : numbers) {
                min = Math.min(min, number);
            }
            return min;
        }
    },
    SQRT(1, 1) {
        @Override
        Object apply(List<Object> args) {
            double x = Values.toNumber(args.get(0));
            if (x < 0) {
                throw Values.mismatch("SQRT of a negative number");
            }
            return Math.sqrt(x);
        }
    },
    ABS(1, 1) {
        @Override
        Object apply(List<Object> args) {
            return Math.abs(Values.toNumber(args.get(0)));
        }
    },
    ROUND(1, 2) {
        @Override
        Object apply(List<Object> args) {
            double x = Values.toNumber(args.get(0));
            int digits = args.size() > 1 ? (int) Values.toNumber(args.get(1)) : 0;
            // Past the double range every digit count gives the same result
            digits = Math.max(-MAX_ROUND_DIGITS, Math.min(MAX_ROUND_DIGITS, digits));
            // Half away from zero, as spreadsheets round
            return BigDecimal.valueOf(x).setScale(digits, RoundingMode.HALF_UP).doubleValue();
        }
    },
    IF(2, 3) {
        @Override
        Object call(List<ExprNode> args, EvaluationScope scope) {
            boolean condition = Values.toBoolean(scalar(args.get(0).evaluate(scope)));
            ExprNode whenTrue = args.get(1);
            ExprNode whenFalse = args.size() > 2 ? args.get(2) : null;
            if (scope.conditionalMode() == ConditionalMode.EAGER) {
                Object trueValue = scalar(whenTrue.evaluate(scope));
                Object falseValue = whenFalse == null ? Boolean.FALSE : scalar(whenFalse.evaluate(scope));
                return condition ? trueValue : falseValue;
            }
            if (condition) {
                return scalar(whenTrue.evaluate(scope));
            }
            return whenFalse == null ? Boolean.FALSE : scalar(whenFalse.evaluate(scope));
        }

        @Override
        Object apply(List<Object> args) {
            throw new IllegalStateException("IF evaluates its own arguments");
        }
    },
    AND(1, -1) {
        @Override
        Object apply(List<Object> args) {
            boolean result = true;
            for (boolean value : logicals(args)) {
                result &= value;
            }
            return result;
        }
    },
    OR(1, -1) {
        @Override
        Object apply(List<Object> args) {
            boolean result = false;
            for (boolean value : logicals(args)) {
                result |= value;
            }
            return result;
        }
    },
    POWER(2, 2) {
        @Override
        Object apply(List<Object> args) {
            return BinaryNode.power(Values.toNumber(args.get(0)), Values.toNumber(args.get(1)));
        }
    },
    EXP(1, 1) {
        @Override
        Object apply(List<Object> args) {
            return Values.checked(Math.exp(Values.toNumber(args.get(0))), "EXP");
        }
    },
    LN(1, 1) {
        @Override
        Object apply(List<Object> args) {
            double x = Values.toNumber(args.get(0));
            if (x <= 0) {
                throw Values.mismatch("LN of a non-positive number");
            }
            return Math.log(x);
        }
    },
    LOG(1, 2) {
        @Override
        Object apply(List<Object> args) {
            double x = Values.toNumber(args.get(0));
            if (x <= 0) {
                throw Values.mismatch("LOG of a non-positive number");
            }
            if (args.size() == 1) {
                return Math.log10(x);
            }
            double base = Values.toNumber(args.get(1));
            if (base <= 0) {
                throw Values.mismatch("LOG base must be positive");
            }
            if (base == 1) {
                throw new EvaluationException(EvaluationErrorType.DIVISION_BY_ZERO, "LOG base 1");
            }
            return Math.log(x) / Math.log(base);
        }
    },
    SIN(1, 1) {
        @Override
        Object apply(List<Object> args) {
            return Math.sin(Values.toNumber(args.get(0)));
        }
    },
    COS(1, 1) {
        @Override
        Object apply(List<Object> args) {
            return Math.cos(Values.toNumber(args.get(0)));
        }
    },
    TAN(1, 1) {
        @Override
        Object apply(List<Object> args) {
            return Values.checked(Math.tan(Values.toNumber(args.get(0))), "TAN");
        }
    },
    PI(0, 0) {
        @Override
        Object apply(List<Object> args) {
            return Math.PI;
        }
    };

    // Covers every decimal position a double can carry, subnormals included
    private static final int MAX_ROUND_DIGITS = 340;

    private final int minArgs;
    private final int maxArgs; // -1 for no upper bound

    BuiltinFunction(int minArgs, int maxArgs) {
        this.minArgs = minArgs;
        this.maxArgs = maxArgs;
    }

    static BuiltinFunction lookup(String name) {
        try {
            return valueOf(name.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    void checkArity(int count) {
        if (count < minArgs || (maxArgs >= 0 && count > maxArgs)) {
            throw Values.mismatch(name() + " does not take " + count + " argument(s)");
        }
    }

    /**
     * Evaluates every argument, then applies the function.
     */
    Object call(List<ExprNode> args, EvaluationScope scope) {
        List<Object> values = new ArrayList<>(args.size());
        for (ExprNode arg : args) {
            values.add(arg.evaluate(scope));
        }
        return apply(values);
    }

    abstract Object apply(List<Object> args);

    private static Object scalar(Object value) {
        if (value instanceof RangeValue) {
            throw Values.mismatch("A range cannot be used as a single value");
        }
        return value;
    }

    private static List<Double> numbers(List<Object> args) {
        List<Double> numbers = new ArrayList<>();
        for (Object arg : args) {
            if (arg instanceof RangeValue) {
                for (Object value : ((RangeValue) arg).getValues()) {
                    if (value instanceof Number) {
                        numbers.add(((Number) value).doubleValue());
                    }
                }
            } else {
                numbers.add(Values.toNumber(arg));
            }
        }
        return numbers;
    }

    private static List<Boolean> logicals(List<Object> args) {
        List<Boolean> logicals = new ArrayList<>();
        for (Object arg : args) {
            if (arg instanceof RangeValue) {
                for (Object value : ((RangeValue) arg).getValues()) {
                    if (value instanceof Boolean || value instanceof Number) {
                        logicals.add(Values.toBoolean(value));
                    }
                }
            } else {
                logicals.add(Values.toBoolean(arg));
            }
        }
        if (logicals.isEmpty()) {
            throw Values.mismatch("No logical values to combine");
        }
        return logicals;
    }
}
