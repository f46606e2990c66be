package org.nanoir.runtime.ops;

import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.runtime.Values;

import java.util.function.DoubleBinaryOperator;
import java.util.function.DoublePredicate;
import java.util.function.DoubleUnaryOperator;

import static org.nanoir.ir.schema.BuiltinOp.*;

/**
 * Scalar and element-wise vector math.
 * <p>
 * Binary operations accept two scalars, two vectors of equal length, or a vector and a
 * scalar (broadcast). Comparisons yield a boolean for scalars and a vector of
 * {@code 0.0}/{@code 1.0} for vectors.
 */
final class MathOps {

    /** Smallest positive normal 32-bit float. */
    private static final double FLOAT32_MIN_NORMAL = 1.17549435e-38;

    private MathOps() {
    }

    static void register() {
        OpRegistry.register(MATH_ADD, (ctx, a) -> binary(a, "a", "b", Double::sum));
        OpRegistry.register(MATH_SUB, (ctx, a) -> binary(a, "a", "b", (x, y) -> x - y));
        OpRegistry.register(MATH_MUL, (ctx, a) -> binary(a, "a", "b", (x, y) -> x * y));
        OpRegistry.register(MATH_DIV, (ctx, a) -> binary(a, "a", "b", (x, y) -> x / y));
        OpRegistry.register(MATH_MOD, (ctx, a) -> binary(a, "a", "b", (x, y) -> x % y));
        OpRegistry.register(MATH_POW, (ctx, a) -> binary(a, "a", "b", Math::pow));
        OpRegistry.register(MATH_MIN, (ctx, a) -> binary(a, "a", "b", Math::min));
        OpRegistry.register(MATH_MAX, (ctx, a) -> binary(a, "a", "b", Math::max));
        OpRegistry.register(MATH_ATAN2, (ctx, a) -> binary(a, "a", "b", Math::atan2));
        OpRegistry.register(MATH_LDEXP, (ctx, a) -> binary(a, "val", "exp", (x, e) -> x * Math.pow(2, e)));
        OpRegistry.register(MATH_DIV_SCALAR, (ctx, a) -> {
            double divisor = a.getDouble("scalar");
            return unary(a, a.require("val"), x -> x / divisor);
        });

        OpRegistry.register(MATH_GT, (ctx, a) -> compare(a, (x, y) -> x > y));
        OpRegistry.register(MATH_LT, (ctx, a) -> compare(a, (x, y) -> x < y));
        OpRegistry.register(MATH_GE, (ctx, a) -> compare(a, (x, y) -> x >= y));
        OpRegistry.register(MATH_LE, (ctx, a) -> compare(a, (x, y) -> x <= y));
        OpRegistry.register(MATH_EQ, (ctx, a) -> compare(a, (x, y) -> x == y));
        OpRegistry.register(MATH_NEQ, (ctx, a) -> compare(a, (x, y) -> x != y));

        OpRegistry.register(MATH_AND, (ctx, a) -> Values.truthy(a.require("a")) && Values.truthy(a.require("b")));
        OpRegistry.register(MATH_OR, (ctx, a) -> Values.truthy(a.require("a")) || Values.truthy(a.require("b")));
        OpRegistry.register(MATH_XOR, (ctx, a) -> Values.truthy(a.require("a")) != Values.truthy(a.require("b")));
        OpRegistry.register(MATH_NOT, (ctx, a) -> {
            Object val = a.require("val");
            if (val instanceof double[]) {
                return unary(a, val, x -> x == 0.0 ? 1.0 : 0.0);
            }
            return !Values.truthy(val);
        });

        registerUnary(MATH_ABS, Math::abs);
        registerUnary(MATH_CEIL, Math::ceil);
        registerUnary(MATH_FLOOR, Math::floor);
        registerUnary(MATH_SQRT, Math::sqrt);
        registerUnary(MATH_EXP, Math::exp);
        registerUnary(MATH_LOG, Math::log);
        registerUnary(MATH_SIN, Math::sin);
        registerUnary(MATH_COS, Math::cos);
        registerUnary(MATH_TAN, Math::tan);
        registerUnary(MATH_ASIN, Math::asin);
        registerUnary(MATH_ACOS, Math::acos);
        registerUnary(MATH_ATAN, Math::atan);
        registerUnary(MATH_SINH, Math::sinh);
        registerUnary(MATH_COSH, Math::cosh);
        registerUnary(MATH_TANH, Math::tanh);
        registerUnary(MATH_ASINH, MathOps::asinh);
        registerUnary(MATH_ACOSH, x -> Math.log(x + Math.sqrt(x * x - 1.0)));
        registerUnary(MATH_ATANH, x -> 0.5 * Math.log((1.0 + x) / (1.0 - x)));
        registerUnary(MATH_SIGN, Math::signum);
        registerUnary(MATH_FRACT, x -> x - Math.floor(x));
        registerUnary(MATH_TRUNC, MathOps::trunc);
        registerUnary(MATH_ROUND, x -> Math.floor(x + 0.5));
        registerUnary(MATH_FLUSH_SUBNORMAL, x -> Math.abs(x) < FLOAT32_MIN_NORMAL ? 0.0 : x);
        OpRegistry.registerFamily((ctx, a) -> unary(a, a.require("val"), MathOps::frexpMantissa),
                MATH_MANTISSA, MATH_FREXP_MANTISSA);
        OpRegistry.registerFamily((ctx, a) -> unary(a, a.require("val"), MathOps::frexpExponent),
                MATH_EXPONENT, MATH_FREXP_EXPONENT);

        OpRegistry.register(MATH_IS_NAN, (ctx, a) -> test(a, a.require("val"), Double::isNaN));
        OpRegistry.register(MATH_IS_INF, (ctx, a) -> test(a, a.require("val"), Double::isInfinite));
        OpRegistry.register(MATH_IS_FINITE, (ctx, a) -> test(a, a.require("val"), Double::isFinite));

        OpRegistry.register(MATH_MAD, (ctx, a) -> {
            Object product = combine(a, a.require("a"), a.require("b"), (x, y) -> x * y);
            return combine(a, product, a.require("c"), Double::sum);
        });
        OpRegistry.register(MATH_CLAMP, (ctx, a) -> {
            Object lower = combine(a, a.require("val"), a.require("min"), Math::max);
            return combine(a, lower, a.require("max"), Math::min);
        });
        OpRegistry.register(MATH_STEP, (ctx, a) -> binary(a, "edge", "x", (edge, x) -> x < edge ? 0.0 : 1.0));
        OpRegistry.register(MATH_SMOOTHSTEP, (ctx, a) -> {
            Object span = combine(a, a.require("edge1"), a.require("edge0"), (x, y) -> x - y);
            Object offset = combine(a, a.require("x"), a.require("edge0"), (x, y) -> x - y);
            Object t = unary(a, combine(a, offset, span, (x, y) -> x / y), v -> Math.max(0.0, Math.min(1.0, v)));
            return unary(a, t, v -> v * v * (3.0 - 2.0 * v));
        });
        OpRegistry.register(MATH_MIX, (ctx, a) -> mix(a, a.require("a"), a.require("b"), a.require("t")));

        OpRegistry.register(MATH_PI, (ctx, a) -> Math.PI);
        OpRegistry.register(MATH_E, (ctx, a) -> Math.E);
    }

    private static void registerUnary(BuiltinOp op, DoubleUnaryOperator fn) {
        OpRegistry.register(op, (ctx, a) -> unary(a, a.require("val"), fn));
    }

    private static Object binary(OpArguments args, String left, String right, DoubleBinaryOperator fn) {
        return combine(args, args.require(left), args.require(right), fn);
    }

    /**
     * Applies a binary function to scalars, equal-length vectors, or a vector and a scalar.
     *
     * @param args The invocation, for error reporting.
     * @param a    Left operand.
     * @param b    Right operand.
     * @param fn   The scalar function.
     * @return A {@code Double} or a {@code double[]}.
     */
    static Object combine(OpArguments args, Object a, Object b, DoubleBinaryOperator fn) {
        if (a instanceof double[] va && b instanceof double[] vb) {
            checkLength(args, va, vb);
            double[] out = new double[va.length];
            for (int i = 0; i < va.length; i++) out[i] = fn.applyAsDouble(va[i], vb[i]);
            return out;
        }
        if (a instanceof double[] va) {
            double y = Values.toDouble(b, "right operand of " + args.nodeId());
            double[] out = new double[va.length];
            for (int i = 0; i < va.length; i++) out[i] = fn.applyAsDouble(va[i], y);
            return out;
        }
        if (b instanceof double[] vb) {
            double x = Values.toDouble(a, "left operand of " + args.nodeId());
            double[] out = new double[vb.length];
            for (int i = 0; i < vb.length; i++) out[i] = fn.applyAsDouble(x, vb[i]);
            return out;
        }
        return fn.applyAsDouble(Values.toDouble(a, "left operand of " + args.nodeId()),
                Values.toDouble(b, "right operand of " + args.nodeId()));
    }

    static Object unary(OpArguments args, Object val, DoubleUnaryOperator fn) {
        if (val instanceof double[] v) {
            double[] out = new double[v.length];
            for (int i = 0; i < v.length; i++) out[i] = fn.applyAsDouble(v[i]);
            return out;
        }
        return fn.applyAsDouble(Values.toDouble(val, "operand of " + args.nodeId()));
    }

    static Object mix(OpArguments args, Object a, Object b, Object t) {
        Object inverse = unary(args, t, v -> 1.0 - v);
        return combine(args, combine(args, a, inverse, (x, y) -> x * y), combine(args, b, t, (x, y) -> x * y), Double::sum);
    }

    private static Object compare(OpArguments args, DoubleComparison predicate) {
        Object a = args.require("a");
        Object b = args.require("b");
        if (a instanceof double[] || b instanceof double[]) {
            return combine(args, a, b, (x, y) -> predicate.test(x, y) ? 1.0 : 0.0);
        }
        return predicate.test(Values.toDouble(a, "left operand of " + args.nodeId()),
                Values.toDouble(b, "right operand of " + args.nodeId()));
    }

    private static Object test(OpArguments args, Object val, DoublePredicate predicate) {
        if (val instanceof double[] v) {
            double[] out = new double[v.length];
            for (int i = 0; i < v.length; i++) out[i] = predicate.test(v[i]) ? 1.0 : 0.0;
            return out;
        }
        return predicate.test(Values.toDouble(val, "operand of " + args.nodeId()));
    }

    private static void checkLength(OpArguments args, double[] a, double[] b) {
        if (a.length != b.length) {
            throw args.error("vector length mismatch (" + a.length + " vs " + b.length + ")");
        }
    }

    private static double asinh(double x) {
        double ax = Math.abs(x);
        return Math.copySign(Math.log(ax + Math.sqrt(ax * ax + 1.0)), x);
    }

    private static double trunc(double x) {
        return x < 0 ? Math.ceil(x) : Math.floor(x);
    }

    private static double frexpExponent(double x) {
        if (x == 0.0 || !Double.isFinite(x)) return 0.0;
        double ax = Math.abs(x);
        if (ax < Double.MIN_NORMAL) {
            return Math.getExponent(ax * 0x1p54) - 54 + 1;
        }
        return Math.getExponent(ax) + 1;
    }

    private static double frexpMantissa(double x) {
        if (x == 0.0 || !Double.isFinite(x)) return x == 0.0 ? 0.0 : x;
        return Math.scalb(x, -(int) frexpExponent(x));
    }

    @FunctionalInterface
    private interface DoubleComparison {
        boolean test(double a, double b);
    }
}
