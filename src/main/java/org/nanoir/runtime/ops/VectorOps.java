package org.nanoir.runtime.ops;

import org.nanoir.runtime.Values;

import static org.nanoir.ir.schema.BuiltinOp.COLOR_MIX;
import static org.nanoir.ir.schema.BuiltinOp.VEC_DOT;
import static org.nanoir.ir.schema.BuiltinOp.VEC_GET_ELEMENT;
import static org.nanoir.ir.schema.BuiltinOp.VEC_LENGTH;
import static org.nanoir.ir.schema.BuiltinOp.VEC_MIX;
import static org.nanoir.ir.schema.BuiltinOp.VEC_NORMALIZE;
import static org.nanoir.ir.schema.BuiltinOp.VEC_SWIZZLE;

/**
 * Vector geometry, swizzling and color compositing.
 */
final class VectorOps {

    /** Below this composite alpha, source-over yields transparent black. */
    static final double ALPHA_EPSILON = 1e-6;

    private static final double NORMALIZE_EPSILON = 1e-10;
    private static final String SWIZZLE_COMPONENTS = "xyzw";
    private static final String COLOR_COMPONENTS = "rgba";

    private VectorOps() {
    }

    static void register() {
        OpRegistry.register(VEC_DOT, (ctx, a) -> dot(a, a.getVector("a"), a.getVector("b")));
        OpRegistry.register(VEC_LENGTH, (ctx, a) -> {
            double[] v = a.getVector("a");
            return Math.sqrt(dot(a, v, v));
        });
        OpRegistry.register(VEC_NORMALIZE, (ctx, a) -> {
            double[] v = a.getVector("a");
            double len = Math.sqrt(dot(a, v, v));
            double[] out = new double[v.length];
            if (len < NORMALIZE_EPSILON) return out;
            for (int i = 0; i < v.length; i++) out[i] = v[i] / len;
            return out;
        });
        OpRegistry.register(VEC_SWIZZLE, (ctx, a) -> swizzle(a, a.getVector("vec"), a.getString("channels")));
        OpRegistry.register(VEC_MIX, (ctx, a) -> {
            Object t = a.require("t");
            if (t instanceof Boolean select) {
                return Values.copy(select ? a.require("b") : a.require("a"));
            }
            return MathOps.mix(a, a.require("a"), a.require("b"), t);
        });
        OpRegistry.register(VEC_GET_ELEMENT, (ctx, a) -> {
            double[] v = a.getVector("vec");
            int index = a.getInt("index");
            if (index < 0 || index >= v.length) {
                throw a.error("index " + index + " out of bounds for vector of length " + v.length);
            }
            return v[index];
        });
        OpRegistry.register(COLOR_MIX, (ctx, a) -> sourceOver(a.getVector("a"), a.getVector("b")));
    }

    private static double dot(OpArguments args, double[] a, double[] b) {
        if (a.length != b.length) {
            throw args.error("vector length mismatch (" + a.length + " vs " + b.length + ")");
        }
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) sum += a[i] * b[i];
        return sum;
    }

    private static Object swizzle(OpArguments args, double[] vec, String channels) {
        if (channels.isEmpty() || channels.length() > 4) {
            throw args.error("invalid swizzle mask '" + channels + "'");
        }
        double[] out = new double[channels.length()];
        for (int i = 0; i < channels.length(); i++) {
            char c = channels.charAt(i);
            int idx = SWIZZLE_COMPONENTS.indexOf(c);
            if (idx < 0) idx = COLOR_COMPONENTS.indexOf(c);
            if (idx < 0) {
                throw args.error("invalid swizzle component '" + c + "'");
            }
            if (idx >= vec.length) {
                throw args.error("swizzle component '" + c + "' out of bounds for vector of length " + vec.length);
            }
            out[i] = vec[idx];
        }
        return out.length == 1 ? (Object) out[0] : out;
    }

    /**
     * Porter-Duff source-over of {@code src} onto {@code dst} with straight alpha.
     * Missing alpha channels count as opaque.
     *
     * @param dst The background color.
     * @param src The foreground color.
     * @return The composite RGBA color; transparent black when the result has no coverage.
     */
    static double[] sourceOver(double[] dst, double[] src) {
        double srcA = src.length > 3 ? src[3] : 1.0;
        double dstA = dst.length > 3 ? dst[3] : 1.0;
        double outA = srcA + dstA * (1.0 - srcA);
        if (outA < ALPHA_EPSILON) {
            return new double[4];
        }
        double[] out = new double[4];
        for (int c = 0; c < 3; c++) {
            double s = c < src.length ? src[c] : 0.0;
            double d = c < dst.length ? dst[c] : 0.0;
            out[c] = (s * srcA + d * dstA * (1.0 - srcA)) / outA;
        }
        out[3] = outA;
        return out;
    }
}
