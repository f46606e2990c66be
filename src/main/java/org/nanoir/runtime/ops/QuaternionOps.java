package org.nanoir.runtime.ops;

import static org.nanoir.ir.schema.BuiltinOp.QUAT;
import static org.nanoir.ir.schema.BuiltinOp.QUAT_IDENTITY;
import static org.nanoir.ir.schema.BuiltinOp.QUAT_MUL;
import static org.nanoir.ir.schema.BuiltinOp.QUAT_ROTATE;
import static org.nanoir.ir.schema.BuiltinOp.QUAT_SLERP;
import static org.nanoir.ir.schema.BuiltinOp.QUAT_TO_FLOAT4X4;

/**
 * Quaternions as {@code [x, y, z, w]} vectors.
 */
final class QuaternionOps {

    private static final double SLERP_LINEAR_THRESHOLD = 0.9995;

    private QuaternionOps() {
    }

    static void register() {
        OpRegistry.register(QUAT, (ctx, a) -> {
            if (a.has("axis")) {
                return fromAxisAngle(a, a.getVector("axis"), a.getDouble("angle", 0.0));
            }
            return new double[]{a.getDouble("x", 0.0), a.getDouble("y", 0.0), a.getDouble("z", 0.0), a.getDouble("w", 1.0)};
        });
        OpRegistry.register(QUAT_IDENTITY, (ctx, a) -> new double[]{0.0, 0.0, 0.0, 1.0});
        OpRegistry.register(QUAT_MUL, (ctx, a) -> multiply(quat(a, "a"), quat(a, "b")));
        OpRegistry.register(QUAT_SLERP, (ctx, a) -> slerp(quat(a, "a"), quat(a, "b"), a.getDouble("t")));
        OpRegistry.register(QUAT_TO_FLOAT4X4, (ctx, a) -> toMatrix(quat(a, "q")));
        OpRegistry.register(QUAT_ROTATE, (ctx, a) -> {
            double[] v = a.getVector("v");
            if (v.length != 3) {
                throw a.error("quat_rotate expects a 3-component vector, got " + v.length);
            }
            return rotate(quat(a, "q"), v);
        });
    }

    private static double[] quat(OpArguments args, String key) {
        double[] q = args.getVector(key);
        if (q.length != 4) {
            throw args.error("'" + key + "' must be a quaternion [x, y, z, w], got " + q.length + " components");
        }
        return q;
    }

    private static double[] fromAxisAngle(OpArguments args, double[] axis, double angle) {
        if (axis.length != 3) {
            throw args.error("axis must have 3 components, got " + axis.length);
        }
        double len = Math.sqrt(axis[0] * axis[0] + axis[1] * axis[1] + axis[2] * axis[2]);
        if (len == 0.0) {
            return new double[]{0.0, 0.0, 0.0, 1.0};
        }
        double s = Math.sin(angle / 2.0) / len;
        return new double[]{axis[0] * s, axis[1] * s, axis[2] * s, Math.cos(angle / 2.0)};
    }

    static double[] multiply(double[] a, double[] b) {
        return new double[]{
                a[3] * b[0] + a[0] * b[3] + a[1] * b[2] - a[2] * b[1],
                a[3] * b[1] - a[0] * b[2] + a[1] * b[3] + a[2] * b[0],
                a[3] * b[2] + a[0] * b[1] - a[1] * b[0] + a[2] * b[3],
                a[3] * b[3] - a[0] * b[0] - a[1] * b[1] - a[2] * b[2]};
    }

    static double[] slerp(double[] a, double[] b, double t) {
        double[] end = b.clone();
        double cos = a[0] * b[0] + a[1] * b[1] + a[2] * b[2] + a[3] * b[3];
        if (cos < 0.0) {
            cos = -cos;
            for (int i = 0; i < 4; i++) end[i] = -end[i];
        }
        double[] out = new double[4];
        if (cos > SLERP_LINEAR_THRESHOLD) {
            for (int i = 0; i < 4; i++) out[i] = a[i] + t * (end[i] - a[i]);
            return normalize(out);
        }
        double theta = Math.acos(cos);
        double sin = Math.sin(theta);
        double wa = Math.sin((1.0 - t) * theta) / sin;
        double wb = Math.sin(t * theta) / sin;
        for (int i = 0; i < 4; i++) out[i] = wa * a[i] + wb * end[i];
        return out;
    }

    private static double[] normalize(double[] q) {
        double len = Math.sqrt(q[0] * q[0] + q[1] * q[1] + q[2] * q[2] + q[3] * q[3]);
        if (len == 0.0) return q;
        for (int i = 0; i < 4; i++) q[i] /= len;
        return q;
    }

    static double[] toMatrix(double[] q) {
        double x = q[0], y = q[1], z = q[2], w = q[3];
        double[] m = new double[16];
        // column 0
        m[0] = 1 - 2 * (y * y + z * z);
        m[1] = 2 * (x * y + z * w);
        m[2] = 2 * (x * z - y * w);
        // column 1
        m[4] = 2 * (x * y - z * w);
        m[5] = 1 - 2 * (x * x + z * z);
        m[6] = 2 * (y * z + x * w);
        // column 2
        m[8] = 2 * (x * z + y * w);
        m[9] = 2 * (y * z - x * w);
        m[10] = 1 - 2 * (x * x + y * y);
        m[15] = 1.0;
        return m;
    }

    static double[] rotate(double[] q, double[] v) {
        double tx = 2 * (q[1] * v[2] - q[2] * v[1]);
        double ty = 2 * (q[2] * v[0] - q[0] * v[2]);
        double tz = 2 * (q[0] * v[1] - q[1] * v[0]);
        return new double[]{
                v[0] + q[3] * tx + (q[1] * tz - q[2] * ty),
                v[1] + q[3] * ty + (q[2] * tx - q[0] * tz),
                v[2] + q[3] * tz + (q[0] * ty - q[1] * tx)};
    }
}
