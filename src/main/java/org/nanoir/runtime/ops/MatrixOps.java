package org.nanoir.runtime.ops;

import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.runtime.Values;

import java.util.List;

/**
 * 3x3 and 4x4 matrices stored column-major: element (row r, column c) lives at
 * {@code c * dim + r}.
 */
final class MatrixOps {

    private static final double SINGULAR_EPSILON = 1e-12;

    private MatrixOps() {
    }

    static void register() {
        OpRegistry.register(BuiltinOp.FLOAT3X3, (ctx, a) -> construct(a, 3));
        OpRegistry.register(BuiltinOp.FLOAT4X4, (ctx, a) -> construct(a, 4));
        OpRegistry.register(BuiltinOp.MAT_IDENTITY, (ctx, a) -> {
            int size = a.getInt("size");
            if (size != 3 && size != 4) {
                throw a.error("identity size must be 3 or 4, got " + size);
            }
            return identity(size);
        });
        OpRegistry.register(BuiltinOp.MAT_MUL, (ctx, a) -> multiply(a, a.getVector("a"), a.getVector("b")));
        OpRegistry.register(BuiltinOp.MAT_TRANSPOSE, (ctx, a) -> {
            double[] m = a.getVector("val");
            int dim = dimension(a, m);
            double[] out = new double[m.length];
            for (int c = 0; c < dim; c++) {
                for (int r = 0; r < dim; r++) {
                    out[r * dim + c] = m[c * dim + r];
                }
            }
            return out;
        });
        OpRegistry.register(BuiltinOp.MAT_INVERSE, (ctx, a) -> invert(a, a.getVector("val")));
        OpRegistry.register(BuiltinOp.MAT_EXTRACT, (ctx, a) -> {
            double[] m = a.getVector("mat");
            int dim = dimension(a, m);
            int col = a.getInt("col");
            int row = a.getInt("row");
            if (col < 0 || col >= dim || row < 0 || row >= dim) {
                throw a.error("element (" + row + ", " + col + ") out of bounds for a " + dim + "x" + dim + " matrix");
            }
            return m[col * dim + row];
        });
    }

    private static double[] construct(OpArguments args, int dim) {
        int count = dim * dim;
        if (args.has("vals")) {
            double[] vals = args.getVector("vals");
            if (vals.length != count) {
                throw args.error("expected " + count + " values, got " + vals.length);
            }
            return vals.clone();
        }
        if (args.has("cols")) {
            List<?> cols = columns(args, args.require("cols"), dim);
            double[] out = new double[count];
            for (int c = 0; c < dim; c++) {
                double[] column = Values.toVector(cols.get(c), "column " + c + " of " + args.nodeId());
                if (column.length != dim) {
                    throw args.error("column " + c + " has " + column.length + " components, expected " + dim);
                }
                System.arraycopy(column, 0, out, c * dim, dim);
            }
            return out;
        }
        double[] out = new double[count];
        for (int r = 0; r < dim; r++) {
            for (int c = 0; c < dim; c++) {
                out[c * dim + r] = args.getDouble("m" + r + c, 0.0);
            }
        }
        return out;
    }

    private static List<?> columns(OpArguments args, Object cols, int dim) {
        if (!(cols instanceof List<?> list) || list.size() != dim) {
            throw args.error("'cols' must be a list of " + dim + " column vectors");
        }
        return list;
    }

    static double[] identity(int dim) {
        double[] out = new double[dim * dim];
        for (int i = 0; i < dim; i++) out[i * dim + i] = 1.0;
        return out;
    }

    private static int dimension(OpArguments args, double[] m) {
        if (m.length == 16) return 4;
        if (m.length == 9) return 3;
        throw args.error("expected a 3x3 or 4x4 matrix, got " + m.length + " elements");
    }

    private static double[] multiply(OpArguments args, double[] a, double[] b) {
        int dim = dimension(args, a);
        if (b.length == a.length) {
            double[] out = new double[a.length];
            for (int r = 0; r < dim; r++) {
                for (int c = 0; c < dim; c++) {
                    double sum = 0.0;
                    for (int k = 0; k < dim; k++) sum += a[k * dim + r] * b[c * dim + k];
                    out[c * dim + r] = sum;
                }
            }
            return out;
        }
        if (b.length == dim) {
            double[] out = new double[dim];
            for (int r = 0; r < dim; r++) {
                double sum = 0.0;
                for (int c = 0; c < dim; c++) sum += a[c * dim + r] * b[c];
                out[r] = sum;
            }
            return out;
        }
        throw args.error("cannot multiply a " + dim + "x" + dim + " matrix by a value of " + b.length + " elements");
    }

    /** Gauss-Jordan elimination with partial pivoting. */
    private static double[] invert(OpArguments args, double[] m) {
        int dim = dimension(args, m);
        double[][] aug = new double[dim][2 * dim];
        for (int r = 0; r < dim; r++) {
            for (int c = 0; c < dim; c++) aug[r][c] = m[c * dim + r];
            aug[r][dim + r] = 1.0;
        }
        for (int col = 0; col < dim; col++) {
            int pivot = col;
            for (int r = col + 1; r < dim; r++) {
                if (Math.abs(aug[r][col]) > Math.abs(aug[pivot][col])) pivot = r;
            }
            if (Math.abs(aug[pivot][col]) < SINGULAR_EPSILON) {
                throw args.error("matrix is singular");
            }
            double[] tmp = aug[col];
            aug[col] = aug[pivot];
            aug[pivot] = tmp;
            double p = aug[col][col];
            for (int c = 0; c < 2 * dim; c++) aug[col][c] /= p;
            for (int r = 0; r < dim; r++) {
                if (r == col) continue;
                double f = aug[r][col];
                if (f == 0.0) continue;
                for (int c = 0; c < 2 * dim; c++) aug[r][c] -= f * aug[col][c];
            }
        }
        double[] out = new double[dim * dim];
        for (int r = 0; r < dim; r++) {
            for (int c = 0; c < dim; c++) out[c * dim + r] = aug[r][dim + c];
        }
        return out;
    }
}
