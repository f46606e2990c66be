package org.nanoir.runtime.ops;

import org.nanoir.ir.SamplerDef;
import org.nanoir.runtime.InterpreterException;
import org.nanoir.runtime.ResourceState;
import org.nanoir.runtime.Values;

/**
 * Samples a texture with its declared filter and wrap modes.
 * <p>
 * Nearest filtering wraps the normalized coordinate and indexes the texel under it.
 * Linear filtering uses the half-texel convention {@code coord * size - 0.5} and resolves
 * each of the four neighbours through the wrap mode per axis. Results always have four
 * channels.
 */
final class TextureSampler {

    private TextureSampler() {
    }

    static double[] sample(ResourceState texture, double u, double v) {
        int width = texture.getWidth();
        int height = texture.getHeight();
        if (width <= 0 || height <= 0) {
            throw new InterpreterException("Cannot sample empty texture '" + texture.getId() + "'");
        }
        SamplerDef sampler = texture.getDef().sampler();
        String filter = sampler == null ? SamplerDef.FILTER_NEAREST : sampler.filterOrDefault();
        String wrap = sampler == null ? SamplerDef.WRAP_CLAMP : sampler.wrapOrDefault();

        if (SamplerDef.FILTER_LINEAR.equals(filter)) {
            double x = u * width - 0.5;
            double y = v * height - 0.5;
            int x0 = (int) Math.floor(x);
            int y0 = (int) Math.floor(y);
            double fx = x - x0;
            double fy = y - y0;
            int xa = wrapIndex(x0, width, wrap);
            int xb = wrapIndex(x0 + 1, width, wrap);
            int ya = wrapIndex(y0, height, wrap);
            int yb = wrapIndex(y0 + 1, height, wrap);
            double[] t00 = texel(texture, xa, ya);
            double[] t10 = texel(texture, xb, ya);
            double[] t01 = texel(texture, xa, yb);
            double[] t11 = texel(texture, xb, yb);
            double[] out = new double[4];
            for (int c = 0; c < 4; c++) {
                double top = t00[c] * (1.0 - fx) + t10[c] * fx;
                double bottom = t01[c] * (1.0 - fx) + t11[c] * fx;
                out[c] = top * (1.0 - fy) + bottom * fy;
            }
            return out;
        }

        double wu = wrapCoord(u, wrap);
        double wv = wrapCoord(v, wrap);
        int x = Math.max(0, Math.min((int) Math.floor(wu * width), width - 1));
        int y = Math.max(0, Math.min((int) Math.floor(wv * height), height - 1));
        return texel(texture, x, y);
    }

    static double[] texel(ResourceState texture, int x, int y) {
        return Values.toTexel(texture.getTexel(x, y));
    }

    static double wrapCoord(double coord, String wrap) {
        switch (wrap) {
            case SamplerDef.WRAP_REPEAT:
                return coord - Math.floor(coord);
            case SamplerDef.WRAP_MIRROR: {
                double m = coord % 2.0;
                if (m < 0) m += 2.0;
                return m > 1.0 ? 2.0 - m : m;
            }
            default:
                return Math.max(0.0, Math.min(1.0, coord));
        }
    }

    static int wrapIndex(int index, int size, String wrap) {
        switch (wrap) {
            case SamplerDef.WRAP_REPEAT:
                return Math.floorMod(index, size);
            case SamplerDef.WRAP_MIRROR: {
                int m = Math.floorMod(index, 2 * size);
                return m < size ? m : 2 * size - 1 - m;
            }
            default:
                return Math.max(0, Math.min(size - 1, index));
        }
    }
}
