package org.nanoir.runtime;

import org.nanoir.ir.Builtin;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.PortDef;
import org.nanoir.ir.ResourceType;
import org.nanoir.ir.StructDef;
import org.nanoir.ir.StructMember;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A CPU rasterizer for {@code cmd_draw}: runs the vertex stage once per vertex, maps clip
 * space positions to the target, covers each triangle at pixel centres with edge functions
 * and runs the fragment stage for every covered pixel.
 * <p>
 * Both windings are accepted. Varyings are interpolated with screen-space barycentrics;
 * values that are neither numbers nor vectors are taken from the first vertex.
 */
public final class SoftwareRasterizer {

    /**
     * Runs one shader invocation with the current stage builtins.
     */
    @FunctionalInterface
    public interface ShaderInvoker {
        Object invoke(FunctionDef function, Map<String, Object> inputs);
    }

    private static final String TRIANGLE_LIST = "triangle-list";
    private static final double DEGENERATE_AREA = 1e-6;

    private final EvaluationContext context;
    private final ShaderInvoker invoker;

    public SoftwareRasterizer(EvaluationContext context, ShaderInvoker invoker) {
        this.context = context;
        this.invoker = invoker;
    }

    /**
     * Draws {@code count / 3} triangles into a texture.
     *
     * @param targetId The target texture.
     * @param vertex   The vertex shader; must return a struct with a clip-space position.
     * @param fragment The fragment shader; its result is the pixel color.
     * @param count    The vertex count.
     * @param pipeline Optional pipeline state ({@code topology}, {@code blend}); may be empty.
     */
    public void draw(String targetId, FunctionDef vertex, FunctionDef fragment, int count, Map<?, ?> pipeline) {
        ResourceState target = context.getResource(targetId);
        if (target.getType() != ResourceType.TEXTURE2D) {
            throw new InterpreterException("Draw target '" + targetId + "' is not a texture");
        }
        Object topology = pipeline.get("topology");
        if (topology != null && !TRIANGLE_LIST.equals(topology)) {
            throw new InterpreterException("Unsupported primitive topology '" + topology + "'");
        }
        if (count < 0) {
            throw new InterpreterException("Negative vertex count " + count + " for draw into '" + targetId + "'");
        }
        Map<?, ?> blend = pipeline.get("blend") instanceof Map<?, ?> m ? m : null;
        String positionKey = positionMember(vertex, fragment).orElse(null);

        try {
            List<Map<String, Object>> vertices = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                context.setBuiltin(Builtin.VERTEX_INDEX.wireName(), (double) i);
                context.setBuiltin(Builtin.INSTANCE_INDEX.wireName(), 0.0);
                Object out = invoker.invoke(vertex, Map.of());
                if (!(out instanceof Map<?, ?> map)) {
                    throw new InterpreterException("Vertex shader '" + vertex.id() + "' must return a struct, but returned "
                            + Values.describe(out));
                }
                Map<String, Object> varyings = new LinkedHashMap<>();
                map.forEach((k, v) -> varyings.put(String.valueOf(k), Values.normalize(v)));
                vertices.add(varyings);
            }
            context.clearStageBuiltins();

            for (int t = 0; t + 2 < count; t += 3) {
                rasterize(target, fragment, vertices.get(t), vertices.get(t + 1), vertices.get(t + 2), positionKey, blend);
            }
        } finally {
            context.clearStageBuiltins();
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("vertex", vertex.id());
        payload.put("fragment", fragment.id());
        payload.put("count", count);
        context.logAction(ActionLogEntry.ActionType.DRAW, targetId, payload);
    }

    /** The struct member carrying the {@code position} builtin, if the stage types declare one. */
    private Optional<String> positionMember(FunctionDef vertex, FunctionDef fragment) {
        List<String> candidates = new ArrayList<>();
        if (!fragment.inputs().isEmpty()) candidates.add(fragment.inputs().get(0).type());
        if (!vertex.outputs().isEmpty()) candidates.add(vertex.outputs().get(0).type());
        for (String type : candidates) {
            Optional<String> member = context.getDocument().findStruct(type)
                    .map(StructDef::members)
                    .flatMap(members -> members.stream()
                            .filter(m -> Builtin.POSITION.wireName().equals(m.builtin()))
                            .map(StructMember::name)
                            .findFirst());
            if (member.isPresent()) return member;
        }
        return Optional.empty();
    }

    private static String positionKey(String declared, Map<String, Object> vertex) {
        if (declared != null && vertex.containsKey(declared)) return declared;
        if (vertex.containsKey("position")) return "position";
        if (vertex.containsKey("pos")) return "pos";
        throw new InterpreterException("Vertex output has no position member");
    }

    private void rasterize(ResourceState target, FunctionDef fragment,
                           Map<String, Object> v0, Map<String, Object> v1, Map<String, Object> v2,
                           String declaredPosition, Map<?, ?> blend) {
        String key = positionKey(declaredPosition, v0);
        int width = target.getWidth();
        int height = target.getHeight();
        double[] s0 = toScreen(v0.get(key), width, height);
        double[] s1 = toScreen(v1.get(key), width, height);
        double[] s2 = toScreen(v2.get(key), width, height);

        double area = edge(s0, s1, s2[0], s2[1]);
        if (Math.abs(area) < DEGENERATE_AREA) return;

        int minX = Math.max(0, (int) Math.floor(Math.min(s0[0], Math.min(s1[0], s2[0]))));
        int maxX = Math.min(width - 1, (int) Math.ceil(Math.max(s0[0], Math.max(s1[0], s2[0]))));
        int minY = Math.max(0, (int) Math.floor(Math.min(s0[1], Math.min(s1[1], s2[1]))));
        int maxY = Math.min(height - 1, (int) Math.ceil(Math.max(s0[1], Math.max(s1[1], s2[1]))));

        for (int py = minY; py <= maxY; py++) {
            for (int px = minX; px <= maxX; px++) {
                double cx = px + 0.5;
                double cy = py + 0.5;
                double w = edge(s0, s1, cx, cy);
                double u = edge(s1, s2, cx, cy);
                double v = edge(s2, s0, cx, cy);
                boolean inside = (w >= 0 && u >= 0 && v >= 0) || (w <= 0 && u <= 0 && v <= 0);
                if (!inside) continue;

                double b0 = u / area;
                double b1 = v / area;
                double b2 = w / area;
                double depth = b0 * s0[2] + b1 * s1[2] + b2 * s2[2];
                double[] fragCoord = {cx, cy, depth, 1.0};

                Map<String, Object> varyings = new LinkedHashMap<>();
                for (Map.Entry<String, Object> entry : v0.entrySet()) {
                    String name = entry.getKey();
                    varyings.put(name, name.equals(key)
                            ? fragCoord.clone()
                            : interpolate(entry.getValue(), v1.get(name), v2.get(name), b0, b1, b2));
                }
                context.setBuiltin(Builtin.FRAG_COORD.wireName(), fragCoord);
                context.setBuiltin(Builtin.POSITION.wireName(), fragCoord.clone());
                context.setBuiltin(Builtin.FRONT_FACING.wireName(), area > 0);

                Object out = invoker.invoke(fragment, fragmentInputs(fragment, varyings));
                if (out instanceof Map<?, ?> struct && !struct.isEmpty()) {
                    out = struct.values().iterator().next();
                }
                double[] color = Values.toTexel(out);
                if (blend != null) {
                    color = blend(color, Values.toTexel(target.getTexel(px, py)), blend);
                }
                target.setTexel(px, py, color);
            }
        }
    }

    private Map<String, Object> fragmentInputs(FunctionDef fragment, Map<String, Object> varyings) {
        List<PortDef> inputs = fragment.inputs();
        if (inputs.size() == 1 && context.structMembers(inputs.get(0).type()) != null) {
            return Map.of(inputs.get(0).id(), varyings);
        }
        Map<String, Object> bound = new LinkedHashMap<>();
        for (PortDef input : inputs) {
            if (input.builtin() == null && varyings.containsKey(input.id())) {
                bound.put(input.id(), varyings.get(input.id()));
            }
        }
        return bound;
    }

    private static double[] toScreen(Object position, int width, int height) {
        double[] p = Values.toVector(position, "vertex position");
        if (p.length < 2) {
            throw new InterpreterException("Vertex position needs at least 2 components, got " + p.length);
        }
        double pw = p.length > 3 && p[3] != 0.0 ? p[3] : 1.0;
        double z = p.length > 2 ? p[2] / pw : 0.0;
        return new double[]{
                (p[0] / pw * 0.5 + 0.5) * width,
                (0.5 - p[1] / pw * 0.5) * height,
                z};
    }

    private static double edge(double[] a, double[] b, double px, double py) {
        return (px - a[0]) * (b[1] - a[1]) - (py - a[1]) * (b[0] - a[0]);
    }

    private static Object interpolate(Object a, Object b, Object c, double w0, double w1, double w2) {
        if (a instanceof Number x && b instanceof Number y && c instanceof Number z) {
            return w0 * x.doubleValue() + w1 * y.doubleValue() + w2 * z.doubleValue();
        }
        if (a instanceof double[] x && b instanceof double[] y && c instanceof double[] z
                && x.length == y.length && y.length == z.length) {
            double[] out = new double[x.length];
            for (int i = 0; i < out.length; i++) {
                out[i] = w0 * x[i] + w1 * y[i] + w2 * z[i];
            }
            return out;
        }
        return Values.copy(a);
    }

    // Blending

    static double[] blend(double[] src, double[] dst, Map<?, ?> blend) {
        Map<?, ?> colorState = blend.get("color") instanceof Map<?, ?> m ? m : Map.of();
        Map<?, ?> alphaState = blend.get("alpha") instanceof Map<?, ?> m ? m : Map.of();
        double[] out = new double[4];
        for (int c = 0; c < 3; c++) {
            out[c] = blendComponent(src, dst, c, colorState);
        }
        out[3] = blendComponent(src, dst, 3, alphaState);
        return out;
    }

    private static double blendComponent(double[] src, double[] dst, int c, Map<?, ?> state) {
        String operation = stringOr(state.get("operation"), "add");
        double s = src[c] * factor(stringOr(state.get("srcFactor"), "one"), src, dst, c);
        double d = dst[c] * factor(stringOr(state.get("dstFactor"), "zero"), src, dst, c);
        return switch (operation) {
            case "add" -> s + d;
            case "subtract" -> s - d;
            case "reverse-subtract" -> d - s;
            case "min" -> Math.min(src[c], dst[c]);
            case "max" -> Math.max(src[c], dst[c]);
            default -> throw new InterpreterException("Unknown blend operation '" + operation + "'");
        };
    }

    private static double factor(String name, double[] src, double[] dst, int c) {
        return switch (name) {
            case "zero" -> 0.0;
            case "one" -> 1.0;
            case "src" -> src[c];
            case "one-minus-src" -> 1.0 - src[c];
            case "src-alpha" -> src[3];
            case "one-minus-src-alpha" -> 1.0 - src[3];
            case "dst" -> dst[c];
            case "one-minus-dst" -> 1.0 - dst[c];
            case "dst-alpha" -> dst[3];
            case "one-minus-dst-alpha" -> 1.0 - dst[3];
            default -> throw new InterpreterException("Unknown blend factor '" + name + "'");
        };
    }

    private static String stringOr(Object value, String fallback) {
        return value instanceof String s ? s : fallback;
    }
}
