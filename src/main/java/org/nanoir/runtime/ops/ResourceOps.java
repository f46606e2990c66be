package org.nanoir.runtime.ops;

import org.nanoir.ir.ResourceType;
import org.nanoir.ir.TextureFormat;
import org.nanoir.runtime.ActionLogEntry;
import org.nanoir.runtime.EvaluationContext;
import org.nanoir.runtime.ResourceState;
import org.nanoir.runtime.Values;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.nanoir.ir.schema.BuiltinOp.BUFFER_LOAD;
import static org.nanoir.ir.schema.BuiltinOp.BUFFER_STORE;
import static org.nanoir.ir.schema.BuiltinOp.CMD_COPY_BUFFER;
import static org.nanoir.ir.schema.BuiltinOp.CMD_COPY_TEXTURE;
import static org.nanoir.ir.schema.BuiltinOp.CMD_RESIZE_RESOURCE;
import static org.nanoir.ir.schema.BuiltinOp.RESOURCE_GET_FORMAT;
import static org.nanoir.ir.schema.BuiltinOp.RESOURCE_GET_SIZE;
import static org.nanoir.ir.schema.BuiltinOp.TEXTURE_LOAD;
import static org.nanoir.ir.schema.BuiltinOp.TEXTURE_SAMPLE;
import static org.nanoir.ir.schema.BuiltinOp.TEXTURE_STORE;

/**
 * Buffer and texture access plus the resize and copy commands.
 * <p>
 * Every indexed access is bounds-checked against the resource's current size and fails
 * with a runtime error when out of range.
 */
final class ResourceOps {

    private ResourceOps() {
    }

    static void register() {
        OpRegistry.register(TEXTURE_SAMPLE, (ctx, a) -> {
            ResourceState tex = texture(ctx, a, "tex");
            double[] uv = a.has("coords") ? a.getVector("coords") : a.getVector("uv");
            return TextureSampler.sample(tex, uv[0], uv[1]);
        });
        OpRegistry.register(TEXTURE_LOAD, (ctx, a) -> {
            ResourceState tex = texture(ctx, a, "tex");
            int[] xy = texelCoords(a, tex);
            return TextureSampler.texel(tex, xy[0], xy[1]);
        });
        OpRegistry.register(TEXTURE_STORE, (ctx, a) -> {
            ResourceState tex = texture(ctx, a, "tex");
            int[] xy = texelCoords(a, tex);
            tex.setTexel(xy[0], xy[1], Values.toTexel(a.require("value")));
            return null;
        });
        OpRegistry.register(BUFFER_LOAD, (ctx, a) -> {
            ResourceState buffer = ctx.getResource(a.getString("buffer"));
            return Values.copy(buffer.get(a.getInt("index")));
        });
        OpRegistry.register(BUFFER_STORE, (ctx, a) -> {
            ResourceState buffer = ctx.getResource(a.getString("buffer"));
            buffer.set(a.getInt("index"), Values.copy(a.require("value")));
            return null;
        });
        OpRegistry.register(RESOURCE_GET_SIZE, (ctx, a) -> {
            ResourceState res = ctx.getResource(a.getString("resource"));
            return new double[]{res.getWidth(), res.getHeight()};
        });
        OpRegistry.register(RESOURCE_GET_FORMAT, (ctx, a) ->
                (double) ctx.getResource(a.getString("resource")).getFormat().id());
        OpRegistry.register(CMD_RESIZE_RESOURCE, ResourceOps::resize);
        OpRegistry.register(CMD_COPY_BUFFER, ResourceOps::copyBuffer);
        OpRegistry.register(CMD_COPY_TEXTURE, ResourceOps::copyTexture);
    }

    private static ResourceState texture(EvaluationContext ctx, OpArguments args, String key) {
        ResourceState res = ctx.getResource(args.getString(key));
        if (res.getType() != ResourceType.TEXTURE2D) {
            throw args.error("resource '" + res.getId() + "' is not a texture");
        }
        return res;
    }

    private static int[] texelCoords(OpArguments args, ResourceState tex) {
        double[] coords = args.getVector("coords");
        if (coords.length < 2) {
            throw args.error("texel coordinates need 2 components, got " + coords.length);
        }
        int x = Values.toInt32(coords[0]);
        int y = Values.toInt32(coords[1]);
        if (x < 0 || y < 0 || x >= tex.getWidth() || y >= tex.getHeight()) {
            throw args.error("texel (" + x + ", " + y + ") out of bounds for texture '" + tex.getId() + "' of size "
                    + tex.getWidth() + "x" + tex.getHeight());
        }
        return new int[]{x, y};
    }

    private static Object resize(EvaluationContext ctx, OpArguments args) {
        String id = args.getString("resource");
        ResourceState res = ctx.getResource(id);
        Object size = args.require("size");
        int width;
        int height = 1;
        if (size instanceof double[] dims) {
            if (dims.length == 0) {
                throw args.error("size must not be empty");
            }
            width = Values.toInt32(dims[0]);
            height = dims.length > 1 ? Values.toInt32(dims[1]) : 1;
        } else {
            width = args.getInt("size");
        }
        if (width < 0 || height < 0) {
            throw args.error("negative size " + width + "x" + height + " for resource '" + id + "'");
        }

        if (args.has("format")) {
            res.setFormat(parseFormat(args, args.require("format")));
        }
        res.resize(width, height, args.get("clear"));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("width", width);
        payload.put("height", height);
        payload.put("format", res.getFormat().wireName());
        ctx.logAction(ActionLogEntry.ActionType.RESIZE, id, payload);
        return null;
    }

    private static TextureFormat parseFormat(OpArguments args, Object format) {
        Optional<TextureFormat> parsed;
        if (format instanceof Number n) {
            parsed = TextureFormat.fromId(n.intValue());
        } else {
            String name = String.valueOf(format);
            String key = name.substring(name.lastIndexOf('.') + 1);
            parsed = TextureFormat.fromWireName(name).or(() -> TextureFormat.fromConstantKey(key));
        }
        return parsed.orElseThrow(() -> args.error("unknown texture format '" + format + "'"));
    }

    private static Object copyBuffer(EvaluationContext ctx, OpArguments args) {
        ResourceState src = ctx.getResource(args.getString("src"));
        ResourceState dst = ctx.getResource(args.getString("dst"));
        int srcOffset = args.getInt("src_offset", 0);
        int dstOffset = args.getInt("dst_offset", 0);
        if (srcOffset < 0 || dstOffset < 0) {
            throw args.error("copy offsets must not be negative");
        }
        int available = Math.min(src.elementCount() - srcOffset, dst.elementCount() - dstOffset);
        int count = Math.max(0, Math.min(args.getInt("count", available), available));
        for (int i = 0; i < count; i++) {
            dst.set(dstOffset + i, Values.copy(src.get(srcOffset + i)));
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("src", src.getId());
        payload.put("count", count);
        ctx.logAction(ActionLogEntry.ActionType.COPY, dst.getId(), payload);
        return null;
    }

    private static Object copyTexture(EvaluationContext ctx, OpArguments args) {
        ResourceState src = texture(ctx, args, "src");
        ResourceState dst = texture(ctx, args, "dst");
        int[] srcRect = rect(args, "src_rect", new int[]{0, 0, src.getWidth(), src.getHeight()});
        int[] dstRect = rect(args, "dst_rect", new int[]{0, 0, srcRect[2], srcRect[3]});
        Double alpha = args.has("alpha") ? args.getDouble("alpha") : null;

        for (int dy = 0; dy < dstRect[3]; dy++) {
            int ty = dstRect[1] + dy;
            if (ty < 0 || ty >= dst.getHeight()) continue;
            int sy = srcRect[1] + (int) Math.floor((double) dy * srcRect[3] / dstRect[3]);
            if (sy < 0 || sy >= src.getHeight()) continue;
            for (int dx = 0; dx < dstRect[2]; dx++) {
                int tx = dstRect[0] + dx;
                if (tx < 0 || tx >= dst.getWidth()) continue;
                int sx = srcRect[0] + (int) Math.floor((double) dx * srcRect[2] / dstRect[2]);
                if (sx < 0 || sx >= src.getWidth()) continue;

                double[] color = TextureSampler.texel(src, sx, sy);
                if (alpha != null) {
                    color[3] *= alpha;
                    color = VectorOps.sourceOver(TextureSampler.texel(dst, tx, ty), color);
                }
                dst.setTexel(tx, ty, color);
            }
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("src", src.getId());
        payload.put("srcRect", srcRect.clone());
        payload.put("dstRect", dstRect.clone());
        ctx.logAction(ActionLogEntry.ActionType.COPY, dst.getId(), payload);
        return null;
    }

    private static int[] rect(OpArguments args, String key, int[] defaultRect) {
        if (!args.has(key)) return defaultRect;
        double[] r = args.getVector(key);
        if (r.length != 4) {
            throw args.error("'" + key + "' must be [x, y, w, h]");
        }
        return new int[]{Values.toInt32(r[0]), Values.toInt32(r[1]), Values.toInt32(r[2]), Values.toInt32(r[3])};
    }
}
