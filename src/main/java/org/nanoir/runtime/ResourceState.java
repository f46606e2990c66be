package org.nanoir.runtime;

import org.nanoir.ir.Persistence;
import org.nanoir.ir.ResourceDef;
import org.nanoir.ir.ResourceType;
import org.nanoir.ir.TextureFormat;

import java.util.ArrayList;
import java.util.List;

/**
 * The live state of one resource: its current dimensions, format and element store.
 * <p>
 * Buffers and atomic counters use {@code width} as the element count and a height of 1.
 * Texture elements are RGBA {@code double[4]} texels stored row-major.
 */
public class ResourceState {

    private final ResourceDef def;
    private TextureFormat format;
    private int width;
    private int height;
    private final List<Object> data = new ArrayList<>();

    /**
     * Allocates a resource with the given initial size. Elements start at the declared
     * clear value, or zero.
     *
     * @param def    The declaration.
     * @param width  The initial width (element count for buffers).
     * @param height The initial height.
     */
    public ResourceState(ResourceDef def, int width, int height) {
        this.def = def;
        this.format = def.format() == null ? TextureFormat.DEFAULT
                : TextureFormat.fromWireName(def.format()).orElse(TextureFormat.DEFAULT);
        this.width = Math.max(0, width);
        this.height = Math.max(0, height);
        fill(fillValue(), elementCount());
    }

    public ResourceDef getDef() {
        return def;
    }

    public String getId() {
        return def.id();
    }

    public ResourceType getType() {
        return def.type();
    }

    public TextureFormat getFormat() {
        return format;
    }

    public void setFormat(TextureFormat format) {
        this.format = format;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int elementCount() {
        return width * height;
    }

    /**
     * Reads one element, failing on an out-of-range index.
     *
     * @param index The element index.
     * @return The stored value.
     */
    public Object get(int index) {
        checkIndex(index);
        return data.get(index);
    }

    public void set(int index, Object value) {
        checkIndex(index);
        data.set(index, value);
    }

    public Object getTexel(int x, int y) {
        return get(y * width + x);
    }

    public void setTexel(int x, int y, double[] rgba) {
        set(y * width + x, rgba);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= data.size()) {
            throw new InterpreterException("Index " + index + " out of bounds for resource '" + def.id()
                    + "' with " + data.size() + " elements");
        }
    }

    /**
     * Changes the dimensions.
     * <p>
     * An explicit {@code clear} value refills every element. Otherwise, with
     * {@code clearOnResize} the store is refilled with the clear value (or zero); without it,
     * surviving elements keep their values, new elements get the clear value (or zero) and
     * shrinking truncates. Texture texels keep their (x, y) coordinates.
     *
     * @param newWidth  The new width or element count.
     * @param newHeight The new height.
     * @param clear     An explicit fill value, or {@code null}.
     */
    public void resize(int newWidth, int newHeight, Object clear) {
        int oldWidth = width;
        int oldHeight = height;
        this.width = Math.max(0, newWidth);
        this.height = Math.max(0, newHeight);
        int count = elementCount();
        Persistence persistence = def.persistence();

        if (clear != null) {
            fill(texelOrScalar(Values.normalize(clear)), count);
        } else if (persistence.clearOnResize()) {
            fill(fillValue(), count);
        } else if (def.type() == ResourceType.TEXTURE2D) {
            relayout(oldWidth, oldHeight);
        } else {
            while (data.size() > count) {
                data.remove(data.size() - 1);
            }
            Object pad = fillValue();
            while (data.size() < count) {
                data.add(Values.copy(pad));
            }
        }
    }

    // Texels keep their (x, y) position; uncovered texels get the fill value.
    private void relayout(int oldWidth, int oldHeight) {
        List<Object> previous = new ArrayList<>(data);
        Object pad = fillValue();
        data.clear();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                boolean survives = x < oldWidth && y < oldHeight && y * oldWidth + x < previous.size();
                data.add(survives ? previous.get(y * oldWidth + x) : Values.copy(pad));
            }
        }
    }

    /**
     * Refills every element with the clear value, or zero.
     */
    public void clear() {
        fill(fillValue(), elementCount());
    }

    public List<Object> snapshot() {
        List<Object> copy = new ArrayList<>(data.size());
        for (Object value : data) {
            copy.add(Values.copy(value));
        }
        return copy;
    }

    void release() {
        data.clear();
    }

    private void fill(Object value, int count) {
        data.clear();
        for (int i = 0; i < count; i++) {
            data.add(Values.copy(value));
        }
    }

    private Object fillValue() {
        Object clearValue = def.persistence().clearValue();
        if (clearValue != null) {
            return texelOrScalar(Values.normalize(clearValue));
        }
        return def.type() == ResourceType.TEXTURE2D ? new double[4] : (Object) 0.0;
    }

    private Object texelOrScalar(Object value) {
        if (def.type() == ResourceType.TEXTURE2D && value instanceof Double d) {
            return new double[]{d, d, d, d};
        }
        return value;
    }
}
