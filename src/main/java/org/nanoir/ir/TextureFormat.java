package org.nanoir.ir;

import java.util.Arrays;
import java.util.Optional;

/**
 * Texel layouts with their stable integer ids, as exposed to the graph through
 * {@code resource_get_format} and {@code const_get("TextureFormat.X")}.
 */
public enum TextureFormat {
    UNKNOWN("unknown", 0, 4),
    RGBA8("rgba8", 1, 4),
    RGBA16F("rgba16f", 2, 4),
    RGBA32F("rgba32f", 3, 4),
    R8("r8", 4, 1),
    R16F("r16f", 5, 1),
    R32F("r32f", 6, 1);

    public static final TextureFormat DEFAULT = RGBA8;

    private final String wireName;
    private final int id;
    private final int channels;

    TextureFormat(String wireName, int id, int channels) {
        this.wireName = wireName;
        this.id = id;
        this.channels = channels;
    }

    public String wireName() {
        return wireName;
    }

    public int id() {
        return id;
    }

    public int channels() {
        return channels;
    }

    public static Optional<TextureFormat> fromWireName(String name) {
        return Arrays.stream(values()).filter(f -> f.wireName.equals(name)).findFirst();
    }

    public static Optional<TextureFormat> fromId(int id) {
        return Arrays.stream(values()).filter(f -> f.id == id).findFirst();
    }

    /**
     * Looks up a format by its constant key as used in {@code TextureFormat.RGBA8}.
     *
     * @param key The key after the dot.
     * @return The format, if the key names one.
     */
    public static Optional<TextureFormat> fromConstantKey(String key) {
        return Arrays.stream(values()).filter(f -> f.name().equals(key)).findFirst();
    }
}
