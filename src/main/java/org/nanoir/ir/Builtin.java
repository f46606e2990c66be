package org.nanoir.ir;

import java.util.Arrays;
import java.util.Optional;

/**
 * Per-invocation values readable through {@code builtin_get} or as bare identifiers.
 * Stage builtins only exist while a shader invocation runs; host builtins are also
 * available to {@code cpu} functions.
 */
public enum Builtin {
    GLOBAL_INVOCATION_ID("global_invocation_id", true),
    LOCAL_INVOCATION_ID("local_invocation_id", true),
    WORKGROUP_ID("workgroup_id", true),
    LOCAL_INVOCATION_INDEX("local_invocation_index", true),
    NUM_WORKGROUPS("num_workgroups", true),
    VERTEX_INDEX("vertex_index", true),
    INSTANCE_INDEX("instance_index", true),
    POSITION("position", true),
    FRAG_COORD("frag_coord", true),
    FRONT_FACING("front_facing", true),
    TIME("time", false),
    DELTA_TIME("delta_time", false),
    BPM("bpm", false),
    BEAT_NUMBER("beat_number", false),
    BEAT_DELTA("beat_delta", false);

    private final String wireName;
    private final boolean gpuOnly;

    Builtin(String wireName, boolean gpuOnly) {
        this.wireName = wireName;
        this.gpuOnly = gpuOnly;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isGpuOnly() {
        return gpuOnly;
    }

    public static Optional<Builtin> fromWireName(String name) {
        return Arrays.stream(values()).filter(b -> b.wireName.equals(name)).findFirst();
    }

    public static boolean isBuiltinName(String name) {
        return fromWireName(name).isPresent();
    }
}
