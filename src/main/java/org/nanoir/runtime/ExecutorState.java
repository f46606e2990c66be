package org.nanoir.runtime;

/**
 * Represents the lifecycle state of an {@link Executor}.
 */
public enum ExecutorState {
    /**
     * Created, not yet run.
     */
    IDLE,

    /**
     * Host inputs are being bound and the entry function looked up.
     */
    RESOLVING_ENTRY,

    /**
     * The entry function is being interpreted.
     */
    RUNNING,

    /**
     * The run finished normally.
     */
    COMPLETED,

    /**
     * The run aborted with a runtime error. Terminal.
     */
    FAILED
}
