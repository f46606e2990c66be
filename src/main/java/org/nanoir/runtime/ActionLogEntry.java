package org.nanoir.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A side effect recorded by the interpreter, for inspection by hosts and tests.
 *
 * @param type    The kind of action.
 * @param target  The affected resource or function id.
 * @param payload Action details.
 */
public record ActionLogEntry(ActionType type, String target, Map<String, Object> payload) {

    public enum ActionType {
        DISPATCH,
        DRAW,
        RESIZE,
        COPY
    }

    public ActionLogEntry {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
