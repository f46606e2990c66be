package org.nanoir.runtime;

import org.nanoir.ir.Builtin;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.InputDef;
import org.nanoir.ir.Persistence;
import org.nanoir.ir.ResourceDef;
import org.nanoir.ir.ResourceSize;
import org.nanoir.ir.ResourceType;
import org.nanoir.ir.StructDef;
import org.nanoir.ir.StructMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The mutable runtime state of one interpreter session: resources, the call stack,
 * per-invocation builtins and the action log.
 * <p>
 * A context is created for a document and a set of host inputs and must be closed when
 * the session ends. It is not thread-safe; the interpreter is single-threaded.
 */
public class EvaluationContext implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(EvaluationContext.class);

    private final IRDocument document;
    private final RuntimeOptions options;
    private final Map<String, Object> inputs = new HashMap<>();
    private final Map<String, ResourceState> resources = new LinkedHashMap<>();
    private final Deque<StackFrame> stack = new ArrayDeque<>();
    private final Map<String, Object> builtins = new HashMap<>();
    private final List<ActionLogEntry> log = new ArrayList<>();
    private boolean closed;

    public EvaluationContext(IRDocument document, Map<String, Object> inputs) {
        this(document, inputs, RuntimeOptions.defaults());
    }

    /**
     * Creates a context and allocates every declared resource.
     *
     * @param document The document.
     * @param inputs   Host values for document inputs; may be empty.
     * @param options  Runtime settings.
     */
    public EvaluationContext(IRDocument document, Map<String, Object> inputs, RuntimeOptions options) {
        this.document = document;
        this.options = options;
        inputs.forEach((k, v) -> this.inputs.put(k, Values.normalize(v)));
        allocateResources();
    }

    private void allocateResources() {
        Map<String, ResourceDef> pendingReferences = new LinkedHashMap<>();
        for (ResourceDef def : document.resources()) {
            ResourceSize size = def.size();
            if (size.mode() == ResourceSize.Mode.REFERENCE) {
                pendingReferences.put(def.id(), def);
                continue;
            }
            int[] dims = initialSize(def);
            resources.put(def.id(), new ResourceState(def, dims[0], dims[1]));
        }
        for (ResourceDef def : pendingReferences.values()) {
            int[] dims = referencedSize(def, pendingReferences, new HashSet<>());
            resources.put(def.id(), new ResourceState(def, dims[0], dims[1]));
        }

        for (InputDef input : document.inputs()) {
            if ("texture2d".equals(input.type())) {
                ResourceDef def = new ResourceDef(input.id(), ResourceType.TEXTURE2D, null, null, null, null,
                        ResourceSize.fixed(1, 1), new Persistence(true, false, false, null, false));
                resources.put(input.id(), new ResourceState(def, 1, 1));
            }
        }
    }

    private int[] initialSize(ResourceDef def) {
        ResourceSize size = def.size();
        return switch (size.mode()) {
            case FIXED -> fixedSize(size.value());
            case VIEWPORT -> viewportSize(size.scale());
            case CPU_DRIVEN -> new int[]{0, 1};
            case REFERENCE -> new int[]{1, 1};
        };
    }

    private int[] referencedSize(ResourceDef def, Map<String, ResourceDef> pending, Set<String> visiting) {
        String ref = def.size().ref();
        ResourceState target = resources.get(ref);
        if (target != null) {
            return new int[]{target.getWidth(), target.getHeight()};
        }
        ResourceDef other = pending.get(ref);
        if (other == null || !visiting.add(def.id())) {
            throw new InterpreterException("Resource '" + def.id() + "' references the size of unknown resource '" + ref + "'");
        }
        return referencedSize(other, pending, visiting);
    }

    private static int[] fixedSize(Object value) {
        if (value instanceof Number n) {
            return new int[]{n.intValue(), 1};
        }
        if (value instanceof List<?> list && list.size() >= 2) {
            return new int[]{((Number) list.get(0)).intValue(), ((Number) list.get(1)).intValue()};
        }
        return new int[]{1, 1};
    }

    private int[] viewportSize(Object scale) {
        double sx = 1.0;
        double sy = 1.0;
        if (scale instanceof Number n) {
            sx = n.doubleValue();
            sy = n.doubleValue();
        } else if (scale instanceof List<?> list && list.size() >= 2) {
            sx = ((Number) list.get(0)).doubleValue();
            sy = ((Number) list.get(1)).doubleValue();
        }
        return new int[]{
                Math.max(1, (int) Math.floor(options.viewportWidth() * sx)),
                Math.max(1, (int) Math.floor(options.viewportHeight() * sy))};
    }

    public IRDocument getDocument() {
        return document;
    }

    public RuntimeOptions getOptions() {
        return options;
    }

    // Stack

    public void pushFrame(String name) {
        stack.push(new StackFrame(name));
    }

    public StackFrame popFrame() {
        if (stack.isEmpty()) {
            throw new InterpreterException("Stack Underflow");
        }
        return stack.pop();
    }

    public StackFrame currentFrame() {
        if (stack.isEmpty()) {
            throw new InterpreterException("Stack Underflow");
        }
        return stack.peek();
    }

    public boolean isOnStack(String name) {
        return stack.stream().anyMatch(f -> f.getName().equals(name));
    }

    public int stackDepth() {
        return stack.size();
    }

    // Variables

    public void setVar(String id, Object value) {
        currentFrame().getVars().put(id, value);
    }

    /**
     * Looks up a bare identifier: current frame variables, then builtins, then host inputs
     * (including declared defaults).
     *
     * @param id The identifier.
     * @return The value, if the identifier is bound anywhere.
     */
    public Optional<Object> findVar(String id) {
        Object value = currentFrame().getVars().get(id);
        if (value != null) return Optional.of(value);
        value = builtins.get(id);
        if (value != null) return Optional.of(value);
        value = inputs.get(id);
        if (value != null) return Optional.of(value);
        return document.findInput(id).filter(InputDef::hasDefault).map(i -> Values.normalize(i.defaultValue()));
    }

    public Object getVar(String id) {
        return findVar(id).orElseThrow(() -> new InterpreterException("Variable '" + id + "' is not defined"));
    }

    /**
     * Returns a host input, falling back to its declared default.
     *
     * @param id The input id.
     * @return The value.
     * @throws InterpreterException if the input has neither a value nor a default.
     */
    public Object getInput(String id) {
        Object value = inputs.get(id);
        if (value != null) return value;
        return document.findInput(id)
                .filter(InputDef::hasDefault)
                .map(i -> Values.normalize(i.defaultValue()))
                .orElseThrow(() -> new InterpreterException("Input '" + id + "' not provided"));
    }

    public void setInput(String id, Object value) {
        inputs.put(id, Values.normalize(value));
    }

    public boolean hasInput(String id) {
        return inputs.containsKey(id);
    }

    public Map<String, Object> getInputs() {
        return Collections.unmodifiableMap(inputs);
    }

    // Loops

    public void setLoopIndex(String loopId, int index) {
        currentFrame().getLoopIndices().put(loopId, index);
    }

    public void clearLoopIndex(String loopId) {
        currentFrame().getLoopIndices().remove(loopId);
    }

    public int getLoopIndex(String loopId) {
        Integer index = currentFrame().getLoopIndices().get(loopId);
        if (index == null) {
            throw new InterpreterException("Loop '" + loopId + "' index not found in current frame");
        }
        return index;
    }

    // Builtins

    public void setBuiltin(String name, Object value) {
        builtins.put(name, value);
    }

    public Object getBuiltin(String name) {
        Object value = builtins.get(name);
        if (value == null) {
            throw new InterpreterException("Builtin '" + name + "' is not set in the current invocation");
        }
        return value;
    }

    public void clearBuiltins() {
        builtins.clear();
    }

    /**
     * Removes the per-invocation stage builtins, keeping host values such as {@code time}.
     */
    public void clearStageBuiltins() {
        builtins.keySet().removeIf(name -> Builtin.fromWireName(name).map(Builtin::isGpuOnly).orElse(false));
    }

    // Resources

    public ResourceState getResource(String id) {
        ResourceState state = resources.get(id);
        if (state == null) {
            throw new InterpreterException("Resource '" + id + "' not found");
        }
        return state;
    }

    public boolean hasResource(String id) {
        return resources.containsKey(id);
    }

    public Map<String, ResourceState> getResources() {
        return Collections.unmodifiableMap(resources);
    }

    /**
     * Applies per-frame persistence: resources that are not retained, or are flagged
     * {@code clearEveryFrame}, are refilled with their clear value.
     */
    public void beginFrame() {
        for (ResourceState state : resources.values()) {
            if (state.getDef().persistence().clearsEachFrame()) {
                state.clear();
            }
        }
    }

    /**
     * Returns the member layout of a struct as name to type, or {@code null}.
     *
     * @param structId The struct id.
     * @return The members, or {@code null} if no such struct is declared.
     */
    public Map<String, String> structMembers(String structId) {
        Optional<StructDef> def = document.findStruct(structId);
        if (def.isEmpty()) return null;
        Map<String, String> members = new LinkedHashMap<>();
        for (StructMember member : def.get().members()) {
            members.put(member.name(), member.type());
        }
        return members;
    }

    public Object defaultValue(String type) {
        return Values.defaultFor(type, this::structMembers);
    }

    // Action log

    public void logAction(ActionLogEntry.ActionType type, String target, Map<String, Object> payload) {
        ActionLogEntry entry = new ActionLogEntry(type, target, payload);
        log.add(entry);
        if (options.logActions() && LOG.isDebugEnabled()) {
            LOG.debug("{} {} {}", type, target, entry.payload());
        }
    }

    public List<ActionLogEntry> getLog() {
        return Collections.unmodifiableList(log);
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Releases all resource stores and clears the stack. The context cannot be used afterwards.
     */
    @Override
    public void close() {
        if (closed) return;
        resources.values().forEach(ResourceState::release);
        resources.clear();
        stack.clear();
        builtins.clear();
        closed = true;
        LOG.debug("Evaluation context for '{}' closed", document.entryPoint());
    }
}
