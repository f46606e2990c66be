package org.nanoir.runtime;

import org.nanoir.ir.Builtin;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.InputDef;
import org.nanoir.ir.Node;
import org.nanoir.ir.PortDef;
import org.nanoir.ir.VariableDef;
import org.nanoir.ir.graph.FunctionGraph;
import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.runtime.ops.OpArguments;
import org.nanoir.runtime.ops.OpRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The CPU reference interpreter for one run of a document.
 * <p>
 * Control follows execution edges from a function's entry nodes; data is pulled on demand
 * from the nodes an argument references, and pure results are memoised in the current
 * frame. Shader functions are run on the CPU by {@code cmd_dispatch} once per grid cell and
 * by {@code cmd_draw} through the {@link SoftwareRasterizer}.
 * <p>
 * An executor is single-use: {@link #run(Map)} may be called once.
 */
public class Executor {

    private static final Logger LOG = LoggerFactory.getLogger(Executor.class);

    private static final String EXEC_OUT = "exec_out";
    private static final String EXEC_TRUE = "exec_true";
    private static final String EXEC_FALSE = "exec_false";
    private static final String EXEC_BODY = "exec_body";
    private static final String EXEC_COMPLETED = "exec_completed";
    private static final List<String> EXEC_PORTS = List.of(EXEC_OUT, EXEC_TRUE, EXEC_FALSE, EXEC_BODY, EXEC_COMPLETED);
    private static final Set<String> CALL_KEYS = Set.of("func", "target", "args", "x", "y", "z", "dispatch", "threads");
    private static final int[] DEFAULT_WORKGROUP = {16, 16, 1};

    private final EvaluationContext context;
    private final Map<String, FunctionGraph> graphs = new HashMap<>();
    private ExecutorState state = ExecutorState.IDLE;

    /** Value of an executed {@code func_return}, unwinding the current function. */
    private record ReturnSignal(Object value) {
    }

    public Executor(EvaluationContext context) {
        this.context = context;
    }

    public ExecutorState getState() {
        return state;
    }

    public EvaluationContext getContext() {
        return context;
    }

    public Object run() {
        return run(Map.of());
    }

    /**
     * Binds the host inputs, runs the entry function and returns its result.
     *
     * @param inputs Host values for document inputs, overriding those the context was created with.
     * @return The value of the entry function's {@code func_return}, or {@code null}.
     * @throws InterpreterException on any runtime error; the executor is then {@link ExecutorState#FAILED}.
     * @throws IllegalStateException if this executor has already been run.
     */
    public Object run(Map<String, Object> inputs) {
        if (state != ExecutorState.IDLE) {
            throw new IllegalStateException("Executor is single-use, current state is " + state);
        }
        transition(ExecutorState.RESOLVING_ENTRY);
        try {
            inputs.forEach(context::setInput);
            IRDocument document = context.getDocument();
            for (InputDef input : document.inputs()) {
                if ("texture2d".equals(input.type()) || input.hasDefault() || context.hasInput(input.id())) {
                    continue;
                }
                throw new InterpreterException("Input '" + input.id() + "' not provided");
            }
            FunctionDef entry = document.findFunction(document.entryPoint())
                    .orElseThrow(() -> new InterpreterException("Entry point '" + document.entryPoint() + "' not found"));

            transition(ExecutorState.RUNNING);
            context.beginFrame();
            context.pushFrame(entry.id());
            Object result;
            try {
                result = executeFunction(entry);
            } finally {
                context.popFrame();
            }
            transition(ExecutorState.COMPLETED);
            return result;
        } catch (RuntimeException e) {
            transition(ExecutorState.FAILED);
            LOG.debug("Execution of '{}' failed: {}", context.getDocument().entryPoint(), e.getMessage());
            throw e;
        }
    }

    private void transition(ExecutorState next) {
        LOG.debug("Executor state {} -> {}", state, next);
        state = next;
    }

    // Functions

    private FunctionGraph graph(FunctionDef function) {
        return graphs.computeIfAbsent(function.id(), id -> FunctionGraph.build(function, context.getDocument()));
    }

    private FunctionDef function(String id) {
        return context.getDocument().findFunction(id)
                .orElseThrow(() -> new InterpreterException("Function '" + id + "' not found"));
    }

    /** Runs a function in the frame already pushed for it. */
    private Object executeFunction(FunctionDef function) {
        FunctionGraph graph = graph(function);
        for (VariableDef local : function.localVars()) {
            Object initial = local.initialValue() != null
                    ? Values.copy(Values.normalize(local.initialValue()))
                    : context.defaultValue(local.type());
            context.setVar(local.id(), initial);
        }
        ReturnSignal signal = runChain(graph, graph.entryNodes());
        return signal == null ? null : signal.value();
    }

    private ReturnSignal runChain(FunctionGraph graph, int[] starts) {
        Deque<Integer> queue = new ArrayDeque<>();
        for (int start : starts) {
            queue.add(start);
        }
        while (!queue.isEmpty()) {
            int index = queue.poll();
            Node node = graph.node(index);
            if (context.getOptions().traceNodes()) {
                LOG.debug("Executing {}", node);
            }
            BuiltinOp op = opOf(node);
            int[] next;
            switch (op) {
                case FUNC_RETURN: {
                    OpArguments args = resolveArgs(graph, index);
                    return new ReturnSignal(args.has("val") ? args.get("val") : args.get("value"));
                }
                case FLOW_BRANCH: {
                    OpArguments args = resolveArgs(graph, index);
                    next = graph.successors(index, Values.truthy(args.get("cond")) ? EXEC_TRUE : EXEC_FALSE);
                    break;
                }
                case FLOW_LOOP: {
                    ReturnSignal signal = runLoop(graph, index);
                    if (signal != null) {
                        return signal;
                    }
                    next = graph.successors(index, EXEC_COMPLETED);
                    break;
                }
                default: {
                    StackFrame frame = context.currentFrame();
                    // already run while being pulled as data
                    if (!frame.getPulledNodes().remove(node.getId())) {
                        frame.getNodeResults().put(node.getId(), evaluate(graph, index));
                    }
                    next = graph.successors(index, EXEC_OUT);
                }
            }
            for (int successor : next) {
                queue.add(successor);
            }
        }
        return null;
    }

    private ReturnSignal runLoop(FunctionGraph graph, int index) {
        Node node = graph.node(index);
        OpArguments args = resolveArgs(graph, index);
        int start = args.getInt("start", 0);
        int end;
        if (args.has("end")) {
            end = args.getInt("end");
        } else if (args.has("count")) {
            end = start + args.getInt("count");
        } else {
            throw args.error("flow_loop requires 'count' or 'end'");
        }
        String tag = args.get("tag") instanceof String s ? s : null;

        Set<String> body = bodyNodes(graph, index);
        StackFrame frame = context.currentFrame();
        try {
            for (int i = start; i < end; i++) {
                context.setLoopIndex(node.getId(), i);
                if (tag != null) {
                    context.setLoopIndex(tag, i);
                }
                frame.getNodeResults().keySet().removeIf(id -> body.contains(id) || isPure(graph, id));
                frame.getPulledNodes().removeAll(body);
                ReturnSignal signal = runChain(graph, graph.successors(index, EXEC_BODY));
                if (signal != null) {
                    return signal;
                }
            }
        } finally {
            context.clearLoopIndex(node.getId());
            if (tag != null) {
                context.clearLoopIndex(tag);
            }
        }
        return null;
    }

    /** Ids of the nodes reachable from a loop's body port, excluding the loop itself. */
    private static Set<String> bodyNodes(FunctionGraph graph, int loop) {
        Set<String> body = new HashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        for (int start : graph.successors(loop, EXEC_BODY)) {
            queue.add(start);
        }
        while (!queue.isEmpty()) {
            int index = queue.poll();
            if (index == loop || !body.add(graph.node(index).getId())) continue;
            for (String port : EXEC_PORTS) {
                for (int successor : graph.successors(index, port)) {
                    queue.add(successor);
                }
            }
        }
        return body;
    }

    private static boolean isPure(FunctionGraph graph, String nodeId) {
        int index = graph.indexOf(nodeId);
        return index >= 0 && !graph.isExecutable(index);
    }

    // Data

    private Object pull(FunctionGraph graph, int index) {
        StackFrame frame = context.currentFrame();
        Node node = graph.node(index);
        String id = node.getId();
        if (frame.getNodeResults().containsKey(id)) {
            return frame.getNodeResults().get(id);
        }
        if (!frame.getEvaluating().add(id)) {
            throw new InterpreterException("Cycle detected while evaluating node '" + id + "'");
        }
        try {
            Object value = evaluate(graph, index);
            if (graph.isExecutable(index)) {
                frame.getPulledNodes().add(id);
                frame.getNodeResults().put(id, value);
            } else if (opOf(node) != BuiltinOp.LOOP_INDEX) {
                frame.getNodeResults().put(id, value);
            }
            return value;
        } finally {
            frame.getEvaluating().remove(id);
        }
    }

    private Object evaluate(FunctionGraph graph, int index) {
        Node node = graph.node(index);
        BuiltinOp op = opOf(node);
        switch (op) {
            case CALL_FUNC:
                return callFunction(graph, index);
            case CMD_DISPATCH:
                return dispatch(graph, index);
            case CMD_DRAW:
                return draw(graph, index);
            case FLOW_BRANCH:
            case FLOW_LOOP:
            case FUNC_RETURN:
                throw new InterpreterException("Node '" + node.getId() + "' (" + op.id() + ") produces no value");
            default:
                break;
        }
        OpArguments args = resolveArgs(graph, index);
        try {
            return OpRegistry.get(op).execute(context, args);
        } catch (InterpreterException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new InterpreterException("Node '" + node.getId() + "' (" + op.id() + ") failed: " + e.getMessage(), e);
        }
    }

    private OpArguments resolveArgs(FunctionGraph graph, int index) {
        Node node = graph.node(index);
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : graph.template(index).entrySet()) {
            values.put(entry.getKey(), Values.normalize(resolve(graph, entry.getValue())));
        }
        for (Map.Entry<String, Integer> source : graph.authoredSources(index).entrySet()) {
            if (!values.containsKey(source.getKey())) {
                values.put(source.getKey(), Values.normalize(pull(graph, source.getValue())));
            }
        }
        return new OpArguments(node.getId(), opOf(node), values);
    }

    private Object resolve(FunctionGraph graph, Object value) {
        if (value instanceof FunctionGraph.NodeRef ref) {
            return pull(graph, ref.index());
        }
        if (value instanceof FunctionGraph.SymbolRef symbol) {
            return context.findVar(symbol.name())
                    .orElseThrow(() -> new InterpreterException("Variable '" + symbol.name() + "' is not defined"));
        }
        if (value instanceof List<?> list) {
            List<Object> out = new ArrayList<>(list.size());
            for (Object item : list) {
                out.add(resolve(graph, item));
            }
            return out;
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> out = new LinkedHashMap<>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                out.put(String.valueOf(e.getKey()), resolve(graph, e.getValue()));
            }
            return out;
        }
        return value;
    }

    private static BuiltinOp opOf(Node node) {
        return BuiltinOp.fromId(node.getOp())
                .orElseThrow(() -> new InterpreterException("Unknown op '" + node.getOp() + "' at node '" + node.getId() + "'"));
    }

    // Calls and commands

    private Object callFunction(FunctionGraph graph, int index) {
        OpArguments args = resolveArgs(graph, index);
        FunctionDef callee = function(args.getString("func"));
        if (context.isOnStack(callee.id())) {
            throw new InterpreterException("Recursion detected for function '" + callee.id() + "'");
        }
        Map<String, Object> bound = bindInputs(callee, args, false);
        context.pushFrame(callee.id());
        try {
            bound.forEach((id, value) -> context.setVar(id, Values.copy(value)));
            return executeFunction(callee);
        } finally {
            context.popFrame();
        }
    }

    /**
     * Collects the callee inputs given by a call node, from its {@code args} object or from
     * same-named keys on the node.
     */
    private Map<String, Object> bindInputs(FunctionDef callee, OpArguments args, boolean shader) {
        Map<?, ?> nested = args.get("args") instanceof Map<?, ?> m ? m : Map.of();
        Map<String, Object> bound = new LinkedHashMap<>();
        for (PortDef input : callee.inputs()) {
            Object value;
            if (nested.containsKey(input.id())) {
                value = nested.get(input.id());
            } else if (args.has(input.id()) && !CALL_KEYS.contains(input.id())) {
                value = args.get(input.id());
            } else {
                continue;
            }
            if (shader && value instanceof String s && !"string".equals(input.type())) {
                throw new InterpreterException("Cannot marshal string value '" + s + "' to shader input '" + input.id() + "'");
            }
            bound.put(input.id(), value);
        }
        return bound;
    }

    /**
     * Runs a shader function for one invocation. Stage builtins must already be set;
     * inputs declared with a {@code builtin} are bound from them.
     */
    private Object invokeShader(FunctionDef shader, Map<String, Object> inputs) {
        if (context.isOnStack(shader.id())) {
            throw new InterpreterException("Recursion detected for function '" + shader.id() + "'");
        }
        context.pushFrame(shader.id());
        try {
            for (PortDef input : shader.inputs()) {
                if (input.builtin() != null) {
                    context.setVar(input.id(), context.getBuiltin(input.builtin()));
                } else if (inputs.containsKey(input.id())) {
                    context.setVar(input.id(), Values.copy(inputs.get(input.id())));
                }
            }
            return executeFunction(shader);
        } finally {
            context.popFrame();
        }
    }

    private Object dispatch(FunctionGraph graph, int index) {
        OpArguments args = resolveArgs(graph, index);
        String name;
        if (args.has("func")) {
            name = args.getString("func");
        } else if (args.has("target")) {
            name = args.getString("target");
        } else {
            throw args.error("cmd_dispatch requires 'func'");
        }
        FunctionDef shader = function(name);
        int[] grid = grid(args);
        int[] workgroup = workgroupSize(shader);
        Map<String, Object> inputs = bindInputs(shader, args, true);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("function", shader.id());
        payload.put("grid", grid.clone());
        context.logAction(ActionLogEntry.ActionType.DISPATCH, shader.id(), payload);

        double[] numWorkgroups = {
                Math.ceil((double) grid[0] / workgroup[0]),
                Math.ceil((double) grid[1] / workgroup[1]),
                Math.ceil((double) grid[2] / workgroup[2])};
        try {
            for (int z = 0; z < grid[2]; z++) {
                for (int y = 0; y < grid[1]; y++) {
                    for (int x = 0; x < grid[0]; x++) {
                        int lx = x % workgroup[0];
                        int ly = y % workgroup[1];
                        int lz = z % workgroup[2];
                        context.setBuiltin(Builtin.GLOBAL_INVOCATION_ID.wireName(), new double[]{x, y, z});
                        context.setBuiltin(Builtin.LOCAL_INVOCATION_ID.wireName(), new double[]{lx, ly, lz});
                        context.setBuiltin(Builtin.WORKGROUP_ID.wireName(),
                                new double[]{x / workgroup[0], y / workgroup[1], z / workgroup[2]});
                        context.setBuiltin(Builtin.LOCAL_INVOCATION_INDEX.wireName(),
                                (double) (lx + ly * workgroup[0] + lz * workgroup[0] * workgroup[1]));
                        context.setBuiltin(Builtin.NUM_WORKGROUPS.wireName(), numWorkgroups.clone());
                        invokeShader(shader, inputs);
                    }
                }
            }
        } finally {
            context.clearStageBuiltins();
        }
        return null;
    }

    private static int[] grid(OpArguments args) {
        int[] grid = {1, 1, 1};
        String key = args.has("dispatch") ? "dispatch" : args.has("threads") ? "threads" : null;
        if (key != null) {
            double[] size = args.getVector(key);
            for (int i = 0; i < Math.min(3, size.length); i++) {
                grid[i] = Values.toInt32(size[i]);
            }
        } else {
            grid[0] = args.getInt("x", 1);
            grid[1] = args.getInt("y", 1);
            grid[2] = args.getInt("z", 1);
        }
        if (grid[0] < 0 || grid[1] < 0 || grid[2] < 0) {
            throw args.error("negative dispatch size [" + grid[0] + ", " + grid[1] + ", " + grid[2] + "]");
        }
        return grid;
    }

    private static int[] workgroupSize(FunctionDef shader) {
        int[] size = DEFAULT_WORKGROUP.clone();
        List<Integer> declared = shader.workgroupSize();
        if (!declared.isEmpty()) {
            size = new int[]{1, 1, 1};
            for (int i = 0; i < Math.min(3, declared.size()); i++) {
                size[i] = Math.max(1, declared.get(i));
            }
        }
        return size;
    }

    private Object draw(FunctionGraph graph, int index) {
        OpArguments args = resolveArgs(graph, index);
        Map<?, ?> pipeline = args.get("pipeline") instanceof Map<?, ?> m ? m : Map.of();
        new SoftwareRasterizer(context, this::invokeShader).draw(
                args.getString("target"),
                function(args.getString("vertex")),
                function(args.getString("fragment")),
                args.getInt("count"),
                pipeline);
        return null;
    }
}
