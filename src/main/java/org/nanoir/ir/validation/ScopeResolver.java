package org.nanoir.ir.validation;

import org.nanoir.ir.Builtin;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.InputDef;
import org.nanoir.ir.Node;
import org.nanoir.ir.PortDef;
import org.nanoir.ir.ResourceDef;
import org.nanoir.ir.VariableDef;
import org.nanoir.ir.schema.BuiltinOp;

import java.util.Collection;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves a string reference used inside a function to the kind of entity it names.
 * <p>
 * Lookup order: node, local variable, function input, document input, resource,
 * function, builtin, loop tag, implicit target. The first match wins, so a local
 * variable shadows a document input of the same name.
 */
public class ScopeResolver {

    /**
     * The namespaces a reference can resolve into.
     */
    public enum ReferenceKind {
        NODE,
        LOCAL_VARIABLE,
        FUNCTION_INPUT,
        DOCUMENT_INPUT,
        RESOURCE,
        FUNCTION,
        BUILTIN,
        LOOP_TAG,
        IMPLICIT_TARGET
    }

    private final Set<String> nodeIds = new HashSet<>();
    private final Set<String> localVars = new HashSet<>();
    private final Set<String> functionInputs = new HashSet<>();
    private final Set<String> documentInputs = new HashSet<>();
    private final Set<String> resources = new HashSet<>();
    private final Set<String> textureInputs = new HashSet<>();
    private final Set<String> functions = new HashSet<>();
    private final Set<String> loopTags = new HashSet<>();
    private final Set<String> implicitTargets;

    /**
     * Creates a resolver for references made inside one function.
     *
     * @param document        The owning document.
     * @param function        The function the reference appears in.
     * @param implicitTargets Ids that are always valid targets (e.g. {@code screen}).
     */
    public ScopeResolver(IRDocument document, FunctionDef function, Collection<String> implicitTargets) {
        for (Node node : function.nodes()) {
            nodeIds.add(node.getId());
            if (BuiltinOp.FLOW_LOOP.id().equals(node.getOp()) && node.getString("tag") != null) {
                loopTags.add(node.getString("tag"));
            }
        }
        function.localVars().stream().map(VariableDef::id).forEach(localVars::add);
        function.inputs().stream().map(PortDef::id).forEach(functionInputs::add);
        for (InputDef input : document.inputs()) {
            documentInputs.add(input.id());
            if ("texture2d".equals(input.type())) {
                textureInputs.add(input.id());
            }
        }
        document.resources().stream().map(ResourceDef::id).forEach(resources::add);
        document.functions().stream().map(FunctionDef::id).forEach(functions::add);
        this.implicitTargets = Set.copyOf(implicitTargets);
    }

    public Optional<ReferenceKind> resolve(String id) {
        if (id == null || id.isEmpty()) return Optional.empty();
        if (nodeIds.contains(id)) return Optional.of(ReferenceKind.NODE);
        if (localVars.contains(id)) return Optional.of(ReferenceKind.LOCAL_VARIABLE);
        if (functionInputs.contains(id)) return Optional.of(ReferenceKind.FUNCTION_INPUT);
        if (documentInputs.contains(id)) return Optional.of(ReferenceKind.DOCUMENT_INPUT);
        if (resources.contains(id)) return Optional.of(ReferenceKind.RESOURCE);
        if (functions.contains(id)) return Optional.of(ReferenceKind.FUNCTION);
        if (Builtin.isBuiltinName(id)) return Optional.of(ReferenceKind.BUILTIN);
        if (loopTags.contains(id)) return Optional.of(ReferenceKind.LOOP_TAG);
        if (implicitTargets.contains(id)) return Optional.of(ReferenceKind.IMPLICIT_TARGET);
        return Optional.empty();
    }

    public boolean exists(String id) {
        return resolve(id).isPresent();
    }

    public boolean isResource(String id) {
        return resources.contains(id) || textureInputs.contains(id) || implicitTargets.contains(id);
    }
}
