package org.nanoir.ir.validation;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.InputDef;
import org.nanoir.ir.Node;
import org.nanoir.ir.PortDef;
import org.nanoir.ir.ResourceDef;
import org.nanoir.ir.ResourceSize;
import org.nanoir.ir.VariableDef;
import org.nanoir.ir.validation.ScopeResolver.ReferenceKind;
import org.nanoir.testutils.IrFixtures;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ScopeResolverTest {

    private static ScopeResolver resolver() {
        FunctionDef main = FunctionDef.cpu("main", List.of(
                        Node.of("n", "literal").with("val", 1.0),
                        Node.of("shadow", "literal").with("val", 2.0),
                        Node.of("loop", "flow_loop").with("count", 2).with("tag", "rows")))
                .withLocalVars(List.of(VariableDef.of("acc", "float"), VariableDef.of("shadow", "float")))
                .withInputs(List.of(PortDef.of("arg", "float")));
        IRDocument doc = IrFixtures.document(
                List.of(InputDef.of("speed", "float"), InputDef.of("photo", "texture2d")),
                List.of(ResourceDef.buffer("buf", "float", ResourceSize.fixed(2))),
                List.of(),
                main, FunctionDef.shader("kernel", List.of()));
        return new ScopeResolver(doc, main, List.of("screen"));
    }

    @Test
    void resolve_shouldClassifyEachNamespace() {
        ScopeResolver scope = resolver();

        assertThat(scope.resolve("n")).contains(ReferenceKind.NODE);
        assertThat(scope.resolve("acc")).contains(ReferenceKind.LOCAL_VARIABLE);
        assertThat(scope.resolve("arg")).contains(ReferenceKind.FUNCTION_INPUT);
        assertThat(scope.resolve("speed")).contains(ReferenceKind.DOCUMENT_INPUT);
        assertThat(scope.resolve("buf")).contains(ReferenceKind.RESOURCE);
        assertThat(scope.resolve("kernel")).contains(ReferenceKind.FUNCTION);
        assertThat(scope.resolve("time")).contains(ReferenceKind.BUILTIN);
        assertThat(scope.resolve("rows")).contains(ReferenceKind.LOOP_TAG);
        assertThat(scope.resolve("screen")).contains(ReferenceKind.IMPLICIT_TARGET);
    }

    @Test
    void resolve_shouldPreferNodesOverVariables() {
        assertThat(resolver().resolve("shadow")).contains(ReferenceKind.NODE);
    }

    @Test
    void unknownIds_shouldNotResolve() {
        ScopeResolver scope = resolver();

        assertThat(scope.resolve("ghost")).isEmpty();
        assertThat(scope.resolve("")).isEmpty();
        assertThat(scope.resolve(null)).isEmpty();
        assertThat(scope.exists("ghost")).isFalse();
        assertThat(scope.exists("main")).isTrue();
    }

    @Test
    void isResource_shouldAcceptTextureInputsAndImplicitTargets() {
        ScopeResolver scope = resolver();

        assertThat(scope.isResource("buf")).isTrue();
        assertThat(scope.isResource("photo")).isTrue();
        assertThat(scope.isResource("screen")).isTrue();
        assertThat(scope.isResource("speed")).isFalse();
        assertThat(scope.isResource("n")).isFalse();
    }
}
