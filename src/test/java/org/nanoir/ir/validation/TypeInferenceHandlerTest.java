package org.nanoir.ir.validation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.nanoir.ir.Edge;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.InputDef;
import org.nanoir.ir.Node;
import org.nanoir.ir.PortDef;
import org.nanoir.ir.diagnostics.Diagnostic;
import org.nanoir.ir.diagnostics.DiagnosticsEngine;
import org.nanoir.ir.schema.IrValueType;
import org.nanoir.testutils.IrFixtures;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TypeInferenceHandlerTest {

    private final DocumentValidator validator = new DocumentValidator();
    private final TypeInferenceHandler inference = new TypeInferenceHandler(DocumentValidator.DEFAULT_IMPLICIT_TARGETS);

    @Test
    @DisplayName("Adding a float3 node to a float4 node is rejected before anything runs")
    void mismatchedVectorWidths_shouldBeReported() {
        // Arrange
        FunctionDef main = FunctionDef.cpu("main", List.of(
                Node.of("v3", "float3").with("x", 1).with("y", 2).with("z", 3),
                Node.of("v4", "float4").with("x", 1).with("y", 2).with("z", 3).with("w", 4),
                Node.of("sum", "math_add").with("a", "v3").with("b", "v4"),
                Node.of("ret", "func_return").with("val", "sum")));

        // Act
        ValidationResult result = validator.validate(IrFixtures.document(List.of(), main));

        // Assert
        assertThat(result.errors()).singleElement().satisfies(error -> {
            assertThat(error.message()).isEqualTo("Type Mismatch at 'b': expected float3, got float4");
            assertThat(error.pathString()).isEqualTo("functions[0].nodes[2].b");
            assertThat(error.nodeId()).isEqualTo("sum");
        });
    }

    @Test
    void intsAndFloats_shouldBeInterchangeable() {
        FunctionDef main = FunctionDef.cpu("main", List.of(
                Node.of("loop", "flow_loop").with("count", 4).with("exec_body", "ret"),
                Node.of("i", "loop_index").with("loop", "loop"),
                Node.of("half", "math_mul").with("a", "i").with("b", 0.5),
                Node.of("v", "float2").with("x", "i").with("y", "half"),
                Node.of("first", "vec_get_element").with("vec", "v").with("index", "half"),
                Node.of("ret", "func_return").with("val", "first")));
        IRDocument doc = IrFixtures.document(List.of(), main);

        Map<String, IrValueType> types = inference.inferTypes(doc, main);

        assertThat(validator.validate(doc).isValid()).isTrue();
        assertThat(types).containsEntry("i", IrValueType.INT)
                .containsEntry("half", IrValueType.FLOAT)
                .containsEntry("v", IrValueType.FLOAT2)
                .containsEntry("first", IrValueType.FLOAT);
    }

    @Test
    void inferredShapes_shouldFollowTheMatchedOverload() {
        FunctionDef main = FunctionDef.cpu("main", List.of(
                Node.of("color", "literal").with("val", List.of(1.0, 0.5, 0.25, 1.0)),
                Node.of("scaled", "math_mul").with("a", "color").with("b", 2),
                Node.of("rgb", "vec_swizzle").with("vec", "scaled").with("channels", "xyz"),
                Node.of("len", "vec_length").with("a", "rgb"),
                Node.of("bright", "math_gt").with("a", "len").with("b", 1),
                Node.of("m3", "mat_identity").with("size", 3),
                Node.of("moved", "mat_mul").with("a", "m3").with("b", "rgb"),
                Node.of("opaque", "math_eq").with("a", "color").with("b", List.of(1, 1, 1, 1))));

        Map<String, IrValueType> types = inference.inferTypes(IrFixtures.document(List.of(), main), main);

        assertThat(types).containsExactly(
                Map.entry("color", IrValueType.FLOAT4),
                Map.entry("scaled", IrValueType.FLOAT4),
                Map.entry("rgb", IrValueType.FLOAT3),
                Map.entry("len", IrValueType.FLOAT),
                Map.entry("bright", IrValueType.BOOL),
                Map.entry("m3", IrValueType.FLOAT3X3),
                Map.entry("moved", IrValueType.FLOAT3),
                Map.entry("opaque", IrValueType.FLOAT4));
    }

    @Test
    void dataEdges_shouldCarryTheSourceShape() {
        FunctionDef main = FunctionDef.cpu("main", List.of(
                        Node.of("n", "vec_normalize"),
                        Node.of("src", "float3").with("x", 0).with("y", 1).with("z", 0),
                        Node.of("d", "vec_dot").with("a", List.of(1.0, 0.0)).with("b", "n")))
                .withEdges(List.of(Edge.data("src", "n", "a")));
        IRDocument doc = IrFixtures.document(List.of(), main);
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        inference.validate(doc, diagnostics);

        assertThat(inference.inferTypes(doc, main)).containsEntry("n", IrValueType.FLOAT3);
        assertThat(diagnostics.getErrors()).extracting(Diagnostic::message)
                .containsExactly("Type Mismatch at 'b': expected float2, got float3");
    }

    @Test
    void declaredInputs_shouldTypeTheirReferences() {
        FunctionDef shader = FunctionDef.shader("kernel", List.of(
                        Node.of("gx", "vec_get_element").with("vec", "gid").with("index", 0),
                        Node.of("uv", "math_add").with("a", "offset").with("b", List.of(1, 2, 3))))
                .withInputs(List.of(new PortDef("gid", "int3", "global_invocation_id")));
        IRDocument doc = IrFixtures.document(List.of(InputDef.of("offset", "float2")), List.of(), List.of(),
                FunctionDef.cpu("main", List.of()), shader);

        ValidationResult result = validator.validate(doc);

        assertThat(result.errors()).extracting(Diagnostic::message)
                .containsExactly("Type Mismatch at 'b': expected float2, got float3");
        assertThat(inference.inferTypes(doc, shader)).containsEntry("gx", IrValueType.FLOAT);
    }

    @Test
    void untypedReferences_shouldMatchAnyOverload() {
        FunctionDef shader = FunctionDef.shader("kernel", List.of(
                Node.of("id", "builtin_get").with("name", "global_invocation_id"),
                Node.of("sum", "math_add").with("a", "id").with("b", "time"),
                Node.of("x", "vec_get_element").with("vec", "sum").with("index", 0),
                Node.of("cmp", "math_lt").with("a", "sum").with("b", List.of(1, 2, 3)),
                Node.of("len", "vec_length").with("a", "id")));
        IRDocument doc = IrFixtures.document(List.of(), List.of(), List.of(), FunctionDef.cpu("main", List.of()), shader);

        assertThat(validator.validate(doc).isValid()).isTrue();
        assertThat(inference.inferTypes(doc, shader))
                .containsEntry("sum", IrValueType.ANY)
                .containsEntry("cmp", IrValueType.FLOAT3)
                .containsEntry("len", IrValueType.FLOAT);
    }
}
