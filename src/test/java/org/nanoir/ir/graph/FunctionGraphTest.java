package org.nanoir.ir.graph;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.nanoir.ir.Edge;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.InputDef;
import org.nanoir.ir.Node;
import org.nanoir.ir.PortDef;
import org.nanoir.ir.VariableDef;
import org.nanoir.ir.graph.FunctionGraph.NodeRef;
import org.nanoir.ir.graph.FunctionGraph.SymbolRef;
import org.nanoir.testutils.IrFixtures;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class FunctionGraphTest {

    private static FunctionDef sample() {
        return FunctionDef.cpu("main", List.of(
                        Node.of("lit", "literal").with("val", "hello"),
                        Node.of("sum", "math_add").with("a", "lit").with("b", "acc"),
                        Node.of("store", "var_set").with("var", "acc").with("val", "sum").with("next", "ret"),
                        Node.of("ret", "func_return").with("val", "acc"),
                        Node.of("t", "math_mul").with("a", "time").with("b", "scale"),
                        Node.of("get", "var_get").with("var", "acc"),
                        Node.of("sw", "vec_swizzle").with("vec", "lit").with("channels", "x")))
                .withLocalVars(List.of(VariableDef.of("acc", "float")))
                .withInputs(List.of(PortDef.of("n", "int")));
    }

    @Test
    void entryNodes_areExecutableNodesWithoutIncomingExecution() {
        FunctionGraph graph = FunctionGraph.build(sample(), null);

        assertThat(graph.entryNodes()).containsExactly(graph.indexOf("store"));
        assertThat(graph.isExecutable(graph.indexOf("ret"))).isTrue();
        assertThat(graph.isExecutable(graph.indexOf("sum"))).isFalse();
    }

    @Test
    void successors_shouldFollowExecutionPorts() {
        FunctionGraph graph = FunctionGraph.build(sample(), null);

        assertThat(graph.successors(graph.indexOf("store"), Edge.PORT_EXEC_OUT)).containsExactly(graph.indexOf("ret"));
        assertThat(graph.successors(graph.indexOf("ret"), Edge.PORT_EXEC_OUT)).isEmpty();
        assertThat(graph.indexOf("missing")).isEqualTo(-1);
    }

    @Test
    void template_shouldResolveNodeAndSymbolReferences() {
        IRDocument doc = IrFixtures.document(List.of(InputDef.of("scale", "float")), List.of(), List.of(), sample());
        FunctionGraph graph = FunctionGraph.build(sample(), doc);

        Map<String, Object> sum = graph.template(graph.indexOf("sum"));
        assertThat(sum).containsEntry("a", new NodeRef(graph.indexOf("lit")))
                .containsEntry("b", new SymbolRef("acc"));

        Map<String, Object> t = graph.template(graph.indexOf("t"));
        assertThat(t).containsEntry("a", new SymbolRef("time"))
                .containsEntry("b", new SymbolRef("scale"));
    }

    @Test
    void template_shouldKeepNameSlotsAndLiteralsRaw() {
        FunctionGraph graph = FunctionGraph.build(sample(), null);

        assertThat(graph.template(graph.indexOf("store"))).containsEntry("var", "acc")
                .containsEntry("val", new NodeRef(graph.indexOf("sum")))
                .doesNotContainKey("next");
        assertThat(graph.template(graph.indexOf("get"))).containsEntry("var", "acc");
        assertThat(graph.template(graph.indexOf("sw"))).containsEntry("channels", "x");
        assertThat(graph.template(graph.indexOf("lit"))).containsEntry("val", "hello");
    }

    @Test
    void authoredEdges_shouldReplaceReconstructionAndFeedMissingPorts() {
        FunctionDef fn = FunctionDef.cpu("main", List.of(
                        Node.of("seven", "literal").with("val", 7.0),
                        Node.of("first", "var_set").with("var", "v").with("val", 1.0),
                        Node.of("ret", "func_return")))
                .withEdges(List.of(
                        Edge.data("seven", "ret", "val"),
                        Edge.execution("first", Edge.PORT_EXEC_OUT, "ret")));

        FunctionGraph graph = FunctionGraph.build(fn, null);

        assertThat(graph.edges()).hasSize(2);
        assertThat(graph.entryNodes()).containsExactly(graph.indexOf("first"));
        assertThat(graph.authoredSources(graph.indexOf("ret"))).containsEntry("val", graph.indexOf("seven"));
        assertThat(graph.authoredSources(graph.indexOf("first"))).isEmpty();
    }

    @Test
    void template_shouldResolveReferencesInsideContainers() {
        FunctionDef fn = FunctionDef.cpu("main", List.of(
                Node.of("x", "literal").with("val", 1.0),
                Node.of("arr", "array_construct").with("values", List.of("x", 2.0)),
                Node.of("s", "struct_construct").with("fields", Map.of("p", "x"))));

        FunctionGraph graph = FunctionGraph.build(fn, null);

        assertThat(graph.template(graph.indexOf("arr")).get("values")).isEqualTo(List.of(new NodeRef(0), 2.0));
        assertThat(graph.template(graph.indexOf("s")).get("fields")).isEqualTo(Map.of("p", new NodeRef(0)));
    }
}
