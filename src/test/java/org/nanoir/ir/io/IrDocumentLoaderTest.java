package org.nanoir.ir.io;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.nanoir.ir.Edge;
import org.nanoir.ir.EdgeType;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.FunctionType;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.Node;
import org.nanoir.ir.ResourceDef;
import org.nanoir.ir.ResourceSize;
import org.nanoir.ir.ResourceType;
import org.nanoir.ir.validation.DocumentValidator;
import org.nanoir.junit.extensions.logging.LogWatchExtension;
import org.nanoir.runtime.EvaluationContext;
import org.nanoir.runtime.Executor;
import org.nanoir.testutils.IrFixtures;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class IrDocumentLoaderTest {

    private final IrDocumentLoader loader = new IrDocumentLoader();

    @Test
    void load_shouldReadTheDocumentModel() {
        IRDocument doc = IrFixtures.load("doubling.json");

        assertThat(doc.meta().name()).isEqualTo("doubling");
        assertThat(doc.entryPoint()).isEqualTo("main");

        ResourceDef out = doc.findResource("out").orElseThrow();
        assertThat(out.type()).isEqualTo(ResourceType.BUFFER);
        assertThat(out.size().mode()).isEqualTo(ResourceSize.Mode.FIXED);
        assertThat(out.size().fixedScalar()).isEqualTo(4);
        assertThat(out.persistence().cpuAccess()).isTrue();

        FunctionDef main = doc.findFunction("main").orElseThrow();
        assertThat(main.type()).isEqualTo(FunctionType.CPU);
        assertThat(main.nodes()).extracting(Node::getId).containsExactly("loop", "idx", "dbl", "store", "last", "ret");
        assertThat(main.findNode("store").orElseThrow().getString("buffer")).isEqualTo("out");
        assertThat(main.edges()).isEmpty();
    }

    @Test
    @Tag("integration")
    void loadedFixture_shouldValidateAndRun() {
        IRDocument doc = IrFixtures.load("doubling.json");
        assertThat(new DocumentValidator().validate(doc).isValid()).isTrue();

        try (EvaluationContext ctx = new EvaluationContext(doc, Map.of())) {
            Object result = new Executor(ctx).run();

            assertThat(result).isEqualTo(6.0);
            assertThat(ctx.getResource("out").snapshot()).containsExactly(0.0, 2.0, 4.0, 6.0);
        }
    }

    @Test
    void parse_shouldKeepUnknownNodeKeysInThePropertyBag() throws IrLoadException {
        String json = """
                {
                  "entryPoint": "main",
                  "functions": [{
                    "id": "main", "type": "cpu",
                    "nodes": [{ "id": "n", "op": "literal", "val": [1, 2], "x-editor": { "pos": [10, 20] } }]
                  }]
                }
                """;

        IRDocument doc = loader.parse(json);

        Node node = doc.functions().get(0).nodes().get(0);
        assertThat(node.getProperties()).containsOnlyKeys("val", "x-editor");
        assertThat(node.get("val")).isEqualTo(List.of(1, 2));
        assertThat(node.get("x-editor")).isEqualTo(Map.of("pos", List.of(10, 20)));
        assertThat(doc.inputs()).isEmpty();
        assertThat(doc.resources()).isEmpty();
    }

    @Test
    void parse_shouldRetainResourcesUnlessTheDocumentOptsOut() throws IrLoadException {
        String json = """
                {
                  "entryPoint": "main",
                  "resources": [
                    { "id": "kept", "type": "buffer", "dataType": "float", "size": { "mode": "fixed", "value": 1 },
                      "persistence": { "clearEveryFrame": false } },
                    { "id": "scratch", "type": "buffer", "dataType": "float", "size": { "mode": "fixed", "value": 1 },
                      "persistence": { "retain": false, "clearValue": 2 } }
                  ],
                  "functions": [{ "id": "main", "type": "cpu", "nodes": [] }]
                }
                """;

        IRDocument doc = loader.parse(json);

        assertThat(doc.findResource("kept").orElseThrow().persistence().retain()).isTrue();
        assertThat(doc.findResource("scratch").orElseThrow().persistence().clearsEachFrame()).isTrue();
        assertThat(doc.findResource("scratch").orElseThrow().persistence().clearValue()).isEqualTo(2);
    }

    @Test
    void write_shouldProduceJsonThatParsesBackToTheSameModel() throws IrLoadException {
        FunctionDef main = FunctionDef.cpu("main", List.of(
                        Node.of("seven", "literal").with("val", 7.0),
                        Node.of("ret", "func_return").with("val", "seven")))
                .withEdges(List.of(Edge.data("seven", "ret", "val")));
        IRDocument doc = IrFixtures.document(List.of(ResourceDef.atomicCounter("hits", 2)), main);

        String json = loader.write(doc);
        IRDocument back = loader.parse(json);

        assertThat(json).contains("\"op\" : \"func_return\"").doesNotContain("dedupKey");
        assertThat(back.entryPoint()).isEqualTo("main");
        assertThat(back.resources()).containsExactly(ResourceDef.atomicCounter("hits", 2));
        FunctionDef parsed = back.functions().get(0);
        assertThat(parsed.edges()).containsExactly(new Edge("seven", "val", "ret", "val", EdgeType.DATA));
        assertThat(parsed.nodes()).extracting(Node::getId, Node::getOp)
                .containsExactly(
                        tuple("seven", "literal"),
                        tuple("ret", "func_return"));
        assertThat(parsed.findNode("ret").orElseThrow().get("val")).isEqualTo("seven");
    }

    @Test
    void load_shouldReadFromAPath(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("empty.json");
        Files.writeString(file, "{\"entryPoint\":\"main\",\"functions\":[{\"id\":\"main\",\"type\":\"cpu\"}]}",
                StandardCharsets.UTF_8);

        IRDocument doc = loader.load(file);

        assertThat(doc.functions()).hasSize(1);
        assertThat(doc.functions().get(0).nodes()).isEmpty();
    }

    @Test
    void invalidInput_shouldFailWithALoadException(@TempDir Path dir) {
        assertThatThrownBy(() -> loader.parse("{ \"functions\": [ "))
                .isInstanceOf(IrLoadException.class)
                .hasMessageStartingWith("Invalid IR document JSON:");
        assertThatThrownBy(() -> loader.parse("{\"functions\":[{\"id\":\"f\",\"nodes\":[{\"op\":\"literal\"}]}]}"))
                .isInstanceOf(IrLoadException.class);
        assertThatThrownBy(() -> loader.load(dir.resolve("missing.json")))
                .isInstanceOf(IrLoadException.class)
                .hasMessageContaining("Failed to load IR document from");
    }
}
