package org.nanoir.runtime;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.IRDocument;
import org.nanoir.ir.Node;
import org.nanoir.ir.Persistence;
import org.nanoir.ir.PortDef;
import org.nanoir.ir.ResourceDef;
import org.nanoir.ir.ResourceSize;
import org.nanoir.junit.extensions.logging.LogWatchExtension;
import org.nanoir.testutils.IrFixtures;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class SoftwareRasterizerTest {

    private static final List<List<Double>> FULLSCREEN = List.of(
            List.of(-1.0, -1.0, 0.0, 1.0), List.of(3.0, -1.0, 0.0, 1.0), List.of(-1.0, 3.0, 0.0, 1.0));
    private static final List<List<Double>> LOWER_LEFT = List.of(
            List.of(-1.0, -1.0, 0.0, 1.0), List.of(1.0, -1.0, 0.0, 1.0), List.of(-1.0, 1.0, 0.0, 1.0));

    private EvaluationContext ctx;

    @AfterEach
    void tearDown() {
        if (ctx != null) ctx.close();
    }

    private static FunctionDef vertexShader(List<List<Double>> positions) {
        return FunctionDef.shader("vs", List.of(
                        Node.of("verts", "literal").with("val", positions),
                        Node.of("pos", "array_extract").with("array", "verts").with("index", "vi"),
                        Node.of("out", "struct_construct").with("position", "pos"),
                        Node.of("ret", "func_return").with("val", "out")))
                .withInputs(List.of(new PortDef("vi", "int", "vertex_index")));
    }

    private static FunctionDef solidFragment(double... rgba) {
        return FunctionDef.shader("fs", List.of(
                Node.of("color", "literal").with("val", List.of(rgba[0], rgba[1], rgba[2], rgba[3])),
                Node.of("ret", "func_return").with("val", "color")));
    }

    private void run(IRDocument doc) {
        ctx = new EvaluationContext(doc, Map.of());
        new Executor(ctx).run();
    }

    private static FunctionDef drawCall(Map<String, Object> pipeline) {
        Node draw = Node.of("draw", "cmd_draw").with("target", "tex").with("vertex", "vs")
                .with("fragment", "fs").with("count", 3);
        if (pipeline != null) {
            draw.with("pipeline", pipeline);
        }
        return FunctionDef.cpu("main", List.of(draw));
    }

    @Test
    void draw_fullscreenTriangleCoversEveryPixel() {
        // Arrange
        IRDocument doc = IrFixtures.document(List.of(ResourceDef.texture("tex", "rgba8", ResourceSize.fixed(4, 4))),
                drawCall(null), vertexShader(FULLSCREEN), solidFragment(1, 0, 0, 1));

        // Act
        run(doc);

        // Assert
        ResourceState tex = ctx.getResource("tex");
        for (int y = 0; y < 4; y++) {
            for (int x = 0; x < 4; x++) {
                assertThat((double[]) tex.getTexel(x, y)).as("texel (%d, %d)", x, y).containsExactly(1.0, 0.0, 0.0, 1.0);
            }
        }
        assertThat(ctx.getLog()).singleElement().satisfies(entry -> {
            assertThat(entry.type()).isEqualTo(ActionLogEntry.ActionType.DRAW);
            assertThat(entry.payload()).containsEntry("vertex", "vs").containsEntry("fragment", "fs").containsEntry("count", 3);
        });
    }

    @Test
    void draw_halfScreenTriangleCoversOnlyItsSide() {
        IRDocument doc = IrFixtures.document(List.of(ResourceDef.texture("tex", "rgba8", ResourceSize.fixed(4, 4))),
                drawCall(null), vertexShader(LOWER_LEFT), solidFragment(0, 1, 0, 1));

        run(doc);

        ResourceState tex = ctx.getResource("tex");
        assertThat((double[]) tex.getTexel(0, 3)).containsExactly(0.0, 1.0, 0.0, 1.0);
        assertThat((double[]) tex.getTexel(3, 0)).containsExactly(0.0, 0.0, 0.0, 0.0);
    }

    @Test
    void draw_blendsOverExistingContent() {
        Map<String, Object> pipeline = Map.of("blend", Map.of(
                "color", Map.of("operation", "add", "srcFactor", "src-alpha", "dstFactor", "one-minus-src-alpha"),
                "alpha", Map.of("operation", "add", "srcFactor", "one", "dstFactor", "one-minus-src-alpha")));
        IRDocument doc = IrFixtures.document(List.of(ResourceDef.texture("tex", "rgba8", ResourceSize.fixed(2, 2))
                        .withPersistence(Persistence.defaults().withClearValue(List.of(0.0, 0.0, 1.0, 1.0)))),
                drawCall(pipeline), vertexShader(FULLSCREEN), solidFragment(1, 0, 0, 0.5));

        run(doc);

        double[] texel = (double[]) ctx.getResource("tex").getTexel(1, 1);
        assertThat(texel[0]).isCloseTo(0.5, within(1e-9));
        assertThat(texel[1]).isCloseTo(0.0, within(1e-9));
        assertThat(texel[2]).isCloseTo(0.5, within(1e-9));
        assertThat(texel[3]).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void draw_requiresAStructFromTheVertexStage() {
        FunctionDef badVertex = FunctionDef.shader("vs", List.of(
                Node.of("ret", "func_return").with("val", 1.0)));
        IRDocument doc = IrFixtures.document(List.of(ResourceDef.texture("tex", "rgba8", ResourceSize.fixed(2, 2))),
                drawCall(null), badVertex, solidFragment(1, 1, 1, 1));

        assertThatThrownBy(() -> run(doc))
                .isInstanceOf(InterpreterException.class)
                .hasMessageContaining("Vertex shader 'vs' must return a struct");
    }

    @Test
    void draw_rejectsUnsupportedTopologies() {
        IRDocument doc = IrFixtures.document(List.of(ResourceDef.texture("tex", "rgba8", ResourceSize.fixed(2, 2))),
                drawCall(Map.of("topology", "line-strip")), vertexShader(FULLSCREEN), solidFragment(1, 1, 1, 1));

        assertThatThrownBy(() -> run(doc))
                .isInstanceOf(InterpreterException.class)
                .hasMessageContaining("Unsupported primitive topology 'line-strip'");
    }

    @Test
    void blend_minAndMaxIgnoreFactors() {
        double[] src = {0.2, 0.8, 0.5, 1.0};
        double[] dst = {0.6, 0.4, 0.5, 0.5};
        Map<String, Object> max = Map.of("color", Map.of("operation", "max"), "alpha", Map.of("operation", "min"));

        assertThat(SoftwareRasterizer.blend(src, dst, max)).containsExactly(0.6, 0.8, 0.5, 0.5);
    }

    @Test
    void blend_defaultsToReplacingTheDestination() {
        double[] src = {0.2, 0.8, 0.5, 1.0};

        assertThat(SoftwareRasterizer.blend(src, new double[]{1, 1, 1, 1}, Map.of())).containsExactly(src);
    }
}
