package org.nanoir.runtime.ops;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.runtime.EvaluationContext;
import org.nanoir.runtime.InterpreterException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;

@Tag("unit")
class VectorOpsTest {

    private final EvaluationContext ctx = mock(EvaluationContext.class);

    private Object exec(BuiltinOp op, Map<String, Object> args) {
        return OpRegistry.get(op).execute(ctx, OpArguments.of(op, args));
    }

    @Test
    void dotLengthNormalize() {
        assertThat(exec(BuiltinOp.VEC_DOT, Map.of("a", new double[]{1, 2, 3}, "b", new double[]{4, 5, 6}))).isEqualTo(32.0);
        assertThat(exec(BuiltinOp.VEC_LENGTH, Map.of("a", new double[]{3, 4}))).isEqualTo(5.0);
        assertThat((double[]) exec(BuiltinOp.VEC_NORMALIZE, Map.of("a", new double[]{0, 0, 2}))).containsExactly(0.0, 0.0, 1.0);
        assertThat((double[]) exec(BuiltinOp.VEC_NORMALIZE, Map.of("a", new double[]{0, 0}))).containsExactly(0.0, 0.0);
    }

    @Test
    void swizzle_acceptsPositionAndColorNames() {
        double[] v = {1, 2, 3, 4};
        assertThat((double[]) exec(BuiltinOp.VEC_SWIZZLE, Map.of("vec", v, "channels", "wzyx"))).containsExactly(4.0, 3.0, 2.0, 1.0);
        assertThat((double[]) exec(BuiltinOp.VEC_SWIZZLE, Map.of("vec", v, "channels", "rgb"))).containsExactly(1.0, 2.0, 3.0);
        assertThat(exec(BuiltinOp.VEC_SWIZZLE, Map.of("vec", v, "channels", "y"))).isEqualTo(2.0);
    }

    @Test
    void swizzle_rejectsComponentsBeyondTheVector() {
        assertThatThrownBy(() -> exec(BuiltinOp.VEC_SWIZZLE, Map.of("vec", new double[]{1, 2}, "channels", "xz")))
                .isInstanceOf(InterpreterException.class)
                .hasMessageContaining("out of bounds");
    }

    @Test
    void getElement_isBoundsChecked() {
        assertThat(exec(BuiltinOp.VEC_GET_ELEMENT, Map.of("vec", new double[]{7, 8}, "index", 1.0))).isEqualTo(8.0);
        assertThatThrownBy(() -> exec(BuiltinOp.VEC_GET_ELEMENT, Map.of("vec", new double[]{7, 8}, "index", 2.0)))
                .isInstanceOf(InterpreterException.class);
    }

    @Test
    void vecMix_withBooleanSelects() {
        assertThat((double[]) exec(BuiltinOp.VEC_MIX, Map.of("a", new double[]{1, 1}, "b", new double[]{2, 2}, "t", true)))
                .containsExactly(2.0, 2.0);
    }

    @Test
    void colorMix_compositesSourceOverDestination() {
        double[] dst = {0, 0, 1, 1};
        double[] src = {1, 0, 0, 0.5};

        double[] out = (double[]) exec(BuiltinOp.COLOR_MIX, Map.of("a", dst, "b", src));

        assertThat(out[0]).isCloseTo(0.5, within(1e-9));
        assertThat(out[1]).isCloseTo(0.0, within(1e-9));
        assertThat(out[2]).isCloseTo(0.5, within(1e-9));
        assertThat(out[3]).isCloseTo(1.0, within(1e-9));
    }

    @Test
    void colorMix_withoutCoverageIsTransparentBlack() {
        double[] out = (double[]) exec(BuiltinOp.COLOR_MIX, Map.of("a", new double[]{1, 1, 1, 0}, "b", new double[]{1, 0, 0, 0}));

        assertThat(out).containsExactly(0.0, 0.0, 0.0, 0.0);
    }
}
