package org.nanoir.runtime.ops;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.runtime.EvaluationContext;
import org.nanoir.runtime.InterpreterException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * Unit tests for the math and cast handlers. The handlers are pure, so the context is a mock
 * that must never be touched.
 */
@Tag("unit")
@ExtendWith(MockitoExtension.class)
class MathOpsTest {

    @Mock
    private EvaluationContext ctx;

    private Object exec(BuiltinOp op, Map<String, Object> args) {
        return OpRegistry.get(op).execute(ctx, OpArguments.of(op, args));
    }

    @Test
    void add_scalarsAndBroadcastVectors() {
        assertThat(exec(BuiltinOp.MATH_ADD, Map.of("a", 2.0, "b", 3.0))).isEqualTo(5.0);
        assertThat((double[]) exec(BuiltinOp.MATH_ADD, Map.of("a", new double[]{1, 2, 3}, "b", 1.0)))
                .containsExactly(2.0, 3.0, 4.0);
        assertThat((double[]) exec(BuiltinOp.MATH_MUL, Map.of("a", 2.0, "b", new double[]{1, 2})))
                .containsExactly(2.0, 4.0);
        verifyNoInteractions(ctx);
    }

    @Test
    void binary_rejectsVectorsOfDifferentLength() {
        assertThatThrownBy(() -> exec(BuiltinOp.MATH_SUB, Map.of("a", new double[]{1, 2}, "b", new double[]{1, 2, 3})))
                .isInstanceOf(InterpreterException.class)
                .hasMessageStartingWith("Runtime Error:")
                .hasMessageContaining("vector length mismatch (2 vs 3)");
    }

    @Test
    void comparisons_yieldBooleansForScalarsAndMasksForVectors() {
        assertThat(exec(BuiltinOp.MATH_GT, Map.of("a", 2.0, "b", 1.0))).isEqualTo(true);
        assertThat(exec(BuiltinOp.MATH_EQ, Map.of("a", 2.0, "b", 1.0))).isEqualTo(false);
        assertThat((double[]) exec(BuiltinOp.MATH_LT, Map.of("a", new double[]{0, 5}, "b", 1.0)))
                .containsExactly(1.0, 0.0);
    }

    @Test
    void round_isHalfUp() {
        assertThat(exec(BuiltinOp.MATH_ROUND, Map.of("val", 2.5))).isEqualTo(3.0);
        assertThat(exec(BuiltinOp.MATH_ROUND, Map.of("val", -2.5))).isEqualTo(-2.0);
        assertThat(exec(BuiltinOp.MATH_TRUNC, Map.of("val", -2.7))).isEqualTo(-2.0);
    }

    @Test
    void atan2_takesYThenX() {
        assertThat((double) exec(BuiltinOp.MATH_ATAN2, Map.of("a", 1.0, "b", 0.0))).isCloseTo(Math.PI / 2, within(1e-12));
    }

    @Test
    void clampStepAndSmoothstep() {
        assertThat(exec(BuiltinOp.MATH_CLAMP, Map.of("val", 5.0, "min", 0.0, "max", 1.0))).isEqualTo(1.0);
        assertThat(exec(BuiltinOp.MATH_STEP, Map.of("edge", 0.5, "x", 0.2))).isEqualTo(0.0);
        assertThat(exec(BuiltinOp.MATH_SMOOTHSTEP, Map.of("edge0", 0.0, "edge1", 1.0, "x", 0.5))).isEqualTo(0.5);
        assertThat((double[]) exec(BuiltinOp.MATH_MIX, Map.of("a", new double[]{0, 10}, "b", new double[]{10, 20}, "t", 0.5)))
                .containsExactly(5.0, 15.0);
    }

    @Test
    void floatClassification() {
        assertThat(exec(BuiltinOp.MATH_IS_NAN, Map.of("val", Double.NaN))).isEqualTo(true);
        assertThat(exec(BuiltinOp.MATH_IS_FINITE, Map.of("val", Double.POSITIVE_INFINITY))).isEqualTo(false);
        assertThat((double[]) exec(BuiltinOp.MATH_IS_INF, Map.of("val", new double[]{1, Double.NEGATIVE_INFINITY})))
                .containsExactly(0.0, 1.0);
        assertThat(exec(BuiltinOp.MATH_FLUSH_SUBNORMAL, Map.of("val", 1e-40))).isEqualTo(0.0);
    }

    @Test
    void frexp_splitsMantissaAndExponent() {
        assertThat(exec(BuiltinOp.MATH_FREXP_MANTISSA, Map.of("val", 8.0))).isEqualTo(0.5);
        assertThat(exec(BuiltinOp.MATH_FREXP_EXPONENT, Map.of("val", 8.0))).isEqualTo(4.0);
        assertThat(exec(BuiltinOp.MATH_LDEXP, Map.of("val", 0.5, "exp", 4.0))).isEqualTo(8.0);
    }

    @Test
    void logic_usesTruthiness() {
        assertThat(exec(BuiltinOp.MATH_AND, Map.of("a", true, "b", 1.0))).isEqualTo(true);
        assertThat(exec(BuiltinOp.MATH_XOR, Map.of("a", true, "b", 1.0))).isEqualTo(false);
        assertThat(exec(BuiltinOp.MATH_NOT, Map.of("val", 0.0))).isEqualTo(true);
    }

    @Test
    void casts_truncateTowardZero() {
        assertThat(exec(BuiltinOp.STATIC_CAST_INT, Map.of("val", -3.9))).isEqualTo(-3.0);
        assertThat(exec(BuiltinOp.STATIC_CAST_UINT, Map.of("val", -3.9))).isEqualTo(0.0);
        assertThat(exec(BuiltinOp.STATIC_CAST_BOOL, Map.of("val", 0.25))).isEqualTo(true);
        assertThat((double[]) exec(BuiltinOp.STATIC_CAST_INT, Map.of("val", new double[]{1.5, 2.5})))
                .containsExactly(1.0, 2.0);
    }
}
