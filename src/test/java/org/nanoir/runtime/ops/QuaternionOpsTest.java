package org.nanoir.runtime.ops;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.runtime.EvaluationContext;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.mock;

@Tag("unit")
class QuaternionOpsTest {

    private static final double EPS = 1e-9;

    private final EvaluationContext ctx = mock(EvaluationContext.class);

    private Object exec(BuiltinOp op, Map<String, Object> args) {
        return OpRegistry.get(op).execute(ctx, OpArguments.of(op, args));
    }

    private static void assertVector(double[] actual, double... expected) {
        assertThat(actual).hasSize(expected.length);
        for (int i = 0; i < expected.length; i++) {
            assertThat(actual[i]).as("component %d", i).isCloseTo(expected[i], within(EPS));
        }
    }

    @Test
    void rotate_quarterTurnAboutZ() {
        double[] q = (double[]) exec(BuiltinOp.QUAT, Map.of("axis", new double[]{0, 0, 1}, "angle", Math.PI / 2));

        double[] rotated = (double[]) exec(BuiltinOp.QUAT_ROTATE, Map.of("v", new double[]{1, 0, 0}, "q", q));

        assertVector(rotated, 0, 1, 0);
    }

    @Test
    void multiply_byIdentityKeepsTheQuaternion() {
        double[] q = {0.1, 0.2, 0.3, 0.9};
        double[] identity = (double[]) exec(BuiltinOp.QUAT_IDENTITY, Map.of());

        assertVector((double[]) exec(BuiltinOp.QUAT_MUL, Map.of("a", q, "b", identity)), q);
        assertVector((double[]) exec(BuiltinOp.QUAT_MUL, Map.of("a", identity, "b", q)), q);
    }

    @Test
    void slerp_halfwayBetweenIdentityAndHalfTurn() {
        double[] a = {0, 0, 0, 1};
        double[] b = {0, 0, 1, 0};

        double[] mid = (double[]) exec(BuiltinOp.QUAT_SLERP, Map.of("a", a, "b", b, "t", 0.5));

        double h = Math.sqrt(0.5);
        assertVector(mid, 0, 0, h, h);
    }

    @Test
    void toMatrix_matchesRotate() {
        double[] q = (double[]) exec(BuiltinOp.QUAT, Map.of("axis", new double[]{1, 0, 0}, "angle", Math.PI / 2));

        double[] m = (double[]) exec(BuiltinOp.QUAT_TO_FLOAT4X4, Map.of("q", q));
        double[] viaMatrix = (double[]) exec(BuiltinOp.MAT_MUL, Map.of("a", m, "b", new double[]{0, 1, 0, 1}));

        assertVector(viaMatrix, 0, 0, 1, 1);
    }
}
