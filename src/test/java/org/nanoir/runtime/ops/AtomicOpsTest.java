package org.nanoir.runtime.ops;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.ResourceDef;
import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.junit.extensions.logging.LogWatchExtension;
import org.nanoir.runtime.EvaluationContext;
import org.nanoir.runtime.InterpreterException;
import org.nanoir.testutils.IrFixtures;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class AtomicOpsTest {

    private EvaluationContext ctx;

    @BeforeEach
    void setUp() {
        ctx = new EvaluationContext(IrFixtures.document(List.of(ResourceDef.atomicCounter("counter", 2)),
                FunctionDef.cpu("main", List.of())), Map.of());
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    private Object exec(BuiltinOp op, Map<String, Object> args) {
        return OpRegistry.get(op).execute(ctx, OpArguments.of(op, args));
    }

    @Test
    void add_returnsThePreviousValue() {
        // Arrange
        exec(BuiltinOp.ATOMIC_STORE, Map.of("counter", "counter", "value", 5.0));

        // Act
        Object first = exec(BuiltinOp.ATOMIC_ADD, Map.of("counter", "counter", "value", 3.0));
        Object second = exec(BuiltinOp.ATOMIC_ADD, Map.of("counter", "counter", "value", 7.0));

        // Assert
        assertThat(first).isEqualTo(5.0);
        assertThat(second).isEqualTo(8.0);
        assertThat(exec(BuiltinOp.ATOMIC_LOAD, Map.of("counter", "counter"))).isEqualTo(15.0);
    }

    @Test
    void minMaxExchangeAndSub_onASecondSlot() {
        Map<String, Object> slot1 = Map.of("counter", "counter", "index", 1.0, "value", 10.0);
        exec(BuiltinOp.ATOMIC_EXCHANGE, slot1);

        assertThat(exec(BuiltinOp.ATOMIC_MIN, Map.of("counter", "counter", "index", 1.0, "value", 4.0))).isEqualTo(10.0);
        assertThat(exec(BuiltinOp.ATOMIC_MAX, Map.of("counter", "counter", "index", 1.0, "value", 6.0))).isEqualTo(4.0);
        assertThat(exec(BuiltinOp.ATOMIC_SUB, Map.of("counter", "counter", "index", 1.0, "value", 1.0))).isEqualTo(6.0);
        assertThat(exec(BuiltinOp.ATOMIC_LOAD, Map.of("counter", "counter", "index", 1.0))).isEqualTo(5.0);
        assertThat(exec(BuiltinOp.ATOMIC_LOAD, Map.of("counter", "counter"))).isEqualTo(0.0);
    }

    @Test
    void add_wrapsAt32Bits() {
        exec(BuiltinOp.ATOMIC_STORE, Map.of("counter", "counter", "value", (double) Integer.MAX_VALUE));

        exec(BuiltinOp.ATOMIC_ADD, Map.of("counter", "counter", "value", 1.0));

        assertThat(exec(BuiltinOp.ATOMIC_LOAD, Map.of("counter", "counter"))).isEqualTo((double) Integer.MIN_VALUE);
    }

    @Test
    void slotOutOfRange_fails() {
        assertThatThrownBy(() -> exec(BuiltinOp.ATOMIC_ADD, Map.of("counter", "counter", "index", 2.0, "value", 1.0)))
                .isInstanceOf(InterpreterException.class)
                .hasMessageContaining("counter slot 2 out of bounds for 'counter' with 2 slots");
    }
}
