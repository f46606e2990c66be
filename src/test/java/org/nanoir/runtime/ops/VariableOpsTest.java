package org.nanoir.runtime.ops;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.nanoir.ir.FunctionDef;
import org.nanoir.ir.PortDef;
import org.nanoir.ir.TextureFormat;
import org.nanoir.ir.VariableDef;
import org.nanoir.ir.schema.BuiltinOp;
import org.nanoir.runtime.EvaluationContext;
import org.nanoir.runtime.InterpreterException;
import org.nanoir.testutils.IrFixtures;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class VariableOpsTest {

    private EvaluationContext ctx;

    @BeforeEach
    void setUp() {
        FunctionDef main = FunctionDef.cpu("main", List.of())
                .withLocalVars(List.of(VariableDef.of("v", "float2")))
                .withInputs(List.of(PortDef.of("n", "float")));
        ctx = new EvaluationContext(IrFixtures.document(List.of(), main), Map.of());
        ctx.pushFrame("main");
    }

    @AfterEach
    void tearDown() {
        ctx.close();
    }

    private Object exec(BuiltinOp op, Map<String, Object> args) {
        return OpRegistry.get(op).execute(ctx, OpArguments.of(op, args));
    }

    @Test
    void varSet_storesACopy() {
        double[] value = {1, 2};

        exec(BuiltinOp.VAR_SET, Map.of("var", "v", "val", value));
        value[0] = 42;

        assertThat((double[]) exec(BuiltinOp.VAR_GET, Map.of("var", "v"))).containsExactly(1.0, 2.0);
    }

    @Test
    void varSet_acceptsFunctionInputs() {
        exec(BuiltinOp.VAR_SET, Map.of("var", "n", "val", 2.0));

        assertThat(exec(BuiltinOp.VAR_GET, Map.of("var", "n"))).isEqualTo(2.0);
    }

    @Test
    void varSet_rejectsUndeclaredTarget() {
        assertThatThrownBy(() -> exec(BuiltinOp.VAR_SET, Map.of("var", "stray", "val", 1.0)))
                .isInstanceOf(InterpreterException.class)
                .hasMessageContaining("Variable 'stray' is not declared in function 'main'");

        assertThat(ctx.findVar("stray")).isEmpty();
    }

    @Test
    void varGet_ofUnknownVariableFails() {
        assertThatThrownBy(() -> exec(BuiltinOp.VAR_GET, Map.of("var", "missing")))
                .isInstanceOf(InterpreterException.class)
                .hasMessageContaining("Variable 'missing' is not defined");
    }

    @Test
    void constGet_resolvesTextureFormats() {
        assertThat(exec(BuiltinOp.CONST_GET, Map.of("name", "TextureFormat.R8"))).isEqualTo((double) TextureFormat.R8.id());
        assertThat(exec(BuiltinOp.CONST_GET, Map.of("name", "Unknown.X"))).isEqualTo(0.0);
    }

    @Test
    void loopIndexAndBuiltins_readTheCurrentInvocation() {
        ctx.setLoopIndex("loop", 3);
        ctx.setBuiltin("global_invocation_id", new double[]{1, 2, 0});

        assertThat(exec(BuiltinOp.LOOP_INDEX, Map.of("loop", "loop"))).isEqualTo(3.0);
        assertThat((double[]) exec(BuiltinOp.BUILTIN_GET, Map.of("name", "global_invocation_id"))).containsExactly(1.0, 2.0, 0.0);
    }
}
