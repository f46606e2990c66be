package org.nanoir.ir.schema;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class OpSignaturesTest {

    @Test
    void signatureArguments_shouldBeDeclaredByTheOpSchema() {
        Arrays.stream(BuiltinOp.values()).filter(OpSignatures::has).forEach(op -> {
            OpDef def = OpSchemaRegistry.get(op);
            OpSignatures.get(op).forEach(signature -> assertThat(signature.inputs().keySet())
                    .as(op.id())
                    .allMatch(def::declares));
        });
    }

    @Test
    void binaryMath_shouldListSameShapeOverloadsBeforeBroadcasts() {
        assertThat(OpSignatures.get(BuiltinOp.MATH_ADD)).hasSize(10);
        assertThat(OpSignatures.get(BuiltinOp.MATH_ADD).get(2))
                .isEqualTo(OpSignature.of("a", IrValueType.FLOAT3, "b", IrValueType.FLOAT3, IrValueType.FLOAT3));
        assertThat(OpSignatures.get(BuiltinOp.MATH_GT)).hasSize(4)
                .first().extracting(OpSignature::output).isEqualTo(IrValueType.BOOL);
    }

    @Test
    void untypedOps_shouldHaveNoOverloads() {
        assertThat(OpSignatures.has(BuiltinOp.BUFFER_LOAD)).isFalse();
        assertThat(OpSignatures.get(BuiltinOp.CMD_DISPATCH)).isEmpty();
    }
}
