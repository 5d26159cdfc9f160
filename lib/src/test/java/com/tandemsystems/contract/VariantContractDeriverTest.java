package com.tandemsystems.contract;

import com.tandemsystems.analysis.Outcome;
import com.tandemsystems.analysis.RejectionReason;
import com.tandemsystems.declaration.MessageDeclaration;
import com.tandemsystems.declaration.TypeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tandemsystems.declaration.Declarations.*;
import static org.junit.jupiter.api.Assertions.*;

class VariantContractDeriverTest {

    private VariantContractDeriver deriver;

    @BeforeEach
    void setUp() {
        deriver = new VariantContractDeriver();
    }

    @Test
    void testDerivesContractFromVariant() {
        VariantContract contract = deriver.derive(variant("MsgOne", field("value", "int"), resp(TypeRef.of("int"))));

        assertEquals("MsgOne", contract.variantName());
        assertEquals("msg_one", contract.operationName());
        assertEquals("msg_one_no_wait", contract.noWaitOperationName());
        assertEquals(TypeRef.of("int"), contract.responseType());
    }

    @Test
    void testSignaturesWrapBoxedResponseInResult() {
        VariantContract contract = deriver.derive(variant("MsgOne", resp(TypeRef.of("int"))));

        assertEquals("msg_one(message) -> Result<Integer>", contract.waitSignature().toString());
        assertEquals("Result<Void>", contract.noWaitSignature().returnType().render());
        assertEquals("msg_one_no_wait", contract.noWaitSignature().name());
    }

    @Test
    void testUnwrapsOptionalResponse() {
        VariantContract contract = deriver.derive(variant("MsgTwo", optionalResp("Double")));

        assertEquals(TypeRef.of("Double"), contract.responseType());
    }

    @Test
    void testUnwrapsQualifiedOptionalAndResponseSlot() {
        TypeRef qualified = TypeRef.of("java.util.Optional", TypeRef.of("String"));
        TypeRef slot = TypeRef.of("ResponseSlot", TypeRef.of("Long"));

        assertEquals(TypeRef.of("String"), deriver.derive(variant("A", resp(qualified))).responseType());
        assertEquals(TypeRef.of("Long"), deriver.derive(variant("B", resp(slot))).responseType());
    }

    @Test
    void testKeepsOtherGenericResponse() {
        TypeRef list = TypeRef.of("List", TypeRef.of("String"));

        assertEquals(list, deriver.derive(variant("Items", resp(list))).responseType());
    }

    @Test
    void testUnwrapsOnlyOneLevel() {
        TypeRef nested = TypeRef.of("Optional", TypeRef.of("Optional", TypeRef.of("Integer")));

        assertEquals(TypeRef.of("Optional", TypeRef.of("Integer")),
                deriver.derive(variant("Nested", resp(nested))).responseType());
    }

    @Test
    void testDerivationIsDeterministic() {
        assertEquals(deriver.derive(variant("MsgOne", optionalResp("Integer"))),
                deriver.derive(variant("MsgOne", optionalResp("Integer"))));
    }

    @Test
    void testDeriveAllKeepsVariantOrder() {
        Outcome<List<VariantContract>> outcome = deriver.deriveAll(calcMessage());

        List<VariantContract> contracts = ((Outcome.Accepted<List<VariantContract>>) outcome).value();
        assertEquals(List.of("msg_one", "msg_two"), contracts.stream().map(VariantContract::operationName).toList());
    }

    @Test
    void testRejectsVariantsWithSameSnakeName() {
        MessageDeclaration message = message("CalcProcessorMsg",
                variant("MsgOne", optionalResp("Integer")),
                variant("Msg_One", optionalResp("Integer")));

        Outcome<List<VariantContract>> outcome = deriver.deriveAll(message);

        assertInstanceOf(Outcome.Rejected.class, outcome);
        assertEquals(RejectionReason.DUPLICATE_OPERATION_NAME,
                ((Outcome.Rejected<List<VariantContract>>) outcome).rejection().reason());
    }

    @Test
    void testRejectsWaitNameCollidingWithNoWaitName() {
        MessageDeclaration message = message("CalcProcessorMsg",
                variant("Ping", optionalResp("Integer")),
                variant("PingNoWait", optionalResp("Integer")));

        Outcome<List<VariantContract>> outcome = deriver.deriveAll(message);

        assertEquals(RejectionReason.DUPLICATE_OPERATION_NAME,
                ((Outcome.Rejected<List<VariantContract>>) outcome).rejection().reason());
        assertEquals("PingNoWait", ((Outcome.Rejected<List<VariantContract>>) outcome).rejection().subject());
    }

    @Test
    void testDeriveRequiresRespField() {
        assertThrows(IllegalArgumentException.class, () -> deriver.derive(variant("Bare", field("value", "int"))));
    }
}
