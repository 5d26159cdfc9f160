package com.tandemsystems.synthesis;

import com.tandemsystems.analysis.EligibilityAnalyzer;
import com.tandemsystems.analysis.Outcome;
import com.tandemsystems.contract.VariantContract;
import com.tandemsystems.contract.VariantContractDeriver;
import com.tandemsystems.declaration.CandidateUnit;
import com.tandemsystems.declaration.TypeRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.tandemsystems.declaration.Declarations.*;
import static org.junit.jupiter.api.Assertions.*;

class ActorSynthesizerTest {

    private ActorBlueprint blueprint;

    @BeforeEach
    void setUp() {
        CandidateUnit unit = ((Outcome.Accepted<CandidateUnit>) new EligibilityAnalyzer().analyze(calcUnit())).value();
        List<VariantContract> contracts =
                ((Outcome.Accepted<List<VariantContract>>) new VariantContractDeriver().deriveAll(unit.message())).value();
        blueprint = new ActorSynthesizer().synthesize(unit, contracts);
    }

    @Test
    void testNamesHandleAndWorkerAfterProcessor() {
        assertEquals("ActorCalcProcessor", blueprint.handle().name());
        assertEquals("CalcProcessorWorker", blueprint.worker().name());
        assertEquals("CalcProcessor", blueprint.worker().processorName());
        assertEquals("process", blueprint.worker().handlerName());
        assertEquals("CalcProcessorMsg", blueprint.handle().messageTypeName());
    }

    @Test
    void testTwoOperationsPerVariantInOrder() {
        assertEquals(List.of("msg_one", "msg_one_no_wait", "msg_two", "msg_two_no_wait"),
                blueprint.handle().operationNames());
    }

    @Test
    void testOperationFormsAndTypes() {
        OperationDefinition msgOne = blueprint.handle().operation("msg_one").orElseThrow();
        OperationDefinition msgOneNoWait = blueprint.handle().operation("msg_one_no_wait").orElseThrow();

        assertEquals(CallForm.WAIT, msgOne.form());
        assertEquals("MsgOne", msgOne.variantName());
        assertEquals(TypeRef.of("Integer"), msgOne.resultValueType());
        assertEquals(CallForm.NO_WAIT, msgOneNoWait.form());
        assertEquals(TypeRef.of("Void"), msgOneNoWait.resultValueType());
        assertTrue(blueprint.handle().operation("msg_three").isEmpty());
    }

    @Test
    void testMailboxCarriesCallsAndIsUnbounded() {
        assertEquals("Call<CalcProcessorMsg>", blueprint.mailbox().elementType().render());
        assertFalse(blueprint.mailbox().bounded());
    }
}
