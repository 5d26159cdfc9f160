package com.tandemsystems.synthesis;

import com.tandemsystems.contract.VariantContract;
import com.tandemsystems.declaration.CandidateUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the blueprint of an accepted candidate. Never fails on accepted input.
 */
public class ActorSynthesizer {
    private static final Logger logger = LoggerFactory.getLogger(ActorSynthesizer.class);

    static final String HANDLE_PREFIX = "Actor";
    static final String WORKER_SUFFIX = "Worker";

    public ActorBlueprint synthesize(CandidateUnit unit, List<VariantContract> contracts) {
        String processorName = unit.processor().name();
        String messageTypeName = unit.message().name();

        List<OperationDefinition> operations = new ArrayList<>(contracts.size() * 2);
        for (VariantContract contract : contracts) {
            operations.add(new OperationDefinition(contract.operationName(), contract.variantName(),
                    contract.responseType(), CallForm.WAIT));
            operations.add(new OperationDefinition(contract.noWaitOperationName(), contract.variantName(),
                    contract.responseType(), CallForm.NO_WAIT));
        }

        ActorBlueprint blueprint = new ActorBlueprint(
                processorName,
                messageTypeName,
                MailboxWiring.unboundedFor(messageTypeName),
                new WorkerDefinition(processorName + WORKER_SUFFIX, processorName, unit.handler().handler().name()),
                new HandleDefinition(HANDLE_PREFIX + processorName, messageTypeName, operations));
        logger.debug("Synthesized {} with operations {}", blueprint.handle().name(), blueprint.handle().operationNames());
        return blueprint;
    }
}
