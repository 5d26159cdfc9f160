package com.tandemsystems.contract;

import com.tandemsystems.analysis.EligibilityAnalyzer;
import com.tandemsystems.analysis.Outcome;
import com.tandemsystems.analysis.RejectionReason;
import com.tandemsystems.declaration.FieldDeclaration;
import com.tandemsystems.declaration.MessageDeclaration;
import com.tandemsystems.declaration.TypeRef;
import com.tandemsystems.declaration.VariantDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Computes the public operations of each message variant.
 * Assumes the message type already passed {@link EligibilityAnalyzer}.
 */
public class VariantContractDeriver {

    private static final Logger logger = LoggerFactory.getLogger(VariantContractDeriver.class);

    /**
     * Wrapper types stripped from the declared {@code resp} type. The response field is always
     * carried as a slot internally, so writing it optional changes nothing for callers.
     */
    static final Set<String> OPTIONAL_WRAPPERS = Set.of("Optional", "Option", "ResponseSlot");

    /**
     * Derives the contract of a single variant.
     *
     * @param variant a variant with exactly one {@code resp} field
     * @return the contract
     * @throws IllegalArgumentException if the variant has no {@code resp} field
     */
    public VariantContract derive(VariantDeclaration variant) {
        FieldDeclaration resp = variant.fieldsNamed(EligibilityAnalyzer.RESPONSE_FIELD).stream()
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException(
                        "Variant " + variant.name() + " has no '" + EligibilityAnalyzer.RESPONSE_FIELD + "' field"));

        return new VariantContract(
                variant.name(),
                OperationNames.waitName(variant.name()),
                OperationNames.noWaitName(variant.name()),
                responseType(resp.type()));
    }

    /**
     * Derives every variant of a message type and rejects name collisions across all of them.
     *
     * @param message an accepted message type
     * @return contracts in variant order, or a {@link RejectionReason#DUPLICATE_OPERATION_NAME} rejection
     */
    public Outcome<List<VariantContract>> deriveAll(MessageDeclaration message) {
        List<VariantContract> contracts = new ArrayList<>();
        Map<String, String> owners = new HashMap<>();

        for (VariantDeclaration variant : message.variants()) {
            VariantContract contract = derive(variant);
            for (String operation : contract.operationNames()) {
                String owner = owners.putIfAbsent(operation, variant.name());
                if (owner != null) {
                    logger.debug("Operation {} derived from both {} and {}", operation, owner, variant.name());
                    return Outcome.rejected(RejectionReason.DUPLICATE_OPERATION_NAME, variant.name(),
                            "variants " + owner + " and " + variant.name() + " of " + message.name()
                                    + " both derive operation '" + operation + "'");
                }
            }
            contracts.add(contract);
        }
        return Outcome.accepted(List.copyOf(contracts));
    }

    static TypeRef responseType(TypeRef declared) {
        if (declared.arguments().size() == 1 && OPTIONAL_WRAPPERS.contains(declared.simpleName())) {
            return declared.arguments().get(0);
        }
        return declared;
    }
}
