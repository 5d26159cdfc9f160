package com.tandemsystems.analysis;

import com.tandemsystems.declaration.CandidateUnit;
import com.tandemsystems.declaration.Declaration;
import com.tandemsystems.declaration.HandlerBinding;
import com.tandemsystems.declaration.MemberDeclaration;
import com.tandemsystems.declaration.MessageDeclaration;
import com.tandemsystems.declaration.ParameterDeclaration;
import com.tandemsystems.declaration.PassingMode;
import com.tandemsystems.declaration.ProcessorDeclaration;
import com.tandemsystems.declaration.VariantDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Decides whether a set of declarations forms a generatable actor.
 *
 * <p>Rules are checked in order and the first failure wins:
 * <ol>
 *   <li>exactly one processor/message pairing exists;</li>
 *   <li>the processor has an asynchronous {@code process} member taking the message by exclusive reference;</li>
 *   <li>the message type has at least one variant;</li>
 *   <li>every variant has exactly one {@code resp} field.</li>
 * </ol>
 * A processor pairs with the message named by its explicit binding when it has one,
 * and with the message named {@code <processor>Msg} otherwise.
 * Acceptance is all-or-nothing.
 */
public class EligibilityAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(EligibilityAnalyzer.class);

    public static final String MESSAGE_SUFFIX = "Msg";
    public static final String HANDLER_NAME = "process";
    public static final String RESPONSE_FIELD = "resp";

    private record Pairing(ProcessorDeclaration processor, MessageDeclaration message) {}

    /**
     * Analyzes one candidate unit.
     *
     * @param declarations the declarations of the unit
     * @return the accepted unit, or the first rule violation
     */
    public Outcome<CandidateUnit> analyze(List<? extends Declaration> declarations) {
        List<Pairing> pairings = findPairings(declarations);
        if (pairings.size() != 1) {
            return rejectPairing(declarations, pairings);
        }
        Pairing pairing = pairings.get(0);
        Outcome<CandidateUnit> outcome = findHandler(pairing)
                .flatMap(handler -> checkVariants(pairing.message())
                        .map(message -> new CandidateUnit(pairing.processor(), message, handler)));

        if (outcome instanceof Outcome.Rejected<CandidateUnit> rejected) {
            logger.debug("Rejected {}: {}", pairing.processor().name(), rejected.rejection());
        } else {
            logger.debug("Accepted actor unit {} / {}", pairing.processor().name(), pairing.message().name());
        }
        return outcome;
    }

    /**
     * Splits a whole module into one unit per message type that some processor pairs with,
     * and analyzes each unit on its own. Declarations that pair with nothing are ignored.
     *
     * @param declarations every declaration of the module
     * @return one outcome per unit, in order of first appearance of the message type
     */
    public List<Outcome<CandidateUnit>> analyzeModule(List<? extends Declaration> declarations) {
        Map<String, List<Declaration>> units = new LinkedHashMap<>();
        List<MessageDeclaration> messages = messagesOf(declarations);

        for (Declaration declaration : declarations) {
            if (declaration instanceof ProcessorDeclaration processor) {
                String target = targetMessageName(processor);
                boolean hasMessage = messages.stream().anyMatch(message -> sameName(message.name(), target));
                if (hasMessage) {
                    units.computeIfAbsent(target, key -> new ArrayList<>()).add(processor);
                }
            }
        }
        units.forEach((target, unit) -> messages.stream()
                .filter(message -> sameName(message.name(), target))
                .forEach(unit::add));

        logger.debug("Module split into {} candidate unit(s): {}", units.size(), units.keySet());
        return units.values().stream()
                .map(this::analyze)
                .collect(Collectors.toList());
    }

    private List<Pairing> findPairings(List<? extends Declaration> declarations) {
        List<MessageDeclaration> messages = messagesOf(declarations);
        List<Pairing> pairings = new ArrayList<>();
        for (Declaration declaration : declarations) {
            if (declaration instanceof ProcessorDeclaration processor) {
                String target = targetMessageName(processor);
                for (MessageDeclaration message : messages) {
                    if (sameName(message.name(), target)) {
                        pairings.add(new Pairing(processor, message));
                    }
                }
            }
        }
        return pairings;
    }

    private Outcome<CandidateUnit> rejectPairing(List<? extends Declaration> declarations, List<Pairing> pairings) {
        if (pairings.isEmpty()) {
            String names = declarations.stream().map(Declaration::name).collect(Collectors.joining(", "));
            return Outcome.rejected(RejectionReason.AMBIGUOUS_OR_MISSING_PAIR, names.isEmpty() ? "<empty>" : names,
                    "no processor pairs with a message type named <processor>" + MESSAGE_SUFFIX
                            + " or with its explicitly bound message type");
        }
        String found = pairings.stream()
                .map(pairing -> pairing.processor().name() + "/" + pairing.message().name())
                .collect(Collectors.joining(", "));
        return Outcome.rejected(RejectionReason.AMBIGUOUS_OR_MISSING_PAIR, found,
                pairings.size() + " processor/message pairings found, exactly one is required");
    }

    private Outcome<HandlerBinding> findHandler(Pairing pairing) {
        ProcessorDeclaration processor = pairing.processor();
        String messageName = simpleName(pairing.message().name());
        List<MemberDeclaration> candidates = processor.membersNamed(HANDLER_NAME);

        for (MemberDeclaration member : candidates) {
            if (isHandlerFor(member, messageName)) {
                return Outcome.accepted(new HandlerBinding(processor.name(), member));
            }
        }

        String detail = candidates.isEmpty()
                ? processor.name() + " has no member named " + HANDLER_NAME
                : processor.name() + "." + HANDLER_NAME + " must be asynchronous and take exactly one "
                        + messageName + " by exclusive reference";
        return Outcome.rejected(RejectionReason.MISSING_HANDLER, processor.name(), detail);
    }

    private static boolean isHandlerFor(MemberDeclaration member, String messageName) {
        if (!member.asynchronous() || member.parameters().size() != 1) {
            return false;
        }
        ParameterDeclaration parameter = member.parameters().get(0);
        return parameter.passing() == PassingMode.EXCLUSIVE_REFERENCE
                && parameter.type().simpleName().equals(messageName);
    }

    private Outcome<MessageDeclaration> checkVariants(MessageDeclaration message) {
        if (message.variants().isEmpty()) {
            return Outcome.rejected(RejectionReason.EMPTY_MESSAGE_TYPE, message.name(),
                    message.name() + " declares no variants");
        }
        for (VariantDeclaration variant : message.variants()) {
            int responseFields = variant.fieldsNamed(RESPONSE_FIELD).size();
            if (responseFields == 0) {
                return Outcome.rejected(RejectionReason.MISSING_RESPONSE_FIELD, variant.name(),
                        message.name() + "." + variant.name() + " has no '" + RESPONSE_FIELD + "' field");
            }
            if (responseFields > 1) {
                return Outcome.rejected(RejectionReason.MISSING_RESPONSE_FIELD, variant.name(),
                        message.name() + "." + variant.name() + " declares " + responseFields + " '"
                                + RESPONSE_FIELD + "' fields, exactly one is required");
            }
        }
        return Outcome.accepted(message);
    }

    private static List<MessageDeclaration> messagesOf(List<? extends Declaration> declarations) {
        List<MessageDeclaration> messages = new ArrayList<>();
        for (Declaration declaration : declarations) {
            if (declaration instanceof MessageDeclaration message) {
                messages.add(message);
            }
        }
        return messages;
    }

    static String targetMessageName(ProcessorDeclaration processor) {
        return processor.boundMessage().orElse(simpleName(processor.name()) + MESSAGE_SUFFIX);
    }

    private static boolean sameName(String declared, String target) {
        return simpleName(declared).equals(simpleName(target));
    }

    private static String simpleName(String name) {
        int dot = name.lastIndexOf('.');
        return dot < 0 ? name : name.substring(dot + 1);
    }
}
