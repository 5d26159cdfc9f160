package com.tandemsystems.synthesis;

import com.tandemsystems.analysis.EligibilityAnalyzer;
import com.tandemsystems.analysis.Outcome;
import com.tandemsystems.contract.VariantContractDeriver;
import com.tandemsystems.declaration.CandidateUnit;
import com.tandemsystems.declaration.Declaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs analysis, contract derivation and synthesis in sequence.
 */
public class ActorGenerator {
    private static final Logger logger = LoggerFactory.getLogger(ActorGenerator.class);

    private final EligibilityAnalyzer analyzer;
    private final VariantContractDeriver deriver;
    private final ActorSynthesizer synthesizer;

    public ActorGenerator() {
        this(new EligibilityAnalyzer(), new VariantContractDeriver(), new ActorSynthesizer());
    }

    public ActorGenerator(EligibilityAnalyzer analyzer, VariantContractDeriver deriver, ActorSynthesizer synthesizer) {
        this.analyzer = analyzer;
        this.deriver = deriver;
        this.synthesizer = synthesizer;
    }

    /**
     * Generates the actor for a set of declarations holding exactly one processor/message pair.
     *
     * @throws SynthesisException if the declarations are rejected
     */
    public ActorBlueprint generate(List<? extends Declaration> declarations) {
        return build(analyzer.analyze(declarations));
    }

    /**
     * Generates one actor per processor that pairs with a message in the module.
     * Stops at the first rejected pair.
     *
     * @throws SynthesisException if any pair is rejected
     */
    public List<ActorBlueprint> generateAll(List<? extends Declaration> declarations) {
        List<ActorBlueprint> blueprints = new ArrayList<>();
        for (Outcome<CandidateUnit> outcome : analyzer.analyzeModule(declarations)) {
            blueprints.add(build(outcome));
        }
        return blueprints;
    }

    private ActorBlueprint build(Outcome<CandidateUnit> candidate) {
        Outcome<ActorBlueprint> result = candidate.flatMap(unit ->
                deriver.deriveAll(unit.message()).map(contracts -> synthesizer.synthesize(unit, contracts)));
        if (result instanceof Outcome.Rejected<ActorBlueprint> rejected) {
            logger.warn("Actor generation rejected: {}", rejected.rejection());
            throw new SynthesisException(rejected.rejection());
        }
        return ((Outcome.Accepted<ActorBlueprint>) result).value();
    }
}
