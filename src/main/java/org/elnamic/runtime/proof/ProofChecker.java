package org.elnamic.runtime.proof;

import org.elnamic.api.ElException;
import org.elnamic.api.ProofIncompleteException;
import org.elnamic.api.ProofTestFailureException;
import org.elnamic.api.UnboundNameException;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.ExpressionStatementNode;
import org.elnamic.compiler.frontend.parser.features.proof.HypothesisNode;
import org.elnamic.compiler.frontend.parser.features.proof.ProofNode;
import org.elnamic.compiler.frontend.parser.features.proof.ProofTestNode;
import org.elnamic.compiler.frontend.parser.features.proof.QedNode;
import org.elnamic.runtime.exec.ExecutionContext;
import org.elnamic.runtime.model.Boolean3;
import org.elnamic.runtime.model.Environment;
import org.elnamic.runtime.model.TypeName;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs proof blocks. A proof is bookkeeping, not deduction: once the block reaches
 * {@code QED} without a failed test the theorem is marked checked, whatever the values of
 * the conclusion and the stated proposition.
 */
public final class ProofChecker {

    private static final Logger LOG = LoggerFactory.getLogger(ProofChecker.class);

    /**
     * Executes a proof block in a child of the current scope.
     *
     * @param proof The proof block.
     * @param ctx The execution context.
     * @return The record stored for the theorem.
     * @throws UnboundNameException if no theorem of that name was declared.
     * @throws ProofTestFailureException if a test does not produce its expected value.
     * @throws ProofIncompleteException if the block ends without {@code QED}.
     */
    public ProofRecord check(ProofNode proof, ExecutionContext ctx) {
        String theoremName = proof.theoremName().text();
        TheoremRecord theorem = ctx.theorems().findTheorem(theoremName)
                .orElseThrow(() -> new UnboundNameException(theoremName, proof.theoremName().sourceInfo()));

        Environment scope = ctx.newChildScope();
        Map<String, Boolean3> hypotheses = new LinkedHashMap<>();
        List<String> passedTests = new ArrayList<>();
        Boolean3 conclusion = null;

        for (AstNode step : proof.body()) {
            if (step instanceof QedNode) {
                Boolean3 propositionValue = propositionAtCompletion(theorem, scope, ctx);
                ProofRecord record = new ProofRecord(theoremName, Collections.unmodifiableMap(hypotheses), List.copyOf(passedTests),
                        conclusion, propositionValue);
                ctx.theorems().recordProof(record);
                LOG.debug("Theorem '{}' checked (conclusion={}, proposition={})", theoremName,
                        conclusion != null ? conclusion.literal() : "none",
                        propositionValue != null ? propositionValue.literal() : "none");
                return record;
            }
            if (step instanceof HypothesisNode hypothesis) {
                Boolean3 value = ctx.evaluateTruthIn(scope, hypothesis.proposition(), "hypothesis");
                scope.define(hypothesis.name().text(), value, TypeName.BOOLEAN, true, hypothesis.sourceInfo());
                hypotheses.put(hypothesis.name().text(), value);
            } else if (step instanceof ProofTestNode test) {
                Boolean3 actual = ctx.evaluateTruthIn(scope, test.subject(), "test subject");
                if (actual != test.expectedValue()) {
                    throw new ProofTestFailureException(test.label().text(), test.expectedValue().literal(),
                            actual.literal(), test.sourceInfo());
                }
                passedTests.add(test.label().text());
            } else if (step instanceof ExpressionStatementNode expression) {
                conclusion = ctx.evaluateTruthIn(scope, expression.expression(), "proof step");
            } else {
                ctx.executeIn(scope, List.of(step));
            }
        }
        throw new ProofIncompleteException("Proof of '" + theoremName + "' ends without QED", proof.sourceInfo());
    }

    /**
     * The stated proposition evaluated in the proof scope, or {@code null} when it cannot be
     * evaluated there. Completion never depends on it.
     */
    private Boolean3 propositionAtCompletion(TheoremRecord theorem, Environment scope, ExecutionContext ctx) {
        try {
            return ctx.evaluateTruthIn(scope, theorem.proposition(), "theorem proposition");
        } catch (ElException e) {
            LOG.debug("Proposition of theorem '{}' not evaluable at QED: {}", theorem.name(), e.describe());
            return null;
        }
    }
}
