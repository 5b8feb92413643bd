package org.elnamic.runtime.proof;

import org.elnamic.api.RedeclarationException;
import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;
import org.elnamic.runtime.model.Boolean3;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Theorems, axioms and proof outcomes of one program run. Theorem and axiom names share
 * one namespace.
 */
public final class TheoremRegistry {

    private final Map<String, TheoremRecord> theorems = new LinkedHashMap<>();
    private final Map<String, AxiomRecord> axioms = new LinkedHashMap<>();
    private int proofsRun;

    /**
     * Registers a theorem.
     *
     * @param name The theorem name.
     * @param proposition The stated proposition, evaluated when a proof completes.
     * @param at The declaring position.
     * @return The new record.
     * @throws RedeclarationException if a theorem or axiom of that name exists.
     */
    public TheoremRecord declareTheorem(String name, ExpressionNode proposition, SourceInfo at) {
        requireFresh(name, at);
        TheoremRecord record = new TheoremRecord(name, proposition, at);
        theorems.put(name, record);
        return record;
    }

    /**
     * Registers an axiom.
     *
     * @param name The axiom name.
     * @param value The evaluated proposition.
     * @param at The declaring position.
     * @return The new record.
     * @throws RedeclarationException if a theorem or axiom of that name exists.
     */
    public AxiomRecord declareAxiom(String name, Boolean3 value, SourceInfo at) {
        requireFresh(name, at);
        AxiomRecord record = new AxiomRecord(name, value, at);
        axioms.put(name, record);
        return record;
    }

    public Optional<TheoremRecord> findTheorem(String name) {
        return Optional.ofNullable(theorems.get(name));
    }

    public Optional<AxiomRecord> findAxiom(String name) {
        return Optional.ofNullable(axioms.get(name));
    }

    /**
     * @param name A theorem or axiom name.
     * @return Whether it is an axiom or a theorem with a completed proof.
     */
    public boolean isChecked(String name) {
        if (axioms.containsKey(name)) {
            return true;
        }
        TheoremRecord theorem = theorems.get(name);
        return theorem != null && theorem.isChecked();
    }

    /**
     * Records a completed proof and marks its theorem checked, replacing an earlier proof.
     * @param record The proof outcome.
     */
    public void recordProof(ProofRecord record) {
        TheoremRecord theorem = theorems.get(record.theoremName());
        if (theorem == null) {
            throw new IllegalStateException("No theorem named " + record.theoremName());
        }
        theorem.attach(record);
        proofsRun++;
    }

    public Collection<TheoremRecord> theorems() {
        return Collections.unmodifiableCollection(theorems.values());
    }

    public Collection<AxiomRecord> axioms() {
        return Collections.unmodifiableCollection(axioms.values());
    }

    public ProofStatus status() {
        List<String> unchecked = new ArrayList<>();
        int checked = 0;
        for (TheoremRecord theorem : theorems.values()) {
            if (theorem.isChecked()) {
                checked++;
            } else {
                unchecked.add(theorem.name());
            }
        }
        return new ProofStatus(axioms.size(), theorems.size(), checked, proofsRun, List.copyOf(unchecked));
    }

    private void requireFresh(String name, SourceInfo at) {
        if (theorems.containsKey(name) || axioms.containsKey(name)) {
            throw new RedeclarationException("Theorem or axiom '" + name + "' is already declared", at);
        }
    }
}
