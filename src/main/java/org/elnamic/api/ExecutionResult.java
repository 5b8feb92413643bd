package org.elnamic.api;

import java.util.List;

/**
 * Outcome of a successful program run.
 *
 * @param programName The program's declared name, or {@code main}.
 * @param theorems Every theorem stated by the program, in declaration order.
 * @param axioms Number of axioms declared.
 * @param proofsRun Number of proofs that completed.
 */
public record ExecutionResult(String programName, List<TheoremStatus> theorems, int axioms, int proofsRun) {

    public boolean isChecked(String theorem) {
        return theorems.stream().anyMatch(t -> t.name().equals(theorem) && t.checked());
    }

    /**
     * @return A one-line summary of the proof bookkeeping.
     */
    public String proofSummary() {
        long checked = theorems.stream().filter(TheoremStatus::checked).count();
        return String.format("Program '%s': %d axiom(s), %d/%d theorem(s) checked, %d proof(s) run",
                programName, axioms, checked, theorems.size(), proofsRun);
    }
}
