package org.elnamic.runtime.proof;

import java.util.List;

/**
 * Snapshot of the proof bookkeeping of one program run.
 *
 * @param axioms Number of axioms declared.
 * @param theoremsStated Number of theorems declared.
 * @param theoremsChecked Number of theorems with a completed proof.
 * @param proofsRun Number of proof blocks that reached their completion marker.
 * @param uncheckedTheorems Names of stated theorems without a completed proof.
 */
public record ProofStatus(int axioms, int theoremsStated, int theoremsChecked, int proofsRun,
                          List<String> uncheckedTheorems) {
}
