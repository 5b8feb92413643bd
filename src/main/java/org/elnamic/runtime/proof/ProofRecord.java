package org.elnamic.runtime.proof;

import org.elnamic.runtime.model.Boolean3;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a proof block that reached its completion marker.
 *
 * @param theoremName The proven theorem.
 * @param hypotheses The hypotheses in declaration order with their truth values.
 * @param passedTests Labels of the tests that passed, in order.
 * @param conclusion The value of the last bare expression, or {@code null} if there was none.
 * @param propositionValue The theorem's proposition evaluated in the proof scope at completion,
 *                         or {@code null} if it could not be evaluated there.
 */
public record ProofRecord(
        String theoremName,
        Map<String, Boolean3> hypotheses,
        List<String> passedTests,
        Boolean3 conclusion,
        Boolean3 propositionValue
) {
}
