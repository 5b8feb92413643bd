package org.elnamic.api;

/**
 * Proof state of one theorem after a run.
 *
 * @param name The theorem name.
 * @param checked Whether a proof reached its completion marker.
 * @param conclusion The proof's final conclusion as a truth literal, or {@code null}.
 * @param propositionValue The proposition's value at completion as a truth literal, or {@code null} when the
 *                         theorem is unchecked or its proposition could not be evaluated in the proof scope.
 */
public record TheoremStatus(String name, boolean checked, String conclusion, String propositionValue) {
}
