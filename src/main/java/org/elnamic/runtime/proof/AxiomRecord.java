package org.elnamic.runtime.proof;

import org.elnamic.api.SourceInfo;
import org.elnamic.runtime.model.Boolean3;

/**
 * An axiom: a named truth value accepted without proof.
 *
 * @param name The axiom name.
 * @param value The value its proposition evaluated to when declared.
 * @param declaredAt Where it was declared.
 */
public record AxiomRecord(String name, Boolean3 value, SourceInfo declaredAt) {
}
