package org.elnamic.runtime.proof;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.parser.ast.ExpressionNode;

/**
 * A stated theorem and whether a completed proof has been recorded for it.
 */
public final class TheoremRecord {

    private final String name;
    private final ExpressionNode proposition;
    private final SourceInfo declaredAt;
    private ProofRecord proof;

    TheoremRecord(String name, ExpressionNode proposition, SourceInfo declaredAt) {
        this.name = name;
        this.proposition = proposition;
        this.declaredAt = declaredAt;
    }

    public String name() {
        return name;
    }

    public ExpressionNode proposition() {
        return proposition;
    }

    public SourceInfo declaredAt() {
        return declaredAt;
    }

    public boolean isChecked() {
        return proof != null;
    }

    /**
     * @return The most recent completed proof, or {@code null} if the theorem is unchecked.
     */
    public ProofRecord proof() {
        return proof;
    }

    void attach(ProofRecord record) {
        this.proof = record;
    }
}
