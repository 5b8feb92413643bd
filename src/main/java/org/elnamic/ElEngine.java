package org.elnamic;

import org.elnamic.api.AnalysisResult;
import org.elnamic.api.ExecutionResult;
import org.elnamic.api.IScriptEngine;
import org.elnamic.api.TheoremStatus;
import org.elnamic.compiler.FrontendPipeline;
import org.elnamic.compiler.frontend.parser.ast.ProgramNode;
import org.elnamic.runtime.Interpreter;
import org.elnamic.runtime.RuntimeOptions;
import org.elnamic.runtime.RuntimeServices;
import org.elnamic.runtime.proof.ProofRecord;
import org.elnamic.runtime.proof.TheoremRecord;
import org.elnamic.runtime.proof.TheoremRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The standard engine. Every {@link #run(String, String)} gets a fresh interpreter, so runs do
 * not see each other's bindings or theorems.
 */
public class ElEngine implements IScriptEngine {

    private static final Logger LOG = LoggerFactory.getLogger(ElEngine.class);

    private final FrontendPipeline frontend = new FrontendPipeline();
    private final RuntimeServices services;
    private final RuntimeOptions options;

    public ElEngine() {
        this(RuntimeServices.defaults(), RuntimeOptions.defaults());
    }

    public ElEngine(RuntimeServices services, RuntimeOptions options) {
        this.services = services;
        this.options = options;
    }

    @Override
    public ExecutionResult run(String source, String fileName) {
        ProgramNode program = frontend.read(source, fileName);
        Interpreter interpreter = new Interpreter(services, options);
        LOG.debug("Running program '{}'", program.programName());
        interpreter.execute(program);
        return summarize(program.programName(), interpreter.theorems());
    }

    @Override
    public AnalysisResult check(String source, String fileName) {
        return new AnalysisResult(fileName, frontend.check(source, fileName));
    }

    /**
     * Opens an interactive session with its own persistent global scope.
     * @return The session.
     */
    public ScriptSession openSession() {
        return new ScriptSession(frontend, new Interpreter(services, options));
    }

    static ExecutionResult summarize(String programName, TheoremRegistry registry) {
        List<TheoremStatus> theorems = registry.theorems().stream()
                .map(ElEngine::status)
                .toList();
        return new ExecutionResult(programName, theorems, registry.axioms().size(), registry.status().proofsRun());
    }

    private static TheoremStatus status(TheoremRecord theorem) {
        ProofRecord proof = theorem.proof();
        if (proof == null) {
            return new TheoremStatus(theorem.name(), false, null, null);
        }
        return new TheoremStatus(theorem.name(), true,
                proof.conclusion() != null ? proof.conclusion().literal() : null,
                proof.propositionValue() != null ? proof.propositionValue().literal() : null);
    }
}
