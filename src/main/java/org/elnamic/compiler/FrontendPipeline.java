package org.elnamic.compiler;

import org.elnamic.api.LexException;
import org.elnamic.api.ParseException;
import org.elnamic.api.SemanticException;
import org.elnamic.compiler.diagnostics.Diagnostic;
import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.compiler.frontend.lexer.Lexer;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.Parser;
import org.elnamic.compiler.frontend.parser.ast.ProgramNode;
import org.elnamic.compiler.frontend.semantics.SemanticAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Turns source text into an analyzed program: lexing, parsing and structural analysis.
 * A new diagnostics engine is used per call, so one instance may be reused.
 */
public class FrontendPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(FrontendPipeline.class);

    /**
     * Reads a program and rejects it if analysis finds errors. Warnings are logged.
     *
     * @param source The program text.
     * @param fileName The logical name used in positions.
     * @return The program, ready to run.
     * @throws LexException on malformed tokens.
     * @throws ParseException on the first grammar violation.
     * @throws SemanticException if structural analysis reports errors.
     */
    public ProgramNode read(String source, String fileName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        ProgramNode program = readInto(source, fileName, diagnostics);
        if (diagnostics.hasErrors()) {
            throw new SemanticException(diagnostics.getDiagnostics());
        }
        for (Diagnostic warning : diagnostics.ofType(Diagnostic.Type.WARNING)) {
            LOG.warn("{}:{}:{}: {}", warning.fileName(), warning.lineNumber(), warning.columnNumber(), warning.message());
        }
        return program;
    }

    /**
     * Reads a program without running it and collects every finding instead of throwing.
     *
     * @param source The program text.
     * @param fileName The logical name used in positions.
     * @return All diagnostics, including the lex or parse error that stopped reading, if any.
     */
    public List<Diagnostic> check(String source, String fileName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        try {
            readInto(source, fileName, diagnostics);
        } catch (LexException | ParseException e) {
            // already reported to the diagnostics engine
            LOG.debug("Reading {} stopped: {}", fileName, e.getMessage());
        }
        return diagnostics.getDiagnostics();
    }

    private ProgramNode readInto(String source, String fileName, DiagnosticsEngine diagnostics) {
        // Phase 1: Lexical analysis
        List<Token> tokens = new Lexer(source, diagnostics, fileName).scanTokens();

        // Phase 2: Parsing
        ProgramNode program = new Parser(tokens, diagnostics).parse();

        // Phase 3: Structural analysis
        new SemanticAnalyzer(diagnostics).analyze(program);
        LOG.debug("Read program '{}' from {} ({} top-level statements)", program.programName(), fileName,
                program.statements().size());
        return program;
    }
}
