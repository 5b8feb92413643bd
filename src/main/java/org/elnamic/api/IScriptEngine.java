package org.elnamic.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Defines the public interface for running El programs.
 */
public interface IScriptEngine {

    /**
     * Reads, analyzes and runs a program.
     *
     * @param source The program text.
     * @param fileName A logical name for the source, used in error positions.
     * @return The outcome of the run.
     * @throws ElException on the first lex, parse, analysis, runtime or proof error.
     */
    ExecutionResult run(String source, String fileName);

    /**
     * Reads and analyzes a program without running it.
     *
     * @param source The program text.
     * @param fileName A logical name for the source.
     * @return All diagnostics found.
     */
    AnalysisResult check(String source, String fileName);

    /**
     * Runs a program file.
     * @param file The path to the source file.
     * @return The outcome of the run.
     * @throws IOException if the file cannot be read.
     */
    default ExecutionResult run(Path file) throws IOException {
        return run(Files.readString(file, StandardCharsets.UTF_8), file.toString());
    }
}
