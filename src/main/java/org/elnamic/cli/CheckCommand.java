package org.elnamic.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.elnamic.ElEngine;
import org.elnamic.api.AnalysisResult;
import org.elnamic.compiler.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.concurrent.Callable;

@Command(name = "check",
        mixinStandardHelpOptions = true,
        description = "Parses and analyzes an El program without running it.")
public class CheckCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CheckCommand.class);

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "The El source file to check.")
    File file;

    @Option(names = "--json", description = "Print the diagnostics as JSON.")
    boolean json;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (!file.isFile()) {
            err.println("File not found: " + file.getPath());
            return 2;
        }

        String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("Cannot read {}", file, e);
            err.println("IOError: cannot read " + file.getPath() + ": " + e.getMessage());
            return 1;
        }

        AnalysisResult result = new ElEngine().check(source, file.getPath());
        if (json) {
            out.println(toJson(result));
        } else if (result.diagnostics().isEmpty()) {
            out.println(file.getPath() + ": OK");
        } else {
            result.diagnostics().forEach(out::println);
        }
        out.flush();
        return result.hasErrors() ? 1 : 0;
    }

    static String toJson(AnalysisResult result) {
        JsonObject root = new JsonObject();
        root.addProperty("file", result.fileName());
        root.addProperty("ok", !result.hasErrors());
        JsonArray diagnostics = new JsonArray();
        for (Diagnostic d : result.diagnostics()) {
            JsonObject entry = new JsonObject();
            entry.addProperty("type", d.type().name());
            entry.addProperty("message", d.message());
            entry.addProperty("line", d.lineNumber());
            entry.addProperty("column", d.columnNumber());
            diagnostics.add(entry);
        }
        root.add("diagnostics", diagnostics);
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        return gson.toJson(root);
    }
}
