package org.elnamic.runtime.services;

import org.elnamic.runtime.spi.IConsole;

import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Writes program output line by line, by default to {@code System.out}.
 */
public class StdoutConsole implements IConsole {

    private final PrintWriter out;

    public StdoutConsole() {
        this(System.out);
    }

    public StdoutConsole(PrintStream out) {
        this(new PrintWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8), true));
    }

    public StdoutConsole(PrintWriter out) {
        this.out = out;
    }

    @Override
    public void show(String line) {
        out.println(line);
        out.flush();
    }
}
