package org.elnamic.runtime.spi;

import java.io.IOException;

/**
 * File access for the {@code read_file} and {@code write_file} builtins.
 * Implementations own and close any handles they open.
 */
public interface IFileSystem {

    /**
     * Reads a whole text file.
     * @param path The path as written by the program.
     * @return The file content.
     * @throws IOException if the file is missing or unreadable.
     */
    String readFile(String path) throws IOException;

    /**
     * Creates or overwrites a text file.
     * @param path The path as written by the program.
     * @param content The new content.
     * @throws IOException if the file cannot be written.
     */
    void writeFile(String path, String content) throws IOException;
}
