package org.elnamic.runtime.services;

import org.elnamic.runtime.spi.IFileSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes UTF-8 files, resolving relative paths against a base directory.
 */
public class LocalFileSystem implements IFileSystem {

    private static final Logger LOG = LoggerFactory.getLogger(LocalFileSystem.class);

    private final Path baseDirectory;

    /**
     * @param baseDirectory The directory relative paths are resolved against.
     */
    public LocalFileSystem(Path baseDirectory) {
        this.baseDirectory = baseDirectory;
    }

    @Override
    public String readFile(String path) throws IOException {
        Path resolved = baseDirectory.resolve(path);
        LOG.debug("Reading {}", resolved);
        return Files.readString(resolved, StandardCharsets.UTF_8);
    }

    @Override
    public void writeFile(String path, String content) throws IOException {
        Path resolved = baseDirectory.resolve(path);
        LOG.debug("Writing {} characters to {}", content.length(), resolved);
        Files.writeString(resolved, content, StandardCharsets.UTF_8);
    }
}
