package org.elnamic.runtime;

import org.elnamic.runtime.services.HeadlessTurtleSurface;
import org.elnamic.runtime.services.LocalFileSystem;
import org.elnamic.runtime.services.StdoutConsole;
import org.elnamic.runtime.spi.IConsole;
import org.elnamic.runtime.spi.IFileSystem;
import org.elnamic.runtime.spi.IGraphicsSurface;

import java.nio.file.Path;

/**
 * The external collaborators an interpreter talks to. Passed in at construction so that
 * several interpreters can coexist, each with its own console, files and graphics surface.
 *
 * @param console The sink of {@code show}.
 * @param fileSystem The target of the file builtins.
 * @param graphics The turtle surface.
 */
public record RuntimeServices(IConsole console, IFileSystem fileSystem, IGraphicsSurface graphics) {

    /**
     * @return Standard output, the working directory and a headless turtle surface.
     */
    public static RuntimeServices defaults() {
        return new RuntimeServices(new StdoutConsole(), new LocalFileSystem(Path.of("").toAbsolutePath()),
                new HeadlessTurtleSurface());
    }

    public RuntimeServices withConsole(IConsole replacement) {
        return new RuntimeServices(replacement, fileSystem, graphics);
    }

    public RuntimeServices withGraphics(IGraphicsSurface replacement) {
        return new RuntimeServices(console, fileSystem, replacement);
    }
}
