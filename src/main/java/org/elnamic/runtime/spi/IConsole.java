package org.elnamic.runtime.spi;

/**
 * The console sink used by {@code show}.
 */
@FunctionalInterface
public interface IConsole {

    /**
     * Renders one line of program output.
     * @param line The canonical text of the shown value, without line terminator.
     */
    void show(String line);
}
