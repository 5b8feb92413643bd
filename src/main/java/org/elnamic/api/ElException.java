package org.elnamic.api;

/**
 * Base class of every error raised while lexing, parsing, analyzing or running an El program.
 * <p>
 * It is part of the public API and hides the internal exception types of the interpreter.
 * Each subclass corresponds to one entry of the error taxonomy and reports it through
 * {@link #getErrorName()}.
 */
public class ElException extends RuntimeException {

    private final SourceInfo sourceInfo;

    /**
     * Constructs a new exception with a message and the position it refers to.
     * @param message The detail message.
     * @param sourceInfo The source position, or {@code null} if unknown.
     */
    public ElException(String message, SourceInfo sourceInfo) {
        this(message, sourceInfo, null);
    }

    /**
     * Constructs a new exception with a message, a position and a cause.
     * @param message The detail message.
     * @param sourceInfo The source position, or {@code null} if unknown.
     * @param cause The underlying cause.
     */
    public ElException(String message, SourceInfo sourceInfo, Throwable cause) {
        super(message, cause);
        this.sourceInfo = sourceInfo != null ? sourceInfo : SourceInfo.UNKNOWN;
    }

    public SourceInfo getSourceInfo() {
        return sourceInfo;
    }

    /**
     * @return The taxonomy name of this error kind, e.g. {@code TypeMismatchError}.
     */
    public String getErrorName() {
        return "Error";
    }

    /**
     * Formats the error for users: kind, position and message on one line.
     * @return The formatted description.
     */
    public String describe() {
        return String.format("%s at %s: %s", getErrorName(), sourceInfo, getMessage());
    }
}
