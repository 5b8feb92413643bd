package org.elnamic.api;

/**
 * Raised when the source text contains a character sequence that forms no token.
 */
public class LexException extends ElException {

    public LexException(String message, SourceInfo sourceInfo) {
        super(message, sourceInfo);
    }

    @Override
    public String getErrorName() {
        return "LexError";
    }
}
