package org.elnamic.api;

/**
 * Raised when the token stream does not match the grammar.
 * Carries a description of what was expected and the lexeme that was found instead.
 */
public class ParseException extends ElException {

    private final String expected;
    private final String found;

    public ParseException(String expected, String found, SourceInfo sourceInfo) {
        super(String.format("Expected %s but found '%s'", expected, found), sourceInfo);
        this.expected = expected;
        this.found = found;
    }

    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }

    @Override
    public String getErrorName() {
        return "ParseError";
    }
}
