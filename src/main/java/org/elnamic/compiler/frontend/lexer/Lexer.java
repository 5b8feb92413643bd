package org.elnamic.compiler.frontend.lexer;

import org.elnamic.api.LexException;
import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.diagnostics.DiagnosticsEngine;
import org.elnamic.runtime.model.Boolean3;
import org.elnamic.runtime.model.TypeName;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (source code) into a sequence of tokens.
 * <p>
 * Lexing is total: the first character sequence that forms no token is reported to the
 * diagnostics engine and aborts with a {@link LexException}.
 */
public class Lexer {

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        KEYWORDS.put("program", TokenType.PROGRAM);
        KEYWORDS.put("var", TokenType.VAR);
        KEYWORDS.put("const", TokenType.CONST);
        KEYWORDS.put("function", TokenType.FUNCTION);
        KEYWORDS.put("return", TokenType.RETURN);
        KEYWORDS.put("if", TokenType.IF);
        KEYWORDS.put("elif", TokenType.ELIF);
        KEYWORDS.put("else", TokenType.ELSE);
        KEYWORDS.put("while", TokenType.WHILE);
        KEYWORDS.put("do", TokenType.DO);
        KEYWORDS.put("for", TokenType.FOR);
        KEYWORDS.put("in", TokenType.IN);
        KEYWORDS.put("break", TokenType.BREAK);
        KEYWORDS.put("switch", TokenType.SWITCH);
        KEYWORDS.put("case", TokenType.CASE);
        KEYWORDS.put("default", TokenType.DEFAULT);
        KEYWORDS.put("show", TokenType.SHOW);
        KEYWORDS.put("SHOW", TokenType.SHOW);
        KEYWORDS.put("theorem", TokenType.THEOREM);
        KEYWORDS.put("axiom", TokenType.AXIOM);
        KEYWORDS.put("proof", TokenType.PROOF);
        KEYWORDS.put("hypothesis", TokenType.HYPOTHESIS);
        KEYWORDS.put("test", TokenType.TEST);
        KEYWORDS.put("QED", TokenType.QED);
        KEYWORDS.put("qed", TokenType.QED);
        KEYWORDS.put("and", TokenType.AND);
        KEYWORDS.put("or", TokenType.OR);
        KEYWORDS.put("not", TokenType.NOT);
        KEYWORDS.put("div", TokenType.DIV);
    }

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<inline>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The source code as a single string.
     * @param diagnostics The engine for reporting errors.
     * @param logicalFileName The name of the source being lexed, for error reporting.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = source;
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source code.
     * @return A list of the recognized tokens, always terminated by {@link TokenType#END_OF_FILE}.
     * @throws LexException if the source contains an unrecognized character, an unterminated
     *                      string or block comment, or an unsupported escape sequence.
     */
    public List<Token> scanTokens() {
        while (!isAtEnd()) {
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName));
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(' -> addToken(TokenType.LEFT_PAREN);
            case ')' -> addToken(TokenType.RIGHT_PAREN);
            case '{' -> addToken(TokenType.LEFT_BRACE);
            case '}' -> addToken(TokenType.RIGHT_BRACE);
            case '[' -> addToken(TokenType.LEFT_BRACKET);
            case ']' -> addToken(TokenType.RIGHT_BRACKET);
            case ',' -> addToken(TokenType.COMMA);
            case ';' -> addToken(TokenType.SEMICOLON);
            case ':' -> addToken(TokenType.COLON);
            case '+' -> addToken(TokenType.PLUS);
            case '-' -> addToken(TokenType.MINUS);
            case '*' -> addToken(TokenType.STAR);
            case '%' -> addToken(TokenType.PERCENT);
            case '!' -> addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
            case '=' -> addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
            case '<' -> addToken(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>' -> addToken(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '&' -> {
                if (!match('&')) fail("Unexpected character: " + c);
                addToken(TokenType.AND_AND);
            }
            case '|' -> {
                if (!match('|')) fail("Unexpected character: " + c);
                addToken(TokenType.OR_OR);
            }
            case '#' -> skipLineComment();
            case '/' -> {
                if (match('/')) {
                    skipLineComment();
                } else if (match('*')) {
                    skipBlockComment();
                } else {
                    addToken(TokenType.SLASH);
                }
            }
            case ' ', '\r', '\t', '\n' -> {
                // whitespace
            }
            case '"' -> string();
            default -> {
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    fail("Unexpected character: " + c);
                }
            }
        }
    }

    private void skipLineComment() {
        while (peek() != '\n' && !isAtEnd()) advance();
    }

    private void skipBlockComment() {
        while (!(peek() == '*' && peekNext() == '/')) {
            if (isAtEnd()) {
                fail("Unterminated block comment");
            }
            advance();
        }
        advance();
        advance();
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);

        TokenType keyword = KEYWORDS.get(text);
        if (keyword != null) {
            addToken(keyword, null);
            return;
        }
        switch (text) {
            case "true" -> addToken(TokenType.BOOLEAN, Boolean3.TRUE);
            case "false" -> addToken(TokenType.BOOLEAN, Boolean3.FALSE);
            case "realistic" -> addToken(TokenType.BOOLEAN, Boolean3.UNKNOWN);
            default -> {
                Optional<TypeName> typeName = TypeName.fromSpelling(text);
                if (typeName.isPresent()) {
                    addToken(TokenType.TYPE_NAME, typeName.get());
                } else {
                    addToken(TokenType.IDENTIFIER, null);
                }
            }
        }
    }

    private void number() {
        while (isDigit(peek())) advance();

        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
            addToken(TokenType.REAL, Double.parseDouble(source.substring(start, current)));
            return;
        }

        String text = source.substring(start, current);
        try {
            addToken(TokenType.INTEGER, Long.parseLong(text));
        } catch (NumberFormatException e) {
            fail("Integer literal out of range: " + text);
        }
    }

    private void string() {
        StringBuilder value = new StringBuilder();
        while (peek() != '"') {
            if (isAtEnd()) {
                fail("Unterminated string");
            }
            char c = advance();
            if (c == '\\') {
                if (isAtEnd()) {
                    fail("Unterminated string");
                }
                char escaped = advance();
                switch (escaped) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    case '\\' -> value.append('\\');
                    case '"' -> value.append('"');
                    default -> fail("Unsupported escape sequence: \\" + escaped);
                }
            } else {
                value.append(c);
            }
        }
        advance(); // closing quote
        addToken(TokenType.STRING, value.toString());
    }

    private void fail(String message) {
        SourceInfo position = new SourceInfo(logicalFileName, startLine, startColumn);
        diagnostics.reportError(message, position);
        throw new LexException(message, position);
    }

    private boolean match(char expected) {
        if (isAtEnd() || source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, startLine, startColumn, logicalFileName));
    }
}
