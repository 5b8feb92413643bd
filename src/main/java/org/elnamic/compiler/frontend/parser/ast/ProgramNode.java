package org.elnamic.compiler.frontend.parser.ast;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * The root of a parsed program.
 *
 * @param name The token after {@code program}, or {@code null} when the header is omitted.
 * @param statements The top-level statements in source order.
 * @param fileName The logical source name.
 */
public record ProgramNode(Token name, List<AstNode> statements, String fileName) implements AstNode {

    /** Name used for programs written without a {@code program NAME { }} header. */
    public static final String DEFAULT_NAME = "main";

    public String programName() {
        return name != null ? name.text() : DEFAULT_NAME;
    }

    @Override
    public List<AstNode> getChildren() {
        return statements;
    }

    @Override
    public SourceInfo sourceInfo() {
        return name != null ? name.sourceInfo() : new SourceInfo(fileName, 1, 1);
    }
}
