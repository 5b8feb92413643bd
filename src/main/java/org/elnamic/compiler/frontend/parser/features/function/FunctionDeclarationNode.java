package org.elnamic.compiler.frontend.parser.features.function;

import org.elnamic.api.SourceInfo;
import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.BlockNode;

import java.util.List;

/**
 * {@code function name(params) { body }}. Executing it binds a closure over the current scope.
 *
 * @param name The function name.
 * @param parameters The parameters in declaration order.
 * @param body The function body.
 */
public record FunctionDeclarationNode(Token name, List<ParameterNode> parameters, BlockNode body) implements AstNode {

    @Override
    public List<AstNode> getChildren() {
        return List.of(body);
    }

    @Override
    public SourceInfo sourceInfo() {
        return name.sourceInfo();
    }
}
