package org.elnamic.compiler.frontend.parser.features.control;

import org.elnamic.compiler.frontend.lexer.Token;
import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.IStatementHandler;
import org.elnamic.compiler.frontend.parser.ParsingContext;
import org.elnamic.compiler.frontend.parser.ast.AstNode;
import org.elnamic.compiler.frontend.parser.ast.BlockNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Handler for <code>if c { } elif c { } else { }</code>; {@code else if} is accepted as a
 * spelling of {@code elif}.
 */
public class IfStatementHandler implements IStatementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.advance();
        List<IfNode.Branch> branches = new ArrayList<>();
        branches.add(new IfNode.Branch(context.expression(), context.block()));

        BlockNode elseBranch = null;
        while (true) {
            if (context.match(TokenType.ELIF)) {
                branches.add(new IfNode.Branch(context.expression(), context.block()));
            } else if (context.check(TokenType.ELSE) && context.checkNext(TokenType.IF)) {
                context.advance();
                context.advance();
                branches.add(new IfNode.Branch(context.expression(), context.block()));
            } else if (context.match(TokenType.ELSE)) {
                elseBranch = context.block();
                break;
            } else {
                break;
            }
        }
        return new IfNode(keyword, List.copyOf(branches), elseBranch);
    }
}
