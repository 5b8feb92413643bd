package org.elnamic.compiler.frontend.parser;

import org.elnamic.compiler.frontend.lexer.TokenType;
import org.elnamic.compiler.frontend.parser.features.control.BreakStatementHandler;
import org.elnamic.compiler.frontend.parser.features.control.DoWhileStatementHandler;
import org.elnamic.compiler.frontend.parser.features.control.IfStatementHandler;
import org.elnamic.compiler.frontend.parser.features.control.WhileStatementHandler;
import org.elnamic.compiler.frontend.parser.features.decl.VariableDeclarationHandler;
import org.elnamic.compiler.frontend.parser.features.function.FunctionDeclarationHandler;
import org.elnamic.compiler.frontend.parser.features.function.ReturnStatementHandler;
import org.elnamic.compiler.frontend.parser.features.loop.ForStatementHandler;
import org.elnamic.compiler.frontend.parser.features.proof.ProofStatementHandler;
import org.elnamic.compiler.frontend.parser.features.proof.TheoremStatementHandler;
import org.elnamic.compiler.frontend.parser.features.show.ShowStatementHandler;
import org.elnamic.compiler.frontend.parser.features.switchcase.SwitchStatementHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for statement handlers. This class holds a map of leading keywords
 * to the handlers that parse the statements they introduce.
 */
public class StatementHandlerRegistry {
    private final Map<TokenType, IStatementHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a new statement handler.
     * @param keyword The keyword token type that introduces the statement.
     * @param handler The handler for the statement.
     */
    public void register(TokenType keyword, IStatementHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given keyword.
     * @param keyword The token type of the current token.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IStatementHandler> get(TokenType keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Initializes the registry with all the built-in handlers.
     * @return A new instance of {@link StatementHandlerRegistry} with all handlers registered.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        VariableDeclarationHandler declarations = new VariableDeclarationHandler();
        registry.register(TokenType.VAR, declarations);
        registry.register(TokenType.CONST, declarations);
        registry.register(TokenType.IF, new IfStatementHandler());
        registry.register(TokenType.WHILE, new WhileStatementHandler());
        registry.register(TokenType.DO, new DoWhileStatementHandler());
        registry.register(TokenType.BREAK, new BreakStatementHandler());
        registry.register(TokenType.FOR, new ForStatementHandler());
        registry.register(TokenType.SWITCH, new SwitchStatementHandler());
        registry.register(TokenType.FUNCTION, new FunctionDeclarationHandler());
        registry.register(TokenType.RETURN, new ReturnStatementHandler());
        registry.register(TokenType.SHOW, new ShowStatementHandler());

        TheoremStatementHandler theorems = new TheoremStatementHandler();
        registry.register(TokenType.THEOREM, theorems);
        registry.register(TokenType.AXIOM, theorems);
        registry.register(TokenType.PROOF, new ProofStatementHandler());
        return registry;
    }
}
