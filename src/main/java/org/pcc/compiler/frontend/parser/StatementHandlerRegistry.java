package org.pcc.compiler.frontend.parser;

import org.pcc.compiler.frontend.lexer.TokenType;
import org.pcc.compiler.frontend.parser.features.constraint.ConstraintStatementHandler;
import org.pcc.compiler.frontend.parser.features.output.OutputStatementHandler;
import org.pcc.compiler.frontend.parser.features.prompt.PromptStatementHandler;
import org.pcc.compiler.frontend.parser.features.template.TemplateStatementHandler;
import org.pcc.compiler.frontend.parser.features.var.VarStatementHandler;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A registry for statement handlers, keyed by the keyword that starts the statement.
 */
public class StatementHandlerRegistry {
    private final Map<TokenType, IStatementHandler> handlers = new EnumMap<>(TokenType.class);

    /**
     * Registers a new statement handler.
     * @param keyword The keyword token type (e.g., {@link TokenType#PROMPT}).
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
     * @return The keywords that start a statement.
     */
    public Set<TokenType> keywords() {
        return handlers.keySet();
    }

    /**
     * Initializes the registry with all the built-in handlers.
     * @return A new instance of {@link StatementHandlerRegistry} with all handlers registered.
     */
    public static StatementHandlerRegistry initialize() {
        StatementHandlerRegistry registry = new StatementHandlerRegistry();
        registry.register(TokenType.PROMPT, new PromptStatementHandler());
        registry.register(TokenType.VAR, new VarStatementHandler());
        registry.register(TokenType.TEMPLATE, new TemplateStatementHandler());
        registry.register(TokenType.CONSTRAINT, new ConstraintStatementHandler());
        registry.register(TokenType.OUTPUT, new OutputStatementHandler());
        return registry;
    }
}
