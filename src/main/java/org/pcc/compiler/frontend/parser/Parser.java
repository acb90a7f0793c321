package org.pcc.compiler.frontend.parser;

import org.pcc.compiler.api.SourcePosition;
import org.pcc.compiler.config.CompilerOptions;
import org.pcc.compiler.frontend.lexer.Token;
import org.pcc.compiler.frontend.lexer.TokenType;
import org.pcc.compiler.frontend.parser.ast.*;
import org.pcc.compiler.util.DepthGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The recursive-descent parser for the prompt language. It consumes a list of tokens
 * from the {@link org.pcc.compiler.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Top-level statements are dispatched to {@link IStatementHandler}s by their leading keyword.
 * A malformed statement records one {@link ParseError}; the parser then skips to the next
 * statement boundary and continues, so a single run reports errors of several statements.
 */
public class Parser implements ParsingContext {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private final List<Token> tokens;
    private final StatementHandlerRegistry statementRegistry;
    private final DepthGuard depthGuard;
    private final List<ParseError> errors = new ArrayList<>();
    private int current = 0;

    /**
     * Constructs a new Parser with the default nesting limit.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     */
    public Parser(List<Token> tokens) {
        this(tokens, CompilerOptions.defaults().maxNestingDepth());
    }

    /**
     * Constructs a new Parser.
     * @param tokens The list of tokens to parse, terminated by {@link TokenType#END_OF_FILE}.
     * @param maxNestingDepth The deepest expression or block nesting accepted.
     */
    public Parser(List<Token> tokens, int maxNestingDepth) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_FILE) {
            throw new IllegalArgumentException("Token list must end with END_OF_FILE");
        }
        this.tokens = tokens;
        this.statementRegistry = StatementHandlerRegistry.initialize();
        this.depthGuard = new DepthGuard("parser", maxNestingDepth);
    }

    /**
     * Parses the entire token stream.
     * @return The program and all syntax errors.
     * @throws org.pcc.compiler.util.ResourceLimitException if the input nests too deeply.
     */
    public ParseResult parse() {
        SourcePosition start = peek().position();
        ListNode statements = new ListNode(AstNodeKind.STATEMENT_LIST, start);
        ListNode outputs = new ListNode(AstNodeKind.STATEMENT_LIST, start);
        while (!isAtEnd()) {
            AstNode statement = declaration();
            if (statement == null) {
                continue;
            }
            if (statement.kind() == AstNodeKind.OUTPUT_SPEC) {
                outputs.add(statement);
            } else {
                statements.add(statement);
            }
        }
        LOG.debug("Parsed {} statements and {} output specs with {} errors",
                statements.size(), outputs.size(), errors.size());
        return new ParseResult(new ProgramNode(statements, outputs, start), errors);
    }

    /**
     * Parses a single top-level statement.
     * @return The parsed {@link AstNode}, or null if the statement was malformed.
     */
    public AstNode declaration() {
        int statementStart = current;
        try {
            Token keyword = peek();
            Optional<IStatementHandler> handler = statementRegistry.get(keyword.type());
            if (handler.isEmpty()) {
                throw error(keyword, "Expected statement keyword but found " + describe(keyword) + ".");
            }
            return handler.get().parse(this);
        } catch (ParseException ex) {
            synchronize(statementStart);
            return null;
        }
    }

    /**
     * Panic-mode recovery: skips the rest of the broken statement. Stops after the
     * {@code ;} or {@code }} that closes the statement, or before the next statement keyword.
     */
    private void synchronize(int statementStart) {
        if (current == statementStart) {
            advance();
        }
        int depth = 0;
        for (int i = statementStart; i < current; i++) {
            depth += braceDelta(tokens.get(i).type());
        }
        while (!isAtEnd()) {
            if (statementRegistry.keywords().contains(peek().type())) return;
            Token token = advance();
            depth += braceDelta(token.type());
            if (token.type() == TokenType.RIGHT_BRACE && depth <= 0) return;
            if (token.type() == TokenType.SEMICOLON && depth <= 0) return;
        }
    }

    private static int braceDelta(TokenType type) {
        if (type == TokenType.LEFT_BRACE) return 1;
        if (type == TokenType.RIGHT_BRACE) return -1;
        return 0;
    }

    // region Prompt elements

    @Override
    public ListNode block() {
        Token open = consume(TokenType.LEFT_BRACE, "Expected '{' to start a block.");
        depthGuard.enter(open.position());
        try {
            ListNode elements = new ListNode(AstNodeKind.ELEMENT_LIST, open.position());
            while (!check(TokenType.RIGHT_BRACE) && !isAtEnd()) {
                element(elements);
            }
            consume(TokenType.RIGHT_BRACE, "Expected '}' to close the block.");
            return elements;
        } finally {
            depthGuard.exit();
        }
    }

    private void element(ListNode into) {
        if (match(TokenType.STRING)) {
            interpolate(previous(), into);
        } else if (match(TokenType.RAW)) {
            Token text = consume(TokenType.STRING, "Expected string after RAW.");
            into.add(new TextElementNode((String) text.value(), true, text.position()));
        } else if (match(TokenType.VARIABLE_REF)) {
            Token ref = previous();
            into.add(new VariableRefNode((String) ref.value(), ref.position()));
        } else if (match(TokenType.TEMPLATE_CALL)) {
            into.add(call(previous(), true));
        } else if (match(TokenType.IF)) {
            into.add(ifElement(previous()));
        } else if (match(TokenType.FOR)) {
            Token keyword = previous();
            Token variable = consume(TokenType.IDENTIFIER, "Expected loop variable after FOR.");
            consume(TokenType.IN, "Expected IN after loop variable.");
            AstNode iterable = expression();
            ListNode body = block();
            into.add(new ForNode(variable.text(), variable.position(), iterable, body, keyword.position()));
        } else if (match(TokenType.WHILE)) {
            Token keyword = previous();
            AstNode condition = expression();
            ListNode body = block();
            into.add(new WhileNode(condition, body, keyword.position()));
        } else {
            throw error(peek(), "Expected prompt element but found " + describe(peek()) + ".");
        }
    }

    private IfNode ifElement(Token keyword) {
        AstNode condition = expression();
        ListNode thenBranch = block();
        AstNode elseBranch = null;
        if (match(TokenType.ELSE)) {
            if (match(TokenType.IF)) {
                Token nested = previous();
                depthGuard.enter(nested.position());
                try {
                    elseBranch = ifElement(nested);
                } finally {
                    depthGuard.exit();
                }
            } else {
                elseBranch = block();
            }
        }
        return new IfNode(condition, thenBranch, elseBranch, keyword.position());
    }

    /**
     * Splits a string element into text segments and {@code $name} references.
     */
    private void interpolate(Token string, ListNode into) {
        String text = (String) string.value();
        SourcePosition position = string.position();
        StringBuilder segment = new StringBuilder();
        boolean emitted = false;
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '$' && i + 1 < text.length() && isIdentifierStart(text.charAt(i + 1))) {
                if (segment.length() > 0) {
                    into.add(new TextElementNode(segment.toString(), false, position));
                    segment.setLength(0);
                }
                int end = i + 1;
                while (end < text.length() && isIdentifierPart(text.charAt(end))) end++;
                // Columns count decoded characters after the opening quote.
                SourcePosition refPosition = new SourcePosition(
                        position.line(), position.column() + 1 + i, position.fileName());
                into.add(new VariableRefNode(text.substring(i + 1, end), refPosition));
                emitted = true;
                i = end;
            } else {
                segment.append(c);
                i++;
            }
        }
        if (segment.length() > 0 || !emitted) {
            into.add(new TextElementNode(segment.toString(), false, position));
        }
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    // endregion

    // region Expressions

    @Override
    public AstNode expression() {
        depthGuard.enter(peek().position());
        try {
            return or();
        } finally {
            depthGuard.exit();
        }
    }

    private AstNode or() {
        AstNode expr = and();
        while (match(TokenType.OR)) {
            Token op = previous();
            expr = new BinaryExprNode(Operator.OR, expr, and(), op.position());
        }
        return expr;
    }

    private AstNode and() {
        AstNode expr = not();
        while (match(TokenType.AND)) {
            Token op = previous();
            expr = new BinaryExprNode(Operator.AND, expr, not(), op.position());
        }
        return expr;
    }

    private AstNode not() {
        if (match(TokenType.NOT)) {
            Token op = previous();
            depthGuard.enter(op.position());
            try {
                return new UnaryExprNode(Operator.NOT, not(), op.position());
            } finally {
                depthGuard.exit();
            }
        }
        return comparison();
    }

    private AstNode comparison() {
        AstNode expr = additive();
        while (true) {
            Operator operator = comparisonOperator();
            if (operator == null) {
                return expr;
            }
            Token op = previous();
            expr = new BinaryExprNode(operator, expr, additive(), op.position());
        }
    }

    private Operator comparisonOperator() {
        if (match(TokenType.EQUAL_EQUAL)) return Operator.EQUAL;
        if (match(TokenType.BANG_EQUAL)) return Operator.NOT_EQUAL;
        if (match(TokenType.LESS)) return Operator.LESS;
        if (match(TokenType.GREATER)) return Operator.GREATER;
        if (match(TokenType.LESS_EQUAL)) return Operator.LESS_EQUAL;
        if (match(TokenType.GREATER_EQUAL)) return Operator.GREATER_EQUAL;
        if (match(TokenType.IN)) return Operator.IN;
        if (check(TokenType.NOT) && checkNext(TokenType.IN)) {
            advance(); // NOT
            advance(); // IN
            return Operator.NOT_IN;
        }
        return null;
    }

    private AstNode additive() {
        AstNode expr = term();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Operator operator = op.type() == TokenType.PLUS ? Operator.ADD : Operator.SUBTRACT;
            expr = new BinaryExprNode(operator, expr, term(), op.position());
        }
        return expr;
    }

    private AstNode term() {
        AstNode expr = power();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Operator operator;
            if (op.type() == TokenType.STAR) {
                operator = Operator.MULTIPLY;
            } else if (op.type() == TokenType.SLASH) {
                operator = Operator.DIVIDE;
            } else {
                operator = Operator.MODULO;
            }
            expr = new BinaryExprNode(operator, expr, power(), op.position());
        }
        return expr;
    }

    private AstNode power() {
        AstNode base = unary();
        if (match(TokenType.CARET)) {
            Token op = previous();
            depthGuard.enter(op.position());
            try {
                // Right-associative: 2 ^ 3 ^ 2 == 2 ^ (3 ^ 2)
                return new BinaryExprNode(Operator.POWER, base, power(), op.position());
            } finally {
                depthGuard.exit();
            }
        }
        return base;
    }

    private AstNode unary() {
        if (match(TokenType.MINUS, TokenType.BANG)) {
            Token op = previous();
            Operator operator = op.type() == TokenType.MINUS ? Operator.NEGATE : Operator.BANG;
            depthGuard.enter(op.position());
            try {
                return new UnaryExprNode(operator, unary(), op.position());
            } finally {
                depthGuard.exit();
            }
        }
        return primary();
    }

    private AstNode primary() {
        Token token = peek();
        switch (token.type()) {
            case NUMBER:
                advance();
                return new NumberLiteralNode((Double) token.value(), token.position());
            case STRING:
                advance();
                return new StringLiteralNode((String) token.value(), token.position());
            case TRUE:
            case FALSE:
                advance();
                return new BooleanLiteralNode((Boolean) token.value(), token.position());
            case VARIABLE_REF:
                advance();
                return new VariableRefNode((String) token.value(), token.position());
            case TEMPLATE_CALL:
                advance();
                return call(token, true);
            case IDENTIFIER:
                advance();
                if (check(TokenType.LEFT_PAREN)) {
                    return call(token, false);
                }
                return new IdentifierNode(token.text(), token.position());
            case LEFT_PAREN: {
                advance();
                AstNode inner = expression();
                consume(TokenType.RIGHT_PAREN, "Expected ')' after expression.");
                return inner;
            }
            case LEFT_BRACKET: {
                advance();
                ListNode items = new ListNode(AstNodeKind.EXPRESSION_LIST, token.position());
                if (!check(TokenType.RIGHT_BRACKET)) {
                    do {
                        items.add(expression());
                    } while (match(TokenType.COMMA));
                }
                consume(TokenType.RIGHT_BRACKET, "Expected ']' after list items.");
                return items;
            }
            default:
                throw error(token, "Expected expression but found " + describe(token) + ".");
        }
    }

    /**
     * Parses the optional argument list of a call whose name token was already consumed.
     * Template calls may omit the parentheses; function calls always have them.
     */
    private CallNode call(Token nameToken, boolean template) {
        String name = template ? (String) nameToken.value() : nameToken.text();
        ListNode arguments = new ListNode(AstNodeKind.ARGUMENT_LIST, nameToken.position());
        if (match(TokenType.LEFT_PAREN)) {
            if (!check(TokenType.RIGHT_PAREN)) {
                do {
                    arguments.add(expression());
                } while (match(TokenType.COMMA));
            }
            consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments.");
        }
        return new CallNode(name, template, arguments, nameToken.position());
    }

    // endregion

    /**
     * @return An unmodifiable view of the errors recorded so far.
     */
    public List<ParseError> getErrors() {
        return List.copyOf(errors);
    }

    private static String describe(Token token) {
        return token.type() == TokenType.END_OF_FILE ? "end of input" : "'" + token.text() + "'";
    }

    @Override
    public ParseException error(Token token, String message) {
        errors.add(new ParseError(message, token.position()));
        return new ParseException(message);
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    @Override
    public boolean checkNext(TokenType type) {
        if (isAtEnd() || current + 1 >= tokens.size()) return false;
        return tokens.get(current + 1).type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token previous() {
        return tokens.get(current - 1);
    }

    @Override
    public Token consume(TokenType type, String errorMessage) {
        if (check(type)) return advance();
        Token unexpected = peek();
        throw error(unexpected, errorMessage + " Found " + describe(unexpected) + ".");
    }
}
