package com.formulagraph.app.expression;

import com.formulagraph.app.exceptions.EvaluationException;
import com.formulagraph.app.exceptions.InvalidAddressException;
import com.formulagraph.app.models.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser, lowest precedence first:
 * <pre>
 *   comparison := concat (( = | &lt;&gt; | &lt; | &lt;= | &gt; | &gt;= ) concat)*
 *   concat     := additive ( &amp; additive )*
 *   additive   := term (( + | - ) term)*
 *   term       := power (( * | / ) power)*
 *   power      := unary ( ^ unary )*
 *   unary      := ( - | + ) unary | postfix
 *   postfix    := primary ( % )*
 *   primary    := number | string | boolean | cell | range | name ( args ) | name | ( comparison )
 * </pre>
 * Negation binds tighter than '^', so -2^2 is 4 as in spreadsheets.
 * Nesting and tree height are bounded, which also bounds evaluation depth.
 */
final class Parser {

    static final int MAX_NESTING = 256;
    static final int MAX_DEPTH = 1024;

    private final List<Token> tokens;
    private int index;
    private int nesting;

    Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    ExprNode parse() {
        ExprNode root = comparison();
        if (peek().type != TokenType.END) {
            throw malformed("Unexpected " + describe(peek()));
        }
        return root;
    }

    private ExprNode comparison() {
        enter();
        try {
            return comparisonBody();
        } finally {
            nesting--;
        }
    }

    private ExprNode comparisonBody() {
        ExprNode left = concat();
        while (peek().type == TokenType.OPERATOR) {
            Operator operator = Operator.fromSymbol(peek().text);
            if (operator == null || !operator.isComparison()) {
                break;
            }
            index++;
            left = checked(new BinaryNode(operator, left, concat()));
        }
        return left;
    }

    private ExprNode concat() {
        ExprNode left = additive();
        while (peek().is(TokenType.OPERATOR, "&")) {
            index++;
            left = checked(new BinaryNode(Operator.CONCATENATE, left, additive()));
        }
        return left;
    }

    private ExprNode additive() {
        ExprNode left = term();
        while (peek().is(TokenType.OPERATOR, "+") || peek().is(TokenType.OPERATOR, "-")) {
            Operator operator = Operator.fromSymbol(next().text);
            left = checked(new BinaryNode(operator, left, term()));
        }
        return left;
    }

    private ExprNode term() {
        ExprNode left = power();
        while (peek().is(TokenType.OPERATOR, "*") || peek().is(TokenType.OPERATOR, "/")) {
            Operator operator = Operator.fromSymbol(next().text);
            left = checked(new BinaryNode(operator, left, power()));
        }
        return left;
    }

    private ExprNode power() {
        ExprNode left = unary();
        while (peek().is(TokenType.OPERATOR, "^")) {
            index++;
            left = checked(new BinaryNode(Operator.POWER, left, unary()));
        }
        return left;
    }

    private ExprNode unary() {
        if (peek().is(TokenType.OPERATOR, "-") || peek().is(TokenType.OPERATOR, "+")) {
            String operator = next().text;
            enter();
            try {
                return checked(new UnaryNode(operator, unary()));
            } finally {
                nesting--;
            }
        }
        return postfix();
    }

    private ExprNode postfix() {
        ExprNode node = primary();
        while (peek().is(TokenType.OPERATOR, "%")) {
            index++;
            node = checked(new UnaryNode("%", node));
        }
        return node;
    }

    private ExprNode primary() {
        Token token = next();
        switch (token.type) {
            case NUMBER:
                try {
                    return new LiteralNode(Double.parseDouble(token.text));
                } catch (NumberFormatException e) {
                    throw malformed("Bad number " + token.text);
                }
            case STRING:
                return new LiteralNode(token.text);
            case BOOLEAN:
                return new LiteralNode(Boolean.valueOf(token.text.equals("TRUE")));
            case CELL:
                return new CellNode(new CellReference(token.sheet, address(token.text)));
            case RANGE:
                String[] corners = token.text.split(":");
                return new RangeNode(new RangeReference(token.sheet, address(corners[0]), address(corners[1])));
            case NAME:
                if (peek().type == TokenType.LEFT_PAREN) {
                    index++;
                    return checked(new FunctionCallNode(token.text.toUpperCase(Locale.ROOT), arguments()));
                }
                return new NameNode(token.text);
            case LEFT_PAREN:
                ExprNode inner = comparison();
                expect(TokenType.RIGHT_PAREN);
                return inner;
            default:
                throw malformed("Unexpected " + describe(token));
        }
    }

    private List<ExprNode> arguments() {
        List<ExprNode> arguments = new ArrayList<>();
        if (peek().type == TokenType.RIGHT_PAREN) {
            index++;
            return arguments;
        }
        arguments.add(comparison());
        while (peek().type == TokenType.SEPARATOR) {
            index++;
            arguments.add(comparison());
        }
        expect(TokenType.RIGHT_PAREN);
        return arguments;
    }

    private void enter() {
        if (++nesting > MAX_NESTING) {
            nesting--;
            throw malformed("Formula is nested more than " + MAX_NESTING + " levels deep");
        }
    }

    private static ExprNode checked(ExprNode node) {
        int depth = 0;
        for (ExprNode child : node.children()) {
            depth = Math.max(depth, child.getDepth());
        }
        if (depth + 1 > MAX_DEPTH) {
            throw malformed("Formula expression is more than " + MAX_DEPTH + " levels deep");
        }
        node.setDepth(depth + 1);
        return node;
    }

    private static CellAddress address(String text) {
        try {
            return CellAddress.parse(text);
        } catch (InvalidAddressException e) {
            throw malformed(e.getMessage());
        }
    }

    private void expect(TokenType type) {
        Token token = next();
        if (token.type != type) {
            throw malformed("Expected " + type + " but found " + describe(token));
        }
    }

    private Token peek() {
        return tokens.get(index);
    }

    private Token next() {
        Token token = tokens.get(index);
        if (token.type != TokenType.END) {
            index++;
        }
        return token;
    }

    private static String describe(Token token) {
        return token.type == TokenType.END ? "end of formula" : "'" + token.text + "' at position " + token.position;
    }

    private static EvaluationException malformed(String message) {
        return new EvaluationException(EvaluationErrorType.MALFORMED_EXPRESSION, message);
    }
}
