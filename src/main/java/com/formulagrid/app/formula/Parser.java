package com.formulagrid.app.formula;

import com.formulagrid.app.formula.ast.BinaryOpNode;
import com.formulagrid.app.formula.ast.CellRefNode;
import com.formulagrid.app.formula.ast.FunctionCallNode;
import com.formulagrid.app.formula.ast.LiteralNode;
import com.formulagrid.app.formula.ast.Node;
import com.formulagrid.app.formula.ast.Operator;
import com.formulagrid.app.formula.ast.RangeRefNode;
import com.formulagrid.app.formula.ast.UnaryOpNode;
import com.formulagrid.app.references.CellAddress;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;

/**
 * Recursive descent parser for formula bodies.
 *
 * Precedence, lowest first:
 * comparison, concatenation (&amp;), additive, multiplicative, power (^), prefix sign, primary.
 * All binary levels are left-associative.
 *
 * Both parsing and evaluation recurse over the tree, so its shape is bounded:
 * at most {@link #MAX_NESTING} nested parentheses, signs and calls, and at most
 * {@link #MAX_HEIGHT} levels in the finished tree (long operator chains count too).
 */
public final class Parser {

    public static final int MAX_NESTING = 100;
    public static final int MAX_HEIGHT = 200;

    private final List<Token> tokens;
    private int pos;
    private int nesting;

    private Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a formula body (without the leading '=').
     *
     * @throws FormulaParseException if the text is not a complete expression
     */
    public static Node parse(String body) {
        Parser parser = new Parser(Tokenizer.tokenize(body));
        Node node = parser.expression();
        Token trailing = parser.current();
        if (trailing.getType() != TokenType.EOF) {
            throw new FormulaParseException("Unexpected " + trailing, trailing.getStart());
        }
        checkHeight(node);
        return node;
    }

    // Iterative, so a tree that is too tall is rejected without recursing into it
    private static void checkHeight(Node root) {
        Deque<Node> nodes = new ArrayDeque<>();
        Deque<Integer> levels = new ArrayDeque<>();
        nodes.push(root);
        levels.push(1);
        while (!nodes.isEmpty()) {
            Node node = nodes.pop();
            int level = levels.pop();
            if (level > MAX_HEIGHT) {
                throw new FormulaParseException("Formula nests deeper than " + MAX_HEIGHT + " levels", 0);
            }
            List<Node> children = new ArrayList<>();
            if (node instanceof BinaryOpNode) {
                children.add(((BinaryOpNode) node).getLeft());
                children.add(((BinaryOpNode) node).getRight());
            } else if (node instanceof UnaryOpNode) {
                children.add(((UnaryOpNode) node).getOperand());
            } else if (node instanceof FunctionCallNode) {
                children.addAll(((FunctionCallNode) node).getArguments());
            }
            for (Node child : children) {
                if (child != null) {
                    nodes.push(child);
                    levels.push(level + 1);
                }
            }
        }
    }

    private Node expression() {
        Node node = concatenation();
        while (current().getType() == TokenType.OPERATOR) {
            Operator op = Operator.fromSymbol(current().getText());
            if (op == null || !op.isComparison()) {
                break;
            }
            advance();
            node = new BinaryOpNode(op, node, concatenation());
        }
        return node;
    }

    private Node concatenation() {
        Node node = additive();
        while (current().is(TokenType.OPERATOR, "&")) {
            advance();
            node = new BinaryOpNode(Operator.CONCAT, node, additive());
        }
        return node;
    }

    private Node additive() {
        Node node = multiplicative();
        while (current().is(TokenType.OPERATOR, "+") || current().is(TokenType.OPERATOR, "-")) {
            Operator op = Operator.fromSymbol(advance().getText());
            node = new BinaryOpNode(op, node, multiplicative());
        }
        return node;
    }

    private Node multiplicative() {
        Node node = power();
        while (current().is(TokenType.OPERATOR, "*") || current().is(TokenType.OPERATOR, "/")) {
            Operator op = Operator.fromSymbol(advance().getText());
            node = new BinaryOpNode(op, node, power());
        }
        return node;
    }

    private Node power() {
        Node node = unary();
        while (current().is(TokenType.OPERATOR, "^")) {
            advance();
            node = new BinaryOpNode(Operator.POWER, node, unary());
        }
        return node;
    }

    private Node unary() {
        Token token = current();
        if (++nesting > MAX_NESTING) {
            throw new FormulaParseException("Formula nests deeper than " + MAX_NESTING + " levels",
                    token.getStart());
        }
        try {
            if (token.is(TokenType.OPERATOR, "-") || token.is(TokenType.OPERATOR, "+")) {
                Operator op = Operator.fromSymbol(advance().getText());
                return new UnaryOpNode(op, unary());
            }
            return primary();
        } finally {
            nesting--;
        }
    }

    private Node primary() {
        Token token = current();
        switch (token.getType()) {
            case NUMBER:
                advance();
                try {
                    return new LiteralNode(Double.parseDouble(token.getText()));
                } catch (NumberFormatException e) {
                    throw new FormulaParseException("Bad number '" + token.getText() + "'", token.getStart());
                }
            case STRING:
                advance();
                return new LiteralNode(token.getText());
            case LPAREN:
                advance();
                Node inner = expression();
                expect(TokenType.RPAREN);
                return inner;
            case IDENTIFIER:
                return identifier();
            case EOF:
                throw new FormulaParseException("Unexpected end of formula", token.getStart());
            default:
                throw new FormulaParseException("Unexpected " + token, token.getStart());
        }
    }

    private Node identifier() {
        Token name = advance();

        if (current().getType() == TokenType.LPAREN) {
            advance();
            return new FunctionCallNode(name.getText(), arguments());
        }

        if (current().is(TokenType.OPERATOR, ":")) {
            advance();
            Token end = current();
            if (end.getType() != TokenType.IDENTIFIER) {
                throw new FormulaParseException("Expected cell reference after ':'", end.getStart());
            }
            advance();
            return new RangeRefNode(cellRef(name), cellRef(end));
        }

        if (name.getText().equalsIgnoreCase("TRUE")) {
            return new LiteralNode(Boolean.TRUE);
        }
        if (name.getText().equalsIgnoreCase("FALSE")) {
            return new LiteralNode(Boolean.FALSE);
        }
        return cellRef(name);
    }

    // Empty slots like F(,1) or F(1,) become LiteralNode.OMITTED
    private List<Node> arguments() {
        List<Node> args = new ArrayList<>();
        if (current().getType() == TokenType.RPAREN) {
            advance();
            return args;
        }
        while (true) {
            if (current().getType() == TokenType.COMMA || current().getType() == TokenType.RPAREN) {
                args.add(LiteralNode.OMITTED);
            } else {
                args.add(expression());
            }
            if (current().getType() == TokenType.COMMA) {
                advance();
                continue;
            }
            expect(TokenType.RPAREN);
            return args;
        }
    }

    private CellRefNode cellRef(Token token) {
        Matcher matcher = CellAddress.A1_PATTERN.matcher(token.getText());
        if (!matcher.matches()) {
            throw new FormulaParseException("Unknown identifier '" + token.getText() + "'", token.getStart());
        }
        CellAddress address;
        try {
            address = CellAddress.parse(token.getText());
        } catch (IllegalArgumentException e) {
            throw new FormulaParseException(e.getMessage(), token.getStart());
        }
        return new CellRefNode(address, !matcher.group(1).isEmpty(), !matcher.group(3).isEmpty());
    }

    private Token current() {
        return tokens.get(pos);
    }

    private Token advance() {
        Token token = tokens.get(pos);
        if (token.getType() != TokenType.EOF) {
            pos++;
        }
        return token;
    }

    private void expect(TokenType type) {
        Token token = current();
        if (token.getType() != type) {
            throw new FormulaParseException("Expected " + type + ", got " + token, token.getStart());
        }
        advance();
    }
}
