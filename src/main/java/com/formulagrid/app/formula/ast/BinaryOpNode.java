package com.formulagrid.app.formula.ast;

public final class BinaryOpNode implements Node {

    private final Operator operator;
    private final Node left;
    private final Node right;

    public BinaryOpNode(Operator operator, Node left, Node right) {
        this.operator = operator;
        this.left = left;
        this.right = right;
    }

    public Operator getOperator() {
        return operator;
    }

    public Node getLeft() {
        return left;
    }

    public Node getRight() {
        return right;
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.getSymbol() + " " + right + ")";
    }
}
