package com.formulagrid.app.formula.ast;

/**
 * Prefix sign: only ADD and SUBTRACT are valid operators here.
 */
public final class UnaryOpNode implements Node {

    private final Operator operator;
    private final Node operand;

    public UnaryOpNode(Operator operator, Node operand) {
        if (operator != Operator.ADD && operator != Operator.SUBTRACT) {
            throw new IllegalArgumentException("Not a prefix operator: " + operator);
        }
        this.operator = operator;
        this.operand = operand;
    }

    public Operator getOperator() {
        return operator;
    }

    public Node getOperand() {
        return operand;
    }

    @Override
    public String toString() {
        return operator.getSymbol() + operand;
    }
}
