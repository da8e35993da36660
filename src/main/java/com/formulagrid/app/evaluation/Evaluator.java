package com.formulagrid.app.evaluation;

import com.formulagrid.app.dispatch.CrossModuleDispatcher;
import com.formulagrid.app.formula.FormulaParseException;
import com.formulagrid.app.formula.Parser;
import com.formulagrid.app.formula.ast.BinaryOpNode;
import com.formulagrid.app.formula.ast.CellRefNode;
import com.formulagrid.app.formula.ast.FunctionCallNode;
import com.formulagrid.app.formula.ast.LiteralNode;
import com.formulagrid.app.formula.ast.Node;
import com.formulagrid.app.formula.ast.RangeRefNode;
import com.formulagrid.app.formula.ast.UnaryOpNode;
import com.formulagrid.app.functions.FunctionMetadata;
import com.formulagrid.app.functions.FunctionRegistry;
import com.formulagrid.app.functions.RegisteredFunction;
import com.formulagrid.app.references.CellAddress;
import com.formulagrid.app.references.ReferenceResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Recursive formula evaluator bound to one grid.
 *
 * Every descent into another cell goes through the guards: a depth counter and a
 * per-call evaluation counter, both cleared when the outermost {@link #evaluate} returns.
 * Cycles are detected by the grid through the {@code visited} set threaded along the
 * call path. Failures come back as sentinel strings (see {@link FormulaError}).
 *
 * Not thread-safe: the owner serializes calls.
 */
public class Evaluator {

    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final GridContext grid;
    private final FunctionRegistry functions;
    private final CrossModuleDispatcher dispatcher;
    private final EvaluationLimits limits;
    private final ReferenceResolver resolver;
    private final EvaluationContext context = new EvaluationContext();

    public Evaluator(GridContext grid, FunctionRegistry functions, CrossModuleDispatcher dispatcher,
                     EvaluationLimits limits) {
        this.grid = grid;
        this.functions = functions;
        this.dispatcher = dispatcher;
        this.limits = limits;
        this.resolver = new ReferenceResolver(limits.getMaxRangeCells());
    }

    public Object evaluate(String content) {
        return evaluate(content, new HashSet<>());
    }

    /**
     * Evaluates raw cell content. Text without a leading '=' is a literal.
     *
     * @param visited addresses in flight on this call path; the grid adds and removes entries
     * @return Double, Boolean, String (possibly "") or an error sentinel
     */
    public Object evaluate(String content, Set<CellAddress> visited) {
        if (content == null || !content.startsWith("=")) {
            return Values.parseLiteral(content);
        }
        String body = content.substring(1).trim();
        if (body.isEmpty()) {
            return "";
        }

        boolean outermost = context.begin();
        try {
            Node node = Parser.parse(body);
            Object value = evaluateScalar(node, visited);
            return value == null ? "" : value;
        } catch (FormulaParseException e) {
            log.debug("Parse error in '{}': {}", content, e.getMessage());
            return FormulaError.PARSE.sentinel();
        } catch (FormulaErrorException e) {
            log.debug("Evaluation of '{}' failed: {}", content, e.getMessage());
            return e.getSentinel();
        } finally {
            if (outermost) {
                context.reset();
            }
        }
    }

    private Object evaluateNode(Node node, Set<CellAddress> visited) {
        if (node instanceof LiteralNode) {
            return ((LiteralNode) node).getValue();
        }
        if (node instanceof CellRefNode) {
            return evaluateAddress(resolver.resolve((CellRefNode) node), visited);
        }
        if (node instanceof RangeRefNode) {
            return evaluateRange((RangeRefNode) node, visited);
        }
        if (node instanceof FunctionCallNode) {
            return callFunction((FunctionCallNode) node, visited);
        }
        if (node instanceof UnaryOpNode) {
            return evaluateUnary((UnaryOpNode) node, visited);
        }
        if (node instanceof BinaryOpNode) {
            return evaluateBinary((BinaryOpNode) node, visited);
        }
        throw new IllegalStateException("Unsupported node type: " + node.getClass().getName());
    }

    // Ranges are only legal as function arguments
    private Object evaluateScalar(Node node, Set<CellAddress> visited) {
        if (node instanceof RangeRefNode) {
            return FormulaError.VALUE.sentinel();
        }
        Object value = evaluateNode(node, visited);
        return value instanceof RangeValue ? FormulaError.VALUE.sentinel() : value;
    }

    /**
     * Guarded descent into one cell.
     */
    private Object evaluateAddress(CellAddress address, Set<CellAddress> visited) {
        context.enter();
        try {
            if (context.getDepth() >= limits.getMaxDepth()) {
                log.debug("Depth limit {} reached at {}", limits.getMaxDepth(), address);
                return FormulaError.DEPTH.sentinel();
            }
            if (context.getEvaluations() > limits.getMaxEvaluations()) {
                log.debug("Evaluation limit {} reached at {}", limits.getMaxEvaluations(), address);
                return FormulaError.LIMIT.sentinel();
            }
            Object value = grid.evaluateCell(address.getRow(), address.getCol(), visited);
            return value == null ? "" : value;
        } finally {
            context.exit();
        }
    }

    private RangeValue evaluateRange(RangeRefNode node, Set<CellAddress> visited) {
        List<CellAddress> addresses = resolver.expand(node);
        List<Object> values = new ArrayList<>(addresses.size());
        for (CellAddress address : addresses) {
            values.add(evaluateAddress(address, visited));
        }
        return new RangeValue(node.toRange().getRowCount(), node.toRange().getColumnCount(), values);
    }

    private Object callFunction(FunctionCallNode call, Set<CellAddress> visited) {
        RegisteredFunction function = functions.lookup(call.getName());
        if (function == null) {
            return FormulaError.NAME.sentinel();
        }
        FunctionMetadata metadata = function.getMetadata();
        int count = call.getArguments().size();
        if (count < metadata.getMinArgs() || count > metadata.getMaxArgs()) {
            return FormulaError.VALUE.sentinel();
        }

        List<Object> args = new ArrayList<>(count);
        for (Node argument : call.getArguments()) {
            Object value = evaluateArgument(argument, visited);
            if (!metadata.isErrorHandling()) {
                Object error = errorIn(value);
                if (error != null) {
                    return error;
                }
            }
            args.add(value);
        }

        try {
            Object result = function.getImplementation().apply(this, args);
            return result == null ? "" : result;
        } catch (FormulaErrorException e) {
            return e.getSentinel();
        } catch (RuntimeException e) {
            log.error("Function {} failed unexpectedly", metadata.getName(), e);
            throw e;
        }
    }

    // Errors raised while evaluating one argument stay local to it, so IFERROR can see them
    private Object evaluateArgument(Node argument, Set<CellAddress> visited) {
        try {
            return evaluateNode(argument, visited);
        } catch (FormulaErrorException e) {
            return e.getSentinel();
        }
    }

    private Object evaluateUnary(UnaryOpNode node, Set<CellAddress> visited) {
        Object operand = evaluateScalar(node.getOperand(), visited);
        if (FormulaError.isError(operand)) {
            return operand;
        }
        double value = Values.toNumber(operand);
        switch (node.getOperator()) {
            case SUBTRACT:
                return Values.number(-value);
            default:
                return Values.number(value);
        }
    }

    private Object evaluateBinary(BinaryOpNode node, Set<CellAddress> visited) {
        Object left = evaluateScalar(node.getLeft(), visited);
        if (FormulaError.isError(left)) {
            return left;
        }
        Object right = evaluateScalar(node.getRight(), visited);
        if (FormulaError.isError(right)) {
            return right;
        }

        switch (node.getOperator()) {
            case CONCAT:
                return Values.toText(left) + Values.toText(right);
            case EQUAL:
                return Values.compare(left, right) == 0;
            case NOT_EQUAL:
                return Values.compare(left, right) != 0;
            case LESS:
                return Values.compare(left, right) < 0;
            case GREATER:
                return Values.compare(left, right) > 0;
            case LESS_EQUAL:
                return Values.compare(left, right) <= 0;
            case GREATER_EQUAL:
                return Values.compare(left, right) >= 0;
            default:
                return arithmetic(node, Values.toNumber(left), Values.toNumber(right));
        }
    }

    private Object arithmetic(BinaryOpNode node, double left, double right) {
        switch (node.getOperator()) {
            case ADD:
                return Values.number(left + right);
            case SUBTRACT:
                return Values.number(left - right);
            case MULTIPLY:
                return Values.number(left * right);
            case DIVIDE:
                if (right == 0) {
                    return FormulaError.DIV_ZERO.sentinel();
                }
                return Values.number(left / right);
            case POWER:
                return Values.number(Math.pow(left, right));
            default:
                throw new IllegalStateException("Unhandled operator " + node.getOperator());
        }
    }

    private static Object errorIn(Object value) {
        if (value instanceof RangeValue) {
            return ((RangeValue) value).firstError();
        }
        return FormulaError.isError(value) ? value : null;
    }

    public CrossModuleDispatcher getDispatcher() {
        return dispatcher;
    }

    public EvaluationLimits getLimits() {
        return limits;
    }

    /** Guard state; idle (all zero) whenever no evaluation is running. */
    public EvaluationContext getContext() {
        return context;
    }
}
