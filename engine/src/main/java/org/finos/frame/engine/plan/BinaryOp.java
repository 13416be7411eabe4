package org.finos.frame.engine.plan;

import org.finos.frame.engine.store.DataType;

import java.util.List;
import java.util.Objects;

/**
 * Arithmetic, comparison or logical operation on two values.
 * The result is a column when either operand is a column, else a scalar.
 */
public record BinaryOp(
        BinaryOperator operator,
        ValueNode left,
        ValueNode right
) implements ValueNode {

    public BinaryOp {
        Objects.requireNonNull(operator, "Operator cannot be null");
        Objects.requireNonNull(left, "Left operand cannot be null");
        Objects.requireNonNull(right, "Right operand cannot be null");
    }

    public static BinaryOp of(ValueNode left, BinaryOperator operator, ValueNode right) {
        return new BinaryOp(operator, left, right);
    }

    public static BinaryOp equalTo(ValueNode left, ValueNode right) {
        return new BinaryOp(BinaryOperator.EQUALS, left, right);
    }

    @Override
    public String name() {
        return left.name();
    }

    @Override
    public DataType type() {
        if (operator.isPredicate()) {
            return DataType.BOOLEAN;
        }
        if (operator == BinaryOperator.DIVIDE) {
            return DataType.FLOAT;
        }
        return left.type().widen(right.type());
    }

    @Override
    public Shape shape() {
        return left.shape() == Shape.COLUMN || right.shape() == Shape.COLUMN ? Shape.COLUMN : Shape.SCALAR;
    }

    @Override
    public List<Object> inputs() {
        return List.of(operator, left, right);
    }

    @Override
    public <T> T accept(NodeVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public String toString() {
        return "(" + left + " " + operator.sql() + " " + right + ")";
    }
}
