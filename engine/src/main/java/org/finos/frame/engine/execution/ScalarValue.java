package org.finos.frame.engine.execution;

import org.finos.frame.engine.plan.Shape;
import org.finos.frame.engine.store.DataType;

import java.util.Objects;

/**
 * A single, possibly null, scalar.
 */
public record ScalarValue(Object value, DataType type) implements Value {

    public ScalarValue {
        Objects.requireNonNull(type, "Scalar type cannot be null");
    }

    public static ScalarValue of(Object value) {
        return new ScalarValue(value, DataType.infer(value));
    }

    public boolean isNull() {
        return value == null;
    }

    @Override
    public Shape shape() {
        return Shape.SCALAR;
    }
}
