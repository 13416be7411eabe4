package org.finos.frame.engine.plan;

/**
 * Binary operators over scalars and columns.
 */
public enum BinaryOperator {
    ADD("+", Category.ARITHMETIC),
    SUBTRACT("-", Category.ARITHMETIC),
    MULTIPLY("*", Category.ARITHMETIC),
    DIVIDE("/", Category.ARITHMETIC),
    EQUALS("=", Category.COMPARISON),
    NOT_EQUALS("<>", Category.COMPARISON),
    LESS_THAN("<", Category.COMPARISON),
    LESS_THAN_OR_EQUAL("<=", Category.COMPARISON),
    GREATER_THAN(">", Category.COMPARISON),
    GREATER_THAN_OR_EQUAL(">=", Category.COMPARISON),
    AND("AND", Category.LOGICAL),
    OR("OR", Category.LOGICAL);

    public enum Category {
        ARITHMETIC,
        COMPARISON,
        LOGICAL
    }

    private final String sql;
    private final Category category;

    BinaryOperator(String sql, Category category) {
        this.sql = sql;
        this.category = category;
    }

    public String sql() {
        return sql;
    }

    public Category category() {
        return category;
    }

    public boolean isPredicate() {
        return category != Category.ARITHMETIC;
    }
}
