package com.enterprise.sqlscribe.condition;

import com.enterprise.sqlscribe.core.ComparisonOp;
import com.enterprise.sqlscribe.expression.Expressions;

/**
 * Static factory for creating {@link Condition} instances.
 * Designed to be imported statically for a clean DSL.
 *
 * <p>The left operand may be an expression or a column name; the right operand
 * may be an expression or a value, which is rendered as a literal.
 *
 * <pre>{@code
 * import static com.enterprise.sqlscribe.condition.Conditions.*;
 *
 * Condition c = or(
 *     gt("salary", 1000),
 *     and(eq("dept", "SALES"), lt("age", 30))
 * );
 * }</pre>
 */
public final class Conditions {

    private Conditions() {}

    // ==================== Comparisons ====================

    public static Condition eq(Object left, Object right)  { return compare(left, ComparisonOp.EQ, right); }
    public static Condition neq(Object left, Object right) { return compare(left, ComparisonOp.NEQ, right); }
    public static Condition gt(Object left, Object right)  { return compare(left, ComparisonOp.GT, right); }
    public static Condition gte(Object left, Object right) { return compare(left, ComparisonOp.GTE, right); }
    public static Condition lt(Object left, Object right)  { return compare(left, ComparisonOp.LT, right); }
    public static Condition lte(Object left, Object right) { return compare(left, ComparisonOp.LTE, right); }

    public static Condition compare(Object left, ComparisonOp op, Object right) {
        return new Comparison(op, Expressions.of(left), Expressions.value(right));
    }

    // ==================== Composite conditions (AND/OR) ====================

    /**
     * Combines conditions with AND, nesting strictly left to right:
     * {@code and(a, b, c)} is {@code (a AND b) AND c}.
     */
    public static Condition and(Condition first, Condition... rest) {
        return fold(BooleanCombination.Logic.AND, first, rest);
    }

    /**
     * Combines conditions with OR, nesting strictly left to right.
     */
    public static Condition or(Condition first, Condition... rest) {
        return fold(BooleanCombination.Logic.OR, first, rest);
    }

    // ==================== Helpers ====================

    private static Condition fold(BooleanCombination.Logic logic, Condition first, Condition[] rest) {
        if (first == null) {
            throw new NullPointerException(logic + " requires non-null conditions");
        }
        Condition result = first;
        for (Condition next : rest) {
            result = new BooleanCombination(logic, result, next);
        }
        return result;
    }
}
