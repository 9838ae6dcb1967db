package com.enterprise.sqlscribe.expression;

import com.enterprise.sqlscribe.condition.Comparison;
import com.enterprise.sqlscribe.condition.Condition;
import com.enterprise.sqlscribe.core.ComparisonOp;

/**
 * A node that renders to exactly one SQL fragment: a column, a literal,
 * a function call, an aliased expression or a reference to an alias.
 *
 * <p>The comparison methods build {@link Condition} leaves. The right-hand side
 * may be another expression or a plain Java value, which becomes a {@link Literal}
 * (a {@code String} there is a string literal, not a column name).
 *
 * <pre>{@code
 * Condition c = employee.column("salary").gt(1000)
 *         .and(employee.column("dept").eq("SALES"));
 * }</pre>
 */
public interface Expression {

    default Condition eq(Object other)  { return compare(ComparisonOp.EQ, other); }
    default Condition neq(Object other) { return compare(ComparisonOp.NEQ, other); }
    default Condition gt(Object other)  { return compare(ComparisonOp.GT, other); }
    default Condition gte(Object other) { return compare(ComparisonOp.GTE, other); }
    default Condition lt(Object other)  { return compare(ComparisonOp.LT, other); }
    default Condition lte(Object other) { return compare(ComparisonOp.LTE, other); }

    default Condition compare(ComparisonOp op, Object other) {
        return new Comparison(op, this, Expressions.value(other));
    }

    /** Wraps this expression with an alias; this expression is left untouched. */
    default Expression as(String alias) {
        return new Aliased(this, alias);
    }
}
