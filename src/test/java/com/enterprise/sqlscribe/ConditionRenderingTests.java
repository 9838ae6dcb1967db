package com.enterprise.sqlscribe;

import com.enterprise.sqlscribe.builder.SqlRenderer;
import com.enterprise.sqlscribe.condition.BooleanCombination;
import com.enterprise.sqlscribe.condition.Comparison;
import com.enterprise.sqlscribe.condition.Condition;
import com.enterprise.sqlscribe.core.ComparisonOp;
import com.enterprise.sqlscribe.expression.Expressions;
import com.enterprise.sqlscribe.expression.Literal;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static com.enterprise.sqlscribe.condition.Conditions.*;
import static com.enterprise.sqlscribe.expression.Functions.*;
import static org.assertj.core.api.Assertions.*;

public class ConditionRenderingTests {

    private final Condition a = eq("a", 1);
    private final Condition b = eq("b", 2);
    private final Condition c = eq("c", 3);

    // ==================== Comparisons ====================

    @Test
    void testEveryOperator() {
        assertThat(SqlRenderer.condition(eq("x", 1))).isEqualTo("x = 1");
        assertThat(SqlRenderer.condition(neq("x", 1))).isEqualTo("x <> 1");
        assertThat(SqlRenderer.condition(gt("x", 1))).isEqualTo("x > 1");
        assertThat(SqlRenderer.condition(gte("x", 1))).isEqualTo("x >= 1");
        assertThat(SqlRenderer.condition(lt("x", 1))).isEqualTo("x < 1");
        assertThat(SqlRenderer.condition(lte("x", 1))).isEqualTo("x <= 1");
    }

    @Test
    void testStringOnRightIsStringLiteral() {
        assertThat(SqlRenderer.condition(eq("name", "O'Brien"))).isEqualTo("name = 'O''Brien'");
    }

    @Test
    void testDecimalLiteralInPlainNotation() {
        assertThat(SqlRenderer.condition(gt("amount", new BigDecimal("1E+3")))).isEqualTo("amount > 1000");
    }

    @Test
    void testColumnToLiteralDropsQualifier() {
        Condition cond = Expressions.column("employee", "salary").gt(1000);
        assertThat(SqlRenderer.condition(cond)).isEqualTo("salary > 1000");
    }

    @Test
    void testColumnToColumnKeepsQualifiers() {
        Condition cond = Expressions.column("payroll", "id").eq(Expressions.column("employee", "payroll_id"));
        assertThat(SqlRenderer.condition(cond)).isEqualTo("payroll.id = employee.payroll_id");
    }

    @Test
    void testFunctionOperand() {
        assertThat(SqlRenderer.condition(max("salary").gt(10))).isEqualTo("MAX(salary) > 10");
    }

    @Test
    void testNullComparisonValueRejected() {
        assertThatThrownBy(() -> eq("a", null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> Expressions.column("a").gt(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testComparisonBuildsDataNode() {
        Condition cond = Expressions.column("t", "x").lt(5);
        assertThat(cond).isEqualTo(new Comparison(ComparisonOp.LT,
                Expressions.column("t", "x"), new Literal(5)));
    }

    // ==================== AND / OR nesting ====================

    @Test
    void testLeftNestedSameOperatorHasNoParens() {
        assertThat(SqlRenderer.condition(and(a, b, c))).isEqualTo("a = 1 AND b = 2 AND c = 3");
        assertThat(SqlRenderer.condition(a.or(b).or(c))).isEqualTo("a = 1 OR b = 2 OR c = 3");
    }

    @Test
    void testRightNestedSameOperatorIsParenthesized() {
        assertThat(SqlRenderer.condition(a.and(b.and(c)))).isEqualTo("a = 1 AND (b = 2 AND c = 3)");
    }

    @Test
    void testOrUnderAndIsParenthesized() {
        assertThat(SqlRenderer.condition(a.or(b).and(c))).isEqualTo("(a = 1 OR b = 2) AND c = 3");
        assertThat(SqlRenderer.condition(c.and(a.or(b)))).isEqualTo("c = 3 AND (a = 1 OR b = 2)");
    }

    @Test
    void testAndUnderOrIsParenthesized() {
        assertThat(SqlRenderer.condition(a.and(b).or(c))).isEqualTo("(a = 1 AND b = 2) OR c = 3");
    }

    @Test
    void testDistinctTreesRenderDistinctly() {
        List<Condition> trees = List.of(
                a.and(b).and(c), a.and(b.and(c)),
                a.or(b).or(c), a.or(b.or(c)),
                a.and(b).or(c), a.and(b.or(c)),
                a.or(b).and(c), a.or(b.and(c)));
        Set<String> rendered = new HashSet<>();
        for (Condition tree : trees) {
            rendered.add(SqlRenderer.condition(tree));
        }
        assertThat(rendered).hasSize(trees.size());
    }

    @Test
    void testCombiningDoesNotMutateOperands() {
        String before = SqlRenderer.condition(a);
        Condition combined = a.and(b);

        assertThat(combined).isInstanceOf(BooleanCombination.class);
        assertThat(((BooleanCombination) combined).left()).isSameAs(a);
        assertThat(SqlRenderer.condition(a)).isEqualTo(before);
        assertThat(a.and(b)).isNotSameAs(combined).isEqualTo(combined);
    }

    @Test
    void testAndRequiresFirstCondition() {
        assertThatThrownBy(() -> and(null, a)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> a.or(null)).isInstanceOf(NullPointerException.class);
    }
}
