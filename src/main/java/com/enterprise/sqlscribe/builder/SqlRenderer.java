package com.enterprise.sqlscribe.builder;

import com.enterprise.sqlscribe.condition.BooleanCombination;
import com.enterprise.sqlscribe.condition.Comparison;
import com.enterprise.sqlscribe.condition.Condition;
import com.enterprise.sqlscribe.core.TableRef;
import com.enterprise.sqlscribe.dialect.DialectRules;
import com.enterprise.sqlscribe.exception.IncompleteQueryException;
import com.enterprise.sqlscribe.expression.AliasRef;
import com.enterprise.sqlscribe.expression.Aliased;
import com.enterprise.sqlscribe.expression.ColumnRef;
import com.enterprise.sqlscribe.expression.Expression;
import com.enterprise.sqlscribe.expression.FunctionCall;
import com.enterprise.sqlscribe.expression.Literal;
import com.enterprise.sqlscribe.expression.Star;
import com.enterprise.sqlscribe.param.SqlLiteralFormatter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns a {@link Query} into SQL text for a dialect. Stateless and deterministic:
 * the same query state and rules always give the same string.
 *
 * <p>Layout: {@code SELECT <cols> FROM <source>[ AS <alias>][ <joins>][ WHERE <predicate>][ GROUP BY <cols>]}.
 * Lists are joined with a bare comma. Identifiers in the select list, GROUP BY,
 * FROM and JOIN targets are quoted; predicates and function arguments are not.
 *
 * <p>Once a table is aliased (the source via {@link Query#as}, a join target via
 * {@link TableRef#as}) column qualifiers naming that table render as the alias.
 */
public final class SqlRenderer {

    private static final Logger log = LoggerFactory.getLogger(SqlRenderer.class);

    private SqlRenderer() {}

    /** Where an expression appears; decides quoting and qualification. */
    private enum Placement { PROJECTION, PREDICATE, ARGUMENT }

    /** Per-statement rendering state: dialect, whether to qualify, table name to alias. */
    private record Scope(DialectRules rules, boolean qualify, Map<String, String> aliases) {

        static final Scope UNALIASED = new Scope(null, false, Map.of());

        String qualifier(String tableName) {
            return aliases.getOrDefault(tableName, tableName);
        }
    }

    public static String render(Query query, DialectRules rules) {
        if (query.source() == null) {
            throw new IncompleteQueryException("Cannot build query: no source table");
        }
        Scope scope = new Scope(rules, !query.joins().isEmpty(), aliases(query));
        StringBuilder sql = new StringBuilder();

        // SELECT
        sql.append("SELECT ");
        if (query.selected().isEmpty()) {
            sql.append("*");
        } else {
            sql.append(projectionList(query.selected(), scope));
        }

        // FROM
        sql.append(" FROM ").append(table(query.source(), rules));
        if (query.alias() != null) {
            sql.append(" AS ").append(rules.quote(query.alias()));
        }

        // JOINs
        for (JoinClause join : query.joins()) {
            sql.append(" ").append(rules.joinKeyword(join.type()))
                    .append(" ").append(table(join.table(), rules))
                    .append(" ON ").append(condition(join.on(), scope));
        }

        // WHERE
        if (query.predicate() != null) {
            sql.append(" WHERE ").append(condition(query.predicate(), scope));
        }

        // GROUP BY
        if (!query.groupBy().isEmpty()) {
            sql.append(" GROUP BY ").append(projectionList(query.groupBy(), scope));
        }

        String result = sql.toString();
        log.debug("sqlscribe.render dialect={} sql={}", rules.id(), result);
        return result;
    }

    /**
     * Renders a predicate tree on its own, with no table aliases in effect.
     * A nested combination is parenthesized when its operator differs from its
     * parent's, or when it is the right operand.
     */
    public static String condition(Condition condition) {
        return condition(condition, Scope.UNALIASED);
    }

    static String table(TableRef table, DialectRules rules) {
        StringBuilder sb = new StringBuilder();
        if (table.hasSchema()) {
            sb.append(rules.quote(table.schema())).append(".");
        }
        sb.append(rules.quote(table.name()));
        if (table.hasAlias()) {
            sb.append(" AS ").append(rules.quote(table.alias()));
        }
        return sb.toString();
    }

    // ==================== Helpers ====================

    private static Map<String, String> aliases(Query query) {
        Map<String, String> aliases = new HashMap<>();
        if (query.alias() != null) {
            aliases.put(query.source().name(), query.alias());
        }
        for (JoinClause join : query.joins()) {
            if (join.table().hasAlias()) {
                aliases.put(join.table().name(), join.table().alias());
            }
        }
        return aliases;
    }

    private static String condition(Condition condition, Scope scope) {
        if (condition instanceof Comparison c) {
            // column-to-column comparisons (join predicates) keep their table qualifiers
            boolean qualify = c.right() instanceof ColumnRef;
            return c.op().render(predicateOperand(c.left(), scope, qualify),
                    predicateOperand(c.right(), scope, qualify));
        }
        if (condition instanceof BooleanCombination b) {
            return nested(b.left(), b.logic(), false, scope) + " " + b.logic().name() + " "
                    + nested(b.right(), b.logic(), true, scope);
        }
        throw new IllegalArgumentException(
                "Unsupported condition node: " + condition.getClass().getName());
    }

    private static String nested(Condition child, BooleanCombination.Logic parent, boolean rightOperand,
                                 Scope scope) {
        String sql = condition(child, scope);
        if (child instanceof BooleanCombination b && (b.logic() != parent || rightOperand)) {
            return "(" + sql + ")";
        }
        return sql;
    }

    private static String projectionList(List<Expression> expressions, Scope scope) {
        return expressions.stream()
                .map(e -> expression(e, Placement.PROJECTION, scope, scope.qualify()))
                .collect(Collectors.joining(","));
    }

    private static String predicateOperand(Expression e, Scope scope, boolean qualify) {
        return expression(e, Placement.PREDICATE, scope, qualify);
    }

    private static String expression(Expression e, Placement placement, Scope scope, boolean qualify) {
        if (e instanceof ColumnRef c) {
            boolean qualified = qualify && c.isQualified();
            if (placement == Placement.PROJECTION) {
                DialectRules rules = scope.rules();
                return qualified
                        ? rules.quote(scope.qualifier(c.qualifier())) + "." + rules.quote(c.name())
                        : rules.quote(c.name());
            }
            return placement == Placement.PREDICATE && qualified
                    ? scope.qualifier(c.qualifier()) + "." + c.name()
                    : c.name();
        }
        if (e instanceof Literal l) {
            return SqlLiteralFormatter.format(l.value());
        }
        if (e instanceof Star) {
            return "*";
        }
        if (e instanceof FunctionCall f) {
            return f.name() + "(" + f.args().stream()
                    .map(arg -> expression(arg, Placement.ARGUMENT, scope, false))
                    .collect(Collectors.joining(",")) + ")";
        }
        if (e instanceof Aliased a) {
            String inner = expression(a.expression(), placement, scope, qualify);
            return placement == Placement.PROJECTION
                    ? inner + " AS " + scope.rules().quote(a.alias())
                    : inner;
        }
        if (e instanceof AliasRef r) {
            return placement == Placement.PROJECTION ? scope.rules().quote(r.name()) : r.name();
        }
        throw new IllegalArgumentException(
                "Unsupported expression node: " + e.getClass().getName());
    }
}
