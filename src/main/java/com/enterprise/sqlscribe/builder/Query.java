package com.enterprise.sqlscribe.builder;

import com.enterprise.sqlscribe.condition.Condition;
import com.enterprise.sqlscribe.core.JoinType;
import com.enterprise.sqlscribe.core.TableRef;
import com.enterprise.sqlscribe.dialect.DialectRegistry;
import com.enterprise.sqlscribe.dialect.DialectRules;
import com.enterprise.sqlscribe.dialect.Dialects;
import com.enterprise.sqlscribe.exception.IncompleteQueryException;
import com.enterprise.sqlscribe.expression.Expression;
import com.enterprise.sqlscribe.expression.Expressions;
import com.enterprise.sqlscribe.table.Table;
import com.enterprise.sqlscribe.validation.IdentifierValidator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The main entry point for building SELECT statements for one dialect.
 *
 * <p>Every fluent call mutates this builder and returns it. {@link #build()}
 * renders the current state and leaves the builder usable, so calling it twice
 * without changes in between yields the same string.
 *
 * <p>Unsupported: ORDER BY, LIMIT/OFFSET, HAVING, subqueries.
 *
 * <p>Example:
 * <pre>{@code
 * import static com.enterprise.sqlscribe.expression.Functions.*;
 *
 * String sql = Query.postgres()
 *     .select("store_location", max("salary"))
 *     .from("employee")
 *     .where(Expressions.column("salary").gt(1000))
 *     .groupBy("store_location")
 *     .build();
 * // SELECT "store_location",MAX(salary) FROM "employee" WHERE salary > 1000 GROUP BY "store_location"
 * }</pre>
 *
 * @see Table
 * @see SqlRenderer
 */
public class Query {

    private final DialectRules dialect;

    // SELECT (empty means *)
    private final List<Expression> selected = new ArrayList<>();

    // FROM
    private TableRef source;
    private String alias;

    // JOINs
    private final List<JoinClause> joins = new ArrayList<>();

    // WHERE
    private Condition predicate;

    // GROUP BY
    private final List<Expression> groupBy = new ArrayList<>();

    public Query(DialectRules dialect) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    // ==================== Factory ====================

    public static Query mysql()    { return new Query(Dialects.MYSQL); }
    public static Query postgres() { return new Query(Dialects.POSTGRES); }
    public static Query oracle()   { return new Query(Dialects.ORACLE); }
    public static Query sqlite()   { return new Query(Dialects.SQLITE); }

    /**
     * Creates a query for a dialect registered in the default registry.
     *
     * @throws com.enterprise.sqlscribe.exception.UnsupportedDialectException for unknown ids
     */
    public static Query forDialect(String dialectId) {
        return forDialect(dialectId, DialectRegistry.defaultRegistry());
    }

    public static Query forDialect(String dialectId, DialectRegistry registry) {
        return new Query(registry.get(dialectId));
    }

    // ==================== SELECT ====================

    /**
     * Appends columns or expressions to the select list. Strings name columns.
     * No arguments at all keeps {@code SELECT *}.
     */
    public Query select(Object... columns) {
        selected.addAll(Expressions.list(columns));
        return this;
    }

    // ==================== FROM ====================

    /** Sets the source table; a second call replaces the first. */
    public Query from(TableRef table) {
        this.source = Objects.requireNonNull(table, "source table must not be null");
        return this;
    }

    public Query from(String tableName) {
        return from(TableRef.of(tableName));
    }

    public Query from(String schema, String tableName) {
        return from(TableRef.of(schema, tableName));
    }

    public Query from(Table table) {
        return from(table.ref());
    }

    /** Alias for the source table: {@code FROM <source> AS <alias>}. */
    public Query as(String alias) {
        this.alias = IdentifierValidator.validateIdentifier(alias);
        return this;
    }

    // ==================== JOIN ====================

    /**
     * Appends a join clause.
     *
     * @throws com.enterprise.sqlscribe.exception.UnsupportedCapabilityException
     *         if the dialect cannot render this join type
     */
    public Query join(TableRef table, JoinType type, Condition on) {
        Objects.requireNonNull(type, "join type must not be null");
        if (type.requires() != null) {
            dialect.require(type.requires());
        }
        joins.add(new JoinClause(type, table, on));
        return this;
    }

    /**
     * Appends a join clause with the join type given by name ({@code "inner"}, {@code "left"}, ...).
     *
     * @throws com.enterprise.sqlscribe.exception.MalformedJoinTypeException for unknown names
     */
    public Query join(TableRef table, String type, Condition on) {
        return join(table, JoinType.parse(type), on);
    }

    public Query join(Table table, JoinType type, Condition on) {
        return join(table.ref(), type, on);
    }

    public Query join(Table table, String type, Condition on) {
        return join(table.ref(), JoinType.parse(type), on);
    }

    public Query join(String tableName, String type, Condition on) {
        return join(TableRef.of(tableName), JoinType.parse(type), on);
    }

    // Convenience shortcuts
    public Query innerJoin(Table t, Condition on) { return join(t.ref(), JoinType.INNER, on); }
    public Query leftJoin(Table t, Condition on)  { return join(t.ref(), JoinType.LEFT, on); }
    public Query rightJoin(Table t, Condition on) { return join(t.ref(), JoinType.RIGHT, on); }
    public Query fullJoin(Table t, Condition on)  { return join(t.ref(), JoinType.FULL, on); }

    public Query innerJoin(TableRef t, Condition on) { return join(t, JoinType.INNER, on); }
    public Query leftJoin(TableRef t, Condition on)  { return join(t, JoinType.LEFT, on); }
    public Query rightJoin(TableRef t, Condition on) { return join(t, JoinType.RIGHT, on); }
    public Query fullJoin(TableRef t, Condition on)  { return join(t, JoinType.FULL, on); }

    // ==================== WHERE ====================

    /**
     * Sets the predicate, replacing any earlier one. Combine conditions with
     * {@link Condition#and}/{@link Condition#or} before passing them in.
     */
    public Query where(Condition condition) {
        this.predicate = Objects.requireNonNull(condition, "condition must not be null");
        return this;
    }

    // ==================== GROUP BY ====================

    /** Appends grouping expressions in call order. Duplicates are kept. */
    public Query groupBy(Object... columns) {
        groupBy.addAll(Expressions.list(columns));
        return this;
    }

    // ==================== BUILD ====================

    /**
     * Renders the statement.
     *
     * @throws IncompleteQueryException if no source table was set
     */
    public String build() {
        if (source == null) {
            throw new IncompleteQueryException("Cannot build query: no source table");
        }
        return SqlRenderer.render(this, dialect);
    }

    // ==================== Accessors ====================

    public DialectRules dialect() { return dialect; }

    public List<Expression> selected() { return Collections.unmodifiableList(selected); }

    public TableRef source() { return source; }

    public String alias() { return alias; }

    public List<JoinClause> joins() { return Collections.unmodifiableList(joins); }

    public Condition predicate() { return predicate; }

    public List<Expression> groupBy() { return Collections.unmodifiableList(groupBy); }
}
