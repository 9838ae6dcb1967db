package com.enterprise.sqlscribe.table;

import com.enterprise.sqlscribe.builder.Query;
import com.enterprise.sqlscribe.condition.Condition;
import com.enterprise.sqlscribe.core.JoinType;
import com.enterprise.sqlscribe.core.TableRef;
import com.enterprise.sqlscribe.dialect.DialectRules;
import com.enterprise.sqlscribe.dialect.Dialects;
import com.enterprise.sqlscribe.exception.UnknownFieldException;
import com.enterprise.sqlscribe.expression.ColumnRef;
import com.enterprise.sqlscribe.expression.Expressions;
import com.enterprise.sqlscribe.validation.IdentifierValidator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named table with a declared set of fields. Each field is available as a
 * {@link ColumnRef} qualified by the table name via {@link #column(String)}.
 *
 * <p>The fluent methods ({@link #select}, {@link #where}, {@link #join},
 * {@link #groupBy}, {@link #as}) each start a fresh {@link Query} whose source is
 * this table, so two chains started from the same table never share state.
 *
 * <p>Example:
 * <pre>{@code
 * Table employee = Table.postgres("employee", "salary", "payroll_id");
 * Table payroll = Table.postgres("payroll", "id");
 *
 * String sql = employee
 *     .join(payroll, JoinType.INNER, payroll.column("id").eq(employee.column("payroll_id")))
 *     .build();
 * // SELECT * FROM "employee" INNER JOIN "payroll" ON payroll.id = employee.payroll_id
 * }</pre>
 */
public class Table {

    private final DialectRules dialect;
    private final String schema;
    private final String name;
    private final Map<String, ColumnRef> fields = new LinkedHashMap<>();

    public Table(DialectRules dialect, String schema, String name, List<String> fieldNames) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.schema = schema == null ? null : IdentifierValidator.validateIdentifier(schema);
        this.name = IdentifierValidator.validateIdentifier(name);
        setFields(fieldNames);
    }

    public Table(DialectRules dialect, String name, String... fieldNames) {
        this(dialect, null, name, Arrays.asList(fieldNames));
    }

    // ==================== Factory ====================

    public static Table mysql(String name, String... fields)    { return new Table(Dialects.MYSQL, name, fields); }
    public static Table postgres(String name, String... fields) { return new Table(Dialects.POSTGRES, name, fields); }
    public static Table oracle(String name, String... fields)   { return new Table(Dialects.ORACLE, name, fields); }
    public static Table sqlite(String name, String... fields)   { return new Table(Dialects.SQLITE, name, fields); }

    // ==================== Fields ====================

    /**
     * @throws UnknownFieldException if {@code field} is not currently declared
     */
    public ColumnRef column(String field) {
        ColumnRef column = fields.get(field);
        if (column == null) {
            throw new UnknownFieldException("table " + name, field, fields.keySet());
        }
        return column;
    }

    public boolean hasField(String field) {
        return fields.containsKey(field);
    }

    public List<String> fields() {
        return List.copyOf(fields.keySet());
    }

    /**
     * Replaces the declared fields. Names that are not in the new list stop
     * resolving. All names are validated before anything is replaced.
     */
    public void setFields(List<String> fieldNames) {
        Objects.requireNonNull(fieldNames, "fields must not be null");
        Map<String, ColumnRef> replacement = new LinkedHashMap<>();
        for (String field : fieldNames) {
            replacement.put(field, Expressions.column(name, field));
        }
        fields.clear();
        fields.putAll(replacement);
    }

    public void setFields(String... fieldNames) {
        setFields(Arrays.asList(fieldNames));
    }

    // ==================== Fluent entry points ====================

    public Query select(Object... columns) {
        return newQuery().select(columns);
    }

    public Query where(Condition condition) {
        return newQuery().where(condition);
    }

    public Query join(Table other, JoinType type, Condition on) {
        return newQuery().join(other, type, on);
    }

    public Query join(Table other, String type, Condition on) {
        return newQuery().join(other, type, on);
    }

    public Query groupBy(Object... columns) {
        return newQuery().groupBy(columns);
    }

    public Query as(String alias) {
        return newQuery().as(alias);
    }

    /** A fresh query with this table as its source. */
    public Query newQuery() {
        return new Query(dialect).from(ref());
    }

    // ==================== Accessors ====================

    public TableRef ref() {
        return TableRef.of(schema, name);
    }

    public String name() { return name; }

    public String schema() { return schema; }

    public DialectRules dialect() { return dialect; }

    @Override
    public String toString() {
        List<String> parts = new ArrayList<>();
        if (schema != null) parts.add(schema);
        parts.add(name);
        return String.join(".", parts) + fields.keySet();
    }
}
