package com.enterprise.sqlscribe.table;

import com.enterprise.sqlscribe.config.DefaultDialectResolver;
import com.enterprise.sqlscribe.dialect.DialectRules;
import com.enterprise.sqlscribe.exception.UnknownFieldException;
import com.enterprise.sqlscribe.validation.IdentifierValidator;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Groups tables under one schema name. Tables created here render their FROM
 * clause schema-qualified and share the schema's dialect.
 *
 * <pre>{@code
 * Schema hr = new Schema("hr", Dialects.POSTGRES);
 * Table employee = hr.createTable("employee", "id", "salary");
 * hr.table("employee").select("salary").build();
 * // SELECT "salary" FROM "hr"."employee"
 * }</pre>
 */
public class Schema {

    private final String name;
    private final DialectRules dialect;
    private final Map<String, Table> tables = new LinkedHashMap<>();

    public Schema(String name, DialectRules dialect) {
        this.name = IdentifierValidator.validateIdentifier(name);
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
    }

    /** Schema whose dialect comes from configuration. */
    public Schema(String name, DefaultDialectResolver resolver) {
        this(name, resolver.resolve());
    }

    /** Creates a table in this schema, replacing any table of the same name. */
    public Table createTable(String tableName, String... fields) {
        Table table = new Table(dialect, name, tableName, Arrays.asList(fields));
        tables.put(table.name(), table);
        return table;
    }

    /**
     * @throws UnknownFieldException if no table of that name was created
     */
    public Table table(String tableName) {
        Table table = tables.get(tableName);
        if (table == null) {
            throw new UnknownFieldException("schema " + name, tableName, tables.keySet());
        }
        return table;
    }

    public Map<String, Table> tables() {
        return Collections.unmodifiableMap(tables);
    }

    public String name() { return name; }

    public DialectRules dialect() { return dialect; }
}
