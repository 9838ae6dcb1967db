package com.enterprise.sqlscribe.expression;

/**
 * SQL function catalog. Each factory accepts an {@link Expression} or a bare
 * column name and wraps it in a {@link FunctionCall}.
 *
 * <pre>{@code
 * import static com.enterprise.sqlscribe.expression.Functions.*;
 *
 * employee.select(upper(employee.column("store_location")), max("salary"))
 *         .groupBy(employee.column("store_location"));
 * }</pre>
 */
public final class Functions {

    private Functions() {}

    // Aggregates
    public static FunctionCall count()              { return call("COUNT", Expressions.star()); }
    public static FunctionCall count(Object column) { return call("COUNT", column); }
    public static FunctionCall sum(Object column)   { return call("SUM", column); }
    public static FunctionCall min(Object column)   { return call("MIN", column); }
    public static FunctionCall max(Object column)   { return call("MAX", column); }
    public static FunctionCall avg(Object column)   { return call("AVG", column); }

    // Scalar
    public static FunctionCall upper(Object column)  { return call("UPPER", column); }
    public static FunctionCall lower(Object column)  { return call("LOWER", column); }
    public static FunctionCall abs(Object column)    { return call("ABS", column); }
    public static FunctionCall sqrt(Object column)   { return call("SQRT", column); }
    public static FunctionCall round(Object column)  { return call("ROUND", column); }
    public static FunctionCall trim(Object column)   { return call("TRIM", column); }
    public static FunctionCall length(Object column) { return call("LENGTH", column); }
    public static FunctionCall ceil(Object column)   { return call("CEIL", column); }
    public static FunctionCall floor(Object column)  { return call("FLOOR", column); }

    /** Any unary function not in the catalog. */
    public static FunctionCall call(String functionName, Object column) {
        return Expressions.call(functionName, column);
    }
}
