package com.enterprise.sqlscribe.dialect;

import com.enterprise.sqlscribe.core.Capability;
import com.enterprise.sqlscribe.core.JoinType;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Built-in dialects.
 */
public final class Dialects {

    private Dialects() {}

    // MySQL has no FULL OUTER JOIN
    public static final DialectRules MYSQL = of("mysql", "`",
            EnumSet.of(Capability.OFFSET, Capability.RIGHT_JOIN));

    public static final DialectRules POSTGRES = of("postgres", "\"",
            EnumSet.allOf(Capability.class));

    public static final DialectRules ORACLE = of("oracle", "\"",
            EnumSet.allOf(Capability.class));

    public static final DialectRules SQLITE = of("sqlite", "\"",
            EnumSet.of(Capability.OFFSET));

    /**
     * Rules with the same quote character on both sides and the default join spelling.
     */
    public static DialectRules of(String id, String quote, Set<Capability> capabilities) {
        return new StandardDialectRules(id, quote, quote, Map.of(), capabilities);
    }

    public static DialectRules of(String id, String quote, Map<JoinType, String> joinKeywords,
                                  Set<Capability> capabilities) {
        return new StandardDialectRules(id, quote, quote, joinKeywords, capabilities);
    }
}
