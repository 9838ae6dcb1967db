package com.enterprise.sqlscribe.dialect;

import com.enterprise.sqlscribe.core.Capability;
import com.enterprise.sqlscribe.core.JoinType;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Table-driven {@link DialectRules}. Join types without an explicit spelling
 * fall back to {@link JoinType#sql()}.
 */
public record StandardDialectRules(String id,
                                   String openQuote,
                                   String closeQuote,
                                   Map<JoinType, String> joinKeywords,
                                   Set<Capability> capabilities) implements DialectRules {

    public StandardDialectRules {
        Objects.requireNonNull(id, "dialect id must not be null");
        Objects.requireNonNull(openQuote, "open quote must not be null");
        Objects.requireNonNull(closeQuote, "close quote must not be null");
        id = id.toLowerCase(Locale.ROOT);
        joinKeywords = Map.copyOf(joinKeywords);
        capabilities = Set.copyOf(capabilities);
    }

    @Override
    public String quote(String identifier) {
        return openQuote + identifier + closeQuote;
    }

    @Override
    public String joinKeyword(JoinType type) {
        return joinKeywords.getOrDefault(type, type.sql());
    }
}
