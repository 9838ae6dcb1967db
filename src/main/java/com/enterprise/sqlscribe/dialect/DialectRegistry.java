package com.enterprise.sqlscribe.dialect;

import com.enterprise.sqlscribe.exception.UnsupportedDialectException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named registry for {@link DialectRules}. Identifiers are case-insensitive.
 *
 * <p>Populate it once at startup; lookups afterwards are read-only. The registry
 * itself does no locking.
 *
 * <pre>{@code
 * DialectRegistry registry = DialectRegistry.builtIns();
 * registry.register("mariadb", Dialects.of("mariadb", "`", EnumSet.allOf(Capability.class)));
 * Query q = Query.forDialect("mariadb", registry);
 * }</pre>
 */
public class DialectRegistry {

    private static final Logger log = LoggerFactory.getLogger(DialectRegistry.class);

    private static final DialectRegistry DEFAULT = builtIns().readOnly();

    private final Map<String, DialectRules> dialects = new LinkedHashMap<>();
    private boolean readOnly;

    /** A registry holding mysql, postgres, oracle and sqlite. */
    public static DialectRegistry builtIns() {
        DialectRegistry registry = new DialectRegistry();
        registry.register(Dialects.MYSQL.id(), Dialects.MYSQL);
        registry.register(Dialects.POSTGRES.id(), Dialects.POSTGRES);
        registry.register(Dialects.ORACLE.id(), Dialects.ORACLE);
        registry.register(Dialects.SQLITE.id(), Dialects.SQLITE);
        return registry;
    }

    /** Process-wide registry of the built-in dialects; read-only. */
    public static DialectRegistry defaultRegistry() {
        return DEFAULT;
    }

    /**
     * @throws UnsupportedOperationException on a read-only registry
     */
    public DialectRegistry register(String id, DialectRules rules) {
        if (readOnly) {
            throw new UnsupportedOperationException(
                    "Registry is read-only; register dialects on DialectRegistry.builtIns() instead");
        }
        Objects.requireNonNull(id, "dialect id must not be null");
        Objects.requireNonNull(rules, "dialect rules must not be null");
        dialects.put(key(id), rules);
        log.debug("sqlscribe.dialect registered id={} rules={}", key(id), rules.id());
        return this;
    }

    /**
     * @throws UnsupportedDialectException if nothing is registered under {@code id}
     */
    public DialectRules get(String id) {
        DialectRules rules = id == null ? null : dialects.get(key(id));
        if (rules == null) {
            throw new UnsupportedDialectException(id);
        }
        return rules;
    }

    /** A copy of this registry that rejects further registration. */
    public DialectRegistry readOnly() {
        DialectRegistry copy = new DialectRegistry();
        copy.dialects.putAll(dialects);
        copy.readOnly = true;
        return copy;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public boolean contains(String id) {
        return id != null && dialects.containsKey(key(id));
    }

    public Set<String> ids() {
        return Collections.unmodifiableSet(dialects.keySet());
    }

    private static String key(String id) {
        return id.trim().toLowerCase(Locale.ROOT);
    }
}
