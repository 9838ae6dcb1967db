package com.enterprise.sqlscribe.config;

import com.enterprise.sqlscribe.dialect.DialectRegistry;
import com.enterprise.sqlscribe.dialect.DialectRules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;

/**
 * Resolves the dialect used when none is given explicitly.
 *
 * <p>Reads {@value #PROPERTY} from the Spring {@link Environment}. With the
 * standard environment the variable {@code SQLSCRIBE_DIALECT} satisfies it too.
 * Falls back to {@value #DEFAULT_DIALECT} when unset; an unknown value fails
 * with {@link com.enterprise.sqlscribe.exception.UnsupportedDialectException}.
 */
public class DefaultDialectResolver {

    private static final Logger log = LoggerFactory.getLogger(DefaultDialectResolver.class);

    public static final String PROPERTY = "sqlscribe.dialect";
    public static final String DEFAULT_DIALECT = "mysql";

    private final Environment environment;
    private final DialectRegistry registry;

    public DefaultDialectResolver(Environment environment, DialectRegistry registry) {
        this.environment = environment;
        this.registry = registry;
    }

    public DialectRules resolve() {
        String id = environment.getProperty(PROPERTY, DEFAULT_DIALECT);
        DialectRules rules = registry.get(id);
        log.info("sqlscribe.dialect default resolved property={} id={}", PROPERTY, rules.id());
        return rules;
    }
}
