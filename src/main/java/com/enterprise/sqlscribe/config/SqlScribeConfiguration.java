package com.enterprise.sqlscribe.config;

import com.enterprise.sqlscribe.dialect.DialectRegistry;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Spring wiring for the dialect registry and default dialect resolution.
 *
 * <pre>{@code
 * @Import(SqlScribeConfiguration.class)
 * @Configuration
 * public class MyConfig { ... }
 * }</pre>
 *
 * <p>Override {@link #dialectRegistry()} to register extra dialects:
 * <pre>{@code
 * @Bean
 * public DialectRegistry dialectRegistry() {
 *     return DialectRegistry.builtIns()
 *         .register("mariadb", Dialects.of("mariadb", "`", EnumSet.allOf(Capability.class)));
 * }
 * }</pre>
 */
@Configuration
public class SqlScribeConfiguration {

    @Bean
    public DialectRegistry dialectRegistry() {
        return DialectRegistry.builtIns();
    }

    @Bean
    public DefaultDialectResolver defaultDialectResolver(Environment environment,
                                                         DialectRegistry dialectRegistry) {
        return new DefaultDialectResolver(environment, dialectRegistry);
    }
}
