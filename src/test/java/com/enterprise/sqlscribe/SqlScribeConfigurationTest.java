package com.enterprise.sqlscribe;

import com.enterprise.sqlscribe.config.DefaultDialectResolver;
import com.enterprise.sqlscribe.config.SqlScribeConfiguration;
import com.enterprise.sqlscribe.dialect.DialectRegistry;
import com.enterprise.sqlscribe.dialect.Dialects;
import com.enterprise.sqlscribe.exception.UnsupportedDialectException;
import com.enterprise.sqlscribe.table.Schema;

import org.junit.jupiter.api.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;
import org.springframework.mock.env.MockEnvironment;

import static org.assertj.core.api.Assertions.*;

/**
 * Boots the Spring configuration and checks default dialect resolution.
 */
public class SqlScribeConfigurationTest {

    private static AnnotationConfigApplicationContext context(MockEnvironment environment) {
        AnnotationConfigApplicationContext ctx = new AnnotationConfigApplicationContext();
        ctx.setEnvironment(environment);
        ctx.register(SqlScribeConfiguration.class);
        ctx.refresh();
        return ctx;
    }

    @Test
    void testBeansAreWired() {
        try (AnnotationConfigApplicationContext ctx = context(new MockEnvironment())) {
            assertThat(ctx.getBean(DialectRegistry.class).ids())
                    .contains("mysql", "postgres", "oracle", "sqlite");
            assertThat(ctx.getBean(DefaultDialectResolver.class)).isNotNull();
        }
    }

    @Test
    void testDefaultsToMysqlWhenUnset() {
        try (AnnotationConfigApplicationContext ctx = context(new MockEnvironment())) {
            assertThat(ctx.getBean(DefaultDialectResolver.class).resolve()).isSameAs(Dialects.MYSQL);
        }
    }

    @Test
    void testPropertySelectsDialect() {
        MockEnvironment env = new MockEnvironment()
                .withProperty(DefaultDialectResolver.PROPERTY, "postgres");
        try (AnnotationConfigApplicationContext ctx = context(env)) {
            Schema hr = new Schema("hr", ctx.getBean(DefaultDialectResolver.class));
            assertThat(hr.dialect()).isSameAs(Dialects.POSTGRES);
            assertThat(hr.createTable("employee", "id").select("id").build())
                    .isEqualTo("SELECT \"id\" FROM \"hr\".\"employee\"");
        }
    }

    @Test
    void testUnknownConfiguredDialectFails() {
        MockEnvironment env = new MockEnvironment()
                .withProperty(DefaultDialectResolver.PROPERTY, "informix");
        DefaultDialectResolver resolver = new DefaultDialectResolver(env, DialectRegistry.builtIns());
        assertThatThrownBy(resolver::resolve)
                .isInstanceOf(UnsupportedDialectException.class)
                .hasMessageContaining("informix");
    }
}
