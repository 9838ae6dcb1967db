package com.enterprise.sqlscribe;

import com.enterprise.sqlscribe.builder.Query;
import com.enterprise.sqlscribe.dialect.Dialects;
import com.enterprise.sqlscribe.exception.InvalidIdentifierException;
import com.enterprise.sqlscribe.exception.UnknownFieldException;
import com.enterprise.sqlscribe.expression.ColumnRef;
import com.enterprise.sqlscribe.table.Schema;
import com.enterprise.sqlscribe.table.Table;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

public class TableTests {

    @Test
    void testColumnIsQualifiedByTableName() {
        Table employee = Table.postgres("employee", "salary");
        assertThat(employee.column("salary")).isEqualTo(new ColumnRef("employee", "salary"));
    }

    @Test
    void testUnknownFieldFails() {
        Table employee = Table.postgres("employee", "salary");
        assertThatThrownBy(() -> employee.column("bonus"))
                .isInstanceOf(UnknownFieldException.class)
                .hasMessageContaining("bonus")
                .hasMessageContaining("employee");
    }

    @Test
    void testSetFieldsReplacesAccessors() {
        Table employee = Table.mysql("employee", "salary", "name");
        employee.setFields("first_name", "last_name");

        assertThat(employee.fields()).containsExactly("first_name", "last_name");
        assertThat(employee.column("first_name").name()).isEqualTo("first_name");
        assertThatThrownBy(() -> employee.column("salary")).isInstanceOf(UnknownFieldException.class);
        assertThatThrownBy(() -> employee.column("name")).isInstanceOf(UnknownFieldException.class);
    }

    @Test
    void testSetFieldsWithInvalidNameLeavesFieldsUntouched() {
        Table employee = Table.mysql("employee", "salary");
        assertThatThrownBy(() -> employee.setFields(List.of("ok", "not valid")))
                .isInstanceOf(InvalidIdentifierException.class);
        assertThat(employee.fields()).containsExactly("salary");
    }

    @Test
    void testEachFluentCallStartsAFreshQuery() {
        Table employee = Table.postgres("employee", "salary", "name");
        Query first = employee.select("salary");
        Query second = employee.select("name");

        assertThat(first).isNotSameAs(second);
        assertThat(first.build()).isEqualTo("SELECT \"salary\" FROM \"employee\"");
        assertThat(second.build()).isEqualTo("SELECT \"name\" FROM \"employee\"");
    }

    @Test
    void testTableEntryPoints() {
        Table t = Table.sqlite("t", "a");
        assertThat(t.where(t.column("a").eq(1)).build()).isEqualTo("SELECT * FROM \"t\" WHERE a = 1");
        assertThat(t.groupBy("a").build()).isEqualTo("SELECT * FROM \"t\" GROUP BY \"a\"");
        assertThat(t.as("x").build()).isEqualTo("SELECT * FROM \"t\" AS \"x\"");
    }

    @Test
    void testInvalidTableNameRejected() {
        assertThatThrownBy(() -> Table.oracle("emp; DROP TABLE x"))
                .isInstanceOf(InvalidIdentifierException.class);
    }

    // ==================== Schema ====================

    @Test
    void testSchemaQualifiesFromButNotColumns() {
        Schema hr = new Schema("hr", Dialects.POSTGRES);
        Table employee = hr.createTable("employee", "salary");

        assertThat(employee.column("salary").qualifier()).isEqualTo("employee");
        assertThat(hr.table("employee").select("salary").where(employee.column("salary").gt(10)).build())
                .isEqualTo("SELECT \"salary\" FROM \"hr\".\"employee\" WHERE salary > 10");
    }

    @Test
    void testSchemaUnknownTableFails() {
        Schema hr = new Schema("hr", Dialects.MYSQL);
        hr.createTable("employee");
        assertThatThrownBy(() -> hr.table("payroll"))
                .isInstanceOf(UnknownFieldException.class)
                .hasMessageContaining("payroll");
        assertThat(hr.tables()).containsOnlyKeys("employee");
    }
}
