package com.dikit.core.introspect;

import com.dikit.core.introspect.CatalogSnapshot.Column;
import com.dikit.core.model.DefaultFunction;
import com.dikit.core.model.DefaultValue;
import com.dikit.core.model.ScalarType;
import com.dikit.core.sql.SqlDialect;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link NativeTypes}.
 */
class NativeTypesTest {

    private static Column column(String dataType, String nativeType, String defaultExpression, String extra) {
        return new Column("t", "c", dataType, nativeType, true, defaultExpression, extra, 1);
    }

    @ParameterizedTest
    @CsvSource({
        "integer, int4, INT",
        "character varying, varchar, STRING",
        "jsonb, jsonb, JSON",
        "timestamp with time zone, timestamptz, DATETIME",
        "USER-DEFINED, citext, STRING",
        "double precision, float8, FLOAT"
    })
    void map_postgresTypes(String dataType, String udt, ScalarType expected) {
        assertThat(NativeTypes.map(SqlDialect.POSTGRES, column(dataType, udt, null, null)).type()).isEqualTo(expected);
    }

    @Test
    void map_mysqlTinyintOne_isBoolean() {
        NativeTypes.Mapped mapped = NativeTypes.map(SqlDialect.MYSQL, column("tinyint", "tinyint(1)", null, null));

        assertThat(mapped).isEqualTo(new NativeTypes.Mapped(ScalarType.BOOLEAN, false));
        assertThat(NativeTypes.map(SqlDialect.MYSQL, column("tinyint", "tinyint(4)", null, null)).type())
            .isEqualTo(ScalarType.INT);
    }

    @Test
    void parseDefault_recognizesFunctionDefaults() {
        assertThat(NativeTypes.parseDefault(SqlDialect.POSTGRES,
            column("uuid", "uuid", "gen_random_uuid()", null), ScalarType.STRING))
            .isEqualTo(DefaultValue.function(DefaultFunction.UUID));
        assertThat(NativeTypes.parseDefault(SqlDialect.POSTGRES,
            column("timestamp with time zone", "timestamptz", "now()", null), ScalarType.DATETIME))
            .isEqualTo(DefaultValue.function(DefaultFunction.NOW));
        assertThat(NativeTypes.parseDefault(SqlDialect.MYSQL,
            column("int", "int", null, "auto_increment"), ScalarType.INT))
            .isEqualTo(DefaultValue.function(DefaultFunction.AUTOINCREMENT));
    }

    @Test
    void parseDefault_readsLiterals() {
        assertThat(NativeTypes.parseDefault(SqlDialect.POSTGRES,
            column("integer", "int4", "0", null), ScalarType.INT))
            .isEqualTo(DefaultValue.number("0"));
        assertThat(NativeTypes.parseDefault(SqlDialect.POSTGRES,
            column("boolean", "bool", "false", null), ScalarType.BOOLEAN))
            .isEqualTo(DefaultValue.bool(false));
        assertThat(NativeTypes.parseDefault(SqlDialect.POSTGRES,
            column("text", "text", "'it''s'::text", null), ScalarType.STRING))
            .isEqualTo(DefaultValue.string("it's"));
        assertThat(NativeTypes.parseDefault(SqlDialect.MYSQL,
            column("varchar", "varchar(255)", "member", null), ScalarType.STRING))
            .isEqualTo(DefaultValue.string("member"));
    }

    @Test
    void parseDefault_keepsUnknownExpressionsVerbatim() {
        assertThat(NativeTypes.parseDefault(SqlDialect.POSTGRES,
            column("integer", "int4", "floor(random() * 10)", null), ScalarType.INT))
            .isEqualTo(DefaultValue.expression("floor(random() * 10)"));
    }

    @Test
    void parseDefault_withoutDefault_returnsNull() {
        assertThat(NativeTypes.parseDefault(SqlDialect.POSTGRES,
            column("integer", "int4", null, null), ScalarType.INT)).isNull();
    }
}
