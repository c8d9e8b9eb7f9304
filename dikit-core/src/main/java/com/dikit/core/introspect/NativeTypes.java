package com.dikit.core.introspect;

import com.dikit.core.model.DefaultFunction;
import com.dikit.core.model.DefaultValue;
import com.dikit.core.model.ScalarType;
import com.dikit.core.sql.SqlDialect;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps catalog types and default expressions back to the schema vocabulary.
 */
final class NativeTypes {

    private static final Map<String, ScalarType> POSTGRES_TYPES = Map.ofEntries(
        Map.entry("int2", ScalarType.INT),
        Map.entry("int4", ScalarType.INT),
        Map.entry("int8", ScalarType.INT),
        Map.entry("smallint", ScalarType.INT),
        Map.entry("integer", ScalarType.INT),
        Map.entry("bigint", ScalarType.INT),
        Map.entry("varchar", ScalarType.STRING),
        Map.entry("character varying", ScalarType.STRING),
        Map.entry("bpchar", ScalarType.STRING),
        Map.entry("character", ScalarType.STRING),
        Map.entry("text", ScalarType.STRING),
        Map.entry("uuid", ScalarType.STRING),
        Map.entry("bool", ScalarType.BOOLEAN),
        Map.entry("boolean", ScalarType.BOOLEAN),
        Map.entry("real", ScalarType.FLOAT),
        Map.entry("float4", ScalarType.FLOAT),
        Map.entry("float8", ScalarType.FLOAT),
        Map.entry("double precision", ScalarType.FLOAT),
        Map.entry("numeric", ScalarType.FLOAT),
        Map.entry("json", ScalarType.JSON),
        Map.entry("jsonb", ScalarType.JSON),
        Map.entry("timestamp", ScalarType.DATETIME),
        Map.entry("timestamptz", ScalarType.DATETIME),
        Map.entry("timestamp without time zone", ScalarType.DATETIME),
        Map.entry("timestamp with time zone", ScalarType.DATETIME),
        Map.entry("date", ScalarType.DATE)
    );

    private static final Map<String, ScalarType> MYSQL_TYPES = Map.ofEntries(
        Map.entry("tinyint", ScalarType.INT),
        Map.entry("smallint", ScalarType.INT),
        Map.entry("mediumint", ScalarType.INT),
        Map.entry("int", ScalarType.INT),
        Map.entry("integer", ScalarType.INT),
        Map.entry("bigint", ScalarType.INT),
        Map.entry("char", ScalarType.STRING),
        Map.entry("varchar", ScalarType.STRING),
        Map.entry("tinytext", ScalarType.STRING),
        Map.entry("text", ScalarType.STRING),
        Map.entry("mediumtext", ScalarType.STRING),
        Map.entry("longtext", ScalarType.STRING),
        Map.entry("enum", ScalarType.STRING),
        Map.entry("bool", ScalarType.BOOLEAN),
        Map.entry("boolean", ScalarType.BOOLEAN),
        Map.entry("float", ScalarType.FLOAT),
        Map.entry("double", ScalarType.FLOAT),
        Map.entry("real", ScalarType.FLOAT),
        Map.entry("decimal", ScalarType.FLOAT),
        Map.entry("json", ScalarType.JSON),
        Map.entry("datetime", ScalarType.DATETIME),
        Map.entry("timestamp", ScalarType.DATETIME),
        Map.entry("date", ScalarType.DATE)
    );

    private static final Pattern SEQUENCE_DEFAULT = Pattern.compile("^nextval\\('.*'::regclass\\)$");
    private static final Pattern CAST_LITERAL = Pattern.compile("^'(.*)'::[a-z0-9_ ]+(\\[\\])?$", Pattern.DOTALL);
    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?$");
    private static final Pattern CURRENT_TIMESTAMP =
        Pattern.compile("^(now\\(\\)|current_timestamp(\\(\\d*\\))?)(::.*)?$", Pattern.CASE_INSENSITIVE);
    private static final Pattern UUID_CALL =
        Pattern.compile("^(gen_random_uuid|uuid_generate_v4|uuid)\\(\\)$", Pattern.CASE_INSENSITIVE);

    private NativeTypes() {
    }

    /**
     * Mapped column type.
     *
     * @param type scalar type; unknown native types map to {@link ScalarType#STRING}
     * @param isArray whether the native type is an array of {@code type}
     */
    record Mapped(ScalarType type, boolean isArray) {
    }

    static Mapped map(SqlDialect dialect, CatalogSnapshot.Column column) {
        String dataType = lower(column.dataType());
        String nativeType = lower(column.nativeType());
        return switch (dialect) {
            case POSTGRES -> {
                if ("array".equals(dataType) && nativeType.startsWith("_")) {
                    yield new Mapped(POSTGRES_TYPES.getOrDefault(nativeType.substring(1), ScalarType.STRING), true);
                }
                ScalarType type = POSTGRES_TYPES.get(dataType);
                yield new Mapped(type != null ? type : POSTGRES_TYPES.getOrDefault(nativeType, ScalarType.STRING), false);
            }
            case MYSQL -> {
                if (nativeType.startsWith("tinyint(1)")) {
                    yield new Mapped(ScalarType.BOOLEAN, false);
                }
                yield new Mapped(MYSQL_TYPES.getOrDefault(dataType, ScalarType.STRING), false);
            }
            case SQLITE, GENERIC -> throw new IllegalArgumentException(
                "Introspection is not supported for dialect " + dialect.id());
        };
    }

    static DefaultValue parseDefault(SqlDialect dialect, CatalogSnapshot.Column column, ScalarType type) {
        String extra = lower(column.extra());
        if (extra.contains("auto_increment")) {
            return DefaultValue.function(DefaultFunction.AUTOINCREMENT);
        }
        String expression = column.defaultExpression();
        if (expression == null) {
            return null;
        }
        expression = expression.trim();

        if (SEQUENCE_DEFAULT.matcher(expression).matches()) {
            return DefaultValue.function(DefaultFunction.AUTOINCREMENT);
        }
        if (CURRENT_TIMESTAMP.matcher(expression).matches()) {
            return DefaultValue.function(DefaultFunction.NOW);
        }
        if (UUID_CALL.matcher(expression).matches()) {
            return DefaultValue.function(DefaultFunction.UUID);
        }
        if (type == ScalarType.BOOLEAN) {
            String normalized = lower(expression);
            if ("true".equals(normalized) || "1".equals(normalized) || "'1'".equals(normalized)) {
                return DefaultValue.bool(true);
            }
            if ("false".equals(normalized) || "0".equals(normalized) || "'0'".equals(normalized)) {
                return DefaultValue.bool(false);
            }
        }

        String literal = expression;
        boolean quoted = false;
        Matcher cast = CAST_LITERAL.matcher(expression);
        if (cast.matches()) {
            literal = cast.group(1).replace("''", "'");
            quoted = true;
        } else if (dialect == SqlDialect.MYSQL) {
            if (extra.contains("default_generated")) {
                return DefaultValue.expression(expression);
            }
            if (expression.length() >= 2 && expression.startsWith("'") && expression.endsWith("'")) {
                literal = expression.substring(1, expression.length() - 1).replace("''", "'");
            }
            quoted = true;
        }

        if ((type == ScalarType.INT || type == ScalarType.FLOAT) && NUMBER.matcher(literal).matches()) {
            return DefaultValue.number(literal);
        }
        if (quoted) {
            return DefaultValue.string(literal);
        }
        return DefaultValue.expression(expression);
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
