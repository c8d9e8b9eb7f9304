package com.dikit.core.introspect;

import com.dikit.core.compiler.SchemaCompiler;
import com.dikit.core.introspect.CatalogSnapshot.Column;
import com.dikit.core.introspect.CatalogSnapshot.Constraint;
import com.dikit.core.introspect.CatalogSnapshot.ConstraintType;
import com.dikit.core.model.DefaultFunction;
import com.dikit.core.model.DefaultValue;
import com.dikit.core.model.FieldNode;
import com.dikit.core.model.ModelNode;
import com.dikit.core.model.Relation;
import com.dikit.core.model.RelationType;
import com.dikit.core.model.SchemaNode;
import com.dikit.core.sql.MigrationGenerator;
import com.dikit.core.sql.MigrationPlan;
import com.dikit.core.sql.SqlDialect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SchemaIntrospector}.
 */
class SchemaIntrospectorTest {

    private final SchemaIntrospector introspector = SchemaIntrospector.forDialect(SqlDialect.POSTGRES);

    private static Column pg(String table, String name, String dataType, String udt, boolean nullable,
                             String defaultExpression, int position) {
        return new Column(table, name, dataType, udt, nullable, defaultExpression, null, position);
    }

    private static Column serial(String table) {
        return pg(table, "id", "integer", "int4", false, "nextval('" + table + "_id_seq'::regclass)", 1);
    }

    private static Constraint primaryKey(String table) {
        return new Constraint(table + "_pkey", ConstraintType.PRIMARY_KEY, table, List.of("id"), null);
    }

    private static SchemaNode shopSnapshot() {
        return new SchemaIntrospector(new PostgresCatalogReader()).toSchema(new CatalogSnapshot(SqlDialect.POSTGRES,
            List.of(
                serial("order"),
                pg("order", "customer_id", "integer", "int4", false, null, 2),
                pg("order", "placed_at", "timestamp without time zone", "timestamp", true, "CURRENT_TIMESTAMP", 3),
                serial("customer"),
                pg("customer", "email", "character varying", "varchar", false, null, 2)),
            List.of(
                primaryKey("order"),
                primaryKey("customer"),
                new Constraint("customer_email_key", ConstraintType.UNIQUE, "customer", List.of("email"), null),
                new Constraint("order_customer_id_fkey", ConstraintType.FOREIGN_KEY, "order",
                    List.of("customer_id"), "customer"))));
    }

    @Test
    void toSchema_mapsTablesAndColumnsInOrder() {
        // When
        SchemaNode schema = shopSnapshot();

        // Then
        assertThat(schema.models()).extracting(ModelNode::name).containsExactly("customer", "order");
        ModelNode order = schema.model("order").orElseThrow();
        assertThat(order.columns()).extracting(FieldNode::name).containsExactly("id", "customer_id", "placed_at");

        FieldNode id = order.field("id").orElseThrow();
        assertThat(id.fieldType()).isEqualTo("int");
        assertThat(id.isPrimaryKey()).isTrue();
        assertThat(id.defaultValue()).isEqualTo(DefaultValue.function(DefaultFunction.AUTOINCREMENT));

        assertThat(order.field("placed_at").orElseThrow().defaultValue())
            .isEqualTo(DefaultValue.function(DefaultFunction.NOW));
        assertThat(schema.model("customer").orElseThrow().field("email").orElseThrow().isUnique()).isTrue();
    }

    @Test
    void toSchema_turnsForeignKeysIntoManyToOneRelations() {
        ModelNode order = shopSnapshot().model("order").orElseThrow();

        assertThat(order.field("customer_id").orElseThrow().relation())
            .isEqualTo(new Relation(RelationType.MANY_TO_ONE, "customer_id"));
        FieldNode customer = order.field("customer").orElseThrow();
        assertThat(customer.fieldType()).isEqualTo("customer");
        assertThat(customer.isColumn()).isFalse();
    }

    @Test
    void toSchema_matchesParsedSchemaSoDiffIsEmpty() {
        // Given the schema source that produced the deployed tables
        SchemaNode parsed = new SchemaCompiler().compile("""
            model order {
              id int @primary_key @default(autoincrement())
              customer_id int @required
              customer customer @many_to_one(customer_id)
              placed_at datetime @default(now())
            }
            model customer {
              id int @primary_key @default(autoincrement())
              email string @unique @required
            }
            """).schema();

        // When
        String script = new MigrationGenerator(SqlDialect.POSTGRES).generateScript(shopSnapshot(), parsed);

        // Then
        assertThat(script).isEqualTo(MigrationPlan.NO_CHANGES);
    }

    @Test
    void toSchema_collapsesJoinTablesIntoManyToManyFields() {
        // Given
        CatalogSnapshot snapshot = new CatalogSnapshot(SqlDialect.POSTGRES,
            List.of(
                serial("role"),
                serial("user"),
                pg("_role_user", "A_id", "integer", "int4", false, null, 1),
                pg("_role_user", "B_id", "integer", "int4", false, null, 2)),
            List.of(
                primaryKey("role"),
                primaryKey("user"),
                new Constraint("fk_a", ConstraintType.FOREIGN_KEY, "_role_user", List.of("A_id"), "role"),
                new Constraint("fk_b", ConstraintType.FOREIGN_KEY, "_role_user", List.of("B_id"), "user"),
                new Constraint("uq", ConstraintType.UNIQUE, "_role_user", List.of("A_id", "B_id"), null)));

        // When
        SchemaNode schema = introspector.toSchema(snapshot);

        // Then
        assertThat(schema.models()).extracting(ModelNode::name).containsExactly("role", "user");
        FieldNode users = schema.model("role").orElseThrow().field("users").orElseThrow();
        assertThat(users.isArray()).isTrue();
        assertThat(users.relation()).isEqualTo(new Relation(RelationType.MANY_TO_MANY, "_role_user"));
        assertThat(schema.model("user").orElseThrow().field("roles")).isPresent();
    }

    @Test
    void toSchema_keepsTablesWithExtraDataColumns() {
        CatalogSnapshot snapshot = new CatalogSnapshot(SqlDialect.POSTGRES,
            List.of(
                serial("team"),
                serial("person"),
                pg("membership", "team_id", "integer", "int4", false, null, 1),
                pg("membership", "person_id", "integer", "int4", false, null, 2),
                pg("membership", "role", "text", "text", true, null, 3)),
            List.of(
                new Constraint("fk_team", ConstraintType.FOREIGN_KEY, "membership", List.of("team_id"), "team"),
                new Constraint("fk_person", ConstraintType.FOREIGN_KEY, "membership", List.of("person_id"), "person")));

        SchemaNode schema = introspector.toSchema(snapshot);

        assertThat(schema.models()).extracting(ModelNode::name).containsExactly("membership", "person", "team");
    }

    @Test
    void toSchema_mapsCompositeUniqueAndArrays() {
        CatalogSnapshot snapshot = new CatalogSnapshot(SqlDialect.POSTGRES,
            List.of(
                pg("post", "slug", "text", "text", false, null, 1),
                pg("post", "lang", "text", "text", false, "'en'::text", 2),
                pg("post", "tags", "ARRAY", "_varchar", true, null, 3)),
            List.of(new Constraint("post_slug_lang", ConstraintType.UNIQUE, "post", List.of("slug", "lang"), null)));

        ModelNode post = introspector.toSchema(snapshot).models().get(0);

        assertThat(post.combinedUniques()).containsExactly(List.of("slug", "lang"));
        assertThat(post.field("lang").orElseThrow().defaultValue()).isEqualTo(DefaultValue.string("en"));
        FieldNode tags = post.field("tags").orElseThrow();
        assertThat(tags.fieldType()).isEqualTo("string");
        assertThat(tags.isArray()).isTrue();
    }

    @Test
    void toSchema_withEmptySnapshot_returnsEmptySchema() {
        assertThat(introspector.toSchema(new CatalogSnapshot(SqlDialect.POSTGRES, List.of(), List.of())).isEmpty())
            .isTrue();
    }

    @Test
    void forDialect_withoutCatalogReader_throws() {
        assertThatThrownBy(() -> SchemaIntrospector.forDialect(SqlDialect.SQLITE))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("Introspection is not supported for dialect sqlite");
    }

    @Test
    void pluralize_followsSimpleEnglishRules() {
        assertThat(SchemaIntrospector.pluralize("category")).isEqualTo("categories");
        assertThat(SchemaIntrospector.pluralize("status")).isEqualTo("status");
        assertThat(SchemaIntrospector.pluralize("role")).isEqualTo("roles");
    }
}
