package com.dikit.core.sql;

import com.dikit.core.compiler.CompilationResult;
import com.dikit.core.compiler.SchemaCompiler;
import com.dikit.core.model.SchemaNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MigrationGenerator}.
 */
class MigrationGeneratorTest {

    private static final String USER_WITH_ID = """
        model user {
          id int @primary_key @default(autoincrement())
        }
        """;

    private static final String SHOP = """
        model order {
          id int @primary_key @default(autoincrement())
          customer_id int @required
          customer customer @many_to_one(customer_id)
          placed_at datetime @default(now())
        }

        model customer {
          id int @primary_key @default(autoincrement())
          email string @unique @required
          orders order[] @one_to_many(customer_id)
        }
        """;

    private static SchemaNode schema(String source) {
        CompilationResult result = new SchemaCompiler().compile(source);
        assertThat(result.errorMessages()).isEmpty();
        return result.schema();
    }

    private static List<String> statements(SqlDialect dialect, String previous, String current) {
        return new MigrationGenerator(dialect)
            .generate(previous == null ? null : schema(previous), schema(current))
            .statements().stream()
            .map(MigrationStatement::sql)
            .toList();
    }

    @Test
    void generate_withoutPrevious_createsEveryTable() {
        // Given
        SchemaNode current = schema("""
            model user {
              id int @primary_key @default(autoincrement())
              email string @unique @required
              created_at datetime @default(now())
            }
            """);

        // When
        String script = new MigrationGenerator(SqlDialect.POSTGRES).generateScript(null, current);

        // Then
        assertThat(script).isEqualTo("""
            BEGIN;
            CREATE TABLE user (
              id SERIAL PRIMARY KEY,
              email VARCHAR(255) UNIQUE NOT NULL,
              created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP
            );
            COMMIT;""");
    }

    @Test
    void generate_forMySql_usesAutoIncrementKeyword() {
        List<String> statements = statements(SqlDialect.MYSQL, null, """
            model user {
              id int @primary_key @default(autoincrement())
              active boolean @default(true)
              created_at datetime @default(now())
            }
            """);

        assertThat(statements).containsExactly("""
            CREATE TABLE user (
              id INT PRIMARY KEY AUTO_INCREMENT NOT NULL,
              active TINYINT(1) DEFAULT true,
              created_at DATETIME DEFAULT NOW()
            );""");
    }

    @Test
    void generate_forSqlite_usesAutoIncrementAndTextTypes() {
        List<String> statements = statements(SqlDialect.SQLITE, null, """
            model note {
              id int @primary_key @default(autoincrement())
              body string
              meta json
            }
            """);

        assertThat(statements).containsExactly("""
            CREATE TABLE note (
              id INTEGER PRIMARY KEY AUTOINCREMENT NOT NULL,
              body TEXT,
              meta TEXT
            );""");
    }

    @Test
    void generate_withNowDefault_translatesPerDialect() {
        String source = "model event { at datetime @default(now()) }";

        assertThat(statements(SqlDialect.POSTGRES, null, source).get(0)).contains("at TIMESTAMP DEFAULT CURRENT_TIMESTAMP");
        assertThat(statements(SqlDialect.MYSQL, null, source).get(0)).contains("at DATETIME DEFAULT NOW()");
        assertThat(statements(SqlDialect.SQLITE, null, source).get(0)).contains("DEFAULT (DATETIME('now'))");
    }

    @Test
    void generate_withUuidDefault_translatesPerDialect() {
        String source = "model token { value string @default(uuid()) }";

        assertThat(statements(SqlDialect.POSTGRES, null, source).get(0)).contains("value VARCHAR(255) DEFAULT gen_random_uuid()");
        assertThat(statements(SqlDialect.MYSQL, null, source).get(0)).contains("DEFAULT (UUID())");
        assertThat(statements(SqlDialect.GENERIC, null, source).get(0)).contains("value VARCHAR(255)\n").doesNotContain("DEFAULT");
    }

    @Test
    void generate_createsReferencedTablesFirst() {
        // Given: order references customer but is declared first
        List<String> statements = statements(SqlDialect.POSTGRES, null, SHOP);

        // Then
        assertThat(statements).hasSize(2);
        assertThat(statements.get(0)).startsWith("CREATE TABLE customer (");
        assertThat(statements.get(1)).startsWith("CREATE TABLE order (")
            .contains("FOREIGN KEY (customer_id) REFERENCES customer(id)");
    }

    @Test
    void generate_referencesTargetPrimaryKeyName() {
        List<String> statements = statements(SqlDialect.POSTGRES, null, """
            model account {
              code string @primary_key
            }
            model invoice {
              id int @primary_key
              account_code string
              account account @many_to_one(account_code)
            }
            """);

        assertThat(statements.get(1)).contains("FOREIGN KEY (account_code) REFERENCES account(code)");
    }

    @Test
    void generate_withCompositeUnique_addsTableConstraint() {
        List<String> statements = statements(SqlDialect.POSTGRES, null, """
            model membership {
              user_id int @required
              team_id int @required
              @@unique([user_id, team_id])
            }
            """);

        assertThat(statements).containsExactly("""
            CREATE TABLE membership (
              user_id INTEGER NOT NULL,
              team_id INTEGER NOT NULL,
              UNIQUE (user_id, team_id)
            );""");
    }

    @Test
    void generate_withManyToManyOnBothSides_createsOneJoinTable() {
        // Given
        String source = """
            model user {
              id int @primary_key
              roles role[] @many_to_many
            }
            model role {
              id int @primary_key
              users user[] @many_to_many
            }
            """;

        // When
        List<String> statements = statements(SqlDialect.POSTGRES, null, source);

        // Then
        assertThat(statements).filteredOn(sql -> sql.startsWith("CREATE TABLE _role_user")).hasSize(1);
        assertThat(statements).hasSize(3);
        assertThat(statements.get(2)).isEqualTo("""
            CREATE TABLE _role_user (
              A_id INTEGER NOT NULL,
              B_id INTEGER NOT NULL,
              FOREIGN KEY (A_id) REFERENCES role(id) ON DELETE CASCADE,
              FOREIGN KEY (B_id) REFERENCES user(id) ON DELETE CASCADE,
              UNIQUE (A_id, B_id)
            );""");
    }

    @Test
    void generate_withExplicitJoinTableName_prefersItRegardlessOfOrder() {
        List<String> statements = statements(SqlDialect.POSTGRES, null, """
            model role {
              id int @primary_key
              users user[] @many_to_many
            }
            model user {
              id int @primary_key
              roles role[] @many_to_many(user_roles)
            }
            """);

        assertThat(statements).filteredOn(sql -> sql.contains("A_id")).singleElement()
            .asString().startsWith("CREATE TABLE user_roles (");
    }

    @Test
    void generate_withManyToManyToUnknownModel_throws() {
        SchemaNode current = schema("""
            model user {
              id int @primary_key
              tags ghost[] @many_to_many
            }
            """);

        assertThatThrownBy(() -> new MigrationGenerator(SqlDialect.POSTGRES).generate(null, current))
            .isInstanceOf(MigrationException.class)
            .hasMessage("Many-to-many field user.tags targets unknown model 'ghost'");
    }

    @Test
    void generate_withManyToManyParticipantWithoutPrimaryKey_throws() {
        SchemaNode current = schema("""
            model user {
              id int @primary_key
              tags tag[] @many_to_many
            }
            model tag {
              label string
            }
            """);

        assertThatThrownBy(() -> new MigrationGenerator(SqlDialect.POSTGRES).generate(null, current))
            .isInstanceOf(MigrationException.class)
            .hasMessage("Model 'tag' has no primary key; cannot build join table '_tag_user'");
    }

    @Test
    void generate_withMismatchedDefault_throws() {
        SchemaNode current = schema("model item { qty int @default(\"many\") }");

        assertThatThrownBy(() -> new MigrationGenerator(SqlDialect.POSTGRES).generate(null, current))
            .isInstanceOf(MigrationException.class)
            .hasMessage("Unsupported default string literal for column item.qty of type int");
    }

    @Test
    void generate_escapesQuotesInStringDefaults() {
        List<String> statements = statements(SqlDialect.POSTGRES, null,
            "model quote { text string @default(\"it's\") }");

        assertThat(statements.get(0)).contains("text VARCHAR(255) DEFAULT 'it''s'");
    }

    @Test
    void generate_withArrayColumns_usesNativeArraysOnlyOnPostgres() {
        String source = "model post { tags string[] }";

        assertThat(statements(SqlDialect.POSTGRES, null, source).get(0)).contains("tags VARCHAR(255)[]");
        assertThat(statements(SqlDialect.MYSQL, null, source).get(0)).contains("tags JSON");
    }

    @Test
    void generate_withModelWithoutColumns_createsEmptyTable() {
        assertThat(statements(SqlDialect.POSTGRES, null, "model marker { }"))
            .containsExactly("CREATE TABLE marker ();");
    }

    @Test
    void generate_withSameSchemaTwice_reportsNoChanges() {
        // Given
        String source = SHOP + """
            model tag {
              id int @primary_key
              label string @unique
              data json { color: string }
              posts customer[] @many_to_many
            }
            """;

        // When
        String script = new MigrationGenerator(SqlDialect.POSTGRES).generateScript(schema(source), schema(source));

        // Then
        assertThat(script).isEqualTo(MigrationPlan.NO_CHANGES);
    }

    @Test
    void generate_withAddedRequiredColumn_emitsSingleAddColumn() {
        List<String> statements = statements(SqlDialect.POSTGRES, USER_WITH_ID, """
            model user {
              id int @primary_key @default(autoincrement())
              name string @required
            }
            """);

        assertThat(statements).containsExactly("ALTER TABLE user ADD COLUMN name VARCHAR(255) NOT NULL;");
    }

    @Test
    void generate_withRemovedModel_emitsSingleDropTable() {
        List<String> statements = statements(SqlDialect.POSTGRES, USER_WITH_ID + """
            model post {
              id int @primary_key
              title string
            }
            """, USER_WITH_ID);

        assertThat(statements).containsExactly("DROP TABLE post;");
    }

    @Test
    void generate_withRemovedModels_dropsDependentsFirst() {
        List<String> statements = statements(SqlDialect.POSTGRES, USER_WITH_ID + SHOP, USER_WITH_ID);

        assertThat(statements).containsExactly("DROP TABLE order;", "DROP TABLE customer;");
    }

    @Test
    void generate_withNewModel_createsOnlyThatTable() {
        List<String> statements = statements(SqlDialect.POSTGRES, USER_WITH_ID,
            USER_WITH_ID + "model tag { id int @primary_key }");

        assertThat(statements).containsExactly("CREATE TABLE tag (\n  id INTEGER PRIMARY KEY NOT NULL\n);");
    }

    @Test
    void generate_withRemovedColumn_dropsIt() {
        List<String> statements = statements(SqlDialect.POSTGRES,
            "model user { id int @primary_key nickname string }",
            "model user { id int @primary_key }");

        assertThat(statements).containsExactly("ALTER TABLE user DROP COLUMN nickname;");
    }

    @Test
    void generate_withNullabilityChanges_setsAndDropsNotNull() {
        List<String> statements = statements(SqlDialect.POSTGRES,
            "model user { id int @primary_key name string bio string @required }",
            "model user { id int @primary_key name string @required bio string }");

        assertThat(statements).containsExactly(
            "ALTER TABLE user ALTER COLUMN name SET NOT NULL;",
            "ALTER TABLE user ALTER COLUMN bio DROP NOT NULL;");
    }

    @Test
    void generate_whenPrimaryKeyLosesNotNull_warnsInsteadOfAltering() {
        // Given
        SchemaNode previous = schema("model user { id int @primary_key }");
        SchemaNode current = schema("model user { id int }");

        // When
        MigrationPlan plan = new MigrationGenerator(SqlDialect.POSTGRES).generate(previous, current);

        // Then
        assertThat(plan.statements()).extracting(MigrationStatement::sql)
            .containsExactly("-- WARNING: Attempt to DROP NOT NULL on primary key column id skipped.");
        assertThat(plan.executableStatements()).isEmpty();
    }

    @Test
    void generate_withTypeChange_altersType() {
        List<String> statements = statements(SqlDialect.POSTGRES,
            "model user { id int @primary_key age string settings string }",
            "model user { id int @primary_key age int settings json }");

        assertThat(statements).containsExactly(
            "ALTER TABLE user ALTER COLUMN age TYPE INTEGER;",
            "ALTER TABLE user ALTER COLUMN settings TYPE JSONB USING settings::JSONB;");
    }

    @Test
    void generate_withTypeAndDefaultChange_changesTypeBeforeSettingDefault() {
        List<String> statements = statements(SqlDialect.POSTGRES,
            "model item { id int @primary_key code int @default(0) }",
            "model item { id int @primary_key code string @default(\"x\") }");

        assertThat(statements).containsExactly(
            "ALTER TABLE item ALTER COLUMN code DROP DEFAULT;",
            "ALTER TABLE item ALTER COLUMN code TYPE VARCHAR(255);",
            "ALTER TABLE item ALTER COLUMN code SET DEFAULT 'x';");
    }

    @Test
    void generate_withTypeChangeAndUnchangedDefault_restoresDefaultAfterType() {
        List<String> statements = statements(SqlDialect.POSTGRES,
            "model item { id int @primary_key qty int @default(1) }",
            "model item { id int @primary_key qty float @default(1) }");

        assertThat(statements).containsExactly(
            "ALTER TABLE item ALTER COLUMN qty DROP DEFAULT;",
            "ALTER TABLE item ALTER COLUMN qty TYPE REAL;",
            "ALTER TABLE item ALTER COLUMN qty SET DEFAULT 1;");
    }

    @Test
    void generate_forMySql_restatesModifiedColumns() {
        List<String> statements = statements(SqlDialect.MYSQL,
            "model user { id int @primary_key age string name string }",
            "model user { id int @primary_key age int name string @required }");

        assertThat(statements).containsExactly(
            "ALTER TABLE user MODIFY COLUMN age INT;",
            "ALTER TABLE user MODIFY COLUMN name VARCHAR(255) NOT NULL;");
    }

    @Test
    void generate_withDefaultChanges_setsAndDropsDefaults() {
        List<String> statements = statements(SqlDialect.POSTGRES,
            "model user { id int @primary_key role string status string @default(\"new\") }",
            "model user { id int @primary_key role string @default(\"member\") status string }");

        assertThat(statements).containsExactly(
            "ALTER TABLE user ALTER COLUMN role SET DEFAULT 'member';",
            "ALTER TABLE user ALTER COLUMN status DROP DEFAULT;");
    }

    @Test
    void generate_withAutoincrementChange_warns() {
        List<String> statements = statements(SqlDialect.POSTGRES,
            "model user { id int @primary_key }",
            USER_WITH_ID);

        assertThat(statements).containsExactly(
            "-- WARNING: Changing autoincrement on column id is not automated. Adjust the identity manually.");
    }

    @Test
    void generate_withUniqueChanges_addsOrWarns() {
        List<String> statements = statements(SqlDialect.POSTGRES,
            "model user { id int @primary_key email string login string @unique }",
            "model user { id int @primary_key email string @unique login string }");

        assertThat(statements).containsExactly(
            "ALTER TABLE user ADD UNIQUE (email);",
            "-- WARNING: UNIQUE constraint removal for login not automated. Please drop constraint manually if needed.");
    }

    @Test
    void generate_withEmptyPreviousSchema_treatsDatabaseAsFresh() {
        MigrationPlan plan = new MigrationGenerator(SqlDialect.POSTGRES)
            .generate(SchemaNode.empty(), schema(USER_WITH_ID));

        assertThat(plan.executableStatements()).singleElement().asString().startsWith("CREATE TABLE user");
    }
}
