package com.dikit.core.introspect;

import com.dikit.core.sql.SqlDialect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link MySqlCatalogReader} with a mocked JDBC connection.
 */
class MySqlCatalogReaderTest {

    private Connection connection;
    private PreparedStatement columnsStatement;
    private PreparedStatement constraintsStatement;
    private ResultSet columnRows;
    private ResultSet constraintRows;

    @BeforeEach
    void setUp() throws SQLException {
        connection = mock(Connection.class);
        columnsStatement = mock(PreparedStatement.class);
        constraintsStatement = mock(PreparedStatement.class);
        columnRows = mock(ResultSet.class);
        constraintRows = mock(ResultSet.class);

        when(connection.prepareStatement(MySqlCatalogReader.COLUMNS)).thenReturn(columnsStatement);
        when(connection.prepareStatement(MySqlCatalogReader.CONSTRAINTS)).thenReturn(constraintsStatement);
        when(columnsStatement.executeQuery()).thenReturn(columnRows);
        when(constraintsStatement.executeQuery()).thenReturn(constraintRows);
    }

    @Test
    void read_mapsColumnTypeAndExtraAndForeignKeys() throws SQLException {
        // Given
        when(columnRows.next()).thenReturn(true, true, false);
        when(columnRows.getString("table_name")).thenReturn("post", "post");
        when(columnRows.getString("column_name")).thenReturn("id", "published");
        when(columnRows.getString("data_type")).thenReturn("int", "tinyint");
        when(columnRows.getString("native_type")).thenReturn("int", "tinyint(1)");
        when(columnRows.getString("is_nullable")).thenReturn("NO", "YES");
        when(columnRows.getString("column_default")).thenReturn(null, "0");
        when(columnRows.getString("extra")).thenReturn("auto_increment", "");
        when(columnRows.getInt("ordinal_position")).thenReturn(1, 2);

        when(constraintRows.next()).thenReturn(true, true, false);
        when(constraintRows.getString("constraint_type")).thenReturn("PRIMARY KEY", "FOREIGN KEY");
        when(constraintRows.getString("table_name")).thenReturn("post", "post");
        when(constraintRows.getString("constraint_name")).thenReturn("PRIMARY", "post_ibfk_1");
        when(constraintRows.getString("referenced_table")).thenReturn(null, "user");
        when(constraintRows.getString("column_name")).thenReturn("id", "author_id");

        // When
        CatalogSnapshot snapshot = new MySqlCatalogReader().read(connection);

        // Then
        assertThat(snapshot.dialect()).isEqualTo(SqlDialect.MYSQL);
        assertThat(snapshot.columns()).containsExactly(
            new CatalogSnapshot.Column("post", "id", "int", "int", false, null, "auto_increment", 1),
            new CatalogSnapshot.Column("post", "published", "tinyint", "tinyint(1)", true, "0", "", 2));
        assertThat(snapshot.constraints()).containsExactly(
            new CatalogSnapshot.Constraint("PRIMARY", CatalogSnapshot.ConstraintType.PRIMARY_KEY,
                "post", List.of("id"), null),
            new CatalogSnapshot.Constraint("post_ibfk_1", CatalogSnapshot.ConstraintType.FOREIGN_KEY,
                "post", List.of("author_id"), "user"));
    }

    @Test
    void read_bindsNoParameters() throws SQLException {
        when(columnRows.next()).thenReturn(true, false);
        when(columnRows.getString("table_name")).thenReturn("user");
        when(columnRows.getString("column_name")).thenReturn("id");
        when(columnRows.getString("data_type")).thenReturn("int");
        when(columnRows.getString("is_nullable")).thenReturn("NO");
        when(constraintRows.next()).thenReturn(false);

        new MySqlCatalogReader().read(connection);

        verify(columnsStatement, never()).setString(anyInt(), anyString());
        verify(constraintsStatement, never()).setString(anyInt(), anyString());
    }

    @Test
    void read_withoutTables_skipsConstraintQuery() throws SQLException {
        when(columnRows.next()).thenReturn(false);

        CatalogSnapshot snapshot = new MySqlCatalogReader().read(connection);

        assertThat(snapshot.isEmpty()).isTrue();
        verify(connection, never()).prepareStatement(MySqlCatalogReader.CONSTRAINTS);
    }

    @Test
    void queries_aliasMySqlColumnsToCommonLabels() {
        assertThat(MySqlCatalogReader.COLUMNS)
            .contains("c.COLUMN_TYPE AS native_type")
            .contains("c.EXTRA AS extra")
            .contains("WHERE c.TABLE_SCHEMA = DATABASE()")
            .doesNotContain("?");
        assertThat(MySqlCatalogReader.CONSTRAINTS)
            .contains("kcu.REFERENCED_TABLE_NAME AS referenced_table")
            .contains("AND tc.TABLE_NAME = kcu.TABLE_NAME");
    }
}
