package space.ketterling.sensornet.query;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import space.ketterling.sensornet.schema.FeatureTableException;
import space.ketterling.sensornet.schema.SchemaRegistry;
import space.ketterling.sensornet.schema.TableSchema;
import space.ketterling.sensornet.testsupport.InMemorySchemaRegistry;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JdbcObservationStore")
class JdbcObservationStoreTest {
    @Mock
    private DataSource ds;
    @Mock
    private Connection connection;
    @Mock
    private PreparedStatement statement;
    @Mock
    private ResultSet resultSet;
    @Mock
    private ResultSetMetaData metaData;
    @Mock
    private SchemaRegistry schemas;

    private JdbcObservationStore store;
    private ObservationQuery query;

    @BeforeEach
    void setUp() throws Exception {
        when(ds.getConnection()).thenReturn(connection);
        when(connection.prepareStatement(anyString())).thenReturn(statement);
        store = new JdbcObservationStore(ds, schemas);
        TableSchema schema = InMemorySchemaRegistry.sample().schemaFor("temperature");
        query = new ObservationQuery(schema, List.of(), List.of(), null, null);
    }

    @Test
    @DisplayName("an undefined table drops the cached schema and becomes a feature table error")
    void undefinedTableFailsClosed() throws Exception {
        when(statement.executeQuery()).thenThrow(new SQLException("relation does not exist", "42P01"));

        assertThatThrownBy(() -> store.fetch(query.select()))
                .isInstanceOf(FeatureTableException.class)
                .hasMessageContaining("temperature");
        verify(schemas).invalidate("temperature");
    }

    @Test
    @DisplayName("other SQL errors propagate unchanged and keep the cached schema")
    void otherErrorsPropagate() throws Exception {
        SQLException timeout = new SQLException("canceling statement due to statement timeout", "57014");
        when(statement.executeQuery()).thenThrow(timeout);

        assertThatThrownBy(() -> store.count(query)).isSameAs(timeout);
        verify(schemas, never()).invalidate(anyString());
    }

    @Test
    @DisplayName("streaming reads through a cursor with the requested fetch size")
    void streamUsesCursor() throws Exception {
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(metaData);
        columns("node_id", "datetime", "meta_id", "sensor", "temperature");
        when(resultSet.next()).thenReturn(true, true, false);
        when(resultSet.getObject(5)).thenReturn(20.5, 21.0);

        List<Object> seen = new ArrayList<>();
        store.stream(query, 500, row -> seen.add(row.get("temperature")));

        assertThat(seen).containsExactly(20.5, 21.0);
        var order = inOrder(connection, statement);
        order.verify(connection).setAutoCommit(false);
        order.verify(statement).setFetchSize(500);
        order.verify(connection).commit();
        order.verify(connection).setAutoCommit(true);
    }

    @Test
    @DisplayName("a failing row handler rolls back without touching the schema cache")
    void handlerFailureIsNotASchemaError() throws Exception {
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(metaData);
        columns("node_id", "datetime", "meta_id", "sensor", "temperature");
        when(resultSet.next()).thenReturn(true);
        SQLException downstream = new SQLException("datadump table missing", "42P01");

        assertThatThrownBy(() -> store.stream(query, 100, row -> {
            throw downstream;
        })).isSameAs(downstream);
        verify(connection).rollback();
        verify(schemas, never()).invalidate(anyString());
    }

    @Test
    @DisplayName("a column added after the schema was cached drops the cached schema instead of being left out")
    void addedColumnFailsClosed() throws Exception {
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(metaData);
        columns("node_id", "datetime", "meta_id", "sensor", "temperature", "humidity");

        assertThatThrownBy(() -> store.fetch(query.select()))
                .isInstanceOf(FeatureTableException.class)
                .hasMessageContaining("changed since its schema was cached");
        verify(schemas).invalidate("temperature");
        verify(resultSet, never()).next();
    }

    @Test
    @DisplayName("a dropped column is caught while streaming and the cursor is rolled back")
    void droppedColumnFailsClosedWhileStreaming() throws Exception {
        when(statement.executeQuery()).thenReturn(resultSet);
        when(resultSet.getMetaData()).thenReturn(metaData);
        columns("node_id", "datetime", "meta_id", "sensor");
        List<Object> seen = new ArrayList<>();

        assertThatThrownBy(() -> store.stream(query, 100, seen::add))
                .isInstanceOf(FeatureTableException.class);
        assertThat(seen).isEmpty();
        verify(schemas).invalidate("temperature");
        verify(connection).rollback();
    }

    private void columns(String... labels) throws SQLException {
        when(metaData.getColumnCount()).thenReturn(labels.length);
        for (int i = 0; i < labels.length; i++)
            when(metaData.getColumnLabel(i + 1)).thenReturn(labels[i]);
    }
}
