package com.cinegen.api.config;

import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DatabaseInitializerTest {

    @Test
    void unreachableDatabaseStopsStartup() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("Connection refused"));

        assertThatThrownBy(() -> new DatabaseInitializer(dataSource).initialize())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(DatabaseInitializer.SCHEMA_LOCATION);
    }
}
