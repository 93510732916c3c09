package com.fedsearch.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("JdbcValues")
class JdbcValuesTest {

    @Test
    @DisplayName("keeps numbers, booleans and strings")
    void scalars() throws Exception {
        assertThat(JdbcValues.toJsonSafe(42L, 0)).isEqualTo(42L);
        assertThat(JdbcValues.toJsonSafe(true, 0)).isEqualTo(true);
        assertThat(JdbcValues.toJsonSafe("Ada", 0)).isEqualTo("Ada");
        assertThat(JdbcValues.toJsonSafe(null, 0)).isNull();
    }

    @Test
    @DisplayName("renders other values as text")
    void text() throws Exception {
        UUID id = UUID.fromString("6f1c2c36-1d0a-4d7e-9a55-3f7c9d3c1e2b");

        assertThat(JdbcValues.toJsonSafe(LocalDate.of(2024, 3, 1), 0)).isEqualTo("2024-03-01");
        assertThat(JdbcValues.toJsonSafe(id, 0)).isEqualTo(id.toString());
        assertThat(JdbcValues.toJsonSafe(new byte[]{1, 2, 3}, 0)).isEqualTo("AQID");
    }

    @Test
    @DisplayName("truncates very long strings")
    void longStrings() throws Exception {
        assertThat((String) JdbcValues.toJsonSafe("x".repeat(100_050), 0)).hasSize(100_000);
    }

    @Test
    @DisplayName("replaces unreadable values with a placeholder")
    void unreadable() throws Exception {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getObject(1)).thenThrow(new SQLException("unsupported type"));
        when(rs.getObject(2)).thenReturn(7);

        assertThat(JdbcValues.read(rs, 1)).isEqualTo(JdbcValues.UNSUPPORTED_PLACEHOLDER);
        assertThat(JdbcValues.read(rs, 2)).isEqualTo(7);
    }
}
