package com.shardql.query;

import org.junit.jupiter.api.Test;

import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class RowValuesTest {

    @Test
    void keepsScalarsAndStringifiesTemporalValues() throws SQLException {
        UUID id = UUID.randomUUID();

        assertThat(RowValues.convert(42L, 0)).isEqualTo(42L);
        assertThat(RowValues.convert(true, 0)).isEqualTo(true);
        assertThat(RowValues.convert(LocalDate.of(2025, 3, 1), 0)).isEqualTo("2025-03-01");
        assertThat(RowValues.convert(Timestamp.valueOf("2025-03-01 10:15:00"), 0)).isEqualTo("2025-03-01 10:15:00.0");
        assertThat(RowValues.convert(id, 0)).isEqualTo(id.toString());
        assertThat(RowValues.convert(new byte[]{1, 2, 3}, 0)).isEqualTo("AQID");
    }

    @Test
    void convertsArraysElementWise() throws SQLException {
        Array array = mock(Array.class);
        when(array.getArray()).thenReturn(new Object[]{"a", 1, null});

        assertThat(RowValues.convert(array, 0)).isEqualTo(java.util.Arrays.asList("a", 1, null));
    }

    @Test
    void truncatesLongStrings() throws SQLException {
        String longText = "x".repeat(RowValues.MAX_STRING_CHARS + 10);

        assertThat((String) RowValues.convert(longText, 0)).hasSize(RowValues.MAX_STRING_CHARS);
    }

    @Test
    void unreadableColumnBecomesPlaceholder() throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.getObject(1)).thenThrow(new SQLException("unsupported type"));

        assertThat(RowValues.read(rs, 1)).isEqualTo(RowValues.UNSUPPORTED);
    }
}
