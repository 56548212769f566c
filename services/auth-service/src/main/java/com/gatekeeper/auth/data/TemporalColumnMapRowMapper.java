package com.gatekeeper.auth.data;

import org.springframework.jdbc.core.ColumnMapRowMapper;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;

/**
 * {@link ColumnMapRowMapper} that reads date and timestamp columns as
 * {@code java.time} values instead of {@code java.sql} ones, so a fetched
 * row maps back onto the same entity property types a payload is built from.
 */
class TemporalColumnMapRowMapper extends ColumnMapRowMapper {

    @Override
    protected Object getColumnValue(ResultSet rs, int index) throws SQLException {
        ResultSetMetaData metaData = rs.getMetaData();
        int type = metaData.getColumnType(index);
        if (type == Types.TIMESTAMP_WITH_TIMEZONE
                || (type == Types.TIMESTAMP && "timestamptz".equalsIgnoreCase(metaData.getColumnTypeName(index)))) {
            return rs.getObject(index, OffsetDateTime.class);
        }
        if (type == Types.TIMESTAMP) {
            return rs.getObject(index, LocalDateTime.class);
        }
        if (type == Types.DATE) {
            return rs.getObject(index, LocalDate.class);
        }
        return super.getColumnValue(rs, index);
    }
}
