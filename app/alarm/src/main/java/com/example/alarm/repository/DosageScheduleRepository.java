/*
 * Where: Alarm data access
 * What: Reads active rows of the medicines table as schedule entries
 * Why: One full read per tick; no change feed is needed at minute granularity
 */
package com.example.alarm.repository;

import com.example.alarm.model.DosageScheduleEntry;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DosageScheduleRepository implements ScheduleStore {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    @Override
    public List<DosageScheduleEntry> listAllActiveEntries() {
        String sql = """
                SELECT id::text AS id_text, user_id, name, timing, times, days
                FROM medicines
                WHERE active
                ORDER BY created_at, id
                """;
        return jdbcTemplate.query(sql, new MapSqlParameterSource(), this::mapRow);
    }

    private DosageScheduleEntry mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new DosageScheduleEntry(
                rs.getString("id_text"),
                rs.getString("user_id"),
                rs.getString("name"),
                rs.getString("timing"),
                toList(rs.getArray("times")),
                toList(rs.getArray("days")));
    }

    private List<String> toList(Array array) throws SQLException {
        if (array == null) {
            return List.of();
        }
        try {
            return Arrays.asList((String[]) array.getArray());
        } finally {
            array.free();
        }
    }
}
