package com.compass.calendar.infrastructure.persistence;

import com.compass.calendar.domain.model.CalendarEvent;
import com.compass.calendar.domain.model.EventException;
import com.compass.calendar.domain.model.EventOccurrence;
import com.compass.calendar.domain.model.EventReminder;
import com.compass.calendar.domain.model.EventType;
import com.compass.calendar.domain.model.Frequency;
import com.compass.calendar.domain.model.OccurrenceStatus;
import com.compass.calendar.domain.model.RecurrenceRule;
import com.compass.calendar.domain.model.ReminderMethod;
import com.compass.calendar.domain.model.Transparency;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import org.springframework.jdbc.core.RowMapper;

/**
 * Row mapping and column conversion for the calendar tables
 */
final class CalendarRowMappers {

    static final RowMapper<CalendarEvent> EVENT = (rs, rowNum) -> new CalendarEvent(
            uuid(rs, "id"),
            uuid(rs, "owner_id"),
            rs.getString("title"),
            rs.getString("description"),
            EventType.valueOf(rs.getString("event_type")),
            instant(rs, "start_time"),
            instant(rs, "end_time"),
            rs.getBoolean("is_all_day"),
            rs.getString("location"),
            rs.getString("color"),
            Transparency.valueOf(rs.getString("transparency")),
            instant(rs, "created_at"),
            instant(rs, "updated_at"),
            List.of(),
            List.of(),
            List.of()
    );

    static final RowMapper<RecurrenceRule> RULE = (rs, rowNum) -> {
        int count = rs.getInt("occurrence_count");
        Integer occurrenceCount = rs.wasNull() ? null : count;
        return new RecurrenceRule(
                uuid(rs, "id"),
                uuid(rs, "event_id"),
                Frequency.valueOf(rs.getString("freq")),
                rs.getInt("repeat_interval"),
                stringSet(rs.getArray("by_day")),
                integerSet(rs.getArray("by_month")),
                integerSet(rs.getArray("by_month_day")),
                occurrenceCount,
                instant(rs, "until_time"),
                instant(rs, "created_at"),
                instant(rs, "updated_at")
        );
    };

    static final RowMapper<EventOccurrence> OCCURRENCE = (rs, rowNum) -> new EventOccurrence(
            uuid(rs, "id"),
            uuid(rs, "event_id"),
            instant(rs, "occurrence_time"),
            OccurrenceStatus.valueOf(rs.getString("status")),
            instant(rs, "created_at"),
            instant(rs, "updated_at")
    );

    static final RowMapper<EventException> EXCEPTION = (rs, rowNum) -> {
        String transparency = rs.getString("override_transparency");
        return new EventException(
                uuid(rs, "id"),
                uuid(rs, "event_id"),
                instant(rs, "original_time"),
                instant(rs, "override_start_time"),
                instant(rs, "override_end_time"),
                rs.getString("override_title"),
                rs.getString("override_description"),
                rs.getString("override_location"),
                rs.getString("override_color"),
                transparency == null ? null : Transparency.valueOf(transparency),
                rs.getBoolean("is_deleted"),
                instant(rs, "created_at"),
                instant(rs, "updated_at")
        );
    };

    static final RowMapper<EventReminder> REMINDER = (rs, rowNum) -> new EventReminder(
            uuid(rs, "id"),
            uuid(rs, "event_id"),
            rs.getInt("minutes_before"),
            ReminderMethod.valueOf(rs.getString("method")),
            instant(rs, "created_at"),
            instant(rs, "updated_at")
    );

    private CalendarRowMappers() {
    }

    static OffsetDateTime toDb(Instant instant) {
        return instant == null ? null : instant.atOffset(ZoneOffset.UTC);
    }

    static String toDb(Enum<?> value) {
        return value == null ? null : value.name();
    }

    /**
     * Empty filter sets are stored as NULL.
     */
    static String[] toTextArray(Set<String> values) {
        return values.isEmpty() ? null : values.stream().sorted().toArray(String[]::new);
    }

    static Integer[] toIntegerArray(Set<Integer> values) {
        return values.isEmpty() ? null : values.stream().sorted().toArray(Integer[]::new);
    }

    private static UUID uuid(ResultSet rs, String column) throws SQLException {
        String value = rs.getString(column);
        return value == null ? null : UUID.fromString(value);
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static Set<String> stringSet(Array array) throws SQLException {
        if (array == null) {
            return Set.of();
        }
        return Arrays.stream((Object[]) array.getArray())
                .map(Object::toString)
                .collect(Collectors.toSet());
    }

    private static Set<Integer> integerSet(Array array) throws SQLException {
        if (array == null) {
            return Set.of();
        }
        return Arrays.stream((Object[]) array.getArray())
                .map(value -> ((Number) value).intValue())
                .collect(Collectors.toSet());
    }
}
