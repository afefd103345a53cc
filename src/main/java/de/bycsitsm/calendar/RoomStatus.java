package de.bycsitsm.calendar;

import de.bycsitsm.room.Room;
import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * What a room display shows for one day.
 *
 * @param room         the room
 * @param date         the day shown
 * @param events       the events of that day in start order
 * @param currentEvent the running event, only resolved when the day is today
 * @param nextEvent    the next upcoming event, only resolved when the day is today
 * @param serverTime   the moment the snapshot was taken
 */
public record RoomStatus(
        Room room,
        LocalDate date,
        List<CalendarEvent> events,
        @Nullable CalendarEvent currentEvent,
        @Nullable CalendarEvent nextEvent,
        LocalDateTime serverTime
) {

    public boolean available() {
        return currentEvent == null;
    }
}
