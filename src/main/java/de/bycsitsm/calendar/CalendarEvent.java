package de.bycsitsm.calendar;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Provider-agnostic event of a room calendar.
 * <p>
 * Start and end are wall-clock timestamps in the configured calendar zone;
 * adapters convert provider timestamps at their boundary. The end is never
 * before the start; providers may report events of zero length.
 *
 * @param id        the provider-issued id (numeric ids of the local store as string)
 * @param title     the title of the event, {@code "Busy"} if the provider has none
 * @param start     the start of the event
 * @param end       the end of the event
 * @param organizer the organizer or booker, or {@code null} if unknown
 * @param provider  the backend the event was read from
 */
public record CalendarEvent(
        String id,
        String title,
        LocalDateTime start,
        LocalDateTime end,
        @Nullable String organizer,
        CalendarProvider provider
) {

    public static final String UNTITLED = "Busy";

    public CalendarEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        Objects.requireNonNull(provider, "provider");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Event " + id + " ends before it starts.");
        }
        if (title == null || title.isBlank()) {
            title = UNTITLED;
        }
    }

    /**
     * Whether the event is running at the given moment, inclusive of both ends.
     */
    public boolean isRunningAt(LocalDateTime moment) {
        return !moment.isBefore(start) && !moment.isAfter(end);
    }

    /**
     * Half-open overlap test: an event that ends exactly when the slot starts,
     * or starts exactly when the slot ends, does not overlap.
     */
    public boolean overlaps(LocalDateTime slotStart, LocalDateTime slotEnd) {
        return slotStart.isBefore(end) && slotEnd.isAfter(start);
    }
}
