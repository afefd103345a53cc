package de.bycsitsm.calendar;

import de.bycsitsm.room.Room;
import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calendar adapter keeping events in a list, with switches to simulate provider failures.
 */
class InMemoryCalendarAdapter implements CalendarAdapter {

    private final CalendarProvider provider;
    private final List<CalendarEvent> events = new ArrayList<>();
    private final AtomicInteger ids = new AtomicInteger();

    @Nullable RuntimeException readFailure;
    int createsBeforeFailure = Integer.MAX_VALUE;
    LocalDateTime now = LocalDateTime.of(2024, 1, 10, 10, 0);

    InMemoryCalendarAdapter(CalendarProvider provider) {
        this.provider = provider;
    }

    CalendarEvent add(String title, LocalDateTime start, LocalDateTime end) {
        var event = new CalendarEvent("evt-" + ids.incrementAndGet(), title, start, end, null, provider);
        events.add(event);
        return event;
    }

    List<CalendarEvent> events() {
        return events;
    }

    @Override
    public CalendarProvider provider() {
        return provider;
    }

    @Override
    public List<CalendarEvent> listEvents(Room room, LocalDate date) {
        if (readFailure != null) {
            throw readFailure;
        }
        return events.stream()
                .filter(event -> event.start().toLocalDate().equals(date))
                .toList();
    }

    @Override
    public CalendarEvent getEvent(Room room, String eventId) {
        return find(eventId);
    }

    @Override
    public CalendarEvent createEvent(Room room, BookingRequest request) {
        if (createsBeforeFailure-- <= 0) {
            throw new ProviderRejectedException("Calendar refused the event.");
        }
        return add(request.title(), request.start(), request.end());
    }

    @Override
    public CalendarEvent extendEvent(Room room, String eventId, int minutes) {
        var event = find(eventId);
        var extended = new CalendarEvent(event.id(), event.title(), event.start(), event.end().plusMinutes(minutes),
                event.organizer(), provider);
        events.set(events.indexOf(event), extended);
        return extended;
    }

    @Override
    public void endEvent(Room room, String eventId) {
        var event = find(eventId);
        events.set(events.indexOf(event), new CalendarEvent(event.id(), event.title(), event.start(), now,
                event.organizer(), provider));
    }

    @Override
    public void deleteEvent(Room room, String eventId) {
        events.remove(find(eventId));
    }

    private CalendarEvent find(String eventId) {
        return events.stream()
                .filter(event -> event.id().equals(eventId))
                .findFirst()
                .orElseThrow(() -> new EventNotFoundException("Event " + eventId + " not found."));
    }
}
