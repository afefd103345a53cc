package de.bycsitsm.calendar.local;

import de.bycsitsm.calendar.BookingRequest;
import de.bycsitsm.calendar.CalendarAdapter;
import de.bycsitsm.calendar.CalendarEvent;
import de.bycsitsm.calendar.CalendarProvider;
import de.bycsitsm.calendar.EventNotFoundException;
import de.bycsitsm.room.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

/**
 * {@link CalendarAdapter} backed by the {@code local_event} table, used for
 * rooms without an external calendar. Event ids are the numeric row ids.
 */
@Component
class LocalCalendarAdapter implements CalendarAdapter {

    private static final Logger log = LoggerFactory.getLogger(LocalCalendarAdapter.class);

    private final LocalEventRepository eventRepository;
    private final Clock clock;

    LocalCalendarAdapter(LocalEventRepository eventRepository, Clock clock) {
        this.eventRepository = eventRepository;
        this.clock = clock;
    }

    @Override
    public CalendarProvider provider() {
        return CalendarProvider.LOCAL;
    }

    @Override
    @Transactional(readOnly = true)
    public List<CalendarEvent> listEvents(Room room, LocalDate date) {
        return eventRepository.findStartingBetween(room.getId(), date.atStartOfDay(), date.plusDays(1).atStartOfDay())
                .stream()
                .map(LocalCalendarAdapter::toEvent)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public CalendarEvent getEvent(Room room, String eventId) {
        return toEvent(find(room, eventId));
    }

    @Override
    @Transactional
    public CalendarEvent createEvent(Room room, BookingRequest request) {
        var organizer = request.hasBooker() ? request.booker().strip() : null;
        var event = eventRepository.save(new LocalEvent(room.getId(), request.title(), request.start(), request.end(),
                organizer));
        log.debug("Stored local event {} for room {}", event.getId(), room.getName());
        return toEvent(event);
    }

    @Override
    @Transactional
    public CalendarEvent extendEvent(Room room, String eventId, int minutes) {
        var event = find(room, eventId);
        event.setEndTime(event.getEndTime().plusMinutes(minutes));
        return toEvent(eventRepository.save(event));
    }

    @Override
    @Transactional
    public void endEvent(Room room, String eventId) {
        var event = find(room, eventId);
        event.setEndTime(LocalDateTime.now(clock));
        eventRepository.save(event);
    }

    @Override
    @Transactional
    public void deleteEvent(Room room, String eventId) {
        eventRepository.delete(find(room, eventId));
    }

    private LocalEvent find(Room room, String eventId) {
        long id;
        try {
            id = Long.parseLong(eventId);
        } catch (NumberFormatException e) {
            throw new EventNotFoundException("Event " + eventId + " not found.");
        }
        return eventRepository.findByIdAndRoomId(id, room.getId())
                .orElseThrow(() -> new EventNotFoundException("Event " + eventId + " not found."));
    }

    private static CalendarEvent toEvent(LocalEvent event) {
        return new CalendarEvent(
                String.valueOf(event.getId()),
                event.getTitle(),
                event.getStartTime(),
                event.getEndTime(),
                event.getOrganizer(),
                CalendarProvider.LOCAL
        );
    }
}
