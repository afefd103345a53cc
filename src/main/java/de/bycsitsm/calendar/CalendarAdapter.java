package de.bycsitsm.calendar;

import de.bycsitsm.room.Room;

import java.time.LocalDate;
import java.util.List;

/**
 * Translates room calendar operations to one backend.
 * <p>
 * Implementations are Spring beans; {@link CalendarAdapters} picks the one
 * whose {@link #provider()} matches the room. Failures are reported with the
 * subclasses of {@link CalendarException}.
 */
public interface CalendarAdapter {

    CalendarProvider provider();

    /**
     * Lists the events of the room that start on the given date, with recurring
     * series expanded into single instances, ordered by start.
     *
     * @throws ProviderUnavailableException if the backend cannot be reached
     * @throws ProviderRejectedException    if the backend refuses the request
     */
    List<CalendarEvent> listEvents(Room room, LocalDate date);

    /**
     * Reads a single event.
     *
     * @throws EventNotFoundException if the event does not exist
     */
    CalendarEvent getEvent(Room room, String eventId);

    /**
     * Writes a new event. No conflict check is performed here.
     */
    CalendarEvent createEvent(Room room, BookingRequest request);

    /**
     * Moves the end of an event by the given number of minutes.
     *
     * @throws EventNotFoundException if the event does not exist
     */
    CalendarEvent extendEvent(Room room, String eventId, int minutes);

    /**
     * Sets the end of an event to the current time.
     *
     * @throws EventNotFoundException if the event does not exist
     */
    void endEvent(Room room, String eventId);

    /**
     * Removes an event.
     *
     * @throws EventNotFoundException if the event does not exist (anymore)
     */
    void deleteEvent(Room room, String eventId);
}
