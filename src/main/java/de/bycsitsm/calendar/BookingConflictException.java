package de.bycsitsm.calendar;

/**
 * Thrown when a requested slot overlaps an existing event of the room.
 */
public class BookingConflictException extends CalendarException {

    private final CalendarEvent conflictingEvent;

    public BookingConflictException(String message, CalendarEvent conflictingEvent) {
        super(message);
        this.conflictingEvent = conflictingEvent;
    }

    public BookingConflictException(CalendarEvent conflictingEvent) {
        this("Conflicts with existing booking: " + conflictingEvent.title(), conflictingEvent);
    }

    public CalendarEvent getConflictingEvent() {
        return conflictingEvent;
    }
}
