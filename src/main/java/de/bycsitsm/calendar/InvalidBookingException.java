package de.bycsitsm.calendar;

/**
 * Thrown when a booking, date or range argument is malformed.
 */
public class InvalidBookingException extends CalendarException {

    public InvalidBookingException(String message) {
        super(message);
    }
}
