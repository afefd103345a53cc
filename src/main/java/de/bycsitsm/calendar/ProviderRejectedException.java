package de.bycsitsm.calendar;

/**
 * Thrown when a calendar provider answered with a request-level error.
 * The same request will fail again unless it is changed.
 */
public class ProviderRejectedException extends CalendarException {

    public ProviderRejectedException(String message) {
        super(message);
    }

    public ProviderRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
