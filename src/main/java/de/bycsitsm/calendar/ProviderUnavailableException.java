package de.bycsitsm.calendar;

/**
 * Thrown when a calendar provider cannot be reached, either because no usable
 * credential exists or because the transport failed. Retrying later may succeed.
 */
public class ProviderUnavailableException extends CalendarException {

    public ProviderUnavailableException(String message) {
        super(message);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
