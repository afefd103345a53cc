package de.bycsitsm.calendar;

public class EventNotFoundException extends CalendarException {

    public EventNotFoundException(String message) {
        super(message);
    }
}
