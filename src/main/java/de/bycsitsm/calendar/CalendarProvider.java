package de.bycsitsm.calendar;

/**
 * The backends a room calendar can live in.
 */
public enum CalendarProvider {

    GOOGLE("Google Calendar"),
    MICROSOFT("Microsoft Calendar"),
    LOCAL("Local calendar");

    private final String displayName;

    CalendarProvider(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
