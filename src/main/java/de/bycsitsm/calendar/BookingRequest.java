package de.bycsitsm.calendar;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;

/**
 * A new event to be written to a room calendar.
 *
 * @param title  the title entered by the booker
 * @param start  the start of the booking
 * @param end    the end of the booking
 * @param booker the name of the person booking, or {@code null}
 */
public record BookingRequest(
        String title,
        LocalDateTime start,
        LocalDateTime end,
        @Nullable String booker
) {

    public boolean hasBooker() {
        return booker != null && !booker.isBlank();
    }

    /**
     * The title as written to remote calendars, with the booker's name appended.
     */
    public String titleWithBooker() {
        return hasBooker() ? title + " (" + booker.strip() + ")" : title;
    }

    public String description() {
        return hasBooker()
                ? "Booked by " + booker.strip() + " via room display."
                : "Booked via room display.";
    }
}
