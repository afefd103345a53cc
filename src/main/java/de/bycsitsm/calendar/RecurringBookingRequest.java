package de.bycsitsm.calendar;

import org.jspecify.annotations.Nullable;

import java.time.LocalDate;
import java.util.List;

/**
 * A batch of identical bookings repeated on selected weekdays.
 *
 * @param title           the title of every instance
 * @param startHour       the hour each instance starts (0-23)
 * @param startMinute     the minute each instance starts (0-59)
 * @param durationMinutes the length of each instance
 * @param booker          the name of the person booking, or {@code null}
 * @param daysOfWeek      the weekdays to book, 0 for Monday through 6 for Sunday
 * @param startDate       the first date of the range, or {@code null} for today
 * @param endDate         the last date of the range (inclusive), or {@code null}
 *                        for the configured default range length
 */
public record RecurringBookingRequest(
        String title,
        int startHour,
        int startMinute,
        int durationMinutes,
        @Nullable String booker,
        List<Integer> daysOfWeek,
        @Nullable LocalDate startDate,
        @Nullable LocalDate endDate
) {
}
