package de.bycsitsm.calendar;

/**
 * Outcome of a recurring booking batch.
 *
 * @param created number of instances written to the calendar
 * @param skipped number of instances left out because they conflicted
 */
public record RecurringBookingResult(int created, int skipped) {
}
