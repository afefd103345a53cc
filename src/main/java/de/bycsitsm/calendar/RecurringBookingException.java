package de.bycsitsm.calendar;

/**
 * Thrown when a recurring batch stops part way through. Instances created before
 * the failure stay booked; {@link #getPartialResult()} accounts for them.
 */
public class RecurringBookingException extends CalendarException {

    private final RecurringBookingResult partialResult;

    public RecurringBookingException(RecurringBookingResult partialResult, Throwable cause) {
        super("Recurring booking stopped after " + partialResult.created() + " created and "
                + partialResult.skipped() + " skipped booking(s): " + cause.getMessage(), cause);
        this.partialResult = partialResult;
    }

    public RecurringBookingResult getPartialResult() {
        return partialResult;
    }
}
