package de.bycsitsm.calendar;

import de.bycsitsm.room.Room;
import de.bycsitsm.room.RoomRepository;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Provider-agnostic booking and availability operations on room calendars.
 * Resolves the adapter serving a room, validates inputs and owns the conflict
 * logic; the service itself keeps no state.
 * <p>
 * Reads fail soft: if an adapter cannot list events, for whatever reason, the
 * day is reported empty. Writes propagate the {@link CalendarException} subclasses.
 * <p>
 * Conflict checks and the following write are not atomic. Two bookers racing
 * for the same slot can both pass the check; only the provider's own
 * consistency orders them.
 */
@Service
public class SchedulingService {

    private static final Logger log = LoggerFactory.getLogger(SchedulingService.class);

    private static final int DAYS_PER_WEEK = 7;

    private final RoomRepository roomRepository;
    private final CalendarAdapters adapters;
    private final CalendarProperties properties;
    private final Clock clock;

    SchedulingService(RoomRepository roomRepository, CalendarAdapters adapters, CalendarProperties properties,
                      Clock clock) {
        this.roomRepository = roomRepository;
        this.adapters = adapters;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Lists all active rooms ordered by name.
     */
    public List<Room> listRooms() {
        return roomRepository.findByActiveTrueOrderByNameAsc();
    }

    /**
     * @throws RoomNotFoundException if the room does not exist
     */
    public Room getRoom(long roomId) {
        return roomRepository.findById(roomId).orElseThrow(() -> new RoomNotFoundException(roomId));
    }

    /**
     * Lists the events of a room starting on the given date, ordered by start.
     *
     * @param roomId the room
     * @param date   the date, or {@code null} for today
     * @return the events, empty if the room's calendar could not be read
     * @throws RoomNotFoundException if the room does not exist
     */
    public List<CalendarEvent> eventsForDate(long roomId, @Nullable LocalDate date) {
        return readEvents(getRoom(roomId), date != null ? date : today());
    }

    /**
     * Lists the events of seven consecutive days. Events are not deduplicated
     * across days.
     *
     * @param roomId    the room
     * @param startDate the first day, or {@code null} for today
     * @return the events per day, in date order
     */
    public Map<LocalDate, List<CalendarEvent>> eventsForWeek(long roomId, @Nullable LocalDate startDate) {
        var room = getRoom(roomId);
        var first = startDate != null ? startDate : today();
        var week = new LinkedHashMap<LocalDate, List<CalendarEvent>>();
        for (int i = 0; i < DAYS_PER_WEEK; i++) {
            var date = first.plusDays(i);
            week.put(date, readEvents(room, date));
        }
        return week;
    }

    /**
     * Lists the events of every day of a month.
     *
     * @throws InvalidBookingException if the month is not between 1 and 12
     */
    public Map<LocalDate, List<CalendarEvent>> eventsForMonth(long roomId, int year, int month) {
        if (month < 1 || month > 12) {
            throw new InvalidBookingException("Month must be between 1 and 12.");
        }
        YearMonth yearMonth;
        try {
            yearMonth = YearMonth.of(year, month);
        } catch (DateTimeException e) {
            throw new InvalidBookingException("Invalid year: " + year + ".");
        }

        var room = getRoom(roomId);
        var days = new LinkedHashMap<LocalDate, List<CalendarEvent>>();
        for (int day = 1; day <= yearMonth.lengthOfMonth(); day++) {
            var date = yearMonth.atDay(day);
            days.put(date, readEvents(room, date));
        }
        return days;
    }

    /**
     * Returns the first of today's events running now, start and end inclusive.
     */
    public Optional<CalendarEvent> currentEvent(long roomId) {
        return findCurrent(eventsForDate(roomId, null), now());
    }

    /**
     * Returns the first of today's events starting after now.
     */
    public Optional<CalendarEvent> nextEvent(long roomId) {
        return findNext(eventsForDate(roomId, null), now());
    }

    /**
     * Collects what a display shows for a day. Current and next event are only
     * resolved when the day is today.
     *
     * @param date the day, or {@code null} for today
     */
    public RoomStatus roomStatus(long roomId, @Nullable LocalDate date) {
        var room = getRoom(roomId);
        var now = now();
        var day = date != null ? date : now.toLocalDate();
        var events = readEvents(room, day);

        CalendarEvent current = null;
        CalendarEvent next = null;
        if (day.equals(now.toLocalDate())) {
            current = findCurrent(events, now).orElse(null);
            next = findNext(events, now).orElse(null);
        }
        return new RoomStatus(room, day, events, current, next, now);
    }

    /**
     * Returns the events of the start date that overlap {@code [start, end)}.
     * Events touching the slot at either end do not conflict.
     */
    public List<CalendarEvent> checkConflicts(long roomId, LocalDateTime start, LocalDateTime end) {
        return findConflicts(getRoom(roomId), start, end);
    }

    /**
     * Books a room after checking for conflicts.
     *
     * @throws RoomNotFoundException    if the room does not exist
     * @throws InvalidBookingException  if the start is not before the end
     * @throws BookingConflictException if the slot overlaps an existing event
     */
    public CalendarEvent book(long roomId, String title, LocalDateTime start, LocalDateTime end,
                              @Nullable String booker) {
        var room = getRoom(roomId);
        var request = new BookingRequest(validTitle(title), start, end, booker);
        validateRange(start, end);

        var conflicts = findConflicts(room, start, end);
        if (!conflicts.isEmpty()) {
            throw new BookingConflictException(conflicts.get(0));
        }

        var event = adapters.forRoom(room).createEvent(room, request);
        log.info("Booked '{}' in room {} from {} to {}", event.title(), room.getName(), event.start(), event.end());
        return event;
    }

    /**
     * Books a room from now on for the given duration.
     *
     * @throws BookingConflictException if a meeting is running or the slot overlaps an event
     */
    public CalendarEvent bookNow(long roomId, String title, int durationMinutes, @Nullable String booker) {
        validateDuration(durationMinutes);
        var now = now();
        var current = currentEvent(roomId);
        if (current.isPresent()) {
            throw new BookingConflictException("Room is currently occupied.", current.get());
        }
        return book(roomId, title, now, now.plusMinutes(durationMinutes), booker);
    }

    /**
     * Moves the end of an event.
     *
     * @throws EventNotFoundException if the event does not exist
     */
    public CalendarEvent extend(long roomId, String eventId, int minutes) {
        validateDuration(minutes);
        var room = getRoom(roomId);
        var event = adapters.forRoom(room).extendEvent(room, eventId, minutes);
        log.info("Extended event {} in room {} by {} minute(s)", eventId, room.getName(), minutes);
        return event;
    }

    /**
     * Extends the meeting currently running in the room.
     *
     * @throws EventNotFoundException if no meeting is running
     */
    public CalendarEvent extendCurrentMeeting(long roomId, int minutes) {
        var current = currentEvent(roomId)
                .orElseThrow(() -> new EventNotFoundException("No active meeting to extend."));
        return extend(roomId, current.id(), minutes);
    }

    /**
     * Ends an event now. An event ending at its start is removed, and an
     * event that is already over is left as it is.
     *
     * @throws EventNotFoundException  if the event does not exist
     * @throws InvalidBookingException if the event has not started yet
     */
    public void end(long roomId, String eventId) {
        var room = getRoom(roomId);
        var adapter = adapters.forRoom(room);
        var event = adapter.getEvent(room, eventId);
        var now = now();

        if (event.start().isAfter(now)) {
            throw new InvalidBookingException("Meeting has not started yet.");
        }
        if (!event.end().isAfter(now)) {
            log.debug("Event {} in room {} is already over", eventId, room.getName());
            return;
        }
        if (event.start().isEqual(now)) {
            adapter.deleteEvent(room, eventId);
            log.info("Ended event {} in room {} at its start, removed it", eventId, room.getName());
            return;
        }
        adapter.endEvent(room, eventId);
        log.info("Ended event {} in room {}", eventId, room.getName());
    }

    /**
     * Ends the meeting currently running in the room.
     *
     * @throws EventNotFoundException if no meeting is running
     */
    public void endCurrentMeeting(long roomId) {
        var current = currentEvent(roomId)
                .orElseThrow(() -> new EventNotFoundException("No active meeting to end."));
        end(roomId, current.id());
    }

    /**
     * Cancels a booking. Cancelling an event that no longer exists succeeds.
     */
    public void cancel(long roomId, String eventId) {
        var room = getRoom(roomId);
        try {
            adapters.forRoom(room).deleteEvent(room, eventId);
            log.info("Cancelled event {} in room {}", eventId, room.getName());
        } catch (EventNotFoundException e) {
            log.warn("Event {} in room {} was already gone: {}", eventId, room.getName(), e.getMessage());
        }
    }

    /**
     * Books the same slot on every selected weekday of a date range. Dates whose
     * slot conflicts are skipped. Instances are checked and created one after
     * the other, so each check sees the instances created before it.
     * <p>
     * The batch is not transactional: if a write fails, the instances created
     * so far stay booked and the failure carries their count.
     *
     * @throws InvalidBookingException    if the request is malformed
     * @throws RecurringBookingException  if writing an instance fails
     */
    public RecurringBookingResult bookRecurring(long roomId, RecurringBookingRequest request) {
        var room = getRoom(roomId);
        var title = validTitle(request.title());
        validateRecurring(request);

        var startDate = request.startDate() != null ? request.startDate() : today();
        var endDate = request.endDate() != null
                ? request.endDate()
                : startDate.plusDays(properties.recurringDefaultDays());
        if (endDate.isBefore(startDate)) {
            throw new InvalidBookingException("End date must not be before start date.");
        }

        var adapter = adapters.forRoom(room);
        int created = 0;
        int skipped = 0;
        for (var date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            // 0 is Monday
            if (!request.daysOfWeek().contains(date.getDayOfWeek().getValue() - 1)) {
                continue;
            }
            var start = date.atTime(request.startHour(), request.startMinute());
            var end = start.plusMinutes(request.durationMinutes());

            if (!findConflicts(room, start, end).isEmpty()) {
                log.debug("Skipping recurring instance on {} in room {}: conflict", date, room.getName());
                skipped++;
                continue;
            }
            try {
                adapter.createEvent(room, new BookingRequest(title, start, end, request.booker()));
            } catch (CalendarException e) {
                var partial = new RecurringBookingResult(created, skipped);
                log.warn("Recurring booking in room {} failed on {} after {} created, {} skipped: {}",
                        room.getName(), date, created, skipped, e.getMessage());
                throw new RecurringBookingException(partial, e);
            }
            created++;
        }

        log.info("Recurring booking '{}' in room {}: created {}, skipped {} due to conflicts",
                title, room.getName(), created, skipped);
        return new RecurringBookingResult(created, skipped);
    }

    private List<CalendarEvent> readEvents(Room room, LocalDate date) {
        List<CalendarEvent> events;
        try {
            events = adapters.forRoom(room).listEvents(room, date);
        } catch (RuntimeException e) {
            log.warn("Could not read {} events of room {} on {}: {}",
                    room.getProvider().displayName(), room.getName(), date, e.getMessage());
            return List.of();
        }
        // stable sort, events starting together keep the adapter's order
        return events.stream()
                .sorted(Comparator.comparing(CalendarEvent::start))
                .toList();
    }

    private List<CalendarEvent> findConflicts(Room room, LocalDateTime start, LocalDateTime end) {
        return readEvents(room, start.toLocalDate()).stream()
                .filter(event -> event.overlaps(start, end))
                .toList();
    }

    private static Optional<CalendarEvent> findCurrent(List<CalendarEvent> events, LocalDateTime now) {
        return events.stream().filter(event -> event.isRunningAt(now)).findFirst();
    }

    private static Optional<CalendarEvent> findNext(List<CalendarEvent> events, LocalDateTime now) {
        return events.stream().filter(event -> event.start().isAfter(now)).findFirst();
    }

    private static String validTitle(@Nullable String title) {
        if (title == null || title.isBlank()) {
            throw new InvalidBookingException("Title must not be empty.");
        }
        return title.strip();
    }

    private static void validateRange(LocalDateTime start, LocalDateTime end) {
        if (start == null || end == null) {
            throw new InvalidBookingException("Start and end must be given.");
        }
        if (!start.isBefore(end)) {
            throw new InvalidBookingException("Start must be before end.");
        }
    }

    private static void validateDuration(int minutes) {
        if (minutes <= 0) {
            throw new InvalidBookingException("Duration must be positive.");
        }
    }

    private static void validateRecurring(RecurringBookingRequest request) {
        if (request.daysOfWeek() == null || request.daysOfWeek().isEmpty()) {
            throw new InvalidBookingException("At least one day must be selected.");
        }
        for (var day : request.daysOfWeek()) {
            if (day == null || day < 0 || day > 6) {
                throw new InvalidBookingException("Days of week must be between 0 (Monday) and 6 (Sunday).");
            }
        }
        if (request.startHour() < 0 || request.startHour() > 23) {
            throw new InvalidBookingException("Start hour must be between 0 and 23.");
        }
        if (request.startMinute() < 0 || request.startMinute() > 59) {
            throw new InvalidBookingException("Start minute must be between 0 and 59.");
        }
        validateDuration(request.durationMinutes());
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
