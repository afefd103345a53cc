package de.bycsitsm.calendar.google;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import de.bycsitsm.calendar.BookingRequest;
import de.bycsitsm.calendar.CalendarAdapter;
import de.bycsitsm.calendar.CalendarEvent;
import de.bycsitsm.calendar.CalendarProperties;
import de.bycsitsm.calendar.CalendarProvider;
import de.bycsitsm.calendar.ProviderHttpClient;
import de.bycsitsm.calendar.ProviderRejectedException;
import de.bycsitsm.calendar.ProviderUnavailableException;
import de.bycsitsm.calendar.WireTimestamps;
import de.bycsitsm.credential.CredentialService;
import de.bycsitsm.room.Room;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link CalendarAdapter} for the Google Calendar v3 REST API.
 * <p>
 * Lists are requested with {@code singleEvents=true} so the API expands
 * recurring series into their instances and orders them by start time.
 */
@Component
class GoogleCalendarAdapter implements CalendarAdapter {

    private static final Logger log = LoggerFactory.getLogger(GoogleCalendarAdapter.class);

    private static final String PRIMARY_CALENDAR = "primary";
    private static final int PAGE_SIZE = 250;

    private final CredentialService credentialService;
    private final ProviderHttpClient httpClient;
    private final String apiUrl;
    private final Clock clock;
    private final ZoneId zone;

    GoogleCalendarAdapter(CredentialService credentialService, CalendarProperties properties,
                          ObjectMapper objectMapper, Clock clock) {
        this.credentialService = credentialService;
        this.httpClient = new ProviderHttpClient(CalendarProvider.GOOGLE.displayName(), objectMapper);
        this.apiUrl = properties.google().apiUrl().replaceAll("/+$", "");
        this.clock = clock;
        this.zone = clock.getZone();
    }

    @Override
    public CalendarProvider provider() {
        return CalendarProvider.GOOGLE;
    }

    @Override
    public List<CalendarEvent> listEvents(Room room, LocalDate date) {
        var accessToken = accessToken();
        var dayStart = date.atStartOfDay();
        var dayEnd = date.plusDays(1).atStartOfDay();

        var query = new LinkedHashMap<String, String>();
        query.put("timeMin", WireTimestamps.rfc3339(dayStart, zone));
        query.put("timeMax", WireTimestamps.rfc3339(dayEnd, zone));
        query.put("singleEvents", "true");
        query.put("orderBy", "startTime");
        query.put("maxResults", String.valueOf(PAGE_SIZE));

        var events = new ArrayList<CalendarEvent>();
        String pageToken = null;
        do {
            if (pageToken != null) {
                query.put("pageToken", pageToken);
            }
            var response = httpClient.get(ProviderHttpClient.uri(eventsUrl(room), query), accessToken, Map.of());
            for (var item : response.path("items")) {
                if ("cancelled".equals(item.path("status").asText())) {
                    continue;
                }
                CalendarEvent event;
                try {
                    event = toEvent(item);
                } catch (ProviderRejectedException e) {
                    log.warn("Skipping unreadable Google Calendar event: {}", e.getMessage());
                    continue;
                }
                // timeMin/timeMax select overlapping events, only those starting on the day count
                if (!event.start().isBefore(dayStart) && event.start().isBefore(dayEnd)) {
                    events.add(event);
                }
            }
            pageToken = textOrNull(response, "nextPageToken");
        } while (pageToken != null);

        log.debug("Google Calendar returned {} event(s) on {} for room {}", events.size(), date, room.getName());
        return events;
    }

    @Override
    public CalendarEvent getEvent(Room room, String eventId) {
        return toEvent(httpClient.get(eventUri(room, eventId), accessToken(), Map.of()));
    }

    @Override
    public CalendarEvent createEvent(Room room, BookingRequest request) {
        var body = JsonNodeFactory.instance.objectNode();
        body.put("summary", request.titleWithBooker());
        body.put("description", request.description());
        body.set("start", WireTimestamps.write(request.start(), zone));
        body.set("end", WireTimestamps.write(request.end(), zone));

        var created = httpClient.post(URI.create(eventsUrl(room)), accessToken(), body);
        return toEvent(created);
    }

    @Override
    public CalendarEvent extendEvent(Room room, String eventId, int minutes) {
        var accessToken = accessToken();
        var eventUri = eventUri(room, eventId);
        var current = httpClient.get(eventUri, accessToken, Map.of());
        var newEnd = WireTimestamps.read(current.path("end"), zone).plusMinutes(minutes);

        var patch = JsonNodeFactory.instance.objectNode();
        patch.set("end", WireTimestamps.write(newEnd, zone));
        return toEvent(httpClient.patch(eventUri, accessToken, patch));
    }

    @Override
    public void endEvent(Room room, String eventId) {
        var patch = JsonNodeFactory.instance.objectNode();
        patch.set("end", WireTimestamps.write(LocalDateTime.now(clock), zone));
        httpClient.patch(eventUri(room, eventId), accessToken(), patch);
    }

    @Override
    public void deleteEvent(Room room, String eventId) {
        httpClient.delete(eventUri(room, eventId), accessToken());
    }

    /**
     * Maps a Google Calendar event resource to a {@link CalendarEvent}.
     */
    CalendarEvent toEvent(JsonNode item) {
        var id = item.path("id").asText("");
        if (id.isBlank()) {
            throw new ProviderRejectedException("Google Calendar event without id: " + item);
        }
        var start = WireTimestamps.read(item.path("start"), zone);
        var end = WireTimestamps.read(item.path("end"), zone);
        if (end.isBefore(start)) {
            throw new ProviderRejectedException("Google Calendar event " + id + " ends before it starts.");
        }
        return new CalendarEvent(
                id,
                item.path("summary").asText(CalendarEvent.UNTITLED),
                start,
                end,
                textOrNull(item.path("organizer"), "email"),
                CalendarProvider.GOOGLE
        );
    }

    private String accessToken() {
        return credentialService.validCredential(CalendarProvider.GOOGLE)
                .map(credential -> credential.getAccessToken())
                .orElseThrow(() -> new ProviderUnavailableException("Google Calendar is not connected."));
    }

    private String eventsUrl(Room room) {
        var calendarId = room.getCalendarId() != null ? room.getCalendarId() : PRIMARY_CALENDAR;
        return apiUrl + "/calendars/" + ProviderHttpClient.encode(calendarId) + "/events";
    }

    private URI eventUri(Room room, String eventId) {
        return URI.create(eventsUrl(room) + "/" + ProviderHttpClient.encode(eventId));
    }

    private static @Nullable String textOrNull(JsonNode node, String field) {
        var value = node.path(field).asText("");
        return value.isBlank() ? null : value;
    }
}
