package de.bycsitsm.calendar.microsoft;

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
 * {@link CalendarAdapter} for Outlook calendars through Microsoft Graph.
 * <p>
 * Lists use the {@code calendarView} endpoint, which expands recurring series
 * into occurrences. Times are requested in the calendar zone through the
 * {@code Prefer: outlook.timezone} header.
 */
@Component
class MicrosoftCalendarAdapter implements CalendarAdapter {

    private static final Logger log = LoggerFactory.getLogger(MicrosoftCalendarAdapter.class);

    private static final int PAGE_SIZE = 250;

    private final CredentialService credentialService;
    private final ProviderHttpClient httpClient;
    private final String apiUrl;
    private final Clock clock;
    private final ZoneId zone;

    MicrosoftCalendarAdapter(CredentialService credentialService, CalendarProperties properties,
                             ObjectMapper objectMapper, Clock clock) {
        this.credentialService = credentialService;
        this.httpClient = new ProviderHttpClient(CalendarProvider.MICROSOFT.displayName(), objectMapper);
        this.apiUrl = properties.microsoft().apiUrl().replaceAll("/+$", "");
        this.clock = clock;
        this.zone = clock.getZone();
    }

    @Override
    public CalendarProvider provider() {
        return CalendarProvider.MICROSOFT;
    }

    @Override
    public List<CalendarEvent> listEvents(Room room, LocalDate date) {
        var accessToken = accessToken();
        var dayStart = date.atStartOfDay();
        var dayEnd = date.plusDays(1).atStartOfDay();

        var query = new LinkedHashMap<String, String>();
        query.put("startDateTime", WireTimestamps.rfc3339(dayStart, zone));
        query.put("endDateTime", WireTimestamps.rfc3339(dayEnd, zone));
        query.put("$orderby", "start/dateTime");
        query.put("$top", String.valueOf(PAGE_SIZE));
        var headers = Map.of("Prefer", "outlook.timezone=\"" + zone.getId() + "\"");

        var events = new ArrayList<CalendarEvent>();
        var pageUri = ProviderHttpClient.uri(calendarUrl(room) + "/calendarView", query);
        while (pageUri != null) {
            var response = httpClient.get(pageUri, accessToken, headers);
            for (var item : response.path("value")) {
                if (item.path("isCancelled").asBoolean(false)) {
                    continue;
                }
                CalendarEvent event;
                try {
                    event = toEvent(item);
                } catch (ProviderRejectedException e) {
                    log.warn("Skipping unreadable Microsoft Graph event: {}", e.getMessage());
                    continue;
                }
                // calendarView returns every occurrence overlapping the window
                if (!event.start().isBefore(dayStart) && event.start().isBefore(dayEnd)) {
                    events.add(event);
                }
            }
            var nextLink = response.path("@odata.nextLink").asText("");
            pageUri = nextLink.isBlank() ? null : URI.create(nextLink);
        }

        log.debug("Microsoft Graph returned {} event(s) on {} for room {}", events.size(), date, room.getName());
        return events;
    }

    @Override
    public CalendarEvent getEvent(Room room, String eventId) {
        return toEvent(httpClient.get(eventUri(room, eventId), accessToken(), Map.of()));
    }

    @Override
    public CalendarEvent createEvent(Room room, BookingRequest request) {
        var body = JsonNodeFactory.instance.objectNode();
        body.put("subject", request.titleWithBooker());
        body.putObject("body")
                .put("contentType", "text")
                .put("content", request.description());
        body.set("start", WireTimestamps.write(request.start(), zone));
        body.set("end", WireTimestamps.write(request.end(), zone));

        var created = httpClient.post(URI.create(calendarUrl(room) + "/events"), accessToken(), body);
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
     * Maps a Microsoft Graph event resource to a {@link CalendarEvent}.
     */
    CalendarEvent toEvent(JsonNode item) {
        var id = item.path("id").asText("");
        if (id.isBlank()) {
            throw new ProviderRejectedException("Microsoft Graph event without id: " + item);
        }
        var start = WireTimestamps.read(item.path("start"), zone);
        var end = WireTimestamps.read(item.path("end"), zone);
        if (end.isBefore(start)) {
            throw new ProviderRejectedException("Microsoft Graph event " + id + " ends before it starts.");
        }
        var organizer = item.path("organizer").path("emailAddress").path("address").asText("");
        return new CalendarEvent(
                id,
                item.path("subject").asText(CalendarEvent.UNTITLED),
                start,
                end,
                organizer.isBlank() ? null : organizer,
                CalendarProvider.MICROSOFT
        );
    }

    private String accessToken() {
        return credentialService.validCredential(CalendarProvider.MICROSOFT)
                .map(credential -> credential.getAccessToken())
                .orElseThrow(() -> new ProviderUnavailableException("Microsoft Calendar is not connected."));
    }

    private String calendarUrl(Room room) {
        if (room.getCalendarId() != null) {
            return apiUrl + "/me/calendars/" + ProviderHttpClient.encode(room.getCalendarId());
        }
        return apiUrl + "/me/calendar";
    }

    private URI eventUri(Room room, String eventId) {
        return URI.create(calendarUrl(room) + "/events/" + ProviderHttpClient.encode(eventId));
    }
}
