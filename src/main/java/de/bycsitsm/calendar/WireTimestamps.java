package de.bycsitsm.calendar;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Conversion between the {@code {dateTime, date, timeZone}} objects used by
 * calendar provider APIs and wall-clock timestamps in the calendar zone.
 */
public final class WireTimestamps {

    private WireTimestamps() {
    }

    /**
     * Reads a provider timestamp object into the given zone.
     * <ul>
     *   <li>{@code dateTime} with an offset is converted to the zone.</li>
     *   <li>{@code dateTime} without offset is read in its {@code timeZone}, or in
     *       the target zone if that is missing or not a known zone id.</li>
     *   <li>{@code date} alone (all-day events) is midnight of that date.</li>
     * </ul>
     *
     * @throws ProviderRejectedException if the object holds no readable timestamp
     */
    public static LocalDateTime read(JsonNode node, ZoneId zone) {
        var dateTime = node.path("dateTime").asText("");
        var date = node.path("date").asText("");
        try {
            if (!dateTime.isBlank()) {
                var parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(dateTime,
                        OffsetDateTime::from, LocalDateTime::from);
                if (parsed instanceof OffsetDateTime offsetDateTime) {
                    return offsetDateTime.atZoneSameInstant(zone).toLocalDateTime();
                }
                var sourceZone = zoneOrDefault(node.path("timeZone").asText(""), zone);
                return ((LocalDateTime) parsed).atZone(sourceZone)
                        .withZoneSameInstant(zone)
                        .toLocalDateTime();
            }
            if (!date.isBlank()) {
                return LocalDate.parse(date).atStartOfDay();
            }
        } catch (DateTimeException e) {
            throw new ProviderRejectedException("Unreadable event timestamp: " + node, e);
        }
        throw new ProviderRejectedException("Event timestamp is missing: " + node);
    }

    /**
     * Writes a timestamp as a {@code {dateTime, timeZone}} object.
     */
    public static ObjectNode write(LocalDateTime timestamp, ZoneId zone) {
        var node = JsonNodeFactory.instance.objectNode();
        node.put("dateTime", timestamp.truncatedTo(ChronoUnit.SECONDS).format(DateTimeFormatter.ISO_LOCAL_DATE_TIME));
        node.put("timeZone", zone.getId());
        return node;
    }

    /**
     * Formats the start of a timestamp's instant as RFC 3339 with the zone's offset.
     */
    public static String rfc3339(LocalDateTime timestamp, ZoneId zone) {
        return timestamp.atZone(zone).toOffsetDateTime().format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    private static ZoneId zoneOrDefault(String zoneId, ZoneId fallback) {
        if (zoneId.isBlank()) {
            return fallback;
        }
        try {
            return ZoneId.of(zoneId);
        } catch (DateTimeException e) {
            // Windows zone names such as "W. Europe Standard Time" are not zone ids
            return fallback;
        }
    }
}
