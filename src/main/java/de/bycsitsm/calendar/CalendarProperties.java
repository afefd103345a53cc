package de.bycsitsm.calendar;

import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;

/**
 * Configuration properties for the room calendars.
 *
 * @param zone                 the zone all event timestamps are expressed in,
 *                             the system default zone if blank
 * @param recurringDefaultDays the length of a recurring range when no end date is given
 * @param google               Google Calendar settings
 * @param microsoft            Microsoft Graph calendar settings
 */
@ConfigurationProperties(prefix = "calendar")
public record CalendarProperties(
        @Nullable String zone,
        int recurringDefaultDays,
        Google google,
        Microsoft microsoft
) {

    public CalendarProperties {
        if (zone == null) {
            zone = "";
        }
        if (recurringDefaultDays <= 0) {
            recurringDefaultDays = 90;
        }
        if (google == null) {
            google = new Google(null, null, null, null);
        }
        if (microsoft == null) {
            microsoft = new Microsoft(null, null, null, null, null);
        }
    }

    public ZoneId zoneId() {
        return zone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(zone);
    }

    /**
     * @param clientId     the OAuth client id
     * @param clientSecret the OAuth client secret
     * @param apiUrl       the base URL of the Calendar v3 API
     * @param tokenUrl     the OAuth token endpoint
     */
    public record Google(
            @Nullable String clientId,
            @Nullable String clientSecret,
            @Nullable String apiUrl,
            @Nullable String tokenUrl
    ) {

        public Google {
            if (clientId == null) {
                clientId = "";
            }
            if (clientSecret == null) {
                clientSecret = "";
            }
            if (apiUrl == null || apiUrl.isBlank()) {
                apiUrl = "https://www.googleapis.com/calendar/v3";
            }
            if (tokenUrl == null || tokenUrl.isBlank()) {
                tokenUrl = "https://oauth2.googleapis.com/token";
            }
        }
    }

    /**
     * @param clientId     the application (client) id
     * @param clientSecret the client secret
     * @param tenantId     the directory tenant, {@code common} for multi-tenant apps
     * @param apiUrl       the base URL of Microsoft Graph
     * @param tokenUrl     the OAuth token endpoint, derived from the tenant if blank
     */
    public record Microsoft(
            @Nullable String clientId,
            @Nullable String clientSecret,
            @Nullable String tenantId,
            @Nullable String apiUrl,
            @Nullable String tokenUrl
    ) {

        public Microsoft {
            if (clientId == null) {
                clientId = "";
            }
            if (clientSecret == null) {
                clientSecret = "";
            }
            if (tenantId == null || tenantId.isBlank()) {
                tenantId = "common";
            }
            if (apiUrl == null || apiUrl.isBlank()) {
                apiUrl = "https://graph.microsoft.com/v1.0";
            }
            if (tokenUrl == null || tokenUrl.isBlank()) {
                tokenUrl = "https://login.microsoftonline.com/" + tenantId + "/oauth2/v2.0/token";
            }
        }
    }
}
