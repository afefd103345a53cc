package de.bycsitsm.calendar.google;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.bycsitsm.calendar.CalendarProperties;
import de.bycsitsm.calendar.CalendarProvider;
import de.bycsitsm.credential.OAuthTokenRefresher;
import org.springframework.stereotype.Component;

/**
 * Refreshes Google OAuth access tokens. Google keeps the refresh token
 * unchanged unless it is revoked.
 */
@Component
class GoogleTokenRefresher extends OAuthTokenRefresher {

    private final CalendarProperties.Google google;

    GoogleTokenRefresher(CalendarProperties properties, ObjectMapper objectMapper) {
        super("Google OAuth", objectMapper);
        this.google = properties.google();
    }

    @Override
    public CalendarProvider provider() {
        return CalendarProvider.GOOGLE;
    }

    @Override
    protected String tokenUrl() {
        return google.tokenUrl();
    }

    @Override
    protected String clientId() {
        return google.clientId();
    }

    @Override
    protected String clientSecret() {
        return google.clientSecret();
    }

    @Override
    protected String scopes() {
        // the refresh grant keeps the scopes of the original consent
        return "";
    }
}
