package de.bycsitsm.calendar.microsoft;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.bycsitsm.calendar.CalendarProperties;
import de.bycsitsm.calendar.CalendarProvider;
import de.bycsitsm.credential.OAuthTokenRefresher;
import org.springframework.stereotype.Component;

/**
 * Refreshes Microsoft identity platform access tokens. Microsoft rotates the
 * refresh token on every refresh.
 */
@Component
class MicrosoftTokenRefresher extends OAuthTokenRefresher {

    static final String SCOPES = "offline_access https://graph.microsoft.com/Calendars.ReadWrite "
            + "https://graph.microsoft.com/User.Read";

    private final CalendarProperties.Microsoft microsoft;

    MicrosoftTokenRefresher(CalendarProperties properties, ObjectMapper objectMapper) {
        super("Microsoft identity platform", objectMapper);
        this.microsoft = properties.microsoft();
    }

    @Override
    public CalendarProvider provider() {
        return CalendarProvider.MICROSOFT;
    }

    @Override
    protected String tokenUrl() {
        return microsoft.tokenUrl();
    }

    @Override
    protected String clientId() {
        return microsoft.clientId();
    }

    @Override
    protected String clientSecret() {
        return microsoft.clientSecret();
    }

    @Override
    protected String scopes() {
        return SCOPES;
    }
}
