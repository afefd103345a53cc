package de.bycsitsm.credential;

import de.bycsitsm.calendar.CalendarProvider;

/**
 * Exchanges a refresh token for a new access token at one provider.
 */
public interface TokenRefresher {

    CalendarProvider provider();

    /**
     * @throws de.bycsitsm.calendar.CalendarException if the provider refuses the grant or cannot be reached
     */
    RefreshedToken refresh(String refreshToken);
}
