package de.bycsitsm.credential;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.bycsitsm.calendar.ProviderHttpClient;
import de.bycsitsm.calendar.ProviderRejectedException;
import de.bycsitsm.calendar.ProviderUnavailableException;

import java.net.URI;
import java.util.LinkedHashMap;

/**
 * {@link TokenRefresher} for OAuth 2.0 token endpoints that accept the
 * {@code refresh_token} grant with client id and secret in the form body.
 */
public abstract class OAuthTokenRefresher implements TokenRefresher {

    static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    private final ProviderHttpClient httpClient;

    protected OAuthTokenRefresher(String serviceName, ObjectMapper objectMapper) {
        this.httpClient = new ProviderHttpClient(serviceName, objectMapper);
    }

    protected abstract String tokenUrl();

    protected abstract String clientId();

    protected abstract String clientSecret();

    /**
     * The scopes to request, space separated, or an empty string to omit them.
     */
    protected abstract String scopes();

    @Override
    public RefreshedToken refresh(String refreshToken) {
        if (clientId().isBlank() || clientSecret().isBlank()) {
            throw new ProviderUnavailableException(provider().displayName() + " OAuth client is not configured.");
        }

        var form = new LinkedHashMap<String, String>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        form.put("client_id", clientId());
        form.put("client_secret", clientSecret());
        if (!scopes().isBlank()) {
            form.put("scope", scopes());
        }

        var response = httpClient.postForm(URI.create(tokenUrl()), form);
        if (response.hasNonNull("error")) {
            throw new ProviderRejectedException("Token refresh was refused: " + response.path("error").asText());
        }
        var accessToken = response.path("access_token").asText("");
        if (accessToken.isBlank()) {
            throw new ProviderRejectedException("Token response contains no access token.");
        }
        return new RefreshedToken(
                accessToken,
                response.hasNonNull("refresh_token") ? response.get("refresh_token").asText() : null,
                response.path("expires_in").asLong(DEFAULT_EXPIRES_IN_SECONDS),
                response.hasNonNull("scope") ? response.get("scope").asText() : null
        );
    }
}
