package de.bycsitsm.calendar.google;

import com.fasterxml.jackson.databind.ObjectMapper;
import de.bycsitsm.calendar.CalendarProperties;
import de.bycsitsm.calendar.ProviderUnavailableException;
import de.bycsitsm.support.StubHttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoogleTokenRefresherTest {

    private StubHttpServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = StubHttpServer.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private GoogleTokenRefresher refresher(String clientSecret) {
        var properties = new CalendarProperties(null, 90,
                new CalendarProperties.Google("client", clientSecret, null, server.baseUrl() + "/token"), null);
        return new GoogleTokenRefresher(properties, new ObjectMapper());
    }

    @Test
    void refresh_posts_grant_without_scope() {
        server.respond("POST", "/token", 200, """
                {"access_token": "ya29.fresh", "expires_in": 3599, "token_type": "Bearer",
                 "scope": "https://www.googleapis.com/auth/calendar"}
                """);

        var token = refresher("secret").refresh("1//refresh");

        assertThat(token.accessToken()).isEqualTo("ya29.fresh");
        assertThat(token.expiresInSeconds()).isEqualTo(3599);
        assertThat(token.scope()).isEqualTo("https://www.googleapis.com/auth/calendar");

        var body = URLDecoder.decode(server.lastRequest().body(), StandardCharsets.UTF_8);
        assertThat(body)
                .contains("grant_type=refresh_token")
                .contains("refresh_token=1//refresh")
                .contains("client_id=client")
                .contains("client_secret=secret")
                .doesNotContain("scope=");
    }

    @Test
    void refresh_without_rotation_leaves_refresh_token_out() {
        server.respond("POST", "/token", 200, "{\"access_token\": \"ya29.fresh\", \"expires_in\": 3599}");

        var token = refresher("secret").refresh("1//refresh");

        assertThat(token.refreshToken()).isNull();
    }

    @Test
    void missing_client_secret_fails_without_request() {
        assertThatThrownBy(() -> refresher("").refresh("1//refresh"))
                .isInstanceOf(ProviderUnavailableException.class);
        assertThat(server.requests()).isEmpty();
    }
}
