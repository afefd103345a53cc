package de.bycsitsm.credential;

import de.bycsitsm.calendar.CalendarProvider;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * OAuth credential of one calendar provider. Created when the provider is
 * connected; afterwards only {@link CredentialService} mutates it.
 */
@Entity
@Table(name = "calendar_credential")
public class CalendarCredential {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "provider", nullable = false, unique = true, length = 16)
    private CalendarProvider provider;

    @Column(name = "access_token", nullable = false, columnDefinition = "TEXT")
    private String accessToken;

    @Column(name = "refresh_token", columnDefinition = "TEXT")
    private @Nullable String refreshToken;

    @Column(name = "token_type", length = 50)
    private String tokenType = "Bearer";

    @Column(name = "expires_at")
    private @Nullable Instant expiresAt;

    @Column(name = "scope", columnDefinition = "TEXT")
    private @Nullable String scope;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    protected CalendarCredential() {
    }

    public CalendarCredential(CalendarProvider provider, String accessToken, @Nullable String refreshToken,
                              @Nullable Instant expiresAt, @Nullable String scope) {
        this.provider = provider;
        this.accessToken = accessToken;
        this.refreshToken = refreshToken;
        this.expiresAt = expiresAt;
        this.scope = scope;
    }

    public Long getId() {
        return id;
    }

    public CalendarProvider getProvider() {
        return provider;
    }

    public String getAccessToken() {
        return accessToken;
    }

    public @Nullable String getRefreshToken() {
        return refreshToken;
    }

    public String getTokenType() {
        return tokenType;
    }

    public @Nullable Instant getExpiresAt() {
        return expiresAt;
    }

    public Set<String> getScopes() {
        if (scope == null || scope.isBlank()) {
            return Set.of();
        }
        return new LinkedHashSet<>(Arrays.asList(scope.strip().split("\\s+")));
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    /**
     * A credential without expiry never expires.
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }

    /**
     * Applies the result of a token refresh. The refresh token is only replaced
     * if the provider rotated it.
     */
    void applyRefresh(RefreshedToken token, Instant now) {
        this.accessToken = token.accessToken();
        if (token.refreshToken() != null && !token.refreshToken().isBlank()) {
            this.refreshToken = token.refreshToken();
        }
        if (token.scope() != null && !token.scope().isBlank()) {
            this.scope = token.scope();
        }
        this.expiresAt = now.plusSeconds(token.expiresInSeconds());
        this.updatedAt = now;
    }
}
