package de.bycsitsm.credential;

import org.jspecify.annotations.Nullable;

/**
 * Result of a successful refresh-token grant.
 *
 * @param accessToken      the new access token
 * @param refreshToken     the rotated refresh token, or {@code null} if the old one stays valid
 * @param expiresInSeconds lifetime of the access token
 * @param scope            the granted scopes, space separated, or {@code null} if unchanged
 */
public record RefreshedToken(
        String accessToken,
        @Nullable String refreshToken,
        long expiresInSeconds,
        @Nullable String scope
) {
}
