package de.bycsitsm.credential;

import de.bycsitsm.calendar.CalendarProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hands out usable provider credentials, refreshing expired access tokens.
 * <p>
 * Refresh failures never propagate: a credential that cannot be refreshed is
 * reported as absent, the same as a provider that was never connected.
 * Refreshes of the same provider are serialized, so a rotated refresh token
 * is not used twice.
 */
@Service
public class CredentialService {

    private static final Logger log = LoggerFactory.getLogger(CredentialService.class);

    private final CalendarCredentialRepository credentialRepository;
    private final Map<CalendarProvider, TokenRefresher> refreshers = new EnumMap<>(CalendarProvider.class);
    private final Map<CalendarProvider, ReentrantLock> refreshLocks = new EnumMap<>(CalendarProvider.class);
    private final Clock clock;

    CredentialService(CalendarCredentialRepository credentialRepository, List<TokenRefresher> refreshers, Clock clock) {
        this.credentialRepository = credentialRepository;
        this.clock = clock;
        for (var refresher : refreshers) {
            this.refreshers.put(refresher.provider(), refresher);
        }
        for (var provider : CalendarProvider.values()) {
            refreshLocks.put(provider, new ReentrantLock());
        }
    }

    /**
     * Returns a currently valid credential for the provider.
     *
     * @param provider the calendar provider
     * @return the credential, or empty if the provider is not connected or its
     *         expired token could not be refreshed
     */
    public Optional<CalendarCredential> validCredential(CalendarProvider provider) {
        var stored = credentialRepository.findByProvider(provider);
        if (stored.isEmpty()) {
            log.debug("{} is not connected", provider.displayName());
            return Optional.empty();
        }

        var credential = stored.get();
        if (!credential.isExpired(clock.instant())) {
            return Optional.of(credential);
        }
        if (!credential.hasRefreshToken()) {
            log.warn("{} access token expired and no refresh token is stored", provider.displayName());
            return Optional.empty();
        }
        return refresh(provider);
    }

    private Optional<CalendarCredential> refresh(CalendarProvider provider) {
        var refresher = refreshers.get(provider);
        if (refresher == null) {
            log.warn("No token refresher available for {}", provider.displayName());
            return Optional.empty();
        }

        var lock = refreshLocks.get(provider);
        lock.lock();
        try {
            // Another caller may have refreshed while this one was waiting
            var current = credentialRepository.findByProvider(provider);
            if (current.isEmpty() || !current.get().hasRefreshToken()) {
                return Optional.empty();
            }
            var credential = current.get();
            if (!credential.isExpired(clock.instant())) {
                return Optional.of(credential);
            }

            log.info("Refreshing expired {} access token", provider.displayName());
            RefreshedToken token;
            try {
                token = refresher.refresh(credential.getRefreshToken());
            } catch (RuntimeException e) {
                log.warn("Refreshing {} access token failed: {}", provider.displayName(), e.getMessage());
                return Optional.empty();
            }

            credential.applyRefresh(token, clock.instant());
            return Optional.of(credentialRepository.save(credential));
        } finally {
            lock.unlock();
        }
    }
}
