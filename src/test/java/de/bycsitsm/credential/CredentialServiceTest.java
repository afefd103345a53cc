package de.bycsitsm.credential;

import de.bycsitsm.calendar.CalendarProvider;
import de.bycsitsm.calendar.ProviderRejectedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CredentialServiceTest {

    private static final Instant NOW = Instant.parse("2024-01-10T10:00:00Z");

    @Mock
    private CalendarCredentialRepository credentialRepository;

    @Mock
    private TokenRefresher microsoftRefresher;

    private CredentialService credentialService;

    @BeforeEach
    void setUp() {
        lenient().when(microsoftRefresher.provider()).thenReturn(CalendarProvider.MICROSOFT);
        lenient().when(credentialRepository.save(any(CalendarCredential.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        credentialService = new CredentialService(credentialRepository, List.of(microsoftRefresher),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void missing_credential_means_not_connected() {
        when(credentialRepository.findByProvider(CalendarProvider.MICROSOFT)).thenReturn(Optional.empty());

        assertThat(credentialService.validCredential(CalendarProvider.MICROSOFT)).isEmpty();
    }

    @Test
    void unexpired_credential_is_returned_without_refresh() {
        var credential = new CalendarCredential(CalendarProvider.MICROSOFT, "access", "refresh",
                NOW.plusSeconds(60), null);
        when(credentialRepository.findByProvider(CalendarProvider.MICROSOFT)).thenReturn(Optional.of(credential));

        assertThat(credentialService.validCredential(CalendarProvider.MICROSOFT)).contains(credential);
        verify(microsoftRefresher, never()).refresh(anyString());
    }

    @Test
    void credential_without_expiry_never_expires() {
        var credential = new CalendarCredential(CalendarProvider.MICROSOFT, "access", null, null, null);
        when(credentialRepository.findByProvider(CalendarProvider.MICROSOFT)).thenReturn(Optional.of(credential));

        assertThat(credentialService.validCredential(CalendarProvider.MICROSOFT)).contains(credential);
    }

    @Test
    void expired_credential_without_refresh_token_is_unusable_and_not_refreshed() {
        var credential = new CalendarCredential(CalendarProvider.MICROSOFT, "stale", "", NOW.minusSeconds(1), null);
        when(credentialRepository.findByProvider(CalendarProvider.MICROSOFT)).thenReturn(Optional.of(credential));

        assertThat(credentialService.validCredential(CalendarProvider.MICROSOFT)).isEmpty();
        verify(microsoftRefresher, never()).refresh(anyString());
        verify(credentialRepository, never()).save(any());
    }

    @Test
    void credential_expiring_exactly_now_is_expired() {
        var credential = new CalendarCredential(CalendarProvider.MICROSOFT, "stale", null, NOW, null);
        when(credentialRepository.findByProvider(CalendarProvider.MICROSOFT)).thenReturn(Optional.of(credential));

        assertThat(credentialService.validCredential(CalendarProvider.MICROSOFT)).isEmpty();
    }

    @Test
    void expired_credential_is_refreshed_and_stored() {
        var credential = new CalendarCredential(CalendarProvider.MICROSOFT, "stale", "refresh-1",
                NOW.minusSeconds(10), "Calendars.ReadWrite");
        when(credentialRepository.findByProvider(CalendarProvider.MICROSOFT)).thenReturn(Optional.of(credential));
        when(microsoftRefresher.refresh("refresh-1"))
                .thenReturn(new RefreshedToken("fresh", "refresh-2", 3600, null));

        var result = credentialService.validCredential(CalendarProvider.MICROSOFT);

        assertThat(result).isPresent();
        assertThat(result.get().getAccessToken()).isEqualTo("fresh");
        assertThat(result.get().getRefreshToken()).isEqualTo("refresh-2");
        assertThat(result.get().getExpiresAt()).isEqualTo(NOW.plusSeconds(3600));
        assertThat(result.get().getScopes()).containsExactly("Calendars.ReadWrite");
        verify(credentialRepository).save(credential);
    }

    @Test
    void refresh_keeps_refresh_token_when_provider_does_not_rotate_it() {
        var credential = new CalendarCredential(CalendarProvider.MICROSOFT, "stale", "refresh-1",
                NOW.minusSeconds(10), null);
        when(credentialRepository.findByProvider(CalendarProvider.MICROSOFT)).thenReturn(Optional.of(credential));
        when(microsoftRefresher.refresh("refresh-1")).thenReturn(new RefreshedToken("fresh", null, 1800, null));

        var result = credentialService.validCredential(CalendarProvider.MICROSOFT);

        assertThat(result).map(CalendarCredential::getRefreshToken).contains("refresh-1");
        assertThat(result).map(CalendarCredential::getExpiresAt).contains(NOW.plusSeconds(1800));
    }

    @Test
    void failed_refresh_means_not_connected() {
        var credential = new CalendarCredential(CalendarProvider.MICROSOFT, "stale", "revoked",
                NOW.minusSeconds(10), null);
        when(credentialRepository.findByProvider(CalendarProvider.MICROSOFT)).thenReturn(Optional.of(credential));
        when(microsoftRefresher.refresh("revoked"))
                .thenThrow(new ProviderRejectedException("Token refresh was refused: invalid_grant"));

        assertThat(credentialService.validCredential(CalendarProvider.MICROSOFT)).isEmpty();
        verify(credentialRepository, never()).save(any());
    }

    @Test
    void expired_credential_without_refresher_is_unusable() {
        var credential = new CalendarCredential(CalendarProvider.GOOGLE, "stale", "refresh",
                NOW.minusSeconds(10), null);
        when(credentialRepository.findByProvider(CalendarProvider.GOOGLE)).thenReturn(Optional.of(credential));

        assertThat(credentialService.validCredential(CalendarProvider.GOOGLE)).isEmpty();
    }

    @Test
    void concurrent_callers_share_one_refresh() throws Exception {
        var credential = new CalendarCredential(CalendarProvider.MICROSOFT, "stale", "refresh",
                NOW.minusSeconds(1), null);
        when(credentialRepository.findByProvider(CalendarProvider.MICROSOFT)).thenReturn(Optional.of(credential));

        var refreshStarted = new CountDownLatch(1);
        var releaseRefresh = new CountDownLatch(1);
        var refreshCalls = new AtomicInteger();
        var blockingRefresher = new TokenRefresher() {
            @Override
            public CalendarProvider provider() {
                return CalendarProvider.MICROSOFT;
            }

            @Override
            public RefreshedToken refresh(String refreshToken) {
                refreshCalls.incrementAndGet();
                refreshStarted.countDown();
                try {
                    releaseRefresh.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException(e);
                }
                return new RefreshedToken("fresh", "rotated", 3600, null);
            }
        };
        var service = new CredentialService(credentialRepository, List.of(blockingRefresher),
                Clock.fixed(NOW, ZoneOffset.UTC));

        FutureTask<Optional<CalendarCredential>> first =
                new FutureTask<>(() -> service.validCredential(CalendarProvider.MICROSOFT));
        FutureTask<Optional<CalendarCredential>> second =
                new FutureTask<>(() -> service.validCredential(CalendarProvider.MICROSOFT));

        new Thread(first).start();
        assertThat(refreshStarted.await(5, TimeUnit.SECONDS)).isTrue();
        var secondThread = new Thread(second);
        secondThread.start();
        awaitParked(secondThread);
        releaseRefresh.countDown();

        assertThat(first.get(5, TimeUnit.SECONDS)).map(CalendarCredential::getAccessToken).contains("fresh");
        assertThat(second.get(5, TimeUnit.SECONDS)).map(CalendarCredential::getAccessToken).contains("fresh");
        assertThat(refreshCalls).hasValue(1);
        assertThat(credential.getRefreshToken()).isEqualTo("rotated");
    }

    private static void awaitParked(Thread thread) throws InterruptedException {
        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (thread.getState() != Thread.State.WAITING && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        assertThat(thread.getState()).isEqualTo(Thread.State.WAITING);
    }
}
