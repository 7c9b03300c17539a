package com.walkerbrain.portal.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.walkerbrain.portal.global.security.SessionAuthenticationPrincipal;
import com.walkerbrain.portal.modules.auth.application.SessionException;
import com.walkerbrain.portal.modules.auth.application.SessionService;
import com.walkerbrain.portal.modules.auth.application.SessionTokenGenerator;
import com.walkerbrain.portal.modules.auth.domain.AppUser;
import com.walkerbrain.portal.modules.auth.domain.UserSession;
import com.walkerbrain.portal.modules.auth.infrastructure.persistence.AppUserRepository;
import com.walkerbrain.portal.modules.auth.infrastructure.persistence.UserSessionRepository;
import com.walkerbrain.portal.support.MutableClock;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

class SessionServiceTest {

    private static final UUID USER_ID = UUID.fromString("7f1c2a4e-0000-4000-8000-000000000001");

    private final Map<String, UserSession> rows = new ConcurrentHashMap<>();
    private UserSessionRepository sessionRepository;
    private MutableClock clock;
    private SessionTokenGenerator tokenGenerator;
    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        AppUser user = new AppUser();
        ReflectionTestUtils.setField(user, "id", USER_ID);
        user.setEmail("analyst@walkeradvertising.com");
        user.setDisplayName("Analyst");
        user.setAdmin(true);

        AppUserRepository userRepository = mock(AppUserRepository.class);
        when(userRepository.getReferenceById(USER_ID)).thenReturn(user);

        sessionRepository = mock(UserSessionRepository.class);
        when(sessionRepository.save(any(UserSession.class))).thenAnswer(invocation -> {
            UserSession session = invocation.getArgument(0);
            rows.put(session.getTokenHash(), session);
            return session;
        });
        when(sessionRepository.findByTokenHash(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(rows.get(invocation.<String>getArgument(0))));
        when(sessionRepository.deleteByTokenHash(anyString()))
                .thenAnswer(invocation -> rows.remove(invocation.<String>getArgument(0)) != null ? 1 : 0);

        clock = MutableClock.at("2025-03-01T09:00:00Z");
        tokenGenerator = new SessionTokenGenerator(32);
        sessionService = new SessionService(sessionRepository, userRepository, tokenGenerator, clock, Duration.ofDays(7));
    }

    @Test
    void issuedTokenIsUrlSafeAndOnlyItsDigestIsStored() {
        SessionService.IssuedSession issued = sessionService.create(USER_ID, "Analyst");

        assertThat(issued.token()).hasSize(43).matches("[A-Za-z0-9_-]+");
        assertThat(issued.expiresAt()).isEqualTo(issued.issuedAt().plusDays(7));
        assertThat(rows).containsOnlyKeys(tokenGenerator.hash(issued.token()));
        assertThat(rows).doesNotContainKey(issued.token());
    }

    @Test
    void tokensAreUniqueAcrossIssues() {
        String first = sessionService.create(USER_ID, "Analyst").token();
        String second = sessionService.create(USER_ID, "Analyst").token();

        assertThat(first).isNotEqualTo(second);
        assertThat(rows).hasSize(2);
    }

    @Test
    void sessionIsValidJustBeforeTtlElapses() {
        String token = sessionService.create(USER_ID, "Analyst").token();
        clock.advance(Duration.ofDays(6).plusHours(23));

        Optional<SessionAuthenticationPrincipal> principal = sessionService.validate(token);

        assertThat(principal).isPresent();
        assertThat(principal.get().userId()).isEqualTo(USER_ID);
        assertThat(principal.get().email()).isEqualTo("analyst@walkeradvertising.com");
        assertThat(principal.get().admin()).isTrue();
    }

    @Test
    void expiredSessionIsRejectedAndRemoved() {
        String token = sessionService.create(USER_ID, "Analyst").token();
        clock.advance(Duration.ofDays(7).plusHours(1));

        assertThat(sessionService.validate(token)).isEmpty();
        assertThat(rows).isEmpty();
    }

    @Test
    void requireValidReportsExpiryBeforeTheRowIsGone() {
        String token = sessionService.create(USER_ID, "Analyst").token();
        clock.advance(Duration.ofDays(7));

        assertThatThrownBy(() -> sessionService.requireValid(token))
                .isInstanceOfSatisfying(SessionException.class,
                        e -> assertThat(e.getReasonCode()).isEqualTo(SessionException.Reason.EXPIRED));
        assertThatThrownBy(() -> sessionService.requireValid(token))
                .isInstanceOfSatisfying(SessionException.class,
                        e -> assertThat(e.getReasonCode()).isEqualTo(SessionException.Reason.NOT_FOUND));
    }

    @Test
    void deletedSessionNoLongerValidatesAndSecondDeleteIsHarmless() {
        String token = sessionService.create(USER_ID, "Analyst").token();

        sessionService.delete(token);
        sessionService.delete(token);

        assertThat(sessionService.validate(token)).isEmpty();
    }

    @Test
    void malformedTokenIsRejectedWithoutTouchingTheStore() {
        assertThatThrownBy(() -> sessionService.requireValid("short"))
                .isInstanceOfSatisfying(SessionException.class,
                        e -> assertThat(e.getReasonCode()).isEqualTo(SessionException.Reason.NOT_FOUND));
        assertThat(sessionService.validate(null)).isEmpty();
        assertThat(sessionService.validate("a".repeat(42) + "!")).isEmpty();

        sessionService.delete("short");

        verify(sessionRepository, never()).findByTokenHash(anyString());
        verify(sessionRepository, never()).deleteByTokenHash(anyString());
    }

    @Test
    void unknownWellFormedTokenIsNotFound() {
        String stranger = tokenGenerator.generate();

        assertThat(sessionService.validate(stranger)).isEmpty();
    }

    @Test
    void nonPositiveTtlIsRejected() {
        assertThatThrownBy(() -> new SessionService(sessionRepository, mock(AppUserRepository.class), tokenGenerator,
                clock, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void generatorRejectsShortTokenBudgets() {
        assertThatThrownBy(() -> new SessionTokenGenerator(16))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new SessionTokenGenerator(48).tokenLength()).isEqualTo(64);
    }

    @Test
    void validateRacingDeleteNeverFails() throws Exception {
        String token = sessionService.create(USER_ID, "Analyst").token();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(9);
        try {
            List<Future<Optional<SessionAuthenticationPrincipal>>> validations = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                validations.add(pool.submit(() -> {
                    start.await();
                    return sessionService.validate(token);
                }));
            }
            Future<?> deletion = pool.submit(() -> {
                start.await();
                sessionService.delete(token);
                return null;
            });
            start.countDown();

            deletion.get(2, TimeUnit.SECONDS);
            for (Future<Optional<SessionAuthenticationPrincipal>> validation : validations) {
                Optional<SessionAuthenticationPrincipal> principal = validation.get(2, TimeUnit.SECONDS);
                principal.ifPresent(p -> assertThat(p.email()).isEqualTo("analyst@walkeradvertising.com"));
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(sessionService.validate(token)).isEmpty();
    }

    @Test
    void expiredRowDeletedByAnotherCallerStillReportsExpired() {
        String token = sessionService.create(USER_ID, "Analyst").token();
        String hash = tokenGenerator.hash(token);
        UserSession row = rows.get(hash);
        // the concurrent delete lands after our lookup
        when(sessionRepository.findByTokenHash(hash)).thenAnswer(invocation -> {
            rows.remove(hash);
            return Optional.of(row);
        });
        clock.advance(Duration.ofDays(8));

        assertThatThrownBy(() -> sessionService.requireValid(token))
                .isInstanceOfSatisfying(SessionException.class,
                        e -> assertThat(e.getReasonCode()).isEqualTo(SessionException.Reason.EXPIRED));
        assertThat(rows).isEmpty();
    }
}
