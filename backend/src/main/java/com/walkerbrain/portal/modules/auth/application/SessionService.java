package com.walkerbrain.portal.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;

import com.walkerbrain.portal.global.security.SessionAuthenticationPrincipal;
import com.walkerbrain.portal.global.security.SessionTokenResolver;
import com.walkerbrain.portal.modules.auth.domain.AppUser;
import com.walkerbrain.portal.modules.auth.domain.UserSession;
import com.walkerbrain.portal.modules.auth.infrastructure.persistence.AppUserRepository;
import com.walkerbrain.portal.modules.auth.infrastructure.persistence.UserSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Session lifecycle. Every operation is a single-row statement, so a validate racing a delete on the
 * same token ends in "not found" rather than an error.
 */
@Service
@Transactional(noRollbackFor = SessionException.class)
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final UserSessionRepository userSessionRepository;
    private final AppUserRepository appUserRepository;
    private final SessionTokenGenerator tokenGenerator;
    private final Clock clock;
    private final Duration ttl;

    public SessionService(
            UserSessionRepository userSessionRepository,
            AppUserRepository appUserRepository,
            SessionTokenGenerator tokenGenerator,
            Clock clock,
            @Value("${app.session.ttl:P7D}") Duration ttl
    ) {
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("session ttl must be positive");
        }
        this.userSessionRepository = userSessionRepository;
        this.appUserRepository = appUserRepository;
        this.tokenGenerator = tokenGenerator;
        this.clock = clock;
        this.ttl = ttl;
    }

    public IssuedSession create(UUID userId, String displayName) {
        AppUser user = appUserRepository.getReferenceById(userId);
        OffsetDateTime now = OffsetDateTime.now(clock);
        String token = tokenGenerator.generate();

        UserSession session = new UserSession();
        session.setUser(user);
        session.setTokenHash(tokenGenerator.hash(token));
        session.setDisplayName(displayName);
        session.setIssuedAt(now);
        session.setExpiresAt(now.plus(ttl));
        userSessionRepository.save(session);

        log.info("Issued session {} for user {} (expires {})", SessionTokenResolver.mask(token), userId, session.getExpiresAt());
        return new IssuedSession(token, session.getIssuedAt(), session.getExpiresAt());
    }

    public Optional<SessionAuthenticationPrincipal> validate(String token) {
        try {
            return Optional.of(requireValid(token));
        } catch (SessionException e) {
            log.debug("Session {} rejected: {}", SessionTokenResolver.mask(token), e.getReasonCode());
            return Optional.empty();
        }
    }

    /**
     * Like {@link #validate(String)} but reports why the token was refused. An expired row is removed on
     * this path.
     */
    public SessionAuthenticationPrincipal requireValid(String token) {
        if (!tokenGenerator.isWellFormed(token)) {
            throw new SessionException(SessionException.Reason.NOT_FOUND);
        }
        String tokenHash = tokenGenerator.hash(token);
        UserSession session = userSessionRepository.findByTokenHash(tokenHash)
                .orElseThrow(() -> new SessionException(SessionException.Reason.NOT_FOUND));

        OffsetDateTime now = OffsetDateTime.now(clock);
        if (session.isExpiredAt(now)) {
            userSessionRepository.deleteByTokenHash(tokenHash);
            throw new SessionException(SessionException.Reason.EXPIRED);
        }

        AppUser user = session.getUser();
        return new SessionAuthenticationPrincipal(
                user.getId(),
                user.getEmail(),
                session.getDisplayName(),
                user.isAdmin(),
                session.getExpiresAt()
        );
    }

    public void delete(String token) {
        if (!tokenGenerator.isWellFormed(token)) {
            return;
        }
        int deleted = userSessionRepository.deleteByTokenHash(tokenGenerator.hash(token));
        log.debug("Deleted session {} (rows={})", SessionTokenResolver.mask(token), deleted);
    }

    public int purgeExpired() {
        return userSessionRepository.deleteExpired(OffsetDateTime.now(clock));
    }

    public int purgeExpiredForUser(UUID userId) {
        return userSessionRepository.deleteExpiredForUser(userId, OffsetDateTime.now(clock));
    }

    public Duration ttl() {
        return ttl;
    }

    public record IssuedSession(String token, OffsetDateTime issuedAt, OffsetDateTime expiresAt) {
    }
}
