package com.walkerbrain.portal.modules.auth.application;

import java.util.Locale;
import java.util.Optional;

import com.walkerbrain.portal.global.error.ProblemException;
import com.walkerbrain.portal.global.security.SessionAuthenticationPrincipal;
import com.walkerbrain.portal.modules.auth.domain.AppUser;
import com.walkerbrain.portal.modules.auth.infrastructure.persistence.AppUserRepository;
import com.walkerbrain.portal.modules.auth.presentation.dto.LoginResponse;
import com.walkerbrain.portal.modules.auth.presentation.dto.UserProfileResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(noRollbackFor = AuthException.class)
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);
    public static final String ADMIN_REQUIRED = "ADMIN_REQUIRED";

    private final AppUserRepository appUserRepository;
    private final SessionService sessionService;
    private final EmailDomainPolicy emailDomainPolicy;
    private final PasswordEncoder passwordEncoder;
    private final String dummyPasswordHash;

    public AuthService(
            AppUserRepository appUserRepository,
            SessionService sessionService,
            EmailDomainPolicy emailDomainPolicy,
            PasswordEncoder passwordEncoder
    ) {
        this.appUserRepository = appUserRepository;
        this.sessionService = sessionService;
        this.emailDomainPolicy = emailDomainPolicy;
        this.passwordEncoder = passwordEncoder;
        // unknown emails still pay for one hash comparison
        this.dummyPasswordHash = passwordEncoder.encode("unused-" + System.nanoTime());
    }

    @Transactional(readOnly = true)
    public AppUser authenticate(String email, String password) {
        String normalized = normalizeEmail(email);
        Optional<AppUser> user = appUserRepository.findByEmailIgnoreCase(normalized);
        String hash = user.map(AppUser::getPasswordHash).orElse(dummyPasswordHash);
        boolean matches = password != null && passwordEncoder.matches(password, hash);
        if (user.isEmpty() || !matches) {
            throw new AuthException(AuthException.Reason.INVALID_CREDENTIALS);
        }
        return user.get();
    }

    /**
     * Creates an account without signing it in. The domain allow-list is checked before uniqueness so
     * outsiders cannot tell which addresses exist.
     */
    public AppUser register(String email, String password, String displayName) {
        String normalized = normalizeEmail(email);
        if (!emailDomainPolicy.isAllowed(normalized)) {
            throw new AuthException(AuthException.Reason.DOMAIN_RESTRICTED);
        }
        if (appUserRepository.existsByEmailIgnoreCase(normalized)) {
            throw new AuthException(AuthException.Reason.DUPLICATE_ACCOUNT);
        }

        AppUser user = new AppUser();
        user.setEmail(normalized);
        user.setPasswordHash(passwordEncoder.encode(password));
        user.setDisplayName(displayName == null || displayName.isBlank() ? normalized : displayName.trim());
        user.setAdmin(false);
        try {
            AppUser saved = appUserRepository.saveAndFlush(user);
            log.info("Registered user {}", saved.getId());
            return saved;
        } catch (DataIntegrityViolationException e) {
            throw new AuthException(AuthException.Reason.DUPLICATE_ACCOUNT, e);
        }
    }

    public LoginResponse login(String email, String password) {
        AppUser user = authenticate(email, password);
        sessionService.purgeExpiredForUser(user.getId());
        String displayName = user.getDisplayName() != null ? user.getDisplayName() : user.getEmail();
        SessionService.IssuedSession issued = sessionService.create(user.getId(), displayName);
        UserProfileResponse profile = new UserProfileResponse(
                user.getId(),
                user.getEmail(),
                displayName,
                user.isAdmin(),
                issued.expiresAt()
        );
        return new LoginResponse(issued.token(), issued.expiresAt(), profile);
    }

    public void logout(String token) {
        if (token == null) {
            return;
        }
        sessionService.delete(token);
    }

    /**
     * Reads the flag captured when the session was last validated, not the live account row.
     */
    public boolean checkAdmin(SessionAuthenticationPrincipal principal) {
        return principal != null && principal.admin();
    }

    public void requireAdmin(SessionAuthenticationPrincipal principal) {
        if (!checkAdmin(principal)) {
            throw new ProblemException(HttpStatus.FORBIDDEN, ADMIN_REQUIRED, "Restricted to admin users.");
        }
    }

    @Transactional(readOnly = true)
    public UserProfileResponse profile(SessionAuthenticationPrincipal principal) {
        return new UserProfileResponse(
                principal.userId(),
                principal.email(),
                principal.displayName(),
                principal.admin(),
                principal.sessionExpiresAt()
        );
    }

    static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }
}
