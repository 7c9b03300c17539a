package com.walkerbrain.portal.modules.auth;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.walkerbrain.portal.global.error.ProblemException;
import com.walkerbrain.portal.global.security.SessionAuthenticationPrincipal;
import com.walkerbrain.portal.modules.auth.application.AuthException;
import com.walkerbrain.portal.modules.auth.application.AuthService;
import com.walkerbrain.portal.modules.auth.application.EmailDomainPolicy;
import com.walkerbrain.portal.modules.auth.application.SessionService;
import com.walkerbrain.portal.modules.auth.domain.AppUser;
import com.walkerbrain.portal.modules.auth.infrastructure.persistence.AppUserRepository;
import com.walkerbrain.portal.modules.auth.presentation.dto.LoginResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.test.util.ReflectionTestUtils;

class AuthServiceTest {

    private static final OffsetDateTime NOW = OffsetDateTime.of(2025, 3, 1, 9, 0, 0, 0, ZoneOffset.UTC);

    private final PasswordEncoder passwordEncoder = new BCryptPasswordEncoder(4);
    private AppUserRepository userRepository;
    private SessionService sessionService;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        userRepository = mock(AppUserRepository.class);
        sessionService = mock(SessionService.class);
        EmailDomainPolicy domainPolicy = new EmailDomainPolicy("walkeradvertising.com, @walker.example");
        authService = new AuthService(userRepository, sessionService, domainPolicy, passwordEncoder);
    }

    @Test
    void registerRejectsOutsideDomainBeforeCheckingForDuplicates() {
        assertThatThrownBy(() -> authService.register("someone@gmail.com", "secret1", "Someone"))
                .isInstanceOfSatisfying(AuthException.class, e -> {
                    assertThat(e.getReasonCode()).isEqualTo(AuthException.Reason.DOMAIN_RESTRICTED);
                    assertThat(e.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                });
        verify(userRepository, never()).existsByEmailIgnoreCase(anyString());
    }

    @Test
    void registerRejectsExistingAccount() {
        when(userRepository.existsByEmailIgnoreCase("taken@walkeradvertising.com")).thenReturn(true);

        assertThatThrownBy(() -> authService.register(" Taken@WalkerAdvertising.com ", "secret1", "Taken"))
                .isInstanceOfSatisfying(AuthException.class,
                        e -> assertThat(e.getReasonCode()).isEqualTo(AuthException.Reason.DUPLICATE_ACCOUNT));
    }

    @Test
    void registerTranslatesUniqueIndexRace() {
        when(userRepository.saveAndFlush(any(AppUser.class)))
                .thenThrow(new DataIntegrityViolationException("uq_app_user_email"));

        assertThatThrownBy(() -> authService.register("new@walker.example", "secret1", "New"))
                .isInstanceOfSatisfying(AuthException.class,
                        e -> assertThat(e.getReasonCode()).isEqualTo(AuthException.Reason.DUPLICATE_ACCOUNT));
    }

    @Test
    void registerStoresNormalizedEmailAndHashedPassword() {
        when(userRepository.saveAndFlush(any(AppUser.class))).thenAnswer(invocation -> invocation.getArgument(0));

        AppUser saved = authService.register("  New.Hire@WalkerAdvertising.com", "secret1", "  New Hire ");

        assertThat(saved.getEmail()).isEqualTo("new.hire@walkeradvertising.com");
        assertThat(saved.getDisplayName()).isEqualTo("New Hire");
        assertThat(saved.isAdmin()).isFalse();
        assertThat(saved.getPasswordHash()).isNotEqualTo("secret1");
        assertThat(passwordEncoder.matches("secret1", saved.getPasswordHash())).isTrue();
    }

    @Test
    void authenticateRejectsUnknownEmailAndWrongPasswordAlike() {
        AppUser user = user("analyst@walkeradvertising.com", "secret1", false);
        when(userRepository.findByEmailIgnoreCase("analyst@walkeradvertising.com")).thenReturn(Optional.of(user));
        when(userRepository.findByEmailIgnoreCase("ghost@walkeradvertising.com")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> authService.authenticate("analyst@walkeradvertising.com", "wrong"))
                .isInstanceOfSatisfying(AuthException.class,
                        e -> assertThat(e.getReasonCode()).isEqualTo(AuthException.Reason.INVALID_CREDENTIALS));
        assertThatThrownBy(() -> authService.authenticate("ghost@walkeradvertising.com", "secret1"))
                .isInstanceOfSatisfying(AuthException.class,
                        e -> assertThat(e.getReasonCode()).isEqualTo(AuthException.Reason.INVALID_CREDENTIALS));
        assertThatThrownBy(() -> authService.authenticate("analyst@walkeradvertising.com", null))
                .isInstanceOf(AuthException.class);
    }

    @Test
    void loginPurgesStaleSessionsAndReturnsIssuedToken() {
        AppUser user = user("admin@walkeradvertising.com", "secret1", true);
        when(userRepository.findByEmailIgnoreCase("admin@walkeradvertising.com")).thenReturn(Optional.of(user));
        when(sessionService.create(eq(user.getId()), eq("admin")))
                .thenReturn(new SessionService.IssuedSession("tok", NOW, NOW.plusDays(7)));

        LoginResponse response = authService.login("ADMIN@walkeradvertising.com", "secret1");

        verify(sessionService).purgeExpiredForUser(user.getId());
        assertThat(response.sessionToken()).isEqualTo("tok");
        assertThat(response.expiresAt()).isEqualTo(NOW.plusDays(7));
        assertThat(response.user().isAdmin()).isTrue();
        assertThat(response.user().email()).isEqualTo("admin@walkeradvertising.com");
    }

    @Test
    void logoutWithoutTokenDoesNothing() {
        authService.logout(null);

        verify(sessionService, never()).delete(any());
    }

    @Test
    void adminCheckUsesPrincipalFlag() {
        SessionAuthenticationPrincipal admin = principal(true);
        SessionAuthenticationPrincipal analyst = principal(false);

        assertThat(authService.checkAdmin(admin)).isTrue();
        assertThat(authService.checkAdmin(analyst)).isFalse();
        assertThat(authService.checkAdmin(null)).isFalse();

        authService.requireAdmin(admin);
        assertThatThrownBy(() -> authService.requireAdmin(analyst))
                .isInstanceOfSatisfying(ProblemException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
                    assertThat(e.getCode()).isEqualTo(AuthService.ADMIN_REQUIRED);
                });
    }

    private AppUser user(String email, String password, boolean admin) {
        AppUser user = new AppUser();
        ReflectionTestUtils.setField(user, "id", UUID.randomUUID());
        user.setEmail(email);
        user.setPasswordHash(passwordEncoder.encode(password));
        user.setDisplayName(email.substring(0, email.indexOf('@')));
        user.setAdmin(admin);
        return user;
    }

    private static SessionAuthenticationPrincipal principal(boolean admin) {
        return new SessionAuthenticationPrincipal(UUID.randomUUID(), "someone@walkeradvertising.com", "Someone", admin,
                NOW.plusDays(7));
    }
}
