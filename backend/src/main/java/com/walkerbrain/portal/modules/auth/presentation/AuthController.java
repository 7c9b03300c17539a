package com.walkerbrain.portal.modules.auth.presentation;

import com.walkerbrain.portal.global.security.SessionTokenResolver;
import com.walkerbrain.portal.modules.auth.application.AuthService;
import com.walkerbrain.portal.modules.auth.presentation.dto.LoginRequest;
import com.walkerbrain.portal.modules.auth.presentation.dto.LoginResponse;
import com.walkerbrain.portal.modules.auth.presentation.dto.RegisterRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.CacheControl;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/login")
    @Operation(summary = "Sign in with email and password")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok()
                .cacheControl(CacheControl.noStore())
                .body(authService.login(request.email(), request.password()));
    }

    /**
     * Registers and then signs the new account in, as the dashboard does after a successful sign-up.
     */
    @PostMapping("/auth/register")
    @Operation(summary = "Create an account on an approved email domain")
    public ResponseEntity<LoginResponse> register(@Valid @RequestBody RegisterRequest request) {
        authService.register(request.email(), request.password(), request.displayName());
        return ResponseEntity.status(HttpStatus.CREATED)
                .cacheControl(CacheControl.noStore())
                .body(authService.login(request.email(), request.password()));
    }

    @PostMapping("/auth/logout")
    @Operation(summary = "End the current session")
    public ResponseEntity<Void> logout(HttpServletRequest request) {
        authService.logout(SessionTokenResolver.resolve(request));
        return ResponseEntity.noContent().build();
    }
}
