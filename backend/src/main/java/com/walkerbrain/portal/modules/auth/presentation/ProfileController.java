package com.walkerbrain.portal.modules.auth.presentation;

import com.walkerbrain.portal.global.web.ViewContext;
import com.walkerbrain.portal.modules.auth.application.AuthService;
import com.walkerbrain.portal.modules.auth.presentation.dto.UserProfileResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/profile")
public class ProfileController {

    private final AuthService authService;

    public ProfileController(AuthService authService) {
        this.authService = authService;
    }

    @GetMapping("/me")
    @Operation(summary = "Current session's profile view")
    public ResponseEntity<UserProfileResponse> getMyProfile(ViewContext context) {
        return ResponseEntity.ok(authService.profile(context.principal()));
    }
}
