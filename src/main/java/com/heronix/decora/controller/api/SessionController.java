package com.heronix.decora.controller.api;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.heronix.decora.service.DecoraSessionService;
import com.heronix.decora.session.AuthenticationResult;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * REST API for the Decora session and stored credentials.
 */
@RestController
@RequestMapping("/api/v1/decora/session")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Session", description = "APIs for the Decora login session")
public class SessionController {

    private final DecoraSessionService sessionService;

    @GetMapping("/status")
    @Operation(summary = "Session status")
    @ApiResponse(responseCode = "200", description = "Status returned")
    public ResponseEntity<DecoraSessionService.SessionStatus> status() {
        return ResponseEntity.ok(sessionService.getStatus());
    }

    @PostMapping("/login")
    @Operation(summary = "Log in", description = "Log in to Decora with the stored credentials")
    @ApiResponse(responseCode = "401", description = "Login failed or no credentials stored")
    public ResponseEntity<LoginResponse> login() {
        log.info("API: Logging in to Decora");
        AuthenticationResult result = sessionService.login();
        return ResponseEntity.ok(new LoginResponse(true, result.expiresIn(), result.expirationTime().toString()));
    }

    @PutMapping("/credentials")
    @Operation(summary = "Update credentials", description = "Store new Decora credentials; the password is encrypted at rest")
    public ResponseEntity<Map<String, Object>> updateCredentials(@Valid @RequestBody CredentialsRequest request) {
        sessionService.updateCredentials(request.username(), request.password());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Credentials stored"
        ));
    }

    @PostMapping("/logout")
    @Operation(summary = "Log out", description = "Drop the cached session token")
    public ResponseEntity<Map<String, Object>> logout() {
        sessionService.logout();
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Session cleared"
        ));
    }

    // ========================================================================
    // REQUEST/RESPONSE TYPES
    // ========================================================================

    public record CredentialsRequest(
            @NotBlank String username,
            @NotBlank String password
    ) {
        @Override
        public String toString() {
            return "CredentialsRequest[username=" + username + ", password=****]";
        }
    }

    public record LoginResponse(boolean authenticated, long expiresIn, String expiresAt) {}
}
