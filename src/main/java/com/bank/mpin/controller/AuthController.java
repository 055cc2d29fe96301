package com.bank.mpin.controller;

import com.bank.mpin.config.SessionConfig;
import com.bank.mpin.crypto.KeyCustodian;
import com.bank.mpin.exception.InvalidInputException;
import com.bank.mpin.model.AuthOutcome;
import com.bank.mpin.model.AuthResult;
import com.bank.mpin.model.ErrorResponse;
import com.bank.mpin.model.LoginAttempt;
import com.bank.mpin.model.LoginRequest;
import com.bank.mpin.model.PublicKeyResponse;
import com.bank.mpin.model.RegisterRequest;
import com.bank.mpin.model.SessionClaims;
import com.bank.mpin.model.TokenRequest;
import com.bank.mpin.service.AttemptLedgerService;
import com.bank.mpin.service.CredentialService;
import com.bank.mpin.service.PhoneNumbers;
import com.bank.mpin.service.SessionService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseCookie;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Authentication", description = "MPIN registration, login and session verification")
public class AuthController {

    static final String PUBLIC_KEY_ALGORITHM = "RSA-OAEP-256";
    private static final String BEARER_PREFIX = "Bearer ";
    private static final int MAX_HISTORY_LIMIT = 100;

    private final CredentialService credentialService;
    private final SessionService sessionService;
    private final AttemptLedgerService ledgerService;
    private final KeyCustodian keyCustodian;
    private final SessionConfig sessionConfig;

    public AuthController(CredentialService credentialService,
                          SessionService sessionService,
                          AttemptLedgerService ledgerService,
                          KeyCustodian keyCustodian,
                          SessionConfig sessionConfig) {
        this.credentialService = credentialService;
        this.sessionService = sessionService;
        this.ledgerService = ledgerService;
        this.keyCustodian = keyCustodian;
        this.sessionConfig = sessionConfig;
    }

    @Operation(summary = "Get the MPIN transport public key",
            description = "Returns the server's RSA public key (PEM, SubjectPublicKeyInfo). Clients encrypt " +
                    "the MPIN with RSA-OAEP using SHA-256 before sending it.")
    @GetMapping("/public-key")
    public ResponseEntity<PublicKeyResponse> getPublicKey() {
        return ResponseEntity.ok(new PublicKeyResponse(keyCustodian.publicKeyPem(), PUBLIC_KEY_ALGORITHM));
    }

    @Operation(summary = "Register an MPIN",
            description = "Creates the credential for a phone number that has none yet, binds the device " +
                    "and starts a session. The MPIN must be 4 or 6 digits.")
    @PostMapping("/register")
    public ResponseEntity<AuthResult> register(@RequestBody RegisterRequest request, HttpServletRequest http) {
        requireField(request.getEncryptedMpin(), "Phone and encrypted MPIN are required");
        String phone = PhoneNumbers.normalize(request.getPhone());

        AuthResult result = credentialService.register(phone, request.getEncryptedMpin(),
                request.getFingerprint(), clientIp(http), http.getHeader(HttpHeaders.USER_AGENT));
        return withSessionCookie(result, result.isSuccess() ? HttpStatus.CREATED : statusFor(result.getOutcome()));
    }

    @Operation(summary = "Login with an MPIN",
            description = "Checks lockout, scores the attempt for fraud risk (new IP, new device, rapid attempts, " +
                    "high failure rate, unusual hour), verifies the MPIN and starts a session.")
    @PostMapping("/login")
    public ResponseEntity<AuthResult> login(@RequestBody LoginRequest request, HttpServletRequest http) {
        requireField(request.getEncryptedMpin(), "Phone and encrypted MPIN are required");
        String phone = PhoneNumbers.normalize(request.getPhone());

        AuthResult result = credentialService.login(phone, request.getEncryptedMpin(),
                request.getFingerprint(), clientIp(http), http.getHeader(HttpHeaders.USER_AGENT));
        return withSessionCookie(result, statusFor(result.getOutcome()));
    }

    @Operation(summary = "Verify a session token",
            description = "Validates a token from the request body, or from the session cookie when the body " +
                    "has none, and returns its claims.")
    @PostMapping("/verify-token")
    public ResponseEntity<?> verifyToken(@RequestBody(required = false) TokenRequest request,
                                         @CookieValue(name = "${auth.session.cookie-name:smartbank_token}", required = false)
                                         String cookieToken) {
        String token = request != null && request.getToken() != null ? request.getToken() : cookieToken;
        if (token == null || token.isBlank()) {
            return ResponseEntity.badRequest().body(new ErrorResponse("INVALID_INPUT", "Token required"));
        }

        Optional<SessionClaims> claims = sessionService.verify(token);
        if (claims.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(new ErrorResponse("INVALID_TOKEN", "Invalid or expired token"));
        }
        return ResponseEntity.ok(Map.of("valid", true, "session", claims.get()));
    }

    @Operation(summary = "Logout",
            description = "Clears the session cookie. Tokens are stateless and stay valid until they expire.")
    @PostMapping("/logout")
    public ResponseEntity<Map<String, Object>> logout() {
        ResponseCookie cleared = sessionCookie("", Duration.ZERO);
        return ResponseEntity.ok()
                .header(HttpHeaders.SET_COOKIE, cleared.toString())
                .body(Map.of("success", true, "message", "Logged out successfully"));
    }

    @Operation(summary = "Login attempt history",
            description = "Returns the caller's retained login attempts, most recent first. Requires a " +
                    "session token as a Bearer header or the session cookie.")
    @GetMapping("/attempts")
    public ResponseEntity<?> getAttempts(
            @RequestHeader(name = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @CookieValue(name = "${auth.session.cookie-name:smartbank_token}", required = false) String cookieToken,
            @Parameter(description = "Max number of attempts to return", example = "50")
            @RequestParam(defaultValue = "50") int limit) {
        String token = authorization != null && authorization.startsWith(BEARER_PREFIX)
                ? authorization.substring(BEARER_PREFIX.length())
                : cookieToken;

        Optional<SessionClaims> claims = sessionService.verify(token);
        if (claims.isEmpty()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(new ErrorResponse("INVALID_TOKEN", "Invalid or expired token"));
        }

        int boundedLimit = Math.max(1, Math.min(limit, MAX_HISTORY_LIMIT));
        List<LoginAttempt> attempts = ledgerService.history(claims.get().phone(), boundedLimit);
        return ResponseEntity.ok(attempts);
    }

    static HttpStatus statusFor(AuthOutcome outcome) {
        return switch (outcome) {
            case SUCCESS -> HttpStatus.OK;
            case ALREADY_REGISTERED -> HttpStatus.CONFLICT;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case ACCOUNT_LOCKED -> HttpStatus.LOCKED;
            case RISK_BLOCKED -> HttpStatus.FORBIDDEN;
            case WRONG_CREDENTIAL -> HttpStatus.UNAUTHORIZED;
            case INVALID_CIPHERTEXT, INVALID_PIN_FORMAT -> HttpStatus.BAD_REQUEST;
        };
    }

    private ResponseEntity<AuthResult> withSessionCookie(AuthResult result, HttpStatus status) {
        if (!result.isSuccess() || result.getToken() == null) {
            return ResponseEntity.status(status).body(result);
        }
        ResponseCookie cookie = sessionCookie(result.getToken(), Duration.ofMinutes(sessionConfig.getTtlMinutes()));
        return ResponseEntity.status(status)
                .header(HttpHeaders.SET_COOKIE, cookie.toString())
                .body(result);
    }

    private ResponseCookie sessionCookie(String value, Duration maxAge) {
        return ResponseCookie.from(sessionConfig.getCookieName(), value)
                .httpOnly(true)
                .secure(sessionConfig.isSecureCookie())
                .sameSite("Strict")
                .path("/")
                .maxAge(maxAge)
                .build();
    }

    private static void requireField(String value, String message) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(message);
        }
    }

    // Forwarded headers only reach this through server.forward-headers-strategy
    private static String clientIp(HttpServletRequest http) {
        return http.getRemoteAddr();
    }
}
