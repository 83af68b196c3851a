package com.openforge.dnd.auth;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Reads and writes the session cookie.
 * The cookie is Secure, HttpOnly, SameSite=Strict and host-only (no Domain attribute).
 */
@Component
@RequiredArgsConstructor
public class SessionCookies {

    private final SessionProperties props;
    private final Clock             clock;

    public Optional<String> read(HttpServletRequest request) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        for (Cookie cookie : cookies) {
            if (props.cookieName().equals(cookie.getName()) && cookie.getValue() != null && !cookie.getValue().isBlank()) {
                return Optional.of(cookie.getValue());
            }
        }
        return Optional.empty();
    }

    /** Cookie carrying a new session; lives as long as the token does. */
    public ResponseCookie issue(IssuedSession session) {
        Duration maxAge = Duration.between(clock.instant(), session.claims().expiresAt());
        return base(session.token())
                .maxAge(maxAge.isNegative() ? Duration.ZERO : maxAge)
                .build();
    }

    /** Cookie that makes the browser drop the session. */
    public ResponseCookie clear() {
        return base("")
                .maxAge(Duration.ZERO)
                .build();
    }

    private ResponseCookie.ResponseCookieBuilder base(String value) {
        return ResponseCookie.from(props.cookieName(), value)
                .path("/")
                .secure(true)
                .httpOnly(true)
                .sameSite("Strict");
    }
}
