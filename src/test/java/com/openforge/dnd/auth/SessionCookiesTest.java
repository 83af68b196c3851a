package com.openforge.dnd.auth;

import com.openforge.dnd.domain.Account.Role;
import com.openforge.dnd.support.MutableClock;
import jakarta.servlet.http.Cookie;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseCookie;
import org.springframework.mock.web.MockHttpServletRequest;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class SessionCookiesTest {

    private MutableClock   clock;
    private SessionCodec   codec;
    private SessionCookies cookies;

    @BeforeEach
    void setup() {
        clock = new MutableClock(Instant.parse("2024-04-09T12:00:00Z"));
        SessionProperties props = new SessionProperties(
                Duration.ofMinutes(360), Duration.ofSeconds(30), null, "login-token", true);
        codec   = new SessionCodec(props, clock);
        cookies = new SessionCookies(props, clock);
    }

    @Test
    void issuedCookieIsLockedDownAndLivesAsLongAsTheToken() {
        IssuedSession session = codec.issue("root", Role.ROOT);

        ResponseCookie cookie = cookies.issue(session);

        assertThat(cookie.getName()).isEqualTo("login-token");
        assertThat(cookie.getValue()).isEqualTo(session.token());
        assertThat(cookie.isSecure()).isTrue();
        assertThat(cookie.isHttpOnly()).isTrue();
        assertThat(cookie.getSameSite()).isEqualTo("Strict");
        assertThat(cookie.getPath()).isEqualTo("/");
        assertThat(cookie.getDomain()).isNull();
        assertThat(cookie.getMaxAge()).isEqualTo(Duration.ofMinutes(360));
    }

    @Test
    void clearingCookieExpiresImmediately() {
        ResponseCookie cookie = cookies.clear();

        assertThat(cookie.getValue()).isEmpty();
        assertThat(cookie.getMaxAge()).isEqualTo(Duration.ZERO);
    }

    @Test
    void readPicksTheSessionCookieAndIgnoresEmptyOnes() {
        MockHttpServletRequest request = new MockHttpServletRequest();
        assertThat(cookies.read(request)).isEmpty();

        request.setCookies(new Cookie("theme", "dark"), new Cookie("login-token", ""));
        assertThat(cookies.read(request)).isEmpty();

        request.setCookies(new Cookie("theme", "dark"), new Cookie("login-token", "abc"));
        assertThat(cookies.read(request)).contains("abc");
    }
}
