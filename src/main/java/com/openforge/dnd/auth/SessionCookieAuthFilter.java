package com.openforge.dnd.auth;

import com.openforge.dnd.account.StorageUnavailableException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Reads the session cookie on every request.
 * If valid, puts an {@link AuthenticatedAccount} principal into the SecurityContext so the
 * rest of the filter chain treats the request as authenticated. An invalid or expired
 * cookie leaves the request anonymous and tells the browser to drop it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SessionCookieAuthFilter extends OncePerRequestFilter {

    private final AuthService    authService;
    private final SessionCookies sessionCookies;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest  request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain         chain) throws ServletException, IOException {

        Optional<String> token = sessionCookies.read(request);

        if (token.isPresent() && SecurityContextHolder.getContext().getAuthentication() == null) {
            Optional<AuthenticatedAccount> account;
            try {
                account = authService.authenticate(token.get());
            } catch (StorageUnavailableException e) {
                log.error("[Session] Could not check session for {}", request.getRequestURI(), e);
                response.setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
                response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                response.getWriter().write("{\"error\":\"Internal Server Error\",\"message\":\"Failed to check session\"}");
                return;
            }

            if (account.isPresent()) {
                AuthenticatedAccount principal = account.get();
                var auth = new UsernamePasswordAuthenticationToken(
                        principal,
                        null,
                        List.of(new SimpleGrantedAuthority(principal.role().authority()))
                );
                auth.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(auth);
                log.debug("[Session] Authenticated username={} path={}", principal.username(), request.getRequestURI());
            } else {
                response.addHeader(HttpHeaders.SET_COOKIE, sessionCookies.clear().toString());
            }
        }

        chain.doFilter(request, response);
    }
}
