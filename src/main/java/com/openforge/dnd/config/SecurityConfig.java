package com.openforge.dnd.config;

import com.openforge.dnd.auth.SessionCookieAuthFilter;
import com.openforge.dnd.domain.Account.Role;
import jakarta.servlet.DispatcherType;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

    private final SessionCookieAuthFilter sessionCookieAuthFilter;

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http) throws Exception {
        http
            // SameSite=Strict session cookie; no CSRF token round-trip
            .csrf(AbstractHttpConfigurer::disable)
            // No HttpSession; the encrypted cookie is the only state
            .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
            .requestCache(AbstractHttpConfigurer::disable)
            .formLogin(AbstractHttpConfigurer::disable)
            .httpBasic(AbstractHttpConfigurer::disable)
            .logout(AbstractHttpConfigurer::disable)
            .authorizeHttpRequests(auth -> auth
                // Completion of async logins/provisioning was already authorized on the way in
                .dispatcherTypeMatchers(DispatcherType.ASYNC, DispatcherType.ERROR).permitAll()
                // Public API: login, logout, version, health
                .requestMatchers(HttpMethod.POST, "/v1/login", "/v1/logout").permitAll()
                .requestMatchers(HttpMethod.GET, "/v1/version", "/actuator/health").permitAll()
                // Provisioning is root-only
                .requestMatchers("/v1/accounts/**", "/v1/accounts").hasRole(Role.ROOT.name())
                // Every other API route needs a valid session
                .requestMatchers("/v1/**").authenticated()
                // Static client files
                .anyRequest().permitAll()
            )
            // Return 401 JSON instead of redirect to a login page
            .exceptionHandling(ex -> ex
                .authenticationEntryPoint((req, res, e) -> {
                    res.setStatus(401);
                    res.setContentType("application/json");
                    res.getWriter().write("{\"error\":\"Unauthorized\",\"message\":\"Missing or invalid session\"}");
                })
                .accessDeniedHandler((req, res, e) -> {
                    res.setStatus(403);
                    res.setContentType("application/json");
                    res.getWriter().write("{\"error\":\"Forbidden\",\"message\":\"Insufficient role\"}");
                })
            )
            // Resolve the session cookie before Spring's username/password filter
            .addFilterBefore(sessionCookieAuthFilter, UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }

    /** Keep the session filter inside the security chain only, not also as a plain servlet filter. */
    @Bean
    public FilterRegistrationBean<SessionCookieAuthFilter> sessionCookieAuthFilterRegistration(
            SessionCookieAuthFilter filter) {
        FilterRegistrationBean<SessionCookieAuthFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }
}
