package got.mail.app.security;

import got.mail.app.entity.User;
import got.mail.app.service.SessionService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.security.web.util.matcher.RequestMatcher;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Collections;
import java.util.Optional;

/**
 * Resolves the raw session token in the {@code Authorization} header (no scheme prefix)
 * to a user on every request. A missing header leaves the request anonymous; a header
 * that does not match a live session is rejected with 401.
 */
@Slf4j
public class SessionTokenAuthenticationFilter extends OncePerRequestFilter {
    private final SessionService sessionService;
    private final AuthenticationEntryPoint authenticationEntryPoint;
    private final RequestMatcher publicEndpoints;

    public SessionTokenAuthenticationFilter(SessionService sessionService,
                                            AuthenticationEntryPoint authenticationEntryPoint,
                                            RequestMatcher publicEndpoints) {
        this.sessionService = sessionService;
        this.authenticationEntryPoint = authenticationEntryPoint;
        this.publicEndpoints = publicEndpoints;
    }

    @Override
    protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
        // Public endpoints read the token themselves, e.g. logout of an expired session
        return publicEndpoints.matches(request);
    }

    @Override
    protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
                                    @NonNull FilterChain filterChain) throws ServletException, IOException {
        String token = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (token == null || token.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        Optional<User> user = sessionService.resolveUser(token.trim());
        if (user.isEmpty()) {
            log.warn("Rejected invalid or expired session token for {} {}", request.getMethod(), request.getRequestURI());
            SecurityContextHolder.clearContext();
            authenticationEntryPoint.commence(request, response,
                    new BadCredentialsException("Invalid or expired token"));
            return;
        }

        UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                user.get(), null, Collections.emptyList());
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
        filterChain.doFilter(request, response);
    }
}
