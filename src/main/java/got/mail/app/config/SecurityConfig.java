package got.mail.app.config;

import got.mail.app.security.RestAuthenticationEntryPoint;
import got.mail.app.security.SessionTokenAuthenticationFilter;
import got.mail.app.service.SessionService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.OrRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;

@Configuration
public class SecurityConfig {
    static final RequestMatcher PUBLIC_ENDPOINTS = new OrRequestMatcher(
            new AntPathRequestMatcher("/register", HttpMethod.POST.name()),
            new AntPathRequestMatcher("/login", HttpMethod.POST.name()),
            new AntPathRequestMatcher("/logout", HttpMethod.POST.name()),
            new AntPathRequestMatcher("/validate-token", HttpMethod.POST.name()),
            new AntPathRequestMatcher("/error")
    );

    private final SessionService sessionService;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public SecurityConfig(SessionService sessionService, RestAuthenticationEntryPoint authenticationEntryPoint) {
        this.sessionService = sessionService;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                // Token API, no cookies and no server-side HTTP session
                .csrf(AbstractHttpConfigurer::disable)
                .httpBasic(AbstractHttpConfigurer::disable)
                .formLogin(AbstractHttpConfigurer::disable)
                .logout(AbstractHttpConfigurer::disable)
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                // Who can see what
                .authorizeHttpRequests(authorize -> authorize
                        .requestMatchers(PUBLIC_ENDPOINTS).permitAll()
                        .anyRequest().authenticated()
                )

                .exceptionHandling(exceptions -> exceptions.authenticationEntryPoint(authenticationEntryPoint))

                .addFilterBefore(
                        new SessionTokenAuthenticationFilter(sessionService, authenticationEntryPoint, PUBLIC_ENDPOINTS),
                        UsernamePasswordAuthenticationFilter.class);

        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
