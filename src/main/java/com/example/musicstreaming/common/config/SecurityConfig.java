package com.example.musicstreaming.common.config;

import com.example.musicstreaming.application.service.AccessTokenService;
import com.example.musicstreaming.common.logging.AccessLogFilter;
import com.example.musicstreaming.infrastructure.security.TokenAuthFilter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    public AccessLogFilter accessLogFilter() {
        return new AccessLogFilter();
    }

    @Bean
    public TokenAuthFilter tokenAuthFilter(AccessTokenService accessTokenService) {
        return new TokenAuthFilter(accessTokenService);
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http,
                                                   AccessLogFilter accessLogFilter,
                                                   TokenAuthFilter tokenAuthFilter) throws Exception {
        http.csrf().disable()
                .sessionManagement().sessionCreationPolicy(SessionCreationPolicy.STATELESS)
                .and()
                .authorizeRequests()
                .antMatchers(
                        "/actuator/health",
                        "/actuator/info",
                        "/v3/api-docs/**",
                        "/swagger-ui/**",
                        "/swagger-ui.html",
                        "/error",
                        "/api/streaming/v1/sessions/*/manifest.mpd",
                        "/api/streaming/v1/sessions/*/segments/*")
                .permitAll()
                .anyRequest().authenticated()
                .and()
                .addFilterBefore(accessLogFilter, UsernamePasswordAuthenticationFilter.class)
                .addFilterAfter(tokenAuthFilter, AccessLogFilter.class);

        return http.build();
    }
}
