package com.hotelbot.assistant.config;

import com.hotelbot.assistant.auth.JwtAuthFilter;
import com.hotelbot.assistant.auth.JwtService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

/**
 * Guest endpoints stay open; the chat identifies users by the id the client sends.
 * Staff endpoints need an admin bearer token from {@code /auth/admin/login}.
 */
@Configuration
public class SecurityConfig {

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http, JwtService jwtService) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .cors(Customizer.withDefaults())
                .sessionManagement(s -> s.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .exceptionHandling(e -> e.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.GET, "/users").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.POST, "/amenities").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.PUT, "/amenities/**").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.DELETE, "/amenities/**").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.PUT, "/update-booking/**").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.DELETE, "/delete-booking/**").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.GET, "/bookings-in-range", "/bookings-by-room/**").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.GET, "/payment-attempts/**").hasRole("ADMIN")
                        .anyRequest().permitAll())
                .addFilterBefore(new JwtAuthFilter(jwtService), UsernamePasswordAuthenticationFilter.class);
        return http.build();
    }
}
