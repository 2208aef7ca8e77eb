package com.hotelbot.assistant.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Turns an admin bearer token into an authenticated principal. Guests send no token and
 * stay anonymous; a bad or non-admin token is ignored, so the route rules alone decide.
 */
public class JwtAuthFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(JwtAuthFilter.class);

    static final String BEARER = "Bearer ";

    private final JwtService jwtService;

    public JwtAuthFilter(JwtService jwtService) {
        this.jwtService = jwtService;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER)
                && SecurityContextHolder.getContext().getAuthentication() == null) {
            Optional<JwtService.ParsedToken> token = jwtService.parse(header.substring(BEARER.length()).trim());
            if (token.isEmpty()) {
                log.debug("Ignoring invalid bearer token on {} {}", request.getMethod(), request.getRequestURI());
            } else if (!JwtService.ROLE_ADMIN.equals(token.get().role())) {
                log.warn("Ignoring token with role {} for {}", token.get().role(), token.get().subject());
            } else {
                AdminPrincipal admin = new AdminPrincipal(token.get().subject(), token.get().role());
                SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                        admin, null, List.of(new SimpleGrantedAuthority("ROLE_" + JwtService.ROLE_ADMIN))));
            }
        }
        filterChain.doFilter(request, response);
    }
}
