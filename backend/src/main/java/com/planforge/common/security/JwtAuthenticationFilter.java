package com.planforge.common.security;

import com.planforge.common.exception.UnauthorizedException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Authenticates requests carrying an identity-service access token and tags their log lines with
 * the caller's id. Requests without a usable token continue anonymously and are refused by the
 * security rules, not here.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    static final String MDC_USER_ID = "userId";

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";
    private static final String ACCESS_TOKEN_TYPE = "access";

    private final JwtService jwtService;

    public JwtAuthenticationFilter(JwtService jwtService) {
        this.jwtService = jwtService;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator/health");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header == null || !header.startsWith(BEARER_PREFIX)) {
            filterChain.doFilter(request, response);
            return;
        }

        AuthenticatedUser user = authenticate(header.substring(BEARER_PREFIX.length()), request);
        if (user == null) {
            filterChain.doFilter(request, response);
            return;
        }

        MDC.put(MDC_USER_ID, user.userId().toString());
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_USER_ID);
        }
    }

    private AuthenticatedUser authenticate(String token, HttpServletRequest request) {
        try {
            JwtService.ParsedToken parsed = jwtService.parse(token);
            if (!ACCESS_TOKEN_TYPE.equals(parsed.tokenType())) {
                throw new UnauthorizedException("Expected an access token, got " + parsed.tokenType());
            }
            AuthenticatedUser user = new AuthenticatedUser(parsed.userId(), parsed.email(), parsed.role());
            SecurityContextHolder.getContext().setAuthentication(new UsernamePasswordAuthenticationToken(
                    user,
                    null,
                    List.of(new SimpleGrantedAuthority("ROLE_" + parsed.role().name()))
            ));
            return user;
        } catch (UnauthorizedException exception) {
            SecurityContextHolder.clearContext();
            log.debug("Rejected bearer token on {} {}: {}", request.getMethod(), request.getRequestURI(),
                    exception.getMessage());
            return null;
        }
    }
}
