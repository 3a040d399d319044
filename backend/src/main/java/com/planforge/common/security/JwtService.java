package com.planforge.common.security;

import com.planforge.common.exception.UnauthorizedException;
import com.planforge.config.AppProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Verifies access tokens minted by the identity service. Tokens are HMAC signed with the
 * shared {@code app.jwt.secret}; this service never issues tokens itself.
 */
@Service
public class JwtService {

    private final AppProperties properties;
    private SecretKey secretKey;

    public JwtService(AppProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    void initKey() {
        byte[] source = properties.jwt().secret().getBytes(StandardCharsets.UTF_8);
        if (source.length < 32) {
            byte[] expanded = new byte[32];
            for (int i = 0; i < expanded.length; i++) {
                expanded[i] = source[i % source.length];
            }
            source = expanded;
        }
        this.secretKey = Keys.hmacShaKeyFor(source);
    }

    public ParsedToken parse(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .requireIssuer(properties.jwt().issuer())
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String subject = claims.getSubject();
            String tokenType = claims.get("type", String.class);
            Date expiration = claims.getExpiration();
            if (subject == null || tokenType == null || expiration == null) {
                throw new UnauthorizedException("Invalid token payload");
            }

            String roleValue = claims.get("role", String.class);
            UserRole role = roleValue == null ? UserRole.LEARNER : UserRole.valueOf(roleValue);
            return new ParsedToken(
                    UUID.fromString(subject),
                    claims.get("email", String.class),
                    role,
                    tokenType,
                    expiration.toInstant()
            );
        } catch (IllegalArgumentException | JwtException exception) {
            throw new UnauthorizedException("Invalid or expired token");
        }
    }

    public record ParsedToken(
            UUID userId,
            String email,
            UserRole role,
            String tokenType,
            Instant expiresAt
    ) {
    }
}
