package com.layeredapi.backend.modules.auth.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;

import com.layeredapi.backend.modules.auth.infrastructure.jwt.JwtProperties;
import com.layeredapi.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.stereotype.Service;

/**
 * HS256 JWT implementation. Subject is the user id; {@code email} and {@code role} travel as private claims.
 */
@Service
public class JwtTokenService implements TokenService {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLE = "role";

    private final JwtTokenProvider tokenProvider;
    private final Duration tokenTtl;
    private final Clock clock;
    private final JwtParser parser;

    public JwtTokenService(JwtTokenProvider tokenProvider, JwtProperties properties, Clock clock) {
        this.tokenProvider = tokenProvider;
        this.tokenTtl = properties.expiration();
        this.clock = clock;
        this.parser = Jwts.parser()
                .verifyWith(tokenProvider.getSecretKey())
                .clock(() -> Date.from(clock.instant()))
                .build();
    }

    @Override
    public IssuedToken issue(Long userId, String email, String role) {
        Instant now = clock.instant();
        Instant expiry = now.plus(tokenTtl);

        String token = Jwts.builder()
                .subject(String.valueOf(userId))
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_EMAIL, email)
                .claim(CLAIM_ROLE, role)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        return new IssuedToken(
                token,
                OffsetDateTime.ofInstant(now, clock.getZone()),
                OffsetDateTime.ofInstant(expiry, clock.getZone())
        );
    }

    @Override
    public ParsedToken verify(String token) {
        Claims claims;
        String email;
        String role;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
            // RequiredTypeException when a claim is not a string
            email = claims.get(CLAIM_EMAIL, String.class);
            role = claims.get(CLAIM_ROLE, String.class);
        } catch (ExpiredJwtException e) {
            throw new InvalidTokenException("Token has expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid token", e);
        }

        String subject = claims.getSubject();
        if (subject == null || email == null || role == null || claims.getExpiration() == null) {
            throw new InvalidTokenException("Token is missing required claims");
        }

        Long userId;
        try {
            userId = Long.valueOf(subject);
        } catch (NumberFormatException e) {
            throw new InvalidTokenException("Token subject is not a user id", e);
        }

        Instant expiresAt = claims.getExpiration().toInstant();
        Instant issuedAt = claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : expiresAt.minus(tokenTtl);
        return new ParsedToken(
                userId,
                email,
                role,
                OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                OffsetDateTime.ofInstant(expiresAt, clock.getZone())
        );
    }
}
