package com.clutch.backend.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import com.clutch.backend.auth.config.AuthProperties;
import com.clutch.backend.global.ApiException;
import com.clutch.backend.global.ErrorCode;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * Access / Refresh Token(JWT) 발급·검증 코덱
 *
 * - HTTP도, 저장소도 모른다. 서명/만료/클레임 구조만 판단한다. (I/O 없음)
 * - secret / algorithm / TTL은 생성 시점에 한 번 읽고 고정한다.
 * - 실패는 ApiException 두 종류로만 나간다.
 *     exp 지남                                  -> TOKEN_EXPIRED
 *     서명 불일치, 형식 오류, issuer 불일치, 클레임 누락 -> TOKEN_INVALID
 *
 * 클레임:
 * - iss / sub(accountId) / admin / session_id(선택) / type(access|refresh) / iat / exp
 * - iat/exp는 초 단위라서 발급 시각도 초로 잘라 둔다. (발급 -> 검증 왕복 시 값이 그대로 돌아옴)
 */
@Service
public class JwtService {

    private static final int MIN_SECRET_BYTES = 32;

    static final String ADMIN_CLAIM = "admin";
    static final String SESSION_ID_CLAIM = "session_id";
    static final String TYPE_CLAIM = "type";

    private final AuthProperties.Jwt jwtProps;
    private final Clock clock;
    private final SignatureAlgorithm algorithm;
    private final SecretKey key;
    private final JwtParser parser;

    public JwtService(AuthProperties props, Clock clock) {
        this.jwtProps = props.jwt();
        this.clock = clock;

        this.algorithm = resolveAlgorithm(jwtProps.algorithm());
        this.key = buildHmacKey(jwtProps.secret(), algorithm);

        // requireIssuer로 다른 서비스가 같은 키로 만든 토큰을 막는다.
        this.parser = buildParser(jwtProps.issuer(), key, clock, jwtProps.clockSkewSeconds());
    }

    public String mintAccess(TokenSubject subject) {
        return mint(subject, TokenKind.ACCESS, jwtProps.accessTtlSeconds());
    }

    public String mintRefresh(TokenSubject subject) {
        return mint(subject, TokenKind.REFRESH, jwtProps.refreshTtlSeconds());
    }

    /** 로그인/리프레시 공통: 같은 주체로 access + refresh 한 쌍 */
    public TokenPair mintPair(TokenSubject subject) {
        return new TokenPair(mintAccess(subject), mintRefresh(subject));
    }

    /**
     * 서명 + 만료 + 클레임 구조 검증 (종류는 보지 않는다)
     */
    public TokenClaims verify(String token) {
        if (token == null || token.isBlank()) {
            throw new ApiException(ErrorCode.TOKEN_INVALID);
        }

        try {
            Claims claims = parser.parseClaimsJws(token).getBody();
            return toTokenClaims(claims);
        } catch (ExpiredJwtException e) {
            throw new ApiException(ErrorCode.TOKEN_EXPIRED, e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new ApiException(ErrorCode.TOKEN_INVALID, e);
        }
    }

    /**
     * verify + type == refresh
     * - access 토큰을 refresh 자리에 넣으면 TOKEN_INVALID
     */
    public TokenClaims verifyRefresh(String token) {
        TokenClaims claims = verify(token);
        if (claims.kind() != TokenKind.REFRESH) {
            throw new ApiException(ErrorCode.TOKEN_INVALID);
        }
        return claims;
    }

    private String mint(TokenSubject subject, TokenKind kind, long ttlSeconds) {
        if (subject == null) throw new IllegalArgumentException("subject must not be null");

        Instant now = clock.instant().truncatedTo(ChronoUnit.SECONDS);
        Instant exp = now.plusSeconds(ttlSeconds);

        var builder = Jwts.builder()
                .setIssuer(jwtProps.issuer())                       // iss
                .setSubject(String.valueOf(subject.accountId()))    // sub
                .claim(ADMIN_CLAIM, subject.admin())                // admin
                .claim(TYPE_CLAIM, kind.claimValue())               // type
                .setIssuedAt(Date.from(now))                        // iat
                .setExpiration(Date.from(exp));                     // exp

        if (subject.sessionId() != null) {
            builder.claim(SESSION_ID_CLAIM, subject.sessionId());
        }

        return builder.signWith(key, algorithm).compact();
    }

    private static TokenClaims toTokenClaims(Claims claims) {
        Long accountId = parseAccountId(claims.getSubject());

        TokenKind kind = TokenKind.fromClaim(claims.get(TYPE_CLAIM, String.class));
        if (kind == null) {
            throw new JwtException("type claim missing or unknown");
        }

        Boolean admin = claims.get(ADMIN_CLAIM, Boolean.class);
        if (admin == null) {
            throw new JwtException("admin claim missing");
        }

        Date iat = claims.getIssuedAt();
        Date exp = claims.getExpiration();
        if (iat == null || exp == null) {
            throw new JwtException("iat/exp claim missing");
        }

        return new TokenClaims(
                accountId,
                admin,
                claims.get(SESSION_ID_CLAIM, String.class),
                kind,
                iat.toInstant(),
                exp.toInstant()
        );
    }

    // sub -> Long accountId
    private static Long parseAccountId(String sub) {
        if (sub == null || sub.isBlank()) {
            throw new JwtException("subject (accountId) is missing");
        }
        try {
            return Long.valueOf(sub);
        } catch (NumberFormatException e) {
            throw new JwtException("subject is not a valid Long: " + sub, e);
        }
    }

    private static SignatureAlgorithm resolveAlgorithm(String name) {
        SignatureAlgorithm alg;
        try {
            alg = SignatureAlgorithm.forName(name);
        } catch (JwtException e) {
            throw new IllegalStateException("Unsupported JWT algorithm: " + name, e);
        }
        if (!alg.isHmac()) {
            throw new IllegalStateException("JWT algorithm must be HMAC (HS256/HS384/HS512): " + name);
        }
        return alg;
    }

    private static SecretKey buildHmacKey(String secret, SignatureAlgorithm algorithm) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("JWT secret must not be blank");
        }

        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        int minBytes = Math.max(MIN_SECRET_BYTES, algorithm.getMinKeyLength() / 8);
        if (bytes.length < minBytes) {
            throw new IllegalStateException(
                    "JWT secret must be at least " + minBytes + " bytes for " + algorithm.getValue());
        }

        return Keys.hmacShaKeyFor(bytes);
    }

    private static JwtParser buildParser(String issuer, SecretKey key, Clock clock, long clockSkewSeconds) {
        if (issuer == null || issuer.isBlank()) {
            throw new IllegalStateException("JWT issuer must not be blank");
        }

        return Jwts.parserBuilder()
                .requireIssuer(issuer)
                .setSigningKey(key)
                .setAllowedClockSkewSeconds(clockSkewSeconds)
                // JJWT는 Date 기반 clock을 쓰므로 여기서 bridge
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }
}
