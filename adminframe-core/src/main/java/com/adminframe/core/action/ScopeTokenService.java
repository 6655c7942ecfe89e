package com.adminframe.core.action;

import com.adminframe.api.action.ActionScope;
import com.adminframe.api.content.ContentType;
import com.adminframe.api.exception.ConfigurationException;
import com.adminframe.api.exception.TokenException;
import com.adminframe.api.security.AdminUser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;
import java.util.Base64;

/**
 * 范围令牌签发与校验
 * <p>
 * 令牌格式：base64url(JSON 载荷) + "." + base64url(HMAC-SHA256(载荷段))。
 * 校验是纯函数：签名、格式、过期任一不符都抛出 {@link TokenException}。
 *
 * @author AdminFrame
 */
@Slf4j
public class ScopeTokenService {

    private static final String ALGORITHM = "HmacSHA256";
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final SecretKeySpec key;
    private final Duration ttl;
    private final Clock clock;
    private final ObjectMapper mapper;

    public ScopeTokenService(String secret, Duration ttl, Clock clock, ObjectMapper mapper) {
        if (secret == null || secret.isBlank()) {
            throw new ConfigurationException("Scope token secret must not be blank");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new ConfigurationException("Scope token TTL must be positive");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
        this.ttl = ttl;
        this.clock = clock;
        this.mapper = mapper;
    }

    public String issue(ContentType contentType, ActionScope scope, AdminUser subject) {
        long now = clock.instant().getEpochSecond();
        ScopeTokenPayload payload = new ScopeTokenPayload(
                contentType.dottedName(), scope, subject.id(), now, now + ttl.toSeconds());
        try {
            String body = ENCODER.encodeToString(mapper.writeValueAsBytes(payload));
            return body + "." + ENCODER.encodeToString(sign(body));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize scope token payload", e);
        }
    }

    public ScopeTokenPayload verify(String token) {
        if (token == null || token.isBlank()) {
            throw new TokenException("Missing scope token");
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot != token.lastIndexOf('.') || dot == token.length() - 1) {
            throw new TokenException("Malformed scope token");
        }
        String body = token.substring(0, dot);

        byte[] signature;
        try {
            signature = DECODER.decode(token.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            throw new TokenException("Malformed scope token");
        }
        if (!MessageDigest.isEqual(sign(body), signature)) {
            log.warn("[AdminFrame] Rejected scope token with invalid signature");
            throw new TokenException("Invalid scope token signature");
        }

        ScopeTokenPayload payload;
        try {
            payload = mapper.readValue(DECODER.decode(body), ScopeTokenPayload.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new TokenException("Malformed scope token");
        }
        if (payload.contentType() == null || payload.scope() == null || payload.scope().kind() == null) {
            throw new TokenException("Malformed scope token");
        }
        if (clock.instant().getEpochSecond() >= payload.expiresAt()) {
            throw new TokenException("Scope token expired");
        }
        return payload;
    }

    private byte[] sign(String body) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(key);
            return mac.doFinal(body.getBytes(StandardCharsets.US_ASCII));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to compute scope token signature", e);
        }
    }
}
