package com.adminframe.core.action;

import com.adminframe.api.action.ActionScope;
import com.adminframe.api.action.ScopeKind;
import com.adminframe.api.action.ScopeQuery;
import com.adminframe.api.content.ContentType;
import com.adminframe.api.content.ContentTypeId;
import com.adminframe.api.exception.ConfigurationException;
import com.adminframe.api.exception.TokenException;
import com.adminframe.core.support.BlogFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ScopeTokenService 单元测试")
class ScopeTokenServiceTest {

    private static final ContentType POST = new ContentType(new ContentTypeId(1), "blog", "post", "blog.post", false);
    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();

    private ScopeTokenService service(Instant now) {
        return new ScopeTokenService("test-secret", Duration.ofMinutes(5), Clock.fixed(now, ZoneOffset.UTC), mapper);
    }

    @Test
    @DisplayName("签发后可以原样还原范围")
    void roundTrip() {
        ScopeQuery query = new ScopeQuery("hello", "-views", Map.of("status", "draft", "views.gte", "10"));
        String token = service(NOW).issue(POST, ActionScope.ofQuery(query), BlogFixtures.ALICE);

        ScopeTokenPayload payload = service(NOW.plusSeconds(60)).verify(token);

        assertEquals("blog.post", payload.contentType());
        assertEquals("alice", payload.subject());
        assertEquals(ScopeKind.QUERY, payload.scope().kind());
        assertEquals(query, payload.scope().query());
        assertEquals(NOW.getEpochSecond() + 300, payload.expiresAt());
    }

    @Test
    @DisplayName("ids 范围")
    void idsScope() {
        String token = service(NOW).issue(POST, ActionScope.ofIds(List.of("1", "2")), BlogFixtures.ALICE);

        assertEquals(List.of("1", "2"), service(NOW).verify(token).scope().ids());
    }

    @Test
    @DisplayName("到达过期时间即失效")
    void expiresAtBoundary() {
        String token = service(NOW).issue(POST, ActionScope.ofIds(List.of("1")), BlogFixtures.ALICE);

        assertDoesNotThrow(() -> service(NOW.plusSeconds(299)).verify(token));
        assertThrows(TokenException.class, () -> service(NOW.plusSeconds(300)).verify(token));
    }

    @Test
    @DisplayName("篡改载荷或使用其他密钥签名都会被拒绝")
    void tamperedTokenRejected() {
        String token = service(NOW).issue(POST, ActionScope.ofIds(List.of("1")), BlogFixtures.ALICE);
        String forgedBody = service(NOW).issue(POST, ActionScope.ofIds(List.of("1", "2", "3")), BlogFixtures.ALICE)
                .split("\\.")[0];
        String tampered = forgedBody + "." + token.split("\\.")[1];

        assertThrows(TokenException.class, () -> service(NOW).verify(tampered));

        ScopeTokenService other = new ScopeTokenService("other-secret", Duration.ofMinutes(5),
                Clock.fixed(NOW, ZoneOffset.UTC), mapper);
        assertThrows(TokenException.class, () -> other.verify(token));
    }

    @Test
    @DisplayName("格式错误的令牌返回 TokenException")
    void malformedTokenRejected() {
        ScopeTokenService service = service(NOW);

        assertThrows(TokenException.class, () -> service.verify(null));
        assertThrows(TokenException.class, () -> service.verify("no-dot"));
        assertThrows(TokenException.class, () -> service.verify("a.b.c"));
        assertThrows(TokenException.class, () -> service.verify("abc.%%%"));
    }

    @Test
    @DisplayName("空密钥在启动时失败")
    void blankSecretIsConfigurationError() {
        assertThrows(ConfigurationException.class,
                () -> new ScopeTokenService(" ", Duration.ofMinutes(5), Clock.systemUTC(), mapper));
        assertThrows(ConfigurationException.class,
                () -> new ScopeTokenService("s", Duration.ZERO, Clock.systemUTC(), mapper));
    }
}
