package io.fabricla.collector.auth;

import io.fabricla.collector.config.CollectorConfig;
import io.fabricla.collector.config.Settings;
import io.fabricla.collector.error.AuthException;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class TokenSessionTest {
    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    @Test
    void concurrent_refreshes_of_the_same_stale_token_call_provider_once() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CredentialProvider provider = scope -> new BearerToken("t" + calls.incrementAndGet(), null);
        TokenSession session = TokenSession.open(provider, "scope", CLOCK);
        BearerToken stale = session.current();

        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<BearerToken>> results = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            results.add(pool.submit(() -> {
                go.await();
                return session.refresh(stale);
            }));
        }
        go.countDown();
        for (Future<BearerToken> f : results) assertEquals("t2", f.get(5, TimeUnit.SECONDS).value());
        pool.shutdown();

        assertEquals(2, calls.get());
        assertEquals(1, session.refreshCount());
    }

    @Test
    void token_close_to_expiry_is_refreshed_before_use() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        CredentialProvider provider = scope -> calls.incrementAndGet() == 1
                ? new BearerToken("old", CLOCK.instant().plusSeconds(30))
                : new BearerToken("new", CLOCK.instant().plusSeconds(3600));
        TokenSession session = TokenSession.open(provider, "scope", CLOCK);

        assertEquals("new", session.current().value());
        assertEquals("new", session.current().value());
        assertEquals(2, calls.get());
    }

    @Test
    void static_provider_prefers_scope_token_and_fails_without_any() throws Exception {
        StaticCredentialProvider p = new StaticCredentialProvider(Map.of("scope-a", "A"), "shared");
        assertEquals("A", p.getToken("scope-a").value());
        assertEquals("shared", p.getToken("scope-b").value());
        assertThrows(AuthException.class, () -> new StaticCredentialProvider(Map.of(), null).getToken("x"));
        assertFalse(p.getToken("scope-b").toString().contains("shared"));
    }

    @Test
    void static_provider_reads_tokens_from_settings_and_environment() throws Exception {
        Properties file = new Properties();
        file.setProperty("auth.token.powerbi", "from-file");
        Settings settings = new Settings(file, new Properties(), Map.of("FABRICLA_TOKEN", "shared", "FABRICLA_TOKEN_INGESTION", "ing"));
        CollectorConfig.AuthScopes scopes = CollectorConfig.AuthScopes.DEFAULT;

        StaticCredentialProvider p = StaticCredentialProvider.fromSettings(settings, scopes);
        assertEquals("from-file", p.getToken(scopes.powerBi()).value());
        assertEquals("ing", p.getToken(scopes.ingestion()).value());
        assertEquals("shared", p.getToken(scopes.fabric()).value());
    }
}
