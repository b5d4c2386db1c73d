package io.fabricla.collector.auth;

import io.fabricla.collector.error.AuthException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Run-scoped holder of one scope's token, shared read-only by all workers. Refresh is single-flight: a caller
 * hands back the token that was rejected, and only if that token is still current does the provider get called;
 * everyone else picks up the already-refreshed token.
 */
public class TokenSession {
    private static final Logger log = LoggerFactory.getLogger(TokenSession.class);
    static final Duration EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final CredentialProvider provider;
    private final String scope;
    private final Clock clock;
    private volatile BearerToken current;
    private int refreshes;

    private TokenSession(CredentialProvider provider, String scope, Clock clock, BearerToken initial) {
        this.provider = provider;
        this.scope = scope;
        this.clock = clock;
        this.current = initial;
    }

    /** Acquires the initial token; failure here is fatal for the run. */
    public static TokenSession open(CredentialProvider provider, String scope, Clock clock) throws AuthException {
        BearerToken t = provider.getToken(scope);
        log.debug("Acquired token for scope {}", scope);
        return new TokenSession(provider, scope, clock, t);
    }

    /** The token to use now, refreshed first when it is about to expire. */
    public BearerToken current() throws AuthException {
        BearerToken t = current;
        if (t.expiresWithin(EXPIRY_MARGIN, clock.instant())) {
            return refresh(t);
        }
        return t;
    }

    /** Replaces {@code stale} with a fresh token unless another caller already did. */
    public synchronized BearerToken refresh(BearerToken stale) throws AuthException {
        if (current != stale) return current;
        log.info("Refreshing token for scope {}", scope);
        current = provider.getToken(scope);
        refreshes++;
        return current;
    }

    public synchronized int refreshCount() { return refreshes; }
}
