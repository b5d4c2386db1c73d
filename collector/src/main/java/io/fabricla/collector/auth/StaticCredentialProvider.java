package io.fabricla.collector.auth;

import io.fabricla.collector.config.CollectorConfig;
import io.fabricla.collector.config.Settings;
import io.fabricla.collector.error.AuthException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Hands out pre-issued tokens: one per scope when given, else a shared fallback token. Covers the
 * "explicit bearer token" option of the credential chain.
 */
public class StaticCredentialProvider implements CredentialProvider {
    private final Map<String, String> tokensByScope;
    private final String fallback;

    public StaticCredentialProvider(Map<String, String> tokensByScope, String fallback) {
        this.tokensByScope = Map.copyOf(tokensByScope);
        this.fallback = fallback == null || fallback.isBlank() ? null : fallback;
    }

    public static StaticCredentialProvider of(String token) {
        return new StaticCredentialProvider(Map.of(), token);
    }

    /**
     * Reads {@code auth.token} (or {@code FABRICLA_TOKEN}) as the shared token and {@code auth.token.fabric},
     * {@code auth.token.powerbi}, {@code auth.token.ingestion} (or {@code FABRICLA_TOKEN_FABRIC}, ...) per scope.
     */
    public static StaticCredentialProvider fromSettings(Settings settings, CollectorConfig.AuthScopes scopes) {
        Map<String, String> byScope = new HashMap<>();
        token(settings, "fabric").ifPresent(t -> byScope.put(scopes.fabric(), t));
        token(settings, "powerbi").ifPresent(t -> byScope.put(scopes.powerBi(), t));
        token(settings, "ingestion").ifPresent(t -> byScope.put(scopes.ingestion(), t));
        String shared = settings.get("auth.token").or(() -> settings.env("FABRICLA_TOKEN")).orElse(null);
        return new StaticCredentialProvider(byScope, shared);
    }

    private static Optional<String> token(Settings settings, String name) {
        return settings.get("auth.token." + name)
                .or(() -> settings.env("FABRICLA_TOKEN_" + name.toUpperCase(Locale.ROOT)));
    }

    @Override
    public BearerToken getToken(String scope) throws AuthException {
        String t = tokensByScope.getOrDefault(scope, fallback);
        if (t == null || t.isBlank()) {
            throw new AuthException("No token configured for scope " + scope);
        }
        return new BearerToken(t, null);
    }
}
