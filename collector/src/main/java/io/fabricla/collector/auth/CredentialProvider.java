package io.fabricla.collector.auth;

import io.fabricla.collector.error.AuthException;

/**
 * Resolves a bearer token for an OAuth scope. How it does so (explicit token, service principal, managed identity)
 * is the provider's business.
 */
public interface CredentialProvider {
    BearerToken getToken(String scope) throws AuthException;
}
