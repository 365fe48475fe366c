package com.postrelay.accessor;

import com.postrelay.security.Credential;
import com.postrelay.security.CredentialContext;
import com.postrelay.security.UnauthenticatedException;

/**
 * Client accessor that answers with a client built for the credential in scope.
 * <p>
 * The client is kept in the credential's scope ({@link CredentialContext#scoped}): repeated calls
 * within one request or daemon cycle reuse it, and it is discarded with the credential when the
 * scope is reset. A client is therefore never shared between credentials and never outlives its
 * request on a pooled thread.
 *
 * @param <C> the library's client type
 */
public final class CredentialScopedClientAccessor<C> implements ClientAccessor<C> {

    private final CredentialContext context;
    private final ApiClientFactory<C> factory;

    public CredentialScopedClientAccessor(CredentialContext context, ApiClientFactory<C> factory) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory must not be null");
        }
        this.context = context;
        this.factory = factory;
    }

    /**
     * @throws UnauthenticatedException if no credential is in scope
     */
    @Override
    public C currentClient() {
        Credential credential = context.get().orElseThrow(() -> new UnauthenticatedException(
                "No API client for this request: no credential in scope; is OAuth configured?"));
        C client = context.scoped(this, factory::create);
        if (client == null) {
            throw new IllegalStateException("client factory returned no client for " + credential);
        }
        return client;
    }
}
