/**
 * Ambient accessors of the PostRelay platform.
 *
 * <p>The scheduling library asks for "the current client" and "the current storage" without
 * saying who is asking. An {@link com.postrelay.accessor.AmbientAccessorRegistry} answers those
 * calls with {@link com.postrelay.accessor.CredentialScopedClientAccessor} (request-scoped
 * identity) and {@link com.postrelay.accessor.ThreadAffineStorageAccessor} (thread-confined
 * handles).
 */
package com.postrelay.accessor;
