package com.postrelay.security;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Slot holding the {@link Credential} of the logical request currently executing.
 *
 * <p>WHY an interface: library code reaches the caller's identity through an accessor that takes
 * no arguments. Behind that accessor sits one of these objects instead of a global variable, so
 * two concurrent requests never see each other's credential, and tests can substitute a fixed
 * value (see {@code com.postrelay.security.testing.FixedCredentialContext}).
 *
 * <p>Every {@link #set} must be paired with a {@link #reset} of the returned token on every exit
 * path. The usual form is try-with-resources:
 *
 * <pre>{@code
 * try (CredentialContext.Token ignored = context.set(credential)) {
 *     library.schedulePost(request);
 * }
 * }</pre>
 *
 * or one of the {@code withCredential} helpers, which do the same.
 */
public interface CredentialContext {

    /**
     * Installs {@code credential} as current for the calling logical request.
     *
     * @param credential the credential to install (must not be null)
     * @return a token capturing the previous value; reset it to restore
     */
    Token set(Credential credential);

    /**
     * Restores the value captured by {@code token}. A token can be reset exactly once.
     *
     * @param token the token returned by {@link #set}
     * @throws IllegalArgumentException if the token was issued by another context
     * @throws IllegalStateException    if the token was already used, or is reset on a thread
     *                                  other than the one that created it
     */
    void reset(Token token);

    /**
     * Returns the credential installed for the calling logical request, if any.
     */
    Optional<Credential> get();

    /**
     * Returns the value kept under {@code key} in the current credential scope, computing it from
     * the scope's credential on first use. Values live exactly as long as the scope: the
     * {@link #reset} that ends it discards them together with the credential. A nested
     * {@link #set} starts with no values.
     *
     * @param key     identifies the value within the scope
     * @param factory computes the value; a null result is not kept
     * @throws UnauthenticatedException if no credential is installed
     */
    <T> T scoped(Object key, Function<Credential, T> factory);

    /**
     * Returns the current credential or fails.
     *
     * @throws UnauthenticatedException if no credential is installed
     */
    default Credential require() {
        return get().orElseThrow(() -> new UnauthenticatedException(
                "No credential in scope for this request; is OAuth configured?"));
    }

    /**
     * Runs {@code body} with a credential built from {@code accessToken} and {@code subjectId},
     * restoring the previous value afterwards, even if {@code body} throws.
     */
    default void withCredential(String accessToken, String subjectId, Runnable body) {
        try (Token ignored = set(new Credential(accessToken, subjectId))) {
            body.run();
        }
    }

    /**
     * Value-returning form of {@link #withCredential(String, String, Runnable)}.
     */
    default <T> T withCredential(String accessToken, String subjectId, Supplier<T> body) {
        try (Token ignored = set(new Credential(accessToken, subjectId))) {
            return body.get();
        }
    }

    /**
     * Runs {@code body} with {@code credential} installed, propagating checked exceptions.
     */
    default <T> T callWithCredential(Credential credential, Callable<T> body) throws Exception {
        try (Token ignored = set(credential)) {
            return body.call();
        }
    }

    /**
     * Opaque handle on the value that was current before a {@link #set}. Closing it resets the
     * owning context.
     */
    interface Token extends AutoCloseable {

        /**
         * The value that was current before the {@code set} that produced this token.
         */
        Optional<Credential> previous();

        /**
         * Resets the owning context to {@link #previous()}.
         */
        @Override
        void close();
    }
}
