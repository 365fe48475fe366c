package com.postrelay.security;

import com.postrelay.security.testing.TestCredentialFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ThreadLocalCredentialContext}: set/reset/get lifecycle, token discipline,
 * restoration on error, isolation between concurrent requests, MDC bridge and hand-off.
 */
@DisplayName("ThreadLocalCredentialContext")
class ThreadLocalCredentialContextTest {

    private final ThreadLocalCredentialContext context = new ThreadLocalCredentialContext("request");

    @AfterEach
    void cleanup() {
        MDC.clear();
    }

    @Nested
    @DisplayName("set/get/reset lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("returns empty when nothing is set")
        void emptyByDefault() {
            assertThat(context.get()).isEmpty();
        }

        @Test
        @DisplayName("get observes the value just set")
        void getAfterSet() {
            var credential = TestCredentialFactory.forSubject("alice");

            CredentialContext.Token token = context.set(credential);
            try {
                assertThat(context.get()).contains(credential);
            } finally {
                context.reset(token);
            }
            assertThat(context.get()).isEmpty();
        }

        @Test
        @DisplayName("nested set reverts exactly to the outer value")
        void nestedRevert() {
            var outer = TestCredentialFactory.forSubject("outer");
            var inner = TestCredentialFactory.forSubject("inner");

            try (CredentialContext.Token outerToken = context.set(outer)) {
                try (CredentialContext.Token innerToken = context.set(inner)) {
                    assertThat(context.get()).contains(inner);
                    assertThat(innerToken.previous()).contains(outer);
                }
                assertThat(context.get()).contains(outer);
                assertThat(outerToken.previous()).isEmpty();
            }
            assertThat(context.get()).isEmpty();
        }

        @Test
        @DisplayName("rejects null credential")
        void rejectsNull() {
            assertThatThrownBy(() -> context.set(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("require throws UnauthenticatedException when nothing is set")
        void requireWithoutCredential() {
            assertThatThrownBy(context::require)
                    .isInstanceOf(UnauthenticatedException.class)
                    .hasMessageContaining("No credential");
        }
    }

    @Nested
    @DisplayName("Token discipline")
    class TokenDiscipline {

        @Test
        @DisplayName("a token can only be reset once")
        void singleUse() {
            CredentialContext.Token token = context.set(TestCredentialFactory.create());
            context.reset(token);

            assertThatThrownBy(() -> context.reset(token))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already been used");
        }

        @Test
        @DisplayName("a token from another context is rejected")
        void foreignToken() {
            var other = new ThreadLocalCredentialContext("publisher");
            CredentialContext.Token foreign = other.set(TestCredentialFactory.create());
            try {
                assertThatThrownBy(() -> context.reset(foreign))
                        .isInstanceOf(IllegalArgumentException.class)
                        .hasMessageContaining("request");
            } finally {
                other.reset(foreign);
            }
        }

        @Test
        @DisplayName("a token cannot be reset from another thread")
        void otherThread() throws Exception {
            CredentialContext.Token token = context.set(TestCredentialFactory.create());
            AtomicReference<Throwable> failure = new AtomicReference<>();

            Thread other = new Thread(() -> {
                try {
                    context.reset(token);
                } catch (Throwable t) {
                    failure.set(t);
                }
            });
            other.start();
            other.join();

            assertThat(failure.get()).isInstanceOf(IllegalStateException.class);
            context.reset(token);
            assertThat(context.get()).isEmpty();
        }
    }

    @Nested
    @DisplayName("withCredential")
    class WithCredential {

        @Test
        @DisplayName("installs the credential for the body only")
        void scopedToBody() {
            AtomicReference<Optional<Credential>> seen = new AtomicReference<>();

            context.withCredential("AQXd-token", "urn:li:person:7", () -> seen.set(context.get()));

            assertThat(seen.get()).contains(new Credential("AQXd-token", "urn:li:person:7"));
            assertThat(context.get()).isEmpty();
        }

        @Test
        @DisplayName("restores the prior value when the body throws")
        void restoresOnError() {
            var prior = TestCredentialFactory.forSubject("prior");

            try (CredentialContext.Token ignored = context.set(prior)) {
                assertThatThrownBy(() -> context.withCredential("AQXd-token", null, (Runnable) () -> {
                    throw new IllegalStateException("boom");
                })).isInstanceOf(IllegalStateException.class).hasMessage("boom");

                assertThat(context.get()).contains(prior);
            }
        }

        @Test
        @DisplayName("returns the body's value")
        void returnsValue() {
            String subject = context.withCredential("AQXd-token", "bob",
                    () -> context.require().subjectId());

            assertThat(subject).isEqualTo("bob");
        }

        @Test
        @DisplayName("callWithCredential propagates checked exceptions and restores")
        void callPropagatesChecked() {
            assertThatThrownBy(() -> context.callWithCredential(TestCredentialFactory.create(), () -> {
                throw new IOException("disk");
            })).isInstanceOf(IOException.class);

            assertThat(context.get()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Isolation between concurrent requests")
    class Isolation {

        @Test
        @DisplayName("two interleaved requests observe only their own credential")
        void interleavedRequests() throws Exception {
            var alice = TestCredentialFactory.forSubject("alice");
            var bob = TestCredentialFactory.forSubject("bob");
            CyclicBarrier bothSet = new CyclicBarrier(2);
            CyclicBarrier oneReset = new CyclicBarrier(2);

            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<List<Optional<Credential>>> a = pool.submit(request(alice, bothSet, oneReset, true));
                Future<List<Optional<Credential>>> b = pool.submit(request(bob, bothSet, oneReset, false));

                assertThat(a.get(5, TimeUnit.SECONDS))
                        .containsExactly(Optional.of(alice), Optional.empty());
                assertThat(b.get(5, TimeUnit.SECONDS))
                        .containsExactly(Optional.of(bob), Optional.of(bob), Optional.empty());
            } finally {
                pool.shutdownNow();
            }
        }

        private Callable<List<Optional<Credential>>> request(
                Credential credential, CyclicBarrier bothSet, CyclicBarrier oneReset, boolean resetsFirst) {
            return () -> {
                List<Optional<Credential>> observed = new ArrayList<>();
                CredentialContext.Token token = context.set(credential);
                bothSet.await(5, TimeUnit.SECONDS);
                observed.add(context.get());
                if (resetsFirst) {
                    context.reset(token);
                    observed.add(context.get());
                    oneReset.await(5, TimeUnit.SECONDS);
                } else {
                    oneReset.await(5, TimeUnit.SECONDS);
                    observed.add(context.get());
                    context.reset(token);
                    observed.add(context.get());
                }
                return observed;
            };
        }

        @Test
        @DisplayName("a fresh thread starts without the caller's credential")
        void freshThreadIsEmpty() throws Exception {
            AtomicReference<Optional<Credential>> seen = new AtomicReference<>();
            try (CredentialContext.Token ignored = context.set(TestCredentialFactory.create())) {
                Thread other = new Thread(() -> seen.set(context.get()));
                other.start();
                other.join();
            }
            assertThat(seen.get()).isEmpty();
        }

        @Test
        @DisplayName("separate instances on the same thread are independent")
        void separateInstances() {
            var publisher = new ThreadLocalCredentialContext("publisher");
            try (CredentialContext.Token ignored = context.set(TestCredentialFactory.create())) {
                assertThat(publisher.get()).isEmpty();
            }
        }
    }

    @Nested
    @DisplayName("Scoped values")
    class ScopedValues {

        @Test
        @DisplayName("computes once per scope from the scope's credential")
        void memoizedWithinScope() {
            var credential = TestCredentialFactory.forSubject("alice");

            try (CredentialContext.Token ignored = context.set(credential)) {
                Object first = context.scoped("client", c -> new Object[] {c});
                Object second = context.scoped("client", c -> new Object[] {c});

                assertThat(second).isSameAs(first);
                assertThat(((Object[]) first)[0]).isSameAs(credential);
            }
        }

        @Test
        @DisplayName("drops values when the scope ends, so equal credentials in later requests start fresh")
        void droppedOnReset() {
            Object first = context.withCredential("secret-token-A", "alice",
                    () -> context.scoped("client", c -> new Object()));
            Object second = context.withCredential("secret-token-A", "alice",
                    () -> context.scoped("client", c -> new Object()));

            assertThat(second).isNotSameAs(first);
            assertThatThrownBy(() -> context.scoped("client", c -> new Object()))
                    .isInstanceOf(UnauthenticatedException.class);
        }

        @Test
        @DisplayName("a nested scope starts empty and the outer value returns after it ends")
        void nestedScopes() {
            try (CredentialContext.Token outer = context.set(TestCredentialFactory.forSubject("alice"))) {
                Object outerValue = context.scoped("client", c -> new Object());

                try (CredentialContext.Token inner = context.set(TestCredentialFactory.forSubject("bob"))) {
                    assertThat(context.<Object>scoped("client", c -> new Object())).isNotSameAs(outerValue);
                }

                assertThat(context.<Object>scoped("client", c -> new Object())).isSameAs(outerValue);
            }
        }

        @Test
        @DisplayName("a null result is not kept")
        void nullNotKept() {
            try (CredentialContext.Token ignored = context.set(TestCredentialFactory.create())) {
                assertThat((Object) context.scoped("client", c -> null)).isNull();
                assertThat(context.<String>scoped("client", c -> "built")).isEqualTo("built");
            }
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("publishes the subject id, never the token, and restores on reset")
        void publishesSubject() {
            var credential = new Credential("AQXd-secret-token", "urn:li:person:9");

            try (CredentialContext.Token ignored = context.set(credential)) {
                assertThat(MDC.get(ThreadLocalCredentialContext.MDC_SUBJECT_ID)).isEqualTo("urn:li:person:9");
                assertThat(MDC.getCopyOfContextMap().values()).doesNotContain("AQXd-secret-token");
            }
            assertThat(MDC.get(ThreadLocalCredentialContext.MDC_SUBJECT_ID)).isNull();
        }
    }

    @Nested
    @DisplayName("Hand-off to other threads")
    class HandOff {

        @Test
        @DisplayName("wrap carries the caller's credential to the executing thread")
        void wrapCarriesCredential() throws Exception {
            var credential = TestCredentialFactory.forSubject("carol");
            ExecutorService pool = Executors.newSingleThreadExecutor();
            try {
                Callable<Optional<Credential>> task;
                try (CredentialContext.Token ignored = context.set(credential)) {
                    task = context.wrap((Callable<Optional<Credential>>) context::get);
                }
                assertThat(pool.submit(task).get(5, TimeUnit.SECONDS)).contains(credential);
                assertThat(pool.submit(() -> context.get()).get(5, TimeUnit.SECONDS)).isEmpty();
            } finally {
                pool.shutdownNow();
            }
        }

        @Test
        @DisplayName("wrap of an unauthenticated caller hides the worker's own value")
        void wrapOfEmptyCaller() {
            Runnable wrapped = context.wrap((Runnable) () -> assertThat(context.get()).isEmpty());
            var workerValue = TestCredentialFactory.forSubject("worker");

            try (CredentialContext.Token ignored = context.set(workerValue)) {
                wrapped.run();
                assertThat(context.get()).contains(workerValue);
            }
        }

        @Test
        @DisplayName("propagating executor wraps every task")
        void propagatingExecutor() throws Exception {
            var credential = TestCredentialFactory.forSubject("dave");
            ExecutorService pool = Executors.newSingleThreadExecutor();
            AtomicReference<Optional<Credential>> seen = new AtomicReference<>();
            CountDownLatch done = new CountDownLatch(1);
            try (CredentialContext.Token ignored = context.set(credential)) {
                context.propagating(pool).execute(() -> {
                    seen.set(context.get());
                    done.countDown();
                });
            }
            try {
                assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
                assertThat(seen.get()).contains(credential);
            } finally {
                pool.shutdownNow();
            }
        }
    }
}
