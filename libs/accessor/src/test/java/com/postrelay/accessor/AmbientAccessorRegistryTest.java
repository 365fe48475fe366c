package com.postrelay.accessor;

import com.postrelay.security.Credential;
import com.postrelay.security.CredentialContext;
import com.postrelay.security.ThreadLocalCredentialContext;
import com.postrelay.security.UnauthenticatedException;
import com.postrelay.security.testing.TestCredentialFactory;
import com.postrelay.storage.ThreadAffineHandleCache;
import com.postrelay.storage.testing.InMemoryStorageHandle;
import com.postrelay.storage.testing.RecordingStorageOpener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.Callable;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AmbientAccessorRegistry}: loud failure before installation, install-once
 * semantics, and per-request / per-thread resolution once installed.
 */
@DisplayName("AmbientAccessorRegistry")
class AmbientAccessorRegistryTest {

    private AmbientAccessorRegistry<FakeApiClient, InMemoryStorageHandle> registry;

    @BeforeEach
    void setUp() {
        registry = new AmbientAccessorRegistry<>("tools");
    }

    @Nested
    @DisplayName("Before installation")
    class Unconfigured {

        @Test
        @DisplayName("currentClient raises UnauthenticatedException instead of returning a default")
        void clientFailsLoudly() {
            assertThatThrownBy(registry::currentClient)
                    .isInstanceOf(UnauthenticatedException.class)
                    .hasMessageContaining("tools");
            assertThat(registry.isClientAccessorInstalled()).isFalse();
        }

        @Test
        @DisplayName("currentStorage raises AccessorNotInstalledException")
        void storageFailsLoudly() {
            assertThatThrownBy(registry::currentStorage)
                    .isInstanceOf(AccessorNotInstalledException.class)
                    .isInstanceOf(IllegalStateException.class)
                    .satisfies(e -> assertThat(((AccessorNotInstalledException) e).registry()).isEqualTo("tools"));
            assertThat(registry.isStorageAccessorInstalled()).isFalse();
        }
    }

    @Nested
    @DisplayName("Installation")
    class Installation {

        @Test
        @DisplayName("a slot can be installed only once")
        void installOnce() {
            registry.installClientAccessor(() -> null);
            registry.installStorageAccessor(path -> null);

            assertThatThrownBy(() -> registry.installClientAccessor(() -> null))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("already installed");
            assertThatThrownBy(() -> registry.installStorageAccessor(path -> null))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("rejects null accessors")
        void rejectsNull() {
            assertThatThrownBy(() -> registry.installClientAccessor(null))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> registry.installStorageAccessor(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Installed accessors")
    class Installed {

        private ThreadLocalCredentialContext context;
        private RecordingStorageOpener opener;

        @BeforeEach
        void install() {
            context = new ThreadLocalCredentialContext("request");
            opener = new RecordingStorageOpener();
            registry.installClientAccessor(new CredentialScopedClientAccessor<>(context, FakeApiClient::of));
            registry.installStorageAccessor(new ThreadAffineStorageAccessor<>(
                    new ThreadAffineHandleCache<>("request", opener), () -> "data/scheduled_posts.db"));
        }

        @Test
        @DisplayName("currentClient raises UnauthenticatedException outside a request")
        void noCredential() {
            assertThatThrownBy(registry::currentClient).isInstanceOf(UnauthenticatedException.class);
        }

        @Test
        @DisplayName("currentClient acts for the credential in scope")
        void clientForCredential() {
            var credential = TestCredentialFactory.forSubject("alice");

            FakeApiClient client = context.withCredential(credential.accessToken(), credential.subjectId(),
                    registry::currentClient);

            assertThat(client.credential()).isEqualTo(credential);
        }

        @Test
        @DisplayName("currentStorage resolves the default path through the thread's cache")
        void storageDefaultPath() {
            InMemoryStorageHandle handle = registry.currentStorage();

            assertThat(handle.path()).isEqualTo("data/scheduled_posts.db");
            assertThat(registry.currentStorage(null)).isSameAs(handle);
        }

        @Test
        @DisplayName("concurrent requests each receive a client for their own credential")
        void concurrentRequests() throws Exception {
            var alice = TestCredentialFactory.forSubject("alice");
            var bob = TestCredentialFactory.forSubject("bob");
            CyclicBarrier bothInside = new CyclicBarrier(2);

            ExecutorService pool = Executors.newFixedThreadPool(2);
            try {
                Future<Credential> a = pool.submit(asRequest(alice, bothInside));
                Future<Credential> b = pool.submit(asRequest(bob, bothInside));

                assertThat(a.get(5, TimeUnit.SECONDS)).isEqualTo(alice);
                assertThat(b.get(5, TimeUnit.SECONDS)).isEqualTo(bob);
            } finally {
                pool.shutdownNow();
            }
        }

        private Callable<Credential> asRequest(Credential credential, CyclicBarrier bothInside) {
            return () -> {
                try (CredentialContext.Token ignored = context.set(credential)) {
                    bothInside.await(5, TimeUnit.SECONDS);
                    return registry.currentClient().credential();
                }
            };
        }
    }
}
