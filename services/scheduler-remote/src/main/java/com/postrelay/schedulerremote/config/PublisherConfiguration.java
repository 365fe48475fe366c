package com.postrelay.schedulerremote.config;

import com.postrelay.accessor.AmbientAccessorRegistry;
import com.postrelay.accessor.ApiClientFactory;
import com.postrelay.publisher.CredentialStore;
import com.postrelay.publisher.DaemonSettings;
import com.postrelay.publisher.PublisherDaemon;
import com.postrelay.publisher.SchedulingCycle;
import com.postrelay.publisher.StartupCheck;
import com.postrelay.storage.StorageHandle;
import com.postrelay.storage.StorageOpener;
import com.postrelay.storage.StoragePathResolver;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the publisher path: its own accessor registry and the daemon that fills it.
 *
 * <p>The daemon owns a credential slot and handle cache separate from the request path's. It is
 * started and stopped by {@link PublisherLifecycle}.
 */
@Configuration
public class PublisherConfiguration {

    public static final String PUBLISHER = "publisher";

    /**
     * Empty until the daemon is constructed, which installs its accessors.
     */
    @Bean
    public AmbientAccessorRegistry<?, ?> publisherAccessorRegistry() {
        return new AmbientAccessorRegistry<>(PUBLISHER);
    }

    @Bean
    public Tracer publisherTracer() {
        return GlobalOpenTelemetry.getTracer("com.postrelay.publisher");
    }

    @Bean(destroyMethod = "stop")
    public PublisherDaemon<?, ?> publisherDaemon(
            PublisherProperties properties,
            CredentialStore credentialStore,
            SchedulingCycle schedulingCycle,
            @Qualifier("publisherAccessorRegistry") AmbientAccessorRegistry<?, ?> publisherAccessorRegistry,
            ApiClientFactory<?> apiClientFactory,
            StorageOpener<?> storageOpener,
            StoragePathResolver storagePathResolver,
            MeterRegistry meterRegistry,
            @Qualifier("publisherTracer") Tracer publisherTracer) {
        return newDaemon(
                properties.toDaemonSettings(),
                credentialStore,
                schedulingCycle,
                publisherAccessorRegistry,
                apiClientFactory,
                storageOpener,
                storagePathResolver,
                StartupCheck.writableDirectory(properties.dataPath()),
                meterRegistry,
                publisherTracer);
    }

    @Bean
    public PublisherLifecycle publisherLifecycle(PublisherDaemon<?, ?> publisherDaemon, PublisherProperties properties) {
        return new PublisherLifecycle(publisherDaemon, properties.enabled());
    }

    // The registry bean is declared with wildcards; the library reads it back with its own types.
    @SuppressWarnings("unchecked")
    private static <C, H extends StorageHandle> PublisherDaemon<C, H> newDaemon(
            DaemonSettings settings,
            CredentialStore credentialStore,
            SchedulingCycle cycle,
            AmbientAccessorRegistry<?, ?> registry,
            ApiClientFactory<C> clientFactory,
            StorageOpener<H> storageOpener,
            StoragePathResolver pathResolver,
            StartupCheck startupCheck,
            MeterRegistry meterRegistry,
            Tracer tracer) {
        return new PublisherDaemon<>(
                settings,
                credentialStore,
                cycle,
                (AmbientAccessorRegistry<C, H>) registry,
                clientFactory,
                storageOpener,
                pathResolver,
                startupCheck,
                meterRegistry,
                tracer);
    }
}
