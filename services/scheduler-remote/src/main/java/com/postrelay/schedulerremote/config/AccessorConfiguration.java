package com.postrelay.schedulerremote.config;

import com.postrelay.accessor.AmbientAccessorRegistry;
import com.postrelay.accessor.ApiClientFactory;
import com.postrelay.accessor.CredentialScopedClientAccessor;
import com.postrelay.accessor.ThreadAffineStorageAccessor;
import com.postrelay.security.CredentialContext;
import com.postrelay.security.ThreadLocalCredentialContext;
import com.postrelay.storage.StorageHandle;
import com.postrelay.storage.StorageOpener;
import com.postrelay.storage.StoragePathResolver;
import com.postrelay.storage.ThreadAffineHandleCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the request path: the per-request credential slot and the "tools" accessor registry the
 * library's tool handlers read their client and storage from.
 *
 * <p>Accessors are installed while the context starts, before the web server accepts requests.
 */
@Configuration
public class AccessorConfiguration {

    public static final String TOOLS = "tools";

    @Bean
    public ThreadLocalCredentialContext requestCredentialContext() {
        return new ThreadLocalCredentialContext("request");
    }

    @Bean
    @ConditionalOnMissingBean
    public StoragePathResolver storagePathResolver(PublisherProperties properties) {
        String path = properties.storagePath().toString();
        return () -> path;
    }

    @Bean(destroyMethod = "closeAll")
    public ThreadAffineHandleCache<?> toolsHandleCache(StorageOpener<?> storageOpener) {
        return newCache(storageOpener);
    }

    @Bean
    public AmbientAccessorRegistry<?, ?> toolsAccessorRegistry(
            CredentialContext requestCredentialContext,
            ApiClientFactory<?> apiClientFactory,
            ThreadAffineHandleCache<?> toolsHandleCache,
            StoragePathResolver storagePathResolver) {
        return newRegistry(requestCredentialContext, apiClientFactory, toolsHandleCache, storagePathResolver);
    }

    private static <H extends StorageHandle> ThreadAffineHandleCache<H> newCache(StorageOpener<H> opener) {
        return new ThreadAffineHandleCache<>(TOOLS, opener);
    }

    private static <C, H extends StorageHandle> AmbientAccessorRegistry<C, H> newRegistry(
            CredentialContext context,
            ApiClientFactory<C> clientFactory,
            ThreadAffineHandleCache<H> cache,
            StoragePathResolver pathResolver) {
        AmbientAccessorRegistry<C, H> registry = new AmbientAccessorRegistry<>(TOOLS);
        registry.installClientAccessor(new CredentialScopedClientAccessor<>(context, clientFactory));
        registry.installStorageAccessor(new ThreadAffineStorageAccessor<>(cache, pathResolver));
        return registry;
    }
}
