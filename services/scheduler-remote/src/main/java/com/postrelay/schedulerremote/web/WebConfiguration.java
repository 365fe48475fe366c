package com.postrelay.schedulerremote.web;

import com.postrelay.schedulerremote.config.AuthProperties;
import com.postrelay.security.CredentialContext;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Request-binding beans. An OAuth layer that keeps the upstream token elsewhere replaces the
 * resolver with its own {@link UpstreamTokenResolver} bean.
 */
@Configuration
public class WebConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public UpstreamTokenResolver upstreamTokenResolver(AuthProperties properties) {
        return new RequestAttributeTokenResolver(properties);
    }

    @Bean
    public CredentialScopeFilter credentialScopeFilter(
            CredentialContext requestCredentialContext, UpstreamTokenResolver upstreamTokenResolver) {
        return new CredentialScopeFilter(requestCredentialContext, upstreamTokenResolver);
    }
}
