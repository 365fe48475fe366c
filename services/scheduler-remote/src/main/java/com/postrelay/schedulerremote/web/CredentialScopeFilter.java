package com.postrelay.schedulerremote.web;

import com.postrelay.security.Credential;
import com.postrelay.security.CredentialContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the caller's upstream credential for the duration of one request.
 *
 * <p>Runs after the authentication filters, so the verified identity is already on the request.
 * The rest of the chain runs with the credential installed in the request {@link CredentialContext},
 * which is where the "tools" client accessor looks. The previous value is restored on every exit
 * path; Tomcat reuses threads.
 *
 * <p>Requests without a resolvable credential pass through unbound. Anything that then asks for a
 * client fails with {@code UnauthenticatedException} (HTTP 401).
 *
 * <p>Async dispatches are filtered too. A handler resumed on another container thread after
 * {@code startAsync} sees the same credential as the initial dispatch.
 */
public class CredentialScopeFilter extends OncePerRequestFilter
        implements Ordered {

    /** Late in the chain: after Spring Security and any OAuth filters. */
    public static final int ORDER = Ordered.LOWEST_PRECEDENCE - 100;

    private static final Logger log = LoggerFactory.getLogger(CredentialScopeFilter.class);

    private final CredentialContext context;
    private final UpstreamTokenResolver resolver;

    public CredentialScopeFilter(CredentialContext context, UpstreamTokenResolver resolver) {
        this.context = context;
        this.resolver = resolver;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Optional<Credential> credential = resolver.resolve(request);
        if (credential.isEmpty()) {
            log.trace("No upstream credential on {} {}", request.getMethod(), request.getRequestURI());
            filterChain.doFilter(request, response);
            return;
        }

        try (CredentialContext.Token ignored = context.set(credential.get())) {
            filterChain.doFilter(request, response);
        }
    }

    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return false;
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
