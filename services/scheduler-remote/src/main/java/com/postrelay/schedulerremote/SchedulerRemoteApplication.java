package com.postrelay.schedulerremote;

import com.postrelay.schedulerremote.config.AuthProperties;
import com.postrelay.schedulerremote.config.PublisherProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * The remote scheduler process.
 *
 * <p>Serves many authenticated users at once. Each request runs with its caller's credential bound
 * by {@link com.postrelay.schedulerremote.web.CredentialScopeFilter}; a background publisher daemon
 * publishes due posts with a credential taken from the token store.
 *
 * <p>The scheduling library contributes the collaborator beans this module wires:
 * {@code ApiClientFactory}, {@code StorageOpener}, {@code SchedulingCycle} and
 * {@code CredentialStore}.
 */
@SpringBootApplication
@EnableConfigurationProperties({PublisherProperties.class, AuthProperties.class})
public class SchedulerRemoteApplication {

    private static final Logger log = LoggerFactory.getLogger(SchedulerRemoteApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(SchedulerRemoteApplication.class, args);
        log.info("PostRelay scheduler remote started");
    }
}
