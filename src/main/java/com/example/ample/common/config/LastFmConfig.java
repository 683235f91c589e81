package com.example.ample.common.config;

import com.example.ample.application.service.LastFmCredentialResolver;
import com.example.ample.application.service.ScrobbleDispatcher;
import com.example.ample.common.exception.ScrobblerException;
import com.example.ample.domain.model.LastFmCredentials;
import com.example.ample.infrastructure.lastfm.HttpLastFmClient;
import com.example.ample.infrastructure.lastfm.LastFmTransport;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.ExecutorService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

/**
 * Bootstraps the LastFM session at startup. When that fails the application keeps running with a
 * dispatcher that drops every action.
 */
@Configuration
@Profile("!provision")
public class LastFmConfig {

    private static final Logger log = LoggerFactory.getLogger(LastFmConfig.class);

    @Bean
    public ScrobbleDispatcher scrobbleDispatcher(LastFmCredentialResolver credentialResolver,
                                                 LastFmTransport lastFmTransport,
                                                 AppLastFmProperties appLastFmProperties,
                                                 ExecutorService lastFmDispatchExecutor,
                                                 ObjectProvider<MeterRegistry> meterRegistryProvider) {
        HttpLastFmClient client = null;
        try {
            LastFmCredentials credentials = credentialResolver.resolve(
                    appLastFmProperties.getBootstrapAttempts(), appLastFmProperties.getBootstrapBackoffMs());
            client = new HttpLastFmClient(lastFmTransport, credentials);
            log.info("LastFM support enabled, credentials={}", credentials);
        } catch (ScrobblerException e) {
            log.error("LastFM support not enabled: {}", e.toString());
        }
        return new ScrobbleDispatcher(lastFmDispatchExecutor, client, meterRegistryProvider);
    }
}
