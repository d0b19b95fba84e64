package com.sandy.fleet.view.config;

import com.sandy.fleet.view.transport.CallCredentials;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Static bearer token from configuration. Deployments that refresh tokens replace this bean.
 */
@Configuration
@Slf4j
public class CredentialsConfig {

    @Bean
    public CallCredentials callCredentials(@Value("${fleet.auth.token:}") String token) {
        if (token.isBlank()) {
            log.warn("No fleet.auth.token configured, calls are sent without Authorization header");
        }
        return () -> token;
    }
}
