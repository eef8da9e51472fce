package com.usermanagement.config;

import com.usermanagement.security.AuthenticationProperties;
import com.usermanagement.security.ConfiguredTokenValidator;
import com.usermanagement.security.TokenValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Builds the token validator once at startup
 */
@Slf4j
@Configuration
public class AuthenticationConfig {

    @Bean
    public TokenValidator tokenValidator(AuthenticationProperties properties) {
        ConfiguredTokenValidator validator = ConfiguredTokenValidator.fromProperties(properties);
        if (validator.hasConfiguredTokens()) {
            log.info("Bearer authentication enabled with {} token(s)", validator.size());
        } else {
            log.warn("No authentication tokens configured; every API request will be rejected. "
                    + "Set authentication.token or authentication.tokens.");
        }
        return validator;
    }
}
