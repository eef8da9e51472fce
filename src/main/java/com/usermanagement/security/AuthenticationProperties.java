package com.usermanagement.security;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Bearer token settings.
 * <p>
 * Both settings are combined at startup. Tokens should come from the environment,
 * e.g. {@code AUTHENTICATION_TOKEN} or {@code AUTHENTICATION_TOKENS_0}.
 */
@Data
@ConfigurationProperties(prefix = "authentication")
public class AuthenticationProperties {

    /**
     * Single accepted token
     */
    private String token;

    /**
     * Additional accepted tokens
     */
    private List<String> tokens = new ArrayList<>();
}
