package com.usermanagement.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Swagger/OpenAPI Configuration
 * Configures API documentation for the User Management API
 */
@Configuration
public class SwaggerConfig {

    static final String BEARER_SCHEME = "bearerAuth";

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(apiInfo())
                .servers(apiServers())
                .components(new Components()
                        .addSecuritySchemes(BEARER_SCHEME, bearerScheme()));
    }

    /**
     * API information
     */
    private Info apiInfo() {
        return new Info()
                .title("User Management API")
                .description("REST APIs for listing, creating, updating and deleting users. "
                        + "All /api endpoints require a bearer token.")
                .version("v1")
                .contact(new Contact()
                        .name("User Management Team")
                        .email("support@example.com"));
    }

    private SecurityScheme bearerScheme() {
        return new SecurityScheme()
                .type(SecurityScheme.Type.HTTP)
                .scheme("bearer")
                .description("Shared API token");
    }

    /**
     * API servers configuration
     */
    private List<Server> apiServers() {
        Server localServer = new Server()
                .url("http://localhost:" + serverPort)
                .description("Local Development Server");

        return List.of(localServer);
    }
}
