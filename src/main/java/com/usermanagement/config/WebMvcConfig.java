package com.usermanagement.config;

import com.usermanagement.interceptor.BearerTokenInterceptor;
import com.usermanagement.interceptor.RequestLoggingInterceptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration for registering interceptors
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Autowired
    private RequestLoggingInterceptor requestLoggingInterceptor;

    @Autowired
    private BearerTokenInterceptor bearerTokenInterceptor;

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        // Registered first so rejected requests are logged too
        registry.addInterceptor(requestLoggingInterceptor);

        registry.addInterceptor(bearerTokenInterceptor)
                .addPathPatterns("/api/**")
                .excludePathPatterns(
                    "/v3/api-docs/**",        // Exclude OpenAPI docs
                    "/swagger-ui/**",         // Exclude Swagger UI
                    "/swagger-ui.html"        // Exclude Swagger UI
                );
    }
}
