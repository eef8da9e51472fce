package com.usermanagement.config;

import com.usermanagement.repository.UserRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for Prometheus monitoring
 * Publishes the size of the user store, tagged with the service and store names
 */
@Slf4j
@Configuration
public class MetricsConfig {

    static final String STORED_USERS = "users.stored";

    @Value("${spring.application.name:user-management}")
    private String applicationName;

    /**
     * Gauge over the live user count, read on every scrape
     */
    @Bean
    public MeterBinder storedUsersGauge(UserRepository userRepository) {
        Tags tags = Tags.of("service", applicationName,
                "store", userRepository.getClass().getSimpleName());
        return registry -> {
            Gauge.builder(STORED_USERS, userRepository, UserRepository::count)
                    .description("Number of users currently held by the repository")
                    .tags(tags)
                    .register(registry);
            log.info("Registered gauge {} with tags {}", STORED_USERS, tags);
        };
    }
}
