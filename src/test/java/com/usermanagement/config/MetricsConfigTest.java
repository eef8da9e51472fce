package com.usermanagement.config;

import com.usermanagement.BaseIntegrationTest;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Metrics Configuration Tests")
class MetricsConfigTest extends BaseIntegrationTest {

    @Autowired
    private MeterRegistry meterRegistry;

    @Test
    @DisplayName("Stored users gauge follows creates and deletes")
    void testStoredUsersGauge() throws Exception {
        Gauge gauge = meterRegistry.get(MetricsConfig.STORED_USERS)
                .tag("service", "user-management")
                .gauge();
        assertThat(gauge.value()).isEqualTo(0.0);

        createUser("jane.doe@example.com", "Jane Doe");
        createUser("john.smith@example.com", "John Smith");
        assertThat(gauge.value()).isEqualTo(2.0);

        userRepository.delete(userRepository.list().get(0).getId());
        assertThat(gauge.value()).isEqualTo(1.0);
    }
}
