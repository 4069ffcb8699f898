package com.openforge.toollog.config;

import com.openforge.toollog.provisioning.ControlPlaneConfigurationException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * One named breaker, "controlPlane", guards every call to the database
 * hosting API. No Retry instance is registered: provisioning never retries.
 */
@Configuration
public class Resilience4jConfig {

    public static final String CONTROL_PLANE = "controlPlane";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                // allow 2 trial calls while HALF-OPEN
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                // configuration problems are not outages
                .ignoreExceptions(ControlPlaneConfigurationException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(CONTROL_PLANE);
        return registry;
    }

    @Bean
    public CircuitBreaker controlPlaneCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker(CONTROL_PLANE);
    }
}
