package com.bastion.gateway;

import com.bastion.gateway.config.GatewayProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Validation gateway service.
 *
 * <p>Validates every request twice, once with the legacy validator and once with the
 * zero-trust validator, and answers from the validator the selection policy names. Both outcomes
 * are recorded for the rollout readiness report.
 *
 * <ul>
 *   <li>{@code POST /api/v1/validate} validates a bearer credential for a tenant and resource
 *   <li>{@code GET /api/v1/readiness} evaluates the promotion criteria over a window
 *   <li>{@code GET /api/v1/gateway/metrics} exposes cache, recorder and translation counters
 *   <li>{@code POST /api/v1/credentials/revocations} drops cached decisions of revoked credentials
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(GatewayProperties.class)
public class ValidationGatewayApplication {

    private static final Logger log = LoggerFactory.getLogger(ValidationGatewayApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(ValidationGatewayApplication.class, args);
        log.info("Bastion validation gateway started");
    }
}
