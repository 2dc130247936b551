package com.bastion.gateway.infrastructure.health;

import com.bastion.validation.store.CredentialStore;
import com.bastion.validation.store.StoreUnavailableException;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports DOWN when the credential store cannot be reached. Both validators depend on it.
 */
@Component
public class CredentialStoreHealthIndicator implements HealthIndicator {

    private final CredentialStore store;

    public CredentialStoreHealthIndicator(CredentialStore store) {
        this.store = store;
    }

    @Override
    public Health health() {
        try {
            return store.ping() ? Health.up().build() : Health.down().build();
        } catch (StoreUnavailableException e) {
            return Health.down().withDetail("error", e.getMessage()).build();
        }
    }
}
