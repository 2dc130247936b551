package com.bastion.gateway.api;

import com.bastion.security.CredentialFingerprint;
import com.bastion.validation.ValidationGateway;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Revocation hook: the credential store's owner calls it after revoking credentials so the
 * gateway stops serving cached decisions for them.
 * <p>
 * Deactivating a tenant also needs a call here with its {@code tenantId}: cached decisions are
 * served without rechecking the tenant, so until then the enhanced validator keeps allowing the
 * tenant's credentials for the remainder of the cache TTL.
 */
@RestController
@RequestMapping("/api/v1/credentials")
public class RevocationController {

    private static final Logger log = LoggerFactory.getLogger(RevocationController.class);

    private final ValidationGateway gateway;

    public RevocationController(ValidationGateway gateway) {
        this.gateway = gateway;
    }

    @PostMapping("/revocations")
    public Map<String, Object> revoke(@RequestBody RevocationRequest request) {
        int invalidated;
        if (RevocationRequest.present(request.tenantId())) {
            invalidated = gateway.invalidateTenant(request.tenantId());
        } else {
            CredentialFingerprint fingerprint = RevocationRequest.present(request.credential())
                    ? gateway.parser().parse(request.credential()).fingerprint()
                    : new CredentialFingerprint(request.fingerprint().strip());
            invalidated = gateway.invalidateCredential(fingerprint);
        }
        log.info("Revocation processed, {} cached decisions dropped", invalidated);
        return Map.of("invalidated", invalidated);
    }
}
