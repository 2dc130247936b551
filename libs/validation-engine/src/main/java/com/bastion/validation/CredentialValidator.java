package com.bastion.validation;

import com.bastion.audit.ValidatorName;
import com.bastion.audit.ValidationOutcome;

/**
 * A validation path the orchestrator can run.
 *
 * <p>Implementations never throw for credential problems or store outages; those become failed
 * outcomes. Anything that does escape is turned into an internal fault by the orchestrator.
 */
public interface CredentialValidator {

    ValidatorName name();

    ValidationOutcome validate(ValidationRequest request);
}
