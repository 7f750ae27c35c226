package com.strata.error;

import java.util.List;

/**
 * Thrown when a retention policy fails validation. Raised before any mutation.
 */
public class InvalidPolicyException extends LifecycleException {

    private final List<String> errors;

    public InvalidPolicyException(String policyName, List<String> errors) {
        super(ErrorCategory.INVALID_POLICY,
            "policy '" + policyName + "' is invalid: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
