package com.strata.error;

/**
 * Thrown for an unknown policy name, backup id or archive key.
 */
public class NotFoundException extends LifecycleException {

    public NotFoundException(String kind, String id) {
        super(ErrorCategory.NOT_FOUND, kind + " '" + id + "' not found");
    }
}
