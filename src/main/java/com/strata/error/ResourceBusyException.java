package com.strata.error;

/**
 * The destructive-operation lock could not be acquired in time.
 * The job is simply re-attempted on a later cycle.
 */
public class ResourceBusyException extends LifecycleException {

    public ResourceBusyException(String operation) {
        super(ErrorCategory.RESOURCE_BUSY, operation + " is waiting on another destructive operation");
    }
}
