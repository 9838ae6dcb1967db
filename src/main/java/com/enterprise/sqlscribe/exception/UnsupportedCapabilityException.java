package com.enterprise.sqlscribe.exception;

import com.enterprise.sqlscribe.core.Capability;

/**
 * Thrown when a clause needs a capability the target dialect does not declare.
 */
public class UnsupportedCapabilityException extends UnsupportedOperationException {

    private final String dialectId;
    private final Capability capability;

    public UnsupportedCapabilityException(String dialectId, Capability capability) {
        super("Dialect '" + dialectId + "' does not support " + capability);
        this.dialectId = dialectId;
        this.capability = capability;
    }

    public String dialectId() { return dialectId; }

    public Capability capability() { return capability; }
}
