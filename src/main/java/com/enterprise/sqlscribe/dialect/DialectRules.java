package com.enterprise.sqlscribe.dialect;

import com.enterprise.sqlscribe.core.Capability;
import com.enterprise.sqlscribe.core.JoinType;
import com.enterprise.sqlscribe.exception.UnsupportedCapabilityException;

import java.util.Set;

/**
 * Everything the renderer needs to know about a SQL dialect: identifier quoting,
 * join keyword spelling and which optional features are available.
 *
 * @see Dialects
 * @see DialectRegistry
 */
public interface DialectRules {

    /** Registry identifier, lower case (e.g. {@code "postgres"}). */
    String id();

    /** Wraps a single identifier in this dialect's quote characters. */
    String quote(String identifier);

    String joinKeyword(JoinType type);

    Set<Capability> capabilities();

    default boolean supports(Capability capability) {
        return capabilities().contains(capability);
    }

    /**
     * @throws UnsupportedCapabilityException if this dialect lacks the capability
     */
    default void require(Capability capability) {
        if (!supports(capability)) {
            throw new UnsupportedCapabilityException(id(), capability);
        }
    }
}
