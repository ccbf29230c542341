package org.abstractica.gameservices.handlers;

import org.abstractica.gameservices.Capability;

/**
 * A call to perform on a capability.
 *
 * <p>Call handlers run on the host's event loop and must not block.</p>
 *
 * @param <T> the capability type
 * @param <R> the result type
 */
@FunctionalInterface
public interface CallHandler<T extends Capability, R>
{
    /**
     * Performs the call.
     *
     * @param target the resolved capability
     * @return the call result
     */
    R call(T target);
}
