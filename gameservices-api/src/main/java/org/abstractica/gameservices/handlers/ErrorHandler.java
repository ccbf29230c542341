package org.abstractica.gameservices.handlers;

import org.abstractica.gameservices.CapabilityRef;
import org.abstractica.gameservices.Connection;

/**
 * Handles calls that failed at transport level.
 *
 * <p>The host logs the failure and invokes this handler before it
 * completes the caller's future exceptionally. Other calls keep being
 * processed.</p>
 */
@FunctionalInterface
public interface ErrorHandler
{
    /**
     * Handles a failed call.
     *
     * @param connection the connection the call came from
     * @param target     the reference the call addressed, or null for a
     *                   failed bootstrap
     * @param exception  the failure
     */
    void handle(Connection connection, CapabilityRef target, Exception exception);
}
